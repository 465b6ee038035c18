package graphql.consulting.federation.plan;

import graphql.PublicApi;

@PublicApi
public enum NodeKind {
    FETCH("Fetch"),
    SEQUENCE("Sequence"),
    PARALLEL("Parallel"),
    FLATTEN("Flatten");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return the name used for this kind in the serialized plan
     */
    public String getDisplayName() {
        return displayName;
    }
}
