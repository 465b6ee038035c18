package graphql.consulting.federation.graph;

import graphql.PublicApi;

@PublicApi
public enum EdgeKind {
    /**
     * Resolves a field inside one subgraph.
     */
    FIELD(1),
    /**
     * Re-enters the same entity in another subgraph through one of its keys.
     */
    KEY_JUMP(10),
    /**
     * Leaves an interface object for a concrete implementation in a subgraph that knows the concrete
     * types.
     */
    INTERFACE_EXPANSION(10),
    /**
     * Narrows an interface or union to one of its object types inside one subgraph.
     */
    DOWNCAST(0);

    private final int cost;

    EdgeKind(int cost) {
        this.cost = cost;
    }

    public int getCost() {
        return cost;
    }
}
