package graphql.consulting.federation.schema;

import graphql.PublicApi;

import java.util.function.Consumer;

import static graphql.Assert.assertNotNull;

/**
 * What one subgraph knows about one field: whether it resolves it, which sibling fields it needs
 * first ({@code requires}) and which fields of the returned object it can hand out without owning
 * them ({@code provides}).
 * <p>
 * An external field is never resolvable in its subgraph; it only exists to be referenced by a
 * {@code requires} or {@code provides} clause there.
 */
@PublicApi
public class FieldOwnership {

    private final Subgraph subgraph;
    private final boolean external;
    private final FieldSet requires;
    private final FieldSet provides;
    private final String override;
    private final boolean overridden;

    private FieldOwnership(Builder builder) {
        this.subgraph = assertNotNull(builder.subgraph, () -> "subgraph is required");
        this.external = builder.external;
        this.requires = builder.requires;
        this.provides = builder.provides;
        this.override = builder.override;
        this.overridden = builder.overridden;
    }

    public Subgraph getSubgraph() {
        return subgraph;
    }

    public boolean isExternal() {
        return external;
    }

    /**
     * @return the required sibling selection or null
     */
    public FieldSet getRequires() {
        return requires;
    }

    /**
     * @return the provided selection on the returned object or null
     */
    public FieldSet getProvides() {
        return provides;
    }

    /**
     * @return the name of the subgraph this field was taken over from, or null
     */
    public String getOverride() {
        return override;
    }

    /**
     * @return true when another subgraph took this field over
     */
    public boolean isOverridden() {
        return overridden;
    }

    public boolean isResolvable() {
        return !external && !overridden;
    }

    public FieldOwnership transform(Consumer<Builder> builderConsumer) {
        Builder builder = new Builder(this);
        builderConsumer.accept(builder);
        return builder.build();
    }

    public static Builder newFieldOwnership() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "FieldOwnership{" +
                "subgraph=" + subgraph.getName() +
                ", external=" + external +
                ", requires=" + requires +
                ", provides=" + provides +
                ", override=" + override +
                ", overridden=" + overridden +
                '}';
    }

    public static class Builder {
        private Subgraph subgraph;
        private boolean external;
        private FieldSet requires;
        private FieldSet provides;
        private String override;
        private boolean overridden;

        public Builder() {
        }

        public Builder(FieldOwnership existing) {
            this.subgraph = existing.subgraph;
            this.external = existing.external;
            this.requires = existing.requires;
            this.provides = existing.provides;
            this.override = existing.override;
            this.overridden = existing.overridden;
        }

        public Builder subgraph(Subgraph subgraph) {
            this.subgraph = subgraph;
            return this;
        }

        public Builder external(boolean external) {
            this.external = external;
            return this;
        }

        public Builder requires(FieldSet requires) {
            this.requires = requires;
            return this;
        }

        public Builder provides(FieldSet provides) {
            this.provides = provides;
            return this;
        }

        public Builder override(String override) {
            this.override = override;
            return this;
        }

        public Builder overridden(boolean overridden) {
            this.overridden = overridden;
            return this;
        }

        public FieldOwnership build() {
            return new FieldOwnership(this);
        }
    }
}
