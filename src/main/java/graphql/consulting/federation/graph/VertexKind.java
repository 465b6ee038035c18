package graphql.consulting.federation.graph;

import graphql.PublicApi;

/**
 * The planning relevant shape of a routing graph vertex. Planning branches on this tag, never on the
 * runtime class of the underlying schema type.
 */
@PublicApi
public enum VertexKind {
    /**
     * A root operation type in one subgraph.
     */
    ROOT,
    OBJECT,
    INTERFACE,
    /**
     * An interface the subgraph only knows as an opaque object: it can resolve the interface's fields
     * but does not know the concrete type of an instance.
     */
    INTERFACE_OBJECT,
    UNION,
    /**
     * A scalar or enum.
     */
    LEAF;

    public boolean isAbstract() {
        return this == INTERFACE || this == UNION;
    }
}
