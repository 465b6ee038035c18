package graphql.consulting.federation.graph;

import graphql.PublicApi;
import graphql.consulting.federation.schema.Subgraph;
import graphql.consulting.federation.schema.TypeOwnership;

/**
 * A (type, subgraph) pair of the routing graph. Vertices are addressed by their index in the graph.
 */
@PublicApi
public class Vertex {

    private final int index;
    private final String typeName;
    private final Subgraph subgraph;
    private final VertexKind kind;
    private final TypeOwnership ownership;

    Vertex(int index, String typeName, Subgraph subgraph, VertexKind kind, TypeOwnership ownership) {
        this.index = index;
        this.typeName = typeName;
        this.subgraph = subgraph;
        this.kind = kind;
        this.ownership = ownership;
    }

    public int getIndex() {
        return index;
    }

    public String getTypeName() {
        return typeName;
    }

    public Subgraph getSubgraph() {
        return subgraph;
    }

    public VertexKind getKind() {
        return kind;
    }

    /**
     * @return how the subgraph declares the type, null for leaf vertices
     */
    public TypeOwnership getOwnership() {
        return ownership;
    }

    @Override
    public String toString() {
        return typeName + "(" + subgraph.getName() + ")";
    }
}
