package graphql.consulting.federation.graph;

import graphql.PublicApi;
import graphql.consulting.federation.schema.ComposedSchema;
import graphql.consulting.federation.schema.Subgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The compiled form of a composed schema the planner searches. Vertices live in an arena and are
 * addressed by index, edges are index pairs; the graph is cyclic and immutable once built and can be
 * shared by any number of concurrent planning calls.
 *
 * @see RoutingGraphBuilder
 */
@PublicApi
public class RoutingGraph {

    private final ComposedSchema schema;
    private final List<Vertex> vertices;
    private final List<Edge> edges;
    private final List<List<Edge>> outgoing;
    private final List<Map<String, Edge>> fieldEdges;
    private final Map<String, Map<Subgraph, Vertex>> verticesByType;

    RoutingGraph(ComposedSchema schema, List<Vertex> vertices, List<Edge> edges) {
        this.schema = schema;
        this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        List<List<Edge>> outgoing = new ArrayList<>();
        List<Map<String, Edge>> fieldEdges = new ArrayList<>();
        Map<String, Map<Subgraph, Vertex>> verticesByType = new LinkedHashMap<>();
        for (Vertex vertex : vertices) {
            outgoing.add(new ArrayList<>());
            fieldEdges.add(new LinkedHashMap<>());
            verticesByType.computeIfAbsent(vertex.getTypeName(), ignored -> new LinkedHashMap<>()).put(vertex.getSubgraph(), vertex);
        }
        for (Edge edge : edges) {
            outgoing.get(edge.getHead()).add(edge);
            if (edge.getKind() == EdgeKind.FIELD) {
                fieldEdges.get(edge.getHead()).put(edge.getFieldName(), edge);
            }
        }
        List<List<Edge>> frozen = new ArrayList<>();
        for (List<Edge> list : outgoing) {
            frozen.add(Collections.unmodifiableList(list));
        }
        this.outgoing = Collections.unmodifiableList(frozen);
        this.fieldEdges = fieldEdges;
        this.verticesByType = verticesByType;
    }

    public ComposedSchema getSchema() {
        return schema;
    }

    public int getVertexCount() {
        return vertices.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public Vertex getVertex(int index) {
        return vertices.get(index);
    }

    public List<Vertex> getVertices() {
        return vertices;
    }

    public Edge getEdge(int index) {
        return edges.get(index);
    }

    /**
     * @return the vertex of the type in the subgraph or null if the subgraph does not declare it
     */
    public Vertex findVertex(String typeName, Subgraph subgraph) {
        Map<Subgraph, Vertex> bySubgraph = verticesByType.get(typeName);
        return bySubgraph == null ? null : bySubgraph.get(subgraph);
    }

    /**
     * @return all vertices of a type, ordered by subgraph name
     */
    public List<Vertex> getVertices(String typeName) {
        Map<Subgraph, Vertex> bySubgraph = verticesByType.get(typeName);
        if (bySubgraph == null) {
            return Collections.emptyList();
        }
        List<Vertex> result = new ArrayList<>(bySubgraph.values());
        result.sort((v1, v2) -> v1.getSubgraph().compareTo(v2.getSubgraph()));
        return result;
    }

    /**
     * @return the root vertices of a root type, ordered by subgraph name
     */
    public List<Vertex> getRootVertices(String rootTypeName) {
        List<Vertex> result = new ArrayList<>();
        for (Vertex vertex : getVertices(rootTypeName)) {
            if (vertex.getKind() == VertexKind.ROOT) {
                result.add(vertex);
            }
        }
        return result;
    }

    public List<Edge> getOutgoingEdges(Vertex vertex) {
        return outgoing.get(vertex.getIndex());
    }

    public List<Edge> getOutgoingEdges(Vertex vertex, EdgeKind kind) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : outgoing.get(vertex.getIndex())) {
            if (edge.getKind() == kind) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * @return the edge resolving the field at the vertex or null if the field can't be resolved there
     */
    public Edge getFieldEdge(Vertex vertex, String fieldName) {
        return fieldEdges.get(vertex.getIndex()).get(fieldName);
    }

    /**
     * @return the object vertex an abstract vertex narrows to for the given object type, or null
     */
    public Vertex getDowncast(Vertex vertex, String objectTypeName) {
        for (Edge edge : outgoing.get(vertex.getIndex())) {
            if (edge.getKind() == EdgeKind.DOWNCAST && getVertex(edge.getTail()).getTypeName().equals(objectTypeName)) {
                return getVertex(edge.getTail());
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "RoutingGraph{" +
                "vertices=" + vertices.size() +
                ", edges=" + edges.size() +
                '}';
    }
}
