package graphql.consulting.federation.graph;

import graphql.consulting.federation.TestSchemas;
import graphql.consulting.federation.schema.ComposedSchema;
import graphql.consulting.federation.schema.ComposedSchemaLoader;
import graphql.consulting.federation.schema.FieldSet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutingGraphBuilderTest {

    private static final String TWO_GRAPHS = "" +
            "enum join__Graph {\n" +
            "  ONE @join__graph(name: \"one\", url: \"http://one\")\n" +
            "  TWO @join__graph(name: \"two\", url: \"http://two\")\n" +
            "}\n";

    private static RoutingGraph build(String sdl) {
        return RoutingGraphBuilder.build(ComposedSchemaLoader.load(sdl));
    }

    private static Vertex vertex(RoutingGraph graph, String typeName, String subgraph) {
        return graph.findVertex(typeName, graph.getSchema().getSubgraph(subgraph));
    }

    private static List<String> tailNames(RoutingGraph graph, Vertex vertex, EdgeKind kind) {
        List<String> result = new ArrayList<>();
        for (Edge edge : graph.getOutgoingEdges(vertex, kind)) {
            result.add(graph.getVertex(edge.getTail()).toString());
        }
        return result;
    }

    @Test
    void createsOneVertexPerTypeAndSubgraph() {
        RoutingGraph graph = build(TestSchemas.products());

        assertThat(graph.getVertices("Product")).extracting(Vertex::toString)
                .containsExactly("Product(inventory)", "Product(products)", "Product(reviews)");
        assertThat(graph.getRootVertices("Query")).hasSize(4);
        assertThat(graph.getRootVertices("Mutation")).extracting(Vertex::toString)
                .containsExactly("Mutation(products)", "Mutation(reviews)");
        assertThat(vertex(graph, "SearchResult", "products").getKind()).isEqualTo(VertexKind.UNION);
    }

    @Test
    void fieldEdgesFollowOwnership() {
        RoutingGraph graph = build(TestSchemas.products());
        Vertex productInInventory = vertex(graph, "Product", "inventory");

        assertThat(graph.getFieldEdge(productInInventory, "inStock")).isNotNull();
        assertThat(graph.getFieldEdge(productInInventory, "price")).isNull();
        Edge shippingEstimate = graph.getFieldEdge(productInInventory, "shippingEstimate");
        assertThat(shippingEstimate.getRequires()).isEqualTo(FieldSet.parse("price weight"));
        assertThat(graph.getVertex(shippingEstimate.getTail()).getKind()).isEqualTo(VertexKind.LEAF);

        Edge author = graph.getFieldEdge(vertex(graph, "Review", "reviews"), "author");
        assertThat(author.getProvides()).isEqualTo(FieldSet.parse("username"));
        assertThat(graph.getVertex(author.getTail()).toString()).isEqualTo("User(reviews)");
    }

    @Test
    void keyJumpsConnectEntityVertices() {
        RoutingGraph graph = build(TestSchemas.products());

        assertThat(tailNames(graph, vertex(graph, "Product", "products"), EdgeKind.KEY_JUMP))
                .containsExactlyInAnyOrder("Product(inventory)", "Product(reviews)");
        assertThat(tailNames(graph, vertex(graph, "User", "accounts"), EdgeKind.KEY_JUMP))
                .containsExactly("User(reviews)");
        assertThat(graph.getOutgoingEdges(vertex(graph, "Category", "products"), EdgeKind.KEY_JUMP)).isEmpty();
        assertThat(graph.getOutgoingEdges(vertex(graph, "Query", "products"), EdgeKind.KEY_JUMP)).isEmpty();
    }

    @Test
    void unionsDowncastToTheirMembers() {
        RoutingGraph graph = build(TestSchemas.products());
        Vertex searchResult = vertex(graph, "SearchResult", "products");

        assertThat(tailNames(graph, searchResult, EdgeKind.DOWNCAST))
                .containsExactlyInAnyOrder("Product(products)", "Category(products)");
        assertThat(graph.getDowncast(searchResult, "Category")).isSameAs(vertex(graph, "Category", "products"));
        assertThat(graph.getDowncast(searchResult, "User")).isNull();
    }

    @Test
    void interfaceObjectsExpandIntoConcreteTypes() {
        RoutingGraph graph = build(TestSchemas.interfaceObject());
        Vertex interfaceObject = vertex(graph, "I", "s1");
        Vertex iInS2 = vertex(graph, "I", "s2");

        assertThat(interfaceObject.getKind()).isEqualTo(VertexKind.INTERFACE_OBJECT);
        assertThat(iInS2.getKind()).isEqualTo(VertexKind.INTERFACE);
        assertThat(tailNames(graph, interfaceObject, EdgeKind.INTERFACE_EXPANSION))
                .containsExactlyInAnyOrder("A(s2)", "B(s2)");
        assertThat(graph.getOutgoingEdges(iInS2, EdgeKind.KEY_JUMP)).isEmpty();
        assertThat(graph.getOutgoingEdges(interfaceObject, EdgeKind.KEY_JUMP)).isEmpty();
    }

    @Test
    void concreteTypesJumpIntoInterfaceObjectsWithTypenameRewrite() {
        RoutingGraph graph = build(TestSchemas.interfaceObject());

        List<Edge> jumps = graph.getOutgoingEdges(vertex(graph, "A", "s2"), EdgeKind.KEY_JUMP);
        assertThat(jumps).hasSize(1);
        assertThat(graph.getVertex(jumps.get(0).getTail())).isSameAs(vertex(graph, "I", "s1"));
        assertThat(jumps.get(0).getTypenameRewrite()).isEqualTo("I");
        assertThat(jumps.get(0).getKey()).isEqualTo(FieldSet.parse("id"));
    }

    @Test
    void rejectsUnreachableType() {
        String types = TWO_GRAPHS +
                "type Query @join__type(graph: ONE) { a: Int }\n" +
                "type T @join__type(graph: ONE, key: \"id\", resolvable: false) { id: ID! }\n";

        assertThatThrownBy(() -> build(TestSchemas.supergraph(types)))
                .isInstanceOfSatisfying(GraphBuildError.class, e -> assertThat(e.getKind()).isEqualTo(GraphBuildError.Kind.UNREACHABLE_TYPE));
    }

    @Test
    void rejectsRequiresOfUnknownField() {
        String types = TWO_GRAPHS +
                "type Query @join__type(graph: ONE) { t: T }\n" +
                "type T @join__type(graph: ONE, key: \"id\") @join__type(graph: TWO, key: \"id\") {\n" +
                "  id: ID!\n" +
                "  total: Int @join__field(graph: TWO, requires: \"amount\")\n" +
                "}\n";

        assertThatThrownBy(() -> build(TestSchemas.supergraph(types)))
                .isInstanceOfSatisfying(GraphBuildError.class, e -> assertThat(e.getKind()).isEqualTo(GraphBuildError.Kind.DANGLING_REQUIRES));
    }

    @Test
    void rejectsFieldReturningUndeclaredType() {
        String types = TWO_GRAPHS +
                "type Query @join__type(graph: ONE) @join__type(graph: TWO) { t: T @join__field(graph: TWO) }\n" +
                "type T @join__type(graph: ONE) { id: ID! }\n";

        assertThatThrownBy(() -> build(TestSchemas.supergraph(types)))
                .isInstanceOfSatisfying(GraphBuildError.class, e -> assertThat(e.getKind()).isEqualTo(GraphBuildError.Kind.INCONSISTENT_OWNERSHIP));
    }

    @Test
    void graphIsSharedReadOnly() {
        ComposedSchema schema = ComposedSchemaLoader.load(TestSchemas.products());
        RoutingGraph graph = RoutingGraphBuilder.build(schema);

        assertThat(graph.getSchema()).isSameAs(schema);
        assertThatThrownBy(() -> graph.getVertices().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
