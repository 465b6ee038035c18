package graphql.consulting.federation.planning;

import graphql.consulting.federation.FederatedQueryPlanner;
import graphql.consulting.federation.QueryPlannerConfiguration;
import graphql.consulting.federation.TestSchemas;
import graphql.consulting.federation.normalized.OperationError;
import graphql.consulting.federation.plan.FetchNode;
import graphql.consulting.federation.plan.FlattenNode;
import graphql.consulting.federation.plan.InputRewrite;
import graphql.consulting.federation.plan.NodeKind;
import graphql.consulting.federation.plan.PlanNode;
import graphql.consulting.federation.plan.QueryPlan;
import graphql.consulting.federation.plan.QueryPlanSerializer;
import graphql.language.AstPrinter;
import graphql.language.InlineFragment;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryPlannerTest {

    private static final FederatedQueryPlanner PRODUCTS = FederatedQueryPlanner.fromSupergraphSdl(TestSchemas.products());
    private static final FederatedQueryPlanner INTERFACE_OBJECT = FederatedQueryPlanner.fromSupergraphSdl(TestSchemas.interfaceObject());
    private static final FederatedQueryPlanner SHARED_ROOT_FIELD = FederatedQueryPlanner.fromSupergraphSdl(TestSchemas.supergraph("" +
            "enum join__Graph {\n" +
            "  S1 @join__graph(name: \"s1\", url: \"http://s1\")\n" +
            "  S2 @join__graph(name: \"s2\", url: \"http://s2\")\n" +
            "}\n" +
            "type Query @join__type(graph: S1) @join__type(graph: S2) {\n" +
            "  a: String @join__field(graph: S1) @join__field(graph: S2)\n" +
            "  b: String @join__field(graph: S2)\n" +
            "  c: String @join__field(graph: S1)\n" +
            "}\n"));

    /**
     * Makes printed documents comparable regardless of the whitespace the printer puts between tokens.
     */
    static String normalize(String document) {
        return document
                .replaceAll("\\.\\.\\.\\s*on\\s+", "... on ")
                .replaceAll("\\s+", " ")
                .replaceAll(" ?([{}():,\\[\\]!]) ?", "$1")
                .replaceFirst("^query\\{", "{")
                .trim();
    }

    static void assertOperation(FetchNode fetchNode, String expected) {
        assertThat(normalize(fetchNode.getOperation())).isEqualTo(normalize(expected));
    }

    private static FetchNode fetch(PlanNode node) {
        assertThat(node.getKind()).isEqualTo(NodeKind.FETCH);
        return (FetchNode) node;
    }

    private static FetchNode flattenedFetch(PlanNode node, String... path) {
        assertThat(node.getKind()).isEqualTo(NodeKind.FLATTEN);
        FlattenNode flattenNode = (FlattenNode) node;
        assertThat(flattenNode.getPathSegments()).containsExactly(path);
        return fetch(flattenNode.getNode());
    }

    private static List<PlanNode> children(PlanNode node, NodeKind kind) {
        assertThat(node.getKind()).isEqualTo(kind);
        return node.getChildren();
    }

    private static String requires(FetchNode fetchNode) {
        StringBuilder sb = new StringBuilder();
        for (InlineFragment inlineFragment : fetchNode.getRequires()) {
            sb.append(AstPrinter.printAstCompact(inlineFragment)).append(' ');
        }
        return normalize(sb.toString());
    }

    @Test
    void singleSubgraphNeedsOneFetch() {
        QueryPlan plan = PRODUCTS.plan("{ topProducts { upc name category { name } } }", null);

        FetchNode fetchNode = fetch(plan.getNode());
        assertThat(fetchNode.getServiceName()).isEqualTo("products");
        assertThat(fetchNode.getOperationKind()).isEqualTo("query");
        assertThat(fetchNode.getOperationName()).isNull();
        assertThat(fetchNode.getRequires()).isEmpty();
        assertOperation(fetchNode, "{ topProducts { upc name category { name } } }");
        assertThat(plan.getFetchCount()).isEqualTo(1);
        assertThat(plan.getDepth()).isEqualTo(1);
    }

    @Test
    void independentRootFieldsRunInParallel() {
        QueryPlan plan = PRODUCTS.plan("{ me { name } topProducts { upc } }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.PARALLEL);
        assertThat(nodes).hasSize(2);
        assertOperation(fetch(nodes.get(0)), "{ me { name } }");
        assertThat(fetch(nodes.get(0)).getServiceName()).isEqualTo("accounts");
        assertOperation(fetch(nodes.get(1)), "{ topProducts { upc } }");
        assertThat(fetch(nodes.get(1)).getServiceName()).isEqualTo("products");
    }

    @Test
    void rootFieldOrderDoesNotChangeThePlan() {
        QueryPlan plan = PRODUCTS.plan("{ topProducts { upc } me { name } }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.PARALLEL);
        assertThat(nodes).hasSize(2);
        assertThat(fetch(nodes.get(0)).getServiceName()).isEqualTo("accounts");
        assertThat(fetch(nodes.get(1)).getServiceName()).isEqualTo("products");
    }

    @Test
    void independentBranchesRunInParallel() {
        QueryPlan plan = PRODUCTS.plan("{ me { reviews { body } } topProducts { inStock } }", null);

        List<PlanNode> branches = children(plan.getNode(), NodeKind.PARALLEL);
        assertThat(branches).hasSize(2);

        List<PlanNode> accountsBranch = children(branches.get(0), NodeKind.SEQUENCE);
        assertThat(accountsBranch).hasSize(2);
        assertThat(fetch(accountsBranch.get(0)).getServiceName()).isEqualTo("accounts");
        assertThat(flattenedFetch(accountsBranch.get(1), "me").getServiceName()).isEqualTo("reviews");

        List<PlanNode> productsBranch = children(branches.get(1), NodeKind.SEQUENCE);
        assertThat(productsBranch).hasSize(2);
        assertThat(fetch(productsBranch.get(0)).getServiceName()).isEqualTo("products");
        FetchNode inventory = flattenedFetch(productsBranch.get(1), "topProducts", "@");
        assertThat(inventory.getServiceName()).isEqualTo("inventory");
        assertOperation(inventory, "query($representations: [_Any!]!) { _entities(representations: $representations) { ... on Product { inStock } } }");
    }

    @Test
    void fieldsOfOneSubgraphAtOnePathShareAFetch() {
        QueryPlan plan = PRODUCTS.plan("{ me { reviews { product { name inStock shippingEstimate } } } }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.SEQUENCE);
        assertThat(nodes).hasSize(4);
        assertThat(fetch(nodes.get(0)).getServiceName()).isEqualTo("accounts");
        assertThat(flattenedFetch(nodes.get(1), "me").getServiceName()).isEqualTo("reviews");
        assertThat(flattenedFetch(nodes.get(2), "me", "reviews", "@", "product").getServiceName()).isEqualTo("products");

        FetchNode inventory = flattenedFetch(nodes.get(3), "me", "reviews", "@", "product");
        assertThat(inventory.getServiceName()).isEqualTo("inventory");
        assertOperation(inventory, "query($representations: [_Any!]!) { _entities(representations: $representations) { ... on Product { inStock shippingEstimate } } }");
        assertThat(requires(inventory)).isEqualTo(normalize("... on Product { __typename upc price weight }"));
    }

    @Test
    void sharedFieldGoesWhereMostSiblingsResolve() {
        FetchNode ab = fetch(SHARED_ROOT_FIELD.plan("{ a b }", null).getNode());
        assertThat(ab.getServiceName()).isEqualTo("s2");
        assertOperation(ab, "{ a b }");

        FetchNode ba = fetch(SHARED_ROOT_FIELD.plan("{ b a }", null).getNode());
        assertThat(ba.getServiceName()).isEqualTo("s2");
        assertOperation(ba, "{ b a }");
    }

    @Test
    void sharedFieldAloneGoesToTheFirstSubgraphByName() {
        FetchNode a = fetch(SHARED_ROOT_FIELD.plan("{ a }", null).getNode());
        assertThat(a.getServiceName()).isEqualTo("s1");
    }

    @Test
    void sharedFieldJoinsAnAlreadyOpenFetch() {
        QueryPlan plan = SHARED_ROOT_FIELD.plan("{ c a b }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.PARALLEL);
        assertThat(nodes).hasSize(2);
        assertThat(fetch(nodes.get(0)).getServiceName()).isEqualTo("s1");
        assertOperation(fetch(nodes.get(0)), "{ c a }");
        assertThat(fetch(nodes.get(1)).getServiceName()).isEqualTo("s2");
        assertOperation(fetch(nodes.get(1)), "{ b }");
    }

    @Test
    void jumpsToAnotherSubgraphOverTheKey() {
        QueryPlan plan = PRODUCTS.plan("{ me { name reviews { body } } }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.SEQUENCE);
        assertThat(nodes).hasSize(2);
        FetchNode accounts = fetch(nodes.get(0));
        assertThat(accounts.getServiceName()).isEqualTo("accounts");
        assertOperation(accounts, "{ me { name __typename id } }");

        FetchNode reviews = flattenedFetch(nodes.get(1), "me");
        assertThat(reviews.getServiceName()).isEqualTo("reviews");
        assertThat(reviews.getOperationKind()).isEqualTo("query");
        assertThat(reviews.isEntityFetch()).isTrue();
        assertOperation(reviews, "query($representations: [_Any!]!) { _entities(representations: $representations) { ... on User { reviews { body } } } }");
        assertThat(requires(reviews)).isEqualTo(normalize("... on User { __typename id }"));
    }

    @Test
    void listPathsUseTheListSegment() {
        QueryPlan plan = PRODUCTS.plan("{ topProducts { upc reviews { body } } }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.SEQUENCE);
        assertOperation(fetch(nodes.get(0)), "{ topProducts { upc __typename } }");
        FetchNode reviews = flattenedFetch(nodes.get(1), "topProducts", "@");
        assertOperation(reviews, "query($representations: [_Any!]!) { _entities(representations: $representations) { ... on Product { reviews { body } } } }");
        assertThat(requires(reviews)).isEqualTo(normalize("... on Product { __typename upc }"));
    }

    @Test
    void requiredFieldsAreFetchedFirst() {
        QueryPlan plan = PRODUCTS.plan("{ topProducts { name shippingEstimate } }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.SEQUENCE);
        assertThat(nodes).hasSize(2);
        FetchNode products = fetch(nodes.get(0));
        assertThat(products.getServiceName()).isEqualTo("products");
        assertOperation(products, "{ topProducts { name __typename upc price weight } }");

        FetchNode inventory = flattenedFetch(nodes.get(1), "topProducts", "@");
        assertThat(inventory.getServiceName()).isEqualTo("inventory");
        assertOperation(inventory, "query($representations: [_Any!]!) { _entities(representations: $representations) { ... on Product { shippingEstimate } } }");
        assertThat(requires(inventory)).isEqualTo(normalize("... on Product { __typename upc price weight }"));
    }

    @Test
    void providedFieldsStayInTheProvidingSubgraph() {
        QueryPlan plan = PRODUCTS.plan("{ topReviews { body author { username } } }", null);

        FetchNode reviews = fetch(plan.getNode());
        assertThat(reviews.getServiceName()).isEqualTo("reviews");
        assertOperation(reviews, "{ topReviews { body author { username } } }");
    }

    @Test
    void fieldsOutsideTheProvidedSetNeedAJump() {
        QueryPlan plan = PRODUCTS.plan("{ topReviews { author { username name } } }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.SEQUENCE);
        assertOperation(fetch(nodes.get(0)), "{ topReviews { author { username __typename id } } }");
        FetchNode accounts = flattenedFetch(nodes.get(1), "topReviews", "@", "author");
        assertThat(accounts.getServiceName()).isEqualTo("accounts");
        assertOperation(accounts, "query($representations: [_Any!]!) { _entities(representations: $representations) { ... on User { name } } }");
    }

    @Test
    void unionMembersAreSelectedWithFragments() {
        QueryPlan plan = PRODUCTS.plan("{ search(text: \"a\") { __typename ... on Product { upc name } ... on Category { name } } }", null);

        FetchNode products = fetch(plan.getNode());
        assertOperation(products, "{ search(text: \"a\") { __typename ... on Product { upc name } ... on Category { name } } }");
    }

    @Test
    void leavesOutMembersTheSubgraphNeverReturns() {
        String types = "" +
                "enum join__Graph {\n" +
                "  S1 @join__graph(name: \"s1\", url: \"http://s1\")\n" +
                "  S2 @join__graph(name: \"s2\", url: \"http://s2\")\n" +
                "}\n" +
                "type Query @join__type(graph: S1) @join__type(graph: S2) {\n" +
                "  u: U @join__field(graph: S1)\n" +
                "  v: U @join__field(graph: S2)\n" +
                "}\n" +
                "union U @join__type(graph: S1) @join__type(graph: S2)\n" +
                "  @join__unionMember(graph: S1, member: \"A\")\n" +
                "  @join__unionMember(graph: S2, member: \"A\")\n" +
                "  @join__unionMember(graph: S2, member: \"B\") = A | B\n" +
                "type A @join__type(graph: S1) @join__type(graph: S2) { id: ID! }\n" +
                "type B @join__type(graph: S2) { name: String }\n";
        FederatedQueryPlanner planner = FederatedQueryPlanner.fromSupergraphSdl(TestSchemas.supergraph(types));

        QueryPlan plan = planner.plan("{ u { ... on A { id } ... on B { name } } }", null);

        FetchNode s1 = fetch(plan.getNode());
        assertThat(s1.getServiceName()).isEqualTo("s1");
        assertOperation(s1, "{ u { ... on A { id } } }");
    }

    @Test
    void mutationFieldsKeepTheirOrder() {
        QueryPlan plan = PRODUCTS.plan("mutation { " +
                "createProduct(upc: \"1\", name: \"Table\") { upc } " +
                "createReview(upc: \"1\", id: \"r1\", body: \"Nice\") { id } " +
                "deleteProduct(upc: \"2\") }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.SEQUENCE);
        assertThat(nodes).extracting(node -> fetch(node).getServiceName()).containsExactly("products", "reviews", "products");
        assertThat(nodes).extracting(node -> fetch(node).getOperationKind()).containsOnly("mutation");
        assertOperation(fetch(nodes.get(0)), "mutation { createProduct(upc: \"1\", name: \"Table\") { upc } }");
        assertOperation(fetch(nodes.get(2)), "mutation { deleteProduct(upc: \"2\") }");
    }

    @Test
    void consecutiveMutationFieldsShareAFetch() {
        QueryPlan plan = PRODUCTS.plan("mutation { createProduct(upc: \"1\") { upc } deleteProduct(upc: \"2\") }", null);

        FetchNode products = fetch(plan.getNode());
        assertOperation(products, "mutation { createProduct(upc: \"1\") { upc } deleteProduct(upc: \"2\") }");
    }

    @Test
    void concreteTypesOfAnInterfaceObjectAreDiscoveredFirst() {
        QueryPlan plan = INTERFACE_OBJECT.plan("{ i { ... on A { y } } }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.SEQUENCE);
        assertThat(nodes).hasSize(3);
        FetchNode s1 = fetch(nodes.get(0));
        assertThat(s1.getServiceName()).isEqualTo("s1");
        assertOperation(s1, "{ i { __typename id x } }");

        FetchNode discovery = flattenedFetch(nodes.get(1), "i");
        assertThat(discovery.getServiceName()).isEqualTo("s2");
        assertOperation(discovery, "query($representations: [_Any!]!) { _entities(representations: $representations) { ... on I { __typename } } }");
        assertThat(requires(discovery)).isEqualTo(normalize("... on I { __typename id }"));

        FetchNode y = flattenedFetch(nodes.get(2), "i");
        assertThat(y.getServiceName()).isEqualTo("s2");
        assertOperation(y, "query($representations: [_Any!]!) { _entities(representations: $representations) { ... on A { y } } }");
        assertThat(requires(y)).isEqualTo(normalize("... on A { __typename id x }"));
    }

    @Test
    void concreteTypesEnteringAnInterfaceObjectAreRewritten() {
        QueryPlan plan = INTERFACE_OBJECT.plan("{ allI { id x } }", null);

        List<PlanNode> nodes = children(plan.getNode(), NodeKind.SEQUENCE);
        assertThat(nodes).hasSize(2);
        assertOperation(fetch(nodes.get(0)), "{ allI { id ... on A { __typename } ... on B { __typename } } }");

        FetchNode s1 = flattenedFetch(nodes.get(1), "allI", "@");
        assertThat(s1.getServiceName()).isEqualTo("s1");
        assertOperation(s1, "query($representations: [_Any!]!) { _entities(representations: $representations) { ... on I { x } } }");
        assertThat(requires(s1)).isEqualTo(normalize("... on A { __typename id } ... on B { __typename id }"));
        assertThat(s1.getInputRewrites()).containsExactly(
                new InputRewrite(Arrays.asList("... on A", "__typename"), "I"),
                new InputRewrite(Arrays.asList("... on B", "__typename"), "I"));
    }

    @Test
    void rejectsFieldsNoSubgraphResolves() {
        assertThatThrownBy(() -> PRODUCTS.plan("{ topProducts { upc legacyCode } }", null))
                .isInstanceOfSatisfying(PlanningError.Unresolvable.class, e -> {
                    assertThat(e.getCoordinates().getTypeName()).isEqualTo("Product");
                    assertThat(e.getCoordinates().getFieldName()).isEqualTo("legacyCode");
                });
    }

    @Test
    void rejectsInvalidSyntax() {
        assertThatThrownBy(() -> PRODUCTS.plan("{ me { ", null)).isInstanceOf(OperationError.class);
    }

    @Test
    void introspectionOnlyGivesAnEmptyPlan() {
        QueryPlan plan = PRODUCTS.plan("{ __schema { queryType { name } } }", null);

        assertThat(plan.getNode()).isNull();
        assertThat(plan.getFetchCount()).isZero();
    }

    @Test
    void reportsVariablesInDeclarationOrder() {
        QueryPlan plan = PRODUCTS.plan("query Top($unused: Int, $upc: String!, $first: Int) { " +
                "product(upc: $upc) { name } topProducts(first: $first) { upc } }", "Top");

        FetchNode products = fetch(plan.getNode());
        assertThat(products.getVariableUsages()).containsExactly("upc", "first");
        assertThat(normalize(products.getOperation())).startsWith(normalize("query Top__products__0($upc: String!, $first: Int)"));
    }

    @Test
    void entityFetchesDeclareTheVariablesTheyUse() {
        QueryPlan plan = PRODUCTS.plan("query Reviews($n: Int) { me { reviews { body } } topReviews(first: $n) { body } }", "Reviews");

        for (FetchNode fetchNode : plan.getFetchNodes()) {
            if (fetchNode.isEntityFetch()) {
                assertThat(fetchNode.getVariableUsages()).isEmpty();
            }
        }
        assertThat(plan.getFetchNodes()).extracting(FetchNode::getVariableUsages).contains(Arrays.asList("n"));
    }

    @Test
    void namesSubgraphOperationsAfterTheClientOperation() {
        QueryPlan plan = PRODUCTS.plan("query MyReviews { me { reviews { body } } }", "MyReviews");

        assertThat(plan.getFetchNodes()).extracting(FetchNode::getOperationName)
                .containsExactly("MyReviews__accounts__0", "MyReviews__reviews__1");
        assertThat(normalize(plan.getFetchNodes().get(1).getOperation()))
                .startsWith(normalize("query MyReviews__reviews__1($representations: [_Any!]!)"));
    }

    @Test
    void sanitizesSubgraphNamesInOperationNames() {
        String types = "" +
                "enum join__Graph {\n" +
                "  A_NA_ME_WITH_PLEN_TY_REPLACE_MENTS @join__graph(name: \"a-na&me-with-plen&ty-replace*ments\", url: \"http://a\")\n" +
                "}\n" +
                "type Query @join__type(graph: A_NA_ME_WITH_PLEN_TY_REPLACE_MENTS) { a: String }\n";
        FederatedQueryPlanner planner = FederatedQueryPlanner.fromSupergraphSdl(TestSchemas.supergraph(types));

        FetchNode fetchNode = fetch(planner.plan("query Op { a }", "Op").getNode());

        assertThat(fetchNode.getServiceName()).isEqualTo("a-na&me-with-plen&ty-replace*ments");
        assertThat(fetchNode.getOperationName()).isEqualTo("Op__a_na_me_with_plen_ty_replace_ments__0");
        assertOperation(fetchNode, "query Op__a_na_me_with_plen_ty_replace_ments__0 { a }");
    }

    @Test
    void operationNamesCanBeTurnedOff() {
        FederatedQueryPlanner planner = new FederatedQueryPlanner(PRODUCTS.getSchema(),
                QueryPlannerConfiguration.newConfiguration().generateOperationNames(false).build());

        QueryPlan plan = planner.plan("query Me { me { name } }", "Me");

        assertThat(fetch(plan.getNode()).getOperationName()).isNull();
        assertOperation(fetch(plan.getNode()), "{ me { name } }");
    }

    @Test
    void planningIsDeterministic() {
        String query = "query Everything { me { name reviews { body product { name shippingEstimate } } } topProducts { inStock reviews { author { username } } } }";
        FederatedQueryPlanner other = FederatedQueryPlanner.fromSupergraphSdl(TestSchemas.products());

        String first = QueryPlanSerializer.toJson(PRODUCTS.plan(query, "Everything"));
        String second = QueryPlanSerializer.toJson(PRODUCTS.plan(query, "Everything"));
        String third = QueryPlanSerializer.toJson(other.plan(query, "Everything"));

        assertThat(second).isEqualTo(first);
        assertThat(third).isEqualTo(first);
    }
}
