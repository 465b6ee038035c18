package graphql.consulting.federation.planning;

import graphql.consulting.federation.QueryPlannerConfiguration;
import graphql.consulting.federation.TestSchemas;
import graphql.consulting.federation.normalized.NormalizedOperation;
import graphql.consulting.federation.normalized.NormalizedOperationFactory;
import graphql.consulting.federation.plan.FetchNode;
import graphql.consulting.federation.plan.FlattenNode;
import graphql.consulting.federation.plan.NodeKind;
import graphql.consulting.federation.plan.PlanNode;
import graphql.consulting.federation.plan.QueryPlan;
import graphql.consulting.federation.schema.ComposedSchemaLoader;
import graphql.consulting.federation.schema.FieldSet;
import graphql.consulting.federation.schema.Subgraph;
import graphql.execution.ResultPath;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlanTreeBuilderTest {

    private static final GraphQLSchema SCHEMA = ComposedSchemaLoader.load(TestSchemas.products()).getApiSchema();

    private static final Subgraph ACCOUNTS = new Subgraph("accounts", "http://accounts", "ACCOUNTS");
    private static final Subgraph PRODUCTS = new Subgraph("products", "http://products", "PRODUCTS");
    private static final Subgraph REVIEWS = new Subgraph("reviews", "http://reviews", "REVIEWS");

    private static PlanTreeBuilder builder(String query, String operationName, QueryPlannerConfiguration configuration) {
        NormalizedOperation operation = NormalizedOperationFactory.createNormalizedOperation(SCHEMA, Parser.parse(query), operationName);
        return new PlanTreeBuilder(configuration, new FetchDocumentWriter(operation));
    }

    private static FetchGroup rootGroup(int id, Subgraph subgraph, String field) {
        FetchGroup group = new FetchGroup(id, subgraph, false, false, ResultPath.rootPath());
        group.getSelection().plainField(field, true).plainField("id", false);
        return group;
    }

    private static FetchGroup entityGroup(int id, Subgraph subgraph, ResultPath path, String field, FetchGroup... dependencies) {
        FetchGroup group = new FetchGroup(id, subgraph, true, false, path);
        group.addInput("User", FieldSet.parse("__typename id"));
        group.getSelection().inlineFragment("User").plainField(field, false);
        group.addDependencies(Arrays.asList(dependencies));
        return group;
    }

    private static List<String> services(List<PlanNode> nodes) {
        List<String> result = new ArrayList<>();
        for (PlanNode node : nodes) {
            PlanNode inner = node.getKind() == NodeKind.FLATTEN ? ((FlattenNode) node).getNode() : node;
            result.add(((FetchNode) inner).getServiceName());
        }
        return result;
    }

    @Test
    void emptyGroupListGivesEmptyPlan() {
        QueryPlan plan = builder("{ me { id } }", null, QueryPlannerConfiguration.defaultConfiguration()).build(Collections.emptyList());

        assertThat(plan.getNode()).isNull();
    }

    @Test
    void unrelatedChainsRunInParallel() {
        FetchGroup accounts = rootGroup(0, ACCOUNTS, "me");
        FetchGroup products = rootGroup(1, PRODUCTS, "topProducts");
        FetchGroup reviews = entityGroup(2, REVIEWS, ResultPath.rootPath().segment("me"), "reviews", accounts);

        QueryPlan plan = builder("query Op { me { id } }", "Op", QueryPlannerConfiguration.defaultConfiguration())
                .build(Arrays.asList(reviews, products, accounts));

        PlanNode root = plan.getNode();
        assertThat(root.getKind()).isEqualTo(NodeKind.PARALLEL);
        assertThat(root.getChildren()).hasSize(2);
        PlanNode chain = root.getChildren().get(0);
        assertThat(chain.getKind()).isEqualTo(NodeKind.SEQUENCE);
        assertThat(services(chain.getChildren())).containsExactly("accounts", "reviews");
        assertThat(chain.getChildren().get(1).getKind()).isEqualTo(NodeKind.FLATTEN);
        assertThat(((FetchNode) root.getChildren().get(1)).getServiceName()).isEqualTo("products");

        assertThat(plan.getFetchNodes()).extracting(FetchNode::getOperationName)
                .containsExactly("Op__accounts__0", "Op__reviews__1", "Op__products__2");
        assertThat(plan.getFetchNodes()).extracting(FetchNode::getId).containsExactly(0, 2, 1);
    }

    @Test
    void dependentStagesAreFlattenedIntoOneSequence() {
        ResultPath me = ResultPath.rootPath().segment("me");
        FetchGroup accounts = rootGroup(0, ACCOUNTS, "me");
        FetchGroup reviews = entityGroup(1, REVIEWS, me, "reviews", accounts);
        FetchGroup name = entityGroup(2, ACCOUNTS, me, "name", reviews);

        QueryPlan plan = builder("{ me { id } }", null, QueryPlannerConfiguration.defaultConfiguration())
                .build(Arrays.asList(accounts, reviews, name));

        assertThat(plan.getNode().getKind()).isEqualTo(NodeKind.SEQUENCE);
        assertThat(services(plan.getNode().getChildren())).containsExactly("accounts", "reviews", "accounts");
        assertThat(plan.getFetchNodes()).extracting(FetchNode::getOperationName).containsOnlyNulls();
    }

    @Test
    void independentGroupsOfAStageShareAParallelNode() {
        ResultPath me = ResultPath.rootPath().segment("me");
        FetchGroup accounts = rootGroup(0, ACCOUNTS, "me");
        FetchGroup reviews = entityGroup(1, REVIEWS, me, "reviews", accounts);
        FetchGroup products = entityGroup(2, PRODUCTS, me, "name", accounts);

        QueryPlan plan = builder("{ me { id } }", null, QueryPlannerConfiguration.defaultConfiguration())
                .build(Arrays.asList(accounts, reviews, products));

        List<PlanNode> steps = plan.getNode().getChildren();
        assertThat(plan.getNode().getKind()).isEqualTo(NodeKind.SEQUENCE);
        assertThat(steps).hasSize(2);
        assertThat(steps.get(1).getKind()).isEqualTo(NodeKind.PARALLEL);
        assertThat(services(steps.get(1).getChildren())).containsExactly("products", "reviews");
    }
}
