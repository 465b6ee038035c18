package graphql.consulting.federation;

import graphql.PublicApi;
import graphql.consulting.federation.graph.RoutingGraph;
import graphql.consulting.federation.graph.RoutingGraphBuilder;
import graphql.consulting.federation.normalized.NormalizedOperation;
import graphql.consulting.federation.normalized.NormalizedOperationFactory;
import graphql.consulting.federation.normalized.OperationError;
import graphql.consulting.federation.plan.QueryPlan;
import graphql.consulting.federation.planning.QueryPlanner;
import graphql.consulting.federation.schema.ComposedSchema;
import graphql.consulting.federation.schema.ComposedSchemaLoader;
import graphql.language.Document;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static graphql.Assert.assertNotNull;

/**
 * Entry point of the planner: holds a composed schema together with its routing graph and plans client
 * operations against them.
 * <pre>
 * FederatedQueryPlanner planner = FederatedQueryPlanner.fromSupergraphSdl(sdl);
 * QueryPlan plan = planner.plan("query Me { me { username reviews { body } } }", "Me");
 * </pre>
 * Instances are immutable and can be used from any number of threads.
 */
@PublicApi
public class FederatedQueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(FederatedQueryPlanner.class);

    private final ComposedSchema schema;
    private final RoutingGraph routingGraph;
    private final QueryPlannerConfiguration configuration;
    private final QueryPlanner queryPlanner;

    public FederatedQueryPlanner(ComposedSchema schema, QueryPlannerConfiguration configuration) {
        this.schema = assertNotNull(schema, () -> "schema can't be null");
        this.configuration = assertNotNull(configuration, () -> "configuration can't be null");
        this.routingGraph = RoutingGraphBuilder.build(schema);
        this.queryPlanner = new QueryPlanner(routingGraph, configuration);
    }

    public static FederatedQueryPlanner fromSupergraphSdl(String sdl) {
        return fromSupergraphSdl(sdl, QueryPlannerConfiguration.defaultConfiguration());
    }

    public static FederatedQueryPlanner fromSupergraphSdl(String sdl, QueryPlannerConfiguration configuration) {
        ComposedSchema schema = ComposedSchemaLoader.load(sdl);
        log.debug("loaded composed schema {}", schema);
        return new FederatedQueryPlanner(schema, configuration);
    }

    public ComposedSchema getSchema() {
        return schema;
    }

    public RoutingGraph getRoutingGraph() {
        return routingGraph;
    }

    public QueryPlannerConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @param operationName the operation to plan, may be null if the document contains only one
     */
    public QueryPlan plan(String query, String operationName) {
        Document document;
        try {
            document = new Parser().parseDocument(query);
        } catch (InvalidSyntaxException e) {
            throw new OperationError("invalid operation syntax: " + e.getMessage(), e);
        }
        return plan(document, operationName);
    }

    public QueryPlan plan(Document document, String operationName) {
        NormalizedOperation normalizedOperation = NormalizedOperationFactory.createNormalizedOperation(schema.getApiSchema(), document, operationName);
        return plan(normalizedOperation);
    }

    public QueryPlan plan(NormalizedOperation normalizedOperation) {
        return queryPlanner.plan(normalizedOperation);
    }
}
