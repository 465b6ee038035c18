package graphql.consulting.federation;

import graphql.consulting.federation.normalized.OperationError;
import graphql.consulting.federation.plan.NodeKind;
import graphql.consulting.federation.planning.PlanningError;
import graphql.parser.Parser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PlanningServiceTest {

    private PlanningService planningService;

    @BeforeEach
    void setUp() {
        FederatedQueryPlanner planner = FederatedQueryPlanner.fromSupergraphSdl(TestSchemas.products(),
                QueryPlannerConfiguration.newConfiguration().planningThreads(2).build());
        planningService = new PlanningService(planner);
    }

    @AfterEach
    void tearDown() {
        planningService.shutdown();
    }

    @Test
    void plansOffTheCallerThread() {
        String caller = Thread.currentThread().getName();

        StepVerifier.create(planningService.plan("{ me { name reviews { body } } }", null)
                        .map(plan -> Thread.currentThread().getName() + "|" + plan.getNode().getKind()))
                .assertNext(result -> {
                    assertThat(result).startsWith("query-planning-scheduler");
                    assertThat(result).endsWith("|" + NodeKind.SEQUENCE);
                    assertThat(result).doesNotStartWith(caller + "|");
                })
                .verifyComplete();
    }

    @Test
    void plansParsedDocuments() {
        StepVerifier.create(planningService.plan(Parser.parse("query Top { topProducts { upc } }"), "Top"))
                .assertNext(plan -> assertThat(plan.getFetchNodes().get(0).getOperationName()).isEqualTo("Top__products__0"))
                .verifyComplete();
    }

    @Test
    void failsWithThePlanningError() {
        StepVerifier.create(planningService.plan("{ topProducts { legacyCode } }", null))
                .expectError(PlanningError.Unresolvable.class)
                .verify(Duration.ofSeconds(10));
        StepVerifier.create(planningService.plan("{ nope }", null))
                .expectError(OperationError.class)
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void plansConcurrently() {
        Flux<Integer> fetchCounts = Flux.range(0, 20)
                .flatMap(i -> planningService.plan("{ topProducts { name shippingEstimate } }", null))
                .map(plan -> plan.getFetchCount());

        StepVerifier.create(fetchCounts.collectList())
                .assertNext(counts -> assertThat(counts).hasSize(20).containsOnly(2))
                .verifyComplete();
    }
}
