package graphql.consulting.federation;

import graphql.PublicApi;
import graphql.consulting.federation.plan.QueryPlan;
import graphql.language.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Plans operations off the caller's thread. Planning itself is synchronous; the returned {@link Mono}
 * completes with the plan or fails with the planning error. Callers may apply a timeout and drop the
 * result, a late plan is simply discarded.
 */
@PublicApi
public class PlanningService {

    private static final Logger log = LoggerFactory.getLogger(PlanningService.class);

    private final FederatedQueryPlanner planner;
    private final Scheduler planningScheduler;

    public PlanningService(FederatedQueryPlanner planner) {
        this.planner = planner;
        this.planningScheduler = Schedulers.newParallel("query-planning-scheduler", planner.getConfiguration().getPlanningThreads());
    }

    public Mono<QueryPlan> plan(String query, String operationName) {
        return Mono.fromCallable(() -> planner.plan(query, operationName))
                .subscribeOn(planningScheduler)
                .doOnError(throwable -> log.debug("planning operation {} failed", operationName, throwable));
    }

    public Mono<QueryPlan> plan(Document document, String operationName) {
        return Mono.fromCallable(() -> planner.plan(document, operationName))
                .subscribeOn(planningScheduler)
                .doOnError(throwable -> log.debug("planning operation {} failed", operationName, throwable));
    }

    public FederatedQueryPlanner getPlanner() {
        return planner;
    }

    public void shutdown() {
        planningScheduler.dispose();
    }
}
