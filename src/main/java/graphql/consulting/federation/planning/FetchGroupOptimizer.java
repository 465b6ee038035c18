package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.QueryPlannerConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Cleans up the groups of one planning call before the plan tree is built: drops empty groups, merges
 * unordered entity groups of a subgraph at the same path and removes dependencies implied by others.
 */
@Internal
public class FetchGroupOptimizer {

    private static final Logger log = LoggerFactory.getLogger(FetchGroupOptimizer.class);

    private final QueryPlannerConfiguration configuration;

    public FetchGroupOptimizer(QueryPlannerConfiguration configuration) {
        this.configuration = configuration;
    }

    public List<FetchGroup> optimize(List<FetchGroup> groups) {
        List<FetchGroup> result = new ArrayList<>(groups);
        removeEmptyGroups(result);
        if (configuration.isMergeSiblingFetches()) {
            mergeSiblings(result);
        }
        reduceTransitively(result);
        return result;
    }

    private void removeEmptyGroups(List<FetchGroup> groups) {
        for (FetchGroup group : new ArrayList<>(groups)) {
            if (!group.isEmpty()) {
                continue;
            }
            for (FetchGroup dependent : groups) {
                if (dependent.getDependencies().contains(group)) {
                    dependent.removeDependency(group);
                    dependent.addDependencies(group.getDependencies());
                }
            }
            groups.remove(group);
            log.debug("removed empty fetch group {}", group.getId());
        }
    }

    private void mergeSiblings(List<FetchGroup> groups) {
        boolean merged = true;
        while (merged) {
            merged = false;
            outer:
            for (int i = 0; i < groups.size(); i++) {
                for (int j = i + 1; j < groups.size(); j++) {
                    FetchGroup first = groups.get(i);
                    FetchGroup second = groups.get(j);
                    if (canMerge(first, second)) {
                        merge(groups, first, second);
                        merged = true;
                        break outer;
                    }
                }
            }
        }
    }

    private boolean canMerge(FetchGroup first, FetchGroup second) {
        return first.isEntity() && second.isEntity()
                && first.getSubgraph().equals(second.getSubgraph())
                && first.getMergePath().toString().equals(second.getMergePath().toString())
                && !first.dependsOnTransitively(second)
                && !second.dependsOnTransitively(first);
    }

    /**
     * The merged group waits for the dependencies of both. Neither depends on the other, so this can not
     * introduce a cycle.
     */
    private void merge(List<FetchGroup> groups, FetchGroup into, FetchGroup from) {
        into.mergeFrom(from);
        into.addDependencies(from.getDependencies());
        for (FetchGroup dependent : groups) {
            if (dependent.getDependencies().contains(from)) {
                dependent.removeDependency(from);
                if (dependent != into) {
                    dependent.addDependency(into);
                }
            }
        }
        groups.remove(from);
        log.debug("merged fetch group {} into {}", from.getId(), into.getId());
    }

    private void reduceTransitively(List<FetchGroup> groups) {
        for (FetchGroup group : groups) {
            List<FetchGroup> implied = new ArrayList<>();
            for (FetchGroup dependency : group.getDependencies()) {
                for (FetchGroup other : group.getDependencies()) {
                    if (other != dependency && other.dependsOnTransitively(dependency)) {
                        implied.add(dependency);
                        break;
                    }
                }
            }
            for (FetchGroup dependency : implied) {
                group.removeDependency(dependency);
            }
        }
    }
}
