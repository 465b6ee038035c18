package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.QueryPlannerConfiguration;
import graphql.consulting.federation.plan.FetchNode;
import graphql.consulting.federation.plan.FlattenNode;
import graphql.consulting.federation.plan.ParallelNode;
import graphql.consulting.federation.plan.PlanNode;
import graphql.consulting.federation.plan.QueryPlan;
import graphql.consulting.federation.plan.SequenceNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Arranges the fetch groups of one planning call into the node tree of the plan.
 * <p>
 * Groups that do not depend on each other, directly or indirectly, run in parallel. Within a set of
 * connected groups the groups without dependencies in the set run first, followed by the rest.
 */
@Internal
public class PlanTreeBuilder {

    static final Comparator<FetchGroup> GROUP_ORDER = Comparator
            .comparing(FetchGroup::getMergePathString)
            .thenComparing(FetchGroup::getSubgraph)
            .thenComparingInt(FetchGroup::getId);

    private enum TreeKind {
        FETCH, SEQUENCE, PARALLEL
    }

    private static class GroupTree {
        private final TreeKind kind;
        private final FetchGroup group;
        private final List<GroupTree> children = new ArrayList<>();

        private GroupTree(TreeKind kind, FetchGroup group) {
            this.kind = kind;
            this.group = group;
        }
    }

    private final QueryPlannerConfiguration configuration;
    private final FetchDocumentWriter documentWriter;

    public PlanTreeBuilder(QueryPlannerConfiguration configuration, FetchDocumentWriter documentWriter) {
        this.configuration = configuration;
        this.documentWriter = documentWriter;
    }

    public QueryPlan build(List<FetchGroup> groups) {
        if (groups.isEmpty()) {
            return new QueryPlan(null);
        }
        List<FetchGroup> sorted = new ArrayList<>(groups);
        sorted.sort(GROUP_ORDER);
        GroupTree tree = arrange(sorted);
        Map<FetchGroup, String> operationNames = new LinkedHashMap<>();
        if (configuration.isGenerateOperationNames() && documentWriter.getClientOperationName() != null) {
            nameOperations(tree, operationNames);
        }
        return new QueryPlan(toPlanNode(tree, operationNames));
    }

    private GroupTree arrange(List<FetchGroup> groups) {
        List<GroupTree> trees = new ArrayList<>();
        for (List<FetchGroup> component : components(groups)) {
            trees.add(arrangeComponent(component));
        }
        return combine(TreeKind.PARALLEL, trees);
    }

    private GroupTree arrangeComponent(List<FetchGroup> groups) {
        Set<FetchGroup> members = new LinkedHashSet<>(groups);
        List<GroupTree> sources = new ArrayList<>();
        List<FetchGroup> rest = new ArrayList<>();
        for (FetchGroup group : groups) {
            if (dependsOnAny(group, members)) {
                rest.add(group);
            } else {
                sources.add(new GroupTree(TreeKind.FETCH, group));
            }
        }
        GroupTree head = combine(TreeKind.PARALLEL, sources);
        if (rest.isEmpty()) {
            return head;
        }
        List<GroupTree> steps = new ArrayList<>();
        steps.add(head);
        steps.add(arrange(rest));
        return combine(TreeKind.SEQUENCE, steps);
    }

    private static boolean dependsOnAny(FetchGroup group, Set<FetchGroup> members) {
        for (FetchGroup dependency : group.getDependencies()) {
            if (members.contains(dependency)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits the groups into sets connected by dependencies, keeping the given order.
     */
    private static List<List<FetchGroup>> components(List<FetchGroup> groups) {
        Set<FetchGroup> members = new LinkedHashSet<>(groups);
        Map<FetchGroup, Set<FetchGroup>> neighbours = new LinkedHashMap<>();
        for (FetchGroup group : groups) {
            neighbours.computeIfAbsent(group, ignored -> new LinkedHashSet<>());
            for (FetchGroup dependency : group.getDependencies()) {
                if (members.contains(dependency)) {
                    neighbours.get(group).add(dependency);
                    neighbours.computeIfAbsent(dependency, ignored -> new LinkedHashSet<>()).add(group);
                }
            }
        }
        List<List<FetchGroup>> result = new ArrayList<>();
        Set<FetchGroup> seen = new LinkedHashSet<>();
        for (FetchGroup group : groups) {
            if (seen.contains(group)) {
                continue;
            }
            Set<FetchGroup> component = new LinkedHashSet<>();
            Deque<FetchGroup> queue = new ArrayDeque<>();
            queue.add(group);
            seen.add(group);
            while (!queue.isEmpty()) {
                FetchGroup current = queue.poll();
                component.add(current);
                for (FetchGroup neighbour : neighbours.get(current)) {
                    if (seen.add(neighbour)) {
                        queue.add(neighbour);
                    }
                }
            }
            List<FetchGroup> ordered = new ArrayList<>();
            for (FetchGroup member : groups) {
                if (component.contains(member)) {
                    ordered.add(member);
                }
            }
            result.add(ordered);
        }
        return result;
    }

    private static GroupTree combine(TreeKind kind, List<GroupTree> trees) {
        if (trees.size() == 1) {
            return trees.get(0);
        }
        GroupTree result = new GroupTree(kind, null);
        for (GroupTree tree : trees) {
            if (tree.kind == kind) {
                result.children.addAll(tree.children);
            } else {
                result.children.add(tree);
            }
        }
        return result;
    }

    private void nameOperations(GroupTree tree, Map<FetchGroup, String> operationNames) {
        if (tree.kind == TreeKind.FETCH) {
            String name = documentWriter.getClientOperationName() + "__" + tree.group.getSubgraph().getSanitizedName() + "__" + operationNames.size();
            operationNames.put(tree.group, name);
            return;
        }
        for (GroupTree child : tree.children) {
            nameOperations(child, operationNames);
        }
    }

    private PlanNode toPlanNode(GroupTree tree, Map<FetchGroup, String> operationNames) {
        switch (tree.kind) {
            case FETCH:
                return fetchNode(tree.group, operationNames.get(tree.group));
            case SEQUENCE:
                return new SequenceNode(childNodes(tree, operationNames));
            default:
                return new ParallelNode(childNodes(tree, operationNames));
        }
    }

    private List<PlanNode> childNodes(GroupTree tree, Map<FetchGroup, String> operationNames) {
        List<PlanNode> result = new ArrayList<>();
        for (GroupTree child : tree.children) {
            result.add(toPlanNode(child, operationNames));
        }
        return result;
    }

    private PlanNode fetchNode(FetchGroup group, String operationName) {
        FetchNode fetchNode = FetchNode.newFetchNode()
                .id(group.getId())
                .serviceName(group.getSubgraph().getName())
                .operationKind(documentWriter.getOperationKind(group))
                .operationName(operationName)
                .operation(documentWriter.write(group, operationName))
                .variableUsages(documentWriter.getVariableUsages(group))
                .requires(documentWriter.getRequires(group))
                .inputRewrites(new ArrayList<>(group.getInputRewrites()))
                .build();
        if (!group.isEntity()) {
            return fetchNode;
        }
        return new FlattenNode(group.getMergePath(), fetchNode);
    }
}
