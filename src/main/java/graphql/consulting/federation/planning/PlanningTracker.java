package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.normalized.NormalizedOperation;
import graphql.consulting.federation.schema.Subgraph;
import graphql.execution.ResultPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The mutable state of one planning call: the fetch groups created so far and the indexes used to find
 * them again. Never shared between calls.
 */
@Internal
public class PlanningTracker {

    private static final Logger log = LoggerFactory.getLogger(PlanningTracker.class);

    private final NormalizedOperation operation;
    private final IdGenerator idGenerator = new IdGenerator();
    private final List<FetchGroup> groups = new ArrayList<>();
    private final Map<Subgraph, FetchGroup> rootGroups = new LinkedHashMap<>();
    private final Map<String, FetchGroup> jumpGroups = new LinkedHashMap<>();
    private final Map<String, FetchGroup> requiresGroups = new LinkedHashMap<>();
    private final Deque<Set<FetchGroup>> producerCollectors = new ArrayDeque<>();
    private final PathContext rootContext = new PathContext();

    public PlanningTracker(NormalizedOperation operation) {
        this.operation = operation;
    }

    public NormalizedOperation getOperation() {
        return operation;
    }

    public List<FetchGroup> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    public PathContext getRootContext() {
        return rootContext;
    }

    public FetchGroup getRootGroup(Subgraph subgraph) {
        return rootGroups.get(subgraph);
    }

    /**
     * @return the root group of the subgraph, created on first use without any dependencies
     */
    public FetchGroup rootGroup(Subgraph subgraph) {
        FetchGroup group = rootGroups.get(subgraph);
        if (group == null) {
            group = createGroup(subgraph, false, false, ResultPath.rootPath());
            rootGroups.put(subgraph, group);
        }
        return group;
    }

    /**
     * Opens a further root group for the subgraph, as needed when mutation fields alternate between
     * subgraphs. It depends on every group created before.
     */
    public FetchGroup newMutationRootGroup(Subgraph subgraph) {
        List<FetchGroup> earlier = new ArrayList<>(groups);
        FetchGroup group = createGroup(subgraph, false, false, ResultPath.rootPath());
        group.addDependencies(earlier);
        rootGroups.put(subgraph, group);
        return group;
    }

    public FetchGroup findJumpGroup(Subgraph subgraph, ResultPath path, FetchGroup source) {
        return jumpGroups.get(jumpKey(subgraph, path, source));
    }

    /**
     * @return true if any entity group (not opened for requires) targets the subgraph at the path
     */
    public boolean hasJumpGroup(Subgraph subgraph, ResultPath path) {
        for (FetchGroup group : jumpGroups.values()) {
            if (group.getSubgraph().equals(subgraph) && group.getMergePath().toString().equals(path.toString())) {
                return true;
            }
        }
        return false;
    }

    public FetchGroup newJumpGroup(Subgraph subgraph, ResultPath path, FetchGroup source) {
        FetchGroup group = createGroup(subgraph, true, false, path);
        jumpGroups.put(jumpKey(subgraph, path, source), group);
        return group;
    }

    /**
     * Groups for fields with {@code requires} are shared between fields that need the same producers
     * at the same path.
     */
    public FetchGroup requiresGroup(Subgraph subgraph, ResultPath path, Set<FetchGroup> producers) {
        List<Integer> ids = new ArrayList<>();
        for (FetchGroup producer : producers) {
            ids.add(producer.getId());
        }
        Collections.sort(ids);
        String key = subgraph.getName() + "|" + path + "|" + ids;
        FetchGroup group = requiresGroups.get(key);
        if (group == null) {
            group = createGroup(subgraph, true, true, path);
            group.addDependencies(producers);
            requiresGroups.put(key, group);
        }
        return group;
    }

    private FetchGroup createGroup(Subgraph subgraph, boolean entity, boolean requiresGroup, ResultPath path) {
        FetchGroup group = new FetchGroup(idGenerator.nextId(), subgraph, entity, requiresGroup, path);
        groups.add(group);
        log.debug("opened fetch group {} for {} at '{}'", group.getId(), subgraph.getName(), path);
        return group;
    }

    private static String jumpKey(Subgraph subgraph, ResultPath path, FetchGroup source) {
        return subgraph.getName() + "|" + path + "|" + source.getId();
    }

    /**
     * Runs the action and returns every group a field was selected in or found in meanwhile.
     */
    public Set<FetchGroup> collectProducers(Runnable action) {
        producerCollectors.push(new LinkedHashSet<>());
        try {
            action.run();
            return producerCollectors.peek();
        } finally {
            producerCollectors.pop();
        }
    }

    public void recordProducer(FetchGroup group) {
        Set<FetchGroup> producers = producerCollectors.peek();
        if (producers != null) {
            producers.add(group);
        }
    }
}
