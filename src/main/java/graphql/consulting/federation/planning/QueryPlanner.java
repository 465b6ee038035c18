package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.QueryPlannerConfiguration;
import graphql.consulting.federation.graph.Edge;
import graphql.consulting.federation.graph.EdgeKind;
import graphql.consulting.federation.graph.RoutingGraph;
import graphql.consulting.federation.graph.Vertex;
import graphql.consulting.federation.graph.VertexKind;
import graphql.consulting.federation.normalized.NormalizedField;
import graphql.consulting.federation.normalized.NormalizedOperation;
import graphql.consulting.federation.plan.InputRewrite;
import graphql.consulting.federation.plan.QueryPlan;
import graphql.consulting.federation.plan.QueryPlanSerializer;
import graphql.consulting.federation.schema.ComposedSchema;
import graphql.consulting.federation.schema.FieldSet;
import graphql.consulting.federation.schema.Subgraph;
import graphql.execution.ResultPath;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLTypeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static graphql.Assert.assertShouldNeverHappen;
import static graphql.schema.FieldCoordinates.coordinates;

/**
 * Plans a normalized operation against a routing graph.
 * <p>
 * Fields are planned top down. Every field is attached to a fetch group at a {@link Position}: locally
 * if the subgraph of the position resolves it, otherwise in an earlier group at the same response path
 * or in a new entity group reached over key jumps. Fields with {@code requires} get their own group
 * which waits for every group producing the required fields. The resulting groups are optimized and
 * turned into the plan tree by {@link FetchGroupOptimizer} and {@link PlanTreeBuilder}.
 * <p>
 * A planner is stateless; all state of one call lives in its {@link PlanningTracker}.
 */
@Internal
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private static final String TYPENAME = "__typename";
    private static final FieldSet TYPENAME_SET = new FieldSet(Collections.singletonList(FieldSet.Entry.field(TYPENAME, FieldSet.EMPTY)));

    private final RoutingGraph graph;
    private final ComposedSchema schema;
    private final QueryPlannerConfiguration configuration;

    public QueryPlanner(RoutingGraph graph, QueryPlannerConfiguration configuration) {
        this.graph = graph;
        this.schema = graph.getSchema();
        this.configuration = configuration;
    }

    public QueryPlan plan(NormalizedOperation operation) {
        checkResolvable(operation.getTopLevelFields(), ResultPath.rootPath());

        PlanningTracker tracker = new PlanningTracker(operation);
        if (operation.getOperation() == OperationDefinition.Operation.MUTATION) {
            planMutationFields(tracker, operation);
        } else {
            planRootFields(tracker, operation);
        }

        List<FetchGroup> groups = new FetchGroupOptimizer(configuration).optimize(tracker.getGroups());
        QueryPlan queryPlan = new PlanTreeBuilder(configuration, new FetchDocumentWriter(operation)).build(groups);
        if (log.isDebugEnabled()) {
            log.debug("planned operation {} with {} fetches:\n{}", operation.getOperationName(), queryPlan.getFetchCount(), QueryPlanSerializer.toJson(queryPlan));
        }
        return queryPlan;
    }

    private void checkResolvable(List<NormalizedField> fields, ResultPath path) {
        for (NormalizedField field : fields) {
            ResultPath fieldPath = path.segment(field.getResultKey());
            if (!field.isTypename() && !schema.hasResolvableOwner(field.getParentTypeName(), field.getName())) {
                throw new PlanningError.Unresolvable(coordinates(field.getParentTypeName(), field.getName()), fieldPath);
            }
            checkResolvable(field.getChildren(), fieldPath);
        }
    }

    private void planRootFields(PlanningTracker tracker, NormalizedOperation operation) {
        String rootTypeName = operation.getRootType().getName();
        List<Vertex> rootVertices = graph.getRootVertices(rootTypeName);
        PathContext context = tracker.getRootContext();
        context.addPendingFields(operation.getTopLevelFields());

        List<NormalizedField> typenameFields = new ArrayList<>();
        for (NormalizedField field : operation.getTopLevelFields()) {
            context.removePendingField(field);
            if (field.isTypename()) {
                typenameFields.add(field);
                continue;
            }
            Vertex rootVertex = chooseRootVertex(tracker, rootVertices, field, context);
            resolveField(tracker, rootPosition(tracker, rootVertex), field);
        }
        if (typenameFields.isEmpty()) {
            return;
        }
        Vertex typenameVertex = null;
        for (Vertex rootVertex : rootVertices) {
            if (tracker.getRootGroup(rootVertex.getSubgraph()) != null) {
                typenameVertex = rootVertex;
                break;
            }
        }
        if (typenameVertex == null) {
            typenameVertex = rootVertices.get(0);
        }
        Position position = rootPosition(tracker, typenameVertex);
        for (NormalizedField field : typenameFields) {
            select(tracker, position, field, false);
        }
    }

    private Vertex chooseRootVertex(PlanningTracker tracker, List<Vertex> rootVertices, NormalizedField field, PathContext context) {
        List<Vertex> candidates = new ArrayList<>();
        for (Vertex rootVertex : rootVertices) {
            if (graph.getFieldEdge(rootVertex, field.getName()) != null) {
                candidates.add(rootVertex);
            }
        }
        if (candidates.isEmpty()) {
            throw new PlanningError.Unresolvable(coordinates(field.getParentTypeName(), field.getName()), ResultPath.rootPath().segment(field.getResultKey()));
        }
        candidates.sort(Comparator
                .comparing((Vertex vertex) -> tracker.getRootGroup(vertex.getSubgraph()) == null)
                .thenComparing(vertex -> -resolvableSiblings(vertex, context))
                .thenComparing(Vertex::getSubgraph));
        return candidates.get(0);
    }

    private Position rootPosition(PlanningTracker tracker, Vertex rootVertex) {
        FetchGroup group = tracker.rootGroup(rootVertex.getSubgraph());
        PathContext context = tracker.getRootContext();
        Position position = context.findPosition(group, rootVertex, false);
        if (position == null) {
            position = new Position(group, group.getSelection(), rootVertex, ResultPath.rootPath(), null, context, false);
            context.addPosition(position);
        }
        return position;
    }

    /**
     * Mutation fields run one after the other: a field stays in the group of its predecessor when that
     * subgraph resolves it, otherwise a new root group is opened after everything planned so far.
     */
    private void planMutationFields(PlanningTracker tracker, NormalizedOperation operation) {
        String rootTypeName = operation.getRootType().getName();
        List<Vertex> rootVertices = graph.getRootVertices(rootTypeName);
        PathContext context = tracker.getRootContext();
        context.addPendingFields(operation.getTopLevelFields());

        Position current = null;
        List<NormalizedField> typenameFields = new ArrayList<>();
        for (NormalizedField field : operation.getTopLevelFields()) {
            context.removePendingField(field);
            if (field.isTypename()) {
                typenameFields.add(field);
                continue;
            }
            if (current == null || graph.getFieldEdge(current.getVertex(), field.getName()) == null) {
                Vertex rootVertex = null;
                for (Vertex candidate : rootVertices) {
                    if (graph.getFieldEdge(candidate, field.getName()) != null) {
                        rootVertex = candidate;
                        break;
                    }
                }
                if (rootVertex == null) {
                    throw new PlanningError.Unresolvable(coordinates(rootTypeName, field.getName()), ResultPath.rootPath().segment(field.getResultKey()));
                }
                current = newMutationPosition(tracker, rootVertex);
            }
            resolveField(tracker, current, field);
        }
        if (typenameFields.isEmpty()) {
            return;
        }
        if (current == null) {
            current = newMutationPosition(tracker, rootVertices.get(0));
        }
        for (NormalizedField field : typenameFields) {
            select(tracker, current, field, false);
        }
    }

    private Position newMutationPosition(PlanningTracker tracker, Vertex rootVertex) {
        FetchGroup group = tracker.newMutationRootGroup(rootVertex.getSubgraph());
        Position position = new Position(group, group.getSelection(), rootVertex, ResultPath.rootPath(), null, tracker.getRootContext(), false);
        tracker.getRootContext().addPosition(position);
        return position;
    }

    private void planSelection(PlanningTracker tracker, Position position, List<NormalizedField> fields) {
        position.getContext().addPendingFields(fields);
        for (NormalizedField field : fields) {
            position.getContext().removePendingField(field);
            planField(tracker, position, field);
        }
    }

    private void planField(PlanningTracker tracker, Position position, NormalizedField field) {
        if (!field.getParentTypeName().equals(position.getTypeName())) {
            planOnObjectType(tracker, position, field);
            return;
        }
        if (field.isTypename()) {
            planTypename(tracker, position, field);
            return;
        }
        resolveField(tracker, position, field);
    }

    /**
     * The field was selected on a concrete type of the abstract type at the position. When the subgraph
     * at the position never returns objects of that type the field is left out: no such object can be
     * in the response there, so this is not a partial plan.
     */
    private void planOnObjectType(PlanningTracker tracker, Position position, NormalizedField field) {
        Vertex vertex = position.getVertex();
        String objectTypeName = field.getParentTypeName();
        switch (vertex.getKind()) {
            case INTERFACE:
            case UNION:
                Vertex objectVertex = graph.getDowncast(vertex, objectTypeName);
                if (objectVertex == null) {
                    // the subgraph never returns objects of that type here
                    log.debug("skipping {} at '{}': {} is not a possible type in {}", field.printDetails(), position.getPath(), objectTypeName, vertex);
                    return;
                }
                planField(tracker, position.downcast(objectVertex), field);
                return;
            case INTERFACE_OBJECT:
                Position discovered = discover(tracker, position, objectTypeName, field);
                if (discovered == null) {
                    log.debug("skipping {} at '{}': {} is unknown to the subgraph resolving {}", field.printDetails(), position.getPath(), objectTypeName, vertex.getTypeName());
                    return;
                }
                planField(tracker, discovered, field);
                return;
            default:
                assertShouldNeverHappen("field %s selected on %s at %s", field.printDetails(), objectTypeName, vertex);
        }
    }

    private void planTypename(PlanningTracker tracker, Position position, NormalizedField field) {
        if (position.getVertex().getKind() == VertexKind.INTERFACE_OBJECT) {
            // an interface object only knows the interface name
            select(tracker, discoveryPosition(tracker, position, null, field), field, false);
            return;
        }
        select(tracker, position, field, false);
    }

    private SelectionSetBuilder select(PlanningTracker tracker, Position position, NormalizedField field, boolean composite) {
        FetchGroup group = position.getGroup();
        SelectionSetBuilder child = position.getTarget().field(field.getAlias(), field.getName(), field.getArguments(), field.getConditions(), composite);
        group.addVariableUsages(field.getArguments(), field.getConditions());
        tracker.recordProducer(group);
        return child;
    }

    private void resolveField(PlanningTracker tracker, Position position, NormalizedField field) {
        Vertex vertex = position.getVertex();
        Edge edge = graph.getFieldEdge(vertex, field.getName());
        if (edge != null && !hasRequires(edge)) {
            attachLocal(tracker, position, field, edge);
            return;
        }
        if (edge == null && canUseProvided(position, field)) {
            attachProvided(tracker, position, field);
            return;
        }
        if (edge != null) {
            resolveWithRequires(tracker, position, field, edge, vertex);
            return;
        }
        if (vertex.getKind().isAbstract()) {
            expandAbstract(tracker, position, field);
            return;
        }
        Position reused = findResolvingPosition(position, field);
        if (reused != null) {
            log.debug("reusing fetch group {} for {} at '{}'", reused.getGroup().getId(), field.printDetails(), position.getPath());
            attachLocal(tracker, reused, field, graph.getFieldEdge(reused.getVertex(), field.getName()));
            return;
        }
        List<Edge> jumps = findJumpPath(tracker, position, field);
        if (jumps != null) {
            Vertex target = graph.getVertex(jumps.get(jumps.size() - 1).getTail());
            Edge fieldEdge = graph.getFieldEdge(target, field.getName());
            Position current = position;
            if (hasRequires(fieldEdge)) {
                for (Edge jump : jumps.subList(0, jumps.size() - 1)) {
                    current = jumpTo(tracker, current, jump);
                }
                resolveWithRequires(tracker, current, field, fieldEdge, target);
                return;
            }
            for (Edge jump : jumps) {
                current = jumpTo(tracker, current, jump);
            }
            attachLocal(tracker, current, field, fieldEdge);
            return;
        }
        if (vertex.getKind() == VertexKind.INTERFACE_OBJECT) {
            resolveField(tracker, discoveryPosition(tracker, position, null, field), field);
            return;
        }
        throw unresolvable(position, field);
    }

    private static boolean hasRequires(Edge edge) {
        return edge.getRequires() != null && !edge.getRequires().isEmpty();
    }

    private PlanningError.Unresolvable unresolvable(Position position, NormalizedField field) {
        return new PlanningError.Unresolvable(coordinates(position.getTypeName(), field.getName()), position.getPath().segment(field.getResultKey()));
    }

    private void attachLocal(PlanningTracker tracker, Position position, NormalizedField field, Edge edge) {
        Vertex tail = graph.getVertex(edge.getTail());
        if (tail.getKind() == VertexKind.LEAF) {
            select(tracker, position, field, false);
            return;
        }
        SelectionSetBuilder childTarget = select(tracker, position, field, true);
        FieldSet provided = edge.getProvides();
        FieldSet providedChildren = providedChildren(position, field);
        if (providedChildren != null) {
            provided = provided == null ? providedChildren : provided.merge(providedChildren);
        }
        planChildren(tracker, position, field, childTarget, tail, provided);
    }

    private void planChildren(PlanningTracker tracker, Position position, NormalizedField field, SelectionSetBuilder childTarget, Vertex tail, FieldSet provided) {
        PathContext childContext = new PathContext();
        Position child = new Position(position.getGroup(), childTarget, tail, childPath(position.getPath(), field), provided, childContext, position.isRequiresPosition());
        childContext.addPosition(child);
        planSelection(tracker, child, field.getChildren());
    }

    private static ResultPath childPath(ResultPath path, NormalizedField field) {
        ResultPath result = path.segment(field.getResultKey());
        for (int i = 0; i < field.getListDepth(); i++) {
            result = result.segment("@");
        }
        return result;
    }

    private static FieldSet providedChildren(Position position, NormalizedField field) {
        if (position.getProvided() == null) {
            return null;
        }
        FieldSet.Entry entry = position.getProvided().getField(field.getName());
        return entry == null || entry.getChildren().isEmpty() ? null : entry.getChildren();
    }

    private boolean canUseProvided(Position position, NormalizedField field) {
        if (position.getProvided() == null || !position.getProvided().hasField(field.getName())) {
            return false;
        }
        return !isComposite(field) || graph.findVertex(field.getReturnTypeName(), position.getVertex().getSubgraph()) != null;
    }

    private static boolean isComposite(NormalizedField field) {
        return !GraphQLTypeUtil.isLeaf(GraphQLTypeUtil.unwrapAll(field.getType()));
    }

    /**
     * The subgraph does not resolve the field itself but hands it out on this path.
     */
    private void attachProvided(PlanningTracker tracker, Position position, NormalizedField field) {
        if (!isComposite(field)) {
            select(tracker, position, field, false);
            return;
        }
        SelectionSetBuilder childTarget = select(tracker, position, field, true);
        Vertex tail = graph.findVertex(field.getReturnTypeName(), position.getVertex().getSubgraph());
        planChildren(tracker, position, field, childTarget, tail, providedChildren(position, field));
    }

    private void expandAbstract(PlanningTracker tracker, Position position, NormalizedField field) {
        List<String> objectTypeNames = new ArrayList<>(schema.getPossibleObjectTypes(position.getTypeName()));
        Collections.sort(objectTypeNames);
        for (String objectTypeName : objectTypeNames) {
            Vertex objectVertex = graph.getDowncast(position.getVertex(), objectTypeName);
            if (objectVertex != null) {
                resolveField(tracker, position.downcast(objectVertex), field);
            }
        }
    }

    /**
     * Looks for another group at the same response path whose subgraph resolves the field locally.
     */
    private Position findResolvingPosition(Position position, NormalizedField field) {
        String typeName = position.getTypeName();
        Position best = null;
        for (Position candidate : position.getContext().getPositions()) {
            if (!receivesType(candidate, typeName)) {
                continue;
            }
            Position view = resolvingView(candidate, typeName, field.getName());
            if (view == null) {
                continue;
            }
            if (best == null || compareReuseCandidates(view, best) < 0) {
                best = view;
            }
        }
        return best;
    }

    private boolean receivesType(Position candidate, String typeName) {
        FetchGroup group = candidate.getGroup();
        if (!group.isEntity() || !group.getMergePath().toString().equals(candidate.getPath().toString())) {
            return true;
        }
        return group.acceptsType(schema, typeName);
    }

    private Position resolvingView(Position candidate, String typeName, String fieldName) {
        Vertex vertex = candidate.getVertex();
        if (vertex.getTypeName().equals(typeName)) {
            return resolvesWithoutRequires(vertex, fieldName) ? candidate : null;
        }
        if (!schema.isPossibleType(vertex.getTypeName(), typeName)) {
            return null;
        }
        if (vertex.getKind().isAbstract()) {
            Vertex objectVertex = graph.getDowncast(vertex, typeName);
            return objectVertex != null && resolvesWithoutRequires(objectVertex, fieldName) ? candidate.downcast(objectVertex) : null;
        }
        if (vertex.getKind() == VertexKind.INTERFACE_OBJECT && resolvesWithoutRequires(vertex, fieldName)) {
            return candidate;
        }
        return null;
    }

    private boolean resolvesWithoutRequires(Vertex vertex, String fieldName) {
        Edge edge = graph.getFieldEdge(vertex, fieldName);
        return edge != null && !hasRequires(edge);
    }

    private static int compareReuseCandidates(Position p1, Position p2) {
        if (p1.isRequiresPosition() != p2.isRequiresPosition()) {
            return p1.isRequiresPosition() ? 1 : -1;
        }
        int bySubgraph = p1.getVertex().getSubgraph().compareTo(p2.getVertex().getSubgraph());
        if (bySubgraph != 0) {
            return bySubgraph;
        }
        return Integer.compare(p1.getGroup().getId(), p2.getGroup().getId());
    }

    /**
     * Breadth first search over key jumps for the closest vertex resolving the field.
     *
     * @return the jumps to take, null if no vertex within {@link QueryPlannerConfiguration#getMaxKeyJumps()} resolves the field
     */
    private List<Edge> findJumpPath(PlanningTracker tracker, Position position, NormalizedField field) {
        Map<Integer, Edge> reachedBy = new LinkedHashMap<>();
        Set<Integer> visited = new HashSet<>();
        visited.add(position.getVertex().getIndex());
        List<Vertex> frontier = Collections.singletonList(position.getVertex());
        for (int level = 1; level <= configuration.getMaxKeyJumps() && !frontier.isEmpty(); level++) {
            List<Vertex> next = new ArrayList<>();
            for (Vertex vertex : frontier) {
                List<Edge> jumps = graph.getOutgoingEdges(vertex, EdgeKind.KEY_JUMP);
                jumps.sort(Comparator.comparing(jump -> graph.getVertex(jump.getTail()).getSubgraph()));
                for (Edge jump : jumps) {
                    Vertex tail = graph.getVertex(jump.getTail());
                    if (visited.add(tail.getIndex())) {
                        reachedBy.put(tail.getIndex(), jump);
                        next.add(tail);
                    }
                }
            }
            List<Vertex> candidates = new ArrayList<>();
            for (Vertex vertex : next) {
                if (graph.getFieldEdge(vertex, field.getName()) != null) {
                    candidates.add(vertex);
                }
            }
            if (!candidates.isEmpty()) {
                candidates.sort(Comparator
                        .comparing((Vertex vertex) -> !tracker.hasJumpGroup(vertex.getSubgraph(), position.getPath()))
                        .thenComparing(vertex -> -resolvableSiblings(vertex, position.getContext()))
                        .thenComparing(Vertex::getSubgraph));
                return jumpsTo(candidates.get(0), reachedBy);
            }
            frontier = next;
        }
        return null;
    }

    private List<Edge> jumpsTo(Vertex target, Map<Integer, Edge> reachedBy) {
        List<Edge> result = new ArrayList<>();
        Edge edge = reachedBy.get(target.getIndex());
        while (edge != null) {
            result.add(0, edge);
            edge = reachedBy.get(edge.getHead());
        }
        return result;
    }

    private int resolvableSiblings(Vertex vertex, PathContext context) {
        int count = 0;
        for (NormalizedField pending : context.getPendingFields()) {
            if (!pending.isTypename() && graph.getFieldEdge(vertex, pending.getName()) != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Enters the subgraph at the tail of a key jump: the source position selects {@code __typename}
     * and the key, the entity group of the subgraph at this path takes them as representation.
     */
    private Position jumpTo(PlanningTracker tracker, Position position, Edge jump) {
        Vertex tail = graph.getVertex(jump.getTail());
        Subgraph subgraph = tail.getSubgraph();
        FetchGroup existing = tracker.findJumpGroup(subgraph, position.getPath(), position.getGroup());
        Set<FetchGroup> producers = tracker.collectProducers(() -> {
            planRepresentation(tracker, position, TYPENAME_SET, existing);
            planRepresentation(tracker, position, jump.getKey(), existing);
        });
        FetchGroup group = existing != null ? existing : tracker.newJumpGroup(subgraph, position.getPath(), position.getGroup());
        producers.remove(group);
        group.addDependencies(producers);
        group.addInput(position.getTypeName(), TYPENAME_SET.merge(jump.getKey()));
        if (jump.getTypenameRewrite() != null) {
            group.addInputRewrite(typenameRewrite(position.getTypeName(), jump.getTypenameRewrite()));
        }
        return entityPosition(position, group, tail, false);
    }

    private static InputRewrite typenameRewrite(String typeName, String setValueTo) {
        return new InputRewrite(Arrays.asList("... on " + typeName, TYPENAME), setValueTo);
    }

    private static Position entityPosition(Position source, FetchGroup group, Vertex vertex, boolean requiresPosition) {
        PathContext context = source.getContext();
        Position position = context.findPosition(group, vertex, requiresPosition);
        if (position == null) {
            position = new Position(group, group.getSelection().inlineFragment(vertex.getTypeName()), vertex, source.getPath(), null, context, requiresPosition);
            context.addPosition(position);
        }
        return position;
    }

    /**
     * Plans the required fields at the position, then resolves the field in an entity group of the
     * target subgraph which waits for all of them.
     */
    private void resolveWithRequires(PlanningTracker tracker, Position position, NormalizedField field, Edge edge, Vertex target) {
        List<FieldSet> keys = target.getOwnership().getResolvableKeys();
        if (keys.isEmpty()) {
            throw unresolvable(position, field);
        }
        FieldSet key = keys.get(0);
        FieldSet requires = edge.getRequires();
        Set<FetchGroup> producers = tracker.collectProducers(() -> {
            planRepresentation(tracker, position, TYPENAME_SET, null);
            planRepresentation(tracker, position, key, null);
            planRepresentation(tracker, position, requires, null);
        });
        FetchGroup group = tracker.requiresGroup(target.getSubgraph(), position.getPath(), producers);
        group.addInput(position.getTypeName(), TYPENAME_SET.merge(key).merge(requires));
        if (target.getKind() == VertexKind.INTERFACE_OBJECT && !target.getTypeName().equals(position.getTypeName())) {
            group.addInputRewrite(typenameRewrite(position.getTypeName(), target.getTypeName()));
        }
        log.debug("{} at '{}' requires {}, planned in fetch group {}", field.printDetails(), position.getPath(), requires, group.getId());
        attachLocal(tracker, entityPosition(position, group, target, true), field, edge);
    }

    /**
     * Makes sure the fields of a representation are selected at the position. Fields some group at the
     * path already selects are reused; the groups they come from are recorded as producers.
     *
     * @param excluded a group that must not produce the fields, null if any group may
     */
    private void planRepresentation(PlanningTracker tracker, Position position, FieldSet fieldSet, FetchGroup excluded) {
        for (FieldSet.Entry entry : fieldSet.getEntries()) {
            if (!entry.isField()) {
                String typeCondition = entry.getTypeCondition();
                if (typeCondition.equals(position.getTypeName()) || schema.isPossibleType(typeCondition, position.getTypeName())) {
                    planRepresentation(tracker, position, entry.getChildren(), excluded);
                } else if (position.getVertex().getKind().isAbstract()) {
                    Vertex objectVertex = graph.getDowncast(position.getVertex(), typeCondition);
                    if (objectVertex != null) {
                        planRepresentation(tracker, position.downcast(objectVertex), entry.getChildren(), excluded);
                    }
                }
                continue;
            }
            Position selected = findSelected(position, entry, excluded);
            if (selected != null) {
                tracker.recordProducer(selected.getGroup());
                continue;
            }
            if (TYPENAME.equals(entry.getFieldName())) {
                position.getTarget().plainField(TYPENAME, false);
                tracker.recordProducer(position.getGroup());
                continue;
            }
            FieldSet single = new FieldSet(Collections.singletonList(entry));
            for (NormalizedField synthetic : FieldSetSelections.toNormalizedFields(schema.getApiSchema(), position.getTypeName(), single)) {
                resolveField(tracker, position, synthetic);
            }
        }
    }

    private Position findSelected(Position position, FieldSet.Entry entry, FetchGroup excluded) {
        String typeName = position.getTypeName();
        List<Position> candidates = new ArrayList<>();
        candidates.add(position);
        candidates.addAll(position.getContext().getPositions());
        for (Position candidate : candidates) {
            FetchGroup group = candidate.getGroup();
            if (excluded != null && (group == excluded || group.dependsOnTransitively(excluded))) {
                continue;
            }
            Vertex vertex = candidate.getVertex();
            if (TYPENAME.equals(entry.getFieldName()) && vertex.getKind() == VertexKind.INTERFACE_OBJECT && !vertex.getTypeName().equals(typeName)) {
                continue;
            }
            if (!receivesType(candidate, typeName)) {
                continue;
            }
            if (vertex.getTypeName().equals(typeName) || vertex.getKind() == VertexKind.INTERFACE_OBJECT && schema.isPossibleType(vertex.getTypeName(), typeName)) {
                if (candidate.getTarget().contains(entry)) {
                    return candidate;
                }
            } else if (vertex.getKind().isAbstract() && schema.isPossibleType(vertex.getTypeName(), typeName)) {
                SelectionSetBuilder fragment = candidate.getTarget().getInlineFragment(typeName);
                if (candidate.getTarget().contains(entry) || fragment != null && fragment.contains(entry)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    /**
     * The position of the group that knows the concrete types behind an interface object at this path,
     * opened over an interface expansion edge on first use.
     *
     * @param objectTypeName the concrete type that is needed, null if any will do
     */
    private Position discoveryPosition(PlanningTracker tracker, Position position, String objectTypeName, NormalizedField field) {
        PathContext context = position.getContext();
        if (context.getDiscovery() != null) {
            return context.getDiscovery();
        }
        List<Edge> expansions = graph.getOutgoingEdges(position.getVertex(), EdgeKind.INTERFACE_EXPANSION);
        if (expansions.isEmpty()) {
            throw unresolvable(position, field);
        }
        expansions.sort(Comparator
                .comparing((Edge expansion) -> objectTypeName != null && !knowsType(graph.getVertex(expansion.getTail()).getSubgraph(), position.getTypeName(), objectTypeName))
                .thenComparing(expansion -> !tracker.hasJumpGroup(graph.getVertex(expansion.getTail()).getSubgraph(), position.getPath()))
                .thenComparing(expansion -> graph.getVertex(expansion.getTail()).getSubgraph()));
        Edge expansion = expansions.get(0);
        Subgraph subgraph = graph.getVertex(expansion.getTail()).getSubgraph();
        Vertex interfaceVertex = graph.findVertex(position.getTypeName(), subgraph);

        FetchGroup existing = tracker.findJumpGroup(subgraph, position.getPath(), position.getGroup());
        Set<FetchGroup> producers = tracker.collectProducers(() -> {
            planRepresentation(tracker, position, TYPENAME_SET, existing);
            planRepresentation(tracker, position, expansion.getKey(), existing);
        });
        FetchGroup group = existing != null ? existing : tracker.newJumpGroup(subgraph, position.getPath(), position.getGroup());
        producers.remove(group);
        group.addDependencies(producers);
        group.addInput(position.getTypeName(), TYPENAME_SET.merge(expansion.getKey()));

        Position discovery = entityPosition(position, group, interfaceVertex, false);
        discovery.getTarget().plainField(TYPENAME, false);
        context.setDiscovery(discovery);
        log.debug("discovering concrete types of {} at '{}' in fetch group {}", position.getTypeName(), position.getPath(), group.getId());
        return discovery;
    }

    private boolean knowsType(Subgraph subgraph, String interfaceName, String objectTypeName) {
        Vertex interfaceVertex = graph.findVertex(interfaceName, subgraph);
        return interfaceVertex != null && graph.getDowncast(interfaceVertex, objectTypeName) != null;
    }

    /**
     * @return the position for fields selected on the concrete type, null if the subgraph knowing the
     * concrete types never returns that type
     */
    private Position discover(PlanningTracker tracker, Position position, String objectTypeName, NormalizedField field) {
        Position discovery = discoveryPosition(tracker, position, objectTypeName, field);
        Vertex objectVertex = graph.getDowncast(discovery.getVertex(), objectTypeName);
        return objectVertex == null ? null : discovery.downcast(objectVertex);
    }
}
