package graphql.consulting.federation.graph;

import graphql.PublicApi;
import graphql.consulting.federation.schema.ComposedSchema;
import graphql.consulting.federation.schema.FieldDef;
import graphql.consulting.federation.schema.FieldOwnership;
import graphql.consulting.federation.schema.FieldSet;
import graphql.consulting.federation.schema.Subgraph;
import graphql.consulting.federation.schema.TypeDef;
import graphql.consulting.federation.schema.TypeKind;
import graphql.consulting.federation.schema.TypeOwnership;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static graphql.consulting.federation.graph.GraphBuildError.Kind.DANGLING_REQUIRES;
import static graphql.consulting.federation.graph.GraphBuildError.Kind.INCONSISTENT_OWNERSHIP;
import static graphql.consulting.federation.graph.GraphBuildError.Kind.UNREACHABLE_TYPE;

/**
 * Compiles a {@link ComposedSchema} into a {@link RoutingGraph}.
 * <p>
 * Every (type, subgraph) declaration becomes a vertex. Inside a subgraph, FIELD edges lead from a type
 * to the return type of each field the subgraph resolves and DOWNCAST edges from abstract types to
 * their object types. Between subgraphs, KEY_JUMP edges connect declarations of the same entity when
 * the source can produce a key the target accepts, and INTERFACE_EXPANSION edges lead from an interface
 * object to the concrete implementations known by another subgraph.
 */
@PublicApi
public class RoutingGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(RoutingGraphBuilder.class);

    private final ComposedSchema schema;
    private final List<Vertex> vertices = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, Map<Subgraph, Vertex>> vertexIndex = new LinkedHashMap<>();

    private RoutingGraphBuilder(ComposedSchema schema) {
        this.schema = schema;
    }

    public static RoutingGraph build(ComposedSchema schema) {
        return new RoutingGraphBuilder(schema).buildImpl();
    }

    private RoutingGraph buildImpl() {
        checkReachability();
        checkFieldSets();

        for (TypeDef typeDef : schema.getTypes().values()) {
            if (!typeDef.getKind().isComposite()) {
                continue;
            }
            for (Subgraph subgraph : typeDef.getSubgraphs()) {
                TypeOwnership ownership = typeDef.getOwnership(subgraph);
                addVertex(typeDef.getName(), subgraph, vertexKind(typeDef, ownership), ownership);
            }
        }

        List<Vertex> compositeVertices = new ArrayList<>(vertices);
        for (Vertex vertex : compositeVertices) {
            addFieldEdges(vertex);
        }
        for (Vertex vertex : compositeVertices) {
            addDowncastEdges(vertex);
        }
        for (Vertex vertex : compositeVertices) {
            addKeyJumpEdges(vertex);
        }
        for (Vertex vertex : compositeVertices) {
            if (vertex.getKind() == VertexKind.INTERFACE_OBJECT) {
                addInterfaceExpansionEdges(vertex);
            }
        }

        log.debug("built routing graph with {} vertices and {} edges for {} subgraphs", vertices.size(), edges.size(), schema.getSubgraphs().size());
        return new RoutingGraph(schema, vertices, edges);
    }

    private VertexKind vertexKind(TypeDef typeDef, TypeOwnership ownership) {
        if (schema.isRootType(typeDef.getName())) {
            return VertexKind.ROOT;
        }
        switch (typeDef.getKind()) {
            case INTERFACE:
                return ownership.isInterfaceObject() ? VertexKind.INTERFACE_OBJECT : VertexKind.INTERFACE;
            case UNION:
                return VertexKind.UNION;
            default:
                return VertexKind.OBJECT;
        }
    }

    private Vertex addVertex(String typeName, Subgraph subgraph, VertexKind kind, TypeOwnership ownership) {
        Vertex vertex = new Vertex(vertices.size(), typeName, subgraph, kind, ownership);
        vertices.add(vertex);
        vertexIndex.computeIfAbsent(typeName, ignored -> new LinkedHashMap<>()).put(subgraph, vertex);
        return vertex;
    }

    private Vertex findVertex(String typeName, Subgraph subgraph) {
        Map<Subgraph, Vertex> bySubgraph = vertexIndex.get(typeName);
        return bySubgraph == null ? null : bySubgraph.get(subgraph);
    }

    private List<Vertex> verticesOf(String typeName) {
        Map<Subgraph, Vertex> bySubgraph = vertexIndex.get(typeName);
        return bySubgraph == null ? new ArrayList<>() : new ArrayList<>(bySubgraph.values());
    }

    private void addFieldEdges(Vertex vertex) {
        TypeDef typeDef = schema.getType(vertex.getTypeName());
        for (FieldDef fieldDef : typeDef.getFields().values()) {
            FieldOwnership ownership = fieldDef.getOwnership(vertex.getSubgraph());
            if (ownership == null || !ownership.isResolvable()) {
                continue;
            }
            TypeDef returnType = schema.getType(fieldDef.getReturnTypeName());
            Vertex tail;
            if (returnType.getKind().isComposite()) {
                tail = findVertex(returnType.getName(), vertex.getSubgraph());
                if (tail == null) {
                    throw new GraphBuildError(INCONSISTENT_OWNERSHIP, "subgraph " + vertex.getSubgraph().getName() + " resolves " + fieldDef
                            + " but does not declare its type " + returnType.getName());
                }
            } else {
                tail = findVertex(returnType.getName(), vertex.getSubgraph());
                if (tail == null) {
                    tail = addVertex(returnType.getName(), vertex.getSubgraph(), VertexKind.LEAF, null);
                }
            }
            edges.add(Edge.field(edges.size(), vertex.getIndex(), tail.getIndex(), fieldDef.getName(), ownership.getRequires(), ownership.getProvides()));
        }
    }

    private void addDowncastEdges(Vertex vertex) {
        if (!vertex.getKind().isAbstract()) {
            return;
        }
        TypeDef typeDef = schema.getType(vertex.getTypeName());
        for (String objectTypeName : typeDef.getPossibleObjectTypes()) {
            Vertex objectVertex = findVertex(objectTypeName, vertex.getSubgraph());
            if (objectVertex == null) {
                continue;
            }
            boolean member = vertex.getKind() == VertexKind.UNION
                    ? vertex.getOwnership().getUnionMembers().contains(objectTypeName)
                    : objectVertex.getOwnership().getImplementedInterfaces().contains(vertex.getTypeName());
            if (member) {
                edges.add(Edge.downcast(edges.size(), vertex.getIndex(), objectVertex.getIndex()));
            }
        }
    }

    private void addKeyJumpEdges(Vertex source) {
        if (source.getKind() == VertexKind.ROOT || source.getKind() == VertexKind.UNION) {
            return;
        }
        for (Vertex target : verticesOf(source.getTypeName())) {
            if (target.getSubgraph().equals(source.getSubgraph()) || !compatibleForKeyJump(source, target)) {
                continue;
            }
            for (FieldSet key : target.getOwnership().getResolvableKeys()) {
                if (isLocallyResolvable(key, source.getTypeName(), source.getSubgraph())) {
                    edges.add(Edge.keyJump(edges.size(), source.getIndex(), target.getIndex(), key, null));
                }
            }
        }
        if (source.getKind() != VertexKind.OBJECT) {
            return;
        }
        // concrete types entering subgraphs that only know one of their interfaces as an object
        TypeDef typeDef = schema.getType(source.getTypeName());
        for (String interfaceName : typeDef.getInterfaces()) {
            for (Vertex target : verticesOf(interfaceName)) {
                if (target.getKind() != VertexKind.INTERFACE_OBJECT || target.getSubgraph().equals(source.getSubgraph())) {
                    continue;
                }
                for (FieldSet key : target.getOwnership().getResolvableKeys()) {
                    if (isLocallyResolvable(key, source.getTypeName(), source.getSubgraph())) {
                        edges.add(Edge.keyJump(edges.size(), source.getIndex(), target.getIndex(), key, interfaceName));
                    }
                }
            }
        }
    }

    private boolean compatibleForKeyJump(Vertex source, Vertex target) {
        if (target.getKind() == VertexKind.ROOT || target.getKind() == VertexKind.UNION) {
            return false;
        }
        // between an interface and an interface object the concrete type has to be discovered first
        if (source.getKind() == VertexKind.INTERFACE && target.getKind() == VertexKind.INTERFACE_OBJECT) {
            return false;
        }
        return !(source.getKind() == VertexKind.INTERFACE_OBJECT && target.getKind() == VertexKind.INTERFACE);
    }

    private void addInterfaceExpansionEdges(Vertex source) {
        TypeDef interfaceDef = schema.getType(source.getTypeName());
        for (Vertex target : verticesOf(source.getTypeName())) {
            if (target.getKind() != VertexKind.INTERFACE || target.getSubgraph().equals(source.getSubgraph())) {
                continue;
            }
            FieldSet usableKey = null;
            for (FieldSet key : target.getOwnership().getResolvableKeys()) {
                if (isLocallyResolvable(key, source.getTypeName(), source.getSubgraph())) {
                    usableKey = key;
                    break;
                }
            }
            if (usableKey == null) {
                continue;
            }
            for (String objectTypeName : interfaceDef.getPossibleObjectTypes()) {
                Vertex objectVertex = findVertex(objectTypeName, target.getSubgraph());
                if (objectVertex != null && objectVertex.getOwnership().getImplementedInterfaces().contains(source.getTypeName())) {
                    edges.add(Edge.interfaceExpansion(edges.size(), source.getIndex(), objectVertex.getIndex(), usableKey));
                }
            }
        }
    }

    private boolean isLocallyResolvable(FieldSet fieldSet, String typeName, Subgraph subgraph) {
        for (FieldSet.Entry entry : fieldSet.getEntries()) {
            if (!entry.isField()) {
                if (!isLocallyResolvable(entry.getChildren(), entry.getTypeCondition(), subgraph)) {
                    return false;
                }
                continue;
            }
            if ("__typename".equals(entry.getFieldName())) {
                continue;
            }
            FieldDef fieldDef = schema.getField(typeName, entry.getFieldName());
            if (fieldDef == null || !fieldDef.isResolvableIn(subgraph)) {
                return false;
            }
            if (!entry.getChildren().isEmpty() && !isLocallyResolvable(entry.getChildren(), fieldDef.getReturnTypeName(), subgraph)) {
                return false;
            }
        }
        return true;
    }

    private void checkReachability() {
        for (TypeDef typeDef : schema.getTypes().values()) {
            if (!typeDef.getKind().isComposite()) {
                continue;
            }
            boolean resolvable = false;
            for (TypeOwnership ownership : typeDef.getOwnerships().values()) {
                resolvable |= ownership.isResolvable();
            }
            if (!resolvable) {
                throw new GraphBuildError(UNREACHABLE_TYPE, "type " + typeDef.getName() + " is not resolvable in any subgraph");
            }
        }
    }

    private void checkFieldSets() {
        for (TypeDef typeDef : schema.getTypes().values()) {
            for (FieldDef fieldDef : typeDef.getFields().values()) {
                for (FieldOwnership ownership : fieldDef.getOwnerships()) {
                    if (ownership.getRequires() != null) {
                        checkFieldSet(ownership.getRequires(), typeDef.getName(), "@requires of " + fieldDef);
                    }
                    if (ownership.getProvides() != null) {
                        checkFieldSet(ownership.getProvides(), fieldDef.getReturnTypeName(), "@provides of " + fieldDef);
                    }
                }
            }
        }
    }

    private void checkFieldSet(FieldSet fieldSet, String typeName, String location) {
        TypeDef typeDef = schema.getType(typeName);
        for (FieldSet.Entry entry : fieldSet.getEntries()) {
            if (!entry.isField()) {
                TypeDef condition = schema.getType(entry.getTypeCondition());
                if (condition == null || condition.getKind() == TypeKind.SCALAR || !overlaps(typeDef, condition)) {
                    throw new GraphBuildError(DANGLING_REQUIRES, location + " uses impossible type condition " + entry.getTypeCondition());
                }
                checkFieldSet(entry.getChildren(), condition.getName(), location);
                continue;
            }
            if ("__typename".equals(entry.getFieldName())) {
                continue;
            }
            FieldDef fieldDef = typeDef == null ? null : typeDef.getField(entry.getFieldName());
            if (fieldDef == null) {
                throw new GraphBuildError(DANGLING_REQUIRES, location + " references unknown field " + typeName + "." + entry.getFieldName());
            }
            if (!entry.getChildren().isEmpty()) {
                checkFieldSet(entry.getChildren(), fieldDef.getReturnTypeName(), location);
            }
        }
    }

    private boolean overlaps(TypeDef typeDef, TypeDef condition) {
        if (typeDef == null) {
            return false;
        }
        for (String objectType : condition.getPossibleObjectTypes()) {
            if (typeDef.getPossibleObjectTypes().contains(objectType)) {
                return true;
            }
        }
        return false;
    }
}
