package graphql.consulting.federation.schema;

import graphql.PublicApi;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The logical schema plus the ownership metadata of every subgraph. Immutable once loaded and safe to
 * share between planning calls.
 *
 * @see ComposedSchemaLoader
 */
@PublicApi
public class ComposedSchema {

    private final GraphQLSchema apiSchema;
    private final Map<String, Subgraph> subgraphsByName;
    private final Map<String, Subgraph> subgraphsByToken;
    private final Map<String, TypeDef> types;

    public ComposedSchema(GraphQLSchema apiSchema, List<Subgraph> subgraphs, Map<String, TypeDef> types) {
        this.apiSchema = apiSchema;
        List<Subgraph> sorted = new ArrayList<>(subgraphs);
        Collections.sort(sorted);
        Map<String, Subgraph> byName = new LinkedHashMap<>();
        Map<String, Subgraph> byToken = new LinkedHashMap<>();
        for (Subgraph subgraph : sorted) {
            byName.put(subgraph.getName(), subgraph);
            byToken.put(subgraph.getEnumToken(), subgraph);
        }
        this.subgraphsByName = Collections.unmodifiableMap(byName);
        this.subgraphsByToken = Collections.unmodifiableMap(byToken);
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    /**
     * @return the client facing schema operations are validated against
     */
    public GraphQLSchema getApiSchema() {
        return apiSchema;
    }

    /**
     * @return all subgraphs in name order
     */
    public Collection<Subgraph> getSubgraphs() {
        return subgraphsByName.values();
    }

    public Subgraph getSubgraph(String name) {
        return subgraphsByName.get(name);
    }

    public Subgraph getSubgraphByToken(String enumToken) {
        return subgraphsByToken.get(enumToken);
    }

    public Map<String, TypeDef> getTypes() {
        return types;
    }

    public TypeDef getType(String typeName) {
        return types.get(typeName);
    }

    public FieldDef getField(String typeName, String fieldName) {
        TypeDef typeDef = types.get(typeName);
        return typeDef == null ? null : typeDef.getField(fieldName);
    }

    public Collection<TypeOwnership> getTypeOwnerships(String typeName) {
        TypeDef typeDef = types.get(typeName);
        if (typeDef == null) {
            return Collections.emptyList();
        }
        return typeDef.getOwnerships().values();
    }

    /**
     * @return the root type name for the operation kind or null if the schema does not support it
     */
    public String getRootTypeName(OperationDefinition.Operation operation) {
        GraphQLObjectType rootType;
        switch (operation) {
            case MUTATION:
                rootType = apiSchema.getMutationType();
                break;
            case SUBSCRIPTION:
                rootType = apiSchema.getSubscriptionType();
                break;
            default:
                rootType = apiSchema.getQueryType();
        }
        return rootType == null ? null : rootType.getName();
    }

    public boolean isRootType(String typeName) {
        for (OperationDefinition.Operation operation : OperationDefinition.Operation.values()) {
            if (typeName.equals(getRootTypeName(operation))) {
                return true;
            }
        }
        return false;
    }

    public Collection<String> getPossibleObjectTypes(String typeName) {
        TypeDef typeDef = types.get(typeName);
        if (typeDef == null) {
            return Collections.emptyList();
        }
        return typeDef.getPossibleObjectTypes();
    }

    public boolean isPossibleType(String typeName, String objectTypeName) {
        return getPossibleObjectTypes(typeName).contains(objectTypeName);
    }

    /**
     * A field is resolvable somewhere when a subgraph resolves it directly, when it is declared on an
     * interface a subgraph sees as interface object and that subgraph resolves it there, or, for
     * interface fields, when any implementation resolves it.
     */
    public boolean hasResolvableOwner(String typeName, String fieldName) {
        TypeDef typeDef = types.get(typeName);
        if (typeDef == null) {
            return false;
        }
        if (isDirectlyResolvable(typeDef, fieldName)) {
            return true;
        }
        if (typeDef.getKind() == TypeKind.OBJECT) {
            for (String interfaceName : typeDef.getInterfaces()) {
                TypeDef interfaceDef = types.get(interfaceName);
                if (interfaceDef != null && resolvableOnInterfaceObject(interfaceDef, fieldName)) {
                    return true;
                }
            }
        }
        if (typeDef.isAbstract()) {
            for (String objectTypeName : typeDef.getPossibleObjectTypes()) {
                TypeDef objectTypeDef = types.get(objectTypeName);
                if (objectTypeDef != null && isDirectlyResolvable(objectTypeDef, fieldName)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isDirectlyResolvable(TypeDef typeDef, String fieldName) {
        FieldDef fieldDef = typeDef.getField(fieldName);
        return fieldDef != null && !fieldDef.getResolvingSubgraphs().isEmpty();
    }

    private boolean resolvableOnInterfaceObject(TypeDef interfaceDef, String fieldName) {
        FieldDef fieldDef = interfaceDef.getField(fieldName);
        if (fieldDef == null) {
            return false;
        }
        for (TypeOwnership ownership : interfaceDef.getOwnerships().values()) {
            if (ownership.isInterfaceObject() && fieldDef.isResolvableIn(ownership.getSubgraph())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ComposedSchema{" +
                "subgraphs=" + subgraphsByName.keySet() +
                ", types=" + types.size() +
                '}';
    }
}
