package graphql.consulting.federation.schema;

import graphql.GraphQLException;
import graphql.PublicApi;
import graphql.language.Argument;
import graphql.language.BooleanValue;
import graphql.language.Directive;
import graphql.language.EnumTypeDefinition;
import graphql.language.EnumValue;
import graphql.language.EnumValueDefinition;
import graphql.language.FieldDefinition;
import graphql.language.InterfaceTypeDefinition;
import graphql.language.NullValue;
import graphql.language.ObjectTypeDefinition;
import graphql.language.StringValue;
import graphql.language.TypeDefinition;
import graphql.language.Value;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLUnionType;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.UnExecutableSchemaGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads a composed (supergraph) SDL: the logical schema whose types and fields carry
 * {@code @join__type}, {@code @join__field}, {@code @join__implements} and
 * {@code @join__unionMember} directives referencing the subgraphs declared in the
 * {@code join__Graph} enum.
 */
@PublicApi
public class ComposedSchemaLoader {
    private static final Logger log = LoggerFactory.getLogger(ComposedSchemaLoader.class);

    public static final String JOIN_GRAPH_ENUM = "join__Graph";
    public static final String JOIN_GRAPH = "join__graph";
    public static final String JOIN_TYPE = "join__type";
    public static final String JOIN_FIELD = "join__field";
    public static final String JOIN_IMPLEMENTS = "join__implements";
    public static final String JOIN_UNION_MEMBER = "join__unionMember";

    private TypeDefinitionRegistry registry;
    private GraphQLSchema apiSchema;
    private Map<String, Subgraph> subgraphsByToken;
    private Map<String, Subgraph> subgraphsByName;

    public static ComposedSchema load(String sdl) {
        return new ComposedSchemaLoader().loadImpl(sdl);
    }

    private ComposedSchema loadImpl(String sdl) {
        try {
            registry = new SchemaParser().parse(sdl);
        } catch (GraphQLException e) {
            throw new SchemaError("composed schema can not be parsed: " + e.getMessage(), e);
        }
        List<Subgraph> subgraphs = readSubgraphs();
        try {
            apiSchema = UnExecutableSchemaGenerator.makeUnExecutableSchema(registry);
        } catch (GraphQLException e) {
            throw new SchemaError("composed schema is not a valid schema: " + e.getMessage(), e);
        }

        Map<String, TypeDef> types = new LinkedHashMap<>();
        for (GraphQLNamedType type : apiSchema.getAllTypesAsList()) {
            if (isHidden(type.getName())) {
                continue;
            }
            types.put(type.getName(), buildTypeDef(type));
        }
        validateExternalFields(types);

        log.debug("loaded composed schema with {} subgraphs and {} types", subgraphs.size(), types.size());
        return new ComposedSchema(apiSchema, subgraphs, types);
    }

    static boolean isHidden(String typeName) {
        return typeName.startsWith("__") || typeName.startsWith("join__") || typeName.startsWith("link__");
    }

    private List<Subgraph> readSubgraphs() {
        Optional<EnumTypeDefinition> graphEnum = registry.getType(JOIN_GRAPH_ENUM, EnumTypeDefinition.class);
        if (!graphEnum.isPresent()) {
            throw new SchemaError("composed schema does not declare the " + JOIN_GRAPH_ENUM + " enum");
        }
        subgraphsByToken = new LinkedHashMap<>();
        subgraphsByName = new LinkedHashMap<>();
        Map<String, String> namesBySanitizedName = new LinkedHashMap<>();
        List<Subgraph> result = new ArrayList<>();
        for (EnumValueDefinition valueDefinition : graphEnum.get().getEnumValueDefinitions()) {
            List<Directive> directives = valueDefinition.getDirectives(JOIN_GRAPH);
            if (directives.size() != 1) {
                throw new SchemaError("subgraph " + valueDefinition.getName() + " must carry exactly one @" + JOIN_GRAPH);
            }
            Directive directive = directives.get(0);
            String name = stringArgument(directive, "name");
            if (name == null) {
                throw new SchemaError("subgraph " + valueDefinition.getName() + " has no name");
            }
            if (subgraphsByName.containsKey(name)) {
                throw new SchemaError("subgraph name '" + name + "' is declared more than once");
            }
            Subgraph subgraph = new Subgraph(name, stringArgument(directive, "url"), valueDefinition.getName());
            String clash = namesBySanitizedName.put(subgraph.getSanitizedName(), name);
            if (clash != null) {
                throw new SchemaError("subgraph names '" + clash + "' and '" + name + "' both sanitize to '" + subgraph.getSanitizedName() + "'");
            }
            subgraphsByToken.put(valueDefinition.getName(), subgraph);
            subgraphsByName.put(name, subgraph);
            result.add(subgraph);
        }
        if (result.isEmpty()) {
            throw new SchemaError("composed schema declares no subgraph");
        }
        return result;
    }

    private TypeDef buildTypeDef(GraphQLNamedType type) {
        String name = type.getName();
        TypeKind kind = kindOf(type);
        Set<String> interfaces = new LinkedHashSet<>();
        Set<String> possibleTypes = new LinkedHashSet<>();
        if (type instanceof GraphQLObjectType) {
            for (GraphQLNamedOutputType interfaceType : ((GraphQLObjectType) type).getInterfaces()) {
                interfaces.add(interfaceType.getName());
            }
            possibleTypes.add(name);
        } else if (type instanceof GraphQLInterfaceType) {
            for (GraphQLNamedOutputType interfaceType : ((GraphQLInterfaceType) type).getInterfaces()) {
                interfaces.add(interfaceType.getName());
            }
            for (GraphQLObjectType implementation : apiSchema.getImplementations((GraphQLInterfaceType) type)) {
                possibleTypes.add(implementation.getName());
            }
        } else if (type instanceof GraphQLUnionType) {
            for (GraphQLNamedOutputType member : ((GraphQLUnionType) type).getTypes()) {
                possibleTypes.add(member.getName());
            }
        }

        Map<Subgraph, TypeOwnership> ownerships = readTypeOwnerships(type, kind, interfaces, possibleTypes);
        if (kind.isComposite() && ownerships.isEmpty()) {
            throw new SchemaError("type " + name + " is missing the @" + JOIN_TYPE + " directive");
        }

        Map<String, FieldDef> fields = new LinkedHashMap<>();
        if (type instanceof GraphQLFieldsContainer && kind.isComposite()) {
            Map<String, FieldDefinition> astFields = astFieldDefinitions(name);
            for (GraphQLFieldDefinition fieldDefinition : ((GraphQLFieldsContainer) type).getFieldDefinitions()) {
                FieldDefinition astField = astFields.get(fieldDefinition.getName());
                List<FieldOwnership> fieldOwnerships = readFieldOwnerships(name, fieldDefinition.getName(), astField, ownerships);
                fields.put(fieldDefinition.getName(), new FieldDef(name, fieldDefinition, fieldOwnerships));
            }
        }
        return new TypeDef(name, kind, type, interfaces, possibleTypes, fields, ownerships);
    }

    private Map<Subgraph, TypeOwnership> readTypeOwnerships(GraphQLNamedType type, TypeKind kind, Set<String> interfaces, Set<String> possibleTypes) {
        String typeName = type.getName();
        Map<Subgraph, TypeOwnership.Builder> builders = new LinkedHashMap<>();
        Map<Subgraph, Set<String>> keysSeen = new LinkedHashMap<>();
        Map<Subgraph, Boolean> anyResolvable = new LinkedHashMap<>();
        for (Directive directive : typeDirectives(typeName, JOIN_TYPE)) {
            Subgraph subgraph = subgraphArgument(directive, typeName);
            if (subgraph == null) {
                throw new SchemaError("@" + JOIN_TYPE + " on " + typeName + " does not name a subgraph");
            }
            String keyText = stringArgument(directive, "key");
            boolean resolvable = booleanArgument(directive, "resolvable", true);
            boolean extension = booleanArgument(directive, "extension", false);
            boolean interfaceObject = booleanArgument(directive, "isInterfaceObject", false);
            if (interfaceObject && kind != TypeKind.INTERFACE) {
                throw new SchemaError("type " + typeName + " is not an interface but is declared as interface object in " + subgraph.getName());
            }

            Set<String> seen = keysSeen.computeIfAbsent(subgraph, ignored -> new LinkedHashSet<>());
            String keyIdentity = keyText == null ? "" : FieldSet.parse(keyText).toString();
            if (!seen.add(keyIdentity)) {
                throw new SchemaError("duplicate @" + JOIN_TYPE + " for " + typeName + " in subgraph " + subgraph.getName());
            }

            TypeOwnership.Builder builder = builders.get(subgraph);
            if (builder == null) {
                builder = TypeOwnership.newTypeOwnership()
                        .typeName(typeName)
                        .subgraph(subgraph)
                        .interfaceObject(interfaceObject)
                        .extension(extension);
                builders.put(subgraph, builder);
                builder.implementedInterfaces(implementedInterfaces(typeName, subgraph, interfaces));
                builder.unionMembers(unionMembers(typeName, subgraph, kind, possibleTypes));
            } else {
                TypeOwnership existing = builder.build();
                if (existing.isInterfaceObject() != interfaceObject || existing.isExtension() != extension) {
                    throw new SchemaError("conflicting @" + JOIN_TYPE + " declarations for " + typeName + " in subgraph " + subgraph.getName());
                }
            }
            anyResolvable.merge(subgraph, resolvable, Boolean::logicalOr);
            if (keyText != null) {
                FieldSet key = FieldSet.parse(keyText);
                validateKey(type, key, keyText);
                builder.key(new TypeOwnership.Key(key, resolvable));
            }
        }

        Map<Subgraph, TypeOwnership> result = new LinkedHashMap<>();
        for (Map.Entry<Subgraph, TypeOwnership.Builder> entry : builders.entrySet()) {
            result.put(entry.getKey(), entry.getValue().resolvable(anyResolvable.get(entry.getKey())).build());
        }
        return result;
    }

    private Set<String> implementedInterfaces(String typeName, Subgraph subgraph, Set<String> interfaces) {
        List<Directive> directives = typeDirectives(typeName, JOIN_IMPLEMENTS);
        if (directives.isEmpty()) {
            return interfaces;
        }
        Set<String> result = new LinkedHashSet<>();
        for (Directive directive : directives) {
            if (subgraph.equals(subgraphArgument(directive, typeName))) {
                String interfaceName = stringArgument(directive, "interface");
                if (!interfaces.contains(interfaceName)) {
                    throw new SchemaError("type " + typeName + " does not implement " + interfaceName + " in the composed schema");
                }
                result.add(interfaceName);
            }
        }
        return result;
    }

    private Set<String> unionMembers(String typeName, Subgraph subgraph, TypeKind kind, Set<String> possibleTypes) {
        if (kind != TypeKind.UNION) {
            return Collections.emptySet();
        }
        List<Directive> directives = typeDirectives(typeName, JOIN_UNION_MEMBER);
        if (directives.isEmpty()) {
            return possibleTypes;
        }
        Set<String> result = new LinkedHashSet<>();
        for (Directive directive : directives) {
            if (subgraph.equals(subgraphArgument(directive, typeName))) {
                String member = stringArgument(directive, "member");
                if (!possibleTypes.contains(member)) {
                    throw new SchemaError(member + " is not a member of union " + typeName);
                }
                result.add(member);
            }
        }
        return result;
    }

    private void validateKey(GraphQLNamedType type, FieldSet key, String keyText) {
        if (key.isEmpty()) {
            throw new SchemaError("empty key on " + type.getName());
        }
        if (!(type instanceof GraphQLFieldsContainer)) {
            throw new SchemaError("key '" + keyText + "' declared on " + type.getName() + " which has no fields");
        }
        GraphQLFieldsContainer container = (GraphQLFieldsContainer) type;
        for (FieldSet.Entry entry : key.getEntries()) {
            if (!entry.isField() || container.getFieldDefinition(entry.getFieldName()) == null) {
                throw new SchemaError("malformed key '" + keyText + "' on " + type.getName() + ": unknown field " + entry);
            }
        }
    }

    private List<FieldOwnership> readFieldOwnerships(String typeName,
                                                     String fieldName,
                                                     FieldDefinition astField,
                                                     Map<Subgraph, TypeOwnership> typeOwnerships) {
        List<Directive> directives = astField == null ? Collections.emptyList() : astField.getDirectives(JOIN_FIELD);
        Map<Subgraph, FieldOwnership> result = new LinkedHashMap<>();
        if (directives.isEmpty()) {
            for (Subgraph subgraph : typeOwnerships.keySet()) {
                result.put(subgraph, FieldOwnership.newFieldOwnership().subgraph(subgraph).build());
            }
            return new ArrayList<>(result.values());
        }
        for (Directive directive : directives) {
            Subgraph subgraph = subgraphArgument(directive, typeName + "." + fieldName);
            if (subgraph == null) {
                // declared by no subgraph, resolvable only through other means (e.g. interface objects)
                continue;
            }
            if (result.containsKey(subgraph)) {
                throw new SchemaError("duplicate @" + JOIN_FIELD + " for " + typeName + "." + fieldName + " in subgraph " + subgraph.getName());
            }
            String requires = stringArgument(directive, "requires");
            String provides = stringArgument(directive, "provides");
            FieldOwnership ownership = FieldOwnership.newFieldOwnership()
                    .subgraph(subgraph)
                    .external(booleanArgument(directive, "external", false))
                    .requires(requires == null ? null : FieldSet.parse(requires))
                    .provides(provides == null ? null : FieldSet.parse(provides))
                    .override(stringArgument(directive, "override"))
                    .overridden(booleanArgument(directive, "usedOverridden", false))
                    .build();
            result.put(subgraph, ownership);
        }

        for (FieldOwnership ownership : new ArrayList<>(result.values())) {
            if (ownership.getOverride() == null) {
                continue;
            }
            Subgraph from = subgraphsByName.get(ownership.getOverride());
            if (from == null) {
                from = subgraphsByToken.get(ownership.getOverride());
            }
            if (from == null) {
                throw new SchemaError(typeName + "." + fieldName + " overrides unknown subgraph '" + ownership.getOverride() + "'");
            }
            FieldOwnership previous = result.get(from);
            if (previous != null) {
                result.put(from, previous.transform(builder -> builder.overridden(true)));
            }
        }
        return new ArrayList<>(result.values());
    }

    private void validateExternalFields(Map<String, TypeDef> types) {
        Set<String> references = new LinkedHashSet<>();
        for (TypeDef typeDef : types.values()) {
            for (TypeOwnership typeOwnership : typeDef.getOwnerships().values()) {
                for (TypeOwnership.Key key : typeOwnership.getKeys()) {
                    collectReferences(key.getFields(), typeDef.getName(), typeOwnership.getSubgraph(), types, references);
                }
            }
            for (FieldDef fieldDef : typeDef.getFields().values()) {
                for (FieldOwnership ownership : fieldDef.getOwnerships()) {
                    if (ownership.getRequires() != null) {
                        collectReferences(ownership.getRequires(), typeDef.getName(), ownership.getSubgraph(), types, references);
                    }
                    if (ownership.getProvides() != null) {
                        collectReferences(ownership.getProvides(), fieldDef.getReturnTypeName(), ownership.getSubgraph(), types, references);
                    }
                }
            }
        }
        for (TypeDef typeDef : types.values()) {
            for (FieldDef fieldDef : typeDef.getFields().values()) {
                for (FieldOwnership ownership : fieldDef.getOwnerships()) {
                    if (ownership.isExternal() && !references.contains(reference(ownership.getSubgraph(), typeDef.getName(), fieldDef.getName()))) {
                        throw new SchemaError("field " + fieldDef + " is external in subgraph " + ownership.getSubgraph().getName()
                                + " but no @key, @requires or @provides there references it");
                    }
                }
            }
        }
    }

    private void collectReferences(FieldSet fieldSet, String typeName, Subgraph subgraph, Map<String, TypeDef> types, Set<String> references) {
        for (FieldSet.Entry entry : fieldSet.getEntries()) {
            if (!entry.isField()) {
                collectReferences(entry.getChildren(), entry.getTypeCondition(), subgraph, types, references);
                continue;
            }
            references.add(reference(subgraph, typeName, entry.getFieldName()));
            TypeDef typeDef = types.get(typeName);
            FieldDef fieldDef = typeDef == null ? null : typeDef.getField(entry.getFieldName());
            if (fieldDef != null && !entry.getChildren().isEmpty()) {
                collectReferences(entry.getChildren(), fieldDef.getReturnTypeName(), subgraph, types, references);
            }
        }
    }

    private static String reference(Subgraph subgraph, String typeName, String fieldName) {
        return subgraph.getName() + "|" + typeName + "|" + fieldName;
    }

    private List<Directive> typeDirectives(String typeName, String directiveName) {
        List<Directive> result = new ArrayList<>();
        for (TypeDefinition<?> definition : typeDefinitions(typeName)) {
            result.addAll(definition.getDirectives(directiveName));
        }
        return result;
    }

    private List<TypeDefinition<?>> typeDefinitions(String typeName) {
        List<TypeDefinition<?>> result = new ArrayList<>();
        registry.getType(typeName).ifPresent(result::add);
        result.addAll(registry.objectTypeExtensions().getOrDefault(typeName, Collections.emptyList()));
        result.addAll(registry.interfaceTypeExtensions().getOrDefault(typeName, Collections.emptyList()));
        result.addAll(registry.unionTypeExtensions().getOrDefault(typeName, Collections.emptyList()));
        result.addAll(registry.enumTypeExtensions().getOrDefault(typeName, Collections.emptyList()));
        result.addAll(registry.scalarTypeExtensions().getOrDefault(typeName, Collections.emptyList()));
        result.addAll(registry.inputObjectTypeExtensions().getOrDefault(typeName, Collections.emptyList()));
        return result;
    }

    private Map<String, FieldDefinition> astFieldDefinitions(String typeName) {
        Map<String, FieldDefinition> result = new LinkedHashMap<>();
        for (TypeDefinition<?> definition : typeDefinitions(typeName)) {
            List<FieldDefinition> fieldDefinitions;
            if (definition instanceof ObjectTypeDefinition) {
                fieldDefinitions = ((ObjectTypeDefinition) definition).getFieldDefinitions();
            } else if (definition instanceof InterfaceTypeDefinition) {
                fieldDefinitions = ((InterfaceTypeDefinition) definition).getFieldDefinitions();
            } else {
                continue;
            }
            for (FieldDefinition fieldDefinition : fieldDefinitions) {
                result.putIfAbsent(fieldDefinition.getName(), fieldDefinition);
            }
        }
        return result;
    }

    private Subgraph subgraphArgument(Directive directive, String location) {
        Argument argument = directive.getArgument("graph");
        if (argument == null || argument.getValue() instanceof NullValue) {
            return null;
        }
        Value<?> value = argument.getValue();
        if (!(value instanceof EnumValue)) {
            throw new SchemaError("@" + directive.getName() + " on " + location + " has a malformed graph argument");
        }
        Subgraph subgraph = subgraphsByToken.get(((EnumValue) value).getName());
        if (subgraph == null) {
            throw new SchemaError("@" + directive.getName() + " on " + location + " references unknown subgraph " + ((EnumValue) value).getName());
        }
        return subgraph;
    }

    private static String stringArgument(Directive directive, String name) {
        Argument argument = directive.getArgument(name);
        if (argument == null || argument.getValue() instanceof NullValue) {
            return null;
        }
        Value<?> value = argument.getValue();
        if (value instanceof StringValue) {
            return ((StringValue) value).getValue();
        }
        if (value instanceof EnumValue) {
            return ((EnumValue) value).getName();
        }
        throw new SchemaError("argument '" + name + "' of @" + directive.getName() + " must be a string");
    }

    private static boolean booleanArgument(Directive directive, String name, boolean defaultValue) {
        Argument argument = directive.getArgument(name);
        if (argument == null || argument.getValue() instanceof NullValue) {
            return defaultValue;
        }
        Value<?> value = argument.getValue();
        if (!(value instanceof BooleanValue)) {
            throw new SchemaError("argument '" + name + "' of @" + directive.getName() + " must be a boolean");
        }
        return ((BooleanValue) value).isValue();
    }

    private static TypeKind kindOf(GraphQLNamedType type) {
        if (type instanceof GraphQLObjectType) {
            return TypeKind.OBJECT;
        }
        if (type instanceof GraphQLInterfaceType) {
            return TypeKind.INTERFACE;
        }
        if (type instanceof GraphQLUnionType) {
            return TypeKind.UNION;
        }
        if (type instanceof graphql.schema.GraphQLEnumType) {
            return TypeKind.ENUM;
        }
        if (type instanceof graphql.schema.GraphQLInputObjectType) {
            return TypeKind.INPUT_OBJECT;
        }
        return TypeKind.SCALAR;
    }
}
