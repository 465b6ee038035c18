package graphql.consulting.federation.normalized;

import graphql.Internal;
import graphql.introspection.Introspection;
import graphql.language.Argument;
import graphql.language.AstPrinter;
import graphql.language.BooleanValue;
import graphql.language.Directive;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.SourceLocation;
import graphql.language.TypeName;
import graphql.language.Value;
import graphql.language.VariableReference;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLNamedOutputType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.GraphQLUnionType;

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
 * Collects the fields of one or more selection sets selected at the same position, inlining fragments
 * and merging fields that end up with the same response key on the same type.
 */
@Internal
public class FieldCollector {

    private static final String SKIP = "skip";
    private static final String INCLUDE = "include";

    /**
     * A collected field without children together with all AST fields merged into it.
     */
    public static class CollectedField {
        private final NormalizedField normalizedField;
        private final List<Field> astFields = new ArrayList<>();

        CollectedField(NormalizedField normalizedField, Field first) {
            this.normalizedField = normalizedField;
            this.astFields.add(first);
        }

        public NormalizedField getNormalizedField() {
            return normalizedField;
        }

        public List<Field> getAstFields() {
            return astFields;
        }

        public List<SelectionSet> getSelectionSets() {
            List<SelectionSet> result = new ArrayList<>();
            for (Field astField : astFields) {
                if (astField.getSelectionSet() != null) {
                    result.add(astField.getSelectionSet());
                }
            }
            return result;
        }
    }

    public List<CollectedField> collectFields(FieldCollectorParameters parameters,
                                              GraphQLCompositeType positionType,
                                              List<SelectionSet> selectionSets,
                                              int level) {
        Map<String, CollectedField> result = new LinkedHashMap<>();
        for (SelectionSet selectionSet : selectionSets) {
            collect(parameters, selectionSet, positionType, Collections.emptyList(), new ArrayDeque<>(), result, level);
        }
        return new ArrayList<>(result.values());
    }

    private void collect(FieldCollectorParameters parameters,
                         SelectionSet selectionSet,
                         GraphQLCompositeType scope,
                         List<Directive> conditions,
                         Deque<String> fragmentStack,
                         Map<String, CollectedField> result,
                         int level) {
        for (Selection<?> selection : selectionSet.getSelections()) {
            if (selection instanceof Field) {
                collectField(parameters, (Field) selection, scope, conditions, result, level);
            } else if (selection instanceof InlineFragment) {
                InlineFragment inlineFragment = (InlineFragment) selection;
                List<Directive> fragmentConditions = variableConditions(parameters, inlineFragment.getDirectives(), inlineFragment.getSourceLocation());
                if (fragmentConditions == null) {
                    continue;
                }
                TypeName typeCondition = inlineFragment.getTypeCondition();
                List<GraphQLCompositeType> scopes = narrow(parameters, scope, typeCondition == null ? null : typeCondition.getName(), inlineFragment.getSourceLocation());
                for (GraphQLCompositeType narrowed : scopes) {
                    collect(parameters, inlineFragment.getSelectionSet(), narrowed, concat(conditions, fragmentConditions), fragmentStack, result, level);
                }
            } else if (selection instanceof FragmentSpread) {
                FragmentSpread fragmentSpread = (FragmentSpread) selection;
                List<Directive> spreadConditions = variableConditions(parameters, fragmentSpread.getDirectives(), fragmentSpread.getSourceLocation());
                if (spreadConditions == null) {
                    continue;
                }
                FragmentDefinition fragmentDefinition = parameters.getFragmentsByName().get(fragmentSpread.getName());
                if (fragmentDefinition == null) {
                    throw new OperationError("unknown fragment '" + fragmentSpread.getName() + "'", fragmentSpread.getSourceLocation());
                }
                if (fragmentStack.contains(fragmentSpread.getName())) {
                    throw new OperationError("fragment '" + fragmentSpread.getName() + "' spreads itself", fragmentSpread.getSourceLocation());
                }
                fragmentStack.push(fragmentSpread.getName());
                List<GraphQLCompositeType> scopes = narrow(parameters, scope, fragmentDefinition.getTypeCondition().getName(), fragmentSpread.getSourceLocation());
                for (GraphQLCompositeType narrowed : scopes) {
                    collect(parameters, fragmentDefinition.getSelectionSet(), narrowed, concat(conditions, spreadConditions), fragmentStack, result, level);
                }
                fragmentStack.pop();
            }
        }
    }

    private void collectField(FieldCollectorParameters parameters,
                              Field field,
                              GraphQLCompositeType scope,
                              List<Directive> conditions,
                              Map<String, CollectedField> result,
                              int level) {
        List<Directive> ownConditions = variableConditions(parameters, field.getDirectives(), field.getSourceLocation());
        if (ownConditions == null) {
            return;
        }
        GraphQLFieldDefinition fieldDefinition = fieldDefinition(parameters.getGraphQLSchema(), scope, field);
        GraphQLType unwrapped = GraphQLTypeUtil.unwrapAll(fieldDefinition.getType());
        boolean composite = unwrapped instanceof GraphQLCompositeType;
        if (composite && field.getSelectionSet() == null) {
            throw new OperationError("field '" + field.getName() + "' of type " + GraphQLTypeUtil.simplePrint(fieldDefinition.getType())
                    + " must have a selection of subfields", field.getSourceLocation());
        }
        if (!composite && field.getSelectionSet() != null) {
            throw new OperationError("field '" + field.getName() + "' of type " + GraphQLTypeUtil.simplePrint(fieldDefinition.getType())
                    + " must not have a selection", field.getSourceLocation());
        }

        String resultKey = field.getAlias() != null ? field.getAlias() : field.getName();
        List<Directive> fieldConditions = concat(conditions, ownConditions);
        for (CollectedField collected : result.values()) {
            NormalizedField other = collected.getNormalizedField();
            if (other.getResultKey().equals(resultKey) && other.getParentTypeName().equals(scope.getName())) {
                if (!other.getName().equals(field.getName()) || !printArguments(other.getArguments()).equals(printArguments(field.getArguments()))) {
                    throw new OperationError("fields '" + resultKey + "' conflict: they select different fields or arguments", field.getSourceLocation());
                }
            }
        }

        String mergeKey = resultKey + ":" + scope.getName() + ":" + printConditions(fieldConditions);
        CollectedField existing = result.get(mergeKey);
        if (existing != null) {
            existing.getAstFields().add(field);
            return;
        }
        NormalizedField normalizedField = NormalizedField.newNormalizedField()
                .alias(field.getAlias())
                .arguments(field.getArguments())
                .conditions(fieldConditions)
                .parentType(scope)
                .fieldDefinition(fieldDefinition)
                .level(level)
                .build();
        result.put(mergeKey, new CollectedField(normalizedField, field));
    }

    private GraphQLFieldDefinition fieldDefinition(GraphQLSchema schema, GraphQLCompositeType scope, Field field) {
        String name = field.getName();
        if (Introspection.TypeNameMetaFieldDef.getName().equals(name)) {
            return Introspection.TypeNameMetaFieldDef;
        }
        if (scope == schema.getQueryType()) {
            if (Introspection.SchemaMetaFieldDef.getName().equals(name)) {
                return Introspection.SchemaMetaFieldDef;
            }
            if (Introspection.TypeMetaFieldDef.getName().equals(name)) {
                return Introspection.TypeMetaFieldDef;
            }
        }
        GraphQLFieldDefinition fieldDefinition = null;
        if (scope instanceof GraphQLFieldsContainer) {
            fieldDefinition = ((GraphQLFieldsContainer) scope).getFieldDefinition(name);
        }
        if (fieldDefinition == null) {
            throw new OperationError("unknown field '" + name + "' on type " + scope.getName(), field.getSourceLocation());
        }
        return fieldDefinition;
    }

    /**
     * The types fields inside a fragment with the given type condition are recorded against: the
     * enclosing type when the condition covers it, the condition when it is an object type, otherwise
     * every object type both have in common.
     */
    private List<GraphQLCompositeType> narrow(FieldCollectorParameters parameters, GraphQLCompositeType scope, String typeCondition, SourceLocation location) {
        if (typeCondition == null || typeCondition.equals(scope.getName())) {
            return Collections.singletonList(scope);
        }
        GraphQLSchema schema = parameters.getGraphQLSchema();
        GraphQLType conditionType = schema.getType(typeCondition);
        if (!(conditionType instanceof GraphQLCompositeType)) {
            throw new OperationError("unknown type condition '" + typeCondition + "'", location);
        }
        GraphQLCompositeType condition = (GraphQLCompositeType) conditionType;
        List<GraphQLObjectType> scopeTypes = possibleObjectTypes(schema, scope);
        List<GraphQLObjectType> conditionTypes = possibleObjectTypes(schema, condition);
        List<GraphQLCompositeType> intersection = new ArrayList<>();
        for (GraphQLObjectType objectType : scopeTypes) {
            if (conditionTypes.contains(objectType)) {
                intersection.add(objectType);
            }
        }
        if (intersection.isEmpty()) {
            throw new OperationError("fragment on " + typeCondition + " can never apply to " + scope.getName(), location);
        }
        if (condition instanceof GraphQLObjectType) {
            return Collections.singletonList(condition);
        }
        if (scope instanceof GraphQLObjectType) {
            return Collections.singletonList(scope);
        }
        // fields of another abstract type are recorded per concrete type
        return intersection;
    }

    static List<GraphQLObjectType> possibleObjectTypes(GraphQLSchema schema, GraphQLCompositeType type) {
        List<GraphQLObjectType> result = new ArrayList<>();
        if (type instanceof GraphQLObjectType) {
            result.add((GraphQLObjectType) type);
        } else if (type instanceof GraphQLInterfaceType) {
            result.addAll(schema.getImplementations((GraphQLInterfaceType) type));
        } else if (type instanceof GraphQLUnionType) {
            for (GraphQLNamedOutputType member : ((GraphQLUnionType) type).getTypes()) {
                result.add((GraphQLObjectType) member);
            }
        }
        result.sort((t1, t2) -> t1.getName().compareTo(t2.getName()));
        return result;
    }

    /**
     * @return the conditions that depend on variables, or null if the selection is statically excluded
     */
    private List<Directive> variableConditions(FieldCollectorParameters parameters, List<Directive> directives, SourceLocation location) {
        List<Directive> result = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Directive directive : directives) {
            String name = directive.getName();
            if (!SKIP.equals(name) && !INCLUDE.equals(name)) {
                if (parameters.getGraphQLSchema().getDirective(name) == null) {
                    throw new OperationError("unknown directive '@" + name + "'", directive.getSourceLocation());
                }
                continue;
            }
            if (!seen.add(name)) {
                throw new OperationError("directive '@" + name + "' used more than once", directive.getSourceLocation());
            }
            Argument ifArgument = directive.getArgument("if");
            if (ifArgument == null) {
                throw new OperationError("directive '@" + name + "' requires the 'if' argument", directive.getSourceLocation());
            }
            Value<?> value = ifArgument.getValue();
            if (value instanceof BooleanValue) {
                boolean condition = ((BooleanValue) value).isValue();
                if (SKIP.equals(name) == condition) {
                    return null;
                }
            } else if (value instanceof VariableReference) {
                result.add(directive);
            } else {
                throw new OperationError("argument 'if' of '@" + name + "' must be a boolean", location);
            }
        }
        return result;
    }

    private static List<Directive> concat(List<Directive> first, List<Directive> second) {
        if (second.isEmpty()) {
            return first;
        }
        List<Directive> result = new ArrayList<>(first);
        for (Directive directive : second) {
            if (!printConditions(result).contains(AstPrinter.printAst(directive))) {
                result.add(directive);
            }
        }
        return result;
    }

    private static String printConditions(List<Directive> conditions) {
        StringBuilder sb = new StringBuilder();
        for (Directive condition : conditions) {
            sb.append(AstPrinter.printAst(condition)).append(' ');
        }
        return sb.toString();
    }

    private static String printArguments(List<Argument> arguments) {
        List<String> printed = new ArrayList<>();
        for (Argument argument : arguments) {
            printed.add(AstPrinter.printAst(argument));
        }
        Collections.sort(printed);
        return String.join(",", printed);
    }
}
