package graphql.consulting.federation.normalized;

import graphql.Internal;
import graphql.consulting.federation.normalized.FieldCollector.CollectedField;
import graphql.introspection.Introspection;
import graphql.language.Definition;
import graphql.language.Document;
import graphql.language.FragmentDefinition;
import graphql.language.OperationDefinition;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Internal
public class NormalizedOperationFactory {
    private static final Logger log = LoggerFactory.getLogger(NormalizedOperationFactory.class);

    public static NormalizedOperation createNormalizedOperation(GraphQLSchema graphQLSchema,
                                                                Document document,
                                                                String operationName) {
        return new NormalizedOperationFactory().createNormalizedOperationImpl(graphQLSchema, document, operationName);
    }

    /**
     * Creates the normalized tree for the selected operation of the document
     */
    private NormalizedOperation createNormalizedOperationImpl(GraphQLSchema graphQLSchema, Document document, String operationName) {
        Map<String, FragmentDefinition> fragmentsByName = new LinkedHashMap<>();
        List<OperationDefinition> operations = new ArrayList<>();
        for (Definition<?> definition : document.getDefinitions()) {
            if (definition instanceof FragmentDefinition) {
                FragmentDefinition fragmentDefinition = (FragmentDefinition) definition;
                if (fragmentsByName.put(fragmentDefinition.getName(), fragmentDefinition) != null) {
                    throw new OperationError("fragment '" + fragmentDefinition.getName() + "' is defined more than once", fragmentDefinition.getSourceLocation());
                }
            } else if (definition instanceof OperationDefinition) {
                operations.add((OperationDefinition) definition);
            }
        }
        OperationDefinition operationDefinition = selectOperation(operations, operationName);
        GraphQLObjectType rootType = rootType(graphQLSchema, operationDefinition);

        FieldCollector fieldCollector = new FieldCollector();
        FieldCollectorParameters parameters = FieldCollectorParameters
                .newParameters()
                .fragments(fragmentsByName)
                .schema(graphQLSchema)
                .build();

        List<CollectedField> roots = fieldCollector.collectFields(parameters, rootType, Collections.singletonList(operationDefinition.getSelectionSet()), 1);
        List<NormalizedField> realRoots = new ArrayList<>();
        for (CollectedField root : roots) {
            String name = root.getNormalizedField().getName();
            if (Introspection.SchemaMetaFieldDef.getName().equals(name) || Introspection.TypeMetaFieldDef.getName().equals(name)) {
                log.debug("dropping introspection field {}", root.getNormalizedField().getResultKey());
                continue;
            }
            NormalizedField realRoot = buildFieldWithChildren(root, fieldCollector, parameters, 1);
            fixUpParentReference(realRoot);
            realRoots.add(realRoot);
        }

        NormalizedOperation result = new NormalizedOperation(operationDefinition.getOperation(),
                operationDefinition.getName(),
                rootType,
                realRoots,
                operationDefinition.getVariableDefinitions());
        log.debug("normalized operation {} into {} fields", operationDefinition.getName(), result.getFieldCount());
        return result;
    }

    private OperationDefinition selectOperation(List<OperationDefinition> operations, String operationName) {
        if (operations.isEmpty()) {
            throw new OperationError("document does not contain an operation");
        }
        if (operationName == null) {
            if (operations.size() > 1) {
                throw new OperationError("document contains several operations, an operation name is required");
            }
            return operations.get(0);
        }
        for (OperationDefinition operation : operations) {
            if (operationName.equals(operation.getName())) {
                return operation;
            }
        }
        throw new OperationError("unknown operation named '" + operationName + "'");
    }

    private GraphQLObjectType rootType(GraphQLSchema graphQLSchema, OperationDefinition operationDefinition) {
        GraphQLObjectType rootType;
        switch (operationDefinition.getOperation()) {
            case MUTATION:
                rootType = graphQLSchema.getMutationType();
                break;
            case SUBSCRIPTION:
                rootType = graphQLSchema.getSubscriptionType();
                break;
            default:
                rootType = graphQLSchema.getQueryType();
        }
        if (rootType == null) {
            throw new OperationError("schema does not support " + operationDefinition.getOperation().name().toLowerCase() + " operations",
                    operationDefinition.getSourceLocation());
        }
        return rootType;
    }

    private void fixUpParentReference(NormalizedField rootNormalizedField) {
        for (NormalizedField child : rootNormalizedField.getChildren()) {
            child.replaceParent(rootNormalizedField);
        }
    }

    private NormalizedField buildFieldWithChildren(CollectedField collectedField,
                                                   FieldCollector fieldCollector,
                                                   FieldCollectorParameters parameters,
                                                   int curLevel) {
        NormalizedField field = collectedField.getNormalizedField();
        GraphQLType returnType = GraphQLTypeUtil.unwrapAll(field.getType());
        if (!(returnType instanceof GraphQLCompositeType)) {
            return field;
        }
        List<CollectedField> childrenWithoutChildren = fieldCollector.collectFields(parameters,
                (GraphQLCompositeType) returnType,
                collectedField.getSelectionSets(),
                curLevel + 1);
        List<NormalizedField> realChildren = new ArrayList<>();
        for (CollectedField childWithoutChildren : childrenWithoutChildren) {
            NormalizedField realChild = buildFieldWithChildren(childWithoutChildren, fieldCollector, parameters, curLevel + 1);
            fixUpParentReference(realChild);
            realChildren.add(realChild);
        }
        return field.transform(builder -> builder.children(realChildren));
    }
}
