package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.normalized.NormalizedField;
import graphql.consulting.federation.schema.FieldSet;
import graphql.introspection.Introspection;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;

import java.util.ArrayList;
import java.util.List;

import static graphql.Assert.assertNotNull;
import static graphql.Assert.assertTrue;

/**
 * Turns key, {@code requires} and {@code provides} field sets into normalized fields, so they can be
 * planned like fields the client selected.
 */
@Internal
public class FieldSetSelections {

    private FieldSetSelections() {
    }

    /**
     * Fragments are unwrapped into fields selected on the fragment's type; the planner narrows to them
     * the same way it does for client fragments.
     */
    public static List<NormalizedField> toNormalizedFields(GraphQLSchema apiSchema, String typeName, FieldSet fieldSet) {
        List<NormalizedField> result = new ArrayList<>();
        collect(apiSchema, typeName, fieldSet, 0, result);
        return result;
    }

    private static void collect(GraphQLSchema apiSchema, String typeName, FieldSet fieldSet, int level, List<NormalizedField> result) {
        for (FieldSet.Entry entry : fieldSet.getEntries()) {
            if (!entry.isField()) {
                collect(apiSchema, entry.getTypeCondition(), entry.getChildren(), level, result);
                continue;
            }
            result.add(toNormalizedField(apiSchema, typeName, entry, level));
        }
    }

    private static NormalizedField toNormalizedField(GraphQLSchema apiSchema, String typeName, FieldSet.Entry entry, int level) {
        GraphQLType type = assertNotNull(apiSchema.getType(typeName), () -> "unknown type " + typeName);
        assertTrue(type instanceof GraphQLCompositeType, () -> typeName + " is not a composite type");
        GraphQLCompositeType parentType = (GraphQLCompositeType) type;
        GraphQLFieldDefinition fieldDefinition;
        if (Introspection.TypeNameMetaFieldDef.getName().equals(entry.getFieldName())) {
            fieldDefinition = Introspection.TypeNameMetaFieldDef;
        } else {
            assertTrue(parentType instanceof GraphQLFieldsContainer, () -> typeName + " has no fields");
            fieldDefinition = assertNotNull(((GraphQLFieldsContainer) parentType).getFieldDefinition(entry.getFieldName()),
                    () -> "unknown field " + typeName + "." + entry.getFieldName());
        }
        List<NormalizedField> children = new ArrayList<>();
        if (!entry.getChildren().isEmpty()) {
            String returnTypeName = ((GraphQLNamedType) GraphQLTypeUtil.unwrapAll(fieldDefinition.getType())).getName();
            collect(apiSchema, returnTypeName, entry.getChildren(), level + 1, children);
        }
        NormalizedField normalizedField = NormalizedField.newNormalizedField()
                .parentType(parentType)
                .fieldDefinition(fieldDefinition)
                .children(children)
                .level(level)
                .build();
        for (NormalizedField child : children) {
            child.replaceParent(normalizedField);
        }
        return normalizedField;
    }
}
