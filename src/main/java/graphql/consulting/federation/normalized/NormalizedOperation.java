package graphql.consulting.federation.normalized;

import graphql.Internal;
import graphql.language.OperationDefinition;
import graphql.language.VariableDefinition;
import graphql.schema.GraphQLObjectType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The canonical form of a client operation the planner consumes: fragments inlined, static
 * conditions applied, fields merged. The planner never looks at the query text again.
 */
@Internal
public class NormalizedOperation {

    private final OperationDefinition.Operation operation;
    private final String operationName;
    private final GraphQLObjectType rootType;
    private final List<NormalizedField> topLevelFields;
    private final List<VariableDefinition> variableDefinitions;

    public NormalizedOperation(OperationDefinition.Operation operation,
                               String operationName,
                               GraphQLObjectType rootType,
                               List<NormalizedField> topLevelFields,
                               List<VariableDefinition> variableDefinitions) {
        this.operation = operation;
        this.operationName = operationName;
        this.rootType = rootType;
        this.topLevelFields = Collections.unmodifiableList(new ArrayList<>(topLevelFields));
        this.variableDefinitions = Collections.unmodifiableList(new ArrayList<>(variableDefinitions));
    }

    public OperationDefinition.Operation getOperation() {
        return operation;
    }

    /**
     * @return the client operation name or null for anonymous operations
     */
    public String getOperationName() {
        return operationName;
    }

    public GraphQLObjectType getRootType() {
        return rootType;
    }

    public List<NormalizedField> getTopLevelFields() {
        return topLevelFields;
    }

    public List<VariableDefinition> getVariableDefinitions() {
        return variableDefinitions;
    }

    public VariableDefinition getVariableDefinition(String name) {
        for (VariableDefinition variableDefinition : variableDefinitions) {
            if (variableDefinition.getName().equals(name)) {
                return variableDefinition;
            }
        }
        return null;
    }

    public int getFieldCount() {
        int[] count = new int[]{topLevelFields.size()};
        for (NormalizedField topLevelField : topLevelFields) {
            topLevelField.traverseSubTree(child -> count[0]++);
        }
        return count[0];
    }
}
