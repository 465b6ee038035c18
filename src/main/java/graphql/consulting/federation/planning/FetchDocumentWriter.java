package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.normalized.NormalizedOperation;
import graphql.language.Argument;
import graphql.language.AstPrinter;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.ListType;
import graphql.language.NonNullType;
import graphql.language.OperationDefinition;
import graphql.language.SelectionSet;
import graphql.language.TypeName;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the subgraph documents of fetch groups. Root groups select the root fields directly, entity
 * groups select through {@code _entities} and declare the client variables they use after
 * {@code $representations}.
 */
@Internal
public class FetchDocumentWriter {

    static final String REPRESENTATIONS = "representations";
    static final String ENTITIES_FIELD = "_entities";

    private final NormalizedOperation operation;

    public FetchDocumentWriter(NormalizedOperation operation) {
        this.operation = operation;
    }

    public String getClientOperationName() {
        return operation.getOperationName();
    }

    public String getOperationKind(FetchGroup group) {
        OperationDefinition.Operation kind = group.isEntity() ? OperationDefinition.Operation.QUERY : operation.getOperation();
        return kind.name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the client variables the group uses, in the order the client operation declares them
     */
    public List<String> getVariableUsages(FetchGroup group) {
        List<String> result = new ArrayList<>();
        for (VariableDefinition variableDefinition : operation.getVariableDefinitions()) {
            if (group.getVariableUsages().contains(variableDefinition.getName())) {
                result.add(variableDefinition.getName());
            }
        }
        return result;
    }

    public List<InlineFragment> getRequires(FetchGroup group) {
        List<InlineFragment> result = new ArrayList<>();
        for (Map.Entry<String, SelectionSetBuilder> input : group.getInputs().entrySet()) {
            result.add(InlineFragment.newInlineFragment()
                    .typeCondition(new TypeName(input.getKey()))
                    .selectionSet(input.getValue().toAst())
                    .build());
        }
        return result;
    }

    public String write(FetchGroup group, String operationName) {
        List<VariableDefinition> variableDefinitions = new ArrayList<>();
        SelectionSet selectionSet;
        OperationDefinition.Operation kind;
        if (group.isEntity()) {
            kind = OperationDefinition.Operation.QUERY;
            variableDefinitions.add(VariableDefinition.newVariableDefinition(REPRESENTATIONS,
                    new NonNullType(new ListType(new NonNullType(new TypeName("_Any"))))).build());
            Field entities = Field.newField(ENTITIES_FIELD)
                    .arguments(Collections.singletonList(new Argument(REPRESENTATIONS, new VariableReference(REPRESENTATIONS))))
                    .selectionSet(group.getSelection().toAst())
                    .build();
            selectionSet = SelectionSet.newSelectionSet().selection(entities).build();
        } else {
            kind = operation.getOperation();
            selectionSet = group.getSelection().toAst();
        }
        for (String variableName : getVariableUsages(group)) {
            variableDefinitions.add(operation.getVariableDefinition(variableName));
        }
        OperationDefinition operationDefinition = OperationDefinition.newOperationDefinition()
                .operation(kind)
                .name(operationName)
                .variableDefinitions(variableDefinitions)
                .selectionSet(selectionSet)
                .build();
        return AstPrinter.printAstCompact(Document.newDocument().definition(operationDefinition).build());
    }
}
