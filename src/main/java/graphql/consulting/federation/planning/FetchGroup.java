package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.plan.InputRewrite;
import graphql.consulting.federation.schema.ComposedSchema;
import graphql.consulting.federation.schema.FieldSet;
import graphql.consulting.federation.schema.Subgraph;
import graphql.execution.ResultPath;
import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.Directive;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.Value;
import graphql.language.VariableReference;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static graphql.Assert.assertTrue;

/**
 * One planned remote operation against one subgraph, before it is turned into a fetch node.
 * <p>
 * A root group selects fields of a root operation type. An entity group selects through
 * {@code _entities}: its inputs describe, per type of the incoming objects, the representation built
 * from the data at its merge path.
 */
@Internal
public class FetchGroup {

    private final int id;
    private final Subgraph subgraph;
    private final boolean entity;
    private final boolean requiresGroup;
    private final ResultPath mergePath;
    private final SelectionSetBuilder selection = new SelectionSetBuilder();
    private final Map<String, SelectionSetBuilder> inputs = new LinkedHashMap<>();
    private final Set<InputRewrite> inputRewrites = new LinkedHashSet<>();
    private final Set<String> variableUsages = new LinkedHashSet<>();
    private final Set<FetchGroup> dependencies = new LinkedHashSet<>();

    public FetchGroup(int id, Subgraph subgraph, boolean entity, boolean requiresGroup, ResultPath mergePath) {
        this.id = id;
        this.subgraph = subgraph;
        this.entity = entity;
        this.requiresGroup = requiresGroup;
        this.mergePath = mergePath;
    }

    public int getId() {
        return id;
    }

    public Subgraph getSubgraph() {
        return subgraph;
    }

    public boolean isEntity() {
        return entity;
    }

    /**
     * @return true for groups opened to resolve a field with {@code requires}
     */
    public boolean isRequiresGroup() {
        return requiresGroup;
    }

    public ResultPath getMergePath() {
        return mergePath;
    }

    public SelectionSetBuilder getSelection() {
        return selection;
    }

    public Map<String, SelectionSetBuilder> getInputs() {
        return inputs;
    }

    public void addInput(String typeName, FieldSet fields) {
        assertTrue(entity, () -> "only entity groups take representations");
        inputs.computeIfAbsent(typeName, ignored -> new SelectionSetBuilder()).addFieldSet(fields);
    }

    /**
     * @return true if objects of the type reach this group: root groups see everything, entity groups
     * only the types they take representations for
     */
    public boolean acceptsType(ComposedSchema schema, String typeName) {
        if (!entity) {
            return true;
        }
        for (String inputType : inputs.keySet()) {
            if (inputType.equals(typeName) || schema.isPossibleType(inputType, typeName)) {
                return true;
            }
        }
        return false;
    }

    public Set<InputRewrite> getInputRewrites() {
        return inputRewrites;
    }

    public void addInputRewrite(InputRewrite inputRewrite) {
        inputRewrites.add(inputRewrite);
    }

    public Set<String> getVariableUsages() {
        return variableUsages;
    }

    public void addVariableUsages(List<Argument> arguments, List<Directive> directives) {
        for (Argument argument : arguments) {
            collectVariables(argument.getValue());
        }
        for (Directive directive : directives) {
            for (Argument argument : directive.getArguments()) {
                collectVariables(argument.getValue());
            }
        }
    }

    private void collectVariables(Value<?> value) {
        if (value instanceof VariableReference) {
            variableUsages.add(((VariableReference) value).getName());
        } else if (value instanceof ArrayValue) {
            for (Value<?> element : ((ArrayValue) value).getValues()) {
                collectVariables(element);
            }
        } else if (value instanceof ObjectValue) {
            for (ObjectField objectField : ((ObjectValue) value).getObjectFields()) {
                collectVariables(objectField.getValue());
            }
        }
    }

    public Set<FetchGroup> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public void addDependency(FetchGroup dependency) {
        assertTrue(dependency != this, () -> "fetch group " + id + " can't depend on itself");
        dependencies.add(dependency);
    }

    public void addDependencies(Collection<FetchGroup> dependencies) {
        for (FetchGroup dependency : dependencies) {
            addDependency(dependency);
        }
    }

    public void removeDependency(FetchGroup dependency) {
        dependencies.remove(dependency);
    }

    /**
     * @return true if this group has to wait for the other one, directly or through other groups
     */
    public boolean dependsOnTransitively(FetchGroup other) {
        Set<FetchGroup> visited = new LinkedHashSet<>();
        Deque<FetchGroup> queue = new ArrayDeque<>(dependencies);
        while (!queue.isEmpty()) {
            FetchGroup current = queue.poll();
            if (current == other) {
                return true;
            }
            if (visited.add(current)) {
                queue.addAll(current.dependencies);
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return selection.isEmpty();
    }

    /**
     * Takes over selection, inputs and variables of a sibling group targeting the same subgraph at the
     * same path.
     */
    public void mergeFrom(FetchGroup other) {
        selection.mergeFrom(other.selection);
        for (Map.Entry<String, SelectionSetBuilder> input : other.inputs.entrySet()) {
            inputs.computeIfAbsent(input.getKey(), ignored -> new SelectionSetBuilder()).mergeFrom(input.getValue());
        }
        inputRewrites.addAll(other.inputRewrites);
        variableUsages.addAll(other.variableUsages);
    }

    public String getMergePathString() {
        return String.join(".", mergePath.getKeysOnly());
    }

    @Override
    public String toString() {
        return "FetchGroup{" +
                "id=" + id +
                ", subgraph=" + subgraph.getName() +
                ", entity=" + entity +
                ", mergePath=" + getMergePathString() +
                ", dependencies=" + dependencyIds() +
                '}';
    }

    private String dependencyIds() {
        StringBuilder sb = new StringBuilder("[");
        for (FetchGroup dependency : dependencies) {
            if (sb.length() > 1) {
                sb.append(',');
            }
            sb.append(dependency.id);
        }
        return sb.append(']').toString();
    }
}
