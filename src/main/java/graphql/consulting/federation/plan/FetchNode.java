package graphql.consulting.federation.plan;

import graphql.PublicApi;
import graphql.language.InlineFragment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import static graphql.Assert.assertNotNull;

/**
 * One self-contained remote operation against one subgraph: the document to send, the client variables
 * it uses and, for entity fetches, the shape of the representations to build from earlier results.
 */
@PublicApi
public class FetchNode extends PlanNode {

    private final int id;
    private final String serviceName;
    private final String operationKind;
    private final String operationName;
    private final String operation;
    private final List<String> variableUsages;
    private final List<InlineFragment> requires;
    private final List<InputRewrite> inputRewrites;

    private FetchNode(Builder builder) {
        this.id = builder.id;
        this.serviceName = assertNotNull(builder.serviceName, () -> "serviceName is required");
        this.operationKind = assertNotNull(builder.operationKind, () -> "operationKind is required");
        this.operationName = builder.operationName;
        this.operation = assertNotNull(builder.operation, () -> "operation is required");
        this.variableUsages = Collections.unmodifiableList(new ArrayList<>(builder.variableUsages));
        this.requires = Collections.unmodifiableList(new ArrayList<>(builder.requires));
        this.inputRewrites = Collections.unmodifiableList(new ArrayList<>(builder.inputRewrites));
    }

    /**
     * @return the id of the fetch group this node was built from; unique within one plan
     */
    public int getId() {
        return id;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getOperationKind() {
        return operationKind;
    }

    public String getOperationName() {
        return operationName;
    }

    public String getOperation() {
        return operation;
    }

    public List<String> getVariableUsages() {
        return variableUsages;
    }

    /**
     * @return the representation selection per type, empty for root fetches
     */
    public List<InlineFragment> getRequires() {
        return requires;
    }

    public boolean isEntityFetch() {
        return !requires.isEmpty();
    }

    public List<InputRewrite> getInputRewrites() {
        return inputRewrites;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FETCH;
    }

    @Override
    public List<PlanNode> getChildren() {
        return Collections.emptyList();
    }

    public FetchNode transform(Consumer<Builder> builderConsumer) {
        Builder builder = new Builder(this);
        builderConsumer.accept(builder);
        return builder.build();
    }

    public static Builder newFetchNode() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Fetch(" + serviceName + ")";
    }

    public static class Builder {
        private int id;
        private String serviceName;
        private String operationKind;
        private String operationName;
        private String operation;
        private final List<String> variableUsages = new ArrayList<>();
        private final List<InlineFragment> requires = new ArrayList<>();
        private final List<InputRewrite> inputRewrites = new ArrayList<>();

        private Builder() {
        }

        private Builder(FetchNode existing) {
            this.id = existing.id;
            this.serviceName = existing.serviceName;
            this.operationKind = existing.operationKind;
            this.operationName = existing.operationName;
            this.operation = existing.operation;
            this.variableUsages.addAll(existing.variableUsages);
            this.requires.addAll(existing.requires);
            this.inputRewrites.addAll(existing.inputRewrites);
        }

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder operationKind(String operationKind) {
            this.operationKind = operationKind;
            return this;
        }

        public Builder operationName(String operationName) {
            this.operationName = operationName;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder variableUsages(List<String> variableUsages) {
            this.variableUsages.clear();
            this.variableUsages.addAll(variableUsages);
            return this;
        }

        public Builder requires(List<InlineFragment> requires) {
            this.requires.clear();
            this.requires.addAll(requires);
            return this;
        }

        public Builder inputRewrites(List<InputRewrite> inputRewrites) {
            this.inputRewrites.clear();
            this.inputRewrites.addAll(inputRewrites);
            return this;
        }

        public FetchNode build() {
            return new FetchNode(this);
        }
    }
}
