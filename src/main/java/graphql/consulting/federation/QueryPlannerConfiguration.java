package graphql.consulting.federation;

import graphql.PublicApi;

import java.util.function.Consumer;

import static graphql.Assert.assertTrue;

@PublicApi
public class QueryPlannerConfiguration {

    public static final int DEFAULT_MAX_KEY_JUMPS = 3;

    private final int maxKeyJumps;
    private final boolean generateOperationNames;
    private final boolean mergeSiblingFetches;
    private final int planningThreads;

    private QueryPlannerConfiguration(Builder builder) {
        this.maxKeyJumps = builder.maxKeyJumps;
        this.generateOperationNames = builder.generateOperationNames;
        this.mergeSiblingFetches = builder.mergeSiblingFetches;
        this.planningThreads = builder.planningThreads;
    }

    public static QueryPlannerConfiguration defaultConfiguration() {
        return newConfiguration().build();
    }

    /**
     * @return how many entity jumps a single field may need before it is considered unresolvable
     */
    public int getMaxKeyJumps() {
        return maxKeyJumps;
    }

    /**
     * @return true if subgraph operations of named client operations get generated names
     */
    public boolean isGenerateOperationNames() {
        return generateOperationNames;
    }

    public boolean isMergeSiblingFetches() {
        return mergeSiblingFetches;
    }

    public int getPlanningThreads() {
        return planningThreads;
    }

    public QueryPlannerConfiguration transform(Consumer<Builder> builderConsumer) {
        Builder builder = new Builder(this);
        builderConsumer.accept(builder);
        return builder.build();
    }

    public static Builder newConfiguration() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "QueryPlannerConfiguration{" +
                "maxKeyJumps=" + maxKeyJumps +
                ", generateOperationNames=" + generateOperationNames +
                ", mergeSiblingFetches=" + mergeSiblingFetches +
                ", planningThreads=" + planningThreads +
                '}';
    }

    public static class Builder {
        private int maxKeyJumps = DEFAULT_MAX_KEY_JUMPS;
        private boolean generateOperationNames = true;
        private boolean mergeSiblingFetches = true;
        private int planningThreads = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        private Builder(QueryPlannerConfiguration existing) {
            this.maxKeyJumps = existing.maxKeyJumps;
            this.generateOperationNames = existing.generateOperationNames;
            this.mergeSiblingFetches = existing.mergeSiblingFetches;
            this.planningThreads = existing.planningThreads;
        }

        public Builder maxKeyJumps(int maxKeyJumps) {
            assertTrue(maxKeyJumps >= 1, () -> "maxKeyJumps must be at least 1");
            this.maxKeyJumps = maxKeyJumps;
            return this;
        }

        public Builder generateOperationNames(boolean generateOperationNames) {
            this.generateOperationNames = generateOperationNames;
            return this;
        }

        public Builder mergeSiblingFetches(boolean mergeSiblingFetches) {
            this.mergeSiblingFetches = mergeSiblingFetches;
            return this;
        }

        public Builder planningThreads(int planningThreads) {
            assertTrue(planningThreads >= 1, () -> "planningThreads must be at least 1");
            this.planningThreads = planningThreads;
            return this;
        }

        public QueryPlannerConfiguration build() {
            return new QueryPlannerConfiguration(this);
        }
    }
}
