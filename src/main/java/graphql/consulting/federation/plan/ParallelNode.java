package graphql.consulting.federation.plan;

import graphql.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Children are independent of each other and may run concurrently.
 */
@PublicApi
public class ParallelNode extends PlanNode {

    private final List<PlanNode> nodes;

    public ParallelNode(List<PlanNode> nodes) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public List<PlanNode> getNodes() {
        return nodes;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PARALLEL;
    }

    @Override
    public List<PlanNode> getChildren() {
        return nodes;
    }

    @Override
    public String toString() {
        return "Parallel" + nodes;
    }
}
