package graphql.consulting.federation.plan;

import graphql.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Children run one after the other, in list order.
 */
@PublicApi
public class SequenceNode extends PlanNode {

    private final List<PlanNode> nodes;

    public SequenceNode(List<PlanNode> nodes) {
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
    }

    public List<PlanNode> getNodes() {
        return nodes;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SEQUENCE;
    }

    @Override
    public List<PlanNode> getChildren() {
        return nodes;
    }

    @Override
    public String toString() {
        return "Sequence" + nodes;
    }
}
