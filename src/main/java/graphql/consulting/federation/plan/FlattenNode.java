package graphql.consulting.federation.plan;

import graphql.PublicApi;
import graphql.execution.ResultPath;

import java.util.Collections;
import java.util.List;

/**
 * Runs the inner node for the objects found at a response path. A {@code @} segment stands for every
 * element of a list.
 */
@PublicApi
public class FlattenNode extends PlanNode {

    public static final String LIST_SEGMENT = "@";

    private final ResultPath path;
    private final PlanNode node;

    public FlattenNode(ResultPath path, PlanNode node) {
        this.path = path;
        this.node = node;
    }

    public ResultPath getPath() {
        return path;
    }

    public List<String> getPathSegments() {
        return path.getKeysOnly();
    }

    public PlanNode getNode() {
        return node;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FLATTEN;
    }

    @Override
    public List<PlanNode> getChildren() {
        return Collections.singletonList(node);
    }

    @Override
    public String toString() {
        return "Flatten(" + String.join(".", getPathSegments()) + ")[" + node + "]";
    }
}
