package graphql.consulting.federation.plan;

import graphql.PublicApi;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of planning one client operation. An operation that needs no remote call at all (for
 * example only introspection) has no root node.
 */
@PublicApi
public class QueryPlan {

    private final PlanNode node;

    public QueryPlan(PlanNode node) {
        this.node = node;
    }

    /**
     * @return the root node or null
     */
    public PlanNode getNode() {
        return node;
    }

    public List<FetchNode> getFetchNodes() {
        List<FetchNode> result = new ArrayList<>();
        if (node != null) {
            collectFetchNodes(node, result);
        }
        return result;
    }

    private void collectFetchNodes(PlanNode planNode, List<FetchNode> result) {
        if (planNode.getKind() == NodeKind.FETCH) {
            result.add((FetchNode) planNode);
            return;
        }
        for (PlanNode child : planNode.getChildren()) {
            collectFetchNodes(child, result);
        }
    }

    public int getFetchCount() {
        return getFetchNodes().size();
    }

    /**
     * @return the number of nodes on the longest root to leaf path, 0 for an empty plan
     */
    public int getDepth() {
        return node == null ? 0 : depth(node);
    }

    private int depth(PlanNode planNode) {
        int max = 0;
        for (PlanNode child : planNode.getChildren()) {
            max = Math.max(max, depth(child));
        }
        return max + 1;
    }

    @Override
    public String toString() {
        return "QueryPlan{" + node + '}';
    }
}
