package graphql.consulting.federation.plan;

import graphql.PublicApi;

import java.util.List;

/**
 * A node of a query plan tree. Planning code branches on {@link #getKind()}.
 */
@PublicApi
public abstract class PlanNode {

    public abstract NodeKind getKind();

    /**
     * @return the direct child nodes, empty for fetches
     */
    public abstract List<PlanNode> getChildren();
}
