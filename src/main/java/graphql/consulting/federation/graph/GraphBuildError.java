package graphql.consulting.federation.graph;

import graphql.GraphQLException;
import graphql.PublicApi;

/**
 * The composed schema loaded but can not be compiled into a consistent routing graph.
 */
@PublicApi
public class GraphBuildError extends GraphQLException {

    public enum Kind {
        /**
         * No subgraph declares the type in a way it can be resolved.
         */
        UNREACHABLE_TYPE,
        /**
         * A requires or provides selection names a field the type does not have.
         */
        DANGLING_REQUIRES,
        /**
         * A subgraph resolves a field returning a type it does not declare.
         */
        INCONSISTENT_OWNERSHIP
    }

    private final Kind kind;

    public GraphBuildError(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
