package graphql.consulting.federation.schema;

import graphql.GraphQLException;
import graphql.PublicApi;

/**
 * The composed schema carries metadata that can not be turned into a consistent model. Loading is
 * aborted; nothing is ever planned against such a schema.
 */
@PublicApi
public class SchemaError extends GraphQLException {

    public SchemaError(String message) {
        super(message);
    }

    public SchemaError(String message, Throwable cause) {
        super(message, cause);
    }
}
