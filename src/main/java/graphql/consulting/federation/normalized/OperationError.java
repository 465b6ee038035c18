package graphql.consulting.federation.normalized;

import graphql.ErrorClassification;
import graphql.ErrorType;
import graphql.GraphQLError;
import graphql.GraphQLException;
import graphql.PublicApi;
import graphql.language.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The client operation does not fit the composed schema. This is a request level failure: the schema
 * and routing graph stay usable for other operations.
 */
@PublicApi
public class OperationError extends GraphQLException implements GraphQLError {

    private final List<SourceLocation> locations;

    public OperationError(String message) {
        this(message, (SourceLocation) null);
    }

    public OperationError(String message, SourceLocation location) {
        super(message);
        this.locations = location == null ? Collections.emptyList() : Collections.singletonList(location);
    }

    public OperationError(String message, Throwable cause) {
        super(message, cause);
        this.locations = Collections.emptyList();
    }

    @Override
    public List<SourceLocation> getLocations() {
        return new ArrayList<>(locations);
    }

    @Override
    public ErrorClassification getErrorType() {
        return ErrorType.ValidationError;
    }
}
