package graphql.consulting.federation.planning;

import graphql.GraphQLException;
import graphql.PublicApi;
import graphql.execution.ResultPath;
import graphql.schema.FieldCoordinates;

/**
 * Planning of one operation failed. The routing graph is not affected and other operations can still
 * be planned.
 */
@PublicApi
public class PlanningError extends GraphQLException {

    public PlanningError(String message) {
        super(message);
    }

    /**
     * A selected field can not be resolved by any path through the routing graph. The whole operation
     * is rejected, planning never drops a field.
     */
    public static class Unresolvable extends PlanningError {
        private final FieldCoordinates coordinates;
        private final ResultPath path;

        public Unresolvable(FieldCoordinates coordinates, ResultPath path) {
            super("field " + coordinates.getTypeName() + "." + coordinates.getFieldName() + " at '" + path + "' can not be resolved by any subgraph");
            this.coordinates = coordinates;
            this.path = path;
        }

        public FieldCoordinates getCoordinates() {
            return coordinates;
        }

        public ResultPath getPath() {
            return path;
        }
    }
}
