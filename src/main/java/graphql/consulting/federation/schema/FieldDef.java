package graphql.consulting.federation.schema;

import graphql.PublicApi;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A field of the composed schema together with its per subgraph ownership records.
 */
@PublicApi
public class FieldDef {

    private final String parentTypeName;
    private final GraphQLFieldDefinition definition;
    private final List<FieldOwnership> ownerships;

    public FieldDef(String parentTypeName, GraphQLFieldDefinition definition, List<FieldOwnership> ownerships) {
        this.parentTypeName = parentTypeName;
        this.definition = definition;
        this.ownerships = Collections.unmodifiableList(new ArrayList<>(ownerships));
    }

    public String getName() {
        return definition.getName();
    }

    public String getParentTypeName() {
        return parentTypeName;
    }

    public GraphQLFieldDefinition getDefinition() {
        return definition;
    }

    public GraphQLOutputType getType() {
        return definition.getType();
    }

    public String getReturnTypeName() {
        GraphQLType unwrapped = GraphQLTypeUtil.unwrapAll(definition.getType());
        return ((GraphQLNamedType) unwrapped).getName();
    }

    public List<FieldOwnership> getOwnerships() {
        return ownerships;
    }

    /**
     * @return the ownership record for the subgraph or null if the subgraph does not know this field
     */
    public FieldOwnership getOwnership(Subgraph subgraph) {
        for (FieldOwnership ownership : ownerships) {
            if (ownership.getSubgraph().equals(subgraph)) {
                return ownership;
            }
        }
        return null;
    }

    public boolean isResolvableIn(Subgraph subgraph) {
        FieldOwnership ownership = getOwnership(subgraph);
        return ownership != null && ownership.isResolvable();
    }

    public List<Subgraph> getResolvingSubgraphs() {
        List<Subgraph> result = new ArrayList<>();
        for (FieldOwnership ownership : ownerships) {
            if (ownership.isResolvable()) {
                result.add(ownership.getSubgraph());
            }
        }
        Collections.sort(result);
        return result;
    }

    @Override
    public String toString() {
        return parentTypeName + "." + getName();
    }
}
