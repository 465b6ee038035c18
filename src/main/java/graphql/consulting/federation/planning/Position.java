package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.graph.Vertex;
import graphql.consulting.federation.schema.FieldSet;
import graphql.execution.ResultPath;

/**
 * Where the planner currently stands: a group, the place in its document new fields go to, the routing
 * vertex describing what the subgraph can resolve there and the response path of the object.
 */
@Internal
public class Position {

    private final FetchGroup group;
    private final SelectionSetBuilder target;
    private final Vertex vertex;
    private final ResultPath path;
    private final FieldSet provided;
    private final PathContext context;
    private final boolean requiresPosition;

    public Position(FetchGroup group,
                    SelectionSetBuilder target,
                    Vertex vertex,
                    ResultPath path,
                    FieldSet provided,
                    PathContext context,
                    boolean requiresPosition) {
        this.group = group;
        this.target = target;
        this.vertex = vertex;
        this.path = path;
        this.provided = provided;
        this.context = context;
        this.requiresPosition = requiresPosition;
    }

    public FetchGroup getGroup() {
        return group;
    }

    public SelectionSetBuilder getTarget() {
        return target;
    }

    public Vertex getVertex() {
        return vertex;
    }

    public String getTypeName() {
        return vertex.getTypeName();
    }

    public ResultPath getPath() {
        return path;
    }

    /**
     * @return fields the subgraph hands out here although it does not resolve them, or null
     */
    public FieldSet getProvided() {
        return provided;
    }

    public PathContext getContext() {
        return context;
    }

    public boolean isRequiresPosition() {
        return requiresPosition;
    }

    /**
     * @return the position inside a fragment on one of the object types of this abstract position
     */
    public Position downcast(Vertex objectVertex) {
        return new Position(group,
                target.inlineFragment(objectVertex.getTypeName()),
                objectVertex,
                path,
                provided == null ? null : provided.forType(objectVertex.getTypeName()),
                context,
                requiresPosition);
    }

    @Override
    public String toString() {
        return "Position{" +
                "group=" + group.getId() +
                ", vertex=" + vertex +
                ", path=" + path +
                '}';
    }
}
