package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.graph.Vertex;
import graphql.consulting.federation.normalized.NormalizedField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything the planner knows about one object of the response: the positions of all groups that
 * fetch data for it and the sibling fields still waiting to be planned.
 */
@Internal
public class PathContext {

    private final List<Position> positions = new ArrayList<>();
    private final List<NormalizedField> pendingFields = new ArrayList<>();
    private Position discovery;

    public List<Position> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    public void addPosition(Position position) {
        if (!positions.contains(position)) {
            positions.add(position);
        }
    }

    /**
     * @return the position of the group at the vertex, null if there is none yet
     */
    public Position findPosition(FetchGroup group, Vertex vertex, boolean requiresPosition) {
        for (Position position : positions) {
            if (position.getGroup() == group && position.getVertex() == vertex && position.isRequiresPosition() == requiresPosition) {
                return position;
            }
        }
        return null;
    }

    public List<NormalizedField> getPendingFields() {
        return pendingFields;
    }

    public void addPendingFields(List<NormalizedField> fields) {
        pendingFields.addAll(fields);
    }

    public void removePendingField(NormalizedField field) {
        pendingFields.remove(field);
    }

    /**
     * @return the position in a subgraph that knows the concrete types of an interface object, null
     * until the concrete type was needed
     */
    public Position getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Position discovery) {
        this.discovery = discovery;
    }
}
