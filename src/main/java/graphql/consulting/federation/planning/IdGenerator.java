package graphql.consulting.federation.planning;

import graphql.Internal;

/**
 * Fetch group ids, unique within one planning call. Ids are handed out in creation order, which keeps
 * plans reproducible.
 */
@Internal
public class IdGenerator {

    private int next;

    public int nextId() {
        return next++;
    }
}
