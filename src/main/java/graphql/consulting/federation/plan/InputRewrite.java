package graphql.consulting.federation.plan;

import graphql.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tells the executor to overwrite a value of each representation before it is sent, for example the
 * {@code __typename} of a concrete type entering a subgraph that only knows its interface.
 */
@PublicApi
public class InputRewrite {

    public static final String VALUE_SETTER = "ValueSetter";

    private final List<String> path;
    private final String setValueTo;

    public InputRewrite(List<String> path, String setValueTo) {
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
        this.setValueTo = setValueTo;
    }

    public String getKind() {
        return VALUE_SETTER;
    }

    public List<String> getPath() {
        return path;
    }

    public String getSetValueTo() {
        return setValueTo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        InputRewrite that = (InputRewrite) o;
        return path.equals(that.path) && setValueTo.equals(that.setValueTo);
    }

    @Override
    public int hashCode() {
        return 31 * path.hashCode() + setValueTo.hashCode();
    }

    @Override
    public String toString() {
        return "InputRewrite{" + path + " -> " + setValueTo + '}';
    }
}
