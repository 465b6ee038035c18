package graphql.consulting.federation.schema;

import graphql.PublicApi;

import java.util.Locale;

/**
 * Turns free-form subgraph names into tokens that are safe to embed in generated GraphQL names
 * (operation names, enum values).
 * <p>
 * Every character outside {@code [A-Za-z0-9_]} is replaced by one {@code _}, also when it takes two
 * UTF-16 units. The mapping is total and
 * idempotent: {@code sanitize(sanitize(s)).equals(sanitize(s))} for every string, so it does not
 * matter how many stages of the pipeline apply it.
 */
@PublicApi
public final class SubgraphNames {

    private SubgraphNames() {
    }

    public static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder sb = null;
        int i = 0;
        while (i < name.length()) {
            int codePoint = name.codePointAt(i);
            int next = i + Character.charCount(codePoint);
            if (isSafe(codePoint)) {
                if (sb != null) {
                    sb.appendCodePoint(codePoint);
                }
            } else {
                if (sb == null) {
                    sb = new StringBuilder(name.length());
                    sb.append(name, 0, i);
                }
                sb.append('_');
            }
            i = next;
        }
        return sb == null ? name : sb.toString();
    }

    /**
     * The value a composed schema uses in its {@code join__Graph} enum for the given subgraph name.
     */
    public static String toEnumToken(String name) {
        return sanitize(name).toUpperCase(Locale.ROOT);
    }

    public static boolean isSanitized(String name) {
        return sanitize(name).equals(name);
    }

    private static boolean isSafe(int c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '_';
    }
}
