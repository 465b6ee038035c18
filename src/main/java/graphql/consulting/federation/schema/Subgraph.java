package graphql.consulting.federation.schema;

import graphql.PublicApi;

import java.util.Objects;

import static graphql.Assert.assertNotNull;

/**
 * One backend service exposing a portion of the composed schema.
 */
@PublicApi
public class Subgraph implements Comparable<Subgraph> {

    private final String name;
    private final String url;
    private final String enumToken;
    private final String sanitizedName;

    public Subgraph(String name, String url, String enumToken) {
        this.name = assertNotNull(name, () -> "subgraph name can't be null");
        this.url = url;
        this.enumToken = enumToken;
        this.sanitizedName = SubgraphNames.sanitize(name);
    }

    public String getName() {
        return name;
    }

    /**
     * The endpoint is opaque to planning; it is carried for the executor.
     */
    public String getUrl() {
        return url;
    }

    /**
     * @return the {@code join__Graph} value that references this subgraph in the composed SDL
     */
    public String getEnumToken() {
        return enumToken;
    }

    public String getSanitizedName() {
        return sanitizedName;
    }

    @Override
    public int compareTo(Subgraph o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Subgraph subgraph = (Subgraph) o;
        return name.equals(subgraph.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "Subgraph{" +
                "name='" + name + '\'' +
                ", url='" + url + '\'' +
                '}';
    }
}
