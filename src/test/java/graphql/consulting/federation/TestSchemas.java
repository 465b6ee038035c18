package graphql.consulting.federation;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public class TestSchemas {

    public static final String JOIN_DEFINITIONS = "" +
            "directive @join__field(graph: join__Graph, requires: join__FieldSet, provides: join__FieldSet, type: String, external: Boolean, override: String, usedOverridden: Boolean) repeatable on FIELD_DEFINITION | INPUT_FIELD_DEFINITION\n" +
            "directive @join__graph(name: String!, url: String!) on ENUM_VALUE\n" +
            "directive @join__implements(graph: join__Graph!, interface: String!) repeatable on OBJECT | INTERFACE\n" +
            "directive @join__type(graph: join__Graph!, key: join__FieldSet, extension: Boolean! = false, resolvable: Boolean! = true, isInterfaceObject: Boolean! = false) repeatable on OBJECT | INTERFACE | UNION | ENUM | INPUT_OBJECT | SCALAR\n" +
            "directive @join__unionMember(graph: join__Graph!, member: String!) repeatable on UNION\n" +
            "scalar join__FieldSet\n";

    public static String products() {
        return read("schemas/products.graphql");
    }

    public static String interfaceObject() {
        return read("schemas/interface-object.graphql");
    }

    /**
     * @param types the {@code join__Graph} enum and the types of a small supergraph
     */
    public static String supergraph(String types) {
        return JOIN_DEFINITIONS + types;
    }

    private static String read(String resource) {
        try (InputStream inputStream = TestSchemas.class.getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("missing test resource " + resource);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
