package graphql.consulting.federation.schema;

import graphql.PublicApi;
import graphql.schema.GraphQLNamedType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A named type of the composed schema, its fields and how each subgraph declares it.
 */
@PublicApi
public class TypeDef {

    private final String name;
    private final TypeKind kind;
    private final GraphQLNamedType graphQLType;
    private final Set<String> interfaces;
    private final Set<String> possibleObjectTypes;
    private final Map<String, FieldDef> fields;
    private final Map<Subgraph, TypeOwnership> ownerships;

    public TypeDef(String name,
                   TypeKind kind,
                   GraphQLNamedType graphQLType,
                   Set<String> interfaces,
                   Set<String> possibleObjectTypes,
                   Map<String, FieldDef> fields,
                   Map<Subgraph, TypeOwnership> ownerships) {
        this.name = name;
        this.kind = kind;
        this.graphQLType = graphQLType;
        this.interfaces = Collections.unmodifiableSet(new LinkedHashSet<>(interfaces));
        this.possibleObjectTypes = Collections.unmodifiableSet(new LinkedHashSet<>(possibleObjectTypes));
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.ownerships = Collections.unmodifiableMap(new LinkedHashMap<>(ownerships));
    }

    public String getName() {
        return name;
    }

    public TypeKind getKind() {
        return kind;
    }

    public GraphQLNamedType getGraphQLType() {
        return graphQLType;
    }

    /**
     * @return the interfaces this type implements in the composed schema
     */
    public Set<String> getInterfaces() {
        return interfaces;
    }

    /**
     * @return for interfaces and unions the object types an instance can have, for objects the type
     * itself
     */
    public Set<String> getPossibleObjectTypes() {
        return possibleObjectTypes;
    }

    public Map<String, FieldDef> getFields() {
        return fields;
    }

    public FieldDef getField(String fieldName) {
        return fields.get(fieldName);
    }

    public Map<Subgraph, TypeOwnership> getOwnerships() {
        return ownerships;
    }

    public TypeOwnership getOwnership(Subgraph subgraph) {
        return ownerships.get(subgraph);
    }

    /**
     * @return the declaring subgraphs in name order
     */
    public List<Subgraph> getSubgraphs() {
        List<Subgraph> result = new ArrayList<>(ownerships.keySet());
        Collections.sort(result);
        return result;
    }

    public boolean isAbstract() {
        return kind.isAbstract();
    }

    @Override
    public String toString() {
        return "TypeDef{" +
                "name='" + name + '\'' +
                ", kind=" + kind +
                ", subgraphs=" + ownerships.keySet().size() +
                '}';
    }
}
