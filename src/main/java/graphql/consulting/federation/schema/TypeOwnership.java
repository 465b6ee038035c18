package graphql.consulting.federation.schema;

import graphql.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static graphql.Assert.assertNotNull;

/**
 * How one subgraph declares one type.
 */
@PublicApi
public class TypeOwnership {

    /**
     * A field set identifying an entity. A key that is not resolvable can be handed out by the
     * subgraph as a reference but can not be used to enter it.
     */
    public static class Key {
        private final FieldSet fields;
        private final boolean resolvable;

        public Key(FieldSet fields, boolean resolvable) {
            this.fields = fields;
            this.resolvable = resolvable;
        }

        public FieldSet getFields() {
            return fields;
        }

        public boolean isResolvable() {
            return resolvable;
        }

        @Override
        public String toString() {
            return fields + (resolvable ? "" : " (not resolvable)");
        }
    }

    private final String typeName;
    private final Subgraph subgraph;
    private final List<Key> keys;
    private final boolean interfaceObject;
    private final boolean resolvable;
    private final boolean extension;
    private final Set<String> implementedInterfaces;
    private final Set<String> unionMembers;

    private TypeOwnership(Builder builder) {
        this.typeName = assertNotNull(builder.typeName);
        this.subgraph = assertNotNull(builder.subgraph);
        this.keys = Collections.unmodifiableList(new ArrayList<>(builder.keys));
        this.interfaceObject = builder.interfaceObject;
        this.resolvable = builder.resolvable;
        this.extension = builder.extension;
        this.implementedInterfaces = Collections.unmodifiableSet(new LinkedHashSet<>(builder.implementedInterfaces));
        this.unionMembers = Collections.unmodifiableSet(new LinkedHashSet<>(builder.unionMembers));
    }

    public String getTypeName() {
        return typeName;
    }

    public Subgraph getSubgraph() {
        return subgraph;
    }

    public List<Key> getKeys() {
        return keys;
    }

    /**
     * @return the keys through which this subgraph can be entered
     */
    public List<FieldSet> getResolvableKeys() {
        List<FieldSet> result = new ArrayList<>();
        for (Key key : keys) {
            if (key.isResolvable()) {
                result.add(key.getFields());
            }
        }
        return result;
    }

    public boolean isEntity() {
        return !keys.isEmpty();
    }

    /**
     * @return true when the subgraph sees this interface as a plain object without knowing the
     * concrete implementation of an instance
     */
    public boolean isInterfaceObject() {
        return interfaceObject;
    }

    public boolean isResolvable() {
        return resolvable;
    }

    public boolean isExtension() {
        return extension;
    }

    public Set<String> getImplementedInterfaces() {
        return implementedInterfaces;
    }

    public Set<String> getUnionMembers() {
        return unionMembers;
    }

    public static Builder newTypeOwnership() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TypeOwnership{" +
                "type=" + typeName +
                ", subgraph=" + subgraph.getName() +
                ", keys=" + keys +
                ", interfaceObject=" + interfaceObject +
                ", resolvable=" + resolvable +
                ", extension=" + extension +
                '}';
    }

    public static class Builder {
        private String typeName;
        private Subgraph subgraph;
        private final List<Key> keys = new ArrayList<>();
        private boolean interfaceObject;
        private boolean resolvable = true;
        private boolean extension;
        private final Set<String> implementedInterfaces = new LinkedHashSet<>();
        private final Set<String> unionMembers = new LinkedHashSet<>();

        public Builder typeName(String typeName) {
            this.typeName = typeName;
            return this;
        }

        public Builder subgraph(Subgraph subgraph) {
            this.subgraph = subgraph;
            return this;
        }

        public Builder key(Key key) {
            this.keys.add(key);
            return this;
        }

        public Builder interfaceObject(boolean interfaceObject) {
            this.interfaceObject = interfaceObject;
            return this;
        }

        public Builder resolvable(boolean resolvable) {
            this.resolvable = resolvable;
            return this;
        }

        public Builder extension(boolean extension) {
            this.extension = extension;
            return this;
        }

        public Builder implementedInterfaces(Set<String> implementedInterfaces) {
            this.implementedInterfaces.clear();
            this.implementedInterfaces.addAll(implementedInterfaces);
            return this;
        }

        public Builder unionMembers(Set<String> unionMembers) {
            this.unionMembers.clear();
            this.unionMembers.addAll(unionMembers);
            return this;
        }

        public TypeOwnership build() {
            return new TypeOwnership(this);
        }
    }
}
