package graphql.consulting.federation.graph;

import graphql.PublicApi;
import graphql.consulting.federation.schema.FieldSet;

/**
 * A directed edge between two vertices, stored as a pair of vertex indices.
 */
@PublicApi
public class Edge {

    private final int index;
    private final EdgeKind kind;
    private final int head;
    private final int tail;
    private final String fieldName;
    private final FieldSet key;
    private final FieldSet requires;
    private final FieldSet provides;
    private final String typenameRewrite;

    private Edge(int index, EdgeKind kind, int head, int tail, String fieldName, FieldSet key, FieldSet requires, FieldSet provides, String typenameRewrite) {
        this.index = index;
        this.kind = kind;
        this.head = head;
        this.tail = tail;
        this.fieldName = fieldName;
        this.key = key;
        this.requires = requires;
        this.provides = provides;
        this.typenameRewrite = typenameRewrite;
    }

    static Edge field(int index, int head, int tail, String fieldName, FieldSet requires, FieldSet provides) {
        return new Edge(index, EdgeKind.FIELD, head, tail, fieldName, null, requires, provides, null);
    }

    static Edge keyJump(int index, int head, int tail, FieldSet key, String typenameRewrite) {
        return new Edge(index, EdgeKind.KEY_JUMP, head, tail, null, key, null, null, typenameRewrite);
    }

    static Edge interfaceExpansion(int index, int head, int tail, FieldSet key) {
        return new Edge(index, EdgeKind.INTERFACE_EXPANSION, head, tail, null, key, null, null, null);
    }

    static Edge downcast(int index, int head, int tail) {
        return new Edge(index, EdgeKind.DOWNCAST, head, tail, null, null, null, null, null);
    }

    public int getIndex() {
        return index;
    }

    public EdgeKind getKind() {
        return kind;
    }

    public int getHead() {
        return head;
    }

    public int getTail() {
        return tail;
    }

    /**
     * @return the resolved field for FIELD edges
     */
    public String getFieldName() {
        return fieldName;
    }

    /**
     * @return the key the representation must carry, for KEY_JUMP and INTERFACE_EXPANSION edges
     */
    public FieldSet getKey() {
        return key;
    }

    /**
     * @return sibling fields the field needs first, null if none
     */
    public FieldSet getRequires() {
        return requires;
    }

    /**
     * @return fields of the returned object the subgraph hands out alongside, null if none
     */
    public FieldSet getProvides() {
        return provides;
    }

    /**
     * For jumps from a concrete type into an interface object: the interface name the representation's
     * {@code __typename} has to be rewritten to. Null otherwise.
     */
    public String getTypenameRewrite() {
        return typenameRewrite;
    }

    public int getCost() {
        return kind.getCost();
    }

    @Override
    public String toString() {
        return "Edge{" +
                "kind=" + kind +
                ", head=" + head +
                ", tail=" + tail +
                (fieldName != null ? ", field=" + fieldName : "") +
                (key != null ? ", key=" + key : "") +
                '}';
    }
}
