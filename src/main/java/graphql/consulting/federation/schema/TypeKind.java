package graphql.consulting.federation.schema;

import graphql.PublicApi;

@PublicApi
public enum TypeKind {
    OBJECT,
    INTERFACE,
    UNION,
    SCALAR,
    ENUM,
    INPUT_OBJECT;

    public boolean isAbstract() {
        return this == INTERFACE || this == UNION;
    }

    public boolean isComposite() {
        return this == OBJECT || this == INTERFACE || this == UNION;
    }

    public boolean isLeaf() {
        return this == SCALAR || this == ENUM;
    }
}
