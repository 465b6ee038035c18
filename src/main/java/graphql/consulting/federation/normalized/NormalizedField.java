package graphql.consulting.federation.normalized;

import graphql.Internal;
import graphql.introspection.Introspection;
import graphql.language.Argument;
import graphql.language.AstPrinter;
import graphql.language.Directive;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import static graphql.Assert.assertNotNull;

/**
 * One field of a normalized operation: a field selected on exactly one parent type (the type it was
 * selected on, concrete for fragments on object types) with its merged sub selection.
 */
@Internal
public class NormalizedField {
    private final String alias;
    private final List<Argument> arguments;
    private final List<Directive> conditions;
    private final GraphQLCompositeType parentType;
    private final GraphQLFieldDefinition fieldDefinition;
    private final List<NormalizedField> children;
    private final int level;
    private NormalizedField parent;

    private NormalizedField(Builder builder) {
        this.alias = builder.alias;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(builder.arguments));
        this.conditions = Collections.unmodifiableList(new ArrayList<>(builder.conditions));
        this.parentType = assertNotNull(builder.parentType);
        this.fieldDefinition = assertNotNull(builder.fieldDefinition);
        this.children = Collections.unmodifiableList(new ArrayList<>(builder.children));
        this.level = builder.level;
        this.parent = builder.parent;
    }

    public String getName() {
        return fieldDefinition.getName();
    }

    public String getAlias() {
        return alias;
    }

    /**
     * @return the key of this field in the response: the alias if there is one, the name otherwise
     */
    public String getResultKey() {
        return alias != null ? alias : getName();
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    /**
     * @return the {@code @skip}/{@code @include} directives whose outcome depends on variables; the
     * executor decides them
     */
    public List<Directive> getConditions() {
        return conditions;
    }

    public GraphQLCompositeType getParentType() {
        return parentType;
    }

    public String getParentTypeName() {
        return parentType.getName();
    }

    public GraphQLFieldDefinition getFieldDefinition() {
        return fieldDefinition;
    }

    public GraphQLOutputType getType() {
        return fieldDefinition.getType();
    }

    public String getReturnTypeName() {
        return ((GraphQLNamedType) GraphQLTypeUtil.unwrapAll(fieldDefinition.getType())).getName();
    }

    public boolean isTypename() {
        return Introspection.TypeNameMetaFieldDef.getName().equals(getName());
    }

    public boolean isListType() {
        return GraphQLTypeUtil.isList(GraphQLTypeUtil.unwrapNonNull(fieldDefinition.getType()));
    }

    /**
     * @return how many list wrappers the field type has, ignoring non null wrappers
     */
    public int getListDepth() {
        int depth = 0;
        GraphQLType type = fieldDefinition.getType();
        while (true) {
            type = GraphQLTypeUtil.unwrapNonNull(type);
            if (!GraphQLTypeUtil.isList(type)) {
                return depth;
            }
            depth++;
            type = GraphQLTypeUtil.unwrapOne(type);
        }
    }

    public List<NormalizedField> getChildren() {
        return children;
    }

    public int getLevel() {
        return level;
    }

    public NormalizedField getParent() {
        return parent;
    }

    public void replaceParent(NormalizedField newParent) {
        this.parent = newParent;
    }

    public void traverseSubTree(Consumer<NormalizedField> consumer) {
        for (NormalizedField child : children) {
            consumer.accept(child);
            child.traverseSubTree(consumer);
        }
    }

    public NormalizedField transform(Consumer<Builder> builderConsumer) {
        Builder builder = new Builder(this);
        builderConsumer.accept(builder);
        return builder.build();
    }

    public static Builder newNormalizedField() {
        return new Builder();
    }

    public String printDetails() {
        StringBuilder sb = new StringBuilder();
        if (alias != null) {
            sb.append(alias).append(": ");
        }
        sb.append(getParentTypeName()).append(".").append(getName());
        if (!arguments.isEmpty()) {
            sb.append("(");
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(AstPrinter.printAst(arguments.get(i)));
            }
            sb.append(")");
        }
        for (Directive condition : conditions) {
            sb.append(" ").append(AstPrinter.printAst(condition));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "NormalizedField{" + printDetails() + ", children=" + children.size() + '}';
    }

    public static class Builder {
        private String alias;
        private final List<Argument> arguments = new ArrayList<>();
        private final List<Directive> conditions = new ArrayList<>();
        private GraphQLCompositeType parentType;
        private GraphQLFieldDefinition fieldDefinition;
        private final List<NormalizedField> children = new ArrayList<>();
        private int level;
        private NormalizedField parent;

        private Builder() {
        }

        private Builder(NormalizedField existing) {
            this.alias = existing.alias;
            this.arguments.addAll(existing.arguments);
            this.conditions.addAll(existing.conditions);
            this.parentType = existing.parentType;
            this.fieldDefinition = existing.fieldDefinition;
            this.children.addAll(existing.children);
            this.level = existing.level;
            this.parent = existing.parent;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder arguments(List<Argument> arguments) {
            this.arguments.clear();
            this.arguments.addAll(arguments);
            return this;
        }

        public Builder conditions(List<Directive> conditions) {
            this.conditions.clear();
            this.conditions.addAll(conditions);
            return this;
        }

        public Builder parentType(GraphQLCompositeType parentType) {
            this.parentType = parentType;
            return this;
        }

        public Builder fieldDefinition(GraphQLFieldDefinition fieldDefinition) {
            this.fieldDefinition = fieldDefinition;
            return this;
        }

        public Builder children(List<NormalizedField> children) {
            this.children.clear();
            this.children.addAll(children);
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder parent(NormalizedField parent) {
            this.parent = parent;
            return this;
        }

        public NormalizedField build() {
            return new NormalizedField(this);
        }
    }
}
