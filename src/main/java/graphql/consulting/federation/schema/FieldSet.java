package graphql.consulting.federation.schema;

import graphql.PublicApi;
import graphql.language.Definition;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed field selection as used by keys, {@code requires} and {@code provides}, for example
 * {@code "id organization { id }"} or {@code "... on Book { isbn }"}.
 */
@PublicApi
public class FieldSet {

    public static final FieldSet EMPTY = new FieldSet(Collections.emptyList());

    private final List<Entry> entries;

    public FieldSet(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * One element of a field set: either a field (with an optional sub selection) or an inline
     * fragment with a type condition.
     */
    public static class Entry {
        private final String fieldName;
        private final String typeCondition;
        private final FieldSet children;

        private Entry(String fieldName, String typeCondition, FieldSet children) {
            this.fieldName = fieldName;
            this.typeCondition = typeCondition;
            this.children = children;
        }

        public static Entry field(String name, FieldSet children) {
            return new Entry(name, null, children);
        }

        public static Entry inlineFragment(String typeCondition, FieldSet children) {
            return new Entry(null, typeCondition, children);
        }

        public boolean isField() {
            return fieldName != null;
        }

        public String getFieldName() {
            return fieldName;
        }

        public String getTypeCondition() {
            return typeCondition;
        }

        public FieldSet getChildren() {
            return children;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Entry entry = (Entry) o;
            return Objects.equals(fieldName, entry.fieldName) &&
                    Objects.equals(typeCondition, entry.typeCondition) &&
                    Objects.equals(children, entry.children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(fieldName, typeCondition, children);
        }

        @Override
        public String toString() {
            String head = isField() ? fieldName : "... on " + typeCondition;
            if (children.isEmpty()) {
                return head;
            }
            return head + " { " + children + " }";
        }
    }

    public static FieldSet parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            return EMPTY;
        }
        Document document;
        try {
            document = new Parser().parseDocument("{" + text + "}");
        } catch (InvalidSyntaxException e) {
            throw new SchemaError("malformed field set '" + text + "': " + e.getMessage(), e);
        }
        List<Definition> definitions = document.getDefinitions();
        if (definitions.size() != 1 || !(definitions.get(0) instanceof OperationDefinition)) {
            throw new SchemaError("malformed field set '" + text + "'");
        }
        OperationDefinition operationDefinition = (OperationDefinition) definitions.get(0);
        return fromSelectionSet(operationDefinition.getSelectionSet(), text);
    }

    private static FieldSet fromSelectionSet(SelectionSet selectionSet, String text) {
        if (selectionSet == null) {
            return EMPTY;
        }
        List<Entry> entries = new ArrayList<>();
        for (Selection<?> selection : selectionSet.getSelections()) {
            if (selection instanceof Field) {
                Field field = (Field) selection;
                if (field.getAlias() != null || !field.getArguments().isEmpty() || !field.getDirectives().isEmpty()) {
                    throw new SchemaError("field set '" + text + "' may not use aliases, arguments or directives");
                }
                entries.add(Entry.field(field.getName(), fromSelectionSet(field.getSelectionSet(), text)));
            } else if (selection instanceof InlineFragment) {
                InlineFragment inlineFragment = (InlineFragment) selection;
                if (inlineFragment.getTypeCondition() == null) {
                    throw new SchemaError("inline fragment without type condition in field set '" + text + "'");
                }
                entries.add(Entry.inlineFragment(inlineFragment.getTypeCondition().getName(),
                        fromSelectionSet(inlineFragment.getSelectionSet(), text)));
            } else {
                throw new SchemaError("fragment spreads are not allowed in field set '" + text + "'");
            }
        }
        return new FieldSet(entries);
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return the names of the top level fields, in declaration order
     */
    public Set<String> getFieldNames() {
        Set<String> result = new LinkedHashSet<>();
        for (Entry entry : entries) {
            if (entry.isField()) {
                result.add(entry.getFieldName());
            }
        }
        return result;
    }

    public boolean hasField(String fieldName) {
        return getField(fieldName) != null;
    }

    public Entry getField(String fieldName) {
        for (Entry entry : entries) {
            if (entry.isField() && entry.getFieldName().equals(fieldName)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Narrows the set to what applies to objects of the given type: top level fields plus the content
     * of fragments conditioned on that type.
     */
    public FieldSet forType(String typeName) {
        List<Entry> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.isField()) {
                result.add(entry);
            } else if (entry.getTypeCondition().equals(typeName)) {
                result.addAll(entry.getChildren().getEntries());
            }
        }
        return new FieldSet(result);
    }

    public FieldSet merge(FieldSet other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<Entry> result = new ArrayList<>(entries);
        for (Entry entry : other.entries) {
            if (!result.contains(entry)) {
                result.add(entry);
            }
        }
        return new FieldSet(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return entries.equals(((FieldSet) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Entry entry : entries) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(entry);
        }
        return sb.toString();
    }
}
