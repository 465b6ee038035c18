package graphql.consulting.federation.planning;

import graphql.Internal;
import graphql.consulting.federation.schema.FieldSet;
import graphql.language.Argument;
import graphql.language.AstPrinter;
import graphql.language.Directive;
import graphql.language.Field;
import graphql.language.InlineFragment;
import graphql.language.SelectionSet;
import graphql.language.TypeName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A mutable selection of a subgraph document. Identical fields and fragments on the same type are
 * merged as they are added; the order of first insertion is kept.
 */
@Internal
public class SelectionSetBuilder {

    private static final String TYPENAME = "__typename";

    private static class Entry {
        private final String alias;
        private final String name;
        private final List<Argument> arguments;
        private final List<Directive> directives;
        private final String typeCondition;
        // null for leaf fields
        private final SelectionSetBuilder children;

        private Entry(String alias, String name, List<Argument> arguments, List<Directive> directives, String typeCondition, SelectionSetBuilder children) {
            this.alias = alias;
            this.name = name;
            this.arguments = arguments;
            this.directives = directives;
            this.typeCondition = typeCondition;
            this.children = children;
        }

        private boolean isField() {
            return name != null;
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * Adds the field unless an identical one is present.
     *
     * @return the sub selection of the field, null for leaf fields
     */
    public SelectionSetBuilder field(String alias, String name, List<Argument> arguments, List<Directive> directives, boolean composite) {
        String key = fieldKey(alias, name, arguments, directives);
        Entry entry = entries.get(key);
        if (entry == null) {
            entry = new Entry(alias, name, new ArrayList<>(arguments), new ArrayList<>(directives), null, composite ? new SelectionSetBuilder() : null);
            entries.put(key, entry);
        }
        return entry.children;
    }

    public SelectionSetBuilder plainField(String name, boolean composite) {
        return field(null, name, Collections.emptyList(), Collections.emptyList(), composite);
    }

    public SelectionSetBuilder inlineFragment(String typeCondition) {
        String key = "... on " + typeCondition;
        Entry entry = entries.get(key);
        if (entry == null) {
            entry = new Entry(null, null, Collections.emptyList(), Collections.emptyList(), typeCondition, new SelectionSetBuilder());
            entries.put(key, entry);
        }
        return entry.children;
    }

    public SelectionSetBuilder getInlineFragment(String typeCondition) {
        Entry entry = entries.get("... on " + typeCondition);
        return entry == null ? null : entry.children;
    }

    public void addFieldSet(FieldSet fieldSet) {
        for (FieldSet.Entry fieldSetEntry : fieldSet.getEntries()) {
            if (fieldSetEntry.isField()) {
                SelectionSetBuilder child = plainField(fieldSetEntry.getFieldName(), !fieldSetEntry.getChildren().isEmpty());
                if (child != null) {
                    child.addFieldSet(fieldSetEntry.getChildren());
                }
            } else {
                inlineFragment(fieldSetEntry.getTypeCondition()).addFieldSet(fieldSetEntry.getChildren());
            }
        }
    }

    /**
     * @return true if every field of the field set is selected here without alias, arguments or
     * conditions
     */
    public boolean containsAll(FieldSet fieldSet) {
        for (FieldSet.Entry fieldSetEntry : fieldSet.getEntries()) {
            if (!contains(fieldSetEntry)) {
                return false;
            }
        }
        return true;
    }

    public boolean contains(FieldSet.Entry fieldSetEntry) {
        if (!fieldSetEntry.isField()) {
            SelectionSetBuilder fragment = getInlineFragment(fieldSetEntry.getTypeCondition());
            return fragment != null && fragment.containsAll(fieldSetEntry.getChildren());
        }
        Entry entry = entries.get(fieldKey(null, fieldSetEntry.getFieldName(), Collections.emptyList(), Collections.emptyList()));
        if (entry == null) {
            return false;
        }
        if (fieldSetEntry.getChildren().isEmpty()) {
            return true;
        }
        return entry.children != null && entry.children.containsAll(fieldSetEntry.getChildren());
    }

    /**
     * @return true if no field is selected; fragments without fields do not count
     */
    public boolean isEmpty() {
        for (Entry entry : entries.values()) {
            if (entry.isField() || !entry.children.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public void mergeFrom(SelectionSetBuilder other) {
        for (Entry entry : other.entries.values()) {
            if (entry.isField()) {
                SelectionSetBuilder child = field(entry.alias, entry.name, entry.arguments, entry.directives, entry.children != null);
                if (child != null && entry.children != null) {
                    child.mergeFrom(entry.children);
                }
            } else {
                inlineFragment(entry.typeCondition).mergeFrom(entry.children);
            }
        }
    }

    public SelectionSet toAst() {
        SelectionSet.Builder builder = SelectionSet.newSelectionSet();
        for (Entry entry : entries.values()) {
            if (entry.isField()) {
                Field.Builder fieldBuilder = Field.newField(entry.name)
                        .alias(entry.alias)
                        .arguments(entry.arguments)
                        .directives(entry.directives);
                if (entry.children != null) {
                    // a composite field needs at least one selection
                    fieldBuilder.selectionSet(entry.children.isEmpty()
                            ? SelectionSet.newSelectionSet().selection(Field.newField(TYPENAME).build()).build()
                            : entry.children.toAst());
                }
                builder.selection(fieldBuilder.build());
            } else if (!entry.children.isEmpty()) {
                builder.selection(InlineFragment.newInlineFragment()
                        .typeCondition(new TypeName(entry.typeCondition))
                        .selectionSet(entry.children.toAst())
                        .build());
            }
        }
        return builder.build();
    }

    private static String fieldKey(String alias, String name, List<Argument> arguments, List<Directive> directives) {
        StringBuilder sb = new StringBuilder();
        sb.append(alias != null ? alias : name).append(':').append(name).append('(');
        for (Argument argument : arguments) {
            sb.append(AstPrinter.printAst(argument)).append(',');
        }
        sb.append(')');
        for (Directive directive : directives) {
            sb.append(AstPrinter.printAst(directive));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return AstPrinter.printAst(toAst());
    }
}
