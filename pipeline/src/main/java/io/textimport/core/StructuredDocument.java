package io.textimport.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered list of named values. A value may itself be a {@code StructuredDocument}, which is how
 * dotted field names ({@code a.b}) are represented. Immutable once built.
 */
public final class StructuredDocument implements Iterable<StructuredDocument.Field> {
    private final List<Field> fields;

    private StructuredDocument(List<Field> fields) {
        this.fields = Collections.unmodifiableList(fields);
    }

    public static Builder builder() { return new Builder(); }

    public List<Field> fields() { return fields; }
    public int size() { return fields.size(); }
    public boolean isEmpty() { return fields.isEmpty(); }

    /** Value of the first field with this name, or {@code null}. */
    public Object get(String name) {
        for (Field f : fields) {
            if (f.name().equals(name)) return f.value();
        }
        return null;
    }

    /** Plain nested-map view, preserving field order. Later duplicates overwrite earlier ones. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Field f : fields) {
            Object v = f.value();
            out.put(f.name(), v instanceof StructuredDocument d ? d.toMap() : v);
        }
        return out;
    }

    @Override
    public Iterator<Field> iterator() { return fields.iterator(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructuredDocument that)) return false;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() { return fields.hashCode(); }

    @Override
    public String toString() { return toMap().toString(); }

    public record Field(String name, Object value) {
        public Field {
            Objects.requireNonNull(name, "name");
        }
    }

    public static final class Builder {
        // values are either plain objects or nested Builders until build()
        private final List<String> names = new ArrayList<>();
        private final List<Object> values = new ArrayList<>();

        public Builder append(String name, Object value) {
            names.add(Objects.requireNonNull(name, "name"));
            values.add(value);
            return this;
        }

        /**
         * Append under a dotted path, creating or reusing nested documents for each parent segment.
         *
         * @throws IllegalArgumentException if a parent segment already holds a non-document value
         */
        public Builder appendPath(String path, Object value) {
            int dot = path.indexOf('.');
            if (dot < 0) return append(path, value);
            String head = path.substring(0, dot);
            Builder child = null;
            for (int i = 0; i < names.size(); i++) {
                if (!names.get(i).equals(head)) continue;
                if (values.get(i) instanceof Builder b) {
                    child = b;
                    break;
                }
                throw new IllegalArgumentException("field '" + head + "' already holds a value; cannot set '" + path + "'");
            }
            if (child == null) {
                child = new Builder();
                append(head, child);
            }
            child.appendPath(path.substring(dot + 1), value);
            return this;
        }

        public boolean contains(String name) { return names.contains(name); }

        public StructuredDocument build() {
            List<Field> out = new ArrayList<>(names.size());
            for (int i = 0; i < names.size(); i++) {
                Object v = values.get(i);
                out.add(new Field(names.get(i), v instanceof Builder b ? b.build() : v));
            }
            return new StructuredDocument(out);
        }
    }
}
