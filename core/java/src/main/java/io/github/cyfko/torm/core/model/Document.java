package io.github.cyfko.torm.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable stored record: an insertion-ordered mapping from field name to {@link Value}.
 * <p>
 * Documents are schemaless. Fields declared in a {@link Schema} are validated on write, every
 * other field passes through untouched. Three fields are reserved and managed by the model
 * facade rather than by callers:
 * </p>
 * <ul>
 *   <li>{@value #ID}: identity, a string unique within its collection</li>
 *   <li>{@value #CREATED_AT}: creation instant (ISO-8601)</li>
 *   <li>{@value #UPDATED_AT}: last update instant (ISO-8601)</li>
 * </ul>
 *
 * <p>Reading a field that is not present yields {@link Value#NULL}, so queries and validation
 * never need to special-case missing fields.</p>
 *
 * <pre>{@code
 * Document alice = Document.of(Map.of("name", "Alice", "age", 30));
 * alice.get("age");        // Num(30)
 * alice.get("nickname");   // Value.NULL
 *
 * Document older = alice.merge(Document.of(Map.of("age", 31)));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Document {

    public static final String ID = "_id";
    public static final String CREATED_AT = "_createdAt";
    public static final String UPDATED_AT = "_updatedAt";

    /** Fields owned by the model facade. */
    public static final Set<String> RESERVED_FIELDS = Set.of(ID, CREATED_AT, UPDATED_AT);

    private static final Document EMPTY = new Document(Map.of());

    private final Map<String, Value> fields;

    private Document(Map<String, Value> fields) {
        this.fields = fields;
    }

    public static Document empty() {
        return EMPTY;
    }

    /**
     * Creates a document from plain Java values, converting each with {@link Value#of(Object)}.
     *
     * @param data field map, iteration order is kept
     * @return the document
     * @throws IllegalArgumentException if a value cannot be converted
     */
    public static Document of(Map<String, ?> data) {
        Objects.requireNonNull(data, "data");
        Builder builder = builder();
        data.forEach(builder::field);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the value of a field.
     *
     * @param field the field name
     * @return the value, or {@link Value#NULL} when the field is absent
     */
    public Value get(String field) {
        Value value = fields.get(field);
        return value == null ? Value.NULL : value;
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Set<String> fields() {
        return fields.keySet();
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Returns the identity of this document.
     *
     * @return the {@value #ID} field when it holds a string, empty otherwise
     */
    public Optional<String> id() {
        Value id = fields.get(ID);
        return id instanceof Value.Str s ? Optional.of(s.value()) : Optional.empty();
    }

    /**
     * Returns a copy with one field set. An existing field keeps its position.
     *
     * @param field the field name
     * @param value the new value, {@code null} stores {@link Value#NULL}
     * @return a new document
     */
    public Document with(String field, Object value) {
        Objects.requireNonNull(field, "field");
        Map<String, Value> copy = new LinkedHashMap<>(fields);
        copy.put(field, Value.of(value));
        return new Document(Collections.unmodifiableMap(copy));
    }

    public Document without(String field) {
        if (!fields.containsKey(field)) return this;
        Map<String, Value> copy = new LinkedHashMap<>(fields);
        copy.remove(field);
        return new Document(Collections.unmodifiableMap(copy));
    }

    /**
     * Shallow merge: every field of {@code patch} replaces (or adds) the same field here,
     * fields the patch does not mention keep their current value.
     *
     * @param patch the fields to apply
     * @return a new merged document
     */
    public Document merge(Document patch) {
        Objects.requireNonNull(patch, "patch");
        if (patch.isEmpty()) return this;
        Map<String, Value> copy = new LinkedHashMap<>(fields);
        copy.putAll(patch.fields);
        return new Document(Collections.unmodifiableMap(copy));
    }

    /**
     * Returns the fields as an unmodifiable map of {@link Value}s.
     *
     * @return field values keyed by name
     */
    public Map<String, Value> values() {
        return fields;
    }

    /**
     * Unwraps the document into plain Java objects (see {@link Value#toJava()}).
     *
     * @return a new insertion-ordered map
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        fields.forEach((k, v) -> map.put(k, v.toJava()));
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return JsonText.write(fields);
    }

    /**
     * Fluent builder for {@link Document}.
     */
    public static final class Builder {
        private final Map<String, Value> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder field(String name, Object value) {
            fields.put(Objects.requireNonNull(name, "field name"), Value.of(value));
            return this;
        }

        public Builder fields(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::field);
            }
            return this;
        }

        public Document build() {
            return fields.isEmpty() ? EMPTY : new Document(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
