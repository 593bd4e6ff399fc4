package io.github.cyfko.torm.core.model;

import io.github.cyfko.torm.core.exception.SchemaDefinitionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, per-collection set of field rules enforced on write.
 * <p>
 * Fields are validated in declaration order, and validation stops at the first failing field,
 * so the order fields are declared in decides which error is reported when several are invalid.
 * Document fields the schema does not declare are never checked.
 * </p>
 *
 * <pre>{@code
 * Schema users = Schema.builder()
 *         .field("name", FieldRule.string().required().minLength(3))
 *         .field("email", FieldRule.string().required().email())
 *         .field("age", FieldRule.number().min(13).max(120))
 *         .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Schema {

    private static final Schema EMPTY = new Schema(Map.of());

    private final Map<String, FieldRule> rules;

    private Schema(Map<String, FieldRule> rules) {
        this.rules = rules;
    }

    public static Schema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the rules in declaration order, unmodifiable
     */
    public Map<String, FieldRule> rules() {
        return rules;
    }

    public FieldRule rule(String field) {
        return rules.get(field);
    }

    public Set<String> fieldNames() {
        return rules.keySet();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "Schema" + rules;
    }

    public static final class Builder {
        private final Map<String, FieldRule> rules = new LinkedHashMap<>();

        private Builder() {}

        public Builder field(String name, FieldRule rule) {
            Objects.requireNonNull(rule, "rule");
            if (name == null || name.isBlank()) {
                throw new SchemaDefinitionException("field name required");
            }
            if (rules.putIfAbsent(name, rule) != null) {
                throw new SchemaDefinitionException("duplicate field " + name);
            }
            return this;
        }

        public Builder field(String name, FieldRule.Builder rule) {
            return field(name, Objects.requireNonNull(rule, "rule").build());
        }

        public Schema build() {
            return rules.isEmpty() ? EMPTY : new Schema(Collections.unmodifiableMap(new LinkedHashMap<>(rules)));
        }
    }
}
