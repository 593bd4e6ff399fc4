package io.github.cyfko.torm.core.model;

import io.github.cyfko.torm.core.api.Op;
import io.github.cyfko.torm.core.exception.QueryDefinitionException;

import java.util.Objects;

/**
 * One predicate of a query: {@code field op value}.
 * <p>
 * All filters of a {@link QueryPlan} are AND-combined. The value is held as a {@link Value};
 * for {@link Op#IN} and {@link Op#NOT_IN} it is expected to be an array, but a non-array value
 * is accepted here and simply never matches during evaluation.
 * </p>
 *
 * <pre>{@code
 * QueryFilter adults = QueryFilter.of("age", Op.GTE, 18);
 * QueryFilter roles = new QueryFilter("role", "in", List.of("ADMIN", "OWNER"));
 * }</pre>
 *
 * @param field the field name, never blank
 * @param op    the operator
 * @param value the operand, {@link Value#NULL} when {@code null} was given
 * @since 1.0.0
 */
public record QueryFilter(String field, Op op, Value value) {

    public QueryFilter {
        if (field == null || field.isBlank()) {
            throw new QueryDefinitionException("filter field cannot be null nor blank");
        }
        Objects.requireNonNull(op, "op");
        value = value == null ? Value.NULL : value;
    }

    /**
     * Creates a filter from an operator code or symbol and a plain Java operand.
     *
     * @param field the field name
     * @param op    operator code or symbol, e.g. {@code "gte"} or {@code ">="}
     * @param value the operand, converted with {@link Value#of(Object)}
     * @throws QueryDefinitionException if the operator is unknown or the operand cannot be converted
     */
    public QueryFilter(String field, String op, Object value) {
        this(field, Op.fromString(op), toValue(field, value));
    }

    public static QueryFilter of(String field, Op op, Object value) {
        return new QueryFilter(field, op, toValue(field, value));
    }

    private static Value toValue(String field, Object value) {
        try {
            return Value.of(value);
        } catch (IllegalArgumentException e) {
            throw new QueryDefinitionException("Unsupported filter value for field '" + field + "': " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return field + " " + op.getSymbol() + " " + value;
    }
}
