package io.github.cyfko.torm.core.utils;

import io.github.cyfko.torm.core.model.Value;
import io.github.cyfko.torm.core.model.ValueType;

import java.util.Comparator;
import java.util.OptionalInt;

/**
 * Comparison rules between dynamically-typed {@link Value}s, shared by query filtering and sorting.
 * <p>
 * None of these methods throws for any pair of values: operands that cannot be compared
 * simply do not match.
 * </p>
 *
 * <p><strong>Equality ({@link #looseEquals}):</strong></p>
 * <ul>
 *   <li>two numbers: numeric equality ({@code 30 == 30.0})</li>
 *   <li>same type: deep structural equality</li>
 *   <li>null: equal to null only</li>
 *   <li>two scalars of different types: their string forms are compared ({@code "30" == 30})</li>
 *   <li>array or object against anything of another type: not equal</li>
 * </ul>
 *
 * <p><strong>Ordering ({@link #compare}):</strong> numeric between two numbers, lexicographic
 * between two strings, {@code false < true} between two booleans, undefined otherwise.</p>
 *
 * <p><strong>Sort order ({@link #SORT_ORDER}):</strong> a total order so every collection can be
 * sorted: null first, then numbers, strings, booleans, arrays, objects; arrays and objects
 * among themselves by their JSON text.</p>
 *
 * @since 1.0.0
 */
public final class ValueComparisons {

    /** Total ordering used for sorting query results in ascending order. */
    public static final Comparator<Value> SORT_ORDER = ValueComparisons::sortCompare;

    private ValueComparisons() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Equality used by {@code eq}, {@code ne}, {@code in} and {@code not_in}.
     *
     * @param left  field value, never {@code null}
     * @param right filter value, never {@code null}
     * @return whether the two values are considered equal
     */
    public static boolean looseEquals(Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return l.value().compareTo(r.value()) == 0;
        }
        if (left.type() == right.type()) {
            return left.equals(right);
        }
        if (left.isScalar() && right.isScalar()) {
            return left.asText().equals(right.asText());
        }
        return false;
    }

    /**
     * Ordering used by {@code gt}, {@code gte}, {@code lt} and {@code lte}.
     *
     * @param left  field value
     * @param right filter value
     * @return the sign of the comparison, or empty when the two values are not comparable
     */
    public static OptionalInt compare(Value left, Value right) {
        if (left instanceof Value.Num l && right instanceof Value.Num r) {
            return OptionalInt.of(l.value().compareTo(r.value()));
        }
        if (left instanceof Value.Str l && right instanceof Value.Str r) {
            return OptionalInt.of(l.value().compareTo(r.value()));
        }
        if (left instanceof Value.Bool l && right instanceof Value.Bool r) {
            return OptionalInt.of(Boolean.compare(l.value(), r.value()));
        }
        return OptionalInt.empty();
    }

    /**
     * Substring test on the string forms of both operands.
     *
     * @param left  field value
     * @param right filter value
     * @return {@code true} when {@code left.asText()} contains {@code right.asText()}
     */
    public static boolean contains(Value left, Value right) {
        return left.asText().contains(right.asText());
    }

    /**
     * Membership test: {@code candidates} must be an array, otherwise nothing is a member.
     *
     * @param value      field value
     * @param candidates filter value
     * @return {@code true} if an element of the array equals {@code value}
     */
    public static boolean isMember(Value value, Value candidates) {
        if (!(candidates instanceof Value.Arr arr)) {
            return false;
        }
        for (Value candidate : arr.values()) {
            if (looseEquals(value, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static int sortCompare(Value left, Value right) {
        int byRank = Integer.compare(rank(left.type()), rank(right.type()));
        if (byRank != 0) {
            return byRank;
        }
        return switch (left.type()) {
            case NULL -> 0;
            case ARRAY, OBJECT -> left.asText().compareTo(right.asText());
            default -> compare(left, right).orElse(0);
        };
    }

    private static int rank(ValueType type) {
        return switch (type) {
            case NULL -> 0;
            case NUMBER -> 1;
            case STRING -> 2;
            case BOOLEAN -> 3;
            case ARRAY -> 4;
            case OBJECT -> 5;
        };
    }
}
