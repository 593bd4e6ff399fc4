package io.github.cyfko.torm.core.api;

import io.github.cyfko.torm.core.exception.QueryDefinitionException;

/**
 * Enumeration of supported query filter operators.
 * <p>
 * Each operator has a display symbol and a short lower-case code, the latter being the wire
 * name used by every TORM client ({@code eq}, {@code gte}, {@code not_in}, ...).
 * All filters of a query are AND-combined; there is no OR or grouping operator.
 * </p>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Op op = Op.fromString("gte");     // GTE
 * Op same = Op.fromString(">=");    // GTE
 *
 * users.query()
 *      .filter("age", Op.GTE, 18)
 *      .filter("status", Op.IN, List.of("ACTIVE", "PENDING"))
 *      .exec();
 * }</pre>
 *
 * <p><strong>Operator Categories:</strong></p>
 * <pre>{@code
 * // Equality (numbers numerically, other values structurally)
 * user.age == 25              -> Op.EQ
 * user.status != "BANNED"     -> Op.NE
 *
 * // Ordering (numeric, or lexicographic between two strings)
 * user.age > 18               -> Op.GT
 * user.age >= 21              -> Op.GTE
 * user.name < "M"             -> Op.LT
 * user.score <= 5             -> Op.LTE
 *
 * // Substring on the string forms of both operands
 * user.email CONTAINS "@corp" -> Op.CONTAINS
 *
 * // Membership, the filter value must be an array
 * user.role IN [...]          -> Op.IN
 * user.role NOT IN [...]      -> Op.NOT_IN
 * }</pre>
 *
 * @since 1.0.0
 */
public enum Op {

    /** Equality operator: "=" */
    EQ("=", "eq"),

    /** Not equal operator: "!=" */
    NE("!=", "ne"),

    /** Greater than operator: "&gt;" */
    GT(">", "gt"),

    /** Greater than or equal operator: "&gt;=" */
    GTE(">=", "gte"),

    /** Less than operator: "&lt;" */
    LT("<", "lt"),

    /** Less than or equal operator: "&lt;=" */
    LTE("<=", "lte"),

    /** Substring operator: "CONTAINS" */
    CONTAINS("CONTAINS", "contains"),

    /** Inclusion operator: "IN" */
    IN("IN", "in"),

    /** Negated inclusion operator: "NOT IN" */
    NOT_IN("NOT IN", "not_in");

    private final String symbol;
    private final String code;

    Op(String symbol, String code) {
        this.symbol = symbol;
        this.code = code;
    }

    /**
     * Returns the display symbol of the operator, such as "=", "&gt;=" or "NOT IN".
     *
     * @return the symbol representing the operator
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the wire code of the operator, such as "eq", "gte" or "not_in".
     *
     * @return the lower-case code
     */
    public String getCode() {
        return code;
    }

    /**
     * Whether the filter value of this operator is expected to be an array.
     *
     * @return {@code true} for {@link #IN} and {@link #NOT_IN}
     */
    public boolean expectsArray() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Finds an {@code Op} by its symbol, code or enum name, ignoring case.
     *
     * @param value symbol or code string to search for
     * @return matching {@code Op}, never {@code null}
     * @throws QueryDefinitionException if {@code value} is null, blank or unknown
     */
    public static Op fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new QueryDefinitionException("operator cannot be null nor blank");
        }
        String trimmed = value.trim();
        for (Op op : values()) {
            if (op.symbol.equalsIgnoreCase(trimmed)
                    || op.code.equalsIgnoreCase(trimmed)
                    || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        throw new QueryDefinitionException("Unknown operator: " + trimmed);
    }
}
