package io.github.cyfko.torm.core.exception;

/**
 * Exception thrown when a query filter, sort or pagination cannot be constructed.
 * <p>
 * Raised eagerly while a query is being built, never while it is evaluated: an evaluated
 * query is total over well-formed plans.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li>Unknown operator code, e.g. {@code "between"}</li>
 *   <li>Null or blank field name</li>
 *   <li>Negative {@code skip} or {@code limit}</li>
 *   <li>Sort direction other than {@code asc}/{@code desc}</li>
 * </ul>
 *
 * <pre>{@code
 * users.query().filter("age", "between", List.of(18, 65));
 * // -> QueryDefinitionException: Unknown operator: between
 * }</pre>
 *
 * @since 1.0.0
 */
public class QueryDefinitionException extends RuntimeException {

    /**
     * Creates a new QueryDefinitionException with detailed message.
     *
     * @param message explanation of the construction error
     */
    public QueryDefinitionException(String message) {
        super(message);
    }

    /**
     * Creates a new QueryDefinitionException with detailed message and cause.
     *
     * @param message explanation of the failure
     * @param cause underlying exception causing this failure
     */
    public QueryDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
