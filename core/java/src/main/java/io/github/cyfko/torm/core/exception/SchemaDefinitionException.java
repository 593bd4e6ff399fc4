package io.github.cyfko.torm.core.exception;

/**
 * Exception thrown when a schema or one of its field rules is inconsistent.
 * <p>
 * Examples: a negative {@code minLength}, {@code minLength > maxLength}, {@code min > max},
 * an invalid regular expression, or the same field declared twice.
 * </p>
 *
 * @since 1.0.0
 */
public class SchemaDefinitionException extends RuntimeException {

    public SchemaDefinitionException(String message) {
        super(message);
    }

    public SchemaDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
