package io.github.cyfko.torm.kv.exception;

/**
 * Exception thrown when a document cannot be written to or read from its JSON form.
 * <p>
 * Typical causes are a stored value that is not a JSON object, truncated or malformed text,
 * or a JSON node type with no {@link io.github.cyfko.torm.core.model.Value} counterpart.
 * </p>
 *
 * @since 1.0.0
 */
public class DocumentCodecException extends RuntimeException {

    public DocumentCodecException(String message) {
        super(message);
    }

    public DocumentCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
