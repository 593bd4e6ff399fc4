package io.github.cyfko.torm.core.exception;

import io.github.cyfko.torm.core.validation.ValidationError;
import io.github.cyfko.torm.core.validation.ValidationErrorKind;

import java.util.Objects;

/**
 * Exception thrown when a document is rejected by its model's schema.
 * <p>
 * Validation stops at the first failing field, so this exception always carries exactly one
 * {@link ValidationError}. It is raised before the backing store is touched: a rejected
 * write leaves no trace.
 * </p>
 *
 * <p><strong>Failure kinds:</strong></p>
 * <ul>
 *   <li>{@link ValidationErrorKind#REQUIRED_FIELD_MISSING}: required field absent or null on create</li>
 *   <li>{@link ValidationErrorKind#TYPE_MISMATCH}: value of the wrong kind</li>
 *   <li>{@link ValidationErrorKind#CONSTRAINT_VIOLATION}: length, range, pattern, email or URL rule</li>
 *   <li>{@link ValidationErrorKind#CUSTOM_VALIDATION_FAILED}: the field's custom predicate said no</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     users.create(Map.of("name", "Al"));
 * } catch (DocumentValidationException e) {
 *     e.getError().field();           // "name"
 *     e.getError().constraintName();  // "minLength"
 *     e.getMessage();                 // "Validation error: Field 'name' must be at least 3 characters"
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @see io.github.cyfko.torm.core.validation.DocumentValidator
 */
public class DocumentValidationException extends RuntimeException {

    private final ValidationError error;

    public DocumentValidationException(ValidationError error) {
        super("Validation error: " + Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }

    public String getField() {
        return error.field();
    }

    public ValidationErrorKind getKind() {
        return error.kind();
    }
}
