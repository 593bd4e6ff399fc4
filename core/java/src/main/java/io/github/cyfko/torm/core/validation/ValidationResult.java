package io.github.cyfko.torm.core.validation;

import io.github.cyfko.torm.core.exception.DocumentValidationException;

import java.util.Objects;
import java.util.Optional;

/**
 * Class representing the result of validating a document against a schema.
 * <p>
 * The result is either a success, or a failure carrying the single {@link ValidationError}
 * of the first field that did not pass.
 * </p>
 *
 * <p>Instances are immutable and created via the static methods
 * {@link #success()} and {@link #failure(ValidationError)}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = DocumentValidator.validate(schema, document, false);
 * if (!result.isValid()) {
 *     log.warning("Validation error: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(null);

    private final ValidationError error;

    private ValidationResult(ValidationError error) {
        this.error = error;
    }

    /**
     * Creates an instance indicating a successful validation.
     *
     * @return a valid result with no error
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * Creates an instance indicating a failed validation.
     *
     * @param error the first failure
     * @return an invalid result containing the provided error
     */
    public static ValidationResult failure(ValidationError error) {
        return new ValidationResult(Objects.requireNonNull(error, "error"));
    }

    /**
     * Indicates whether the validation succeeded.
     *
     * @return true if valid, false otherwise
     */
    public boolean isValid() {
        return error == null;
    }

    public Optional<ValidationError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the error message associated with a failed validation.
     *
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return error == null ? null : error.message();
    }

    /**
     * Throws when this result is a failure.
     *
     * @throws DocumentValidationException carrying the error
     */
    public void orThrow() {
        if (error != null) {
            throw new DocumentValidationException(error);
        }
    }

    @Override
    public String toString() {
        return error == null ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + error.message() + "]";
    }
}
