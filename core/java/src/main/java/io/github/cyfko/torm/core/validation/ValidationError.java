package io.github.cyfko.torm.core.validation;

import io.github.cyfko.torm.core.api.FieldKind;

import java.util.Objects;

/**
 * Structured description of the first failing field of a document.
 *
 * @param kind           the failure category
 * @param field          the failing field
 * @param constraintName the violated constraint ({@code required}, {@code type}, {@code minLength},
 *                       {@code maxLength}, {@code pattern}, {@code email}, {@code url}, {@code min},
 *                       {@code max} or {@code custom})
 * @param bound          the constraint's bound, expected kind or pattern, {@code null} when it has none
 * @param message        human-readable message
 * @since 1.0.0
 */
public record ValidationError(ValidationErrorKind kind, String field, String constraintName, String bound, String message) {

    public ValidationError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(constraintName, "constraintName");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationError required(String field) {
        return new ValidationError(ValidationErrorKind.REQUIRED_FIELD_MISSING, field, "required", null,
                "Field '" + field + "' is required");
    }

    public static ValidationError typeMismatch(String field, FieldKind expected) {
        return new ValidationError(ValidationErrorKind.TYPE_MISMATCH, field, "type", expected.getCode(),
                "Field '" + field + "' must be of type " + expected.getCode());
    }

    public static ValidationError constraint(String field, String constraintName, String bound, String message) {
        return new ValidationError(ValidationErrorKind.CONSTRAINT_VIOLATION, field, constraintName, bound, message);
    }

    public static ValidationError custom(String field) {
        return new ValidationError(ValidationErrorKind.CUSTOM_VALIDATION_FAILED, field, "custom", null,
                "Field '" + field + "' failed custom validation");
    }
}
