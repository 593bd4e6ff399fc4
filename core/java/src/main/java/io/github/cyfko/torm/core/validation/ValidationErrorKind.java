package io.github.cyfko.torm.core.validation;

/**
 * Category of a validation failure.
 *
 * @since 1.0.0
 */
public enum ValidationErrorKind {

    /** A required field is absent or null on a full (non-partial) validation. */
    REQUIRED_FIELD_MISSING,

    /** The value is not of the field's declared kind. */
    TYPE_MISMATCH,

    /** A built-in length, range, pattern, email or URL rule failed. */
    CONSTRAINT_VIOLATION,

    /** The field's custom predicate rejected the value, failed, or threw. */
    CUSTOM_VALIDATION_FAILED
}
