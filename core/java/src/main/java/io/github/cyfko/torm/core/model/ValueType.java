package io.github.cyfko.torm.core.model;

/**
 * Runtime category of a {@link Value}.
 * <p>
 * Mirrors the six JSON shapes a stored document field can take.
 * </p>
 *
 * @since 1.0.0
 */
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    ARRAY,
    OBJECT
}
