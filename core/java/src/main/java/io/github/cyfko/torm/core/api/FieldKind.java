package io.github.cyfko.torm.core.api;

import io.github.cyfko.torm.core.exception.SchemaDefinitionException;
import io.github.cyfko.torm.core.model.Value;
import io.github.cyfko.torm.core.model.ValueType;

/**
 * Expected primitive category of a schema field.
 * <p>
 * {@link #NUMBER} covers every numeric representation; integers and decimals are not
 * distinguished. Arrays, objects and scalars are always distinct kinds.
 * </p>
 *
 * @since 1.0.0
 */
public enum FieldKind {
    STRING("string", ValueType.STRING),
    NUMBER("number", ValueType.NUMBER),
    BOOLEAN("boolean", ValueType.BOOLEAN),
    ARRAY("array", ValueType.ARRAY),
    OBJECT("object", ValueType.OBJECT);

    private final String code;
    private final ValueType valueType;

    FieldKind(String code, ValueType valueType) {
        this.code = code;
        this.valueType = valueType;
    }

    public String getCode() {
        return code;
    }

    /**
     * Checks whether a runtime value belongs to this kind.
     *
     * @param value the value to check
     * @return {@code true} when the value's type is this kind's type
     */
    public boolean matches(Value value) {
        return value != null && value.type() == valueType;
    }

    /**
     * Resolves a kind from its code or enum name, ignoring case.
     *
     * @param value the code, e.g. "string"
     * @return the matching kind
     * @throws SchemaDefinitionException if the value is unknown
     */
    public static FieldKind fromString(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (FieldKind kind : values()) {
                if (kind.code.equalsIgnoreCase(trimmed) || kind.name().equalsIgnoreCase(trimmed)) {
                    return kind;
                }
            }
        }
        throw new SchemaDefinitionException("unsupported field kind " + value);
    }

    @Override
    public String toString() {
        return code;
    }
}
