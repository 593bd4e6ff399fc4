package io.github.cyfko.torm.core.orm;

import io.github.cyfko.torm.core.exception.SchemaDefinitionException;

/**
 * Per-model overrides.
 *
 * @param collection collection name; {@code null} means the lower-cased model name
 * @param validate   whether writes are validated; {@code null} means the {@code TormConfig} default
 * @since 1.0.0
 */
public record ModelOptions(String collection, Boolean validate) {

    private static final ModelOptions DEFAULTS = new ModelOptions(null, null);

    public ModelOptions {
        if (collection != null && (collection.isBlank() || collection.indexOf(':') >= 0)) {
            throw new SchemaDefinitionException("collection must be non-blank and must not contain ':', got: " + collection);
        }
    }

    public static ModelOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String collection;
        private Boolean validate;

        private Builder() {}

        public Builder collection(String collection) {
            this.collection = collection;
            return this;
        }

        public Builder validate(boolean validate) {
            this.validate = validate;
            return this;
        }

        public ModelOptions build() {
            return new ModelOptions(collection, validate);
        }
    }
}
