package io.github.cyfko.torm.spring.support;

import io.github.cyfko.torm.core.model.Schema;
import io.github.cyfko.torm.core.orm.ModelOptions;

import java.util.Objects;

/**
 * Declares a model to be created at startup and published through the {@link ModelRegistry}.
 *
 * <pre>{@code
 * @Bean
 * ModelDefinition users() {
 *     return ModelDefinition.of("User", Schema.builder()
 *             .field("email", FieldRule.string().required().email())
 *             .build());
 * }
 * }</pre>
 *
 * @param name    model name
 * @param schema  field rules
 * @param options per-model overrides
 */
public record ModelDefinition(String name, Schema schema, ModelOptions options) {

    public ModelDefinition {
        Objects.requireNonNull(name, "name");
        schema = schema == null ? Schema.empty() : schema;
        options = options == null ? ModelOptions.defaults() : options;
    }

    public static ModelDefinition of(String name, Schema schema) {
        return new ModelDefinition(name, schema, ModelOptions.defaults());
    }
}
