package io.github.cyfko.torm.spring.support;

import io.github.cyfko.torm.core.Torm;
import io.github.cyfko.torm.core.orm.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central registry of the {@link Model}s declared as {@link ModelDefinition} beans.
 * <p>
 * Populated once at construction; safe for concurrent reads afterwards.
 * </p>
 *
 * <h2>Usage Context</h2>
 * <pre>{@code
 * @Service
 * class UserService {
 *     private final Model users;
 *
 *     UserService(ModelRegistry models) {
 *         this.users = models.getModel("User");
 *     }
 * }
 * }</pre>
 */
public class ModelRegistry {

    private final Map<String, Model> modelsByName;

    /**
     * Creates every declared model.
     *
     * @param torm        the entry point models are created from
     * @param definitions model declarations
     * @throws IllegalArgumentException if two definitions share a name
     */
    public ModelRegistry(Torm torm, List<ModelDefinition> definitions) {
        Map<String, Model> models = new LinkedHashMap<>();
        for (ModelDefinition definition : definitions) {
            Model model = torm.model(definition.name(), definition.schema(), definition.options());
            if (models.putIfAbsent(definition.name(), model) != null) {
                throw new IllegalArgumentException("Model '" + definition.name() + "' is declared more than once");
            }
        }
        this.modelsByName = Collections.unmodifiableMap(models);
    }

    /**
     * Retrieves a model by name.
     *
     * @param name model name as declared
     * @return the model
     * @throws IllegalArgumentException if no model has this name
     */
    public Model getModel(String name) {
        Model model = modelsByName.get(name);
        if (model == null) {
            throw new IllegalArgumentException(
                    "No model named " + name + ". Declare it with a ModelDefinition bean.");
        }
        return model;
    }

    public boolean hasModel(String name) {
        return modelsByName.containsKey(name);
    }

    /**
     * @return registered models by name, in declaration order
     */
    public Map<String, Model> getModels() {
        return modelsByName;
    }
}
