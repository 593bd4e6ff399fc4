package io.github.cyfko.torm.core;

import io.github.cyfko.torm.core.config.TormConfig;
import io.github.cyfko.torm.core.model.Schema;
import io.github.cyfko.torm.core.orm.Model;
import io.github.cyfko.torm.core.orm.ModelOptions;
import io.github.cyfko.torm.core.spi.DocumentRepository;

import java.util.Objects;

/**
 * Entry point: binds a {@link DocumentRepository} and a {@link TormConfig}, and hands out
 * {@link Model}s.
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * // 1. Pick a repository (see the torm-kv module)
 * DocumentRepository repository = new KeyValueDocumentRepository(new InMemoryKeyValueStore());
 *
 * // 2. Create the entry point
 * Torm torm = new Torm(repository, TormConfig.builder().namespace("shop").build());
 *
 * // 3. Declare a model
 * Model products = torm.model("Product", Schema.builder()
 *         .field("sku", FieldRule.string().required().pattern("^[A-Z]{3}-\\d{4}$"))
 *         .field("price", FieldRule.number().required().min(0))
 *         .build());
 *
 * // 4. Use it
 * products.create(Map.of("sku", "ABC-0001", "price", 12.5));
 * List<Document> cheap = products.query().filter("price", Op.LT, 20).sort("price").exec();
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe. Models are cheap and may be created on demand.</p>
 *
 * @see Model
 * @since 1.0.0
 */
public final class Torm {

    private final DocumentRepository repository;
    private final TormConfig config;

    public Torm(DocumentRepository repository) {
        this(repository, TormConfig.defaults());
    }

    public Torm(DocumentRepository repository, TormConfig config) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Creates a schemaless model: every write is accepted as-is.
     *
     * @param name model name, its lower-cased form is the collection
     * @return the model
     */
    public Model model(String name) {
        return model(name, Schema.empty(), ModelOptions.defaults());
    }

    public Model model(String name, Schema schema) {
        return model(name, schema, ModelOptions.defaults());
    }

    public Model model(String name, Schema schema, ModelOptions options) {
        return new Model(name, schema, options, repository, config);
    }

    public DocumentRepository getRepository() {
        return repository;
    }

    public TormConfig getConfig() {
        return config;
    }
}
