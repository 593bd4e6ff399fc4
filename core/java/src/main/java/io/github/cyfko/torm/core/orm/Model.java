package io.github.cyfko.torm.core.orm;

import io.github.cyfko.torm.core.api.FieldKind;
import io.github.cyfko.torm.core.api.Op;
import io.github.cyfko.torm.core.config.TormConfig;
import io.github.cyfko.torm.core.exception.DocumentValidationException;
import io.github.cyfko.torm.core.exception.DuplicateDocumentException;
import io.github.cyfko.torm.core.model.Document;
import io.github.cyfko.torm.core.model.QueryFilter;
import io.github.cyfko.torm.core.model.QueryPlan;
import io.github.cyfko.torm.core.model.Schema;
import io.github.cyfko.torm.core.model.Value;
import io.github.cyfko.torm.core.query.QueryEvaluator;
import io.github.cyfko.torm.core.spi.DocumentRepository;
import io.github.cyfko.torm.core.validation.DocumentValidator;
import io.github.cyfko.torm.core.validation.ValidationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * CRUD and query surface of one collection.
 * <p>
 * A model binds a name, a {@link Schema} and a collection to a {@link DocumentRepository}.
 * Every document lives under the key {@code <namespace>:<collection>:<_id>}. Writes are
 * validated before the repository is touched, so a rejected document leaves no trace.
 * Reads fetch the whole collection and filter it in memory with {@link QueryEvaluator}.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * Torm torm = new Torm(repository);
 * Model users = torm.model("User", Schema.builder()
 *         .field("name", FieldRule.string().required().minLength(3))
 *         .field("email", FieldRule.string().required().email())
 *         .build());
 *
 * Document alice = users.create(Map.of("name", "Alice", "email", "alice@example.com"));
 * users.update(alice.id().orElseThrow(), Map.of("age", 31));
 *
 * List<Document> adults = users.query()
 *         .filter("age", Op.GTE, 18)
 *         .sort("name")
 *         .limit(10)
 *         .exec();
 * }</pre>
 *
 * <p>Models hold no mutable state and can be shared between threads. There is no
 * multi-document atomicity: {@link #deleteMany(Map)} deletes one key at a time.</p>
 *
 * @since 1.0.0
 * @see io.github.cyfko.torm.core.Torm
 * @see QueryBuilder
 */
public class Model {

    private static final Logger log = Logger.getLogger(Model.class.getName());

    private final String name;
    private final String collection;
    private final Schema schema;
    private final boolean validate;
    private final DocumentRepository repository;
    private final TormConfig config;
    private final String keyPrefix;

    /**
     * Creates a model. Applications normally obtain models from
     * {@link io.github.cyfko.torm.core.Torm#model(String, Schema, ModelOptions)}.
     */
    public Model(String name, Schema schema, ModelOptions options, DocumentRepository repository, TormConfig config) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("model name cannot be blank");
        }
        this.name = name;
        this.schema = Objects.requireNonNull(schema, "schema");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.config = Objects.requireNonNull(config, "config");
        ModelOptions opts = options == null ? ModelOptions.defaults() : options;
        this.collection = opts.collection() != null ? opts.collection() : name.toLowerCase(Locale.ROOT);
        this.validate = opts.validate() != null ? opts.validate() : config.isValidateOnWrite();
        this.keyPrefix = config.getNamespace() + ":" + collection + ":";
    }

    public String getName() { return name; }
    public String getCollection() { return collection; }
    public Schema getSchema() { return schema; }
    public boolean isValidating() { return validate; }

    /**
     * @return the prefix shared by every key of this collection, e.g. {@code toonstore:user:}
     */
    public String getKeyPrefix() { return keyPrefix; }

    public String keyFor(String id) {
        return keyPrefix + Objects.requireNonNull(id, "id");
    }

    // ---------------------------------------------------------------- writes

    public Document create(Map<String, ?> data) {
        return create(Document.of(data));
    }

    /**
     * Validates and stores a new document.
     * <p>
     * A non-blank string {@code _id} is kept, otherwise one is generated. {@code _createdAt} and
     * {@code _updatedAt} are always stamped from the configured clock.
     * </p>
     *
     * @param data the document fields
     * @return the stored document, including reserved fields
     * @throws DocumentValidationException if the document breaks the schema or {@code _id} is not a string
     * @throws DuplicateDocumentException  if {@code _id} is already used in the collection
     */
    public Document create(Document data) {
        Objects.requireNonNull(data, "data");
        if (validate) {
            DocumentValidator.validate(schema, data, false).orThrow();
        }

        String id = resolveId(data.get(Document.ID));
        String key = keyFor(id);
        if (repository.fetchOne(key).isPresent()) {
            throw new DuplicateDocumentException(collection, id);
        }

        String now = config.getClock().instant().toString();
        Document.Builder builder = Document.builder().field(Document.ID, id);
        data.values().forEach((field, value) -> {
            if (!Document.RESERVED_FIELDS.contains(field)) {
                builder.field(field, value);
            }
        });
        Document stored = builder
                .field(Document.CREATED_AT, now)
                .field(Document.UPDATED_AT, now)
                .build();

        repository.put(key, stored);
        log.fine(() -> String.format("Created %s in %s", id, collection));
        return stored;
    }

    public Optional<Document> update(String id, Map<String, ?> patch) {
        return update(id, Document.of(patch));
    }

    /**
     * Shallow-merges a patch into a stored document and re-stamps {@code _updatedAt}.
     * <p>
     * The patch is validated without required checks. Reserved fields in the patch are ignored.
     * </p>
     *
     * @param id    the document identity
     * @param patch the fields to set
     * @return the updated document, or empty when no document has this identity
     * @throws DocumentValidationException if a patched field breaks the schema
     */
    public Optional<Document> update(String id, Document patch) {
        String key = keyFor(id);
        Objects.requireNonNull(patch, "patch");

        Document changes = patch;
        for (String reserved : Document.RESERVED_FIELDS) {
            changes = changes.without(reserved);
        }
        if (validate) {
            DocumentValidator.validate(schema, changes, true).orThrow();
        }

        Optional<Document> existing = repository.fetchOne(key);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Document updated = existing.get()
                .merge(changes)
                .with(Document.UPDATED_AT, config.getClock().instant().toString());
        repository.put(key, updated);
        log.fine(() -> String.format("Updated %s in %s (%d fields)", id, collection, patch.size()));
        return Optional.of(updated);
    }

    /**
     * @return {@code true} if a document was removed, {@code false} if none had this identity
     */
    public boolean delete(String id) {
        boolean deleted = repository.delete(keyFor(id));
        log.fine(() -> String.format("Delete %s in %s: %s", id, collection, deleted ? "removed" : "not found"));
        return deleted;
    }

    public long deleteMany() {
        return deleteMany(Map.of());
    }

    /**
     * Deletes every document whose fields equal the given values.
     *
     * @param equalsFilter field values to match, empty to delete the whole collection
     * @return the number of documents deleted
     */
    public long deleteMany(Map<String, ?> equalsFilter) {
        List<Document> matches = execute(new QueryPlan(equalityFilters(equalsFilter), null, null, null));
        long deleted = 0;
        for (Document document : matches) {
            Optional<String> id = document.id();
            if (id.isPresent() && repository.delete(keyFor(id.get()))) {
                deleted++;
            }
        }
        long total = deleted;
        log.fine(() -> String.format("Deleted %d documents from %s", total, collection));
        return deleted;
    }

    // ---------------------------------------------------------------- reads

    public List<Document> find() {
        return execute(QueryPlan.all());
    }

    /**
     * @param equalsFilter field values to match with {@link Op#EQ}
     * @return matching documents in repository order
     */
    public List<Document> find(Map<String, ?> equalsFilter) {
        return execute(new QueryPlan(equalityFilters(equalsFilter), null, null, null));
    }

    public Optional<Document> findById(String id) {
        return repository.fetchOne(keyFor(id));
    }

    /**
     * @return the first matching document in repository order
     */
    public Optional<Document> findOne(Map<String, ?> equalsFilter) {
        List<Document> first = execute(new QueryPlan(equalityFilters(equalsFilter), null, null, 1));
        return first.stream().findFirst();
    }

    public boolean exists(String id) {
        return findById(id).isPresent();
    }

    public long count() {
        return countMatching(List.of());
    }

    public long count(Map<String, ?> equalsFilter) {
        return countMatching(equalityFilters(equalsFilter));
    }

    public QueryBuilder query() {
        return new QueryBuilder(this);
    }

    /**
     * Fetches the collection and applies a plan to it.
     *
     * @param plan the query
     * @return the resulting documents
     */
    public List<Document> execute(QueryPlan plan) {
        Objects.requireNonNull(plan, "plan");
        log.fine(() -> String.format("Executing query on %s: %s", collection, plan));

        long start = System.nanoTime();
        List<Document> results = QueryEvaluator.apply(repository.fetchAll(keyPrefix), plan);
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        log.fine(() -> String.format("Query on %s returned %d documents in %d ms", collection, results.size(), durationMs));
        return results;
    }

    long countMatching(List<QueryFilter> filters) {
        return QueryEvaluator.count(repository.fetchAll(keyPrefix), filters);
    }

    private String resolveId(Value raw) {
        if (raw.isNull()) {
            return config.getIdGenerator().nextId();
        }
        if (!(raw instanceof Value.Str s)) {
            throw new DocumentValidationException(ValidationError.typeMismatch(Document.ID, FieldKind.STRING));
        }
        return s.value().isBlank() ? config.getIdGenerator().nextId() : s.value();
    }

    private static List<QueryFilter> equalityFilters(Map<String, ?> equalsFilter) {
        Objects.requireNonNull(equalsFilter, "equalsFilter");
        List<QueryFilter> filters = new ArrayList<>(equalsFilter.size());
        equalsFilter.forEach((field, value) -> filters.add(QueryFilter.of(field, Op.EQ, value)));
        return filters;
    }

    @Override
    public String toString() {
        return "Model{name=" + name + ", collection=" + collection + ", schema=" + schema.fieldNames() + "}";
    }
}
