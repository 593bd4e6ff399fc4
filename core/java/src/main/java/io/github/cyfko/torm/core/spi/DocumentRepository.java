package io.github.cyfko.torm.core.spi;

import io.github.cyfko.torm.core.model.Document;

import java.util.List;
import java.util.Optional;

/**
 * Boundary between the model facade and the backing store.
 * <p>
 * Keys are namespaced as {@code <namespace>:<collection>:<documentId>}; a collection is read by
 * its prefix {@code <namespace>:<collection>:}. Implementations own transport, timeouts and
 * retries, and signal an unreachable store with
 * {@link io.github.cyfko.torm.core.exception.RepositoryUnavailableException}.
 * </p>
 *
 * <p><strong>Consistency:</strong> {@link #fetchAll(String)} must return a consistent sequence
 * for a single call. Nothing is required across calls; two queries may observe different states.</p>
 *
 * @since 1.0.0
 */
public interface DocumentRepository {

    /**
     * Returns every document whose key starts with the given prefix.
     *
     * @param collectionKeyPrefix the collection prefix, e.g. {@code "toonstore:users:"}
     * @return the documents, possibly empty, never {@code null}
     */
    List<Document> fetchAll(String collectionKeyPrefix);

    /**
     * Returns the document stored under a key.
     *
     * @param key the full document key
     * @return the document, or empty if none is stored
     */
    Optional<Document> fetchOne(String key);

    /**
     * Stores a document, replacing any previous value under the key.
     *
     * @param key      the full document key
     * @param document the document to store
     */
    void put(String key, Document document);

    /**
     * Deletes the document stored under a key.
     *
     * @param key the full document key
     * @return {@code true} if a document was deleted, {@code false} if none existed
     */
    boolean delete(String key);
}
