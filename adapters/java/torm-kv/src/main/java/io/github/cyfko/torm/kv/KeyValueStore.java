package io.github.cyfko.torm.kv;

import java.util.List;
import java.util.Optional;

/**
 * Minimal contract of the backing key-value store.
 * <p>
 * Values are opaque strings. Implementations signal an unreachable store with
 * {@link io.github.cyfko.torm.core.exception.RepositoryUnavailableException} and own any
 * retry, timeout or connection handling.
 * </p>
 *
 * @since 1.0.0
 */
public interface KeyValueStore {

    /**
     * @param key the key
     * @return the stored value, or empty if the key is unknown
     */
    Optional<String> get(String key);

    /**
     * Stores a value, replacing any previous one.
     */
    void set(String key, String value);

    /**
     * @return {@code true} if a value was removed
     */
    boolean delete(String key);

    /**
     * Lists keys starting with a prefix.
     *
     * @param prefix the key prefix, empty for every key
     * @return matching keys in ascending order
     */
    List<String> keys(String prefix);
}
