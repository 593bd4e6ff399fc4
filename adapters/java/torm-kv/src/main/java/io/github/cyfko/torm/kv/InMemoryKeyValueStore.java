package io.github.cyfko.torm.kv;

import io.github.cyfko.torm.core.exception.RepositoryUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link KeyValueStore} held in a {@link ConcurrentSkipListMap}.
 * <p>
 * Keys are kept sorted, so a prefix scan is a range scan. Scans are weakly consistent: they
 * never fail under concurrent writes, but may or may not see writes made while they run.
 * After {@link #close()} every operation raises {@link RepositoryUnavailableException}.
 * </p>
 *
 * <pre>{@code
 * try (InMemoryKeyValueStore store = new InMemoryKeyValueStore()) {
 *     Torm torm = new Torm(new KeyValueDocumentRepository(store));
 *     ...
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class InMemoryKeyValueStore implements KeyValueStore, AutoCloseable {

    private final ConcurrentSkipListMap<String, String> entries = new ConcurrentSkipListMap<>();
    private volatile boolean closed;

    @Override
    public Optional<String> get(String key) {
        ensureOpen();
        return Optional.ofNullable(entries.get(Objects.requireNonNull(key, "key")));
    }

    @Override
    public void set(String key, String value) {
        ensureOpen();
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public boolean delete(String key) {
        ensureOpen();
        return entries.remove(Objects.requireNonNull(key, "key")) != null;
    }

    @Override
    public List<String> keys(String prefix) {
        ensureOpen();
        Objects.requireNonNull(prefix, "prefix");
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, String> entry : entries.tailMap(prefix, true).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                break;
            }
            keys.add(entry.getKey());
        }
        return keys;
    }

    public int size() {
        ensureOpen();
        return entries.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Discards every entry and rejects further operations.
     */
    @Override
    public void close() {
        closed = true;
        entries.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new RepositoryUnavailableException("Key-value store is closed");
        }
    }
}
