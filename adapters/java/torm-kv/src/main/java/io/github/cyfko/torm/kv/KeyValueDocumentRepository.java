package io.github.cyfko.torm.kv;

import io.github.cyfko.torm.core.model.Document;
import io.github.cyfko.torm.core.spi.DocumentRepository;
import io.github.cyfko.torm.kv.codec.DocumentJsonCodec;
import io.github.cyfko.torm.kv.exception.DocumentCodecException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * {@link DocumentRepository} storing each document as one JSON value in a {@link KeyValueStore}.
 * <p>
 * A collection scan lists the keys under the collection prefix and reads them one by one; a
 * key deleted between the listing and the read is skipped. Entries that cannot be decoded are
 * skipped by {@link #fetchAll(String)} with a warning, while {@link #fetchOne(String)} reports
 * them with a {@link DocumentCodecException}.
 * </p>
 *
 * <p>Store failures are propagated unchanged.</p>
 *
 * @since 1.0.0
 */
public class KeyValueDocumentRepository implements DocumentRepository {

    private static final Logger log = Logger.getLogger(KeyValueDocumentRepository.class.getName());

    private final KeyValueStore store;
    private final DocumentJsonCodec codec;

    public KeyValueDocumentRepository(KeyValueStore store) {
        this(store, new DocumentJsonCodec());
    }

    public KeyValueDocumentRepository(KeyValueStore store, DocumentJsonCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public List<Document> fetchAll(String collectionKeyPrefix) {
        List<Document> documents = new ArrayList<>();
        for (String key : store.keys(collectionKeyPrefix)) {
            Optional<String> json = store.get(key);
            if (json.isEmpty()) {
                continue;
            }
            try {
                documents.add(codec.decode(json.get()));
            } catch (DocumentCodecException e) {
                log.warning(() -> String.format("Skipping undecodable entry %s: %s", key, e.getMessage()));
            }
        }
        return documents;
    }

    @Override
    public Optional<Document> fetchOne(String key) {
        return store.get(key).map(codec::decode);
    }

    @Override
    public void put(String key, Document document) {
        store.set(key, codec.encode(document));
    }

    @Override
    public boolean delete(String key) {
        return store.delete(key);
    }
}
