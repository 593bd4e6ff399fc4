package io.github.cyfko.torm.core.exception;

/**
 * Exception thrown when a document is created with an identity already used in its collection.
 *
 * @since 1.0.0
 */
public class DuplicateDocumentException extends RuntimeException {

    private final String collection;
    private final String id;

    public DuplicateDocumentException(String collection, String id) {
        super("Document '" + id + "' already exists in collection '" + collection + "'");
        this.collection = collection;
        this.id = id;
    }

    public String getCollection() {
        return collection;
    }

    public String getId() {
        return id;
    }
}
