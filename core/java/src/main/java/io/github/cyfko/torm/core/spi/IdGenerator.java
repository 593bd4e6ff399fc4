package io.github.cyfko.torm.core.spi;

/**
 * Source of identities for documents created without an {@code _id}.
 *
 * @since 1.0.0
 * @see io.github.cyfko.torm.core.impl.TimestampIdGenerator
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * @return a new identity, unique with high probability
     */
    String nextId();
}
