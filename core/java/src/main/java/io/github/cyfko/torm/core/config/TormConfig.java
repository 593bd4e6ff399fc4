package io.github.cyfko.torm.core.config;

import io.github.cyfko.torm.core.impl.TimestampIdGenerator;
import io.github.cyfko.torm.core.spi.IdGenerator;

import java.time.Clock;
import java.util.Objects;

/**
 * Settings shared by every model of a {@link io.github.cyfko.torm.core.Torm} instance.
 * <p>
 * A builder keeps construction fluent; every knob has a default:
 * </p>
 * <ul>
 *   <li>{@code namespace}: first segment of every key, {@value #DEFAULT_NAMESPACE}</li>
 *   <li>{@code validateOnWrite}: whether models validate by default, {@code true}</li>
 *   <li>{@code clock}: source of {@code _createdAt}/{@code _updatedAt}, UTC system clock</li>
 *   <li>{@code idGenerator}: identities for documents created without {@code _id},
 *       {@link TimestampIdGenerator} on the configured clock</li>
 * </ul>
 */
public final class TormConfig {

    public static final String DEFAULT_NAMESPACE = "toonstore";

    private static final TormConfig DEFAULTS = builder().build();

    private final String namespace;
    private final boolean validateOnWrite;
    private final Clock clock;
    private final IdGenerator idGenerator;

    private TormConfig(Builder builder) {
        this.namespace = builder.namespace;
        this.validateOnWrite = builder.validateOnWrite;
        this.clock = builder.clock;
        this.idGenerator = builder.idGenerator != null ? builder.idGenerator : new TimestampIdGenerator(builder.clock);
    }

    public static Builder builder() { return new Builder(); }

    public static TormConfig defaults() { return DEFAULTS; }

    public String getNamespace() { return namespace; }
    public boolean isValidateOnWrite() { return validateOnWrite; }
    public Clock getClock() { return clock; }
    public IdGenerator getIdGenerator() { return idGenerator; }

    @Override
    public String toString() {
        return "TormConfig{namespace=" + namespace + ", validateOnWrite=" + validateOnWrite + ", clock=" + clock + "}";
    }

    /**
     * Builder for {@link TormConfig}.
     */
    public static final class Builder {
        private String namespace = DEFAULT_NAMESPACE;
        private boolean validateOnWrite = true;
        private Clock clock = Clock.systemUTC();
        private IdGenerator idGenerator;

        private Builder() {}

        /**
         * @param namespace non-blank, without {@code ':'} which separates key segments
         */
        public Builder namespace(String namespace) {
            Objects.requireNonNull(namespace, "namespace");
            if (namespace.isBlank() || namespace.indexOf(':') >= 0) {
                throw new IllegalArgumentException("namespace must be non-blank and must not contain ':', got: " + namespace);
            }
            this.namespace = namespace;
            return this;
        }

        public Builder validateOnWrite(boolean validateOnWrite) {
            this.validateOnWrite = validateOnWrite;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder idGenerator(IdGenerator idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
            return this;
        }

        public TormConfig build() { return new TormConfig(this); }
    }
}
