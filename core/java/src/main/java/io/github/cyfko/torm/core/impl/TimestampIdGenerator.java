package io.github.cyfko.torm.core.impl;

import io.github.cyfko.torm.core.spi.IdGenerator;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Default {@link IdGenerator}: epoch milliseconds and a random suffix, both in base 36.
 * <p>
 * Identities look like {@code lx3k9a1c-4fz0q2mb}. The timestamp part keeps identities roughly
 * ordered by creation; the eight random characters (about 2.8e12 combinations) make
 * collisions within the same millisecond unlikely.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimestampIdGenerator implements IdGenerator {

    private static final int SUFFIX_LENGTH = 8;
    private static final long SUFFIX_BOUND = 2_821_109_907_456L; // 36^8

    private final Clock clock;

    public TimestampIdGenerator() {
        this(Clock.systemUTC());
    }

    public TimestampIdGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String nextId() {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(SUFFIX_BOUND), 36);
        StringBuilder sb = new StringBuilder(Long.toString(clock.millis(), 36)).append('-');
        for (int i = suffix.length(); i < SUFFIX_LENGTH; i++) {
            sb.append('0');
        }
        return sb.append(suffix).toString();
    }
}
