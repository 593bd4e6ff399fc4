package io.github.cyfko.torm.core.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimestampIdGenerator Tests")
class TimestampIdGeneratorTest {

    @Test
    @DisplayName("Should format identities as base-36 time and padded random suffix")
    void shouldFormatIdentities() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

        String id = new TimestampIdGenerator(clock).nextId();

        assertTrue(id.matches("[0-9a-z]+-[0-9a-z]{8}"), id);
        assertEquals(Long.toString(1_700_000_000_000L, 36), id.substring(0, id.indexOf('-')));
    }

    @Test
    @DisplayName("Should generate distinct identities within the same millisecond")
    void shouldGenerateDistinctIdentities() {
        TimestampIdGenerator generator = new TimestampIdGenerator(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < 1_000; i++) {
            ids.add(generator.nextId());
        }

        assertEquals(1_000, ids.size());
    }
}
