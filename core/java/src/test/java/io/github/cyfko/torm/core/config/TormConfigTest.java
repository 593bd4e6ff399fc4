package io.github.cyfko.torm.core.config;

import io.github.cyfko.torm.core.impl.TimestampIdGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TormConfig Tests")
class TormConfigTest {

    @Test
    @DisplayName("Should build TormConfig with default values")
    void shouldBuildWithDefaults() {
        // When
        TormConfig config = TormConfig.builder().build();

        // Then
        assertEquals("toonstore", config.getNamespace());
        assertTrue(config.isValidateOnWrite());
        assertEquals(ZoneOffset.UTC, config.getClock().getZone());
        assertInstanceOf(TimestampIdGenerator.class, config.getIdGenerator());
    }

    @Test
    @DisplayName("Should share the default instance")
    void shouldShareDefaults() {
        assertSame(TormConfig.defaults(), TormConfig.defaults());
        assertEquals("toonstore", TormConfig.defaults().getNamespace());
    }

    @Test
    @DisplayName("Should build TormConfig with custom values")
    void shouldBuildWithCustomValues() {
        // Given
        Clock fixed = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

        // When
        TormConfig config = TormConfig.builder()
                .namespace("shop")
                .validateOnWrite(false)
                .clock(fixed)
                .idGenerator(() -> "fixed")
                .build();

        // Then
        assertEquals("shop", config.getNamespace());
        assertFalse(config.isValidateOnWrite());
        assertSame(fixed, config.getClock());
        assertEquals("fixed", config.getIdGenerator().nextId());
    }

    @Test
    @DisplayName("Should derive default identities from the configured clock")
    void shouldUseConfiguredClockForIdentities() {
        Clock fixed = Clock.fixed(Instant.ofEpochMilli(36L * 36 * 36), ZoneOffset.UTC);

        String id = TormConfig.builder().clock(fixed).build().getIdGenerator().nextId();

        assertTrue(id.startsWith("1000-"), id);
    }

    @Test
    @DisplayName("Should reject invalid namespaces and null collaborators")
    void shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> TormConfig.builder().namespace(" "));
        assertThrows(IllegalArgumentException.class, () -> TormConfig.builder().namespace("a:b"));
        assertThrows(NullPointerException.class, () -> TormConfig.builder().namespace(null));
        assertThrows(NullPointerException.class, () -> TormConfig.builder().clock(null));
        assertThrows(NullPointerException.class, () -> TormConfig.builder().idGenerator(null));
    }
}
