package io.github.cyfko.torm.kv;

import io.github.cyfko.torm.core.exception.RepositoryUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryKeyValueStore Tests")
class InMemoryKeyValueStoreTest {

    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
    }

    @Test
    @DisplayName("Should set, get and delete values")
    void shouldSetGetAndDelete() {
        store.set("k", "v1");
        store.set("k", "v2");

        assertEquals(Optional.of("v2"), store.get("k"));
        assertTrue(store.delete("k"));
        assertFalse(store.delete("k"));
        assertEquals(Optional.empty(), store.get("k"));
    }

    @Test
    @DisplayName("Should list keys under a prefix in order")
    void shouldListKeysByPrefix() {
        // Given
        store.set("toonstore:users:b", "{}");
        store.set("toonstore:users:a", "{}");
        store.set("toonstore:usersx:c", "{}");
        store.set("toonstore:posts:a", "{}");
        store.set("other:users:a", "{}");

        // When
        List<String> keys = store.keys("toonstore:users:");

        // Then
        assertEquals(List.of("toonstore:users:a", "toonstore:users:b"), keys);
        assertEquals(5, store.keys("").size());
        assertEquals(List.of(), store.keys("missing:"));
    }

    @Test
    @DisplayName("Should reject every operation once closed")
    void shouldRejectOperationsWhenClosed() {
        store.set("k", "v");

        store.close();

        assertTrue(store.isClosed());
        assertThrows(RepositoryUnavailableException.class, () -> store.get("k"));
        assertThrows(RepositoryUnavailableException.class, () -> store.set("k", "v"));
        assertThrows(RepositoryUnavailableException.class, () -> store.delete("k"));
        assertThrows(RepositoryUnavailableException.class, () -> store.keys(""));
    }
}
