package io.github.cyfko.torm.core.orm;

import io.github.cyfko.torm.core.Torm;
import io.github.cyfko.torm.core.config.TormConfig;
import io.github.cyfko.torm.core.exception.DocumentValidationException;
import io.github.cyfko.torm.core.exception.DuplicateDocumentException;
import io.github.cyfko.torm.core.exception.RepositoryUnavailableException;
import io.github.cyfko.torm.core.model.Document;
import io.github.cyfko.torm.core.model.FieldRule;
import io.github.cyfko.torm.core.model.Schema;
import io.github.cyfko.torm.core.model.Value;
import io.github.cyfko.torm.core.validation.ValidationErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Model Tests")
class ModelTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static final Schema USER_SCHEMA = Schema.builder()
            .field("name", FieldRule.string().required().minLength(3))
            .field("email", FieldRule.string().required().email())
            .field("age", FieldRule.number().min(13).max(120))
            .build();

    private InMemoryDocumentRepository repository;
    private MutableClock clock;
    private Model users;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDocumentRepository();
        clock = new MutableClock(T0);
        AtomicInteger sequence = new AtomicInteger();
        TormConfig config = TormConfig.builder()
                .clock(clock)
                .idGenerator(() -> "id" + sequence.incrementAndGet())
                .build();
        users = new Torm(repository, config).model("User", USER_SCHEMA);
    }

    private Document alice() {
        return users.create(Map.of("name", "Alice", "email", "alice@example.com", "age", 30));
    }

    @Nested
    @DisplayName("Naming")
    class Naming {

        @Test
        @DisplayName("Should derive collection and keys from the model name")
        void shouldDeriveKeys() {
            assertEquals("user", users.getCollection());
            assertEquals("toonstore:user:", users.getKeyPrefix());
            assertEquals("toonstore:user:42", users.keyFor("42"));
        }

        @Test
        @DisplayName("Should honor collection and validation overrides")
        void shouldHonorOptions() {
            Torm torm = new Torm(repository, TormConfig.builder().namespace("shop").build());

            Model orders = torm.model("Order", Schema.empty(), ModelOptions.builder().collection("orders_v2").validate(false).build());

            assertEquals("shop:orders_v2:", orders.getKeyPrefix());
            assertFalse(orders.isValidating());
        }
    }

    @Nested
    @DisplayName("Create")
    class Create {

        @Test
        @DisplayName("Should store and read back a created document")
        void shouldRoundTrip() {
            // When
            Document created = alice();

            // Then
            assertEquals(Optional.of("id1"), created.id());
            assertEquals(Value.of(T0.toString()), created.get(Document.CREATED_AT));
            assertEquals(created.get(Document.CREATED_AT), created.get(Document.UPDATED_AT));
            assertEquals(Optional.of(created), users.findById("id1"));
            assertTrue(repository.entries.containsKey("toonstore:user:id1"));
        }

        @Test
        @DisplayName("Should put identity first and timestamps last")
        void shouldOrderReservedFields() {
            Document created = alice();
            List<String> fields = List.copyOf(created.fields());

            assertEquals(6, fields.size());
            assertEquals("_id", fields.get(0));
            assertEquals(List.of("_createdAt", "_updatedAt"), fields.subList(4, 6));
        }

        @Test
        @DisplayName("Should keep a caller-supplied identity and overwrite supplied timestamps")
        void shouldKeepSuppliedIdentity() {
            Document created = users.create(Map.of("_id", "alice", "name", "Alice", "email", "a@b.io",
                    "_createdAt", "1999-01-01T00:00:00Z"));

            assertEquals(Optional.of("alice"), created.id());
            assertEquals(Value.of(T0.toString()), created.get(Document.CREATED_AT));
        }

        @Test
        @DisplayName("Should generate an identity when the supplied one is blank")
        void shouldGenerateForBlankIdentity() {
            Document created = users.create(Map.of("_id", "  ", "name", "Alice", "email", "a@b.io"));

            assertEquals(Optional.of("id1"), created.id());
        }

        @Test
        @DisplayName("Should reject a non-string identity")
        void shouldRejectNonStringIdentity() {
            DocumentValidationException e = assertThrows(DocumentValidationException.class,
                    () -> users.create(Map.of("_id", 7, "name", "Alice", "email", "a@b.io")));

            assertEquals(ValidationErrorKind.TYPE_MISMATCH, e.getKind());
            assertEquals("_id", e.getField());
        }

        @Test
        @DisplayName("Should reject a duplicate identity")
        void shouldRejectDuplicateIdentity() {
            users.create(Map.of("_id", "alice", "name", "Alice", "email", "a@b.io"));

            DuplicateDocumentException e = assertThrows(DuplicateDocumentException.class,
                    () -> users.create(Map.of("_id", "alice", "name", "Alicia", "email", "a@b.io")));

            assertEquals("user", e.getCollection());
            assertEquals("alice", e.getId());
            assertEquals(Value.of("Alice"), users.findById("alice").orElseThrow().get("name"));
        }

        @Test
        @DisplayName("Should reject an invalid document before touching the store")
        void shouldRejectBeforeStorage() {
            DocumentValidationException e = assertThrows(DocumentValidationException.class,
                    () -> users.create(Map.of("name", "Al", "email", "a@b.io")));

            assertEquals("minLength", e.getError().constraintName());
            assertEquals(0, repository.puts);
            assertEquals(0, users.count());
        }

        @Test
        @DisplayName("Should skip validation when disabled")
        void shouldSkipValidationWhenDisabled() {
            Model lenient = new Torm(repository).model("User", USER_SCHEMA, ModelOptions.builder().validate(false).build());

            Document created = lenient.create(Map.of("name", 1));

            assertTrue(lenient.exists(created.id().orElseThrow()));
        }
    }

    @Nested
    @DisplayName("Update")
    class Update {

        @Test
        @DisplayName("Should merge the patch and re-stamp only the update time")
        void shouldMergeAndRestamp() {
            // Given
            alice();
            clock.advance(Duration.ofMinutes(5));

            // When
            Document updated = users.update("id1", Map.of("age", 31, "city", "Lomé")).orElseThrow();

            // Then
            assertEquals(Value.of(31), updated.get("age"));
            assertEquals(Value.of("Lomé"), updated.get("city"));
            assertEquals(Value.of("Alice"), updated.get("name"));
            assertEquals(Value.of(T0.toString()), updated.get(Document.CREATED_AT));
            assertEquals(Value.of(T0.plus(Duration.ofMinutes(5)).toString()), updated.get(Document.UPDATED_AT));
            assertEquals(Optional.of(updated), users.findById("id1"));
        }

        @Test
        @DisplayName("Should ignore reserved fields in the patch")
        void shouldIgnoreReservedFields() {
            alice();

            Document updated = users.update("id1", Map.of("_id", "hijack", "_createdAt", "never")).orElseThrow();

            assertEquals(Optional.of("id1"), updated.id());
            assertEquals(Value.of(T0.toString()), updated.get(Document.CREATED_AT));
            assertFalse(users.exists("hijack"));
        }

        @Test
        @DisplayName("Should validate the patch without required checks")
        void shouldValidatePatchPartially() {
            alice();
            int putsBefore = repository.puts;

            DocumentValidationException e = assertThrows(DocumentValidationException.class,
                    () -> users.update("id1", Map.of("age", 5)));

            assertEquals("age", e.getField());
            assertEquals(putsBefore, repository.puts);
            assertTrue(users.update("id1", Map.of("age", 14)).isPresent());
        }

        @Test
        @DisplayName("Should return empty for an unknown identity")
        void shouldReturnEmptyForUnknownIdentity() {
            assertEquals(Optional.empty(), users.update("ghost", Map.of("age", 20)));
            assertEquals(0, repository.puts);
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("Should delete once and then report false")
        void shouldDeleteIdempotently() {
            alice();

            assertTrue(users.delete("id1"));
            assertFalse(users.delete("id1"));
            assertFalse(users.exists("id1"));
        }

        @Test
        @DisplayName("Should delete matching documents and return their number")
        void shouldDeleteMany() {
            // Given
            alice();
            users.create(Map.of("name", "Bob", "email", "bob@example.com", "age", 30));
            users.create(Map.of("name", "Carol", "email", "carol@example.com", "age", 41));

            // When
            long deleted = users.deleteMany(Map.of("age", 30));

            // Then
            assertEquals(2, deleted);
            assertEquals(1, users.count());
            assertEquals(1, users.deleteMany());
            assertEquals(0, users.deleteMany());
        }

        @Test
        @DisplayName("Should only delete within its own collection")
        void shouldStayInCollection() {
            alice();
            Model posts = new Torm(repository).model("Post");
            posts.create(Map.of("title", "Hello"));

            users.deleteMany();

            assertEquals(1, posts.count());
        }
    }

    @Nested
    @DisplayName("Read")
    class Read {

        @BeforeEach
        void seed() {
            alice();
            users.create(Map.of("name", "Bob", "email", "bob@example.com", "age", 25));
            users.create(Map.of("name", "Carol", "email", "carol@example.com", "age", 30));
        }

        @Test
        @DisplayName("Should find by equality filter")
        void shouldFindByEquality() {
            assertEquals(3, users.find().size());
            assertEquals(2, users.find(Map.of("age", 30)).size());
            assertEquals(2, users.count(Map.of("age", 30)));
            assertEquals(3, users.count());
        }

        @Test
        @DisplayName("Should find the first match in repository order")
        void shouldFindOne() {
            assertEquals(Value.of("Alice"), users.findOne(Map.of("age", 30)).orElseThrow().get("name"));
            assertEquals(Optional.empty(), users.findOne(Map.of("age", 99)));
        }

        @Test
        @DisplayName("Should report existence")
        void shouldReportExistence() {
            assertTrue(users.exists("id2"));
            assertFalse(users.exists("id9"));
            assertEquals(Optional.empty(), users.findById("id9"));
        }
    }

    @Test
    @DisplayName("Should propagate repository failures unchanged")
    void shouldPropagateRepositoryFailures() {
        repository.down = true;

        assertThrows(RepositoryUnavailableException.class, () -> users.find());
        assertThrows(RepositoryUnavailableException.class, () -> users.findById("id1"));
        assertThrows(RepositoryUnavailableException.class, () -> users.delete("id1"));
        assertThrows(RepositoryUnavailableException.class, () -> users.create(Map.of("name", "Alice", "email", "a@b.io")));
    }

    @Test
    @DisplayName("Should accept any document when the model is schemaless")
    void shouldAcceptAnythingWhenSchemaless() {
        Model notes = new Torm(repository).model("Note");

        Document note = notes.create(Map.of("body", List.of(1, Map.of("x", true))));

        assertEquals(Optional.of(note), notes.findById(note.id().orElseThrow()));
    }

    /** Clock whose instant only changes when the test says so. */
    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
