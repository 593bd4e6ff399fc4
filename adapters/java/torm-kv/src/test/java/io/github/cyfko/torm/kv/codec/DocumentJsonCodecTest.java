package io.github.cyfko.torm.kv.codec;

import io.github.cyfko.torm.core.model.Document;
import io.github.cyfko.torm.core.model.Value;
import io.github.cyfko.torm.kv.exception.DocumentCodecException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DocumentJsonCodec Tests")
class DocumentJsonCodecTest {

    private final DocumentJsonCodec codec = new DocumentJsonCodec();

    @Test
    @DisplayName("Should encode a document as a flat JSON object in field order")
    void shouldEncodeFlatObject() {
        // Given
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("_id", "u1");
        data.put("name", "Alice");
        data.put("age", 30.0);
        data.put("score", new BigDecimal("9.75"));
        data.put("tags", Arrays.asList("a", null));
        data.put("active", true);

        // When
        String json = codec.encode(Document.of(data));

        // Then
        assertEquals("{\"_id\":\"u1\",\"name\":\"Alice\",\"age\":30,\"score\":9.75,\"tags\":[\"a\",null],\"active\":true}", json);
    }

    @Test
    @DisplayName("Should decode nested values")
    void shouldDecodeNestedValues() {
        // When
        Document document = codec.decode("{\"_id\":\"u1\",\"price\":0.10,\"meta\":{\"n\":[1,2.5,\"x\"],\"ok\":false,\"none\":null}}");

        // Then
        assertEquals(Value.of("u1"), document.get("_id"));
        assertEquals(Value.of(new BigDecimal("0.1")), document.get("price"));
        assertEquals(Value.of(Map.of("n", List.of(1, 2.5, "x"), "ok", false, "none", Value.NULL)), document.get("meta"));
    }

    @Test
    @DisplayName("Should read back what it writes")
    void shouldReadBackWhatItWrites() {
        Document original = Document.of(Map.of("big", new BigDecimal("12345678901234567890.5"), "long", Long.MAX_VALUE,
                "text", "quote \" and \\ and é", "nested", Map.of("list", List.of(List.of(1), Map.of()))));

        assertEquals(original, codec.decode(codec.encode(original)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"n\":1e99999999}", "{\"n\":-1E+99999999}", "{\"n\":1e-99999999}", "{\"a\":[2.5e4000]}"})
    @DisplayName("Should reject numbers outside the supported exponent range")
    @Timeout(5)
    void shouldRejectHugeExponents(String json) {
        DocumentCodecException e = assertThrows(DocumentCodecException.class, () -> codec.decode(json));
        assertTrue(e.getMessage().startsWith("Unsupported number"), e.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"[1,2]", "\"text\"", "42", "null", "{\"a\":", "not json", ""})
    @DisplayName("Should reject stored values that are not JSON objects")
    void shouldRejectNonObjects(String json) {
        assertThrows(DocumentCodecException.class, () -> codec.decode(json));
    }
}
