package io.github.cyfko.torm.kv.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.torm.core.model.Document;
import io.github.cyfko.torm.core.model.Value;
import io.github.cyfko.torm.kv.exception.DocumentCodecException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts documents to and from flat JSON objects with Jackson's tree model.
 * <p>
 * A document is stored as one JSON object whose members are its fields, reserved fields
 * included, in document order:
 * </p>
 * <pre>{@code
 * {"_id":"lx3k9a1c-4fz0q2mb","name":"Alice","age":30,"_createdAt":"2024-05-01T10:00:00Z","_updatedAt":"2024-05-01T10:00:00Z"}
 * }</pre>
 *
 * <p>Floating point numbers are read as {@link BigDecimal} so decimal values survive a round
 * trip unchanged. Thread-safe once constructed.</p>
 *
 * @since 1.0.0
 */
public class DocumentJsonCodec {

    private final ObjectMapper mapper;
    private final JsonNodeFactory nodes;

    public DocumentJsonCodec() {
        this(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public DocumentJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.nodes = mapper.getNodeFactory();
    }

    /**
     * @param document the document
     * @return compact JSON object text
     * @throws DocumentCodecException if Jackson cannot write the tree
     */
    public String encode(Document document) {
        Objects.requireNonNull(document, "document");
        ObjectNode root = nodes.objectNode();
        document.values().forEach((field, value) -> root.set(field, toNode(value)));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new DocumentCodecException("Cannot encode document " + document.id().orElse("<no id>"), e);
        }
    }

    /**
     * @param json the stored text
     * @return the document
     * @throws DocumentCodecException if the text is not a JSON object
     */
    public Document decode(String json) {
        Objects.requireNonNull(json, "json");
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DocumentCodecException("Malformed document JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DocumentCodecException("Stored document must be a JSON object, got: "
                    + (root == null ? "nothing" : root.getNodeType()));
        }
        Document.Builder builder = Document.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            builder.field(field.getKey(), toValue(field.getValue()));
        }
        return builder.build();
    }

    public JsonNode toNode(Value value) {
        if (value instanceof Value.Str s) {
            return nodes.textNode(s.value());
        }
        if (value instanceof Value.Num n) {
            Object number = n.toJava();
            return number instanceof Long l ? nodes.numberNode(l) : nodes.numberNode((BigDecimal) number);
        }
        if (value instanceof Value.Bool b) {
            return nodes.booleanNode(b.value());
        }
        if (value instanceof Value.Arr arr) {
            ArrayNode array = nodes.arrayNode(arr.values().size());
            for (Value element : arr.values()) {
                array.add(toNode(element));
            }
            return array;
        }
        if (value instanceof Value.Obj obj) {
            ObjectNode object = nodes.objectNode();
            obj.fields().forEach((k, v) -> object.set(k, toNode(v)));
            return object;
        }
        return nodes.nullNode();
    }

    public Value toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.NULL;
        }
        if (node.isTextual()) {
            return Value.string(node.textValue());
        }
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !node.isBigDecimal() && !Double.isFinite(node.doubleValue())) {
                throw new DocumentCodecException("Non-finite number in stored document: " + node);
            }
            try {
                return Value.number(node.decimalValue());
            } catch (IllegalArgumentException e) {
                throw new DocumentCodecException("Unsupported number in stored document: " + e.getMessage(), e);
            }
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? Value.TRUE : Value.FALSE;
        }
        if (node.isArray()) {
            List<Value> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                values.add(toValue(element));
            }
            return new Value.Arr(values);
        }
        if (node.isObject()) {
            Map<String, Value> fields = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> fields.put(e.getKey(), toValue(e.getValue())));
            return new Value.Obj(fields);
        }
        throw new DocumentCodecException("Unsupported JSON node type: " + node.getNodeType());
    }
}
