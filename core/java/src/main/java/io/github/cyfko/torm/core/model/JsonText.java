package io.github.cyfko.torm.core.model;

import java.util.Iterator;
import java.util.Map;

/**
 * Compact JSON rendering of {@link Value}s for {@code toString()} and {@link Value#asText()}.
 * Persistence goes through the key-value adapter's codec, not through this class.
 */
final class JsonText {

    private JsonText() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    static String write(Value value) {
        StringBuilder sb = new StringBuilder();
        append(sb, value);
        return sb.toString();
    }

    static String write(Map<String, Value> fields) {
        StringBuilder sb = new StringBuilder();
        appendObject(sb, fields);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Value value) {
        if (value instanceof Value.Str s) {
            appendString(sb, s.value());
        } else if (value instanceof Value.Arr arr) {
            sb.append('[');
            Iterator<Value> it = arr.values().iterator();
            while (it.hasNext()) {
                append(sb, it.next());
                if (it.hasNext()) sb.append(',');
            }
            sb.append(']');
        } else if (value instanceof Value.Obj obj) {
            appendObject(sb, obj.fields());
        } else {
            sb.append(value.asText());
        }
    }

    private static void appendObject(StringBuilder sb, Map<String, Value> fields) {
        sb.append('{');
        Iterator<Map.Entry<String, Value>> it = fields.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Value> entry = it.next();
            appendString(sb, entry.getKey());
            sb.append(':');
            append(sb, entry.getValue());
            if (it.hasNext()) sb.append(',');
        }
        sb.append('}');
    }

    private static void appendString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
