package io.github.cyfko.torm.core.model;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Dynamically-typed field value of a {@link Document}.
 * <p>
 * A {@code Value} is one of six variants, one per JSON shape. Every variant is an immutable
 * record, so values can be shared freely between threads and compared structurally.
 * </p>
 *
 * <h2>Variants</h2>
 * <dl>
 *   <dt>{@link Str}</dt><dd>a string</dd>
 *   <dt>{@link Num}</dt><dd>any number, held as a normalized {@link BigDecimal}
 *       ({@code 30}, {@code 30L} and {@code 30.0} are the same value)</dd>
 *   <dt>{@link Bool}</dt><dd>a boolean</dd>
 *   <dt>{@link Null}</dt><dd>explicit null; also what an absent field reads as</dd>
 *   <dt>{@link Arr}</dt><dd>an ordered list of values</dd>
 *   <dt>{@link Obj}</dt><dd>a nested key-value object</dd>
 * </dl>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * Value age = Value.of(30);                     // Num
 * Value tags = Value.of(List.of("a", "b"));     // Arr of Str
 * Value address = Value.of(Map.of("city", "Lomé"));
 *
 * age.type();      // NUMBER
 * age.toJava();    // 30L
 * tags.asText();   // ["a","b"]
 * }</pre>
 *
 * @since 1.0.0
 * @see Document
 */
public sealed interface Value permits Value.Str, Value.Num, Value.Bool, Value.Null, Value.Arr, Value.Obj {

    /** The null value. */
    Value NULL = new Null();

    /** Boolean {@code true}. */
    Value TRUE = new Bool(true);

    /** Boolean {@code false}. */
    Value FALSE = new Bool(false);

    /**
     * Returns the runtime category of this value.
     *
     * @return the value type, never {@code null}
     */
    ValueType type();

    /**
     * Unwraps this value into plain Java objects.
     * <p>
     * Strings become {@link String}, integral numbers within {@code long} range become {@link Long},
     * other numbers {@link BigDecimal}, booleans {@link Boolean}, null {@code null}, arrays an
     * unmodifiable {@link List} and objects an unmodifiable insertion-ordered {@link Map}.
     * </p>
     *
     * @return the plain Java representation
     */
    Object toJava();

    /**
     * Returns the string form used for substring matching and mixed-type equality.
     *
     * @return strings as-is, numbers in plain notation, {@code true}/{@code false}, {@code null},
     *         arrays and objects as compact JSON text
     */
    String asText();

    default boolean isNull() {
        return type() == ValueType.NULL;
    }

    default boolean isNumber() {
        return type() == ValueType.NUMBER;
    }

    /**
     * Whether this value is a string, number or boolean.
     *
     * @return {@code true} for scalar, non-null values
     */
    default boolean isScalar() {
        ValueType t = type();
        return t == ValueType.STRING || t == ValueType.NUMBER || t == ValueType.BOOLEAN;
    }

    /**
     * Converts a plain Java object into a {@code Value}.
     * <p>
     * Supported inputs: {@code null}, {@link Value} (returned as-is), {@link CharSequence},
     * {@link Character}, {@link Boolean}, any {@link Number}, {@link Enum} (by name),
     * {@link Map} (keys converted with {@link String#valueOf(Object)}), {@link Collection}
     * and Java arrays.
     * </p>
     *
     * @param raw the object to convert
     * @return the corresponding value
     * @throws IllegalArgumentException if the type is not supported, or for NaN and infinite numbers
     */
    static Value of(Object raw) {
        if (raw == null) return NULL;
        if (raw instanceof Value v) return v;
        if (raw instanceof CharSequence s) return new Str(s.toString());
        if (raw instanceof Character c) return new Str(String.valueOf(c));
        if (raw instanceof Boolean b) return b ? TRUE : FALSE;
        if (raw instanceof Number n) return new Num(toBigDecimal(n));
        if (raw instanceof Enum<?> e) return new Str(e.name());
        if (raw instanceof Map<?, ?> map) {
            Map<String, Value> fields = new LinkedHashMap<>();
            map.forEach((k, v) -> fields.put(String.valueOf(k), of(v)));
            return new Obj(fields);
        }
        if (raw instanceof Collection<?> collection) {
            List<Value> values = new ArrayList<>(collection.size());
            for (Object element : collection) {
                values.add(of(element));
            }
            return new Arr(values);
        }
        if (raw.getClass().isArray()) {
            int length = Array.getLength(raw);
            List<Value> values = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                values.add(of(Array.get(raw, i)));
            }
            return new Arr(values);
        }
        throw new IllegalArgumentException("Unsupported value type: " + raw.getClass().getName());
    }

    static Value string(String value) {
        return new Str(value);
    }

    static Value number(Number value) {
        return new Num(toBigDecimal(value));
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (n instanceof BigInteger bi) return new BigDecimal(bi);
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Non-finite numbers cannot be stored: " + n);
            }
            // Float.toString keeps 0.1f as "0.1" instead of its binary expansion
            return n instanceof Float ? new BigDecimal(n.toString()) : BigDecimal.valueOf(d);
        }
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
                || n instanceof AtomicInteger || n instanceof AtomicLong || n instanceof LongAdder) {
            return BigDecimal.valueOf(n.longValue());
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException("Non-finite numbers cannot be stored: " + n);
        }
        return BigDecimal.valueOf(d);
    }

    /**
     * String variant.
     *
     * @param value the string, never {@code null}
     */
    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public String toString() {
            return JsonText.write(this);
        }
    }

    /**
     * Numeric variant. The decimal is normalized on construction: trailing zeros are stripped and
     * the scale is never negative, so record equality is numeric equality.
     * <p>
     * The decimal exponent is bounded by {@link #MAX_EXPONENT} in both directions.
     * </p>
     *
     * @param value the number, never {@code null}
     * @throws IllegalArgumentException if the magnitude is outside the supported exponent range
     */
    record Num(BigDecimal value) implements Value {

        /** Largest accepted power of ten, positive or negative. */
        public static final int MAX_EXPONENT = 1000;

        public Num {
            Objects.requireNonNull(value, "value");
            if (value.signum() != 0) {
                long exponent = (long) value.precision() - value.scale() - 1;
                if (Math.abs(exponent) > MAX_EXPONENT) {
                    throw new IllegalArgumentException("Number exponent " + exponent + " is outside +/-" + MAX_EXPONENT);
                }
            }
            BigDecimal stripped = value.stripTrailingZeros();
            value = stripped.scale() < 0 ? stripped.setScale(0) : stripped;
        }

        @Override
        public ValueType type() {
            return ValueType.NUMBER;
        }

        @Override
        public Object toJava() {
            if (value.scale() == 0 && value.toBigInteger().bitLength() < 64) {
                return value.longValueExact();
            }
            return value;
        }

        @Override
        public String asText() {
            return value.toPlainString();
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    /**
     * Boolean variant.
     *
     * @param value the boolean
     */
    record Bool(boolean value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    /**
     * Null variant. Use {@link Value#NULL}.
     */
    record Null() implements Value {
        @Override
        public ValueType type() {
            return ValueType.NULL;
        }

        @Override
        public Object toJava() {
            return null;
        }

        @Override
        public String asText() {
            return "null";
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    /**
     * Array variant.
     *
     * @param values the elements, copied into an unmodifiable list
     */
    record Arr(List<Value> values) implements Value {
        public Arr {
            Objects.requireNonNull(values, "values");
            values = List.copyOf(values);
        }

        @Override
        public ValueType type() {
            return ValueType.ARRAY;
        }

        @Override
        public Object toJava() {
            List<Object> list = new ArrayList<>(values.size());
            for (Value v : values) {
                list.add(v.toJava());
            }
            return Collections.unmodifiableList(list);
        }

        @Override
        public String asText() {
            return JsonText.write(this);
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    /**
     * Nested object variant.
     *
     * @param fields the entries, copied into an unmodifiable insertion-ordered map
     */
    record Obj(Map<String, Value> fields) implements Value {
        public Obj {
            Objects.requireNonNull(fields, "fields");
            Map<String, Value> copy = new LinkedHashMap<>();
            fields.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "field name"), v == null ? NULL : v));
            fields = Collections.unmodifiableMap(copy);
        }

        @Override
        public ValueType type() {
            return ValueType.OBJECT;
        }

        @Override
        public Object toJava() {
            Map<String, Object> map = new LinkedHashMap<>();
            fields.forEach((k, v) -> map.put(k, v.toJava()));
            return Collections.unmodifiableMap(map);
        }

        @Override
        public String asText() {
            return JsonText.write(this);
        }

        @Override
        public String toString() {
            return asText();
        }
    }
}
