package io.github.cyfko.torm.core.model;

import io.github.cyfko.torm.core.api.FieldKind;
import io.github.cyfko.torm.core.exception.SchemaDefinitionException;
import io.github.cyfko.torm.core.spi.CustomPredicate;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Constraints of one schema field.
 * <p>
 * The {@link FieldKind} decides which constraints are inspected: length, pattern, email and
 * URL rules only look at string values, {@code min}/{@code max} only at numeric values.
 * Constraints that do not apply to the value at hand are ignored rather than reported.
 * Every attribute is optional; a rule with no kind accepts any type and still applies the
 * constraints matching the value's actual type.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FieldRule name = FieldRule.string().required().minLength(3).maxLength(50).build();
 * FieldRule email = FieldRule.string().required().email().build();
 * FieldRule age = FieldRule.number().min(13).max(120).build();
 * FieldRule sku = FieldRule.string().pattern("^[A-Z]{3}-\\d{4}$").build();
 * FieldRule even = FieldRule.number().validate(v -> ((Value.Num) v).value().intValue() % 2 == 0).build();
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe; build them once and share them.</p>
 *
 * @since 1.0.0
 * @see Schema
 */
public final class FieldRule {

    private final FieldKind kind;
    private final boolean required;
    private final Integer minLength;
    private final Integer maxLength;
    private final BigDecimal min;
    private final BigDecimal max;
    private final Pattern pattern;
    private final boolean email;
    private final boolean url;
    private final CustomPredicate customPredicate;

    private FieldRule(Builder builder) {
        this.kind = builder.kind;
        this.required = builder.required;
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        this.min = builder.min;
        this.max = builder.max;
        this.pattern = builder.pattern;
        this.email = builder.email;
        this.url = builder.url;
        this.customPredicate = builder.customPredicate;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder string() {
        return new Builder().kind(FieldKind.STRING);
    }

    public static Builder number() {
        return new Builder().kind(FieldKind.NUMBER);
    }

    public static Builder bool() {
        return new Builder().kind(FieldKind.BOOLEAN);
    }

    public static Builder array() {
        return new Builder().kind(FieldKind.ARRAY);
    }

    public static Builder object() {
        return new Builder().kind(FieldKind.OBJECT);
    }

    /** @return the expected kind, or {@code null} when any type is accepted */
    public FieldKind kind() { return kind; }
    public boolean required() { return required; }
    public Integer minLength() { return minLength; }
    public Integer maxLength() { return maxLength; }
    public BigDecimal min() { return min; }
    public BigDecimal max() { return max; }
    public Pattern pattern() { return pattern; }
    public boolean email() { return email; }
    public boolean url() { return url; }
    public CustomPredicate customPredicate() { return customPredicate; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FieldRule{kind=").append(kind);
        if (required) sb.append(", required");
        if (minLength != null) sb.append(", minLength=").append(minLength);
        if (maxLength != null) sb.append(", maxLength=").append(maxLength);
        if (min != null) sb.append(", min=").append(min.toPlainString());
        if (max != null) sb.append(", max=").append(max.toPlainString());
        if (pattern != null) sb.append(", pattern=").append(pattern.pattern());
        if (email) sb.append(", email");
        if (url) sb.append(", url");
        if (customPredicate != null) sb.append(", custom");
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link FieldRule}. Bounds are checked for consistency in {@link #build()}.
     */
    public static final class Builder {
        private FieldKind kind;
        private boolean required;
        private Integer minLength;
        private Integer maxLength;
        private BigDecimal min;
        private BigDecimal max;
        private Pattern pattern;
        private boolean email;
        private boolean url;
        private CustomPredicate customPredicate;

        private Builder() {}

        public Builder kind(FieldKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder required() {
            return required(true);
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder minLength(int minLength) {
            if (minLength < 0) throw new SchemaDefinitionException("minLength cannot be negative: " + minLength);
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            if (maxLength < 0) throw new SchemaDefinitionException("maxLength cannot be negative: " + maxLength);
            this.maxLength = maxLength;
            return this;
        }

        public Builder min(Number min) {
            this.min = toBound("min", min);
            return this;
        }

        public Builder max(Number max) {
            this.max = toBound("max", max);
            return this;
        }

        public Builder pattern(String regex) {
            Objects.requireNonNull(regex, "regex");
            try {
                this.pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new SchemaDefinitionException("Invalid regex pattern: " + regex, e);
            }
            return this;
        }

        public Builder pattern(Pattern pattern) {
            this.pattern = Objects.requireNonNull(pattern, "pattern");
            return this;
        }

        public Builder email() {
            this.email = true;
            return this;
        }

        public Builder url() {
            this.url = true;
            return this;
        }

        /**
         * Sets a synchronous custom check.
         *
         * @param predicate returns {@code false} to reject the value
         * @return this builder
         */
        public Builder validate(Predicate<Value> predicate) {
            this.customPredicate = CustomPredicate.of(predicate);
            return this;
        }

        /**
         * Sets a custom check that may complete asynchronously.
         *
         * @param predicate the check
         * @return this builder
         */
        public Builder validateAsync(CustomPredicate predicate) {
            this.customPredicate = Objects.requireNonNull(predicate, "predicate");
            return this;
        }

        public FieldRule build() {
            if (minLength != null && maxLength != null && minLength > maxLength) {
                throw new SchemaDefinitionException("minLength (" + minLength + ") cannot exceed maxLength (" + maxLength + ")");
            }
            if (min != null && max != null && min.compareTo(max) > 0) {
                throw new SchemaDefinitionException("min (" + min.toPlainString() + ") cannot exceed max (" + max.toPlainString() + ")");
            }
            return new FieldRule(this);
        }

        private static BigDecimal toBound(String name, Number bound) {
            Objects.requireNonNull(bound, name);
            try {
                return ((Value.Num) Value.number(bound)).value();
            } catch (IllegalArgumentException e) {
                throw new SchemaDefinitionException(name + " must be a finite number: " + bound, e);
            }
        }
    }
}
