package io.github.cyfko.torm.core.validation;

import io.github.cyfko.torm.core.model.Document;
import io.github.cyfko.torm.core.model.FieldRule;
import io.github.cyfko.torm.core.model.Schema;
import io.github.cyfko.torm.core.model.Value;
import io.github.cyfko.torm.core.spi.CustomPredicate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Checks documents against a {@link Schema}.
 * <p>
 * Fields are visited in schema declaration order and validation stops at the first failing
 * field. For each field:
 * </p>
 * <ol>
 *   <li>absent or null and required (full validation only): {@link ValidationErrorKind#REQUIRED_FIELD_MISSING}</li>
 *   <li>absent or null otherwise: the field is skipped, no other rule runs</li>
 *   <li>wrong kind: {@link ValidationErrorKind#TYPE_MISMATCH}</li>
 *   <li>strings: {@code minLength}, {@code maxLength}, {@code pattern}, {@code email}, {@code url}</li>
 *   <li>numbers: {@code min}, {@code max}, both inclusive</li>
 *   <li>the custom predicate, last</li>
 * </ol>
 * <p>
 * A partial validation (used for update patches) never reports missing required fields.
 * Fields the schema does not declare are ignored.
 * </p>
 *
 * <p>The validator is stateless and never throws for a bad document: failures are returned
 * as a {@link ValidationResult}.</p>
 *
 * @since 1.0.0
 */
public final class DocumentValidator {

    private DocumentValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Validates a document, waiting for custom predicates to complete.
     *
     * @param schema   the rules
     * @param document the document to check
     * @param partial  {@code true} to skip required checks
     * @return success, or the first failure
     */
    public static ValidationResult validate(Schema schema, Document document, boolean partial) {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(document, "document");

        for (Map.Entry<String, FieldRule> entry : schema.rules().entrySet()) {
            String field = entry.getKey();
            FieldRule rule = entry.getValue();
            Value value = document.get(field);

            if (value.isNull()) {
                if (rule.required() && !partial) {
                    return ValidationResult.failure(ValidationError.required(field));
                }
                continue;
            }

            ValidationError error = checkConstraints(field, rule, value);
            if (error != null) {
                return ValidationResult.failure(error);
            }

            if (rule.customPredicate() != null
                    && !runCustom(rule.customPredicate(), value).toCompletableFuture().join()) {
                return ValidationResult.failure(ValidationError.custom(field));
            }
        }
        return ValidationResult.success();
    }

    /**
     * Validates a document without blocking on custom predicates: the remaining fields are
     * checked once the pending predicate completes.
     *
     * @param schema   the rules
     * @param document the document to check
     * @param partial  {@code true} to skip required checks
     * @return a stage completing with success or the first failure, never exceptionally
     */
    public static CompletionStage<ValidationResult> validateAsync(Schema schema, Document document, boolean partial) {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(document, "document");
        return validateFrom(new ArrayList<>(schema.rules().entrySet()), 0, document, partial);
    }

    private static CompletionStage<ValidationResult> validateFrom(List<Map.Entry<String, FieldRule>> rules, int start,
                                                                  Document document, boolean partial) {
        for (int i = start; i < rules.size(); i++) {
            String field = rules.get(i).getKey();
            FieldRule rule = rules.get(i).getValue();
            Value value = document.get(field);

            if (value.isNull()) {
                if (rule.required() && !partial) {
                    return CompletableFuture.completedFuture(ValidationResult.failure(ValidationError.required(field)));
                }
                continue;
            }

            ValidationError error = checkConstraints(field, rule, value);
            if (error != null) {
                return CompletableFuture.completedFuture(ValidationResult.failure(error));
            }

            if (rule.customPredicate() != null) {
                int next = i + 1;
                return runCustom(rule.customPredicate(), value).thenCompose(ok -> ok
                        ? validateFrom(rules, next, document, partial)
                        : CompletableFuture.completedFuture(ValidationResult.failure(ValidationError.custom(field))));
            }
        }
        return CompletableFuture.completedFuture(ValidationResult.success());
    }

    /**
     * Runs a custom predicate; a thrown exception, a null stage or an exceptional completion
     * all count as a rejection.
     */
    private static CompletionStage<Boolean> runCustom(CustomPredicate predicate, Value value) {
        CompletionStage<Boolean> stage;
        try {
            stage = predicate.test(value);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(false);
        }
        if (stage == null) {
            return CompletableFuture.completedFuture(false);
        }
        return stage.handle((ok, failure) -> failure == null && Boolean.TRUE.equals(ok));
    }

    private static ValidationError checkConstraints(String field, FieldRule rule, Value value) {
        if (rule.kind() != null && !rule.kind().matches(value)) {
            return ValidationError.typeMismatch(field, rule.kind());
        }
        if (value instanceof Value.Str s) {
            return checkString(field, rule, s.value());
        }
        if (value instanceof Value.Num n) {
            return checkNumber(field, rule, n.value());
        }
        return null;
    }

    private static ValidationError checkString(String field, FieldRule rule, String text) {
        int length = Validators.codePointLength(text);
        if (rule.minLength() != null && length < rule.minLength()) {
            return ValidationError.constraint(field, "minLength", String.valueOf(rule.minLength()),
                    "Field '" + field + "' must be at least " + rule.minLength() + " characters");
        }
        if (rule.maxLength() != null && length > rule.maxLength()) {
            return ValidationError.constraint(field, "maxLength", String.valueOf(rule.maxLength()),
                    "Field '" + field + "' must be at most " + rule.maxLength() + " characters");
        }
        if (rule.pattern() != null && !rule.pattern().matcher(text).find()) {
            return ValidationError.constraint(field, "pattern", rule.pattern().pattern(),
                    "Field '" + field + "' does not match pattern " + rule.pattern().pattern());
        }
        if (rule.email() && !Validators.isEmail(text)) {
            return ValidationError.constraint(field, "email", null,
                    "Field '" + field + "' must be a valid email");
        }
        if (rule.url() && !Validators.isUrl(text)) {
            return ValidationError.constraint(field, "url", null,
                    "Field '" + field + "' must be a valid URL");
        }
        return null;
    }

    private static ValidationError checkNumber(String field, FieldRule rule, BigDecimal number) {
        if (rule.min() != null && number.compareTo(rule.min()) < 0) {
            String bound = rule.min().toPlainString();
            return ValidationError.constraint(field, "min", bound, "Field '" + field + "' must be at least " + bound);
        }
        if (rule.max() != null && number.compareTo(rule.max()) > 0) {
            String bound = rule.max().toPlainString();
            return ValidationError.constraint(field, "max", bound, "Field '" + field + "' must be at most " + bound);
        }
        return null;
    }
}
