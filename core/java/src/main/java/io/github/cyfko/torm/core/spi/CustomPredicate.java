package io.github.cyfko.torm.core.spi;

import io.github.cyfko.torm.core.model.Value;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * Application-supplied check run on a field after all built-in rules have passed.
 * <p>
 * The check may complete later (a uniqueness lookup, a remote call): it is the only point
 * where validating a document can suspend. Completing with {@code false}, completing
 * exceptionally, or throwing all reject the field with
 * {@link io.github.cyfko.torm.core.validation.ValidationErrorKind#CUSTOM_VALIDATION_FAILED}.
 * </p>
 *
 * <pre>{@code
 * // synchronous
 * CustomPredicate even = CustomPredicate.of(v -> ((Value.Num) v).value().intValue() % 2 == 0);
 *
 * // asynchronous
 * CustomPredicate unique = v -> lookupService.isFree(v.asText());   // CompletionStage<Boolean>
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CustomPredicate {

    /**
     * Tests a present, non-null field value.
     *
     * @param value the value, already checked against the field's kind and built-in constraints
     * @return a stage completing with {@code true} to accept the value
     */
    CompletionStage<Boolean> test(Value value);

    /**
     * Adapts a synchronous predicate.
     *
     * @param predicate the check
     * @return a predicate whose stages are already complete
     */
    static CustomPredicate of(Predicate<Value> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return value -> CompletableFuture.completedFuture(predicate.test(value));
    }
}
