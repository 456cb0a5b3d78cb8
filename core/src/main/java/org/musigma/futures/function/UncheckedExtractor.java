package org.musigma.futures.function;

import org.apiguardian.api.API;

import java.util.Objects;
import java.util.Optional;

/**
 * Partial function expressed as a predicate and an extraction in one step: an empty result means the extractor
 * is not defined for the given value.
 *
 * @param <T> type of input value
 * @param <R> type of extracted value
 */
@FunctionalInterface
@API(status = API.Status.EXPERIMENTAL)
public interface UncheckedExtractor<T, R> {

    Optional<R> extract(final T value) throws Exception;

    /**
     * Creates an extractor defined only for instances of the given type.
     */
    static <T, R> UncheckedExtractor<T, R> instanceOf(final Class<R> type) {
        return value -> type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /**
     * Creates an extractor defined where the predicate holds, mapping matching values with the given function.
     * The function must not return null for a matching value; a null result fails with a NullPointerException
     * rather than reading as no match.
     */
    static <T, R> UncheckedExtractor<T, R> when(final UncheckedPredicate<? super T> predicate,
                                                final UncheckedFunction<? super T, ? extends R> function) {
        return value -> predicate.test(value)
                ? Optional.of(Objects.requireNonNull(function.apply(value), "extractor function returned null"))
                : Optional.empty();
    }
}
