package org.musigma.futures;

import org.apiguardian.api.API;
import org.musigma.futures.function.UncheckedExtractor;
import org.musigma.futures.function.UncheckedFunction;
import org.musigma.futures.function.UncheckedPredicate;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Reified result of a computation: either a {@link Success} holding a value or a {@link Failure} holding the
 * error it raised. Instances are immutable.
 *
 * @param <T> type of success value
 */
@API(status = API.Status.EXPERIMENTAL)
public interface Try<T> {

    /**
     * Runs the given Callable and reifies its outcome. Fatal throwables are rethrown.
     *
     * @param callable computation to run
     * @param <T>      type of success value
     * @return the outcome of the callable
     */
    static <T> Try<T> of(final Callable<? extends T> callable) {
        Objects.requireNonNull(callable);
        try {
            return new Success<>(callable.call());
        } catch (final Throwable t) {
            Exceptions.rethrowIfFatal(t);
            Exceptions.restoreInterrupt(t);
            return new Failure<>(t);
        }
    }

    /**
     * Creates a successful Try from a given value.
     *
     * @param value success value (can be null)
     */
    static <T> Try<T> success(final T value) {
        return new Success<>(value);
    }

    /**
     * Creates a failed Try from a given error.
     *
     * @param error error value (cannot be null)
     */
    static <T> Try<T> failure(final Throwable error) {
        return new Failure<>(Objects.requireNonNull(error));
    }

    boolean isSuccess();

    boolean isFailure();

    /**
     * Returns this success value or throws if this is a failure.
     *
     * @throws IllegalStateException if this is a failure
     */
    T value();

    /**
     * Returns this error or throws if this is a success.
     *
     * @throws IllegalStateException if this is a success
     */
    Throwable error();

    /**
     * Returns this success value or throws the stored error. Checked errors are wrapped in a
     * {@link ComputationException}.
     */
    T get();

    T getOrElse(final T defaultValue);

    Optional<T> toOptional();

    <U> Try<U> map(final UncheckedFunction<? super T, ? extends U> function);

    <U> Try<U> flatMap(final UncheckedFunction<? super T, ? extends Try<U>> function);

    /**
     * Keeps a success value only if it satisfies the predicate, failing with {@link NoMatchException} otherwise.
     */
    Try<T> filter(final UncheckedPredicate<? super T> predicate);

    /**
     * Applies a partial function to a success value, failing with {@link NoMatchException} where it is undefined.
     */
    <U> Try<U> collect(final UncheckedExtractor<? super T, ? extends U> extractor);

    /**
     * Checks a success value against a runtime type, failing with {@link TypeMismatchException} when it does not
     * match. A null success value matches every type.
     */
    <U> Try<U> cast(final Class<U> type);

    Try<T> recover(final UncheckedFunction<? super Throwable, ? extends T> function);

    Try<T> recoverWith(final UncheckedFunction<? super Throwable, ? extends Try<T>> function);

    /**
     * Reinterprets the value type of a failure.
     *
     * @throws ClassCastException if this is a success
     */
    <U> Try<U> recastFailure();
}
