package org.musigma.futures;

import org.apiguardian.api.API;
import org.musigma.futures.function.UncheckedExtractor;
import org.musigma.futures.function.UncheckedFunction;
import org.musigma.futures.function.UncheckedPredicate;

import java.util.Objects;
import java.util.Optional;

import static org.musigma.futures.Exceptions.restoreInterrupt;
import static org.musigma.futures.Exceptions.rethrowIfFatal;

@API(status = API.Status.EXPERIMENTAL)
public final class Success<T> implements Try<T> {

    private final T value;

    Success(final T value) {
        this.value = value;
    }

    @Override
    public boolean isSuccess() {
        return true;
    }

    @Override
    public boolean isFailure() {
        return false;
    }

    @Override
    public T value() {
        return value;
    }

    @Override
    public Throwable error() {
        throw new IllegalStateException("Cannot call Try::error on a success");
    }

    @Override
    public T get() {
        return value;
    }

    @Override
    public T getOrElse(final T defaultValue) {
        return value;
    }

    @Override
    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public <U> Try<U> map(final UncheckedFunction<? super T, ? extends U> function) {
        try {
            return new Success<>(function.apply(value));
        } catch (final Throwable t) {
            rethrowIfFatal(t);
            restoreInterrupt(t);
            return new Failure<>(t);
        }
    }

    @Override
    public <U> Try<U> flatMap(final UncheckedFunction<? super T, ? extends Try<U>> function) {
        try {
            return Objects.requireNonNull(function.apply(value), "flatMap function returned null");
        } catch (final Throwable t) {
            rethrowIfFatal(t);
            restoreInterrupt(t);
            return new Failure<>(t);
        }
    }

    @Override
    public Try<T> filter(final UncheckedPredicate<? super T> predicate) {
        try {
            return predicate.test(value) ? this : new Failure<>(new NoMatchException("predicate failed for " + value));
        } catch (final Throwable t) {
            rethrowIfFatal(t);
            restoreInterrupt(t);
            return new Failure<>(t);
        }
    }

    @Override
    public <U> Try<U> collect(final UncheckedExtractor<? super T, ? extends U> extractor) {
        try {
            final Optional<? extends U> extracted = extractor.extract(value);
            return extracted.isPresent() ? new Success<>(extracted.get()) : new Failure<>(NoMatchException.forValue(value));
        } catch (final Throwable t) {
            rethrowIfFatal(t);
            restoreInterrupt(t);
            return new Failure<>(t);
        }
    }

    @Override
    public <U> Try<U> cast(final Class<U> type) {
        if (value == null || type.isInstance(value)) {
            return new Success<>(type.cast(value));
        }
        return new Failure<>(new TypeMismatchException(type, value.getClass()));
    }

    @Override
    public Try<T> recover(final UncheckedFunction<? super Throwable, ? extends T> function) {
        return this;
    }

    @Override
    public Try<T> recoverWith(final UncheckedFunction<? super Throwable, ? extends Try<T>> function) {
        return this;
    }

    @Override
    public <U> Try<U> recastFailure() {
        throw new ClassCastException("cannot recast a success");
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Success<?> success = (Success<?>) o;
        return Objects.equals(value, success.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "Success{" + value + '}';
    }
}
