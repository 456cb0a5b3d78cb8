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
public final class Failure<T> implements Try<T> {

    private final Throwable error;

    Failure(final Throwable error) {
        this.error = error;
    }

    @Override
    public boolean isSuccess() {
        return false;
    }

    @Override
    public boolean isFailure() {
        return true;
    }

    @Override
    public T value() {
        throw new IllegalStateException("Cannot call Try::value on a failure", error);
    }

    @Override
    public Throwable error() {
        return error;
    }

    @Override
    public T get() {
        throw Exceptions.propagate(error);
    }

    @Override
    public T getOrElse(final T defaultValue) {
        return defaultValue;
    }

    @Override
    public Optional<T> toOptional() {
        return Optional.empty();
    }

    @Override
    public <U> Try<U> map(final UncheckedFunction<? super T, ? extends U> function) {
        return recastFailure();
    }

    @Override
    public <U> Try<U> flatMap(final UncheckedFunction<? super T, ? extends Try<U>> function) {
        return recastFailure();
    }

    @Override
    public Try<T> filter(final UncheckedPredicate<? super T> predicate) {
        return this;
    }

    @Override
    public <U> Try<U> collect(final UncheckedExtractor<? super T, ? extends U> extractor) {
        return recastFailure();
    }

    @Override
    public <U> Try<U> cast(final Class<U> type) {
        return recastFailure();
    }

    @Override
    public Try<T> recover(final UncheckedFunction<? super Throwable, ? extends T> function) {
        try {
            return new Success<>(function.apply(error));
        } catch (final Throwable t) {
            rethrowIfFatal(t);
            restoreInterrupt(t);
            return new Failure<>(t);
        }
    }

    @Override
    public Try<T> recoverWith(final UncheckedFunction<? super Throwable, ? extends Try<T>> function) {
        try {
            return Objects.requireNonNull(function.apply(error), "recoverWith function returned null");
        } catch (final Throwable t) {
            rethrowIfFatal(t);
            restoreInterrupt(t);
            return new Failure<>(t);
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <U> Try<U> recastFailure() {
        return (Try<U>) this;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Failure<?> failure = (Failure<?>) o;
        return error.equals(failure.error);
    }

    @Override
    public int hashCode() {
        return error.hashCode();
    }

    @Override
    public String toString() {
        return "Failure{" + error + '}';
    }
}
