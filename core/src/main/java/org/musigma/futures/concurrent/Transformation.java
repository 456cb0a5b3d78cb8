package org.musigma.futures.concurrent;

import org.musigma.futures.Exceptions;
import org.musigma.futures.Try;
import org.musigma.futures.function.UncheckedExtractor;
import org.musigma.futures.function.UncheckedFunction;
import org.musigma.futures.function.UncheckedPredicate;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

/**
 * A promise completed by a callback on its source future. Every combinator is one of these.
 *
 * @param <F> type of source value
 * @param <T> type of derived value
 */
final class Transformation<F, T> extends DefaultPromise<T> implements Callback<F> {

    enum Type {
        map, flatMap, collect, filter, transform, transformWith, recover, recoverWith;

        <F, T> Transformation<F, T> using(final Dispatcher dispatcher, final Object function) {
            return new Transformation<>(dispatcher, Objects.requireNonNull(function), this);
        }
    }

    private final Type transformType;
    private Object function;

    private Transformation(final Dispatcher dispatcher, final Object function, final Type transformType) {
        super(dispatcher);
        this.function = function;
        this.transformType = transformType;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Override
    public void onComplete(final Try<F> value) {
        final Object function = this.function;
        this.function = null;
        try {
            Try<T> resolvedResult = null;
            switch (transformType) {
                case map: {
                    final UncheckedFunction<? super F, ? extends T> f = (UncheckedFunction<? super F, ? extends T>) function;
                    resolvedResult = value.map(f);
                    break;
                }

                case flatMap: {
                    if (value.isSuccess()) {
                        final UncheckedFunction<? super F, ? extends Future<T>> f = (UncheckedFunction) function;
                        completeWith(Objects.requireNonNull(f.apply(value.value()), "flatMap function returned null"));
                    } else {
                        resolvedResult = value.recastFailure();
                    }
                    break;
                }

                case collect: {
                    final UncheckedExtractor<? super F, ? extends T> extractor = (UncheckedExtractor) function;
                    resolvedResult = value.collect(extractor);
                    break;
                }

                case filter: {
                    // F == T
                    final UncheckedPredicate<? super F> predicate = (UncheckedPredicate) function;
                    resolvedResult = (Try<T>) value.filter(predicate);
                    break;
                }

                case transform: {
                    final UncheckedFunction<? super Try<F>, ? extends Try<T>> f = (UncheckedFunction) function;
                    resolvedResult = Objects.requireNonNull(f.apply(value), "transform function returned null");
                    break;
                }

                case transformWith: {
                    final UncheckedFunction<? super Try<F>, ? extends Future<T>> f = (UncheckedFunction) function;
                    completeWith(Objects.requireNonNull(f.apply(value), "transformWith function returned null"));
                    break;
                }

                case recover: {
                    // F == T
                    final UncheckedFunction<? super Throwable, ? extends F> f = (UncheckedFunction) function;
                    resolvedResult = (Try<T>) value.recover(f);
                    break;
                }

                case recoverWith: {
                    // F == T
                    if (value.isSuccess()) {
                        resolvedResult = (Try<T>) value;
                    } else {
                        final UncheckedFunction<? super Throwable, ? extends Future<T>> f = (UncheckedFunction) function;
                        completeWith(Objects.requireNonNull(f.apply(value.error()), "recoverWith function returned null"));
                    }
                    break;
                }

                default:
                    throw new UnsupportedOperationException("Unknown transformation type");
            }
            if (resolvedResult != null) {
                tryComplete(resolvedResult);
            }
        } catch (final Throwable t) {
            Exceptions.rethrowIfFatal(t);
            Exceptions.restoreInterrupt(t);
            tryComplete(Try.failure(t));
        }
    }

    @Override
    public DefaultPromise<?> onRejected(final RejectedExecutionException e) {
        function = null;
        return tryCompleteUndispatched(Try.failure(e)) ? this : null;
    }

}
