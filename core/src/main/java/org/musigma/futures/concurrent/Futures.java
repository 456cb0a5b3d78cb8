package org.musigma.futures.concurrent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apiguardian.api.API;
import org.musigma.futures.EmptyAggregateException;
import org.musigma.futures.Exceptions;
import org.musigma.futures.Try;
import org.musigma.futures.function.UncheckedBiFunction;
import org.musigma.futures.function.UncheckedFunction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate operations combining many futures into one.
 *
 * <p>Each operation registers one callback per input and completes a single result promise bound to the given
 * dispatcher. Inputs may complete on any thread in any order. The first failure observed completes the result;
 * inputs completing after the result is decided are ignored.</p>
 */
@API(status = API.Status.EXPERIMENTAL)
public final class Futures {

    private static final Logger LOGGER = LogManager.getLogger(Futures.class);

    private Futures() {
    }

    /**
     * Folds the success values of the given futures into an accumulator in completion order.
     * The combine function should therefore not depend on the order of its inputs. Folding no futures yields
     * {@code zero}.
     *
     * @param dispatcher runs callbacks of the returned future
     * @param zero       initial accumulator value
     * @param futures    futures to fold
     * @param combine    combines the accumulator with one value; invoked while holding the aggregation lock
     * @return a future of the final accumulator or of the first failure
     */
    public static <T, R> Future<R> fold(final Dispatcher dispatcher, final R zero,
                                        final Collection<? extends Future<? extends T>> futures,
                                        final UncheckedBiFunction<? super R, ? super T, ? extends R> combine) {
        Objects.requireNonNull(combine);
        if (futures.isEmpty()) {
            return dispatcher.successful(zero).future();
        }
        final Aggregation<T, R> aggregation = new Aggregation<>(dispatcher, futures.size(), zero, null, combine);
        for (final Future<? extends T> future : futures) {
            future.onComplete(aggregation::accept);
        }
        return aggregation.promise.future();
    }

    /**
     * Like {@link #fold(Dispatcher, Object, Collection, UncheckedBiFunction)} but seeded with the first value to
     * arrive. Reducing no futures fails with {@link EmptyAggregateException}.
     */
    public static <T> Future<T> reduce(final Dispatcher dispatcher, final Collection<? extends Future<? extends T>> futures,
                                       final UncheckedBiFunction<? super T, ? super T, ? extends T> combine) {
        Objects.requireNonNull(combine);
        if (futures.isEmpty()) {
            return dispatcher.<T>failed(new EmptyAggregateException("reduce")).future();
        }
        final Aggregation<T, T> aggregation = new Aggregation<>(dispatcher, futures.size(), null, UncheckedFunction.identity(), combine);
        for (final Future<? extends T> future : futures) {
            future.onComplete(aggregation::accept);
        }
        return aggregation.promise.future();
    }

    /**
     * Turns a list of futures into a future of the list of their values, in the order of the given futures.
     */
    public static <T> Future<List<T>> sequence(final Dispatcher dispatcher, final List<? extends Future<? extends T>> futures) {
        final int size = futures.size();
        if (size == 0) {
            return dispatcher.successful(Collections.<T>emptyList()).future();
        }
        final Sequence<T> sequence = new Sequence<>(dispatcher, size);
        for (int i = 0; i < size; i++) {
            final int index = i;
            futures.get(i).onComplete(result -> sequence.accept(index, result));
        }
        return sequence.promise.future();
    }

    /**
     * Maps every item to a future and sequences the results, preserving item order. If the function throws for
     * an item, the returned future fails with that error.
     */
    public static <A, U> Future<List<U>> traverse(final Dispatcher dispatcher, final Iterable<? extends A> items,
                                                  final UncheckedFunction<? super A, ? extends Future<? extends U>> function) {
        final List<Future<? extends U>> futures = new ArrayList<>();
        for (final A item : items) {
            try {
                futures.add(Objects.requireNonNull(function.apply(item), "traverse function returned null"));
            } catch (final Throwable t) {
                Exceptions.rethrowIfFatal(t);
                Exceptions.restoreInterrupt(t);
                return dispatcher.<List<U>>failed(t).future();
            }
        }
        return sequence(dispatcher, futures);
    }

    /**
     * Returns a future mirroring whichever of the given futures completes first.
     */
    @SafeVarargs
    public static <T> Future<T> firstCompletedOf(final Dispatcher dispatcher, final Future<? extends T>... futures) {
        return firstCompletedOf(dispatcher, Arrays.asList(futures));
    }

    public static <T> Future<T> firstCompletedOf(final Dispatcher dispatcher, final Collection<? extends Future<? extends T>> futures) {
        if (futures.isEmpty()) {
            return dispatcher.<T>failed(new EmptyAggregateException("firstCompletedOf")).future();
        }
        final Promise<T> promise = dispatcher.newPromise();
        for (final Future<? extends T> future : futures) {
            future.onComplete(result -> promise.tryComplete(upcast(result)));
        }
        return promise.future();
    }

    @SuppressWarnings("unchecked")
    private static <T> Try<T> upcast(final Try<? extends T> result) {
        return (Try<T>) result;
    }

    /**
     * Shared state of a fold or reduce: accumulator and remaining count guarded by one lock.
     * A reduce has no zero and seeds the accumulator from the first value to arrive.
     */
    private static final class Aggregation<T, R> {
        private final Promise<R> promise;
        private final UncheckedFunction<? super T, ? extends R> seed;
        private final UncheckedBiFunction<? super R, ? super T, ? extends R> combine;
        private int remaining;
        private R accumulator;
        private boolean seeded;
        private boolean decided;

        private Aggregation(final Dispatcher dispatcher, final int count, final R zero,
                            final UncheckedFunction<? super T, ? extends R> seed,
                            final UncheckedBiFunction<? super R, ? super T, ? extends R> combine) {
            this.promise = dispatcher.newPromise();
            this.remaining = count;
            this.accumulator = zero;
            this.seed = seed;
            this.seeded = seed == null;
            this.combine = combine;
        }

        private void accept(final Try<? extends T> result) {
            Try<R> outcome = null;
            synchronized (this) {
                if (decided) {
                    LOGGER.trace("ignoring {} arriving after aggregate was decided", result);
                    return;
                }
                if (result.isFailure()) {
                    outcome = Try.failure(result.error());
                } else {
                    try {
                        accumulate(result.value());
                    } catch (final Throwable t) {
                        Exceptions.rethrowIfFatal(t);
                        Exceptions.restoreInterrupt(t);
                        outcome = Try.failure(t);
                    }
                    if (outcome == null) {
                        if (--remaining > 0) {
                            return;
                        }
                        outcome = Try.success(accumulator);
                    }
                }
                decided = true;
            }
            promise.tryComplete(outcome);
        }

        // must hold the lock
        private void accumulate(final T value) throws Exception {
            if (seeded) {
                accumulator = combine.apply(accumulator, value);
            } else {
                accumulator = seed.apply(value);
                seeded = true;
            }
        }
    }

    private static final class Sequence<T> {
        private final Promise<List<T>> promise;
        private final Object[] values;
        private int remaining;
        private boolean decided;

        private Sequence(final Dispatcher dispatcher, final int size) {
            this.promise = dispatcher.newPromise();
            this.values = new Object[size];
            this.remaining = size;
        }

        @SuppressWarnings("unchecked")
        private void accept(final int index, final Try<? extends T> result) {
            final Try<List<T>> outcome;
            synchronized (this) {
                if (decided) {
                    LOGGER.trace("ignoring {} arriving after sequence was decided", result);
                    return;
                }
                if (result.isFailure()) {
                    decided = true;
                    outcome = Try.failure(result.error());
                } else {
                    values[index] = result.value();
                    if (--remaining > 0) {
                        return;
                    }
                    decided = true;
                    outcome = Try.success(Collections.unmodifiableList(Arrays.asList((T[]) values)));
                }
            }
            promise.tryComplete(outcome);
        }
    }
}
