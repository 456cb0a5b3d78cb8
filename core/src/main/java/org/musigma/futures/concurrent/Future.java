package org.musigma.futures.concurrent;

import org.apiguardian.api.API;
import org.musigma.futures.Pair;
import org.musigma.futures.Try;
import org.musigma.futures.function.UncheckedBiFunction;
import org.musigma.futures.function.UncheckedConsumer;
import org.musigma.futures.function.UncheckedExtractor;
import org.musigma.futures.function.UncheckedFunction;
import org.musigma.futures.function.UncheckedPredicate;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Read-only view of the eventual result of an asynchronous computation, along with declarative
 * transformations of that result.
 *
 * <p>Callbacks and transformations run on the {@linkplain #dispatcher() dispatcher} this future is bound to,
 * never on the thread completing the future. Callbacks registered on the same future run in registration
 * order.</p>
 *
 * @param <T> type of value being transformed
 */
@API(status = API.Status.EXPERIMENTAL)
public interface Future<T> extends Awaitable, java.util.concurrent.Future<T> {

    /**
     * Returns the dispatcher running callbacks of this future and of futures derived from it.
     */
    Dispatcher dispatcher();

    /**
     * Returns the result of this future if it has already completed.
     */
    Optional<Try<T>> getCurrent();

    /**
     * Registers a callback invoked exactly once with the result of this future. A callback registered after
     * completion is scheduled right away. Errors thrown by the callback are reported to the dispatcher and do not
     * affect this future or other callbacks.
     */
    void onComplete(final UncheckedConsumer<? super Try<T>> consumer);

    /**
     * Registers a callback invoked only if this future succeeds.
     */
    default void foreach(final UncheckedConsumer<? super T> consumer) {
        onComplete(result -> {
            if (result.isSuccess()) {
                consumer.accept(result.value());
            }
        });
    }

    /**
     * Registers a callback invoked only if this future fails.
     */
    default void onFailure(final UncheckedConsumer<? super Throwable> consumer) {
        onComplete(result -> {
            if (result.isFailure()) {
                consumer.accept(result.error());
            }
        });
    }

    <U> Future<U> transform(final UncheckedFunction<? super Try<T>, ? extends Try<U>> function);

    <U> Future<U> transformWith(final UncheckedFunction<? super Try<T>, ? extends Future<U>> function);

    /**
     * Applies a function to the success value. Failures pass through without invoking the function; an error
     * thrown by the function becomes the failure of the returned future.
     */
    <U> Future<U> map(final UncheckedFunction<? super T, ? extends U> function);

    /**
     * Applies a function producing another future to the success value; the returned future mirrors that
     * future's result.
     */
    <U> Future<U> flatMap(final UncheckedFunction<? super T, ? extends Future<U>> function);

    /**
     * Applies a partial function to the success value. Where the extractor is undefined the returned future
     * fails with {@link org.musigma.futures.NoMatchException}.
     */
    <U> Future<U> collect(final UncheckedExtractor<? super T, ? extends U> extractor);

    Future<T> filter(final UncheckedPredicate<? super T> predicate);

    Future<T> recover(final UncheckedFunction<? super Throwable, ? extends T> function);

    Future<T> recoverWith(final UncheckedFunction<? super Throwable, ? extends Future<T>> function);

    /**
     * Checks the success value against a runtime type when it arrives. A mismatch fails the returned future with
     * {@link org.musigma.futures.TypeMismatchException}.
     */
    default <U> Future<U> cast(final Class<U> type) {
        return transform(result -> result.cast(type));
    }

    /**
     * Runs a side effect with the result and returns a future completed with the same result after it ran.
     */
    default Future<T> andThen(final UncheckedConsumer<? super Try<T>> consumer) {
        return transform(result -> {
            try {
                consumer.accept(result);
            } catch (final Exception e) {
                dispatcher().reportFailure(e);
            }
            return result;
        });
    }

    default Future<T> fallbackTo(final Future<T> fallback) {
        return fallback == this ? this : transformWith(result -> result.isSuccess() ? this : fallback);
    }

    default <U> Future<Pair<T, U>> zip(final Future<U> that) {
        return zipWith(that, Pair::of);
    }

    default <U, R> Future<R> zipWith(final Future<U> that,
                                     final UncheckedBiFunction<? super T, ? super U, ? extends R> function) {
        return flatMap(t -> that.map(u -> function.apply(t, u)));
    }

    /**
     * Blocks until this future completes and returns its result.
     */
    Try<T> result() throws InterruptedException;

    /**
     * Blocks until this future completes or the time elapses. An elapsed deadline is not an error: it is reported
     * as an empty result and a later call may still observe the completed value.
     *
     * @return the completed result, or empty if this future was not completed in time
     */
    Optional<Try<T>> valueWithin(final long time, final TimeUnit unit) throws InterruptedException;

    /**
     * Blocks until this future completes and returns its value or throws its error. Checked errors are wrapped
     * in a {@link org.musigma.futures.ComputationException}.
     */
    default T join() throws InterruptedException {
        return result().get();
    }

}
