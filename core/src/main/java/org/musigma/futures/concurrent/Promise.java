package org.musigma.futures.concurrent;

import org.apiguardian.api.API;
import org.musigma.futures.Try;

/**
 * Write-once, asynchronously-completable holder for either a success value or an error.
 * Consumers of this promise should obtain a {@link #future() Future} reference from this Promise.
 *
 * <p>A promise completes at most once. Later completion attempts are ignored: {@link #complete(Try)} silently
 * does nothing while the {@code try*} variants report whether they won.</p>
 *
 * @param <T> type of success value
 */
@API(status = API.Status.EXPERIMENTAL)
public interface Promise<T> {

    /**
     * Returns a Future corresponding to the completion of this Promise.
     *
     * @return a Future corresponding to this
     */
    Future<T> future();

    /**
     * Indicates if this Promise has been completed.
     *
     * @return true if this has a success value or error, or false if this is still incomplete
     */
    boolean isDone();

    /**
     * Attempts to complete this Promise with the given result only if this Promise is incomplete.
     *
     * @param result value or error to complete this with
     * @return true if this call completed the Promise or false if it was already completed
     */
    boolean tryComplete(final Try<T> result);

    /**
     * Completes this Promise with the given result. Does nothing if this is already completed.
     *
     * @param result value or error to complete this with
     * @return this
     */
    default Promise<T> complete(final Try<T> result) {
        tryComplete(result);
        return this;
    }

    /**
     * Completes this Promise with the eventual result of another Future, unless this is completed first.
     *
     * @param other Future to complete this with
     * @return this
     */
    default Promise<T> completeWith(final Future<T> other) {
        if (future() != other) {
            other.onComplete(this::tryComplete);
        }
        return this;
    }

    default Promise<T> success(final T value) {
        return complete(Try.success(value));
    }

    default boolean trySuccess(final T value) {
        return tryComplete(Try.success(value));
    }

    default Promise<T> failure(final Throwable error) {
        return complete(Try.failure(error));
    }

    default boolean tryFailure(final Throwable error) {
        return tryComplete(Try.failure(error));
    }

}
