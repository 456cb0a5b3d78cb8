package org.musigma.futures.concurrent;

import org.apiguardian.api.API;
import org.musigma.futures.Try;

/**
 * Creates promises bound to a {@link Dispatcher}, which runs their callbacks.
 */
@API(status = API.Status.EXPERIMENTAL)
public interface PromiseFactory {

    /**
     * Creates a new incomplete Promise.
     */
    <T> Promise<T> newPromise();

    /**
     * Creates a new Promise already completed with the given result.
     */
    <T> Promise<T> completed(final Try<T> result);

    default <T> Promise<T> successful(final T value) {
        return completed(Try.success(value));
    }

    default <T> Promise<T> failed(final Throwable error) {
        return completed(Try.failure(error));
    }

}
