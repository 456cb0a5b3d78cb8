package org.musigma.futures.concurrent;

import org.musigma.futures.Try;

import java.util.concurrent.RejectedExecutionException;

/**
 * Completion listener registered on a {@link DefaultPromise}.
 */
@FunctionalInterface
interface Callback<T> {

    void onComplete(final Try<T> result) throws Exception;

    /**
     * Invoked instead of {@link #onComplete(Try)} when the dispatcher refused to run this callback.
     *
     * @return a promise completed by this call whose own callbacks must be rejected as well, or null
     */
    default DefaultPromise<?> onRejected(final RejectedExecutionException e) {
        return null;
    }
}
