package org.musigma.futures.concurrent;

import org.apiguardian.api.API;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Something whose completion can be waited on. Waiting never alters the awaited object.
 */
@API(status = API.Status.EXPERIMENTAL)
public interface Awaitable {

    /**
     * Blocks until this is completed.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void await() throws InterruptedException;

    /**
     * Blocks until this is completed or the given time elapses.
     *
     * @return true if this completed within the time limit, false if the time elapsed first
     * @throws InterruptedException if interrupted while waiting
     */
    boolean await(final long time, final TimeUnit unit) throws InterruptedException;

    static <F extends Awaitable> F await(final F awaitable) throws InterruptedException {
        awaitable.await();
        return awaitable;
    }

    /**
     * Waits for every given Awaitable sharing one deadline.
     *
     * @return true if all of them completed before the deadline
     */
    static boolean awaitAll(final Collection<? extends Awaitable> awaitables, final long time, final TimeUnit unit)
            throws InterruptedException {
        final long deadline = System.nanoTime() + unit.toNanos(time);
        for (final Awaitable awaitable : awaitables) {
            if (!awaitable.await(deadline - System.nanoTime(), TimeUnit.NANOSECONDS)) {
                return false;
            }
        }
        return true;
    }

}
