package org.musigma.futures.concurrent;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Count of outstanding tasks of a {@link Dispatcher}. Waiters are woken when the count drops to zero.
 */
final class QuiescenceCounter {

    private final AtomicLong pending = new AtomicLong();

    void increment() {
        pending.incrementAndGet();
    }

    void decrement() {
        final long remaining = pending.decrementAndGet();
        if (remaining == 0L) {
            synchronized (this) {
                notifyAll();
            }
        } else if (remaining < 0L) {
            throw new IllegalStateException("unbalanced quiescence counter: " + remaining);
        }
    }

    long count() {
        return pending.get();
    }

    boolean isQuiescent() {
        return pending.get() == 0L;
    }

    boolean awaitQuiescence(final long time, final TimeUnit unit) throws InterruptedException {
        final long deadline = System.nanoTime() + unit.toNanos(time);
        synchronized (this) {
            while (pending.get() != 0L) {
                final long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(this, remaining);
            }
        }
        return true;
    }
}
