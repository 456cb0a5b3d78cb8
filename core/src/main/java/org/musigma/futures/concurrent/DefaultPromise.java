package org.musigma.futures.concurrent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.musigma.futures.Exceptions;
import org.musigma.futures.Try;
import org.musigma.futures.function.UncheckedConsumer;
import org.musigma.futures.function.UncheckedExtractor;
import org.musigma.futures.function.UncheckedFunction;
import org.musigma.futures.function.UncheckedPredicate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.musigma.futures.concurrent.Transformation.Type.*;

class DefaultPromise<T> implements Promise<T>, Future<T> {

    private static final Logger LOGGER = LogManager.getLogger(DefaultPromise.class);

    private static final long UNTIMED = -1L;

    final Dispatcher dispatcher;

    // written once while holding the monitor of this promise
    private volatile Try<T> result;

    // guarded by this; callbacks not yet handed to a drain task, in registration order
    private List<Callback<T>> callbacks;

    // guarded by this; true while a drain task is scheduled or running
    private boolean draining;

    /**
     * Constructs an unfulfilled promise.
     */
    DefaultPromise(final Dispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher);
    }

    /**
     * Constructs a pre-filled promise.
     */
    DefaultPromise(final Dispatcher dispatcher, final Try<T> result) {
        this(dispatcher);
        this.result = Objects.requireNonNull(result);
    }

    @Override
    public Future<T> future() {
        return this;
    }

    @Override
    public Dispatcher dispatcher() {
        return dispatcher;
    }

    @Override
    public Optional<Try<T>> getCurrent() {
        return Optional.ofNullable(result);
    }

    @Override
    public boolean isDone() {
        return result != null;
    }

    @Override
    public boolean isCancelled() {
        return false;
    }

    /**
     * Futures cannot be cancelled; producers always run to completion.
     *
     * @return false
     */
    @Override
    public boolean cancel(final boolean mayInterruptIfRunning) {
        return false;
    }

    @Override
    public boolean tryComplete(final Try<T> value) {
        Objects.requireNonNull(value);
        final boolean drain;
        synchronized (this) {
            if (result != null) {
                LOGGER.trace("ignoring {} for already completed promise holding {}", value, result);
                return false;
            }
            result = value;
            notifyAll();
            drain = startDraining();
        }
        if (drain) {
            scheduleDrain();
        }
        return true;
    }

    void addCallback(final Callback<T> callback) {
        final boolean drain;
        synchronized (this) {
            if (callbacks == null) {
                callbacks = new ArrayList<>(2);
            }
            callbacks.add(callback);
            drain = result != null && startDraining();
        }
        if (drain) {
            scheduleDrain();
        }
    }

    // must hold the monitor
    private boolean startDraining() {
        if (draining || callbacks == null || callbacks.isEmpty()) {
            return false;
        }
        draining = true;
        return true;
    }

    private void scheduleDrain() {
        try {
            dispatcher.execute(this::drain);
        } catch (final RejectedExecutionException e) {
            reject(e);
        }
    }

    private void drain() {
        final Try<T> value = result;
        while (true) {
            final List<Callback<T>> batch;
            synchronized (this) {
                if (callbacks == null || callbacks.isEmpty()) {
                    draining = false;
                    return;
                }
                batch = callbacks;
                callbacks = null;
            }
            for (int i = 0; i < batch.size(); i++) {
                try {
                    batch.get(i).onComplete(value);
                } catch (final Throwable t) {
                    if (Exceptions.isFatal(t)) {
                        requeue(batch.subList(i + 1, batch.size()));
                        Exceptions.rethrowUnchecked(t);
                    }
                    dispatcher.reportFailure(t);
                }
            }
        }
    }

    /**
     * Puts undelivered callbacks back in front of any registered since and hands them to a fresh drain task.
     */
    private void requeue(final List<Callback<T>> undelivered) {
        final boolean drain;
        synchronized (this) {
            if (!undelivered.isEmpty()) {
                final List<Callback<T>> pending = new ArrayList<>(undelivered);
                if (callbacks != null) {
                    pending.addAll(callbacks);
                }
                callbacks = pending;
            }
            draining = false;
            drain = startDraining();
        }
        if (drain) {
            scheduleDrain();
        }
    }

    /**
     * Fails everything waiting on this promise after the dispatcher refused to run its callbacks. Derived
     * promises are completed without scheduling and their own callbacks rejected in turn, iteratively.
     */
    private void reject(final RejectedExecutionException e) {
        dispatcher.reportFailure(e);
        final Deque<DefaultPromise<?>> rejected = new ArrayDeque<>();
        rejected.add(this);
        while (!rejected.isEmpty()) {
            rejected.poll().rejectCallbacks(e, rejected);
        }
    }

    private void rejectCallbacks(final RejectedExecutionException e, final Deque<DefaultPromise<?>> rejected) {
        final List<Callback<T>> pending;
        synchronized (this) {
            pending = callbacks;
            callbacks = null;
            draining = false;
        }
        if (pending != null) {
            for (final Callback<T> callback : pending) {
                final DefaultPromise<?> derived = callback.onRejected(e);
                if (derived != null) {
                    rejected.add(derived);
                }
            }
        }
    }

    /**
     * Completes this promise without scheduling its callbacks.
     *
     * @return true if this call completed the promise
     */
    final boolean tryCompleteUndispatched(final Try<T> value) {
        synchronized (this) {
            if (result != null) {
                return false;
            }
            result = value;
            notifyAll();
            return true;
        }
    }

    private <C extends Callback<T>> C dispatchOrAddCallback(final C callback) {
        addCallback(callback);
        return callback;
    }

    @Override
    public void onComplete(final UncheckedConsumer<? super Try<T>> consumer) {
        Objects.requireNonNull(consumer);
        addCallback(consumer::accept);
    }

    @SuppressWarnings("unchecked")
    private <U> Future<U> recast() {
        return (Future<U>) this;
    }

    private boolean isFailed() {
        final Try<T> value = result;
        return value != null && value.isFailure();
    }

    private boolean isSucceeded() {
        final Try<T> value = result;
        return value != null && value.isSuccess();
    }

    @Override
    public <U> Future<U> map(final UncheckedFunction<? super T, ? extends U> function) {
        if (isFailed()) {
            // fail fast
            return recast();
        }
        return dispatchOrAddCallback(map.using(dispatcher, function));
    }

    @Override
    public <U> Future<U> flatMap(final UncheckedFunction<? super T, ? extends Future<U>> function) {
        if (isFailed()) {
            // fail fast
            return recast();
        }
        return dispatchOrAddCallback(flatMap.using(dispatcher, function));
    }

    @Override
    public <U> Future<U> collect(final UncheckedExtractor<? super T, ? extends U> extractor) {
        if (isFailed()) {
            // fail fast
            return recast();
        }
        return dispatchOrAddCallback(collect.using(dispatcher, extractor));
    }

    @Override
    public Future<T> filter(final UncheckedPredicate<? super T> predicate) {
        if (isFailed()) {
            // fail fast
            return this;
        }
        return dispatchOrAddCallback(filter.using(dispatcher, predicate));
    }

    @Override
    public <U> Future<U> transform(final UncheckedFunction<? super Try<T>, ? extends Try<U>> function) {
        return dispatchOrAddCallback(transform.using(dispatcher, function));
    }

    @Override
    public <U> Future<U> transformWith(final UncheckedFunction<? super Try<T>, ? extends Future<U>> function) {
        return dispatchOrAddCallback(transformWith.using(dispatcher, function));
    }

    @Override
    public Future<T> recover(final UncheckedFunction<? super Throwable, ? extends T> function) {
        if (isSucceeded()) {
            // recover fast
            return this;
        }
        return dispatchOrAddCallback(recover.using(dispatcher, function));
    }

    @Override
    public Future<T> recoverWith(final UncheckedFunction<? super Throwable, ? extends Future<T>> function) {
        if (isSucceeded()) {
            // recover fast
            return this;
        }
        return dispatchOrAddCallback(recoverWith.using(dispatcher, function));
    }

    @Override
    public void await() throws InterruptedException {
        result();
    }

    @Override
    public boolean await(final long time, final TimeUnit unit) throws InterruptedException {
        return awaitResult(Math.max(0L, unit.toNanos(time))) != null;
    }

    @Override
    public Try<T> result() throws InterruptedException {
        final Try<T> value = result;
        return value != null ? value : awaitResult(UNTIMED);
    }

    @Override
    public Optional<Try<T>> valueWithin(final long time, final TimeUnit unit) throws InterruptedException {
        return Optional.ofNullable(awaitResult(Math.max(0L, unit.toNanos(time))));
    }

    @Override
    public T get() throws InterruptedException, ExecutionException {
        return unwrap(result());
    }

    @Override
    public T get(final long timeout, final TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
        final Try<T> value = awaitResult(Math.max(0L, unit.toNanos(timeout)));
        if (value == null) {
            throw new TimeoutException("future timed out after " + timeout + " " + unit);
        }
        return unwrap(value);
    }

    private static <T> T unwrap(final Try<T> value) throws ExecutionException {
        if (value.isFailure()) {
            throw new ExecutionException(value.error());
        }
        return value.value();
    }

    /**
     * Waits on the monitor of this promise until it is completed or the timeout elapses.
     *
     * @return the result or null if the timeout elapsed first
     */
    private Try<T> awaitResult(final long timeoutNanos) throws InterruptedException {
        final Try<T> value = result;
        if (value != null || timeoutNanos == 0L) {
            return value;
        }
        ForkJoinPool.managedBlock(new ResultBlocker(timeoutNanos));
        return result;
    }

    /**
     * Lets a ForkJoinPool compensate for a worker blocked on this promise.
     */
    private final class ResultBlocker implements ForkJoinPool.ManagedBlocker {

        private final boolean timed;
        private final long deadline;

        ResultBlocker(final long timeoutNanos) {
            timed = timeoutNanos != UNTIMED;
            deadline = timed ? System.nanoTime() + timeoutNanos : 0L;
        }

        @Override
        public boolean block() throws InterruptedException {
            final Object monitor = DefaultPromise.this;
            synchronized (monitor) {
                while (result == null) {
                    if (timed) {
                        final long remaining = deadline - System.nanoTime();
                        if (remaining <= 0L) {
                            break;
                        }
                        TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
                    } else {
                        monitor.wait();
                    }
                }
            }
            return true;
        }

        @Override
        public boolean isReleasable() {
            return result != null || timed && deadline - System.nanoTime() <= 0L;
        }
    }

    @Override
    public String toString() {
        final Try<T> value = result;
        return "Future{" + (value == null ? "pending" : value) + '}';
    }
}
