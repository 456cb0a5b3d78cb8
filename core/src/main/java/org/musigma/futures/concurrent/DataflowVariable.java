package org.musigma.futures.concurrent;

import org.apiguardian.api.API;
import org.musigma.futures.Try;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Single-assignment variable for handing a value between independent units of work. Readers block until the
 * variable is bound; binding is write-once and later assignments are ignored.
 *
 * <p>A variable can {@linkplain #follow(Future) follow} another future, in which case it is bound to whatever
 * that future completes with. Neither side needs to reference the other's unit of work directly.</p>
 *
 * @param <T> type of bound value
 */
@API(status = API.Status.EXPERIMENTAL)
public final class DataflowVariable<T> implements Awaitable {

    private final Promise<T> promise;

    public DataflowVariable(final Dispatcher dispatcher) {
        this.promise = dispatcher.newPromise();
    }

    /**
     * Binds this variable to the given value.
     *
     * @return true if this call bound the variable, false if it was already bound
     */
    public boolean assign(final T value) {
        return promise.trySuccess(value);
    }

    /**
     * Binds this variable to an error; readers observe it as a failure.
     *
     * @return true if this call bound the variable, false if it was already bound
     */
    public boolean fail(final Throwable error) {
        return promise.tryFailure(error);
    }

    /**
     * Binds this variable to the eventual result of the given future.
     *
     * @return this
     */
    public DataflowVariable<T> follow(final Future<T> source) {
        Objects.requireNonNull(source);
        promise.completeWith(source);
        return this;
    }

    /**
     * Binds this variable to the eventual value of another variable.
     *
     * @return this
     */
    public DataflowVariable<T> follow(final DataflowVariable<T> source) {
        return follow(source.future());
    }

    public boolean isBound() {
        return promise.isDone();
    }

    public Future<T> future() {
        return promise.future();
    }

    /**
     * Blocks until this variable is bound and returns its value, or throws the error it was bound to.
     */
    public T get() throws InterruptedException {
        return promise.future().join();
    }

    public Try<T> result() throws InterruptedException {
        return promise.future().result();
    }

    @Override
    public void await() throws InterruptedException {
        promise.future().await();
    }

    @Override
    public boolean await(final long time, final TimeUnit unit) throws InterruptedException {
        return promise.future().await(time, unit);
    }

    @Override
    public String toString() {
        return "DataflowVariable{" + promise.future().getCurrent().map(String::valueOf).orElse("unbound") + '}';
    }
}
