package org.musigma.futures.benchmarks;

import org.musigma.futures.Try;
import org.musigma.futures.concurrent.Dispatcher;
import org.musigma.futures.concurrent.Future;
import org.musigma.futures.concurrent.Promise;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

public abstract class OpFutureBenchmark extends AbstractFutureBenchmark {
    protected final Try<String> failedResult = Try.failure(new Exception("some failed code"));
    protected final Try<String> successfulResult = Try.success("some successful value");

    protected final boolean await(final Future<?> future) throws InterruptedException {
        return future.isDone() || future.await(1, TimeUnit.MINUTES);
    }

    protected abstract Future<String> next(final Dispatcher dispatcher, final Blackhole bh, final int count, final Future<String> input);

    @Benchmark
    public boolean pre(final Blackhole bh) throws InterruptedException {
        return await(next(dispatcher, bh, recursion, dispatcher.completed(successfulResult).future()));
    }

    @Benchmark
    public boolean post(final Blackhole bh) throws InterruptedException {
        final Promise<String> promise = dispatcher.newPromise();
        final Future<String> future = next(dispatcher, bh, recursion, promise.future());
        promise.complete(successfulResult);
        return await(future);
    }

    @Benchmark
    public boolean failed(final Blackhole bh) throws InterruptedException {
        return await(next(dispatcher, bh, recursion, dispatcher.completed(failedResult).future()));
    }
}
