package org.musigma.futures.benchmarks;

import org.musigma.futures.concurrent.Future;
import org.musigma.futures.concurrent.Futures;
import org.musigma.futures.concurrent.Promise;
import org.openjdk.jmh.annotations.Benchmark;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

public class FoldFutureBenchmark extends AbstractFutureBenchmark {

    @Benchmark
    public long fold() throws InterruptedException {
        final List<Promise<Long>> promises = new ArrayList<>(recursion);
        final List<Future<Long>> futures = new ArrayList<>(recursion);
        for (int i = 0; i < recursion; i++) {
            final Promise<Long> promise = dispatcher.newPromise();
            promises.add(promise);
            futures.add(promise.future());
        }
        final Future<Long> sum = Futures.fold(dispatcher, 0L, futures, Long::sum);
        long n = 0;
        for (final Promise<Long> promise : promises) {
            promise.success(n++);
        }
        return sum.valueWithin(1, TimeUnit.MINUTES).orElseThrow(IllegalStateException::new).get();
    }

    @Benchmark
    public int sequence() throws InterruptedException {
        final List<Future<Integer>> futures = new ArrayList<>(recursion);
        for (int i = 0; i < recursion; i++) {
            futures.add(dispatcher.successful(i).future());
        }
        return Futures.sequence(dispatcher, futures).join().size();
    }
}
