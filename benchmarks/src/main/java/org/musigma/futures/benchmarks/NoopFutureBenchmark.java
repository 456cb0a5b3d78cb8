package org.musigma.futures.benchmarks;

import org.musigma.futures.concurrent.Dispatcher;
import org.musigma.futures.concurrent.Future;
import org.openjdk.jmh.infra.Blackhole;

public class NoopFutureBenchmark extends OpFutureBenchmark {
    @Override
    protected Future<String> next(final Dispatcher dispatcher, final Blackhole bh, final int count, final Future<String> input) {
        for (int i = 0; i < count; i++) {
            bh.consume(i);
        }
        bh.consume(input);
        return input;
    }
}
