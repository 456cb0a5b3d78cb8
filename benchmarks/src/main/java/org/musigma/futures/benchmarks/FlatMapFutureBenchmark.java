package org.musigma.futures.benchmarks;

import org.musigma.futures.concurrent.Dispatcher;
import org.musigma.futures.concurrent.Future;
import org.openjdk.jmh.infra.Blackhole;

public class FlatMapFutureBenchmark extends OpFutureBenchmark {
    @Override
    protected Future<String> next(final Dispatcher dispatcher, final Blackhole bh, final int count, final Future<String> input) {
        Future<String> result = input;
        for (int i = 0; i < count; i++) {
            result = result.flatMap(s -> {
                bh.consume(s);
                return dispatcher.successful(s).future();
            });
        }
        return result;
    }
}
