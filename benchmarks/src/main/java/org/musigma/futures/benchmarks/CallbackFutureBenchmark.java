package org.musigma.futures.benchmarks;

import org.musigma.futures.concurrent.Dispatcher;
import org.musigma.futures.concurrent.Future;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Registers many callbacks on a single future; measures draining one long callback list.
 */
public class CallbackFutureBenchmark extends OpFutureBenchmark {
    @Override
    protected Future<String> next(final Dispatcher dispatcher, final Blackhole bh, final int count, final Future<String> input) {
        for (int i = 0; i < count - 1; i++) {
            input.onComplete(bh::consume);
        }
        return input.andThen(bh::consume);
    }
}
