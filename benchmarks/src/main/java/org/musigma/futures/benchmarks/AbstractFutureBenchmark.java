package org.musigma.futures.benchmarks;

import org.musigma.futures.concurrent.Dispatcher;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;

import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.LinkedTransferQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 10, time = 2)
@Measurement(iterations = 10, time = 2)
@Fork(value = 1, jvmArgsAppend = {"-Xmx1G", "-Xms1G", "-server", "-XX:+UseCompressedOops", "-XX:+AlwaysPreTouch", "-XX:+UseCondCardMark"})
@Threads(1)
public abstract class AbstractFutureBenchmark {

    @Param({"fjp", "fix", "dsp"})
    public String pool;

    @Param("1")
    public int threads;

    @Param("1024")
    public int recursion;

    protected Dispatcher dispatcher;

    @Setup
    public void setup() {
        switch (pool) {
            case "fjp":
                dispatcher = Dispatcher.fromExecutorService(new ForkJoinPool(threads), Throwable::printStackTrace);
                break;

            case "fix":
                dispatcher = Dispatcher.fromExecutorService(
                        new ThreadPoolExecutor(threads, threads, 0, TimeUnit.SECONDS, new LinkedTransferQueue<>()),
                        Throwable::printStackTrace);
                break;

            case "dsp":
                dispatcher = Dispatcher.builder().parallelism(threads).threadNamePrefix("benchmark").build();
                break;

            default:
                throw new UnsupportedOperationException("invalid pool option: " + pool);
        }
    }

    @TearDown
    public void teardown() throws InterruptedException {
        try {
            dispatcher.shutdown();
        } finally {
            dispatcher.awaitTermination(1, TimeUnit.MINUTES);
        }
    }

}
