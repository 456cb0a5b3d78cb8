package org.musigma.futures.concurrent;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apiguardian.api.API;
import org.musigma.futures.Exceptions;
import org.musigma.futures.Try;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Worker pool running future callbacks and asynchronous units of work. A dispatcher is an explicit resource:
 * create one at startup, pass it to the code creating promises, and {@linkplain #close() close} it at teardown.
 *
 * <p>Every task handed to the pool is counted until it finishes, so {@link #isQuiescent()} and
 * {@link #awaitQuiescence(long, TimeUnit)} can tell when all outstanding asynchronous work has drained.</p>
 */
@API(status = API.Status.EXPERIMENTAL)
public final class Dispatcher implements PromiseFactory, Executor, AutoCloseable {

    private static final Logger LOGGER = LogManager.getLogger(Dispatcher.class);

    static final String PROPERTY_PREFIX = "org.musigma.futures.";

    private final String name;
    private final ExecutorService executorService;
    private final Consumer<Throwable> failureReporter;
    private final QuiescenceCounter quiescence = new QuiescenceCounter();

    private Dispatcher(final String name, final ExecutorService executorService, final Consumer<Throwable> failureReporter) {
        this.name = name;
        this.executorService = executorService;
        this.failureReporter = failureReporter;
    }

    /**
     * Creates a dispatcher backed by a ForkJoinPool configured from system properties.
     */
    public static Dispatcher create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Adapts an existing ExecutorService. Closing the returned dispatcher shuts the ExecutorService down.
     *
     * @param executorService pool to run tasks on
     * @param reporter        receives errors thrown by callbacks
     */
    public static Dispatcher fromExecutorService(final ExecutorService executorService, final Consumer<Throwable> reporter) {
        return new Dispatcher(executorService.getClass().getSimpleName(), Objects.requireNonNull(executorService),
                Objects.requireNonNull(reporter));
    }

    static void logFailure(final Throwable t) {
        LOGGER.error("uncaught failure in future callback", t);
    }

    @Override
    public <T> Promise<T> newPromise() {
        return new DefaultPromise<>(this);
    }

    @Override
    public <T> Promise<T> completed(final Try<T> result) {
        return new DefaultPromise<>(this, result);
    }

    /**
     * Runs the given Callable on this dispatcher and returns a Future completed exactly once with its value or
     * with the error it raised. If this dispatcher refuses the work, the future fails with the
     * {@link RejectedExecutionException}.
     */
    public <T> Future<T> submit(final Callable<? extends T> callable) {
        Objects.requireNonNull(callable);
        final DefaultPromise<T> promise = new DefaultPromise<>(this);
        try {
            execute(() -> {
                try {
                    promise.tryComplete(Try.of(callable));
                } catch (final Throwable fatal) {
                    promise.tryComplete(Try.failure(fatal));
                    Exceptions.rethrowUnchecked(fatal);
                }
            });
        } catch (final RejectedExecutionException e) {
            promise.tryComplete(Try.failure(e));
        }
        return promise;
    }

    /**
     * Runs the given task on the pool. Non-fatal errors thrown by the task are reported rather than rethrown.
     *
     * @throws RejectedExecutionException if this dispatcher is shut down
     */
    @Override
    public void execute(final Runnable task) {
        Objects.requireNonNull(task);
        quiescence.increment();
        try {
            executorService.execute(() -> runTask(task));
        } catch (final RejectedExecutionException e) {
            quiescence.decrement();
            throw e;
        }
    }

    private void runTask(final Runnable task) {
        try {
            task.run();
        } catch (final Throwable t) {
            Exceptions.rethrowIfFatal(t);
            reportFailure(t);
        } finally {
            // an interrupt restored by a captured InterruptedException must not leak into the next task
            if (Thread.interrupted()) {
                LOGGER.trace("cleared interrupt status left by task on [{}]", name);
            }
            quiescence.decrement();
        }
    }

    public void reportFailure(final Throwable t) {
        try {
            failureReporter.accept(t);
        } catch (final Throwable reporterError) {
            Exceptions.rethrowIfFatal(reporterError);
            reporterError.addSuppressed(t);
            logFailure(reporterError);
        }
    }

    /**
     * Returns the number of tasks scheduled on this dispatcher that have not finished yet.
     */
    public long pendingTasks() {
        return quiescence.count();
    }

    public boolean isQuiescent() {
        return quiescence.isQuiescent();
    }

    /**
     * Blocks until no task is outstanding or the time elapses.
     *
     * @return true if this dispatcher became quiescent in time
     */
    public boolean awaitQuiescence(final long time, final TimeUnit unit) throws InterruptedException {
        return quiescence.awaitQuiescence(time, unit);
    }

    public void shutdown() {
        LOGGER.debug("shutting down dispatcher [{}] with [{}] pending tasks", name, quiescence.count());
        executorService.shutdown();
    }

    public boolean isShutdown() {
        return executorService.isShutdown();
    }

    public boolean awaitTermination(final long time, final TimeUnit unit) throws InterruptedException {
        return executorService.awaitTermination(time, unit);
    }

    @Override
    public void close() {
        shutdown();
    }

    @Override
    public String toString() {
        return "Dispatcher{" + name + '}';
    }

    /**
     * Configures a dispatcher backed by a ForkJoinPool. Unset values fall back to the system properties
     * {@code org.musigma.futures.minThreads}, {@code numThreads}, {@code maxThreads} and {@code threadNamePrefix};
     * thread counts of the form {@code xN} are multiplied by the number of available processors.
     */
    public static final class Builder {

        private int parallelism;
        private String threadNamePrefix;
        private boolean daemon = true;
        private Consumer<Throwable> failureReporter;

        private Builder() {
        }

        public Builder parallelism(final int parallelism) {
            if (parallelism <= 0) throw new IllegalArgumentException("parallelism must be positive");
            this.parallelism = parallelism;
            return this;
        }

        public Builder threadNamePrefix(final String threadNamePrefix) {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix);
            return this;
        }

        public Builder daemon(final boolean daemon) {
            this.daemon = daemon;
            return this;
        }

        public Builder failureReporter(final Consumer<Throwable> failureReporter) {
            this.failureReporter = Objects.requireNonNull(failureReporter);
            return this;
        }

        public Dispatcher build() {
            final int threads = parallelism > 0 ? parallelism : defaultParallelism();
            final String prefix = threadNamePrefix != null ? threadNamePrefix :
                    getString(PROPERTY_PREFIX + "threadNamePrefix", "musigma-dispatcher");
            final Consumer<Throwable> reporter = failureReporter != null ? failureReporter : Dispatcher::logFailure;
            final UncaughtExceptionHandler handler = (thread, e) -> reporter.accept(e);
            final DefaultThreadFactory threadFactory = new DefaultThreadFactory(daemon, prefix, handler);
            final ForkJoinPool pool = new ForkJoinPool(threads, threadFactory, handler, true);
            LOGGER.debug("created dispatcher [{}] with parallelism [{}]", prefix, threads);
            return new Dispatcher(prefix, pool, reporter);
        }

        private static int defaultParallelism() {
            return Math.min(
                    Math.max(getInt(PROPERTY_PREFIX + "minThreads", "1"),
                            getInt(PROPERTY_PREFIX + "numThreads", "x1")),
                    getInt(PROPERTY_PREFIX + "maxThreads", "x1"));
        }

        private static String getString(final String propertyName, final String defaultValue) {
            try {
                return System.getProperty(propertyName, defaultValue);
            } catch (final SecurityException ignored) {
                return defaultValue;
            }
        }

        static int getInt(final String propertyName, final String defaultValue) {
            final String s = getString(propertyName, defaultValue);
            if (s.charAt(0) == 'x') {
                return (int) Math.ceil(Double.parseDouble(s.substring(1)) * Runtime.getRuntime().availableProcessors());
            } else {
                return Integer.parseInt(s);
            }
        }
    }
}
