package org.musigma.futures.concurrent;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinPool.ForkJoinWorkerThreadFactory;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

class DefaultThreadFactory implements ThreadFactory, ForkJoinWorkerThreadFactory {

    private final boolean daemonic;
    private final String prefix;
    private final UncaughtExceptionHandler uncaught;
    private final AtomicInteger threadNumber = new AtomicInteger();

    DefaultThreadFactory(final boolean daemonic, final String prefix, final UncaughtExceptionHandler exceptionHandler) {
        this.daemonic = daemonic;
        this.prefix = Objects.requireNonNull(prefix);
        this.uncaught = exceptionHandler;
    }

    private <T extends Thread> T wire(final T thread) {
        thread.setDaemon(daemonic);
        thread.setUncaughtExceptionHandler(uncaught);
        thread.setName(prefix + '-' + threadNumber.incrementAndGet());
        return thread;
    }

    @Override
    public Thread newThread(final Runnable r) {
        return wire(new Thread(r));
    }

    @Override
    public ForkJoinWorkerThread newThread(final ForkJoinPool pool) {
        return wire(new DispatcherThread(pool));
    }

    private static class DispatcherThread extends ForkJoinWorkerThread {
        private DispatcherThread(final ForkJoinPool pool) {
            super(pool);
        }
    }

}
