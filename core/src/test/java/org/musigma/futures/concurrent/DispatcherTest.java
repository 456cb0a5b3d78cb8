package org.musigma.futures.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.musigma.futures.test.Assertions.assertThrowsWrapped;

class DispatcherTest {

    private final List<Throwable> reported = new CopyOnWriteArrayList<>();
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = Dispatcher.builder()
                .parallelism(2)
                .threadNamePrefix("dispatcher-test")
                .failureReporter(reported::add)
                .build();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        dispatcher.close();
        dispatcher.awaitTermination(10, TimeUnit.SECONDS);
    }

    @Test
    void newDispatcherShouldBeQuiescent() {
        assertTrue(dispatcher.isQuiescent());
        assertEquals(0L, dispatcher.pendingTasks());
    }

    @Test
    void pendingTasksShouldCountUntilFinished() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        dispatcher.execute(() -> {
            started.countDown();
            try {
                release.await();
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(started.await(10, TimeUnit.SECONDS));
        assertEquals(1L, dispatcher.pendingTasks());
        assertFalse(dispatcher.isQuiescent());
        assertFalse(dispatcher.awaitQuiescence(10, TimeUnit.MILLISECONDS));
        release.countDown();
        assertTrue(dispatcher.awaitQuiescence(10, TimeUnit.SECONDS));
        assertEquals(0L, dispatcher.pendingTasks());
    }

    @Test
    void quiescenceShouldCoverCallbackChains() throws InterruptedException {
        AtomicInteger fired = new AtomicInteger();
        Promise<Integer> p = dispatcher.newPromise();
        p.future().map(i -> i + 1).map(i -> i * 2).foreach(i -> fired.incrementAndGet());
        p.success(1);
        assertTrue(dispatcher.awaitQuiescence(10, TimeUnit.SECONDS));
        assertEquals(1, fired.get());
    }

    @Test
    void taskErrorsShouldBeReported() throws InterruptedException {
        dispatcher.execute(() -> {
            throw new IllegalStateException("task failed");
        });
        assertTrue(dispatcher.awaitQuiescence(10, TimeUnit.SECONDS));
        assertEquals(1, reported.size());
        assertEquals("task failed", reported.get(0).getMessage());
    }

    @Test
    void failingReporterShouldNotEscape() throws InterruptedException {
        Dispatcher fragile = Dispatcher.builder()
                .parallelism(1)
                .failureReporter(t -> {
                    throw new IllegalStateException("reporter failed");
                })
                .build();
        try {
            fragile.execute(() -> {
                throw new IllegalArgumentException("task failed");
            });
            fragile.reportFailure(new IllegalArgumentException("direct"));
            assertTrue(fragile.awaitQuiescence(10, TimeUnit.SECONDS));
        } finally {
            fragile.close();
        }
    }

    @Test
    void threadsShouldUseConfiguredPrefix() throws ExecutionException, InterruptedException {
        String name = dispatcher.submit(() -> Thread.currentThread().getName()).get();
        assertTrue(name.startsWith("dispatcher-test-"), name);
        assertTrue(dispatcher.submit(() -> Thread.currentThread().isDaemon()).get());
    }

    @Test
    void submitShouldCompleteWithValueOrError() throws ExecutionException, InterruptedException {
        assertEquals("value", dispatcher.submit(() -> "value").get());
        assertThrowsWrapped(IllegalStateException.class, dispatcher.submit(() -> {
            throw new IllegalStateException("producer failed");
        })::get, "producer failed");
    }

    @Test
    void submitAfterShutdownShouldFailFuture() {
        dispatcher.shutdown();
        assertTrue(dispatcher.isShutdown());
        Future<String> f = dispatcher.submit(() -> "never");
        assertTrue(f.isDone());
        assertInstanceOf(RejectedExecutionException.class, f.getCurrent().orElseThrow(AssertionError::new).error());
        assertThrows(RejectedExecutionException.class, () -> dispatcher.execute(() -> {
        }));
        assertTrue(dispatcher.isQuiescent());
    }

    @Test
    void existingExecutorServiceShouldBeAdapted() throws ExecutionException, InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        try (Dispatcher adapted = Dispatcher.fromExecutorService(pool, errors::add)) {
            Future<Integer> f = adapted.submit(() -> 20).map(i -> i + 1).map(i -> i * 2);
            assertEquals(42, (int) f.get());
            adapted.successful("x").future().onComplete(ignored -> {
                throw new IllegalStateException("callback failed");
            });
            assertTrue(adapted.awaitQuiescence(10, TimeUnit.SECONDS));
            assertEquals(1, errors.size());
        }
        assertTrue(pool.isShutdown());
    }

    @Test
    void threadCountsShouldScaleWithProcessors() {
        int processors = Runtime.getRuntime().availableProcessors();
        String property = Dispatcher.PROPERTY_PREFIX + "testThreads";
        System.setProperty(property, "x2");
        try {
            assertEquals(2 * processors, Dispatcher.Builder.getInt(property, "1"));
            System.setProperty(property, "3");
            assertEquals(3, Dispatcher.Builder.getInt(property, "1"));
        } finally {
            System.clearProperty(property);
        }
        assertEquals(7, Dispatcher.Builder.getInt(property, "7"));
    }

    @Test
    void invalidParallelismShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> Dispatcher.builder().parallelism(0));
    }

}
