package org.musigma.futures.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.musigma.futures.NoMatchException;
import org.musigma.futures.Pair;
import org.musigma.futures.Try;
import org.musigma.futures.TypeMismatchException;
import org.musigma.futures.function.UncheckedExtractor;
import org.musigma.futures.test.TestResponder;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.musigma.futures.test.Assertions.assertThrowsWrapped;

class FutureTest {

    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = Dispatcher.builder().parallelism(4).threadNamePrefix("future-test").build();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        dispatcher.close();
        dispatcher.awaitTermination(10, TimeUnit.SECONDS);
    }

    <T> T fail(final String msg) {
        throw new AssertionError(msg);
    }

    @Test
    void testSuccessful() throws ExecutionException, InterruptedException {
        Future<String> f = dispatcher.successful("test").future();
        assertEquals("test", f.get());
    }

    @Test
    void testFailure() {
        Future<Object> failed = dispatcher.failed(new IllegalStateException("failure")).future();
        assertThrowsWrapped(IllegalStateException.class, failed::get, "failure");
    }

    @Test
    void testMap() throws ExecutionException, InterruptedException {
        Future<Integer> size = dispatcher.successful("hello").future().map(String::length);
        assertEquals(5, (int) size.get());
    }

    @Test
    void testMapOfPendingFuture() throws ExecutionException, InterruptedException {
        Promise<Integer> p = dispatcher.newPromise();
        Future<Integer> doubled = p.future().map(i -> i * 2);
        assertFalse(doubled.isDone());
        p.success(21);
        assertEquals(42, (int) doubled.get());
    }

    @Test
    void testMapSkipsFunctionOnFailure() {
        AtomicBoolean invoked = new AtomicBoolean();
        Promise<String> p = dispatcher.newPromise();
        Future<Integer> mapped = p.future().map(s -> {
            invoked.set(true);
            return s.length();
        });
        p.failure(new IllegalArgumentException("bad input"));
        assertThrowsWrapped(IllegalArgumentException.class, mapped::get, "bad input");
        assertFalse(invoked.get());
    }

    @Test
    void testMapFunctionErrorFailsFuture() {
        Future<Integer> mapped = dispatcher.successful("boom").future().map(s -> {
            throw new ArithmeticException(s);
        });
        assertThrowsWrapped(ArithmeticException.class, mapped::get, "boom");
    }

    @Test
    void testInterruptedFunctionsFailFuture() throws InterruptedException {
        Promise<String> p = dispatcher.newPromise();
        Future<Integer> mapped = p.future().map(s -> {
            throw new InterruptedException("map interrupted");
        });
        Future<Integer> flatMapped = p.future().flatMap(s -> {
            throw new InterruptedException("flatMap interrupted");
        });
        Future<Integer> collected = p.future().collect(s -> {
            throw new InterruptedException("collect interrupted");
        });
        Future<Integer> after = p.future().map(String::length);
        p.success("value");
        assertThrowsWrapped(InterruptedException.class, () -> mapped.get(10, TimeUnit.SECONDS), "map interrupted");
        assertThrowsWrapped(InterruptedException.class, () -> flatMapped.get(10, TimeUnit.SECONDS), "flatMap interrupted");
        assertThrowsWrapped(InterruptedException.class, () -> collected.get(10, TimeUnit.SECONDS), "collect interrupted");
        assertEquals(Try.success(5), after.result());
    }

    @Test
    void testFlatMap() throws ExecutionException, InterruptedException {
        Future<Integer> size = dispatcher.successful("hello").future().flatMap(s -> dispatcher.successful(s.length()).future());
        assertEquals(5, (int) size.get());
    }

    @Test
    void testFlatMapChainAcrossResponders() throws ExecutionException, InterruptedException {
        TestResponder greeter = new TestResponder(dispatcher, message -> "Hello");
        TestResponder shouter = new TestResponder(dispatcher, message -> message.toString().equals("Hello") ? "WORLD" : "?");
        Future<Object> reply = greeter.ask("hi").flatMap(shouter::ask);
        assertEquals("WORLD", reply.get());
    }

    @Test
    void testFlatMapPropagatesResponderError() {
        TestResponder responder = new TestResponder(dispatcher, message -> {
            throw new IllegalStateException("no reply for " + message);
        });
        Future<Object> reply = dispatcher.successful("ping").future().flatMap(responder::ask);
        assertThrowsWrapped(IllegalStateException.class, reply::get, "no reply for ping");
    }

    @Test
    void testCollect() throws ExecutionException, InterruptedException {
        TestResponder echo = new TestResponder(dispatcher, message -> message);
        Future<String> text = echo.ask("Hello").collect(UncheckedExtractor.instanceOf(String.class));
        assertEquals("Hello", text.get());
        Future<String> number = echo.ask(5).collect(UncheckedExtractor.instanceOf(String.class));
        assertThrowsWrapped(NoMatchException.class, number::get, "no match for 5");
    }

    @Test
    void testCastInComprehensionChain() throws ExecutionException, InterruptedException {
        TestResponder echo = new TestResponder(dispatcher, message -> message);
        Future<String> range = echo.ask(10).cast(Integer.class)
                .flatMap(a -> echo.ask(a + 4).cast(Integer.class)
                        .map(b -> a + "-" + b));
        assertEquals("10-14", range.get());

        Future<String> mismatch = echo.ask(10).cast(Integer.class)
                .flatMap(a -> echo.ask("four").cast(Integer.class)
                        .map(b -> a + "-" + b));
        ExecutionException e = assertThrows(ExecutionException.class, mismatch::get);
        TypeMismatchException cause = assertInstanceOf(TypeMismatchException.class, e.getCause());
        assertEquals(Integer.class, cause.getExpected());
        assertEquals(String.class, cause.getActual());
    }

    @Test
    void testFilter() throws ExecutionException, InterruptedException {
        assertNotNull(dispatcher.successful("foo").future().filter(Objects::nonNull).get());
        assertThrowsWrapped(NoMatchException.class, () -> dispatcher.successful(3).future().filter(i -> i > 3).get(), "predicate failed for 3");
        assertThrowsWrapped(IllegalStateException.class, () -> dispatcher.failed(new IllegalStateException("error")).future().filter(ignored -> true).get(), "error");
    }

    @Test
    void testTransform() throws ExecutionException, InterruptedException {
        Future<Integer> testLength = dispatcher.successful("test").future().transform(result -> result.map(String::length));
        assertEquals(4, (int) testLength.get());
        Future<String> resultFuture = dispatcher.successful("test").future().transform(ignored -> Try.failure(new IllegalStateException("uh-oh")));
        assertThrowsWrapped(IllegalStateException.class, resultFuture::get, "uh-oh");
    }

    @Test
    void testTransformWith() throws ExecutionException, InterruptedException {
        Future<String> described = dispatcher.failed(new IllegalStateException("down")).future()
                .transformWith(result -> dispatcher.successful(result.isFailure() ? "failed: " + result.error().getMessage() : "ok").future());
        assertEquals("failed: down", described.get());
    }

    @Test
    void testRecover() throws ExecutionException, InterruptedException {
        Future<Integer> recovered = dispatcher.<Integer>failed(new ArithmeticException("/ by zero")).future()
                .recover(e -> {
                    assertInstanceOf(ArithmeticException.class, e);
                    return 0;
                });
        assertEquals(0, (int) recovered.get());
        Future<Integer> stillFailed = dispatcher.<Integer>failed(new ArithmeticException("/ by zero")).future()
                .recover(e -> {
                    throw new IllegalStateException("cannot recover");
                });
        assertThrowsWrapped(IllegalStateException.class, stillFailed::get, "cannot recover");
    }

    @Test
    void testRecoverWith() throws ExecutionException, InterruptedException {
        Promise<String> p = dispatcher.newPromise();
        Future<String> recovered = p.future().recoverWith(e -> dispatcher.successful("fallback").future());
        p.failure(new RuntimeException("primary failed"));
        assertEquals("fallback", recovered.get());
        Future<String> untouched = dispatcher.successful("primary").future().recoverWith(e -> fail("should not recover"));
        assertEquals("primary", untouched.get());
    }

    @Test
    void testFallbackToPendingFutures() throws ExecutionException, InterruptedException {
        Promise<String> primary = dispatcher.newPromise();
        Promise<String> secondary = dispatcher.newPromise();
        Future<String> result = primary.future().fallbackTo(secondary.future());
        primary.failure(new RuntimeException("primary"));
        assertFalse(result.await(10, TimeUnit.MILLISECONDS));
        secondary.success("secondary");
        assertEquals("secondary", result.get());
    }

    @Test
    void testZip() throws ExecutionException, InterruptedException {
        Future<Pair<String, Integer>> zipped = dispatcher.successful("a").future().zip(dispatcher.successful(1).future());
        assertEquals(Pair.of("a", 1), zipped.get());
        Future<Integer> sum = dispatcher.successful(2).future().zipWith(dispatcher.successful(3).future(), Integer::sum);
        assertEquals(5, (int) sum.get());
        Future<Pair<String, Integer>> failed = dispatcher.successful("a").future()
                .zip(dispatcher.<Integer>failed(new IllegalStateException("right side")).future());
        assertThrowsWrapped(IllegalStateException.class, failed::get, "right side");
    }

    @Test
    void testAndThenRunsSideEffectBeforeCompletion() throws ExecutionException, InterruptedException {
        List<String> effects = new CopyOnWriteArrayList<>();
        Future<String> f = dispatcher.successful("value").future()
                .andThen(result -> effects.add("first " + result.value()))
                .andThen(result -> {
                    throw new IllegalStateException("side effect failed");
                })
                .andThen(result -> effects.add("second " + result.value()));
        assertEquals("value", f.get());
        assertEquals(List.of("first value", "second value"), effects);
    }

    @Test
    void testForeachAndOnFailure() throws ExecutionException, InterruptedException {
        Promise<String> seen = dispatcher.newPromise();
        Promise<String> failures = dispatcher.newPromise();
        dispatcher.failed(new IllegalStateException("ignored")).future().foreach(value -> seen.success("failure leaked"));
        dispatcher.successful("ignored").future().onFailure(error -> failures.success("success leaked"));
        dispatcher.successful("value").future().foreach(seen::success);
        dispatcher.failed(new IllegalStateException("error")).future().onFailure(error -> failures.success(error.getMessage()));
        assertEquals("value", seen.future().get());
        assertEquals("error", failures.future().get());
    }

    @Test
    void testDerivedFuturesShareDispatcher() {
        Future<Integer> f = dispatcher.successful("a").future().map(String::length).filter(i -> i > 0);
        assertSame(dispatcher, f.dispatcher());
    }

    @Test
    void testFailFastReturnsSameFuture() {
        Future<String> failed = dispatcher.<String>failed(new IllegalStateException("error")).future();
        assertSame(failed, failed.map(s -> fail("map should not be called")));
        assertSame(failed, failed.flatMap(s -> fail("flatMap should not be called")));
        assertSame(failed, failed.filter(s -> fail("filter should not be called")));
        Future<String> succeeded = dispatcher.successful("ok").future();
        assertSame(succeeded, succeeded.recover(e -> fail("recover should not be called")));
        assertSame(succeeded, succeeded.recoverWith(e -> fail("recoverWith should not be called")));
    }

}
