/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.magiqan.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RunnableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TimeoutGuardTest {

    private ExecutorService executor;
    private AtomicInteger orphans;

    @BeforeEach
    void beforeEach() {
        executor = Executors.newCachedThreadPool();
        orphans = new AtomicInteger();
    }

    @AfterEach
    void afterEach() {
        executor.shutdownNow();
    }

    private TestResult run(long timeout, TestFunction fn) {
        TimeoutGuard guard = new TimeoutGuard(executor, timeout, orphans, 1);
        return guard.run(TestResult.test("t"), fn, new Invocation("t", null, null));
    }

    @Test
    void testPasses() {
        TestResult result = run(1000, inv -> 42);
        assertEquals(Status.PASSED, result.getStatus());
        assertNull(result.getError());
        assertTrue(result.getStopTime() >= result.getStartTime());
    }

    @Test
    void testFailureKeepsCause() {
        IllegalArgumentException error = new IllegalArgumentException("bad input");
        TestResult result = run(1000, TestFunction.of(inv -> {
            throw error;
        }));
        assertEquals(Status.FAILED, result.getStatus());
        assertSame(error, result.getCause());
        assertFalse(result.isTimedOut());
    }

    @Test
    void testTimeoutInterruptsWorker() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        TestResult result = run(30, TestFunction.of(inv -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
        }));
        assertTrue(result.isTimedOut());
        TimedOutException e = (TimedOutException) result.getCause();
        assertEquals(30, e.getTimeout());
        assertEquals("t timed out after 30 ms", e.getMessage());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void testOrphanIsCountedUntilItFinishes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        TestResult result = run(200, TestFunction.of(inv -> {
            try {
                // ignores interruption on purpose
                while (release.getCount() > 0) {
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        // keep waiting
                    }
                }
            } finally {
                done.countDown();
            }
        }));
        assertTrue(result.isTimedOut());
        assertEquals(1, orphans.get());
        release.countDown();
        assertTrue(done.await(2, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + 2000;
        while (orphans.get() != 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, orphans.get());
    }

    @Test
    void testLogIsCaptured() {
        TestResult result = run(1000, TestFunction.of(inv -> {
            inv.log("step {} of {}", 1, 2);
            inv.log("done");
        }));
        assertEquals("step 1 of 2\ndone\n", result.getLog());
    }


    @Test
    void testLateStartDoesNotRunBody() {
        // the worker picked the task up, but only reaches the body after the deadline
        HeldExecutor held = new HeldExecutor();
        AtomicBoolean ran = new AtomicBoolean();
        TimeoutGuard guard = new TimeoutGuard(held, 30, orphans, 1);
        TestResult result = guard.run(TestResult.test("t"), inv -> ran.getAndSet(true), new Invocation("t", null, null));
        assertTrue(result.isTimedOut());
        assertEquals(0, orphans.get());
        held.release();
        assertFalse(ran.get());
        assertEquals(0, orphans.get());
    }

    @Test
    void testInvocationStates() {
        Invocation running = new Invocation("a", null, null);
        assertTrue(running.begin());
        running.cancel();
        assertTrue(running.orphan());
        assertTrue(running.finish());
        Invocation late = new Invocation("b", null, null);
        late.cancel();
        assertFalse(late.orphan());
        assertFalse(late.begin());
        assertFalse(late.finish());
    }

    /**
     * Holds submitted tasks until {@link #release()} and ignores cancellation, as if each
     * task had already been picked up by a worker.
     */
    static class HeldExecutor extends AbstractExecutorService {

        private final List<Runnable> tasks = new ArrayList<>();

        @Override
        protected <T> RunnableFuture<T> newTaskFor(Callable<T> callable) {
            return new FutureTask<>(callable) {
                @Override
                public boolean cancel(boolean mayInterruptIfRunning) {
                    return false;
                }
            };
        }

        void release() {
            tasks.forEach(Runnable::run);
            tasks.clear();
        }

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        @Override
        public void shutdown() {
        }

        @Override
        public List<Runnable> shutdownNow() {
            return new ArrayList<>(tasks);
        }

        @Override
        public boolean isShutdown() {
            return false;
        }

        @Override
        public boolean isTerminated() {
            return false;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }

    }

}
