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

import io.magiqan.output.LogContext;
import org.slf4j.Logger;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Races one function invocation against a deadline.
 * <p>
 * The function runs on a worker thread while the caller waits at most {@code timeout}
 * milliseconds. When the deadline wins the result is FAILED with a {@link TimedOutException},
 * the invocation is flagged as cancelled and its thread interrupted. A function that
 * ignores both keeps running in the background and is counted as an orphan until it ends.
 * <p>
 * The timeout is fixed when the guard is created.
 */
public class TimeoutGuard {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final ExecutorService executor;
    private final long timeout;
    private final AtomicInteger orphans;
    private final int maxOrphans;

    public TimeoutGuard(ExecutorService executor, long timeout, AtomicInteger orphans, int maxOrphans) {
        this.executor = executor;
        this.timeout = timeout;
        this.orphans = orphans;
        this.maxOrphans = maxOrphans;
    }

    public long getTimeout() {
        return timeout;
    }

    /**
     * Invokes {@code fn} and records the outcome, timestamps and captured log on {@code result}.
     */
    public TestResult run(TestResult result, TestFunction fn, Invocation invocation) {
        result.start();
        Future<Object> future = executor.submit(() -> execute(fn, invocation));
        try {
            future.get(timeout, TimeUnit.MILLISECONDS);
            result.passed();
        } catch (TimeoutException e) {
            abandon(future, invocation);
            result.failed(new TimedOutException(invocation.getName(), timeout));
        } catch (ExecutionException e) {
            result.failed(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(future, invocation);
            result.failed(e);
        }
        result.stop();
        result.setLog(invocation.getLogContext().collect());
        if (result.isFailed()) {
            logger.debug("{} failed: {}", invocation.getName(), result.getErrorMessage());
        }
        return result;
    }

    private Object execute(TestFunction fn, Invocation invocation) throws Exception {
        boolean started = invocation.begin();
        LogContext.set(invocation.getLogContext());
        try {
            if (!started) {
                throw new CancellationException(invocation.getName() + " timed out before it started");
            }
            Object value = fn.invoke(invocation);
            if (value instanceof CompletionStage) {
                return ((CompletionStage<?>) value).toCompletableFuture().get();
            }
            return value;
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new ExecutionException(t);
        } finally {
            LogContext.clear();
            if (invocation.finish()) {
                int remaining = orphans.decrementAndGet();
                logger.debug("orphaned invocation finished: {}, still running: {}", invocation.getName(), remaining);
            }
        }
    }

    private void abandon(Future<?> future, Invocation invocation) {
        invocation.cancel();
        future.cancel(true);
        if (invocation.orphan()) {
            int count = orphans.incrementAndGet();
            if (count > maxOrphans) {
                logger.warn("{} invocations still running after timing out (limit {}), latest: {}",
                        count, maxOrphans, invocation.getName());
            }
        }
    }

}
