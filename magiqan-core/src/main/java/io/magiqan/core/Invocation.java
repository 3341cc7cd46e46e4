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

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * What a {@link TestFunction} receives: the shared class instance, the argument sets of
 * the test, a log that ends up on the result, and a cancellation flag raised when the
 * function runs past its timeout.
 * <p>
 * Long-running bodies should poll {@link #isCancelled()} or call {@link #checkCancelled()};
 * the worker thread is also interrupted. Code that ignores both keeps running after its
 * result has been reported.
 */
public class Invocation {

    private static final int NEW = 0;
    private static final int RUNNING = 1;
    private static final int DONE = 2;
    private static final int ORPHANED = 3;

    private final String name;
    private final Object instance;
    private final List<List<Object>> data;
    private final LogContext logContext = new LogContext();
    private final AtomicInteger state = new AtomicInteger(NEW);
    private volatile boolean cancelled;

    public Invocation(String name, Object instance, List<List<Object>> data) {
        this.name = name;
        this.instance = instance;
        this.data = data == null ? Collections.emptyList() : data;
    }

    public String getName() {
        return name;
    }

    public Object getInstance() {
        return instance;
    }

    public <T> T getInstance(Class<T> type) {
        return type.cast(instance);
    }

    public List<List<Object>> getData() {
        return data;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void checkCancelled() {
        if (cancelled) {
            throw new CancellationException(name + " was cancelled");
        }
    }

    public void log(String format, Object... args) {
        logContext.log(format, args);
    }

    public LogContext getLogContext() {
        return logContext;
    }

    void cancel() {
        cancelled = true;
    }

    /**
     * Called on the worker thread before the body. The cancellation flag is read after
     * the state change, so a timeout that missed the running state is still seen here.
     *
     * @return false if the body must not run
     */
    boolean begin() {
        state.compareAndSet(NEW, RUNNING);
        return !cancelled;
    }

    /**
     * Marks the invocation as still running after its result was reported.
     *
     * @return false if it had not started or had already finished
     */
    boolean orphan() {
        return state.compareAndSet(RUNNING, ORPHANED);
    }

    /**
     * @return true if the invocation had been orphaned before finishing
     */
    boolean finish() {
        return state.getAndSet(DONE) == ORPHANED;
    }

}
