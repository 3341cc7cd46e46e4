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

import io.magiqan.common.StringUtils;
import io.magiqan.registry.HookDefinition;
import io.magiqan.registry.HookKind;
import io.magiqan.registry.TestDefinition;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Outcome of one test or one hook invocation. Test results also carry the results
 * of the each-hooks that ran around the test.
 */
public class TestResult {

    public static final String UNKNOWN_ERROR = "unknown error occurred";

    public enum Kind {
        TEST, HOOK
    }

    private final String name;
    private final Kind kind;
    private final HookKind hookKind;
    private final List<TestResult> hooks = Collections.synchronizedList(new ArrayList<>());
    private volatile Status status = Status.PENDING;
    private long startTime;
    private long stopTime;
    private String error;
    private Throwable cause;
    private String log;

    private TestResult(String name, Kind kind, HookKind hookKind) {
        this.name = name;
        this.kind = kind;
        this.hookKind = hookKind;
    }

    public static TestResult test(String name) {
        return new TestResult(name, Kind.TEST, null);
    }

    public static TestResult hook(HookDefinition hook) {
        return new TestResult(hook.getName(), Kind.HOOK, hook.getKind());
    }

    public static TestResult skipped(TestDefinition test) {
        TestResult result = test(test.getName());
        result.status = Status.SKIPPED;
        return result;
    }

    public static TestResult skipped(HookDefinition hook) {
        TestResult result = hook(hook);
        result.status = Status.SKIPPED;
        return result;
    }

    // ========== Mutation (engine only) ==========

    void start() {
        startTime = System.currentTimeMillis();
    }

    void stop() {
        stopTime = System.currentTimeMillis();
    }

    void passed() {
        status = Status.PASSED;
    }

    void broken() {
        status = Status.BROKEN;
    }

    void failed(Throwable t) {
        status = Status.FAILED;
        Throwable unwrapped = unwrap(t);
        if (unwrapped == null) {
            // a wrapper with nothing inside, keep it as-is on the side
            error = UNKNOWN_ERROR;
            cause = t;
        } else {
            error = StringUtils.throwableToString(unwrapped);
            cause = unwrapped;
        }
    }

    void setLog(String log) {
        this.log = log == null || log.isEmpty() ? null : log;
    }

    void addHookResults(List<TestResult> results) {
        hooks.addAll(results);
    }

    /**
     * Copies the outcome of the invocation of the test body onto this result,
     * keeping the timestamps that span the each-hooks.
     */
    void complete(TestResult body) {
        status = body.status;
        error = body.error;
        cause = body.cause;
        log = body.log;
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof InvocationTargetException
                || current instanceof ExecutionException
                || current instanceof CompletionException
                || current instanceof UndeclaredThrowableException) {
            current = current.getCause();
        }
        return current;
    }

    // ========== Accessors ==========

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isHook() {
        return kind == Kind.HOOK;
    }

    /**
     * Null for tests.
     */
    public HookKind getHookKind() {
        return hookKind;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isPassed() {
        return status == Status.PASSED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isBroken() {
        return status == Status.BROKEN;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    public boolean isTimedOut() {
        return cause instanceof TimedOutException;
    }

    public long getStartTime() {
        return startTime;
    }

    public long getStopTime() {
        return stopTime;
    }

    public long getDurationMillis() {
        return stopTime - startTime;
    }

    /**
     * Stack trace text of the failure, or {@link #UNKNOWN_ERROR}.
     */
    public String getError() {
        return error;
    }

    /**
     * The throwable behind {@link #getError()}, kept even when the error text is the generic marker.
     */
    public Throwable getCause() {
        return cause;
    }

    public String getErrorMessage() {
        return cause == null ? error : cause.getMessage();
    }

    public String getLog() {
        return log;
    }

    public List<TestResult> getHooks() {
        synchronized (hooks) {
            return List.copyOf(hooks);
        }
    }

    public boolean isAnyHookFailed() {
        synchronized (hooks) {
            return hooks.stream().anyMatch(TestResult::isFailed);
        }
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("kind", kind == Kind.HOOK ? hookKind.getValue() : "test");
        map.put("isHook", isHook());
        map.put("result", status.getValue());
        map.put("start", startTime);
        map.put("stop", stopTime);
        if (error != null) {
            map.put("error", error);
        }
        if (log != null) {
            map.put("log", log);
        }
        List<TestResult> hookResults = getHooks();
        if (!hookResults.isEmpty()) {
            List<Map<String, Object>> list = new ArrayList<>();
            for (TestResult hook : hookResults) {
                list.add(hook.toJson());
            }
            map.put("hooks", list);
        }
        return map;
    }

    @Override
    public String toString() {
        return name + ": " + status.getValue();
    }

}
