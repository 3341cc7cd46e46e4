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

import io.magiqan.registry.ClassDefinition;
import io.magiqan.registry.TestDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ClassResult {

    private final ClassDefinition definition;
    private final Object instance;
    private final boolean skipped;
    private final List<TestResult> results = Collections.synchronizedList(new ArrayList<>());
    private long startTime;
    private long stopTime;

    ClassResult(ClassDefinition definition, Object instance) {
        this(definition, instance, false);
    }

    private ClassResult(ClassDefinition definition, Object instance, boolean skipped) {
        this.definition = definition;
        this.instance = instance;
        this.skipped = skipped;
    }

    /**
     * Result for a class declared with skip: one skipped placeholder per declared test,
     * no instance and no hooks.
     */
    public static ClassResult skipped(ClassDefinition definition) {
        ClassResult result = new ClassResult(definition, null, true);
        long now = System.currentTimeMillis();
        result.startTime = now;
        result.stopTime = now;
        for (TestDefinition test : definition.getTests()) {
            result.results.add(TestResult.skipped(test));
        }
        return result;
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    void setStopTime(long stopTime) {
        this.stopTime = stopTime;
    }

    void addResults(List<TestResult> list) {
        results.addAll(list);
    }

    // ========== Aggregation ==========

    /**
     * Derived from the children, first matching rule wins:
     * <ol>
     *   <li>PASSED if every non-skipped test passed</li>
     *   <li>BROKEN if any class hook or each-hook failed</li>
     *   <li>SKIPPED if every test was skipped</li>
     *   <li>BROKEN otherwise</li>
     * </ol>
     * The order matters: a class whose tests all passed is PASSED even when a
     * before-all or after-all hook failed, and a class whose tests were all skipped
     * individually is PASSED as well. A class declared with skip is always SKIPPED.
     */
    public Status getStatus() {
        if (skipped) {
            return Status.SKIPPED;
        }
        List<TestResult> tests = getTestResults();
        List<TestResult> hooks = getHookResults();
        boolean allNonSkippedPassed = tests.stream()
                .filter(r -> !r.isSkipped())
                .allMatch(TestResult::isPassed);
        boolean anyHookFailed = hooks.stream().anyMatch(TestResult::isFailed)
                || tests.stream().anyMatch(TestResult::isAnyHookFailed);
        boolean allSkipped = tests.stream().allMatch(TestResult::isSkipped);
        if (allNonSkippedPassed) {
            return Status.PASSED;
        } else if (anyHookFailed) {
            return Status.BROKEN;
        } else if (allSkipped) {
            return Status.SKIPPED;
        } else {
            return Status.BROKEN;
        }
    }

    public boolean isPassed() {
        return getStatus() == Status.PASSED;
    }

    // ========== Accessors ==========

    public ClassDefinition getDefinition() {
        return definition;
    }

    public String getName() {
        return definition.getName();
    }

    public Class<?> getType() {
        return definition.getType();
    }

    /**
     * The shared instance, null for a skipped class.
     */
    public Object getInstance() {
        return instance;
    }

    /**
     * Before-all hooks, tests and after-all hooks, in that order.
     */
    public List<TestResult> getResults() {
        synchronized (results) {
            return List.copyOf(results);
        }
    }

    public List<TestResult> getTestResults() {
        List<TestResult> list = new ArrayList<>();
        for (TestResult r : getResults()) {
            if (!r.isHook()) {
                list.add(r);
            }
        }
        return list;
    }

    public List<TestResult> getHookResults() {
        List<TestResult> list = new ArrayList<>();
        for (TestResult r : getResults()) {
            if (r.isHook()) {
                list.add(r);
            }
        }
        return list;
    }

    public TestResult getTestResult(String name) {
        for (TestResult r : getTestResults()) {
            if (r.getName().equals(name)) {
                return r;
            }
        }
        return null;
    }

    public int getTestCount() {
        return getTestResults().size();
    }

    public int getCount(Status status) {
        return (int) getTestResults().stream().filter(r -> r.getStatus() == status).count();
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

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", getName());
        map.put("ctor", definition.getType().getName());
        map.put("result", getStatus().getValue());
        map.put("start", startTime);
        map.put("stop", stopTime);
        List<Map<String, Object>> list = new ArrayList<>();
        for (TestResult r : getResults()) {
            list.add(r.toJson());
        }
        map.put("results", list);
        return map;
    }

    @Override
    public String toString() {
        return getName() + ": " + getStatus().getValue();
    }

}
