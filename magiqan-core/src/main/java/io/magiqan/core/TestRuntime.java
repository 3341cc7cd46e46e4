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
import io.magiqan.registry.HookDefinition;
import io.magiqan.registry.HookKind;
import io.magiqan.registry.TestDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs one test: before-each hooks, the body, after-each hooks, in that order.
 * A failed each-hook turns the test BROKEN whatever the body did.
 */
public class TestRuntime implements Callable<TestResult> {

    private final Runner runner;
    private final ClassDefinition definition;
    private final TestDefinition test;
    private final Object instance;

    TestRuntime(Runner runner, ClassDefinition definition, TestDefinition test, Object instance) {
        this.runner = runner;
        this.definition = definition;
        this.test = test;
        this.instance = instance;
    }

    @Override
    public TestResult call() {
        runner.emit(TestRunEvent.enter(runner, definition, test));
        if (test.isSkip() || definition.isSkip()) {
            TestResult skipped = TestResult.skipped(test);
            List<TestResult> placeholders = new ArrayList<>();
            for (HookDefinition hook : definition.getEachHooks(test, HookKind.BEFORE_EACH)) {
                placeholders.add(TestResult.skipped(hook));
            }
            for (HookDefinition hook : definition.getEachHooks(test, HookKind.AFTER_EACH)) {
                placeholders.add(TestResult.skipped(hook));
            }
            skipped.addHookResults(placeholders);
            runner.emit(TestRunEvent.exit(runner, definition, test, skipped));
            return skipped;
        }
        TestResult result = TestResult.test(test.getName());
        result.start();
        HookExecutor hooks = new HookExecutor(runner, definition, instance);
        result.addHookResults(hooks.runEachHooks(test, HookKind.BEFORE_EACH));
        Invocation invocation = new Invocation(test.getName(), instance, test.getData());
        TestResult body = runner.newGuard().run(TestResult.test(test.getName()), test.getFn(), invocation);
        result.complete(body);
        result.addHookResults(hooks.runEachHooks(test, HookKind.AFTER_EACH));
        result.stop();
        if (result.isAnyHookFailed()) {
            result.broken();
        }
        runner.emit(TestRunEvent.exit(runner, definition, test, result));
        return result;
    }

    public TestDefinition getTest() {
        return test;
    }

}
