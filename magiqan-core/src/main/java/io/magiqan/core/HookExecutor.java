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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs the hooks of one kind for a class, or around one test. Skipped hooks are recorded
 * without being invoked, the others run concurrently against the shared instance.
 * Results come back in declaration order.
 */
public class HookExecutor {

    private final Runner runner;
    private final ClassDefinition definition;
    private final Object instance;

    HookExecutor(Runner runner, ClassDefinition definition, Object instance) {
        this.runner = runner;
        this.definition = definition;
        this.instance = instance;
    }

    public List<TestResult> runClassHooks(HookKind kind) {
        return run(null, definition.getHooks(kind));
    }

    public List<TestResult> runEachHooks(TestDefinition test, HookKind kind) {
        return run(test, definition.getEachHooks(test, kind));
    }

    private List<TestResult> run(TestDefinition test, List<HookDefinition> hooks) {
        if (hooks.isEmpty()) {
            return Collections.emptyList();
        }
        List<Callable<TestResult>> tasks = new ArrayList<>(hooks.size());
        for (HookDefinition hook : hooks) {
            if (hook.isSkip()) {
                tasks.add(() -> TestResult.skipped(hook));
            } else {
                tasks.add(() -> runHook(test, hook));
            }
        }
        return runner.runAll(tasks);
    }

    private TestResult runHook(TestDefinition test, HookDefinition hook) {
        runner.emit(HookRunEvent.enter(runner, definition, test, hook));
        Invocation invocation = new Invocation(hook.getName(), instance, null);
        TestResult result = runner.newGuard().run(TestResult.hook(hook), hook.getFn(), invocation);
        runner.emit(HookRunEvent.exit(runner, definition, test, hook, result));
        return result;
    }

}
