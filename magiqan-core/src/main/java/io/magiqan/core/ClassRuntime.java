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
import io.magiqan.registry.ClassDefinition;
import io.magiqan.registry.HookKind;
import io.magiqan.registry.TestDefinition;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs one class: before-all hooks, then every test concurrently, then after-all hooks,
 * all against the one shared instance.
 */
public class ClassRuntime implements Callable<ClassResult> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Runner runner;
    private final ClassDefinition definition;

    ClassRuntime(Runner runner, ClassDefinition definition) {
        this.runner = runner;
        this.definition = definition;
    }

    @Override
    public ClassResult call() {
        runner.emit(ClassRunEvent.enter(runner, definition));
        if (definition.isSkip()) {
            ClassResult skipped = ClassResult.skipped(definition);
            runner.emit(ClassRunEvent.exit(runner, definition, skipped));
            return skipped;
        }
        Object instance = runner.acquireInstance(definition);
        ClassResult result = new ClassResult(definition, instance);
        result.setStartTime(System.currentTimeMillis());
        HookExecutor hooks = new HookExecutor(runner, definition, instance);
        List<TestResult> beforeAll = hooks.runClassHooks(HookKind.BEFORE_ALL);
        List<Callable<TestResult>> tasks = new ArrayList<>();
        for (TestDefinition test : definition.getTests()) {
            tasks.add(new TestRuntime(runner, definition, test, instance));
        }
        List<TestResult> tests = runner.runAll(tasks);
        List<TestResult> afterAll = hooks.runClassHooks(HookKind.AFTER_ALL);
        result.setStopTime(System.currentTimeMillis());
        result.addResults(beforeAll);
        result.addResults(tests);
        result.addResults(afterAll);
        logger.debug("class {}: {} in {} ms", definition.getName(), result.getStatus().getValue(), result.getDurationMillis());
        runner.emit(ClassRunEvent.exit(runner, definition, result));
        return result;
    }

    public ClassDefinition getDefinition() {
        return definition;
    }

}
