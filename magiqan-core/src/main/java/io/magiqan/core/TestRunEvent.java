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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Test events (CLASS_METHOD, CLASS_METHOD_RESULT).
 */
public record TestRunEvent(
        RunEventType type,
        Runner runner,
        ClassDefinition definition,
        TestDefinition test,
        TestResult result  // null for ENTER
) implements RunEvent {

    public static TestRunEvent enter(Runner runner, ClassDefinition definition, TestDefinition test) {
        return new TestRunEvent(RunEventType.CLASS_METHOD, runner, definition, test, null);
    }

    public static TestRunEvent exit(Runner runner, ClassDefinition definition, TestDefinition test, TestResult result) {
        return new TestRunEvent(RunEventType.CLASS_METHOD_RESULT, runner, definition, test, result);
    }

    @Override
    public RunEventType getType() {
        return type;
    }

    @Override
    public Runner getRunner() {
        return runner;
    }

    @Override
    public Map<String, Object> toJson() {
        if (type == RunEventType.CLASS_METHOD_RESULT && result != null) {
            Map<String, Object> map = result.toJson();
            if (definition != null) {
                map.put("class", definition.getName());
            }
            return map;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        if (definition != null) {
            map.put("class", definition.getName());
        }
        if (test != null) {
            map.put("name", test.getName());
            map.put("skip", test.isSkip());
        }
        return map;
    }
}
