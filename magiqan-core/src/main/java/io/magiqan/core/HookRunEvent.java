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
import io.magiqan.registry.TestDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hook events. Class hooks (CLASS_HOOK, CLASS_HOOK_RESULT) have no test,
 * each-hooks (CLASS_EACH_HOOK, CLASS_EACH_HOOK_RESULT) carry the test they run around.
 */
public record HookRunEvent(
        RunEventType type,
        Runner runner,
        ClassDefinition definition,
        TestDefinition test,  // null for class hooks
        HookDefinition hook,
        TestResult result  // null for ENTER
) implements RunEvent {

    public static HookRunEvent enter(Runner runner, ClassDefinition definition, TestDefinition test, HookDefinition hook) {
        RunEventType type = test == null ? RunEventType.CLASS_HOOK : RunEventType.CLASS_EACH_HOOK;
        return new HookRunEvent(type, runner, definition, test, hook, null);
    }

    public static HookRunEvent exit(Runner runner, ClassDefinition definition, TestDefinition test, HookDefinition hook,
                                    TestResult result) {
        RunEventType type = test == null ? RunEventType.CLASS_HOOK_RESULT : RunEventType.CLASS_EACH_HOOK_RESULT;
        return new HookRunEvent(type, runner, definition, test, hook, result);
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
        Map<String, Object> map = new LinkedHashMap<>();
        if (definition != null) {
            map.put("class", definition.getName());
        }
        if (test != null) {
            map.put("test", test.getName());
        }
        if (hook != null) {
            map.put("hook", hook.getName());
            map.put("kind", hook.getKind().getValue());
        }
        if (result != null) {
            map.put("result", result.getStatus().getValue());
            map.put("durationMillis", result.getDurationMillis());
        }
        return map;
    }
}
