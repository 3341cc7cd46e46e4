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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Class-level events (RUN_CLASS, CLASS_CONSTRUCTOR, CLASS_RESULT).
 */
public record ClassRunEvent(
        RunEventType type,
        Runner runner,
        ClassDefinition definition,
        Object instance,  // only for CLASS_CONSTRUCTOR
        ClassResult result  // only for CLASS_RESULT
) implements RunEvent {

    public static ClassRunEvent enter(Runner runner, ClassDefinition definition) {
        return new ClassRunEvent(RunEventType.RUN_CLASS, runner, definition, null, null);
    }

    public static ClassRunEvent constructed(Runner runner, ClassDefinition definition, Object instance) {
        return new ClassRunEvent(RunEventType.CLASS_CONSTRUCTOR, runner, definition, instance, null);
    }

    public static ClassRunEvent exit(Runner runner, ClassDefinition definition, ClassResult result) {
        return new ClassRunEvent(RunEventType.CLASS_RESULT, runner, definition, null, result);
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
        if (type == RunEventType.CLASS_RESULT && result != null) {
            return result.toJson();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        if (definition != null) {
            map.put("name", definition.getName());
            map.put("tests", definition.getTests().size());
            map.put("hooks", definition.getHooks().size());
            map.put("skip", definition.isSkip());
        }
        if (instance != null) {
            map.put("instance", instance.getClass().getName());
        }
        return map;
    }
}
