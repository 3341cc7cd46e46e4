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
package io.magiqan.registry;

import io.magiqan.core.TestFunction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A declared test: a named function plus the each-scoped hooks that belong to it.
 * <p>
 * Argument sets in {@link #getData()} are handed to the single invocation as a whole,
 * the engine does not fan a definition out into one run per set.
 */
public class TestDefinition {

    private final String name;
    private final TestFunction fn;
    private final boolean skip;
    private final List<List<Object>> data;
    private final List<HookDefinition> hooks;
    private final Map<String, Object> metadata;

    private TestDefinition(Builder builder) {
        this.name = builder.name;
        this.fn = builder.fn;
        this.skip = builder.skip;
        this.data = Collections.unmodifiableList(new ArrayList<>(builder.data));
        this.hooks = Collections.unmodifiableList(new ArrayList<>(builder.hooks));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static TestDefinition of(String name, TestFunction fn) {
        return builder(name, fn).build();
    }

    public static Builder builder(String name, TestFunction fn) {
        return new Builder(name, fn);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(name, fn).skip(skip);
        builder.data.addAll(data);
        builder.hooks.addAll(hooks);
        builder.metadata.putAll(metadata);
        return builder;
    }

    public String getName() {
        return name;
    }

    public TestFunction getFn() {
        return fn;
    }

    public boolean isSkip() {
        return skip;
    }

    public List<List<Object>> getData() {
        return data;
    }

    /**
     * Each-scoped hooks declared on this test only. Class-wide each hooks are
     * merged in by {@link ClassDefinition#getEachHooks(TestDefinition, HookKind)}.
     */
    public List<HookDefinition> getHooks() {
        return hooks;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("skip", skip);
        if (!data.isEmpty()) {
            map.put("data", data);
        }
        if (!hooks.isEmpty()) {
            List<Map<String, Object>> list = new ArrayList<>();
            for (HookDefinition hook : hooks) {
                list.add(hook.toJson());
            }
            map.put("hooks", list);
        }
        if (!metadata.isEmpty()) {
            map.put("metadata", metadata);
        }
        return map;
    }

    @Override
    public String toString() {
        return name;
    }

    // ========== Builder ==========

    public static class Builder {

        private final String name;
        private final TestFunction fn;
        private boolean skip;
        private final List<List<Object>> data = new ArrayList<>();
        private final List<HookDefinition> hooks = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        Builder(String name, TestFunction fn) {
            this.name = Objects.requireNonNull(name, "name");
            this.fn = Objects.requireNonNull(fn, "fn");
        }

        public Builder skip(boolean skip) {
            this.skip = skip;
            return this;
        }

        public Builder skip() {
            return skip(true);
        }

        /**
         * Add one argument set.
         */
        public Builder data(Object... args) {
            data.add(Collections.unmodifiableList(Arrays.asList(args)));
            return this;
        }

        public Builder hook(HookDefinition hook) {
            if (!hook.getKind().isEach()) {
                throw new IllegalArgumentException("only each hooks can be attached to a test: " + hook);
            }
            hooks.add(hook);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public TestDefinition build() {
            return new TestDefinition(this);
        }

    }

}
