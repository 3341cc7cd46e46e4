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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Everything the engine knows about one test class: its hooks, its tests and
 * how to construct the single instance they share.
 */
public class ClassDefinition {

    private final Class<?> type;
    private final Supplier<?> factory;
    private final List<HookDefinition> hooks;
    private final List<TestDefinition> tests;
    private final boolean skip;
    private final Map<String, Object> metadata;

    private ClassDefinition(Builder builder) {
        this.type = builder.type;
        this.factory = builder.factory;
        this.hooks = Collections.unmodifiableList(new ArrayList<>(builder.hooks));
        this.tests = Collections.unmodifiableList(new ArrayList<>(builder.tests));
        this.skip = builder.skip;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder of(Class<?> type) {
        return new Builder(type);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(type).skip(skip);
        builder.factory = factory;
        builder.hooks.addAll(hooks);
        builder.tests.addAll(tests);
        builder.metadata.putAll(metadata);
        return builder;
    }

    public Class<?> getType() {
        return type;
    }

    public String getName() {
        return type.getSimpleName();
    }

    public List<HookDefinition> getHooks() {
        return hooks;
    }

    public List<HookDefinition> getHooks(HookKind kind) {
        List<HookDefinition> list = new ArrayList<>();
        for (HookDefinition hook : hooks) {
            if (hook.getKind() == kind) {
                list.add(hook);
            }
        }
        return list;
    }

    /**
     * Class-wide hooks of the given each-kind followed by the ones declared on the test itself.
     */
    public List<HookDefinition> getEachHooks(TestDefinition test, HookKind kind) {
        List<HookDefinition> list = getHooks(kind);
        for (HookDefinition hook : test.getHooks()) {
            if (hook.getKind() == kind) {
                list.add(hook);
            }
        }
        return list;
    }

    public List<TestDefinition> getTests() {
        return tests;
    }

    public Optional<TestDefinition> findTest(String name) {
        for (TestDefinition test : tests) {
            if (test.getName().equals(name)) {
                return Optional.of(test);
            }
        }
        return Optional.empty();
    }

    public boolean isSkip() {
        return skip;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Creates a new instance using the registered factory, or the no-arg constructor.
     */
    public Object newInstance() {
        if (factory != null) {
            return factory.get();
        }
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("constructor failed for: " + type.getName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("cannot construct test class: " + type.getName(), e);
        }
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", getName());
        map.put("type", type.getName());
        map.put("skip", skip);
        List<Map<String, Object>> hookList = new ArrayList<>();
        for (HookDefinition hook : hooks) {
            hookList.add(hook.toJson());
        }
        map.put("hooks", hookList);
        List<Map<String, Object>> testList = new ArrayList<>();
        for (TestDefinition test : tests) {
            testList.add(test.toJson());
        }
        map.put("tests", testList);
        if (!metadata.isEmpty()) {
            map.put("metadata", metadata);
        }
        return map;
    }

    @Override
    public String toString() {
        return type.getName();
    }

    // ========== Builder ==========

    public static class Builder {

        private final Class<?> type;
        private Supplier<?> factory;
        private final List<HookDefinition> hooks = new ArrayList<>();
        private final List<TestDefinition> tests = new ArrayList<>();
        private boolean skip;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        Builder(Class<?> type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder factory(Supplier<?> factory) {
            this.factory = factory;
            return this;
        }

        public Builder hook(HookDefinition hook) {
            hooks.add(hook);
            return this;
        }

        public Builder test(TestDefinition test) {
            for (TestDefinition existing : tests) {
                if (existing.getName().equals(test.getName())) {
                    throw new IllegalArgumentException("duplicate test '" + test.getName() + "' in " + type.getName());
                }
            }
            tests.add(test);
            return this;
        }

        public Builder skip(boolean skip) {
            this.skip = skip;
            return this;
        }

        public Builder skip() {
            return skip(true);
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public ClassDefinition build() {
            return new ClassDefinition(this);
        }

    }

}
