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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link Registry}. Safe for concurrent use; the read-modify-write
 * {@code register*} methods are synchronized so declarations from several threads
 * do not lose updates.
 */
public class ClassRegistry implements Registry {

    private final Map<Class<?>, ClassDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<Class<?>, Object> instances = new ConcurrentHashMap<>();

    @Override
    public ClassDefinition getClassDefinition(Class<?> type) {
        return definitions.get(type);
    }

    @Override
    public void setClassDefinition(Class<?> type, ClassDefinition definition) {
        definitions.put(type, definition);
    }

    @Override
    public Object getInstance(Class<?> type) {
        return instances.get(type);
    }

    @Override
    public void setInstance(Class<?> type, Object instance) {
        instances.put(type, instance);
    }

    @Override
    public synchronized ClassDefinition registerClass(Class<?> type) {
        return Registry.super.registerClass(type);
    }

    @Override
    public synchronized ClassDefinition registerTest(Class<?> type, TestDefinition test) {
        return Registry.super.registerTest(type, test);
    }

    @Override
    public synchronized ClassDefinition registerHook(Class<?> type, HookDefinition hook) {
        return Registry.super.registerHook(type, hook);
    }

    /**
     * Drops every cached instance, the next run constructs fresh ones.
     */
    public void clearInstances() {
        instances.clear();
    }

    public int size() {
        return definitions.size();
    }

}
