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

/**
 * Association between a test class and its {@link ClassDefinition}, plus the cache
 * of the one instance the engine constructs per class.
 * <p>
 * Lookups return null when nothing is registered. The {@code register*} methods are
 * the declaration API: call them once per class, typically from a static block or a
 * module loader, in the order the tests and hooks should run.
 * <pre>
 * registry.registerClass(LoginSuite.class);
 * registry.registerHook(LoginSuite.class, HookDefinition.beforeAll("connect", inv -&gt; ...));
 * registry.registerTest(LoginSuite.class, TestDefinition.of("rejectsBadPassword", inv -&gt; ...));
 * </pre>
 */
public interface Registry {

    ClassDefinition getClassDefinition(Class<?> type);

    void setClassDefinition(Class<?> type, ClassDefinition definition);

    Object getInstance(Class<?> type);

    void setInstance(Class<?> type, Object instance);

    default boolean isRegistered(Class<?> type) {
        return getClassDefinition(type) != null;
    }

    default ClassDefinition registerClass(Class<?> type) {
        ClassDefinition existing = getClassDefinition(type);
        if (existing != null) {
            return existing;
        }
        ClassDefinition definition = ClassDefinition.of(type).build();
        setClassDefinition(type, definition);
        return definition;
    }

    default ClassDefinition registerTest(Class<?> type, TestDefinition test) {
        ClassDefinition definition = registerClass(type).toBuilder().test(test).build();
        setClassDefinition(type, definition);
        return definition;
    }

    default ClassDefinition registerHook(Class<?> type, HookDefinition hook) {
        ClassDefinition definition = registerClass(type).toBuilder().hook(hook).build();
        setClassDefinition(type, definition);
        return definition;
    }

}
