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

import io.magiqan.core.Invocation;
import io.magiqan.core.TestFunction;
import io.magiqan.output.LogContext;
import org.slf4j.Logger;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds a {@link ClassDefinition} from {@link Testable}, {@link TestMethod}, {@link Data} and
 * {@link Hook} annotations, so that annotated classes can be registered without builder calls.
 * <p>
 * Declaration order is not available through reflection, methods are ordered by their
 * {@code order} attribute and then by name.
 */
public final class AnnotationScanner {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final Comparator<Method> TEST_ORDER = Comparator
            .comparingInt((Method m) -> m.getAnnotation(TestMethod.class).order())
            .thenComparing(Method::getName);

    private static final Comparator<Method> HOOK_ORDER = Comparator
            .comparingInt((Method m) -> m.getAnnotation(Hook.class).order())
            .thenComparing(Method::getName);

    private AnnotationScanner() {
    }

    public static boolean isTestable(Class<?> type) {
        return type.isAnnotationPresent(Testable.class)
                && !type.isInterface()
                && !Modifier.isAbstract(type.getModifiers());
    }

    /**
     * Registers the class when it is {@link Testable} and not registered yet.
     *
     * @return true if a definition was added
     */
    public static boolean register(Registry registry, Class<?> type) {
        if (!isTestable(type) || registry.isRegistered(type)) {
            return false;
        }
        registry.setClassDefinition(type, scan(type));
        return true;
    }

    public static ClassDefinition scan(Class<?> type) {
        Testable testable = type.getAnnotation(Testable.class);
        if (testable == null) {
            throw new IllegalArgumentException("not annotated with @Testable: " + type.getName());
        }
        ClassDefinition.Builder builder = ClassDefinition.of(type).skip(testable.skip());
        List<Method> hookMethods = new ArrayList<>();
        List<Method> testMethods = new ArrayList<>();
        for (Method method : type.getDeclaredMethods()) {
            if (method.isAnnotationPresent(Hook.class)) {
                hookMethods.add(method);
            } else if (method.isAnnotationPresent(TestMethod.class)) {
                testMethods.add(method);
            }
        }
        hookMethods.sort(HOOK_ORDER);
        testMethods.sort(TEST_ORDER);
        for (Method method : hookMethods) {
            Hook hook = method.getAnnotation(Hook.class);
            builder.hook(new HookDefinition(method.getName(), hook.value(), function(method), hook.skip(), null));
        }
        for (Method method : testMethods) {
            TestMethod tm = method.getAnnotation(TestMethod.class);
            String name = tm.value().isEmpty() ? method.getName() : tm.value();
            TestDefinition.Builder test = TestDefinition.builder(name, function(method)).skip(tm.skip());
            for (Data data : method.getAnnotationsByType(Data.class)) {
                test.data((Object[]) data.value());
            }
            builder.test(test.build());
        }
        ClassDefinition definition = builder.build();
        logger.debug("scanned {}: {} tests, {} hooks", type.getName(),
                definition.getTests().size(), definition.getHooks().size());
        return definition;
    }

    static TestFunction function(Method method) {
        Class<?>[] params = method.getParameterTypes();
        boolean takesInvocation = params.length == 1 && params[0] == Invocation.class;
        if (params.length > 0 && !takesInvocation) {
            throw new IllegalArgumentException("test method must take no arguments or an Invocation: " + method);
        }
        method.setAccessible(true);
        return invocation -> {
            try {
                return takesInvocation
                        ? method.invoke(invocation.getInstance(), invocation)
                        : method.invoke(invocation.getInstance());
            } catch (InvocationTargetException e) {
                throw e.getCause() == null ? e : e.getCause();
            }
        };
    }

}
