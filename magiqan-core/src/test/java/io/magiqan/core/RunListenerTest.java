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

import io.magiqan.registry.ClassRegistry;
import io.magiqan.registry.HookDefinition;
import io.magiqan.registry.TestDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunListenerTest {

    static class Catalog {
    }

    private static ClassRegistry catalogRegistry() {
        ClassRegistry registry = new ClassRegistry();
        registry.registerHook(Catalog.class, HookDefinition.beforeAll("load", inv -> null));
        registry.registerHook(Catalog.class, HookDefinition.beforeEach("clear", inv -> null));
        registry.registerTest(Catalog.class, TestDefinition.of("lists", inv -> null));
        return registry;
    }

    @Test
    void testRunEventTypeValues() {
        assertEquals(13, RunEventType.values().length);
        assertEquals("runnerInit", RunEventType.RUNNER_INIT.getValue());
        assertEquals("classEachHookResult", RunEventType.CLASS_EACH_HOOK_RESULT.getValue());
        assertEquals("classMethodResult", RunEventType.CLASS_METHOD_RESULT.getValue());
    }

    @Test
    void testClassEventOrder() {
        List<RunEvent> events = Collections.synchronizedList(new ArrayList<>());
        try (Runner runner = Runner.builder().registry(catalogRegistry()).listener(events::add).build()) {
            runner.runClass(Catalog.class);
        }
        List<RunEventType> types = new ArrayList<>();
        for (RunEvent event : events) {
            types.add(event.getType());
        }
        assertEquals(List.of(
                RunEventType.RUNNER_INIT,
                RunEventType.RUN_CLASS,
                RunEventType.CLASS_CONSTRUCTOR,
                RunEventType.CLASS_HOOK,
                RunEventType.CLASS_HOOK_RESULT,
                RunEventType.CLASS_METHOD,
                RunEventType.CLASS_EACH_HOOK,
                RunEventType.CLASS_EACH_HOOK_RESULT,
                RunEventType.CLASS_METHOD_RESULT,
                RunEventType.CLASS_RESULT
        ), types);
        HookRunEvent eachHook = (HookRunEvent) events.get(7);
        assertEquals("lists", eachHook.test().getName());
        assertEquals("clear", eachHook.hook().getName());
        assertEquals(Status.PASSED, eachHook.result().getStatus());
        ClassRunEvent classResult = (ClassRunEvent) events.get(9);
        assertEquals(Status.PASSED, classResult.result().getStatus());
    }

    @Test
    void testRunnerInitIsEmittedOnce() {
        List<RunEventType> types = Collections.synchronizedList(new ArrayList<>());
        try (Runner runner = Runner.builder().registry(catalogRegistry()).listener(e -> types.add(e.getType())).build()) {
            runner.runClass(Catalog.class);
            runner.runClassTest(Catalog.class, "lists");
            runner.run();
        }
        assertEquals(1, types.stream().filter(t -> t == RunEventType.RUNNER_INIT).count());
        assertEquals(RunEventType.RUNNER_INIT, types.get(0));
    }

    @Test
    void testUnsubscribeStopsDelivery() {
        List<RunEventType> types = Collections.synchronizedList(new ArrayList<>());
        RunListener listener = e -> types.add(e.getType());
        try (Runner runner = Runner.of(catalogRegistry())) {
            runner.subscribe(listener);
            runner.runClassTest(Catalog.class, "lists");
            int count = types.size();
            assertTrue(count > 0);
            assertTrue(runner.unsubscribe(listener));
            assertFalse(runner.unsubscribe(listener));
            runner.runClassTest(Catalog.class, "lists");
            assertEquals(count, types.size());
        }
    }

    @Test
    void testFailingListenerDoesNotAffectRun() {
        List<RunEventType> types = Collections.synchronizedList(new ArrayList<>());
        try (Runner runner = Runner.of(catalogRegistry())) {
            runner.subscribe(e -> {
                throw new IllegalStateException("listener bug");
            });
            runner.subscribe(e -> types.add(e.getType()));
            ClassResult result = runner.runClass(Catalog.class);
            assertEquals(Status.PASSED, result.getStatus());
        }
        assertTrue(types.contains(RunEventType.CLASS_RESULT));
    }

    @Test
    void testListenerErrorDoesNotAffectRun() {
        List<RunEventType> types = Collections.synchronizedList(new ArrayList<>());
        try (Runner runner = Runner.of(catalogRegistry())) {
            runner.subscribe(e -> {
                if (e.getType() == RunEventType.CLASS_METHOD_RESULT) {
                    throw new AssertionError("listener assertion");
                }
            });
            runner.subscribe(e -> types.add(e.getType()));
            ClassResult result = runner.runClass(Catalog.class);
            assertNotNull(result);
            assertEquals(Status.PASSED, result.getStatus());
            assertEquals(Status.PASSED, result.getTestResult("lists").getStatus());
        }
        assertTrue(types.contains(RunEventType.CLASS_METHOD_RESULT));
        assertTrue(types.contains(RunEventType.CLASS_RESULT));
    }

    @Test
    void testListenersArePerRunner() {
        List<RunEventType> first = Collections.synchronizedList(new ArrayList<>());
        try (Runner a = Runner.builder().registry(catalogRegistry()).listener(e -> first.add(e.getType())).build();
             Runner b = Runner.of(catalogRegistry())) {
            b.runClass(Catalog.class);
            assertTrue(first.isEmpty());
            a.runClass(Catalog.class);
            assertFalse(first.isEmpty());
        }
    }

    @Test
    void testEventToJson() {
        List<RunEvent> events = Collections.synchronizedList(new ArrayList<>());
        try (Runner runner = Runner.builder().registry(catalogRegistry()).timeout(1234).listener(events::add).build()) {
            runner.runClassTest(Catalog.class, "lists");
        }
        Map<String, Object> init = events.get(0).toJson();
        assertEquals(1234L, init.get("timeout"));
        TestRunEvent exit = (TestRunEvent) events.get(events.size() - 1);
        assertEquals(RunEventType.CLASS_METHOD_RESULT, exit.getType());
        Map<String, Object> json = exit.toJson();
        assertEquals("Catalog", json.get("class"));
        assertEquals("lists", json.get("name"));
        assertEquals("passed", json.get("result"));
    }

}
