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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClassRegistryTest {

    static class Account {
    }

    private final ClassRegistry registry = new ClassRegistry();

    @Test
    void testLookupOfUnknownClass() {
        assertNull(registry.getClassDefinition(Account.class));
        assertNull(registry.getInstance(Account.class));
        assertFalse(registry.isRegistered(Account.class));
    }

    @Test
    void testBuilderApiKeepsOrder() {
        registry.registerTest(Account.class, TestDefinition.of("opens", inv -> null));
        registry.registerHook(Account.class, HookDefinition.beforeEach("login", inv -> null));
        registry.registerTest(Account.class, TestDefinition.of("closes", inv -> null));
        registry.registerHook(Account.class, HookDefinition.afterAll("logout", inv -> null));
        ClassDefinition definition = registry.getClassDefinition(Account.class);
        assertEquals("Account", definition.getName());
        assertEquals(List.of("opens", "closes"), definition.getTests().stream().map(TestDefinition::getName).toList());
        assertEquals(1, definition.getHooks(HookKind.BEFORE_EACH).size());
        assertEquals(1, definition.getHooks(HookKind.AFTER_ALL).size());
        assertTrue(definition.getHooks(HookKind.BEFORE_ALL).isEmpty());
        assertEquals(1, registry.size());
    }

    @Test
    void testRegisterClassIsIdempotent() {
        ClassDefinition first = registry.registerClass(Account.class);
        assertSame(first, registry.registerClass(Account.class));
    }

    @Test
    void testDuplicateTestName() {
        registry.registerTest(Account.class, TestDefinition.of("opens", inv -> null));
        assertThrows(IllegalArgumentException.class,
                () -> registry.registerTest(Account.class, TestDefinition.of("opens", inv -> null)));
    }

    @Test
    void testEachHooksOfTest() {
        HookDefinition own = HookDefinition.beforeEach("own", inv -> null);
        registry.registerHook(Account.class, HookDefinition.beforeEach("shared", inv -> null));
        TestDefinition test = TestDefinition.builder("t", inv -> null).hook(own).build();
        registry.registerTest(Account.class, test);
        ClassDefinition definition = registry.getClassDefinition(Account.class);
        List<HookDefinition> hooks = definition.getEachHooks(test, HookKind.BEFORE_EACH);
        assertEquals(List.of("shared", "own"), hooks.stream().map(HookDefinition::getName).toList());
        assertTrue(definition.getEachHooks(test, HookKind.AFTER_EACH).isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> TestDefinition.builder("x", inv -> null).hook(HookDefinition.beforeAll("all", inv -> null)));
    }

    @Test
    void testInstanceCache() {
        Account account = new Account();
        registry.setInstance(Account.class, account);
        assertSame(account, registry.getInstance(Account.class));
        registry.clearInstances();
        assertNull(registry.getInstance(Account.class));
    }

    @Test
    void testNewInstanceUsesFactoryOrConstructor() {
        Account account = new Account();
        assertSame(account, ClassDefinition.of(Account.class).factory(() -> account).build().newInstance());
        assertTrue(ClassDefinition.of(Account.class).build().newInstance() instanceof Account);
        assertThrows(IllegalStateException.class, () -> ClassDefinition.of(Runnable.class).build().newInstance());
    }

    @Test
    void testDefinitionToJson() {
        registry.registerTest(Account.class, TestDefinition.builder("opens", inv -> null).data(1, "a").skip().build());
        Map<String, Object> json = registry.getClassDefinition(Account.class).toJson();
        assertEquals("Account", json.get("name"));
        List<?> tests = (List<?>) json.get("tests");
        Map<?, ?> test = (Map<?, ?>) tests.get(0);
        assertEquals("opens", test.get("name"));
        assertEquals(true, test.get("skip"));
    }

}
