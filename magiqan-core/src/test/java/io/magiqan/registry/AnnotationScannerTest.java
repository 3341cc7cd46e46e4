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
import io.magiqan.fixtures.CheckoutSuite;
import io.magiqan.fixtures.NoTests;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnnotationScannerTest {

    @Testable
    static class BadSignature {

        @TestMethod
        void takesString(String s) {
        }

    }

    @Testable
    static class Squares {

        @TestMethod
        @Data({"2", "4"})
        @Data({"3", "9"})
        void squares(Invocation inv) {
            for (List<Object> set : inv.getData()) {
                int n = Integer.parseInt((String) set.get(0));
                assertEquals(set.get(1), String.valueOf(n * n));
            }
        }

        @TestMethod
        @Data("one")
        void single() {
        }

    }

    @Test
    void testDataSetsKeepDeclarationOrder() throws Throwable {
        ClassDefinition definition = AnnotationScanner.scan(Squares.class);
        TestDefinition squares = definition.findTest("squares").get();
        assertEquals(List.of(List.of("2", "4"), List.of("3", "9")), squares.getData());
        assertEquals(List.of(List.of("one")), definition.findTest("single").get().getData());
        squares.getFn().invoke(new Invocation("squares", new Squares(), squares.getData()));
    }

    @Test
    void testScanOrdersTestsAndHooks() {
        ClassDefinition definition = AnnotationScanner.scan(CheckoutSuite.class);
        List<String> tests = definition.getTests().stream().map(TestDefinition::getName).toList();
        assertEquals(List.of("addsItem", "applies discount", "paysWithGiftCard"), tests);
        assertTrue(definition.findTest("paysWithGiftCard").get().isSkip());
        assertEquals("openCart", definition.getHooks(HookKind.BEFORE_ALL).get(0).getName());
        assertEquals("resetTotals", definition.getHooks(HookKind.BEFORE_EACH).get(0).getName());
        assertFalse(definition.isSkip());
    }

    @Test
    void testScannedFunctionsCallTheInstance() throws Throwable {
        ClassDefinition definition = AnnotationScanner.scan(CheckoutSuite.class);
        CheckoutSuite suite = new CheckoutSuite();
        Invocation inv = new Invocation("addsItem", suite, null);
        definition.findTest("addsItem").get().getFn().invoke(inv);
        definition.findTest("applies discount").get().getFn().invoke(new Invocation("x", suite, null));
        assertEquals(List.of("addsItem", "appliesDiscount"), suite.calls);
        assertEquals("adding book\n", inv.getLogContext().collect());
    }

    @Test
    void testScannedFunctionRethrowsTargetException() {
        ClassDefinition definition = AnnotationScanner.scan(CheckoutSuite.Legacy.class);
        assertTrue(definition.isSkip());
        HookDefinition hook = definition.getHooks(HookKind.BEFORE_ALL).get(0);
        Invocation inv = new Invocation("neverRuns", new CheckoutSuite.Legacy(), null);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> hook.getFn().invoke(inv));
        assertEquals("must not run", e.getMessage());
    }

    @Test
    void testRegisterOnlyTestableClasses() {
        ClassRegistry registry = new ClassRegistry();
        assertTrue(AnnotationScanner.register(registry, CheckoutSuite.class));
        assertFalse(AnnotationScanner.register(registry, CheckoutSuite.class));
        assertFalse(AnnotationScanner.register(registry, NoTests.class));
        assertFalse(AnnotationScanner.isTestable(CheckoutSuite.Helper.class));
        assertThrows(IllegalArgumentException.class, () -> AnnotationScanner.scan(NoTests.class));
    }

    @Test
    void testRejectsUnsupportedParameters() {
        assertThrows(IllegalArgumentException.class, () -> AnnotationScanner.scan(BadSignature.class));
    }

}
