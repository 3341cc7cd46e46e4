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
package io.magiqan.fixtures;

import io.magiqan.core.Invocation;
import io.magiqan.registry.Hook;
import io.magiqan.registry.HookKind;
import io.magiqan.registry.TestMethod;
import io.magiqan.registry.Testable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Testable
public class CheckoutSuite {

    public final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    @Hook(HookKind.BEFORE_ALL)
    void openCart() {
        calls.add("openCart");
    }

    @Hook(HookKind.BEFORE_EACH)
    void resetTotals() {
        calls.add("resetTotals");
    }

    @TestMethod(order = 1)
    void addsItem(Invocation inv) {
        inv.log("adding {}", "book");
        calls.add("addsItem");
    }

    @TestMethod(value = "applies discount", order = 2)
    void appliesDiscount() {
        calls.add("appliesDiscount");
    }

    @TestMethod(order = 3, skip = true)
    void paysWithGiftCard() {
        calls.add("paysWithGiftCard");
    }

    @Testable
    public static class Refunds {

        @TestMethod
        void refundsOrder() {
        }

    }

    @Testable(skip = true)
    public static class Legacy {

        @Hook(HookKind.BEFORE_ALL)
        void neverRuns() {
            throw new IllegalStateException("must not run");
        }

        @TestMethod
        void oldFlow() {
        }

    }

    public static class Helper {
    }

}
