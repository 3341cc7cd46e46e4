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

import io.magiqan.output.Console;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @BeforeEach
    void beforeEach() {
        Console.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void afterEach() {
        Console.setOutput(System.out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testPassingClassExitsZero() {
        int code = Main.execute("--no-color", "io.magiqan.fixtures.CheckoutSuite$Refunds");
        assertEquals(0, code);
        String out = output();
        assertTrue(out.contains("io.magiqan.fixtures.CheckoutSuite$Refunds passed"), out);
        assertTrue(out.contains("result: passed"), out);
    }

    @Test
    void testBrokenClassExitsOne() {
        int code = Main.execute("--no-color", "io.magiqan.fixtures.BrokenHookSuite");
        assertEquals(1, code);
        String out = output();
        assertTrue(out.contains("BrokenHookSuite broken"), out);
        assertTrue(out.contains("works broken"), out);
    }

    @Test
    void testSourcePathIsResolved() {
        int code = Main.execute("--no-color", "src/test/java/io/magiqan/fixtures/CheckoutSuite.java");
        assertEquals(1, code);
        String out = output();
        assertTrue(out.contains("CheckoutSuite passed"), out);
        assertTrue(out.contains("Legacy skipped"), out);
    }

    @Test
    void testFileWithoutTestClasses() {
        int code = Main.execute("--no-color", "io.magiqan.fixtures.NoTests");
        assertEquals(0, code);
        assertTrue(output().contains("no test classes"));
    }

    @Test
    void testUnknownClassExitsOne() {
        int code = Main.execute("--no-color", "io.magiqan.fixtures.DoesNotExist");
        assertEquals(1, code);
        assertTrue(output().contains("failed to load class io.magiqan.fixtures.DoesNotExist"));
    }

    @Test
    void testUsageErrors() {
        assertEquals(2, Main.execute("--no-such-option"));
        assertEquals(2, Main.execute("--no-color", "-t", "0", "io.magiqan.fixtures.NoTests"));
        assertEquals(2, Main.execute("-t", "soon"));
    }

    @Test
    void testUnknownLogLevel() {
        assertEquals(2, Main.execute("--no-color", "--log-level", "loud", "io.magiqan.fixtures.NoTests"));
        assertTrue(output().contains("unknown log level: loud"), output());
    }

    @Test
    void testNoPaths() {
        assertEquals(0, Main.execute("--no-color"));
        assertTrue(output().contains("No test paths specified."));
    }

}
