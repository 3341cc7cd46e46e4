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
package io.magiqan.output;

import io.magiqan.core.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleTest {

    private final boolean colors = Console.isColorsEnabled();

    @AfterEach
    void afterEach() {
        Console.setColorsEnabled(colors);
        Console.setOutput(System.out);
    }

    @Test
    void testColors() {
        Console.setColorsEnabled(true);
        assertEquals(Console.BRIGHT_GREEN + "passed" + Console.RESET, Console.status(Status.PASSED));
        assertEquals("passed", Console.stripAnsi(Console.status(Status.PASSED)));
        Console.setColorsEnabled(false);
        assertEquals("broken", Console.status(Status.BROKEN));
        assertEquals("text", Console.bold("text"));
    }

    @Test
    void testPrintln() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        Console.setColorsEnabled(false);
        Console.println(Console.label("summary"));
        assertEquals("summary" + System.lineSeparator(), buffer.toString(StandardCharsets.UTF_8));
    }

}
