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
package io.magiqan.loader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileFinderTest {

    @TempDir
    Path dir;

    private void touch(String path) throws IOException {
        Path file = dir.resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "");
    }

    @Test
    void testGlobMatchesSorted() throws IOException {
        touch("b/OrderSuite.java");
        touch("a/CartSuite.java");
        touch("a/deep/StockSuite.java");
        touch("a/Helper.java");
        touch("Root.java");
        List<Path> found = new FileFinder(dir).find("**/*Suite.java");
        assertEquals(List.of(
                dir.resolve("a/CartSuite.java"),
                dir.resolve("a/deep/StockSuite.java"),
                dir.resolve("b/OrderSuite.java")
        ), found);
    }

    @Test
    void testGlobWithoutDirectory() throws IOException {
        touch("Root.java");
        touch("a/Nested.java");
        assertEquals(List.of(dir.resolve("Root.java")), new FileFinder(dir).find("*.java"));
    }

    @Test
    void testPlainPath() throws IOException {
        touch("a/CartSuite.java");
        FileFinder finder = new FileFinder(dir);
        assertEquals(List.of(dir.resolve("a/CartSuite.java")), finder.find("a/CartSuite.java"));
        assertTrue(finder.find("a/Missing.java").isEmpty());
        assertTrue(finder.find("**/*.kt").isEmpty());
    }

    @Test
    void testIsGlob() {
        assertTrue(FileFinder.isGlob("**/*.java"));
        assertTrue(FileFinder.isGlob("a/{b,c}.java"));
        assertFalse(FileFinder.isGlob("a/b.java"));
    }

}
