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

import java.util.List;
import java.util.Map;

/**
 * Turns a file path into the values it exports. A Runner keeps the exported classes
 * that have a registered definition and ignores everything else.
 */
public interface ModuleLoader {

    /**
     * @return export name to value, in a stable order
     * @throws ModuleLoadException if the file cannot be loaded
     */
    Map<String, Object> loadModule(String path);

    /**
     * Expands a glob pattern to matching file paths, sorted.
     */
    List<String> discoverFiles(String pattern);

    /**
     * Canonical form of a path, used as the key of a file in results.
     */
    default String resolve(String path) {
        return path;
    }

}
