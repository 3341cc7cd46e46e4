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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FileDefinition {

    private final String path;
    private final List<ClassDefinition> classes;

    public FileDefinition(String path) {
        this(path, Collections.emptyList());
    }

    public FileDefinition(String path, List<ClassDefinition> classes) {
        this.path = path;
        this.classes = Collections.unmodifiableList(new ArrayList<>(classes));
    }

    public FileDefinition withClasses(List<ClassDefinition> classes) {
        return new FileDefinition(path, classes);
    }

    public String getPath() {
        return path;
    }

    public List<ClassDefinition> getClasses() {
        return classes;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("path", path);
        List<String> names = new ArrayList<>();
        for (ClassDefinition cd : classes) {
            names.add(cd.getName());
        }
        map.put("classes", names);
        return map;
    }

    @Override
    public String toString() {
        return path;
    }

}
