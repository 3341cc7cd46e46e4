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

import io.magiqan.core.TestFunction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class HookDefinition {

    private final String name;
    private final HookKind kind;
    private final TestFunction fn;
    private final boolean skip;
    private final Map<String, Object> metadata;

    public HookDefinition(String name, HookKind kind, TestFunction fn, boolean skip, Map<String, Object> metadata) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.fn = Objects.requireNonNull(fn, "fn");
        this.skip = skip;
        this.metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static HookDefinition of(String name, HookKind kind, TestFunction fn) {
        return new HookDefinition(name, kind, fn, false, null);
    }

    public static HookDefinition beforeAll(String name, TestFunction fn) {
        return of(name, HookKind.BEFORE_ALL, fn);
    }

    public static HookDefinition afterAll(String name, TestFunction fn) {
        return of(name, HookKind.AFTER_ALL, fn);
    }

    public static HookDefinition beforeEach(String name, TestFunction fn) {
        return of(name, HookKind.BEFORE_EACH, fn);
    }

    public static HookDefinition afterEach(String name, TestFunction fn) {
        return of(name, HookKind.AFTER_EACH, fn);
    }

    /**
     * Returns a copy of this hook marked as skipped.
     */
    public HookDefinition skipped() {
        return new HookDefinition(name, kind, fn, true, metadata);
    }

    public HookDefinition withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new HookDefinition(name, kind, fn, skip, merged);
    }

    public String getName() {
        return name;
    }

    public HookKind getKind() {
        return kind;
    }

    public TestFunction getFn() {
        return fn;
    }

    public boolean isSkip() {
        return skip;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("kind", kind.getValue());
        map.put("skip", skip);
        if (!metadata.isEmpty()) {
            map.put("metadata", metadata);
        }
        return map;
    }

    @Override
    public String toString() {
        return kind.getValue() + ":" + name;
    }

}
