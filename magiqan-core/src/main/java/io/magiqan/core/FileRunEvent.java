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

import io.magiqan.registry.FileDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * File-level events (RUN_FILE, FILE_PARSED, FILE_RESULT).
 */
public record FileRunEvent(
        RunEventType type,
        Runner runner,
        FileDefinition file,
        FileResult result  // null until FILE_RESULT
) implements RunEvent {

    public static FileRunEvent start(Runner runner, FileDefinition file) {
        return new FileRunEvent(RunEventType.RUN_FILE, runner, file, null);
    }

    public static FileRunEvent parsed(Runner runner, FileDefinition file) {
        return new FileRunEvent(RunEventType.FILE_PARSED, runner, file, null);
    }

    public static FileRunEvent exit(Runner runner, FileResult result) {
        return new FileRunEvent(RunEventType.FILE_RESULT, runner, result.getFile(), result);
    }

    @Override
    public RunEventType getType() {
        return type;
    }

    @Override
    public Runner getRunner() {
        return runner;
    }

    @Override
    public Map<String, Object> toJson() {
        if (type == RunEventType.FILE_RESULT && result != null) {
            return result.toJson();
        }
        return file == null ? new LinkedHashMap<>() : file.toJson();
    }
}
