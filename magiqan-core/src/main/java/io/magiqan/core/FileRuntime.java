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

import io.magiqan.output.LogContext;
import io.magiqan.registry.ClassDefinition;
import io.magiqan.registry.FileDefinition;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs every test class exported by one file. Returns null when the file exports
 * no registered class.
 */
public class FileRuntime implements Callable<FileResult> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Runner runner;
    private final String path;

    FileRuntime(Runner runner, String path) {
        this.runner = runner;
        this.path = path;
    }

    @Override
    public FileResult call() {
        Map<String, Object> exports = runner.getLoader().loadModule(path);
        FileDefinition file = new FileDefinition(path);
        runner.emit(FileRunEvent.start(runner, file));
        List<ClassDefinition> found = new ArrayList<>();
        for (Object value : exports.values()) {
            if (value instanceof Class) {
                ClassDefinition definition = runner.getRegistry().getClassDefinition((Class<?>) value);
                if (definition != null) {
                    found.add(definition);
                }
            }
        }
        if (found.isEmpty()) {
            logger.info("no test classes found in: {}", path);
            return null;
        }
        file = file.withClasses(found);
        runner.emit(FileRunEvent.parsed(runner, file));
        FileResult result = new FileResult(file);
        result.setStartTime(System.currentTimeMillis());
        List<Callable<ClassResult>> tasks = new ArrayList<>();
        for (ClassDefinition definition : found) {
            if (definition.isSkip()) {
                tasks.add(() -> ClassResult.skipped(definition));
            } else {
                tasks.add(new ClassRuntime(runner, definition));
            }
        }
        result.addClassResults(runner.runAll(tasks));
        result.setStopTime(System.currentTimeMillis());
        logger.debug("file {}: {}", path, result.getStatus().getValue());
        runner.emit(FileRunEvent.exit(runner, result));
        return result;
    }

    public String getPath() {
        return path;
    }

}
