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

import io.magiqan.output.LogContext;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Glob expansion under a base directory. Patterns use {@link java.nio.file.FileSystem#getPathMatcher}
 * glob syntax against '/'-separated paths relative to the base, so {@code **&#47;*.java}
 * only matches files at least one directory deep.
 */
public class FileFinder {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Path baseDir;

    public FileFinder(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public static boolean isGlob(String pattern) {
        for (char c : pattern.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == '{') {
                return true;
            }
        }
        return false;
    }

    /**
     * A pattern without wildcards names a single file, returned only if it exists.
     */
    public List<Path> find(String pattern) {
        if (!isGlob(pattern)) {
            Path path = baseDir.resolve(pattern).normalize();
            return Files.isRegularFile(path) ? List.of(path) : Collections.emptyList();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern.replace('\\', '/'));
        List<Path> found;
        try (Stream<Path> stream = Files.walk(baseDir)) {
            found = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(Path.of(toUnixPath(baseDir.relativize(p)))))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to scan " + baseDir, e);
        }
        logger.debug("glob {} matched {} file(s) under {}", pattern, found.size(), baseDir);
        return new ArrayList<>(found);
    }

    static String toUnixPath(Path path) {
        return path.toString().replace('\\', '/');
    }

}
