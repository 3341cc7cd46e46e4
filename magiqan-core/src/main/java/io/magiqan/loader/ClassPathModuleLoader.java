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
import io.magiqan.registry.AnnotationScanner;
import io.magiqan.registry.Registry;
import org.slf4j.Logger;

import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads test classes from the classpath. A file is either a source or class file under
 * one of the usual Maven roots, or a binary class name:
 * <pre>
 * src/test/java/com/acme/LoginSuite.java      -&gt; com.acme.LoginSuite
 * target/test-classes/com/acme/LoginSuite.class -&gt; com.acme.LoginSuite
 * com.acme.LoginSuite                          -&gt; com.acme.LoginSuite
 * </pre>
 * The exports are the class itself followed by its public nested classes sorted by name.
 * Loading also registers exported {@code @Testable} classes.
 */
public class ClassPathModuleLoader implements ModuleLoader {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final String[] ROOTS = {
            "src/main/java/", "src/test/java/", "target/classes/", "target/test-classes/"
    };

    private final Registry registry;
    private final FileFinder finder;
    private final ClassLoader classLoader;

    public ClassPathModuleLoader(Registry registry, Path workingDir) {
        this(registry, workingDir, null);
    }

    public ClassPathModuleLoader(Registry registry, Path workingDir, ClassLoader classLoader) {
        this.registry = registry;
        this.finder = new FileFinder(workingDir);
        this.classLoader = classLoader;
    }

    @Override
    public String resolve(String path) {
        if (isClassName(path)) {
            return path;
        }
        return finder.getBaseDir().resolve(path).normalize().toString();
    }

    @Override
    public List<String> discoverFiles(String pattern) {
        List<String> paths = new ArrayList<>();
        for (Path path : finder.find(pattern)) {
            paths.add(path.toString());
        }
        return paths;
    }

    @Override
    public Map<String, Object> loadModule(String path) {
        String className = toClassName(path);
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ModuleLoadException(path, "failed to load class " + className, e);
        }
        Map<String, Object> exports = new LinkedHashMap<>();
        exports.put(type.getSimpleName(), type);
        List<Class<?>> nested = new ArrayList<>(Arrays.asList(type.getDeclaredClasses()));
        nested.removeIf(c -> !Modifier.isPublic(c.getModifiers()));
        nested.sort(Comparator.comparing(Class::getSimpleName));
        for (Class<?> c : nested) {
            exports.put(c.getSimpleName(), c);
        }
        for (Object value : exports.values()) {
            AnnotationScanner.register(registry, (Class<?>) value);
        }
        logger.debug("loaded {} with {} export(s)", className, exports.size());
        return exports;
    }

    private ClassLoader classLoader() {
        if (classLoader != null) {
            return classLoader;
        }
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return cl != null ? cl : ClassPathModuleLoader.class.getClassLoader();
    }

    static boolean isClassName(String path) {
        return path.indexOf('/') == -1 && path.indexOf('\\') == -1
                && !path.endsWith(".java") && !path.endsWith(".class");
    }

    static String toClassName(String path) {
        if (isClassName(path)) {
            return path;
        }
        String unix = path.replace('\\', '/');
        if (unix.endsWith(".java")) {
            unix = unix.substring(0, unix.length() - ".java".length());
        } else if (unix.endsWith(".class")) {
            unix = unix.substring(0, unix.length() - ".class".length());
        } else {
            throw new ModuleLoadException(path, "not a java source or class file");
        }
        int best = -1;
        String root = null;
        for (String candidate : ROOTS) {
            int pos = unix.lastIndexOf(candidate);
            if (pos > best) {
                best = pos;
                root = candidate;
            }
        }
        if (root != null) {
            unix = unix.substring(best + root.length());
        } else if (unix.startsWith("/")) {
            throw new ModuleLoadException(path, "path is not under a known source or class root");
        }
        return unix.replace('/', '.');
    }

}
