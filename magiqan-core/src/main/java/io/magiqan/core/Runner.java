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

import io.magiqan.loader.ClassPathModuleLoader;
import io.magiqan.loader.ModuleLoader;
import io.magiqan.output.EventLogListener;
import io.magiqan.output.LogContext;
import io.magiqan.registry.AnnotationScanner;
import io.magiqan.registry.ClassDefinition;
import io.magiqan.registry.ClassRegistry;
import io.magiqan.registry.Registry;
import io.magiqan.registry.TestDefinition;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point: runs registered files, single classes or single tests, and is the
 * only emitter of {@link RunEvent}s.
 * <p>
 * Example usage:
 * <pre>
 * try (Runner runner = Runner.builder().timeout(2000).listener(myReporter).build()) {
 *     runner.addGlob("src/test/java/**&#47;*Suite.java");
 *     SuiteResult result = runner.run();
 * }
 * </pre>
 * Every hook and test is raced against the runner's timeout. The value is read when each
 * invocation starts, so {@link #setDefaultTimeout(long)} during a run only affects the
 * invocations that start afterwards.
 */
public class Runner implements AutoCloseable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final RunnerConfig config;
    private final Registry registry;
    private final ModuleLoader loader;
    private final EventBus events = new EventBus();
    private final List<String> paths = new CopyOnWriteArrayList<>();
    private final AtomicBoolean initialized = new AtomicBoolean();
    private final AtomicInteger orphans = new AtomicInteger();
    private final Object instanceLock = new Object();
    private volatile long timeout;
    private ExecutorService executor;

    private Runner(Builder builder) {
        this.config = builder.config;
        this.registry = builder.registry != null ? builder.registry : new ClassRegistry();
        this.loader = builder.loader != null ? builder.loader : new ClassPathModuleLoader(registry, config.getWorkingDir());
        this.timeout = config.getTimeout();
        if (EventLogListener.isEnabled()) {
            events.subscribe(new EventLogListener());
        }
        for (RunListener listener : builder.listeners) {
            events.subscribe(listener);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Runner of(Registry registry) {
        return builder().registry(registry).build();
    }

    // ========== Paths ==========

    public Runner addFile(String path) {
        paths.add(loader.resolve(path));
        return this;
    }

    public Runner addFiles(Collection<String> values) {
        for (String path : values) {
            addFile(path);
        }
        return this;
    }

    /**
     * Adds every file matching the pattern, resolved against the working directory.
     *
     * @return the number of files added
     */
    public int addGlob(String pattern) {
        List<String> found = loader.discoverFiles(pattern);
        if (found.isEmpty()) {
            logger.warn("no files match: {}", pattern);
        }
        paths.addAll(found);
        return found.size();
    }

    public List<String> getPaths() {
        return List.copyOf(paths);
    }

    // ========== Timeout ==========

    public void setDefaultTimeout(long timeout) {
        if (timeout <= 0) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
    }

    /**
     * Restores the configured timeout.
     */
    public void resetTimeout() {
        this.timeout = config.getTimeout();
    }

    public long getTimeout() {
        return timeout;
    }

    // ========== Events ==========

    public Runner subscribe(RunListener listener) {
        events.subscribe(listener);
        return this;
    }

    public boolean unsubscribe(RunListener listener) {
        return events.unsubscribe(listener);
    }

    // ========== Execution ==========

    /**
     * Runs every registered path concurrently. Entries keep registration order.
     */
    public SuiteResult run() {
        init();
        SuiteResult result = new SuiteResult();
        result.setStartTime(System.currentTimeMillis());
        List<String> snapshot = getPaths();
        if (!snapshot.isEmpty()) {
            logger.info("running {} file(s), timeout: {} ms", snapshot.size(), timeout);
            List<Callable<FileResult>> tasks = new ArrayList<>();
            for (String path : snapshot) {
                tasks.add(new FileRuntime(this, path));
            }
            List<FileResult> fileResults = runAll(tasks);
            for (int i = 0; i < snapshot.size(); i++) {
                result.add(snapshot.get(i), fileResults.get(i));
            }
        }
        result.setEndTime(System.currentTimeMillis());
        return result;
    }

    /**
     * @return empty if the file exports no registered test class
     */
    public Optional<FileResult> runFile(String path) {
        init();
        return Optional.ofNullable(new FileRuntime(this, loader.resolve(path)).call());
    }

    /**
     * Runs one class end to end. A class without a definition is scanned for annotations,
     * or registered as an empty one when it is not {@link io.magiqan.registry.Testable}.
     */
    public ClassResult runClass(Class<?> type) {
        init();
        ClassDefinition definition = lookup(type);
        if (definition == null) {
            logger.warn("{} is not registered or annotated, running it without tests", type.getName());
            definition = registry.registerClass(type);
        }
        return new ClassRuntime(this, definition).call();
    }

    /**
     * Runs a single declared test with its each-hooks, but without the class hooks.
     *
     * @throws TestNotDeclaredException if the class does not declare the test
     */
    public TestResult runClassTest(Class<?> type, String name) {
        init();
        ClassDefinition definition = lookup(type);
        TestDefinition test = definition == null ? null : definition.findTest(name).orElse(null);
        if (test == null) {
            throw new TestNotDeclaredException(type, name);
        }
        Object instance = definition.isSkip() ? null : acquireInstance(definition);
        return new TestRuntime(this, definition, test, instance).call();
    }

    // ========== Internals ==========

    private ClassDefinition lookup(Class<?> type) {
        ClassDefinition definition = registry.getClassDefinition(type);
        if (definition == null && AnnotationScanner.register(registry, type)) {
            logger.debug("registered {} from its annotations", type.getName());
            definition = registry.getClassDefinition(type);
        }
        return definition;
    }

    void init() {
        if (initialized.compareAndSet(false, true)) {
            emit(RunnerRunEvent.init(this));
        }
    }

    void emit(RunEvent event) {
        events.emit(event);
    }

    Object acquireInstance(ClassDefinition definition) {
        Class<?> type = definition.getType();
        synchronized (instanceLock) {
            Object instance = registry.getInstance(type);
            if (instance == null) {
                instance = definition.newInstance();
                registry.setInstance(type, instance);
                emit(ClassRunEvent.constructed(this, definition, instance));
            }
            return instance;
        }
    }

    TimeoutGuard newGuard() {
        return new TimeoutGuard(executor(), timeout, orphans, config.getMaxOrphans());
    }

    /**
     * Runs the tasks concurrently and returns their results in task order.
     * A single task runs on the calling thread.
     */
    <T> List<T> runAll(List<? extends Callable<T>> tasks) {
        if (tasks.isEmpty()) {
            return new ArrayList<>();
        }
        if (tasks.size() == 1) {
            List<T> single = new ArrayList<>(1);
            single.add(callUnchecked(tasks.get(0)));
            return single;
        }
        ExecutorService pool = executor();
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(pool.submit(task));
        }
        List<T> results = new ArrayList<>(futures.size());
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                } else if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new IllegalStateException("execution failed", cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("interrupted while waiting for results", e);
            }
        }
        return results;
    }

    private static <T> T callUnchecked(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("execution failed", e);
        }
    }

    private synchronized ExecutorService executor() {
        if (executor == null) {
            int pool = POOL_COUNTER.incrementAndGet();
            AtomicInteger threads = new AtomicInteger();
            ThreadFactory factory = r -> {
                Thread t = new Thread(r, "magiqan-" + pool + "-worker-" + threads.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
            executor = Executors.newCachedThreadPool(factory);
        }
        return executor;
    }

    /**
     * Stops the worker threads. Orphaned invocations are interrupted.
     */
    @Override
    public synchronized void close() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    // ========== Accessors ==========

    public RunnerConfig getConfig() {
        return config;
    }

    public Registry getRegistry() {
        return registry;
    }

    public ModuleLoader getLoader() {
        return loader;
    }

    public List<RunListener> getListeners() {
        return events.getListeners();
    }

    /**
     * Invocations that timed out and have not finished yet.
     */
    public int getOrphanCount() {
        return orphans.get();
    }

    // ========== Builder ==========

    public static class Builder {

        private RunnerConfig config = RunnerConfig.defaults();
        private Registry registry;
        private ModuleLoader loader;
        private final List<RunListener> listeners = new ArrayList<>();

        Builder() {
        }

        public Builder config(RunnerConfig config) {
            if (config != null) {
                this.config = config;
            }
            return this;
        }

        public Builder timeout(long timeout) {
            this.config = config.toBuilder().timeout(timeout).build();
            return this;
        }

        public Builder registry(Registry registry) {
            this.registry = registry;
            return this;
        }

        public Builder loader(ModuleLoader loader) {
            this.loader = loader;
            return this;
        }

        public Builder listener(RunListener listener) {
            listeners.add(listener);
            return this;
        }

        public Builder listeners(Collection<RunListener> values) {
            if (values != null) {
                listeners.addAll(values);
            }
            return this;
        }

        public Runner build() {
            return new Runner(this);
        }

    }

}
