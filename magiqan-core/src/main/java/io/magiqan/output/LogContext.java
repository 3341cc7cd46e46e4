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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log collector for a single hook or test invocation.
 * Messages written while the invocation runs end up on its TestResult, and are
 * also cascaded to the {@code magiqan.test} logger.
 */
public class LogContext {

    private static final ThreadLocal<LogContext> CURRENT = new ThreadLocal<>();

    // ========== Category Loggers ==========

    /** Logger for the engine (Runner, runtimes, timeout guard, loader, config) */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("magiqan.runtime");

    /** Logger for output written by tests and hooks */
    public static final Logger TEST_LOGGER = LoggerFactory.getLogger("magiqan.test");

    /** Logger for console output (run summary) */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("magiqan.console");

    /** Logger for the run event trace */
    public static final Logger EVENTS_LOGGER = LoggerFactory.getLogger("magiqan.events");

    private static volatile LogLevel threshold = LogLevel.INFO;

    private final StringBuilder buffer = new StringBuilder();

    // ========== Thread-Local Access ==========

    public static LogContext get() {
        LogContext ctx = CURRENT.get();
        if (ctx == null) {
            ctx = new LogContext();
            CURRENT.set(ctx);
        }
        return ctx;
    }

    public static void set(LogContext ctx) {
        CURRENT.set(ctx);
    }

    public static void clear() {
        CURRENT.remove();
    }

    public static void setLogLevel(LogLevel level) {
        threshold = level;
    }

    public static LogLevel getLogLevel() {
        return threshold;
    }

    /**
     * Sets the level of the "magiqan" logger when Logback is the SLF4J binding.
     * Reflection keeps Logback off the compile classpath.
     *
     * @return false if the binding is not Logback or the level could not be set
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                RUNTIME_LOGGER.debug("runtime log level not supported: not using logback");
                return false;
            }
            Object logger = factory.getClass()
                    .getMethod("getLogger", String.class)
                    .invoke(factory, "magiqan");
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase());
            logger.getClass()
                    .getMethod("setLevel", levelClass)
                    .invoke(logger, levelValue);
            RUNTIME_LOGGER.debug("runtime log level set to: {}", level);
            return true;
        } catch (Exception e) {
            RUNTIME_LOGGER.debug("failed to set runtime log level: {}", e.getMessage());
            return false;
        }
    }

    // ========== Logging ==========

    public void log(LogLevel level, String format, Object... args) {
        String message = format(format, args);
        switch (level) {
            case TRACE:
                TEST_LOGGER.trace(message);
                break;
            case DEBUG:
                TEST_LOGGER.debug(message);
                break;
            case WARN:
                TEST_LOGGER.warn(message);
                break;
            case ERROR:
                TEST_LOGGER.error(message);
                break;
            default:
                TEST_LOGGER.info(message);
        }
        if (!level.isEnabled(threshold)) {
            return;
        }
        synchronized (buffer) {
            buffer.append(message).append('\n');
        }
    }

    public void log(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    /**
     * Returns the accumulated log and clears the buffer.
     */
    public String collect() {
        synchronized (buffer) {
            String result = buffer.toString();
            buffer.setLength(0);
            return result;
        }
    }

    public String peek() {
        synchronized (buffer) {
            return buffer.toString();
        }
    }

    /**
     * Replaces {} placeholders in order, leaving extra placeholders untouched.
     */
    static String format(String format, Object... args) {
        if (format == null) {
            return "null";
        }
        if (args == null || args.length == 0) {
            return format;
        }
        StringBuilder sb = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < format.length()) {
            if (i < format.length() - 1 && format.charAt(i) == '{' && format.charAt(i + 1) == '}') {
                if (argIndex < args.length) {
                    sb.append(args[argIndex++]);
                } else {
                    sb.append("{}");
                }
                i += 2;
            } else {
                sb.append(format.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

}
