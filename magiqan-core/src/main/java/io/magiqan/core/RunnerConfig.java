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
import org.slf4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Runner settings. {@link #load()} reads the optional {@code magiqan.properties} classpath
 * resource and then system properties, later sources winning:
 * <pre>
 * magiqan.timeout=5000
 * magiqan.maxOrphans=64
 * magiqan.workingDir=.
 * </pre>
 */
public class RunnerConfig {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final long DEFAULT_TIMEOUT = 5000;
    public static final int DEFAULT_MAX_ORPHANS = 64;
    public static final String CONFIG_RESOURCE = "magiqan.properties";

    static final String TIMEOUT = "magiqan.timeout";
    static final String MAX_ORPHANS = "magiqan.maxOrphans";
    static final String WORKING_DIR = "magiqan.workingDir";

    private final long timeout;
    private final int maxOrphans;
    private final Path workingDir;

    private RunnerConfig(Builder builder) {
        this.timeout = builder.timeout;
        this.maxOrphans = builder.maxOrphans;
        this.workingDir = builder.workingDir;
    }

    public static RunnerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().timeout(timeout).maxOrphans(maxOrphans).workingDir(workingDir);
    }

    public static RunnerConfig load() {
        Properties props = new Properties();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = RunnerConfig.class.getClassLoader();
        }
        try (InputStream is = cl.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                props.load(is);
                logger.debug("loaded {}", CONFIG_RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("failed to read {}: {}", CONFIG_RESOURCE, e.getMessage());
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith("magiqan.")) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    public static RunnerConfig fromProperties(Properties props) {
        Builder builder = builder();
        String timeout = props.getProperty(TIMEOUT);
        if (timeout != null) {
            builder.timeout(parseLong(TIMEOUT, timeout));
        }
        String maxOrphans = props.getProperty(MAX_ORPHANS);
        if (maxOrphans != null) {
            builder.maxOrphans(parseInt(MAX_ORPHANS, maxOrphans));
        }
        String workingDir = props.getProperty(WORKING_DIR);
        if (workingDir != null && !workingDir.isBlank()) {
            builder.workingDir(Path.of(workingDir.trim()));
        }
        return builder.build();
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + name + ": " + value, e);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + name + " (not an int): " + value, e);
        }
    }

    public long getTimeout() {
        return timeout;
    }

    public int getMaxOrphans() {
        return maxOrphans;
    }

    public Path getWorkingDir() {
        return workingDir;
    }

    @Override
    public String toString() {
        return "timeout=" + timeout + ", maxOrphans=" + maxOrphans + ", workingDir=" + workingDir;
    }

    // ========== Builder ==========

    public static class Builder {

        private long timeout = DEFAULT_TIMEOUT;
        private int maxOrphans = DEFAULT_MAX_ORPHANS;
        private Path workingDir = Path.of("").toAbsolutePath();

        Builder() {
        }

        public Builder timeout(long timeout) {
            if (timeout <= 0) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder maxOrphans(int maxOrphans) {
            if (maxOrphans < 0) {
                throw new IllegalArgumentException("maxOrphans must not be negative: " + maxOrphans);
            }
            this.maxOrphans = maxOrphans;
            return this;
        }

        public Builder workingDir(Path workingDir) {
            if (workingDir != null) {
                this.workingDir = workingDir.toAbsolutePath().normalize();
            }
            return this;
        }

        public RunnerConfig build() {
            return new RunnerConfig(this);
        }

    }

}
