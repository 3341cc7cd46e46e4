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

import io.magiqan.common.StringUtils;
import io.magiqan.loader.FileFinder;
import io.magiqan.output.Console;
import io.magiqan.output.LogContext;
import io.magiqan.output.LogLevel;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.ToIntFunction;

/**
 * Command-line interface for running test classes.
 * <p>
 * Usage examples:
 * <pre>
 * # Run every suite under src/test/java
 * java -jar magiqan.jar 'src/test/java/**&#47;*Suite.java'
 *
 * # Run one class by name with a 2 second timeout
 * java -jar magiqan.jar -t 2000 com.acme.LoginSuite
 * </pre>
 */
@Command(
        name = "magiqan",
        mixinStandardHelpOptions = true,
        version = "Magiqan 1.0",
        description = "Run test classes and report a verdict per file"
)
public class Main implements Callable<Integer> {

    @Parameters(
            description = "Source files, class files, class names or glob patterns",
            arity = "0..*"
    )
    List<String> paths;

    @Option(
            names = {"-t", "--timeout"},
            description = "Timeout in milliseconds for each hook and test (default: magiqan.timeout or 5000)"
    )
    Long timeout;

    @Option(
            names = {"--no-color"},
            description = "Disable colored output"
    )
    boolean noColor;

    @Option(
            names = {"--log-level"},
            description = "Level of the magiqan loggers: trace, debug, info, warn, error"
    )
    String logLevel;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Parses the arguments and runs. Returns 0 when nothing failed or broke, 1 otherwise
     * and 2 on invalid usage.
     */
    public static int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Override
    public Integer call() {
        if (noColor) {
            Console.setColorsEnabled(false);
        }
        if (logLevel != null) {
            LogLevel level;
            try {
                level = LogLevel.of(logLevel);
            } catch (IllegalArgumentException e) {
                Console.println(Console.status(Status.FAILED) + " " + e.getMessage());
                return 2;
            }
            LogContext.setRuntimeLogLevel(level.name());
        }
        if (paths == null || paths.isEmpty()) {
            Console.println(Console.label("No test paths specified."));
            Console.println("Usage: magiqan [options] <paths...>");
            return 0;
        }
        RunnerConfig config = RunnerConfig.load();
        if (timeout != null) {
            if (timeout <= 0) {
                Console.println(Console.status(Status.FAILED) + " timeout must be positive: " + timeout);
                return 2;
            }
            config = config.toBuilder().timeout(timeout).build();
        }
        try (Runner runner = Runner.builder().config(config).build()) {
            for (String path : paths) {
                if (FileFinder.isGlob(path)) {
                    runner.addGlob(path);
                } else {
                    runner.addFile(path);
                }
            }
            SuiteResult result = runner.run();
            printSummary(result);
            return result.isFailed() ? 1 : 0;
        } catch (RuntimeException e) {
            Console.println(Console.status(Status.BROKEN) + " " + StringUtils.firstLine(e));
            LogContext.RUNTIME_LOGGER.debug("run failed", e);
            return 1;
        }
    }

    static void printSummary(SuiteResult result) {
        Console.println(Console.line());
        for (String path : result.getPaths()) {
            FileResult fr = result.getResult(path).orElse(null);
            if (fr == null) {
                Console.println(Console.info(path) + " no test classes");
                continue;
            }
            Console.println(Console.info(path) + " " + Console.status(fr.getStatus()) + " " + counts(fr.getTestCount(), fr::getCount));
            for (ClassResult cr : fr.getClassResults()) {
                Console.println("  " + cr.getDefinition().getName() + " " + Console.status(cr.getStatus()));
                for (TestResult tr : cr.getTestResults()) {
                    if (tr.getStatus() == Status.FAILED || tr.getStatus() == Status.BROKEN) {
                        Console.println("    " + tr.getName() + " " + Console.status(tr.getStatus()) + ": " + reason(tr));
                    }
                }
            }
        }
        Console.println(Console.line());
        Console.println(Console.bold("result: ") + Console.status(result.getStatus()) + " "
                + counts(result.getTestCount(), result::getCount)
                + " in " + result.getDurationMillis() + " ms");
    }

    private static String reason(TestResult tr) {
        if (tr.getCause() != null) {
            return StringUtils.firstLine(tr.getCause());
        }
        for (TestResult hook : tr.getHooks()) {
            if (hook.isFailed()) {
                return hook.getName() + ": " + reason(hook);
            }
        }
        return tr.getError() == null ? "" : tr.getError();
    }

    private static String counts(int total, ToIntFunction<Status> counter) {
        return "(tests: " + total
                + ", passed: " + counter.applyAsInt(Status.PASSED)
                + ", failed: " + counter.applyAsInt(Status.FAILED)
                + ", broken: " + counter.applyAsInt(Status.BROKEN)
                + ", skipped: " + counter.applyAsInt(Status.SKIPPED) + ")";
    }

}
