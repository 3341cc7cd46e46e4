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

/**
 * The fixed catalogue of events a {@link Runner} emits.
 */
public enum RunEventType {

    RUNNER_INIT("runnerInit"),
    // file events
    RUN_FILE("runFile"),
    FILE_PARSED("fileParsed"),
    FILE_RESULT("fileResult"),
    // class events
    RUN_CLASS("runClass"),
    CLASS_CONSTRUCTOR("classConstructor"),
    CLASS_RESULT("classResult"),
    // hooks
    CLASS_HOOK("classHook"),
    CLASS_HOOK_RESULT("classHookResult"),
    CLASS_EACH_HOOK("classEachHook"),
    CLASS_EACH_HOOK_RESULT("classEachHookResult"),
    // tests
    CLASS_METHOD("classMethod"),
    CLASS_METHOD_RESULT("classMethodResult");

    private final String value;

    RunEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

}
