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

import io.magiqan.common.Json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Results of {@link Runner#run()}, one entry per registered path in registration order.
 * An empty entry means the file had no test classes.
 */
public class SuiteResult {

    private final List<String> paths = new ArrayList<>();
    private final List<FileResult> results = new ArrayList<>();
    private long startTime;
    private long endTime;

    SuiteResult() {
    }

    void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    void add(String path, FileResult result) {
        paths.add(path);
        results.add(result);
    }

    public List<String> getPaths() {
        return List.copyOf(paths);
    }

    public List<Optional<FileResult>> getResults() {
        List<Optional<FileResult>> list = new ArrayList<>();
        for (FileResult fr : results) {
            list.add(Optional.ofNullable(fr));
        }
        return list;
    }

    public Optional<FileResult> getResult(String path) {
        int index = paths.indexOf(path);
        return index == -1 ? Optional.empty() : Optional.ofNullable(results.get(index));
    }

    /**
     * Only the files that contained test classes.
     */
    public List<FileResult> getFileResults() {
        List<FileResult> list = new ArrayList<>();
        for (FileResult fr : results) {
            if (fr != null) {
                list.add(fr);
            }
        }
        return list;
    }

    public List<String> getEmptyPaths() {
        List<String> list = new ArrayList<>();
        for (int i = 0; i < paths.size(); i++) {
            if (results.get(i) == null) {
                list.add(paths.get(i));
            }
        }
        return list;
    }

    // ========== Aggregation ==========

    /**
     * Same rules as a file verdict, applied to the file verdicts.
     */
    public Status getStatus() {
        List<Status> statuses = new ArrayList<>();
        for (FileResult fr : getFileResults()) {
            statuses.add(fr.getStatus());
        }
        return FileResult.aggregate(statuses);
    }

    public boolean isFailed() {
        Status status = getStatus();
        return status == Status.FAILED || status == Status.BROKEN;
    }

    public int getFileCount() {
        return getFileResults().size();
    }

    public int getTestCount() {
        return getFileResults().stream().mapToInt(FileResult::getTestCount).sum();
    }

    public int getCount(Status status) {
        return getFileResults().stream().mapToInt(fr -> fr.getCount(status)).sum();
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    // ========== Serialization ==========

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        List<Map<String, Object>> files = new ArrayList<>();
        for (FileResult fr : getFileResults()) {
            files.add(fr.toJson());
        }
        map.put("files", files);
        map.put("emptyPaths", getEmptyPaths());
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("file_count", getFileCount());
        summary.put("test_count", getTestCount());
        summary.put("test_passed", getCount(Status.PASSED));
        summary.put("test_failed", getCount(Status.FAILED));
        summary.put("test_broken", getCount(Status.BROKEN));
        summary.put("test_skipped", getCount(Status.SKIPPED));
        summary.put("duration_millis", getDurationMillis());
        summary.put("status", getStatus().getValue());
        map.put("summary", summary);
        return map;
    }

    public String toJson() {
        return Json.stringifyStrict(toMap());
    }

}
