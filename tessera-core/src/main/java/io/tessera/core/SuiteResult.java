/*
 * The MIT License
 *
 * Copyright 2025 The Tessera Authors
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
package io.tessera.core;

import io.tessera.output.Console;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of one suite run, in the order they were reported.
 */
public class SuiteResult {

    private final String suiteName;
    private final List<Outcome> outcomes = Collections.synchronizedList(new ArrayList<>());
    private long startTime;
    private long endTime;
    private boolean aborted;

    public SuiteResult(String suiteName) {
        this.suiteName = suiteName;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    /**
     * Set when the run stopped before every selected test produced an outcome,
     * because it was cancelled or an engine error occurred.
     */
    public void setAborted(boolean aborted) {
        this.aborted = aborted;
    }

    public void addOutcome(Outcome outcome) {
        outcomes.add(outcome);
    }

    public String getSuiteName() {
        return suiteName;
    }

    public List<Outcome> getOutcomes() {
        synchronized (outcomes) {
            return new ArrayList<>(outcomes);
        }
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public boolean isAborted() {
        return aborted;
    }

    public long getDurationMillis() {
        return endTime - startTime;
    }

    // ========== Aggregation ==========

    public int getTestCount() {
        return outcomes.size();
    }

    public int getCount(Status status) {
        synchronized (outcomes) {
            return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
        }
    }

    public int getPassedCount() {
        return getCount(Status.SUCCESS);
    }

    public int getFailedCount() {
        return getCount(Status.FAILURE);
    }

    public int getCancelledCount() {
        return getCount(Status.CANCELLED);
    }

    public int getIgnoredCount() {
        return getCount(Status.IGNORED);
    }

    public boolean isFailed() {
        return aborted || getFailedCount() > 0;
    }

    public boolean isPassed() {
        return !isFailed();
    }

    public List<String> getErrors() {
        List<String> errors = new ArrayList<>();
        for (Outcome outcome : getOutcomes()) {
            if (outcome.isFailed()) {
                errors.add(outcome.getName() + ": " + outcome.getFailureMessage());
            }
        }
        return errors;
    }

    // ========== Serialization ==========

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("suite", suiteName);
        List<Map<String, Object>> list = new ArrayList<>();
        for (Outcome outcome : getOutcomes()) {
            list.add(outcome.toJson());
        }
        map.put("outcomes", list);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("test_count", getTestCount());
        summary.put("passed", getPassedCount());
        summary.put("failed", getFailedCount());
        summary.put("cancelled", getCancelledCount());
        summary.put("ignored", getIgnoredCount());
        summary.put("duration_millis", getDurationMillis());
        summary.put("status", isFailed() ? "failed" : "passed");
        map.put("summary", summary);
        return map;
    }

    // ========== Console Output ==========

    public void printSummary() {
        Console.println(Console.line());
        Console.println(Console.label(suiteName) + " (tessera " + Globals.TESSERA_VERSION + ")");
        Console.println(String.format("elapsed: %6.2fs | tests: %4d | passed: %4d",
                getDurationMillis() / 1000.0, getTestCount(), getPassedCount()));
        String failed = getFailedCount() > 0
                ? Console.fail(getFailedCount() + " failed")
                : Console.pass("none failed");
        Console.println(String.format("%s | cancelled: %d | ignored: %d", failed, getCancelledCount(), getIgnoredCount()));
        if (aborted) {
            Console.println(Console.fail("run aborted before all tests completed"));
        }
        Console.println(Console.line());
        List<String> errors = getErrors();
        if (!errors.isEmpty()) {
            Console.println(Console.fail("failed tests:"));
            for (String error : errors) {
                if (error.length() > 100) {
                    error = error.substring(0, 97) + "...";
                }
                Console.println("  - " + Console.yellow(error));
            }
        }
    }

}
