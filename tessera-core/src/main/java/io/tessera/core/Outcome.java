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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of one executed test. Produced exactly once per test invocation.
 */
public final class Outcome {

    /** Duration value used when the test never ran, e.g. its resource could not be acquired. */
    public static final long NOT_MEASURED = -1;

    private final String name;
    private final Status status;
    private final long durationMillis;
    private final Throwable cause;
    private final String reason;
    private final SourceLocation location;
    private final List<String> log;
    private final String threadName;

    private Outcome(String name, Status status, long durationMillis, Throwable cause, String reason,
                    SourceLocation location, List<String> log, String threadName) {
        this.name = name;
        this.status = status;
        this.durationMillis = durationMillis;
        this.cause = cause;
        this.reason = reason;
        this.location = location;
        this.log = log == null ? List.of() : List.copyOf(log);
        this.threadName = threadName;
    }

    public static Outcome success(String name, long durationMillis, List<String> log) {
        return new Outcome(name, Status.SUCCESS, durationMillis, null, null, null, log, currentThreadName());
    }

    public static Outcome failure(String name, long durationMillis, Throwable cause, SourceLocation location, List<String> log) {
        if (cause == null) {
            throw new IllegalArgumentException("failure outcome requires a cause");
        }
        return new Outcome(name, Status.FAILURE, durationMillis, cause, null, location, log, currentThreadName());
    }

    public static Outcome cancelled(String name, long durationMillis, String reason, SourceLocation location, List<String> log) {
        return new Outcome(name, Status.CANCELLED, durationMillis, null, reason, location, log, currentThreadName());
    }

    public static Outcome ignored(String name, long durationMillis, String reason, SourceLocation location, List<String> log) {
        return new Outcome(name, Status.IGNORED, durationMillis, null, reason, location, log, currentThreadName());
    }

    private static String currentThreadName() {
        return Thread.currentThread().getName();
    }

    /**
     * Same outcome turned into a failure, used when releasing a per-test resource
     * fails after the body already produced a result.
     */
    Outcome withFailure(Throwable failure) {
        if (cause != null && cause != failure) {
            failure.addSuppressed(cause);
        }
        return new Outcome(name, Status.FAILURE, durationMillis, failure, null, location, log, threadName);
    }

    public String getName() {
        return name;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailed() {
        return status == Status.FAILURE;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public Throwable getCause() {
        return cause;
    }

    public String getReason() {
        return reason;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<String> getLog() {
        return log;
    }

    public String getThreadName() {
        return threadName;
    }

    public String getFailureMessage() {
        if (cause == null) {
            return null;
        }
        String message = cause.getMessage();
        return message == null ? cause.getClass().getName() : message;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("status", status.name().toLowerCase());
        if (durationMillis != NOT_MEASURED) {
            map.put("durationMillis", durationMillis);
        }
        if (cause != null) {
            map.put("error", getFailureMessage());
            map.put("errorType", cause.getClass().getName());
        }
        if (reason != null) {
            map.put("reason", reason);
        }
        if (location != null) {
            map.put("location", location.toJson());
        }
        if (!log.isEmpty()) {
            map.put("log", new ArrayList<>(log));
        }
        map.put("thread", threadName);
        return map;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(status).append(' ').append(name);
        if (reason != null) {
            sb.append(" (").append(reason).append(')');
        }
        if (cause != null) {
            sb.append(": ").append(getFailureMessage());
        }
        return sb.toString();
    }

}
