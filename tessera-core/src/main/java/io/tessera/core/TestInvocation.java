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

import io.tessera.output.LogContext;
import org.slf4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * A registered test: name, declaration site and body. Running it always yields
 * exactly one {@link Outcome}; nothing thrown by the body escapes {@link #execute}.
 *
 * @param <R> the suite resource type
 */
public final class TestInvocation<R> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final String name;
    private final SourceLocation location;
    private final TestBody<R> body;

    public TestInvocation(String name, SourceLocation location, TestBody<R> body) {
        if (name == null) {
            throw new IllegalArgumentException("test name must not be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("test body must not be null: " + name);
        }
        this.name = name;
        this.location = location;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Runs the body against the given resource and classifies the result.
     */
    public Outcome execute(R resource) {
        TestLog log = new TestLog(name);
        long start = System.nanoTime();
        logger.trace("test start: {}", name);
        Outcome outcome;
        try {
            Verdict verdict = body.run(resource, log);
            outcome = classify(verdict, millisSince(start), log);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = Outcome.cancelled(name, millisSince(start), "interrupted", location, log.collect());
        } catch (Throwable t) {
            if (isFatal(t)) {
                throw (Error) t;
            }
            outcome = Outcome.failure(name, millisSince(start), t, location, log.collect());
        }
        logger.debug("test end: {} - {} ({} ms)", name, outcome.getStatus(), outcome.getDurationMillis());
        return outcome;
    }

    /**
     * Errors that leave the JVM unusable and are never turned into an outcome.
     * A {@link StackOverflowError} is not one of them: the stack is unwound by the
     * time it is caught.
     */
    static boolean isFatal(Throwable t) {
        return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
    }

    /**
     * Outcome for a test whose body could not run at all, because its resource
     * could not be acquired.
     */
    public Outcome notRun(Throwable cause) {
        return Outcome.failure(name, Outcome.NOT_MEASURED, cause, location, null);
    }

    private Outcome classify(Verdict verdict, long durationMillis, TestLog log) {
        if (verdict == null) {
            return Outcome.failure(name, durationMillis,
                    new IllegalStateException("test body returned null: " + name), location, log.collect());
        }
        SourceLocation where = verdict.getLocation() != null ? verdict.getLocation() : location;
        return switch (verdict.getKind()) {
            case CANCEL -> Outcome.cancelled(name, durationMillis, verdict.getReason(), where, log.collect());
            case IGNORE -> Outcome.ignored(name, durationMillis, verdict.getReason(), where, log.collect());
            case CHECK -> verdict.isPassed()
                    ? Outcome.success(name, durationMillis, log.collect())
                    : Outcome.failure(name, durationMillis,
                    new ExpectationFailedException(verdict.getFailures(), where), where, log.collect());
        };
    }

    private static long millisSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public String toString() {
        return location == null ? name : name + " (" + location + ")";
    }

}
