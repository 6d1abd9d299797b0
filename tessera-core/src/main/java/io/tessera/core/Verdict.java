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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The value a test body returns: either a check (which holds or carries failure
 * messages), or an explicit request to mark the test as cancelled or ignored.
 * <p>
 * Checks compose with {@link #and(Verdict)} and {@link #or(Verdict)}. Cancel and
 * ignore verdicts are terminal: combining them with anything yields the cancel or
 * ignore verdict unchanged.
 * <pre>
 * test("sum", () -&gt; expect(1 + 1 == 2, "arithmetic").and(expect(list.isEmpty(), "empty list")));
 * test("needs db", db -&gt; db == null ? cancel("no database") : expect(db.ping(), "ping"));
 * </pre>
 */
public final class Verdict {

    public enum Kind {
        CHECK, CANCEL, IGNORE
    }

    private static final Verdict SUCCESS = new Verdict(Kind.CHECK, Collections.emptyList(), null, null);

    private final Kind kind;
    private final List<String> failures;
    private final String reason;
    private final SourceLocation location;

    private Verdict(Kind kind, List<String> failures, String reason, SourceLocation location) {
        this.kind = kind;
        this.failures = failures;
        this.reason = reason;
        this.location = location;
    }

    public static Verdict success() {
        return SUCCESS;
    }

    public static Verdict failure(String message) {
        Objects.requireNonNull(message, "message");
        return new Verdict(Kind.CHECK, List.of(message), null, SourceLocation.capture().orElse(null));
    }

    public static Verdict expect(boolean condition, String message) {
        return condition ? SUCCESS : failure(message);
    }

    public static Verdict expectEquals(Object expected, Object actual) {
        if (Objects.equals(expected, actual)) {
            return SUCCESS;
        }
        return failure("expected: " + expected + " but was: " + actual);
    }

    /**
     * Marks the test as cancelled. A cancelled test is reported separately from
     * failed ones and does not fail the run.
     */
    public static Verdict cancel(String reason) {
        return new Verdict(Kind.CANCEL, Collections.emptyList(), reason, SourceLocation.capture().orElse(null));
    }

    public static Verdict ignore(String reason) {
        return new Verdict(Kind.IGNORE, Collections.emptyList(), reason, SourceLocation.capture().orElse(null));
    }

    public Verdict and(Verdict other) {
        if (kind != Kind.CHECK) {
            return this;
        }
        if (other.kind != Kind.CHECK) {
            return other;
        }
        if (other.failures.isEmpty()) {
            return this;
        }
        if (failures.isEmpty()) {
            return other;
        }
        List<String> merged = new ArrayList<>(failures.size() + other.failures.size());
        merged.addAll(failures);
        merged.addAll(other.failures);
        return new Verdict(Kind.CHECK, Collections.unmodifiableList(merged), null, location);
    }

    public Verdict or(Verdict other) {
        if (kind != Kind.CHECK) {
            return this;
        }
        if (other.kind != Kind.CHECK) {
            return other;
        }
        if (failures.isEmpty() || other.failures.isEmpty()) {
            return SUCCESS;
        }
        return and(other);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isPassed() {
        return kind == Kind.CHECK && failures.isEmpty();
    }

    public List<String> getFailures() {
        return failures;
    }

    public String getReason() {
        return reason;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CHECK -> failures.isEmpty() ? "success" : "failure" + failures;
            case CANCEL -> "cancel(" + reason + ")";
            case IGNORE -> "ignore(" + reason + ")";
        };
    }

}
