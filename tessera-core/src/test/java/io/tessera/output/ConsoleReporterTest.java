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
package io.tessera.output;

import io.tessera.core.Outcome;
import io.tessera.core.SourceLocation;
import io.tessera.core.SuiteResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReporterTest {

    ByteArrayOutputStream buffer;
    boolean colors;

    @BeforeEach
    void beforeEach() {
        colors = Console.isColorsEnabled();
        Console.setColorsEnabled(false);
        buffer = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void afterEach() {
        Console.setOutput(System.out);
        Console.setColorsEnabled(colors);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testFormat() {
        assertEquals("+ ok 12ms", ConsoleReporter.format(Outcome.success("ok", 12, null)));
        assertEquals("- bad 3ms", ConsoleReporter.format(
                Outcome.failure("bad", 3, new AssertionError("nope"), null, null)));
        assertEquals("- unmeasured", ConsoleReporter.format(
                Outcome.failure("unmeasured", Outcome.NOT_MEASURED, new IllegalStateException("x"), null, null)));
        assertEquals("! stopped (no network)", ConsoleReporter.format(
                Outcome.cancelled("stopped", 0, "no network", null, null)));
        assertEquals("~ skipped (linux only)", ConsoleReporter.format(
                Outcome.ignored("skipped", 0, "linux only", null, null)));
    }

    @Test
    void testFailureShowsMessageLocationAndLog() {
        SourceLocation location = new SourceLocation("UserSuite.java", "com.example.UserSuite", 42);
        Outcome outcome = Outcome.failure("create user", 7, new IllegalStateException("expected 201\nbut was 500"),
                location, List.of("[INFO] posting user"));
        new ConsoleReporter(true, false).report(outcome);
        String[] lines = output().split("\\R");
        assertEquals("- create user 7ms", lines[0]);
        assertEquals("    expected 201 (UserSuite.java:42)", lines[1]);
        assertEquals("    but was 500", lines[2]);
        assertEquals("    [INFO] posting user", lines[3]);
    }

    @Test
    void testLogOmittedWhenDisabled() {
        Outcome outcome = Outcome.failure("quiet", 1, new IllegalStateException("boom"), null, List.of("[INFO] noise"));
        new ConsoleReporter(false, false).report(outcome);
        assertFalse(output().contains("noise"));
    }

    @Test
    void testPassingTestPrintsSingleLine() {
        new ConsoleReporter().report(Outcome.success("fine", 0, List.of("[INFO] hidden")));
        assertEquals("+ fine 0ms", output().trim());
    }

    @Test
    void testSummary() {
        SuiteResult result = new SuiteResult("payments");
        result.addOutcome(Outcome.success("a", 1, null));
        result.addOutcome(Outcome.failure("b", 1, new IllegalStateException("declined"), null, null));
        result.addOutcome(Outcome.ignored("c", 0, "later", null, null));
        new ConsoleReporter().onSuiteEnd(result);
        String out = output();
        assertTrue(out.contains("payments"));
        assertTrue(out.contains("1 failed"));
        assertTrue(out.contains("ignored: 1"));
        assertTrue(out.contains("  - b: declined"));
    }

    @Test
    void testStripAnsi() {
        Console.setColorsEnabled(true);
        String colored = Console.fail("x");
        assertNotEquals("x", colored);
        assertEquals("x", Console.stripAnsi(colored));
    }

}
