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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceLocationTest {

    static class LocatedSuite extends SimpleSuite {

        LocatedSuite() {
            super("located");
            pureTest("here", () -> cancel("later"));
        }

    }

    @Test
    void testEngineFrames() {
        assertTrue(SourceLocation.isEngineFrame("io.tessera.core.Verdict"));
        assertTrue(SourceLocation.isEngineFrame("io.tessera.core.ResourceSuite"));
        assertTrue(SourceLocation.isEngineFrame("io.tessera.core.ResourceSuite$LoggedTest"));
        assertFalse(SourceLocation.isEngineFrame("io.tessera.core.Runner"));
        assertFalse(SourceLocation.isEngineFrame("io.tessera.core.SourceLocationTest$LocatedSuite"));
        assertFalse(SourceLocation.isEngineFrame("com.example.UserSuite"));
    }

    @Test
    void testCapturesCaller() {
        SourceLocation location = SourceLocation.capture().orElseThrow();
        assertEquals(SourceLocationTest.class.getName(), location.className());
        assertEquals("SourceLocationTest.java", location.fileName());
        assertTrue(location.line() > 0);
        assertTrue(location.toString().startsWith("SourceLocationTest.java:"));
    }

    @Test
    void testRegistrationAndVerdictPointAtSuiteCode() {
        try (Runner runner = Runner.builder().options(RunnerOptions.defaults()).build()) {
            Outcome outcome = runner.run(new LocatedSuite()).getOutcomes().get(0);
            assertEquals(Status.CANCELLED, outcome.getStatus());
            assertEquals(LocatedSuite.class.getName(), outcome.getLocation().className());
        }
    }

}
