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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerdictTest {

    @Test
    void testExpect() {
        assertTrue(Verdict.expect(true, "never shown").isPassed());
        Verdict failed = Verdict.expect(false, "must hold");
        assertFalse(failed.isPassed());
        assertEquals(Verdict.Kind.CHECK, failed.getKind());
        assertEquals(List.of("must hold"), failed.getFailures());
    }

    @Test
    void testExpectEquals() {
        assertTrue(Verdict.expectEquals("a", "a").isPassed());
        assertEquals(List.of("expected: 1 but was: 2"), Verdict.expectEquals(1, 2).getFailures());
        assertTrue(Verdict.expectEquals(null, null).isPassed());
    }

    @Test
    void testAndCollectsAllFailures() {
        Verdict v = Verdict.expect(false, "first")
                .and(Verdict.success())
                .and(Verdict.expect(false, "second"));
        assertEquals(List.of("first", "second"), v.getFailures());
    }

    @Test
    void testOrNeedsOneSuccess() {
        assertTrue(Verdict.failure("a").or(Verdict.success()).isPassed());
        assertTrue(Verdict.success().or(Verdict.failure("b")).isPassed());
        assertEquals(List.of("a", "b"), Verdict.failure("a").or(Verdict.failure("b")).getFailures());
    }

    @Test
    void testCancelAndIgnoreAreTerminal() {
        Verdict cancel = Verdict.cancel("no db");
        assertSame(cancel, cancel.and(Verdict.failure("x")));
        assertSame(cancel, Verdict.failure("x").and(cancel));
        Verdict ignore = Verdict.ignore("later");
        assertSame(ignore, ignore.or(Verdict.success()));
        assertEquals(Verdict.Kind.IGNORE, ignore.getKind());
        assertEquals("later", ignore.getReason());
        assertFalse(ignore.isPassed());
    }

    @Test
    void testLocationPointsAtCaller() {
        Verdict cancel = Verdict.cancel("reason");
        assertNotNull(cancel.getLocation());
        assertEquals("VerdictTest.java", cancel.getLocation().fileName());
        assertTrue(cancel.getLocation().line() > 0);
    }

}
