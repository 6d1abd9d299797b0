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
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class NameFilterTest {

    @Test
    void testNoArgsSelectsEverything() {
        Predicate<String> filter = NameFilter.of("my.Suite", List.of());
        assertTrue(filter.test("anything"));
        assertTrue(NameFilter.of("my.Suite", null).test("x"));
    }

    @Test
    void testOtherArgsIgnored() {
        Predicate<String> filter = NameFilter.of("my.Suite", List.of("--verbose", "foo"));
        assertTrue(filter.test("anything"));
    }

    @Test
    void testPatternMatchesSuiteDotTest() {
        Predicate<String> filter = NameFilter.of("my.Suite", List.of("-o", "my.Suite.login"));
        assertTrue(filter.test("login"));
        assertFalse(filter.test("login twice"));
        assertFalse(filter.test("logout"));
    }

    @Test
    void testWildcards() {
        Predicate<String> filter = NameFilter.of("my.Suite", List.of("--only", "*login*"));
        assertTrue(filter.test("login"));
        assertTrue(filter.test("user login works"));
        assertFalse(filter.test("logout"));
        Predicate<String> bySuite = NameFilter.of("my.Suite", List.of("-o", "my.Suite.*"));
        assertTrue(bySuite.test("anything"));
        assertFalse(NameFilter.of("other.Suite", List.of("-o", "my.Suite.*")).test("anything"));
    }

    @Test
    void testRegexCharactersAreLiteral() {
        Predicate<String> filter = NameFilter.of("s", List.of("-o", "s.a+b (1)"));
        assertTrue(filter.test("a+b (1)"));
        assertFalse(filter.test("aab (1)"));
        // the dot between suite and test is literal too
        assertFalse(NameFilter.of("s", List.of("-o", "sXa")).test("a"));
    }

    @Test
    void testDanglingOptionIgnored() {
        assertTrue(NameFilter.of("s", List.of("-o")).test("anything"));
    }

    @Test
    void testShortOptionWins() {
        Predicate<String> filter = NameFilter.of("s", List.of("--only", "s.a", "-o", "s.b"));
        assertTrue(filter.test("b"));
        assertFalse(filter.test("a"));
    }

}
