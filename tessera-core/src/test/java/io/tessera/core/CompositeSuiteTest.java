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
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A suite whose outcomes are those of two nested suites, one per resource strategy.
 */
class CompositeSuiteTest {

    static class FreshCounterSuite extends PerTestResourceSuite<AtomicInteger> {

        FreshCounterSuite() {
            for (int i = 0; i <= 5; i++) {
                test(i + " gets a fresh counter", counter -> expectEquals(0, counter.getAndIncrement()));
            }
        }

        @Override
        protected ResourceScope<AtomicInteger> perTestResource() {
            return ResourceScope.of(AtomicInteger::new);
        }

    }

    static class SharedCounterSuite extends SharedResourceSuite<AtomicInteger> {

        SharedCounterSuite() {
            for (int i = 0; i <= 5; i++) {
                int expected = i;
                test(i + " reuses the shared counter", counter -> expectEquals(expected, counter.getAndIncrement()));
            }
        }

        @Override
        protected int maxParallelism() {
            return 1;
        }

        @Override
        protected ResourceScope<AtomicInteger> sharedResource() {
            return ResourceScope.of(AtomicInteger::new);
        }

    }

    static class BothSuite implements Suite {

        final Suite fresh = new FreshCounterSuite();
        final Suite shared = new SharedCounterSuite();

        @Override
        public String getName() {
            return "both";
        }

        @Override
        public OutcomeStream spec(List<String> args, Scheduler scheduler) {
            return OutcomeStream.concat(fresh.spec(args, scheduler), shared.spec(args, scheduler));
        }

    }

    @Test
    void testNestedSuites() {
        try (Runner runner = Runner.builder().options(RunnerOptions.defaults()).build()) {
            SuiteResult result = runner.run(new BothSuite());
            assertEquals(12, result.getTestCount());
            assertEquals(12, result.getPassedCount(), () -> String.join("\n", result.getErrors()));
            assertEquals("both", result.getSuiteName());
        }
    }

}
