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

/**
 * Receives outcomes as they are produced, in the order the scheduler emits them.
 * Called at most once per test, always from the thread that drives the run.
 * <p>
 * The suite callbacks are optional and fire once per suite around the outcomes.
 */
@FunctionalInterface
public interface OutcomeReporter {

    void report(Outcome outcome);

    default void onSuiteStart(Suite suite) {
    }

    default void onSuiteEnd(SuiteResult result) {
    }

    /**
     * Reporter forwarding every callback to each of the given reporters in turn.
     */
    static OutcomeReporter all(OutcomeReporter... reporters) {
        return new OutcomeReporter() {
            @Override
            public void report(Outcome outcome) {
                for (OutcomeReporter reporter : reporters) {
                    reporter.report(outcome);
                }
            }

            @Override
            public void onSuiteStart(Suite suite) {
                for (OutcomeReporter reporter : reporters) {
                    reporter.onSuiteStart(suite);
                }
            }

            @Override
            public void onSuiteEnd(SuiteResult result) {
                for (OutcomeReporter reporter : reporters) {
                    reporter.onSuiteEnd(result);
                }
            }
        };
    }

    static OutcomeReporter none() {
        return outcome -> {
        };
    }

}
