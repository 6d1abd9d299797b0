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
import io.tessera.core.OutcomeReporter;
import io.tessera.core.Suite;
import io.tessera.core.SuiteResult;

/**
 * Prints one line per outcome, and the suite summary at the end:
 * <pre>
 * io.example.UserApiSuite
 * + get user 12ms
 * - list users 40ms
 *     expected: 3 but was: 2 (UserApiSuite.java:21)
 * ! needs db (no database)
 * ~ slow path (skipped on CI)
 * </pre>
 */
public class ConsoleReporter implements OutcomeReporter {

    private final boolean printLog;
    private final boolean printSummary;

    public ConsoleReporter() {
        this(true, true);
    }

    /**
     * @param printLog     print the captured test log under failed tests
     * @param printSummary print the suite summary when the suite ends
     */
    public ConsoleReporter(boolean printLog, boolean printSummary) {
        this.printLog = printLog;
        this.printSummary = printSummary;
    }

    @Override
    public void onSuiteStart(Suite suite) {
        Console.println(Console.label(suite.getName()));
    }

    @Override
    public void report(Outcome outcome) {
        Console.println(format(outcome));
        if (outcome.isFailed()) {
            String where = outcome.getLocation() == null ? "" : " (" + outcome.getLocation() + ")";
            for (String line : outcome.getFailureMessage().split("\n")) {
                Console.println("    " + Console.red(line) + where);
                where = "";
            }
            if (printLog) {
                for (String line : outcome.getLog()) {
                    Console.println("    " + line);
                }
            }
        }
    }

    @Override
    public void onSuiteEnd(SuiteResult result) {
        if (printSummary) {
            result.printSummary();
        }
    }

    static String format(Outcome outcome) {
        String duration = outcome.getDurationMillis() == Outcome.NOT_MEASURED ? "" : " " + outcome.getDurationMillis() + "ms";
        String reason = outcome.getReason() == null ? "" : " (" + outcome.getReason() + ")";
        return switch (outcome.getStatus()) {
            case SUCCESS -> Console.pass("+ ") + outcome.getName() + duration;
            case FAILURE -> Console.fail("- ") + outcome.getName() + duration;
            case CANCELLED -> Console.warn("! ") + outcome.getName() + reason;
            case IGNORED -> Console.info("~ ") + outcome.getName() + reason;
        };
    }

}
