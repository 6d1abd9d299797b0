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
import io.tessera.output.LogLevel;
import org.slf4j.Logger;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Log handed to a test body. Lines are captured into the test's {@link Outcome}
 * (so reporters can show them next to a failure) and also cascade to the
 * {@code tessera.test} SLF4J category.
 * <p>
 * One instance per test execution. A test body may hand it to threads it starts
 * itself, so appends are synchronized.
 */
public class TestLog {

    private static final Logger logger = LogContext.TEST_LOGGER;

    private final String testName;
    private final List<String> lines = new ArrayList<>();

    public TestLog(String testName) {
        this.testName = testName;
    }

    public void trace(String format, Object... args) {
        log(LogLevel.TRACE, format, args);
    }

    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    public void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    public void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    public void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }

    public void log(LogLevel level, String format, Object... args) {
        String message = MessageFormatter.arrayFormat(format, args).getMessage();
        if (level.isEnabled(LogContext.getLogLevel())) {
            synchronized (lines) {
                lines.add("[" + level + "] " + message);
            }
        }
        switch (level) {
            case TRACE -> logger.trace("[{}] {}", testName, message);
            case DEBUG -> logger.debug("[{}] {}", testName, message);
            case INFO -> logger.info("[{}] {}", testName, message);
            case WARN -> logger.warn("[{}] {}", testName, message);
            case ERROR -> logger.error("[{}] {}", testName, message);
        }
    }

    /**
     * Snapshot of the captured lines.
     */
    public List<String> collect() {
        synchronized (lines) {
            return Collections.unmodifiableList(new ArrayList<>(lines));
        }
    }

    public String getTestName() {
        return testName;
    }

}
