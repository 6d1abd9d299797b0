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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Category loggers used across the engine, plus the threshold for lines captured
 * into test outcomes.
 */
public final class LogContext {

    // ========== Category Loggers ==========

    /** Logger for the engine itself (suite freeze, resource lifecycle, scheduling) */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("tessera.runtime");

    /** Logger that test bodies write to through {@link io.tessera.core.TestLog} */
    public static final Logger TEST_LOGGER = LoggerFactory.getLogger("tessera.test");

    /** Logger for console output (per-test lines and summary) */
    public static final Logger CONSOLE_LOGGER = LoggerFactory.getLogger("tessera.console");

    private static volatile LogLevel threshold = LogLevel.INFO;

    private LogContext() {
    }

    /**
     * Set the minimum level for test log lines captured into outcomes.
     */
    public static void setLogLevel(LogLevel level) {
        threshold = level;
    }

    public static LogLevel getLogLevel() {
        return threshold;
    }

    /**
     * Set the runtime log level for SLF4J/Logback.
     * Uses reflection to avoid compile-time dependency on Logback.
     * Sets the level on the "tessera" logger, which affects all subcategories.
     *
     * @param level the log level (trace, debug, info, warn, error)
     * @return true if the level was set successfully, false if Logback is not available
     */
    public static boolean setRuntimeLogLevel(String level) {
        if (level == null || level.isEmpty()) {
            return false;
        }
        try {
            Object factory = LoggerFactory.getILoggerFactory();
            if (!factory.getClass().getName().equals("ch.qos.logback.classic.LoggerContext")) {
                RUNTIME_LOGGER.debug("runtime log level not supported: not using logback");
                return false;
            }
            Object logger = factory.getClass()
                    .getMethod("getLogger", String.class)
                    .invoke(factory, "tessera");
            Class<?> levelClass = Class.forName("ch.qos.logback.classic.Level");
            Object levelValue = levelClass
                    .getMethod("toLevel", String.class)
                    .invoke(null, level.toUpperCase());
            logger.getClass()
                    .getMethod("setLevel", levelClass)
                    .invoke(logger, levelValue);
            RUNTIME_LOGGER.debug("set runtime log level to: {}", level);
            return true;
        } catch (Exception e) {
            RUNTIME_LOGGER.debug("failed to set runtime log level: {}", e.getMessage());
            return false;
        }
    }

}
