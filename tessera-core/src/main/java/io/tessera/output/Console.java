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

import java.io.PrintStream;
import java.util.regex.Pattern;

/**
 * Console output with ANSI color support.
 * Also sends a copy (stripped of ANSI codes) to the tessera.console logger at TRACE level.
 */
public final class Console {

    private static final Logger logger = LogContext.CONSOLE_LOGGER;

    private static final Pattern ANSI_PATTERN = Pattern.compile("\u001B\\[[;\\d]*m");

    public static final String RESET = "\u001B[0m";
    public static final String BOLD = "\u001B[1m";
    public static final String RED = "\u001B[31m";
    public static final String YELLOW = "\u001B[33m";
    public static final String CYAN = "\u001B[36m";
    public static final String WHITE = "\u001B[37m";
    public static final String BRIGHT_RED = "\u001B[91m";
    public static final String BRIGHT_GREEN = "\u001B[92m";
    public static final String BRIGHT_YELLOW = "\u001B[93m";

    private static volatile boolean colorsEnabled = detectColorSupport();
    private static volatile PrintStream out = System.out;

    private Console() {
    }

    private static boolean detectColorSupport() {
        // NO_COLOR wins over everything (https://no-color.org/)
        if (System.getenv("NO_COLOR") != null) {
            return false;
        }
        String forceColor = System.getenv("FORCE_COLOR");
        if (forceColor != null && !forceColor.equals("0")) {
            return true;
        }
        String term = System.getenv("TERM");
        if (term != null && (term.contains("color") || term.contains("xterm") || term.contains("256"))) {
            return true;
        }
        if (System.getenv("COLORTERM") != null) {
            return true;
        }
        if (System.getProperty("os.name", "").toLowerCase().contains("win")) {
            return System.getenv("WT_SESSION") != null;
        }
        return System.console() != null;
    }

    static String stripAnsi(String text) {
        return ANSI_PATTERN.matcher(text).replaceAll("");
    }

    public static void setColorsEnabled(boolean enabled) {
        colorsEnabled = enabled;
    }

    public static boolean isColorsEnabled() {
        return colorsEnabled;
    }

    public static void setOutput(PrintStream output) {
        out = output;
    }

    // ========== Formatting ==========

    public static String color(String text, String... codes) {
        if (!colorsEnabled || codes.length == 0) {
            return text;
        }
        return String.join("", codes) + text + RESET;
    }

    public static String red(String text) {
        return color(text, RED);
    }

    public static String yellow(String text) {
        return color(text, YELLOW);
    }

    public static String pass(String text) {
        return color(text, BRIGHT_GREEN);
    }

    public static String fail(String text) {
        return color(text, BRIGHT_RED, BOLD);
    }

    public static String warn(String text) {
        return color(text, BRIGHT_YELLOW);
    }

    public static String info(String text) {
        return color(text, CYAN);
    }

    public static String label(String text) {
        return color(text, WHITE, BOLD);
    }

    // ========== Output ==========

    public static void println(String text) {
        out.println(text);
        if (logger.isTraceEnabled()) {
            logger.trace(stripAnsi(text));
        }
    }

    public static void println() {
        out.println();
    }

    public static String line(int length) {
        return "=".repeat(length);
    }

    public static String line() {
        return line(60);
    }

}
