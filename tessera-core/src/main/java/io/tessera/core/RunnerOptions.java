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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Settings that can be supplied from outside the code, through JVM system properties:
 * <ul>
 *   <li>{@code tessera.parallelism} - caps the parallelism of every suite</li>
 *   <li>{@code tessera.options} - extra run arguments, whitespace separated,
 *   appended to the ones passed in code (for example {@code -o "*smoke*"})</li>
 *   <li>{@code tessera.log.level} - level of the {@code tessera} logger when Logback is used</li>
 * </ul>
 */
public final class RunnerOptions {

    public static final String PARALLELISM = "tessera.parallelism";
    public static final String OPTIONS = "tessera.options";
    public static final String LOG_LEVEL = "tessera.log.level";

    private static final RunnerOptions DEFAULTS = new RunnerOptions(Integer.MAX_VALUE, Collections.emptyList(), null);

    private final int parallelismCap;
    private final List<String> extraArgs;
    private final String logLevel;

    private RunnerOptions(int parallelismCap, List<String> extraArgs, String logLevel) {
        this.parallelismCap = parallelismCap;
        this.extraArgs = extraArgs;
        this.logLevel = logLevel;
    }

    public static RunnerOptions defaults() {
        return DEFAULTS;
    }

    public static RunnerOptions fromSystemProperties() {
        return from(System.getProperties());
    }

    public static RunnerOptions from(Properties props) {
        int cap = Integer.MAX_VALUE;
        String parallelism = props.getProperty(PARALLELISM);
        if (parallelism != null && !parallelism.isBlank()) {
            try {
                cap = Math.max(1, Integer.parseInt(parallelism.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid value for " + PARALLELISM + ": " + parallelism, e);
            }
        }
        List<String> args = Collections.emptyList();
        String options = props.getProperty(OPTIONS);
        if (options != null && !options.isBlank()) {
            args = Collections.unmodifiableList(Arrays.asList(options.trim().split("\\s+")));
        }
        return new RunnerOptions(cap, args, props.getProperty(LOG_LEVEL));
    }

    public int getParallelismCap() {
        return parallelismCap;
    }

    public List<String> getExtraArgs() {
        return extraArgs;
    }

    public String getLogLevel() {
        return logLevel;
    }

    /**
     * The arguments passed in code followed by the configured extra arguments.
     */
    public List<String> mergeArgs(List<String> args) {
        if (extraArgs.isEmpty()) {
            return args == null ? Collections.emptyList() : args;
        }
        List<String> merged = new ArrayList<>();
        if (args != null) {
            merged.addAll(args);
        }
        merged.addAll(extraArgs);
        return merged;
    }

}
