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

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Builds the test-name predicate from the raw arguments of a run.
 * <p>
 * {@code -o <pattern>} (or {@code --only <pattern>}) selects tests whose full name,
 * {@code <suite name>.<test name>}, matches the pattern. {@code *} matches any
 * sequence of characters, everything else is literal. Without the option all tests
 * are selected. Other arguments are ignored.
 */
public final class NameFilter {

    public static final String ONLY_SHORT = "-o";
    public static final String ONLY_LONG = "--only";

    private NameFilter() {
    }

    public static Predicate<String> of(String suiteName, List<String> args) {
        String pattern = findPattern(args);
        if (pattern == null) {
            return name -> true;
        }
        Pattern regex = toRegex(pattern);
        return name -> regex.matcher(suiteName + "." + name).matches();
    }

    static String findPattern(List<String> args) {
        if (args == null) {
            return null;
        }
        int index = args.indexOf(ONLY_SHORT);
        if (index < 0) {
            index = args.indexOf(ONLY_LONG);
        }
        if (index < 0 || index + 1 >= args.size()) {
            return null;
        }
        return args.get(index + 1);
    }

    static Pattern toRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        int start = 0;
        int star;
        while ((star = glob.indexOf('*', start)) >= 0) {
            if (star > start) {
                sb.append(Pattern.quote(glob.substring(start, star)));
            }
            sb.append(".*");
            start = star + 1;
        }
        if (start < glob.length()) {
            sb.append(Pattern.quote(glob.substring(start)));
        }
        return Pattern.compile(sb.toString());
    }

}
