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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Where a test was declared, or where a cancel / ignore verdict was produced.
 * Captured from the call stack, skipping frames that belong to the engine itself.
 */
public record SourceLocation(String fileName, String className, int line) {

    // classes whose frames sit between user code and the capture point
    private static final Set<String> ENGINE_CLASSES = Set.of(
            SourceLocation.class.getName(),
            Verdict.class.getName(),
            ResourceSuite.class.getName(),
            SharedResourceSuite.class.getName(),
            PerTestResourceSuite.class.getName(),
            SimpleSuite.class.getName());

    private static final StackWalker WALKER = StackWalker.getInstance();

    /**
     * Returns the first caller frame outside the engine, or empty when there is none.
     */
    public static Optional<SourceLocation> capture() {
        return WALKER.walk(frames -> frames
                .filter(f -> !isEngineFrame(f.getClassName()))
                .findFirst()
                .map(f -> new SourceLocation(f.getFileName(), f.getClassName(), f.getLineNumber())));
    }

    static boolean isEngineFrame(String className) {
        int nested = className.indexOf('$');
        return ENGINE_CLASSES.contains(nested < 0 ? className : className.substring(0, nested));
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", fileName);
        map.put("line", line);
        return map;
    }

    @Override
    public String toString() {
        return (fileName == null ? className : fileName) + ":" + line;
    }

}
