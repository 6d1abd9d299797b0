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
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class RunnerOptionsTest {

    @Test
    void testDefaults() {
        RunnerOptions options = RunnerOptions.defaults();
        assertEquals(Integer.MAX_VALUE, options.getParallelismCap());
        assertTrue(options.getExtraArgs().isEmpty());
        assertNull(options.getLogLevel());
        assertEquals(List.of("-o", "x"), options.mergeArgs(List.of("-o", "x")));
        assertEquals(List.of(), options.mergeArgs(null));
    }

    @Test
    void testFromProperties() {
        Properties props = new Properties();
        props.setProperty(RunnerOptions.PARALLELISM, " 4 ");
        props.setProperty(RunnerOptions.OPTIONS, "  --only   *login*  ");
        props.setProperty(RunnerOptions.LOG_LEVEL, "debug");
        RunnerOptions options = RunnerOptions.from(props);
        assertEquals(4, options.getParallelismCap());
        assertEquals(List.of("--only", "*login*"), options.getExtraArgs());
        assertEquals("debug", options.getLogLevel());
        assertEquals(List.of("-v", "--only", "*login*"), options.mergeArgs(List.of("-v")));
    }

    @Test
    void testParallelismClampedToOne() {
        Properties props = new Properties();
        props.setProperty(RunnerOptions.PARALLELISM, "0");
        assertEquals(1, RunnerOptions.from(props).getParallelismCap());
    }

    @Test
    void testInvalidParallelism() {
        Properties props = new Properties();
        props.setProperty(RunnerOptions.PARALLELISM, "many");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> RunnerOptions.from(props));
        assertTrue(e.getMessage().contains(RunnerOptions.PARALLELISM));
    }

}
