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

import io.tessera.core.Runner;
import io.tessera.core.RunnerOptions;
import io.tessera.core.SimpleSuite;
import io.tessera.core.SuiteResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesReporterTest {

    @TempDir
    Path tempDir;

    static class CheckoutSuite extends SimpleSuite {

        CheckoutSuite() {
            super("checkout");
            pureTest("add item", () -> success());
            loggedTest("pay", log -> {
                log.warn("card {} declined", "4242");
                return failure("payment declined");
            });
            pureTest("refund", () -> ignore("not implemented"));
        }

        @Override
        protected int maxParallelism() {
            return 1;
        }

    }

    private List<Map<String, Object>> readLines(Path path) throws Exception {
        List<Map<String, Object>> list = new ArrayList<>();
        for (String line : Files.readAllLines(path)) {
            list.add(Json.parseObject(line));
        }
        return list;
    }

    @Test
    void testWritesSuiteOutcomesAndSummary() throws Exception {
        Path outputDir = tempDir.resolve("reports");
        JsonLinesReporter reporter = new JsonLinesReporter(outputDir);
        try (Runner runner = Runner.builder().options(RunnerOptions.defaults()).build()) {
            SuiteResult result = runner.run(new CheckoutSuite(), List.of(), reporter);
            assertTrue(result.isFailed());
        } finally {
            reporter.close();
        }
        assertEquals(outputDir.resolve(JsonLinesReporter.DEFAULT_FILE_NAME), reporter.getPath());
        List<Map<String, Object>> lines = readLines(reporter.getPath());
        assertEquals(5, lines.size());

        Map<String, Object> header = lines.get(0);
        assertEquals("suite", header.get("t"));
        assertEquals("checkout", header.get("name"));
        assertNotNull(header.get("version"));

        Map<String, Object> added = lines.get(1);
        assertEquals("outcome", added.get("t"));
        assertEquals("checkout", added.get("suite"));
        assertEquals("add item", added.get("name"));
        assertEquals("success", added.get("status"));

        Map<String, Object> paid = lines.get(2);
        assertEquals("failure", paid.get("status"));
        assertTrue(((String) paid.get("error")).contains("payment declined"));
        assertEquals(List.of("[WARN] card 4242 declined"), paid.get("log"));
        assertNotNull(paid.get("location"));

        Map<String, Object> refund = lines.get(3);
        assertEquals("ignored", refund.get("status"));
        assertEquals("not implemented", refund.get("reason"));

        Map<String, Object> end = lines.get(4);
        assertEquals("suite_end", end.get("t"));
        assertEquals(1, ((Number) end.get("passed")).intValue());
        assertEquals(1, ((Number) end.get("failed")).intValue());
        assertEquals(1, ((Number) end.get("ignored")).intValue());
        assertEquals(Boolean.FALSE, end.get("aborted"));
    }

    @Test
    void testSeveralSuitesShareOneFile() throws Exception {
        JsonLinesReporter reporter = new JsonLinesReporter(tempDir);
        SimpleSuite other = new SimpleSuite("other") {
            {
                pureTest("one", () -> success());
            }
        };
        try (Runner runner = Runner.builder().options(RunnerOptions.defaults()).build()) {
            runner.runAll(List.of(new CheckoutSuite(), other), List.of(), reporter);
        } finally {
            reporter.close();
        }
        List<Map<String, Object>> lines = readLines(reporter.getPath());
        assertEquals(8, lines.size());
        assertEquals("suite", lines.get(5).get("t"));
        assertEquals("other", lines.get(5).get("name"));
        assertEquals("other", lines.get(6).get("suite"));
    }

    @Test
    void testNothingWrittenBeforeSuiteStart() throws Exception {
        JsonLinesReporter reporter = new JsonLinesReporter(tempDir);
        reporter.close();
        assertFalse(Files.exists(reporter.getPath()));
    }

}
