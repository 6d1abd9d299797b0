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

import io.tessera.core.Globals;
import io.tessera.core.Outcome;
import io.tessera.core.OutcomeReporter;
import io.tessera.core.Suite;
import io.tessera.core.SuiteResult;
import org.slf4j.Logger;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streams outcomes to a JSON Lines file as they are reported, so the file can be
 * tailed during a run. Several suites run with the same reporter append to the same file.
 * <pre>
 * {"t":"suite","name":"io.example.UserApiSuite","time":"2026-01-01T10:30:00Z","version":"..."}
 * {"t":"outcome","suite":"io.example.UserApiSuite","name":"get user","status":"success","durationMillis":12,...}
 * {"t":"suite_end","name":"io.example.UserApiSuite","passed":3,"failed":1,"cancelled":0,"ignored":1,"ms":120}
 * </pre>
 * Write errors are logged and do not fail the run.
 */
public class JsonLinesReporter implements OutcomeReporter, Closeable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String DEFAULT_FILE_NAME = "tessera-results.jsonl";

    private final Path path;
    private BufferedWriter writer;
    private String suiteName;

    public JsonLinesReporter(Path outputDir) {
        this.path = outputDir.resolve(DEFAULT_FILE_NAME);
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void onSuiteStart(Suite suite) {
        suiteName = suite.getName();
        try {
            if (writer == null) {
                Files.createDirectories(path.getParent());
                writer = Files.newBufferedWriter(path,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE);
            }
            Map<String, Object> header = new LinkedHashMap<>();
            header.put("t", "suite");
            header.put("name", suiteName);
            header.put("time", Instant.now().toString());
            header.put("version", Globals.TESSERA_VERSION);
            writeLine(header);
            logger.debug("json lines report started: {}", path);
        } catch (IOException e) {
            logger.warn("failed to start json lines report {}: {}", path, e.getMessage());
        }
    }

    @Override
    public void report(Outcome outcome) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("t", "outcome");
        line.put("suite", suiteName);
        line.putAll(outcome.toJson());
        try {
            writeLine(line);
        } catch (IOException e) {
            logger.warn("failed to write outcome {} to json lines report: {}", outcome.getName(), e.getMessage());
        }
    }

    @Override
    public void onSuiteEnd(SuiteResult result) {
        Map<String, Object> end = new LinkedHashMap<>();
        end.put("t", "suite_end");
        end.put("name", result.getSuiteName());
        end.put("passed", result.getPassedCount());
        end.put("failed", result.getFailedCount());
        end.put("cancelled", result.getCancelledCount());
        end.put("ignored", result.getIgnoredCount());
        end.put("aborted", result.isAborted());
        end.put("ms", result.getDurationMillis());
        try {
            writeLine(end);
        } catch (IOException e) {
            logger.warn("failed to complete json lines report: {}", e.getMessage());
        }
    }

    /**
     * Closes the underlying file. Reporting more suites afterwards reopens and truncates it.
     */
    @Override
    public synchronized void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
            logger.info("json lines report written to: {}", path);
        }
    }

    private synchronized void writeLine(Map<String, Object> map) throws IOException {
        if (writer != null) {
            writer.write(Json.stringify(map));
            writer.newLine();
            writer.flush();
        }
    }

}
