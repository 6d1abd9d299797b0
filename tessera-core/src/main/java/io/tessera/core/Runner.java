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
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Drives suites: obtains each suite's outcome stream, drains it into the reporter
 * and makes sure the stream is closed (releasing resources) on every exit path.
 * <p>
 * Example usage:
 * <pre>
 * try (Runner runner = Runner.builder().executor(executor).build()) {
 *     SuiteResult result = runner.run(new UserApiSuite(), List.of("-o", "*users*"), new ConsoleReporter());
 * }
 * </pre>
 * Engine errors ({@link TesseraException}s such as a failed shared resource, or
 * registration after the suite started) and errors thrown by the reporter are passed
 * through the configured error adapter before being rethrown. Failing tests are never
 * errors: they are reported as outcomes.
 */
public final class Runner implements AutoCloseable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Scheduler scheduler;
    private final ExecutorService ownedExecutor;
    private final Function<RuntimeException, ? extends RuntimeException> errorAdapter;
    private final RunnerOptions options;
    private final Set<OutcomeStream> active = ConcurrentHashMap.newKeySet();

    private volatile boolean cancelled;

    private Runner(Builder builder) {
        this.options = builder.options;
        this.errorAdapter = builder.errorAdapter;
        Scheduler base;
        if (builder.scheduler != null) {
            base = builder.scheduler;
            ownedExecutor = null;
        } else if (builder.executor != null) {
            base = new ExecutorScheduler(builder.executor);
            ownedExecutor = null;
        } else {
            ownedExecutor = Executors.newCachedThreadPool(new WorkerThreadFactory());
            base = new ExecutorScheduler(ownedExecutor);
        }
        int cap = options.getParallelismCap();
        this.scheduler = cap == Integer.MAX_VALUE ? base : (tasks, parallelism) -> base.run(tasks, Math.min(parallelism, cap));
        if (options.getLogLevel() != null) {
            LogContext.setRuntimeLogLevel(options.getLogLevel());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the suite, reporting each outcome as it is produced, and returns once every
     * selected test has been reported (or the run failed or was cancelled).
     */
    public SuiteResult run(Suite suite, List<String> args, OutcomeReporter reporter) {
        List<String> effectiveArgs = options.mergeArgs(args);
        SuiteResult result = new SuiteResult(suite.getName());
        result.setStartTime(System.currentTimeMillis());
        reporter.onSuiteStart(suite);
        logger.debug("running suite {} with args {}", suite.getName(), effectiveArgs);
        RuntimeException error = null;
        OutcomeStream stream = null;
        try {
            stream = suite.spec(effectiveArgs, scheduler);
            active.add(stream);
            if (cancelled) {
                stream.close();
            }
            while (stream.hasNext()) {
                Outcome outcome = stream.next();
                result.addOutcome(outcome);
                reporter.report(outcome);
            }
        } catch (RuntimeException e) {
            error = e;
        } finally {
            if (stream != null) {
                active.remove(stream);
                error = closeStream(stream, error);
            }
        }
        if (error != null) {
            result.setAborted(true);
            logger.error("suite {} aborted: {}", suite.getName(), error.getMessage());
            error = adapt(error);
        } else if (cancelled) {
            result.setAborted(true);
            logger.warn("suite {} cancelled after {} outcome(s)", suite.getName(), result.getTestCount());
        }
        result.setEndTime(System.currentTimeMillis());
        try {
            reporter.onSuiteEnd(result);
        } catch (RuntimeException e) {
            if (error == null) {
                throw adapt(e);
            }
            error.addSuppressed(e);
        }
        if (error != null) {
            throw error;
        }
        return result;
    }

    /**
     * Closes the stream, keeping the first error and suppressing any later one.
     */
    private static RuntimeException closeStream(OutcomeStream stream, RuntimeException error) {
        try {
            stream.close();
        } catch (RuntimeException e) {
            if (error == null) {
                return e;
            }
            if (error != e) {
                error.addSuppressed(e);
            }
        }
        return error;
    }

    public SuiteResult run(Suite suite, List<String> args) {
        return run(suite, args, OutcomeReporter.none());
    }

    public SuiteResult run(Suite suite) {
        return run(suite, Collections.emptyList(), OutcomeReporter.none());
    }

    /**
     * Runs suites one after another with the same arguments and reporter.
     * Stops at the first suite whose run raises an engine error.
     */
    public List<SuiteResult> runAll(List<? extends Suite> suites, List<String> args, OutcomeReporter reporter) {
        List<SuiteResult> results = new ArrayList<>(suites.size());
        for (Suite suite : suites) {
            if (cancelled) {
                break;
            }
            results.add(run(suite, args, reporter));
        }
        return results;
    }

    /**
     * Stops the runs in progress from any thread. Running tests are interrupted,
     * pending ones are skipped and acquired resources are released. The interrupted
     * runs return normally with an aborted {@link SuiteResult}.
     */
    public void cancel() {
        cancelled = true;
        for (OutcomeStream stream : active) {
            try {
                stream.close();
            } catch (RuntimeException e) {
                logger.warn("error while cancelling run: {}", e.getMessage());
            }
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private RuntimeException adapt(RuntimeException e) {
        RuntimeException adapted = errorAdapter.apply(e);
        return adapted == null ? e : adapted;
    }

    /**
     * Shuts down the executor if the runner created it. An executor passed to the
     * builder is left alone.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    // ========== Builder ==========

    public static class Builder {

        private ExecutorService executor;
        private Scheduler scheduler;
        private Function<RuntimeException, ? extends RuntimeException> errorAdapter = Function.identity();
        private RunnerOptions options = RunnerOptions.fromSystemProperties();

        Builder() {
        }

        /**
         * Executor the tests run on. Without one the runner creates (and owns) a cached
         * thread pool, so parallelism is only limited by the suites.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Replaces the executor-based scheduler entirely.
         */
        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Translates errors escaping a run into the caller's own exception types.
         * Returning null keeps the original error.
         */
        public Builder adaptError(Function<RuntimeException, ? extends RuntimeException> errorAdapter) {
            this.errorAdapter = errorAdapter == null ? Function.identity() : errorAdapter;
            return this;
        }

        public Builder options(RunnerOptions options) {
            this.options = options == null ? RunnerOptions.defaults() : options;
            return this;
        }

        public Runner build() {
            return new Runner(this);
        }

    }

    private static class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "tessera-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }

    }

}
