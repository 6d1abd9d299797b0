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
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Base class for suites whose tests receive a resource of type {@code R}.
 * Tests are registered from the constructor (or an initializer block) of the
 * concrete suite:
 * <pre>
 * class UserApiSuite extends SharedResourceSuite&lt;HttpClient&gt; {
 *
 *     UserApiSuite() {
 *         test("get user", client -&gt; expectEquals(200, client.get("/users/1").status()));
 *         test("list users", (client, log) -&gt; {
 *             log.info("calling /users");
 *             return expect(!client.get("/users").body().isEmpty(), "users present");
 *         });
 *     }
 *
 *     protected ResourceScope&lt;HttpClient&gt; sharedResource() {
 *         return ResourceScope.closeable(HttpClient::new);
 *     }
 * }
 * </pre>
 *
 * @param <R> the resource type
 */
public abstract class ResourceSuite<R> implements Suite {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    /** Parallelism used when a suite does not override {@link #maxParallelism()}. */
    public static final int DEFAULT_MAX_PARALLELISM = 10000;

    private final String name;
    private final SuiteRegistry<R> registry;

    protected ResourceSuite() {
        this(null);
    }

    protected ResourceSuite(String name) {
        this.name = name != null ? name : getClass().getName().replace("$", "");
        this.registry = new SuiteRegistry<>(this.name);
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Upper bound on the number of tests of this suite running at the same time.
     * Values below 1 are treated as 1, which runs tests one by one in registration order.
     */
    protected int maxParallelism() {
        return DEFAULT_MAX_PARALLELISM;
    }

    /**
     * How the suite resource is shared between tests.
     */
    protected abstract ResourceStrategy<R> strategy();

    @Override
    public OutcomeStream spec(List<String> args, Scheduler scheduler) {
        List<TestInvocation<R>> tests = registry.freeze();
        Predicate<String> filter = NameFilter.of(name, args);
        List<TestInvocation<R>> selected = new ArrayList<>(tests.size());
        for (TestInvocation<R> test : tests) {
            if (filter.test(test.getName())) {
                selected.add(test);
            }
        }
        int parallelism = Math.max(1, maxParallelism());
        logger.debug("suite {}: {} of {} test(s) selected, parallelism {}", name, selected.size(), tests.size(), parallelism);
        return strategy().apply(selected, parallelism, scheduler);
    }

    // ========== Registration ==========

    protected void registerTest(String testName, TestBody<R> body) {
        registry.register(new TestInvocation<>(testName, SourceLocation.capture().orElse(null), body));
    }

    /**
     * A test that needs neither the resource nor the log.
     */
    public void pureTest(String testName, Supplier<Verdict> run) {
        registerTest(testName, (r, log) -> run.get());
    }

    public void test(String testName, Callable<Verdict> run) {
        registerTest(testName, (r, log) -> run.call());
    }

    public void test(String testName, ResourceTest<R> run) {
        registerTest(testName, (r, log) -> run.run(r));
    }

    public void test(String testName, LoggedResourceTest<R> run) {
        registerTest(testName, run::run);
    }

    public void loggedTest(String testName, LoggedTest run) {
        registerTest(testName, (r, log) -> run.run(log));
    }

    public int getTestCount() {
        return registry.size();
    }

    @FunctionalInterface
    public interface ResourceTest<R> {
        Verdict run(R resource) throws Exception;
    }

    @FunctionalInterface
    public interface LoggedResourceTest<R> {
        Verdict run(R resource, TestLog log) throws Exception;
    }

    @FunctionalInterface
    public interface LoggedTest {
        Verdict run(TestLog log) throws Exception;
    }

    // ========== Verdict helpers ==========

    protected static Verdict success() {
        return Verdict.success();
    }

    protected static Verdict failure(String message) {
        return Verdict.failure(message);
    }

    protected static Verdict expect(boolean condition, String message) {
        return Verdict.expect(condition, message);
    }

    protected static Verdict expectEquals(Object expected, Object actual) {
        return Verdict.expectEquals(expected, actual);
    }

    /**
     * Marks the running test as cancelled.
     */
    protected static Verdict cancel(String reason) {
        return Verdict.cancel(reason);
    }

    /**
     * Marks the running test as ignored.
     */
    protected static Verdict ignore(String reason) {
        return Verdict.ignore(reason);
    }

}
