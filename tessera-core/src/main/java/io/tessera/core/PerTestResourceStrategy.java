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

/**
 * A fresh resource instance for every test, released as soon as that test is done.
 * A failure to acquire or release only affects the outcome of the test that owns
 * the instance.
 */
public class PerTestResourceStrategy<R> extends ResourceStrategy<R> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public PerTestResourceStrategy(String owner, ResourceScope<R> scope) {
        super(owner, scope);
    }

    @Override
    public OutcomeStream apply(List<TestInvocation<R>> tests, int parallelism, Scheduler scheduler) {
        if (tests.isEmpty()) {
            return OutcomeStream.empty();
        }
        List<Callable<Outcome>> tasks = new ArrayList<>(tests.size());
        for (TestInvocation<R> test : tests) {
            tasks.add(() -> runWithFreshResource(test));
        }
        return scheduler.run(tasks, parallelism);
    }

    private Outcome runWithFreshResource(TestInvocation<R> test) {
        String forWhat = owner + " / " + test.getName();
        R resource;
        try {
            resource = acquire(forWhat);
        } catch (ResourceException e) {
            logger.warn("{}", e.getMessage());
            return test.notRun(e);
        }
        Outcome outcome = null;
        try {
            outcome = test.execute(resource);
        } finally {
            try {
                release(resource, forWhat);
            } catch (ResourceException e) {
                logger.warn("{}", e.getMessage());
                if (outcome != null) {
                    outcome = outcome.withFailure(e);
                }
            }
        }
        return outcome;
    }

}
