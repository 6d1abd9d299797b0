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
 * One resource instance for the whole run. It is acquired when the outcome stream
 * is first pulled and released exactly once when the stream closes, whether it
 * ran to the end, failed or was closed early.
 * <p>
 * Tests running in parallel use the instance concurrently; the engine does not
 * synchronize access to it.
 */
public class SharedResourceStrategy<R> extends ResourceStrategy<R> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public SharedResourceStrategy(String owner, ResourceScope<R> scope) {
        super(owner, scope);
    }

    @Override
    public OutcomeStream apply(List<TestInvocation<R>> tests, int parallelism, Scheduler scheduler) {
        if (tests.isEmpty()) {
            logger.debug("no tests selected in {}, shared resource not acquired", owner);
            return OutcomeStream.empty();
        }
        return OutcomeStream.defer(() -> {
            R resource = acquire(owner);
            logger.debug("acquired shared resource for {}", owner);
            List<Callable<Outcome>> tasks = new ArrayList<>(tests.size());
            for (TestInvocation<R> test : tests) {
                tasks.add(() -> test.execute(resource));
            }
            OutcomeStream stream;
            try {
                stream = scheduler.run(tasks, parallelism);
            } catch (RuntimeException e) {
                try {
                    release(resource, owner);
                } catch (RuntimeException re) {
                    e.addSuppressed(re);
                }
                throw e;
            }
            return stream.onClose(() -> {
                release(resource, owner);
                logger.debug("released shared resource for {}", owner);
            });
        });
    }

}
