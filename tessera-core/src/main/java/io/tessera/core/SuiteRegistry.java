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
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered list of the tests registered on a suite. Open for registration until the
 * first execution request, read-only afterwards.
 * <p>
 * Duplicate names are accepted and each registration runs as its own test.
 *
 * @param <R> the suite resource type
 */
public class SuiteRegistry<R> {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final String suiteName;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<TestInvocation<R>> entries = new ArrayList<>();

    private List<TestInvocation<R>> snapshot;

    public SuiteRegistry(String suiteName) {
        this.suiteName = suiteName;
    }

    /**
     * Appends a test.
     *
     * @throws SuiteFrozenException if {@link #freeze()} was already called
     */
    public void register(TestInvocation<R> test) {
        lock.lock();
        try {
            if (snapshot != null) {
                throw new SuiteFrozenException(suiteName, test.getName());
            }
            entries.add(test);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the registry to new tests and returns its entries in registration order.
     * Subsequent calls return the same list.
     */
    public List<TestInvocation<R>> freeze() {
        lock.lock();
        try {
            if (snapshot == null) {
                snapshot = Collections.unmodifiableList(new ArrayList<>(entries));
                logger.debug("suite {} initialized with {} test(s)", suiteName, snapshot.size());
            }
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFrozen() {
        lock.lock();
        try {
            return snapshot != null;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public String getSuiteName() {
        return suiteName;
    }

}
