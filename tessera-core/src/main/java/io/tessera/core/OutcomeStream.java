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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A finite, lazy, single-use sequence of outcomes.
 * <p>
 * Nothing runs until {@link #hasNext()} is first called. {@link #hasNext()} blocks
 * until the next outcome is available. When the sequence is exhausted, fails, or is
 * closed early, the stream closes itself: running tests are stopped and the close
 * hooks (resource releases) run, last registered first.
 * <p>
 * Iteration must happen on one thread. {@link #close()} may be called from any
 * thread, which is how a whole run is cancelled.
 */
public abstract class OutcomeStream implements Iterator<Outcome>, AutoCloseable {

    private final AtomicBoolean closed = new AtomicBoolean();
    private final Deque<Runnable> closeHooks = new ArrayDeque<>();
    private final CountDownLatch closeDone = new CountDownLatch(1);
    private volatile Thread closer;

    private Outcome buffered;

    /**
     * Produce the next outcome, blocking if needed, or null when there are no more.
     */
    protected abstract Outcome computeNext();

    /**
     * Stop whatever is still running. Called once, before the close hooks.
     */
    protected void doClose() {
    }

    @Override
    public boolean hasNext() {
        if (buffered != null) {
            return true;
        }
        if (closed.get()) {
            return false;
        }
        Outcome next;
        try {
            next = computeNext();
        } catch (RuntimeException | Error e) {
            closeAfterFailure(e);
            throw e;
        }
        if (next == null) {
            close();
            return false;
        }
        buffered = next;
        return true;
    }

    @Override
    public Outcome next() {
        if (!hasNext()) {
            throw new NoSuchElementException("no more outcomes");
        }
        Outcome outcome = buffered;
        buffered = null;
        return outcome;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Register an action to run when this stream closes, for any reason.
     */
    public OutcomeStream onClose(Runnable hook) {
        synchronized (closeHooks) {
            closeHooks.push(hook);
        }
        return this;
    }

    /**
     * Stops running tests and runs the close hooks. If a hook fails, the remaining
     * hooks still run and the first failure is thrown with the others suppressed.
     * When another thread is already closing this stream, waits until it is done.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            awaitClosed();
            return;
        }
        closer = Thread.currentThread();
        try {
            runClose();
        } finally {
            closeDone.countDown();
        }
    }

    private void runClose() {
        RuntimeException failure = null;
        try {
            doClose();
        } catch (RuntimeException e) {
            failure = e;
        }
        while (true) {
            Runnable hook;
            synchronized (closeHooks) {
                hook = closeHooks.poll();
            }
            if (hook == null) {
                break;
            }
            try {
                hook.run();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void awaitClosed() {
        // a hook closing its own stream must not wait for itself
        if (closer == Thread.currentThread()) {
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                closeDone.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeAfterFailure(Throwable cause) {
        try {
            close();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Drains the remaining outcomes into a list and closes the stream.
     */
    public List<Outcome> toList() {
        List<Outcome> list = new ArrayList<>();
        try {
            while (hasNext()) {
                list.add(next());
            }
        } finally {
            close();
        }
        return list;
    }

    /**
     * View as a {@link Stream}; closing the returned stream closes this one.
     */
    public Stream<Outcome> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(this::close);
    }

    // ========== Factories ==========

    public static OutcomeStream empty() {
        return new OutcomeStream() {
            @Override
            protected Outcome computeNext() {
                return null;
            }
        };
    }

    public static OutcomeStream of(Outcome... outcomes) {
        Iterator<Outcome> it = Arrays.asList(outcomes).iterator();
        return new OutcomeStream() {
            @Override
            protected Outcome computeNext() {
                return it.hasNext() ? it.next() : null;
            }
        };
    }

    /**
     * A stream that is only created when first pulled. If it is closed before that,
     * the supplier never runs.
     */
    public static OutcomeStream defer(Supplier<OutcomeStream> supplier) {
        return new OutcomeStream() {

            private volatile OutcomeStream delegate;

            @Override
            protected Outcome computeNext() {
                if (delegate == null) {
                    delegate = supplier.get();
                    if (isClosed()) {
                        // closed from another thread while the delegate was being created
                        delegate.close();
                        return null;
                    }
                }
                return delegate.hasNext() ? delegate.next() : null;
            }

            @Override
            protected void doClose() {
                if (delegate != null) {
                    delegate.close();
                }
            }
        };
    }

    /**
     * Each stream is drained and closed before the next one is pulled.
     */
    public static OutcomeStream concat(OutcomeStream... streams) {
        Deque<OutcomeStream> remaining = new ConcurrentLinkedDeque<>(Arrays.asList(streams));
        return new OutcomeStream() {
            @Override
            protected Outcome computeNext() {
                while (!remaining.isEmpty()) {
                    OutcomeStream current = remaining.peek();
                    if (current.hasNext()) {
                        return current.next();
                    }
                    remaining.poll();
                }
                return null;
            }

            @Override
            protected void doClose() {
                RuntimeException failure = null;
                for (OutcomeStream stream : remaining) {
                    try {
                        stream.close();
                    } catch (RuntimeException e) {
                        if (failure == null) {
                            failure = e;
                        } else {
                            failure.addSuppressed(e);
                        }
                    }
                }
                if (failure != null) {
                    throw failure;
                }
            }
        };
    }

}
