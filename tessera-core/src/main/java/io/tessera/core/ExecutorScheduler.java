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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link Scheduler} backed by an {@link ExecutorService} supplied by the caller.
 * The executor is never shut down by the scheduler.
 */
public class ExecutorScheduler implements Scheduler {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final ExecutorService executor;

    public ExecutorScheduler(ExecutorService executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.executor = executor;
    }

    @Override
    public OutcomeStream run(List<? extends Callable<Outcome>> tasks, int parallelism) {
        if (tasks.isEmpty()) {
            return OutcomeStream.empty();
        }
        int window = Math.min(Math.max(1, parallelism), tasks.size());
        return new ScheduledStream(new ArrayList<>(tasks), window);
    }

    private static final int PENDING = 0;
    private static final int RUNNING = 1;
    private static final int DONE = 2;
    private static final int SKIPPED = 3;

    private final class ScheduledStream extends OutcomeStream {

        private final List<Callable<Outcome>> tasks;
        private final int window;

        private final ReentrantLock lock = new ReentrantLock();
        private final Condition changed = lock.newCondition();
        private final Deque<Slot> completed = new ArrayDeque<>();
        private final List<Slot> inFlight = new ArrayList<>();

        private int nextIndex;
        private boolean cancelled;

        ScheduledStream(List<Callable<Outcome>> tasks, int window) {
            this.tasks = tasks;
            this.window = window;
        }

        @Override
        protected Outcome computeNext() {
            lock.lock();
            try {
                fill();
                while (completed.isEmpty()) {
                    if (inFlight.isEmpty() || cancelled) {
                        return null;
                    }
                    try {
                        changed.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new SchedulerException("interrupted while waiting for test outcome", e);
                    }
                }
                Slot slot = completed.poll();
                // keep the window full while the caller handles this outcome
                fill();
                if (slot.error != null) {
                    throw new SchedulerException("test task failed unexpectedly", slot.error);
                }
                return slot.outcome;
            } finally {
                lock.unlock();
            }
        }

        private void fill() {
            while (!cancelled && inFlight.size() < window && nextIndex < tasks.size()) {
                Slot slot = new Slot(tasks.get(nextIndex++));
                inFlight.add(slot);
                try {
                    executor.execute(slot);
                } catch (RejectedExecutionException e) {
                    inFlight.remove(slot);
                    throw new SchedulerException("executor rejected test task", e);
                }
            }
        }

        private void complete(Slot slot) {
            lock.lock();
            try {
                inFlight.remove(slot);
                if (!cancelled) {
                    completed.add(slot);
                }
                changed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        @Override
        protected void doClose() {
            lock.lock();
            try {
                cancelled = true;
                completed.clear();
                inFlight.removeIf(Slot::skip);
                if (!inFlight.isEmpty()) {
                    logger.debug("run closed, stopping {} running test(s)", inFlight.size());
                    inFlight.forEach(Slot::interrupt);
                }
                changed.signalAll();
                boolean interrupted = false;
                while (!inFlight.isEmpty()) {
                    try {
                        changed.await();
                    } catch (InterruptedException e) {
                        interrupted = true;
                    }
                }
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            } finally {
                lock.unlock();
            }
        }

        private final class Slot implements Runnable {

            private final Callable<Outcome> task;
            private final AtomicInteger state = new AtomicInteger(PENDING);
            private Thread thread;
            private boolean stopRequested;
            private Outcome outcome;
            private Throwable error;

            Slot(Callable<Outcome> task) {
                this.task = task;
            }

            @Override
            public void run() {
                if (!state.compareAndSet(PENDING, RUNNING)) {
                    return;
                }
                synchronized (this) {
                    thread = Thread.currentThread();
                    if (stopRequested) {
                        thread.interrupt();
                    }
                }
                try {
                    outcome = task.call();
                    if (outcome == null) {
                        error = new IllegalStateException("test task produced no outcome");
                    }
                } catch (Throwable t) {
                    error = t;
                } finally {
                    synchronized (this) {
                        thread = null;
                        // an interrupt aimed at this task must not leak into the next one on this thread
                        Thread.interrupted();
                    }
                    state.set(DONE);
                    complete(this);
                }
            }

            boolean skip() {
                return state.compareAndSet(PENDING, SKIPPED);
            }

            synchronized void interrupt() {
                stopRequested = true;
                if (thread != null) {
                    thread.interrupt();
                }
            }

        }

    }

}
