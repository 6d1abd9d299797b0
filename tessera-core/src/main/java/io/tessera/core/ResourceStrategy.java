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

import java.util.List;

/**
 * Decides how many resource instances a run needs and when they are acquired and
 * released, then delegates execution to a {@link Scheduler}.
 *
 * @param <R> the resource type
 */
public abstract class ResourceStrategy<R> {

    protected final String owner;
    protected final ResourceScope<R> scope;

    protected ResourceStrategy(String owner, ResourceScope<R> scope) {
        if (scope == null) {
            throw new IllegalArgumentException("resource scope must not be null: " + owner);
        }
        this.owner = owner;
        this.scope = scope;
    }

    public abstract OutcomeStream apply(List<TestInvocation<R>> tests, int parallelism, Scheduler scheduler);

    protected R acquire(String forWhat) {
        try {
            return scope.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ResourceException.acquire(forWhat, e);
        } catch (Throwable t) {
            if (TestInvocation.isFatal(t)) {
                throw (Error) t;
            }
            throw ResourceException.acquire(forWhat, t);
        }
    }

    protected void release(R resource, String forWhat) {
        try {
            scope.release(resource);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ResourceException.release(forWhat, e);
        } catch (Throwable t) {
            if (TestInvocation.isFatal(t)) {
                throw (Error) t;
            }
            throw ResourceException.release(forWhat, t);
        }
    }

}
