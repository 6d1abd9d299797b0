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

import java.util.concurrent.Callable;

/**
 * Acquire / release pair describing how a suite resource is obtained and disposed of.
 * Whether one instance is shared by all tests or one is created per test is decided
 * by the {@link ResourceStrategy} the suite uses, not by the scope.
 *
 * @param <R> the resource type
 */
public interface ResourceScope<R> {

    R acquire() throws Exception;

    void release(R resource) throws Exception;

    @FunctionalInterface
    interface Releaser<R> {
        void release(R resource) throws Exception;
    }

    static <R> ResourceScope<R> of(Callable<R> acquire, Releaser<R> release) {
        return new ResourceScope<>() {
            @Override
            public R acquire() throws Exception {
                return acquire.call();
            }

            @Override
            public void release(R resource) throws Exception {
                release.release(resource);
            }
        };
    }

    /**
     * A scope whose acquisition creates the value and whose release does nothing.
     */
    static <R> ResourceScope<R> of(Callable<R> acquire) {
        return of(acquire, r -> {
        });
    }

    /**
     * Always hands out the same, already existing value.
     */
    static <R> ResourceScope<R> pure(R value) {
        return of(() -> value);
    }

    static ResourceScope<Void> none() {
        return pure(null);
    }

    /**
     * Releases by calling {@link AutoCloseable#close()}.
     */
    static <R extends AutoCloseable> ResourceScope<R> closeable(Callable<R> acquire) {
        return of(acquire, AutoCloseable::close);
    }

}
