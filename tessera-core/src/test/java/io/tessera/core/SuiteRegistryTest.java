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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SuiteRegistryTest {

    private static TestInvocation<Void> test(String name) {
        return new TestInvocation<>(name, null, (r, log) -> Verdict.success());
    }

    @Test
    void testRegistrationOrderPreserved() {
        SuiteRegistry<Void> registry = new SuiteRegistry<>("suite");
        registry.register(test("b"));
        registry.register(test("a"));
        registry.register(test("c"));
        List<TestInvocation<Void>> frozen = registry.freeze();
        assertEquals(List.of("b", "a", "c"), frozen.stream().map(TestInvocation::getName).toList());
    }

    @Test
    void testDuplicateNamesKept() {
        SuiteRegistry<Void> registry = new SuiteRegistry<>("suite");
        registry.register(test("same"));
        registry.register(test("same"));
        assertEquals(2, registry.freeze().size());
    }

    @Test
    void testRegisterAfterFreezeFails() {
        SuiteRegistry<Void> registry = new SuiteRegistry<>("my.Suite");
        registry.register(test("first"));
        registry.freeze();
        SuiteFrozenException e = assertThrows(SuiteFrozenException.class, () -> registry.register(test("late")));
        assertEquals("my.Suite", e.getSuiteName());
        assertEquals("late", e.getTestName());
        assertEquals(1, registry.freeze().size());
    }

    @Test
    void testFreezeIsIdempotentAndReadOnly() {
        SuiteRegistry<Void> registry = new SuiteRegistry<>("suite");
        registry.register(test("a"));
        assertFalse(registry.isFrozen());
        List<TestInvocation<Void>> first = registry.freeze();
        assertTrue(registry.isFrozen());
        assertSame(first, registry.freeze());
        assertThrows(UnsupportedOperationException.class, () -> first.add(test("b")));
    }

    @Test
    void testConcurrentRegistrationAndFreeze() throws Exception {
        SuiteRegistry<Void> registry = new SuiteRegistry<>("suite");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        try {
            for (int i = 0; i < 200; i++) {
                String name = "t" + i;
                executor.execute(() -> {
                    try {
                        start.await();
                        registry.register(test(name));
                        accepted.incrementAndGet();
                    } catch (SuiteFrozenException e) {
                        rejected.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
            List<TestInvocation<Void>> frozen = registry.freeze();
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            // every registration either made it into the snapshot or was rejected
            assertEquals(accepted.get(), frozen.size());
            assertEquals(200, accepted.get() + rejected.get());
        } finally {
            executor.shutdownNow();
        }
    }

}
