package com.dsync.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PairLockRegistryTest {

    private final PairLockRegistry registry = new PairLockRegistry();

    @Test
    void shouldHoldLockOnlyDuringAction() {
        String key = PairLockRegistry.threadKey("1000");

        boolean heldInside = registry.withLock(key, () -> registry.isLocked(key));

        assertTrue(heldInside);
        assertFalse(registry.isLocked(key));
    }

    @Test
    void shouldAllowNestedLockOnSameKey() {
        String key = PairLockRegistry.discussionKey("D_1");

        String result = registry.withLock(key, () -> registry.withLock(key, () -> "inner"));

        assertEquals("inner", result);
    }

    @Test
    void shouldKeepDiscussionAndThreadKeysApart() {
        assertEquals("discussion:42", PairLockRegistry.discussionKey("42"));
        assertEquals("thread:42", PairLockRegistry.threadKey("42"));
    }

    @Test
    void shouldSerializeActionsOnSameKey() throws Exception {
        String key = PairLockRegistry.threadKey("1000");
        int[] counter = {0};
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        registry.withLock(key, () -> {
                            int value = counter[0];
                            Thread.yield();
                            counter[0] = value + 1;
                            return null;
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(2000, counter[0]);
        assertEquals(0, registry.size());
    }

    @Test
    void shouldForgetKeysOnceReleased() {
        String outer = PairLockRegistry.discussionKey("D_1");
        String inner = PairLockRegistry.threadKey("1000");

        int heldInside = registry.withLock(outer, () -> registry.withLock(inner, registry::size));
        int afterNested = registry.withLock(outer, () -> registry.withLock(outer, registry::size));

        assertEquals(2, heldInside);
        assertEquals(1, afterNested);
        assertEquals(0, registry.size());
        assertFalse(registry.isLocked(outer));
    }
}
