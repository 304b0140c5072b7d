package com.dsync.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per discussion and per thread, so that two triggers never work on the same linked
 * pair at the same time.
 * <p>
 * Discussion-side routines take the discussion lock and then the thread lock; thread-side
 * routines only take the thread lock. Locks are never taken in the opposite order.
 */
@Component
public class PairLockRegistry {

    // entries are dropped once no thread holds or waits for them
    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();

    public static String discussionKey(String discussionId) {
        return "discussion:" + discussionId;
    }

    public static String threadKey(String threadId) {
        return "thread:" + threadId;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        LockEntry entry = locks.compute(key, (k, current) -> {
            LockEntry acquired = current == null ? new LockEntry() : current;
            acquired.users++;
            return acquired;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, current) -> --current.users == 0 ? null : current);
        }
    }

    public boolean isLocked(String key) {
        LockEntry entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    /**
     * Number of keys currently held or waited for.
     */
    public int size() {
        return locks.size();
    }

    private static final class LockEntry {

        private final ReentrantLock lock = new ReentrantLock();

        // guarded by the map's per-key compute
        private int users;
    }
}
