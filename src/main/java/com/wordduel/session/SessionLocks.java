package com.wordduel.session;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single-writer lock per key (a session id, or a creator identity while a session is created) for this process. Cross-process writers are kept apart by the
 * version compare-and-swap in the store.
 */
@Component
public class SessionLocks {
    private final Map<Object, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Object key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the lock of a key that will not be written again, such as a completed session.
     */
    public void release(Object key) {
        locks.remove(key);
    }
}
