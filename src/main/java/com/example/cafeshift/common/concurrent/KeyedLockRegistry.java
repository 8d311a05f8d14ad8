package com.example.cafeshift.common.concurrent;

import com.example.cafeshift.exception.ConflictException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Logical locks keyed by string. Waits are always bounded; a caller that cannot get the lock in
 * time gets a {@link ConflictException}. A key's entry lives only while someone holds or waits
 * for it.
 */
@Component
public class KeyedLockRegistry {

    private final Map<String, KeyLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Duration timeout, Supplier<T> action) {
        KeyLock keyLock = retain(key);
        boolean acquired = false;
        try {
            try {
                acquired = keyLock.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConflictException("Interrupted while waiting for lock " + key, e);
            }
            if (!acquired) {
                throw new ConflictException("Another operation holds " + key + "; try again later");
            }
            return action.get();
        } finally {
            if (acquired) {
                keyLock.lock.unlock();
            }
            release(key);
        }
    }

    public boolean isLocked(String key) {
        KeyLock keyLock = locks.get(key);
        return keyLock != null && keyLock.lock.isLocked();
    }

    int trackedKeys() {
        return locks.size();
    }

    // users is only read and written inside compute, which is atomic per key
    private KeyLock retain(String key) {
        return locks.compute(key, (k, existing) -> {
            KeyLock keyLock = existing == null ? new KeyLock() : existing;
            keyLock.users++;
            return keyLock;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, keyLock) -> --keyLock.users == 0 ? null : keyLock);
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
