package com.hotelbot.assistant.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process single-writer locks keyed by string (chat turns per user, settlement per booking).
 * Entries are dropped once no thread holds or waits on them.
 */
@Service
public class KeyedLockService {
    private static final Logger log = LoggerFactory.getLogger(KeyedLockService.class);

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    public static class LockTimeoutException extends RuntimeException {
        public LockTimeoutException(String key) {
            super("Timed out waiting for lock " + key);
        }
    }

    public <T> T withLock(String key, long waitMs, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, e) -> {
            Entry v = e == null ? new Entry() : e;
            v.users++;
            return v;
        });
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(waitMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(key);
            }
            if (!acquired) {
                log.warn("[KeyedLock] lock busy: key={}, waitMs={}", key, waitMs);
                throw new LockTimeoutException(key);
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    int size() {
        return locks.size();
    }
}
