package com.disasteralert.core.util;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion per key. An entry exists only while some thread holds or waits for its lock,
 * so the map stays as small as the set of keys in flight.
 */
public final class KeyedLocks<K> {
    private final ConcurrentHashMap<K, Entry> entries = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        Entry entry = entries.compute(key, (ignored, existing) -> {
            Entry held = existing == null ? new Entry() : existing;
            held.holders++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            entries.compute(key, (ignored, existing) -> --existing.holders == 0 ? null : existing);
        }
    }

    public int size() {
        return entries.size();
    }

    // holders is only touched inside compute, which runs atomically per key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
