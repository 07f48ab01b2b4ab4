package com.disasteralert.engine.dispatch;

import com.disasteralert.core.model.EventKey;
import com.disasteralert.core.util.KeyedLocks;

import java.util.function.Supplier;

/**
 * One lock per event key, held across the check, send and record steps for that key only.
 * Locks for keys no longer in flight are dropped.
 */
public final class EventKeyLocks {
    private final KeyedLocks<EventKey> locks = new KeyedLocks<>();

    public <T> T withLock(EventKey key, Supplier<T> action) {
        return locks.withLock(key, action);
    }

    int size() {
        return locks.size();
    }
}
