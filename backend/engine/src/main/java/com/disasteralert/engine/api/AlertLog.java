package com.disasteralert.engine.api;

import com.disasteralert.core.model.EventKey;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Append-only record of alerts already sent, used to suppress repeats.
 */
public interface AlertLog {
    /**
     * True when a record for exactly this key has {@code sentAt > now - window}.
     * A record sitting exactly on the cutoff counts as expired.
     */
    boolean wasRecentlySent(EventKey key, Duration window);

    void recordSent(EventKey key);

    /**
     * Runs {@code action} while holding an exclusive claim on {@code key} against every other
     * writer of the same log, including writers in other processes. Dispatch runs its check, send
     * and record steps inside this claim. Logs with a single in-process writer need no claim.
     */
    default <T> T withKeyLock(EventKey key, Supplier<T> action) {
        return action.get();
    }
}
