package com.disasteralert.core.events;

import java.time.Instant;

/**
 * Summary of one dispatch pass. Every event key is counted in exactly one bucket.
 */
public record DispatchPassCompleted(
        Instant timestamp,
        int sent,
        int suppressed,
        int skipped,
        int unlogged,
        int failed,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "DispatchPassCompleted";
    }
}
