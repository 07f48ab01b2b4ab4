package com.disasteralert.core.events;

import java.time.Instant;

public record AlertDispatched(
        Instant timestamp,
        String location,
        String disasterType,
        int reportCount,
        int recipients,
        int failedDeliveries,
        boolean logged
) implements Event {
    @Override
    public String type() {
        return "AlertDispatched";
    }
}
