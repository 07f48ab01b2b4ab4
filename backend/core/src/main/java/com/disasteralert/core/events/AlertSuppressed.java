package com.disasteralert.core.events;

import java.time.Instant;

public record AlertSuppressed(Instant timestamp, String location, String disasterType, int reportCount) implements Event {
    @Override
    public String type() {
        return "AlertSuppressed";
    }
}
