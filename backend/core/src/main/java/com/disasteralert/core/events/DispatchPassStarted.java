package com.disasteralert.core.events;

import java.time.Instant;

public record DispatchPassStarted(Instant timestamp, int groupCount, int locationCount) implements Event {
    @Override
    public String type() {
        return "DispatchPassStarted";
    }
}
