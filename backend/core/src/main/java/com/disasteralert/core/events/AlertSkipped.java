package com.disasteralert.core.events;

import java.time.Instant;

public record AlertSkipped(Instant timestamp, String location, String disasterType, String reason) implements Event {
    @Override
    public String type() {
        return "AlertSkipped";
    }
}
