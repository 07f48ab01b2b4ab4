package com.disasteralert.core.events;

import java.time.Instant;

public record DeliveryFailed(
        Instant timestamp,
        String location,
        String disasterType,
        String recipient,
        String message
) implements Event {
    @Override
    public String type() {
        return "DeliveryFailed";
    }
}
