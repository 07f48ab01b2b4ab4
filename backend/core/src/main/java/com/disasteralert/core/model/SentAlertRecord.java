package com.disasteralert.core.model;

import java.time.Instant;

public record SentAlertRecord(String location, String disasterType, Instant sentAt) {
    public boolean matches(EventKey key) {
        return key.location().equals(location) && key.disasterType().equals(disasterType);
    }
}
