package com.disasteralert.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of one disaster event: canonical location plus lower-cased disaster type.
 */
public record EventKey(String location, String disasterType) {
    public EventKey {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(disasterType, "disasterType is required");
        disasterType = disasterType.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return location + "/" + disasterType;
    }
}
