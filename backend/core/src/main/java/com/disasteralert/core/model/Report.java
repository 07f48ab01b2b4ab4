package com.disasteralert.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One analyzed disaster report as handed over by the extraction pipeline.
 * Optional fields carry {@link #NOT_AVAILABLE} instead of {@code null}.
 */
public record Report(
        @JsonProperty("author_id") String authorId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("text") String text,
        @JsonProperty("extracted_location") String extractedLocation,
        @JsonProperty("disaster_type") String disasterType,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("detected_landmark") String detectedLandmark
) {
    public static final String NOT_AVAILABLE = "N/A";

    public Report {
        extractedLocation = orNotAvailable(extractedLocation);
        disasterType = orNotAvailable(disasterType);
        imageUrl = orNotAvailable(imageUrl);
        detectedLandmark = orNotAvailable(detectedLandmark);
    }

    public boolean hasEventIdentity() {
        return present(extractedLocation) && present(disasterType);
    }

    public boolean hasImage() {
        return present(imageUrl);
    }

    public boolean hasLandmark() {
        return present(detectedLandmark);
    }

    public static boolean present(String value) {
        return value != null && !value.isBlank() && !NOT_AVAILABLE.equalsIgnoreCase(value.trim());
    }

    private static String orNotAvailable(String value) {
        return value == null || value.isBlank() ? NOT_AVAILABLE : value;
    }
}
