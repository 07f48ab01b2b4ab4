package com.disasteralert.engine.grouping;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps free-text location names onto canonical keys through a fixed alias table.
 */
public final class LocationNormalizer {
    public static final Map<String, String> DEFAULT_ALIASES = Map.of(
            "bangalore", "bengaluru",
            "bombay", "mumbai"
    );

    private final Map<String, String> aliases;

    public LocationNormalizer() {
        this(DEFAULT_ALIASES);
    }

    public LocationNormalizer(Map<String, String> aliases) {
        Map<String, String> lowered = new HashMap<>();
        aliases.forEach((alias, canonical) -> lowered.put(lower(alias), lower(canonical)));
        this.aliases = Map.copyOf(lowered);
    }

    public String normalize(String raw) {
        String lowered = lower(raw);
        return aliases.getOrDefault(lowered, lowered);
    }

    public Map<String, String> aliases() {
        return aliases;
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
