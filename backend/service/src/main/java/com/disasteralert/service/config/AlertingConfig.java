package com.disasteralert.service.config;

import com.disasteralert.engine.api.DispatchContext;
import com.disasteralert.engine.grouping.LocationNormalizer;

import java.time.Duration;
import java.util.Map;

public record AlertingConfig(
        Duration suppressionWindow,
        Map<String, String> locationAliases,
        Integer deliveryThreads
) {
    public AlertingConfig {
        if (suppressionWindow == null) {
            suppressionWindow = DispatchContext.DEFAULT_SUPPRESSION_WINDOW;
        }
        if (locationAliases == null) {
            locationAliases = LocationNormalizer.DEFAULT_ALIASES;
        }
        if (deliveryThreads == null || deliveryThreads < 1) {
            deliveryThreads = 4;
        }
    }

    public static AlertingConfig defaults() {
        return new AlertingConfig(null, null, null);
    }
}
