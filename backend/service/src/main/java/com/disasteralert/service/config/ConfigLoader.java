package com.disasteralert.service.config;

import com.disasteralert.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static AlertingConfig loadAlerting(Path configDir) {
        Path path = configDir.resolve("alerting.json");
        if (!Files.exists(path)) {
            LOGGER.info("No " + path + " found; using default alerting settings");
            return AlertingConfig.defaults();
        }
        AlertingConfig loaded = read(path, new TypeReference<>() {
        });
        return loaded == null ? AlertingConfig.defaults() : loaded;
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try {
            return JsonUtils.readFile(path, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
