package com.pwsrelay.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pwsrelay.acquisition.config.AcquisitionConfig;
import com.pwsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public final class ConfigLoader {
    public static final String ACQUISITION_FILE = "acquisition.json";
    public static final String GROUPS_FILE = "groups.json";

    private ConfigLoader() {
    }

    public static AcquisitionSettings loadSettings(Path configDir) {
        return read(configDir.resolve(ACQUISITION_FILE), new TypeReference<>() {
        });
    }

    // Optional multi-group layout: an array of settings objects, one coordinator each.
    public static List<AcquisitionSettings> loadGroups(Path configDir) {
        Path groups = configDir.resolve(GROUPS_FILE);
        if (!Files.exists(groups)) {
            return List.of(loadSettings(configDir));
        }
        return read(groups, new TypeReference<>() {
        });
    }

    public static AcquisitionConfig loadAcquisition(Path configDir, Map<String, String> environment) {
        return validate(configDir.resolve(ACQUISITION_FILE), loadSettings(configDir), environment);
    }

    public static List<AcquisitionConfig> loadConfigs(Path configDir, Map<String, String> environment) {
        Path groups = configDir.resolve(GROUPS_FILE);
        Path source = Files.exists(groups) ? groups : configDir.resolve(ACQUISITION_FILE);
        return loadGroups(configDir).stream()
                .map(settings -> validate(source, settings, environment))
                .toList();
    }

    private static AcquisitionConfig validate(Path path, AcquisitionSettings settings, Map<String, String> environment) {
        try {
            return settings.toConfig(environment);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid config in " + path + ": " + e.getMessage(), e);
        }
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
