package com.pwsrelay.core.model;

import java.util.Objects;

/**
 * One configured weather station. Lower {@code priority} values win; ties keep configuration order.
 */
public record SourceConfig(String id, int priority, String displayName) {
    public SourceConfig {
        Objects.requireNonNull(id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("source id must not be blank");
        }
        id = id.trim();
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
    }

    public static SourceConfig single(String id) {
        return new SourceConfig(id, 1, id);
    }
}
