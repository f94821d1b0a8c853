package com.pwsrelay.core.model;

import java.util.Locale;

/**
 * Unit system requested from the upstream API. {@link #apiCode()} goes on the wire,
 * {@link #recordKey()} names the nested observation sub-record holding unit-bearing values.
 */
public enum UnitSystem {
    METRIC("m", "metric"),
    IMPERIAL("e", "imperial");

    private final String apiCode;
    private final String recordKey;

    UnitSystem(String apiCode, String recordKey) {
        this.apiCode = apiCode;
        this.recordKey = recordKey;
    }

    public String apiCode() {
        return apiCode;
    }

    public String recordKey() {
        return recordKey;
    }

    public static UnitSystem parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("unit system is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (UnitSystem system : values()) {
            if (system.apiCode.equals(normalized) || system.recordKey.equals(normalized)) {
                return system;
            }
        }
        throw new IllegalArgumentException("Unsupported unit system: " + value);
    }
}
