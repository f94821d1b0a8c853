package com.pwsrelay.core.model;

import java.util.Locale;

public enum PrecisionMode {
    NONE("none"),
    DECIMAL("decimal");

    private final String apiValue;

    PrecisionMode(String apiValue) {
        this.apiValue = apiValue;
    }

    public String apiValue() {
        return apiValue;
    }

    public static PrecisionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PrecisionMode mode : values()) {
            if (mode.apiValue.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported numeric precision: " + value);
    }
}
