package com.pwsrelay.service.config;

import com.pwsrelay.acquisition.config.AcquisitionConfig;
import com.pwsrelay.core.model.Coordinates;
import com.pwsrelay.core.model.PrecisionMode;
import com.pwsrelay.core.model.SourceConfig;
import com.pwsrelay.core.model.UnitSystem;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of {@code acquisition.json}. Durations use ISO-8601 ({@code PT5M}).
 */
public record AcquisitionSettings(
        String apiKey,
        String groupName,
        String unitSystem,
        String language,
        String numericPrecision,
        Boolean forecastEnabled,
        Boolean calendarDayTemperature,
        Double latitude,
        Double longitude,
        Duration refreshInterval,
        Duration requestTimeout,
        Integer failureEscalationThreshold,
        List<Station> stations
) {
    public static final String API_KEY_ENV = "PWS_API_KEY";

    public record Station(String id, Integer priority, String name) {
    }

    public AcquisitionConfig toConfig(Map<String, String> environment) {
        String key = environment.getOrDefault(API_KEY_ENV, apiKey);
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("API key missing: set apiKey or " + API_KEY_ENV);
        }
        if (stations == null || stations.isEmpty()) {
            throw new IllegalStateException("At least one station must be configured");
        }
        List<SourceConfig> sources = stations.stream()
                .map(station -> new SourceConfig(
                        station.id(),
                        station.priority() == null ? 1 : station.priority(),
                        station.name()
                ))
                .toList();

        return AcquisitionConfig.builder(key)
                .groupName(groupName)
                .sources(sources)
                .unitSystem(unitSystem == null ? UnitSystem.METRIC : UnitSystem.parse(unitSystem))
                .language(language)
                .precision(PrecisionMode.parse(numericPrecision))
                .forecastEnabled(forecastEnabled == null || forecastEnabled)
                .calendarDayTemperature(calendarDayTemperature != null && calendarDayTemperature)
                .fixedCoordinates(coordinates())
                .refreshInterval(refreshInterval)
                .requestTimeout(requestTimeout)
                .failureEscalationThreshold(failureEscalationThreshold == null
                        ? AcquisitionConfig.DEFAULT_FAILURE_ESCALATION_THRESHOLD
                        : failureEscalationThreshold)
                .build();
    }

    private Coordinates coordinates() {
        if (latitude == null && longitude == null) {
            return null;
        }
        if (latitude == null || longitude == null) {
            throw new IllegalStateException("latitude and longitude must be configured together");
        }
        return new Coordinates(latitude, longitude);
    }
}
