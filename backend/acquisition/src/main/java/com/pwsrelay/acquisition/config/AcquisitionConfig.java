package com.pwsrelay.acquisition.config;

import com.pwsrelay.core.model.Coordinates;
import com.pwsrelay.core.model.PrecisionMode;
import com.pwsrelay.core.model.SourceConfig;
import com.pwsrelay.core.model.UnitSystem;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Settings for one coordinator instance. A single station is a group with one source.
 */
public record AcquisitionConfig(
        String apiKey,
        String groupName,
        List<SourceConfig> sources,
        UnitSystem unitSystem,
        String language,
        PrecisionMode precision,
        boolean forecastEnabled,
        boolean calendarDayTemperature,
        Coordinates fixedCoordinates,
        Duration refreshInterval,
        Duration requestTimeout,
        int failureEscalationThreshold,
        Endpoints endpoints
) {
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_FAILURE_ESCALATION_THRESHOLD = 3;
    public static final String DEFAULT_LANGUAGE = "en-US";

    public AcquisitionConfig {
        Objects.requireNonNull(apiKey, "apiKey is required");
        if (apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        Objects.requireNonNull(sources, "sources is required");
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("at least one source is required");
        }
        Set<String> ids = new HashSet<>();
        for (SourceConfig source : sources) {
            if (!ids.add(source.id())) {
                throw new IllegalArgumentException("duplicate source id: " + source.id());
            }
        }
        sources = List.copyOf(sources);
        groupName = groupName == null || groupName.isBlank() ? sources.get(0).id() : groupName;
        Objects.requireNonNull(unitSystem, "unitSystem is required");
        language = language == null || language.isBlank() ? DEFAULT_LANGUAGE : language;
        precision = precision == null ? PrecisionMode.NONE : precision;
        refreshInterval = positiveOrDefault(refreshInterval, DEFAULT_REFRESH_INTERVAL, "refreshInterval");
        requestTimeout = positiveOrDefault(requestTimeout, DEFAULT_REQUEST_TIMEOUT, "requestTimeout");
        if (failureEscalationThreshold < 1) {
            throw new IllegalArgumentException("failureEscalationThreshold must be >= 1");
        }
        endpoints = endpoints == null ? Endpoints.DEFAULT : endpoints;
    }

    public Optional<Coordinates> coordinates() {
        return Optional.ofNullable(fixedCoordinates);
    }

    public static Builder builder(String apiKey) {
        return new Builder(apiKey);
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    public record Endpoints(String currentBaseUrl, String forecastBaseUrl) {
        public static final Endpoints DEFAULT = new Endpoints(
                "https://api.weather.com/v2/pws/observations/current",
                "https://api.weather.com/v3/wx/forecast/daily/5day"
        );

        public Endpoints {
            Objects.requireNonNull(currentBaseUrl, "currentBaseUrl is required");
            Objects.requireNonNull(forecastBaseUrl, "forecastBaseUrl is required");
        }
    }

    public static final class Builder {
        private final String apiKey;
        private String groupName;
        private List<SourceConfig> sources = List.of();
        private UnitSystem unitSystem = UnitSystem.METRIC;
        private String language = DEFAULT_LANGUAGE;
        private PrecisionMode precision = PrecisionMode.NONE;
        private boolean forecastEnabled = true;
        private boolean calendarDayTemperature;
        private Coordinates fixedCoordinates;
        private Duration refreshInterval = DEFAULT_REFRESH_INTERVAL;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private int failureEscalationThreshold = DEFAULT_FAILURE_ESCALATION_THRESHOLD;
        private Endpoints endpoints = Endpoints.DEFAULT;

        private Builder(String apiKey) {
            this.apiKey = apiKey;
        }

        public Builder groupName(String groupName) {
            this.groupName = groupName;
            return this;
        }

        public Builder sources(List<SourceConfig> sources) {
            this.sources = sources;
            return this;
        }

        public Builder unitSystem(UnitSystem unitSystem) {
            this.unitSystem = unitSystem;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder precision(PrecisionMode precision) {
            this.precision = precision;
            return this;
        }

        public Builder forecastEnabled(boolean forecastEnabled) {
            this.forecastEnabled = forecastEnabled;
            return this;
        }

        public Builder calendarDayTemperature(boolean calendarDayTemperature) {
            this.calendarDayTemperature = calendarDayTemperature;
            return this;
        }

        public Builder fixedCoordinates(Coordinates fixedCoordinates) {
            this.fixedCoordinates = fixedCoordinates;
            return this;
        }

        public Builder refreshInterval(Duration refreshInterval) {
            this.refreshInterval = refreshInterval;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder failureEscalationThreshold(int failureEscalationThreshold) {
            this.failureEscalationThreshold = failureEscalationThreshold;
            return this;
        }

        public Builder endpoints(Endpoints endpoints) {
            this.endpoints = endpoints;
            return this;
        }

        public AcquisitionConfig build() {
            return new AcquisitionConfig(
                    apiKey,
                    groupName,
                    sources,
                    unitSystem,
                    language,
                    precision,
                    forecastEnabled,
                    calendarDayTemperature,
                    fixedCoordinates,
                    refreshInterval,
                    requestTimeout,
                    failureEscalationThreshold,
                    endpoints
            );
        }
    }
}
