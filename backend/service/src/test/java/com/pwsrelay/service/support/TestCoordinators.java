package com.pwsrelay.service.support;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pwsrelay.acquisition.config.AcquisitionConfig;
import com.pwsrelay.acquisition.coordinator.LocationState;
import com.pwsrelay.acquisition.coordinator.WeatherCoordinator;
import com.pwsrelay.acquisition.fetch.SourceFetcher;
import com.pwsrelay.core.bus.EventBus;
import com.pwsrelay.core.model.ObservationDocument;
import com.pwsrelay.core.model.SourceConfig;
import com.pwsrelay.core.util.JsonUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

public final class TestCoordinators {
    private TestCoordinators() {
    }

    public static WeatherCoordinator coordinator(String group, SourceFetcher fetcher, EventBus bus, Duration refreshInterval) {
        AcquisitionConfig config = AcquisitionConfig.builder("test-key")
                .groupName(group)
                .sources(List.of(new SourceConfig(group + "-1", 1, group + " primary")))
                .refreshInterval(refreshInterval)
                .forecastEnabled(false)
                .build();
        return new WeatherCoordinator(
                config,
                new LocationState(null),
                fetcher,
                bus,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC)
        );
    }

    public static ObservationDocument observation(double temperature) {
        ObjectNode root = JsonUtils.emptyObject();
        ObjectNode observation = root.putArray(ObservationDocument.OBSERVATIONS).addObject();
        observation.put("solarRadiation", 900.0);
        observation.putObject("metric").put("temp", temperature);
        return ObservationDocument.of(root);
    }
}
