package com.pwsrelay.service;

import com.pwsrelay.acquisition.config.AcquisitionConfig;
import com.pwsrelay.acquisition.coordinator.WeatherCoordinator;
import com.pwsrelay.acquisition.error.NotReadyException;
import com.pwsrelay.acquisition.fetch.HttpSourceFetcher;
import com.pwsrelay.acquisition.field.FieldSchema;
import com.pwsrelay.core.bus.EventBus;
import com.pwsrelay.core.events.RefreshCompleted;
import com.pwsrelay.core.model.Quantity;
import com.pwsrelay.core.model.WeatherCondition;
import com.pwsrelay.service.config.ConfigLoader;
import com.pwsrelay.service.diagnostics.DiagnosticsTracker;
import com.pwsrelay.service.http.HttpClientFactory;
import com.pwsrelay.service.runtime.RefreshScheduler;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");
        Map<String, String> environment = System.getenv();
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        DiagnosticsTracker diagnostics = new DiagnosticsTracker(eventBus);
        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(5));

        List<WeatherCoordinator> coordinators = new ArrayList<>();
        for (AcquisitionConfig config : ConfigLoader.loadConfigs(configDir, environment)) {
            coordinators.add(WeatherCoordinator.create(
                    config,
                    location -> new HttpSourceFetcher(httpClient, config, location),
                    eventBus,
                    clock
            ));
        }
        eventBus.subscribe(RefreshCompleted.class, event -> coordinators.stream()
                .filter(coordinator -> coordinator.config().groupName().equals(event.group()))
                .findFirst()
                .ifPresent(coordinator -> logConditions(coordinator, diagnostics)));

        RefreshScheduler scheduler = new RefreshScheduler(coordinators);
        try {
            scheduler.firstRefreshAll();
        } catch (NotReadyException e) {
            LOGGER.severe(e.getMessage() + "; aborting startup");
            scheduler.shutdown();
            System.exit(2);
        }
        scheduler.start();
        LOGGER.info("Polling " + coordinators.size() + " group(s)");

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            scheduler.shutdown();
            stopped.countDown();
        }, "pws-shutdown"));
        stopped.await();
    }

    static void logConditions(WeatherCoordinator coordinator, DiagnosticsTracker diagnostics) {
        String group = coordinator.config().groupName();
        if (!coordinator.lastRefreshSucceeded()) {
            LOGGER.warning("Group " + group + " refresh failed; serving data from "
                    + coordinator.activeSourceId().orElse("no station") + " " + coordinator.sourceStatuses());
            return;
        }
        String temperature = coordinator.getCondition(FieldSchema.TEMPERATURE)
                .map(value -> value.asText() + " " + coordinator.unitOf(Quantity.TEMPERATURE))
                .orElse("n/a");
        String condition = coordinator.currentCondition().map(WeatherCondition::value).orElse("n/a");
        LOGGER.info("Group " + group + " via " + coordinator.activeSourceId().orElse("?")
                + ": " + temperature + ", " + condition + "; " + diagnostics.groupSnapshot(group));
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not load bundled logging.properties", e);
        }
    }
}
