package com.pwsrelay.acquisition.coordinator;

import com.pwsrelay.acquisition.config.AcquisitionConfig;
import com.pwsrelay.acquisition.error.NotReadyException;
import com.pwsrelay.acquisition.fetch.HttpSourceFetcher;
import com.pwsrelay.acquisition.field.FieldSchema;
import com.pwsrelay.acquisition.forecast.DailyForecast;
import com.pwsrelay.acquisition.support.EventCapture;
import com.pwsrelay.acquisition.support.MutableClock;
import com.pwsrelay.acquisition.support.ScriptedFetcher;
import com.pwsrelay.acquisition.support.StubWeatherServer;
import com.pwsrelay.acquisition.support.StubWeatherServer.Reply;
import com.pwsrelay.acquisition.support.TestConfigs;
import com.pwsrelay.core.bus.EventBus;
import com.pwsrelay.core.events.ActiveSourceChanged;
import com.pwsrelay.core.events.DegradedEscalated;
import com.pwsrelay.core.events.RefreshCompleted;
import com.pwsrelay.core.events.RefreshStarted;
import com.pwsrelay.core.model.Quantity;
import com.pwsrelay.core.model.SourceState;
import com.pwsrelay.core.model.WeatherCondition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.pwsrelay.acquisition.support.FixtureUtils.fixture;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeatherCoordinatorTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final EventBus bus = TestConfigs.strictBus();
    private final EventCapture capture = new EventCapture(bus);
    private final List<AutoCloseable> resources = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable resource : resources) {
            resource.close();
        }
    }

    private StubWeatherServer server() {
        StubWeatherServer server = new StubWeatherServer().forecast(Reply.ok(fixture("fixtures/forecast.json")));
        resources.add(server);
        return server;
    }

    private WeatherCoordinator httpCoordinator(StubWeatherServer server) {
        AcquisitionConfig config = TestConfigs.twoStations(server.endpoints()).build();
        HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build();
        WeatherCoordinator coordinator = WeatherCoordinator.create(
                config,
                location -> new HttpSourceFetcher(client, config, location),
                bus,
                clock
        );
        resources.add(coordinator);
        return coordinator;
    }

    private WeatherCoordinator scriptedCoordinator(ScriptedFetcher fetcher, int escalationThreshold) {
        AcquisitionConfig config = TestConfigs.twoStations(AcquisitionConfig.Endpoints.DEFAULT)
                .failureEscalationThreshold(escalationThreshold)
                .build();
        WeatherCoordinator coordinator = new WeatherCoordinator(
                config,
                new LocationState(config.fixedCoordinates()),
                fetcher,
                bus,
                clock
        );
        resources.add(coordinator);
        return coordinator;
    }

    @Test
    void failsOverWhenPrimaryReturnsServerError() {
        StubWeatherServer server = server()
                .current("KXXTEST1", Reply.status(500, "{\"error\":\"boom\"}"))
                .current("KXXTEST2", Reply.ok(fixture("fixtures/current-KXXTEST2.json")));
        WeatherCoordinator coordinator = httpCoordinator(server);

        coordinator.firstRefresh();

        assertTrue(coordinator.isReady());
        assertTrue(coordinator.lastRefreshSucceeded());
        assertEquals(Optional.of("KXXTEST2"), coordinator.activeSourceId());
        assertEquals(11.9, coordinator.getCondition(FieldSchema.TEMPERATURE).orElseThrow().asDouble());

        Map<String, SourceStatusView> statuses = coordinator.sourceStatuses();
        assertEquals(List.of("KXXTEST1", "KXXTEST2"), List.copyOf(statuses.keySet()));
        SourceStatusView primary = statuses.get("KXXTEST1");
        assertEquals(SourceState.OFFLINE, primary.state());
        assertFalse(primary.active());
        assertTrue(primary.lastError().contains("500"));
        SourceStatusView backup = statuses.get("KXXTEST2");
        assertEquals("Neighbour", backup.name());
        assertEquals(2, backup.priority());
        assertTrue(backup.active());
        assertEquals(clock.instant(), backup.lastSuccessTime());
    }

    @Test
    void primaryWinsWhenBothSucceedEvenIfSlower() {
        StubWeatherServer server = server()
                .current("KXXTEST1", Reply.ok(fixture("fixtures/current-KXXTEST1.json")).delayed(300))
                .current("KXXTEST2", Reply.ok(fixture("fixtures/current-KXXTEST2.json")));
        WeatherCoordinator coordinator = httpCoordinator(server);

        coordinator.firstRefresh();

        assertEquals(Optional.of("KXXTEST1"), coordinator.activeSourceId());
        assertEquals(12.4, coordinator.getCondition(FieldSchema.TEMPERATURE).orElseThrow().asDouble());
        assertTrue(coordinator.coordinates().isPresent());
    }

    @Test
    void exposesForecastConditionAndUnits() {
        StubWeatherServer server = server()
                .current("KXXTEST1", Reply.ok(fixture("fixtures/current-KXXTEST1.json")))
                .current("KXXTEST2", Reply.ok(fixture("fixtures/current-KXXTEST2.json")));
        WeatherCoordinator coordinator = httpCoordinator(server);

        coordinator.firstRefresh();

        assertEquals(14, coordinator.getForecast(FieldSchema.FORECAST_TEMPERATURE_MAX).orElseThrow().asInt());
        assertEquals(29, coordinator.getForecast(FieldSchema.FORECAST_ICON_CODE, 1).orElseThrow().asInt());
        assertEquals(Optional.of(WeatherCondition.CLOUDY), coordinator.currentCondition());
        assertEquals(Optional.of(WeatherCondition.SUNNY), coordinator.iconToCondition(32));
        List<DailyForecast> daily = coordinator.dailyForecast();
        assertEquals(5, daily.size());
        assertEquals("°C", coordinator.unitOf(Quantity.TEMPERATURE));
        assertEquals("km/h", coordinator.unitOf(Quantity.SPEED));
    }

    @Test
    void totalFailureKeepsServingLastGoodData() {
        ScriptedFetcher fetcher = new ScriptedFetcher()
                .succeed("KXXTEST1", "fixtures/current-KXXTEST1.json")
                .succeed("KXXTEST2", "fixtures/current-KXXTEST2.json");
        WeatherCoordinator coordinator = scriptedCoordinator(fetcher, 3);
        coordinator.firstRefresh();

        fetcher.fail("KXXTEST1").fail("KXXTEST2");
        clock.advance(Duration.ofMinutes(5));
        RefreshOutcome outcome = coordinator.refresh();

        assertEquals(RefreshOutcome.FAILED, outcome);
        assertTrue(coordinator.isReady());
        assertFalse(coordinator.lastRefreshSucceeded());
        assertTrue(coordinator.isDegraded());
        assertEquals(1, coordinator.consecutiveFailures());
        assertEquals(Optional.of("KXXTEST1"), coordinator.activeSourceId());
        assertEquals(12.4, coordinator.getCondition(FieldSchema.TEMPERATURE).orElseThrow().asDouble());
        SourceStatusView primary = coordinator.sourceStatuses().get("KXXTEST1");
        assertEquals(SourceState.OFFLINE, primary.state());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), primary.lastSuccessTime());
    }

    @Test
    void firstRefreshWithNoDataIsNotReady() {
        ScriptedFetcher fetcher = new ScriptedFetcher().fail("KXXTEST1").fail("KXXTEST2");
        WeatherCoordinator coordinator = scriptedCoordinator(fetcher, 3);

        assertThrows(NotReadyException.class, coordinator::firstRefresh);

        assertFalse(coordinator.isReady());
        assertTrue(coordinator.activeSourceId().isEmpty());
        assertTrue(coordinator.getCondition(FieldSchema.TEMPERATURE).isEmpty());
        assertTrue(coordinator.getForecast(FieldSchema.FORECAST_TEMPERATURE_MAX).isEmpty());
        assertTrue(coordinator.currentCondition().isEmpty());
        assertTrue(coordinator.dailyForecast().isEmpty());
    }

    @Test
    void recoversAfterLaterSuccess() {
        ScriptedFetcher fetcher = new ScriptedFetcher().fail("KXXTEST1").fail("KXXTEST2");
        WeatherCoordinator coordinator = scriptedCoordinator(fetcher, 3);
        assertEquals(RefreshOutcome.FAILED, coordinator.refresh());

        fetcher.succeed("KXXTEST2", "fixtures/current-KXXTEST2.json");
        assertEquals(RefreshOutcome.SUCCEEDED, coordinator.refresh());

        assertTrue(coordinator.isReady());
        assertFalse(coordinator.isDegraded());
        assertEquals(0, coordinator.consecutiveFailures());
        assertEquals(Optional.of("KXXTEST2"), coordinator.activeSourceId());
    }

    @Test
    void publishesActiveSourceChangesOnlyOnSwitch() {
        ScriptedFetcher fetcher = new ScriptedFetcher()
                .succeed("KXXTEST1", "fixtures/current-KXXTEST1.json")
                .succeed("KXXTEST2", "fixtures/current-KXXTEST2.json");
        WeatherCoordinator coordinator = scriptedCoordinator(fetcher, 3);

        coordinator.refresh();
        coordinator.refresh();
        fetcher.fail("KXXTEST1");
        coordinator.refresh();

        List<ActiveSourceChanged> changes = capture.byType(ActiveSourceChanged.class);
        assertEquals(2, changes.size());
        assertNull(changes.get(0).previousSourceId());
        assertEquals("KXXTEST1", changes.get(0).currentSourceId());
        assertEquals("KXXTEST1", changes.get(1).previousSourceId());
        assertEquals("KXXTEST2", changes.get(1).currentSourceId());
    }

    @Test
    void escalatesOnceWhenThresholdReached() {
        ScriptedFetcher fetcher = new ScriptedFetcher()
                .succeed("KXXTEST1", "fixtures/current-KXXTEST1.json")
                .succeed("KXXTEST2", "fixtures/current-KXXTEST2.json");
        WeatherCoordinator coordinator = scriptedCoordinator(fetcher, 2);
        coordinator.refresh();

        fetcher.fail("KXXTEST1").fail("KXXTEST2");
        coordinator.refresh();
        assertTrue(capture.byType(DegradedEscalated.class).isEmpty());
        coordinator.refresh();
        coordinator.refresh();

        List<DegradedEscalated> escalations = capture.byType(DegradedEscalated.class);
        assertEquals(1, escalations.size());
        assertEquals("home", escalations.get(0).group());
        assertEquals(2, escalations.get(0).consecutiveFailures());
        assertEquals(3, coordinator.consecutiveFailures());
    }

    @Test
    void publishesCycleEvents() {
        ScriptedFetcher fetcher = new ScriptedFetcher()
                .succeed("KXXTEST1", "fixtures/current-KXXTEST1.json")
                .fail("KXXTEST2");
        WeatherCoordinator coordinator = scriptedCoordinator(fetcher, 3);

        coordinator.refresh();

        assertEquals(1, capture.byType(RefreshStarted.class).size());
        assertEquals(2, capture.byType(RefreshStarted.class).get(0).sourceCount());
        RefreshCompleted completed = capture.byType(RefreshCompleted.class).get(0);
        assertTrue(completed.success());
        assertEquals("KXXTEST1", completed.activeSourceId());
        assertEquals(1, completed.onlineSources());
    }

    @Test
    void concurrentRefreshIsSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedFetcher fetcher = new ScriptedFetcher()
                .blockThenSucceed("KXXTEST1", "fixtures/current-KXXTEST1.json", entered, release)
                .succeed("KXXTEST2", "fixtures/current-KXXTEST2.json");
        WeatherCoordinator coordinator = scriptedCoordinator(fetcher, 3);

        CompletableFuture<RefreshOutcome> first = CompletableFuture.supplyAsync(coordinator::refresh);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertTrue(coordinator.isRefreshing());

        assertEquals(RefreshOutcome.SKIPPED, coordinator.refresh());
        release.countDown();

        assertEquals(RefreshOutcome.SUCCEEDED, first.get(5, TimeUnit.SECONDS));
        assertFalse(coordinator.isRefreshing());
        assertEquals(2, fetcher.calls());
    }

    @Test
    void closeDuringRefreshDiscardsResults() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedFetcher fetcher = new ScriptedFetcher()
                .blockThenSucceed("KXXTEST1", "fixtures/current-KXXTEST1.json", entered, release)
                .succeed("KXXTEST2", "fixtures/current-KXXTEST2.json");
        WeatherCoordinator coordinator = scriptedCoordinator(fetcher, 3);

        CompletableFuture<RefreshOutcome> inFlight = CompletableFuture.supplyAsync(coordinator::refresh);
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        coordinator.close();
        release.countDown();

        assertEquals(RefreshOutcome.DISPOSED, inFlight.get(5, TimeUnit.SECONDS));
        assertTrue(coordinator.isDisposed());
        assertFalse(coordinator.isReady());
        assertTrue(coordinator.activeSourceId().isEmpty());
        assertEquals(RefreshOutcome.DISPOSED, coordinator.refresh());
        assertTrue(capture.byType(RefreshCompleted.class).isEmpty());
    }
}
