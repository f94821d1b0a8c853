package com.pwsrelay.service.diagnostics;

import com.pwsrelay.core.bus.EventBus;
import com.pwsrelay.core.events.ActiveSourceChanged;
import com.pwsrelay.core.events.DegradedEscalated;
import com.pwsrelay.core.events.RefreshCompleted;
import com.pwsrelay.core.events.SourceFetchFailed;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagnosticsTrackerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void countsCyclesSwitchesAndEscalations() {
        EventBus bus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(bus);

        bus.publish(new ActiveSourceChanged(NOW, "home", null, "KXXTEST1"));
        bus.publish(new RefreshCompleted(NOW, "home", true, "KXXTEST1", 2, 120));
        bus.publish(new RefreshCompleted(NOW.plusSeconds(300), "home", false, "KXXTEST1", 0, 80));
        bus.publish(new DegradedEscalated(NOW.plusSeconds(300), "home", 3));

        Map<String, Object> home = tracker.groupSnapshot("home");
        assertEquals(2L, home.get("cycles"));
        assertEquals(1L, home.get("successes"));
        assertEquals(1L, home.get("failures"));
        assertEquals(1L, home.get("activeSourceSwitches"));
        assertEquals(1L, home.get("escalations"));
        assertEquals("KXXTEST1", home.get("activeSourceId"));
        assertEquals(80L, home.get("lastDurationMillis"));
        assertEquals("2026-03-01T10:05:00Z", home.get("lastEscalatedAt"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void tracksSourceFailures() {
        EventBus bus = new EventBus();
        DiagnosticsTracker tracker = new DiagnosticsTracker(bus);

        bus.publish(new SourceFetchFailed(NOW, "KXXTEST1", "HTTP_ERROR", "HTTP 500: boom"));
        bus.publish(new SourceFetchFailed(NOW.plusSeconds(60), "KXXTEST1", "TIMEOUT", "timed out"));

        Map<String, Object> sources = (Map<String, Object>) tracker.snapshot().get("sources");
        Map<String, Object> station = (Map<String, Object>) sources.get("KXXTEST1");
        assertEquals(2L, station.get("failures"));
        assertEquals("TIMEOUT", station.get("lastErrorKind"));
        assertEquals("timed out", station.get("lastError"));
        assertEquals("2026-03-01T10:01:00Z", station.get("lastFailureAt"));
    }

    @Test
    void unknownGroupHasEmptySnapshot() {
        DiagnosticsTracker tracker = new DiagnosticsTracker(new EventBus());
        assertTrue(tracker.groupSnapshot("nowhere").isEmpty());
    }
}
