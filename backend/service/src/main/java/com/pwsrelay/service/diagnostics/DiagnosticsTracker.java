package com.pwsrelay.service.diagnostics;

import com.pwsrelay.core.bus.EventBus;
import com.pwsrelay.core.events.ActiveSourceChanged;
import com.pwsrelay.core.events.DegradedEscalated;
import com.pwsrelay.core.events.RefreshCompleted;
import com.pwsrelay.core.events.SourceFetchFailed;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Running counters built from coordinator events, for logging and troubleshooting.
 */
public final class DiagnosticsTracker {
    private final ConcurrentHashMap<String, GroupStats> groups = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SourceStats> sources = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus) {
        eventBus.subscribe(RefreshCompleted.class, this::onRefreshCompleted);
        eventBus.subscribe(SourceFetchFailed.class, this::onSourceFetchFailed);
        eventBus.subscribe(ActiveSourceChanged.class, this::onActiveSourceChanged);
        eventBus.subscribe(DegradedEscalated.class, this::onDegradedEscalated);
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> groupView = new HashMap<>();
        groups.forEach((name, stats) -> groupView.put(name, stats.toMap()));
        Map<String, Object> sourceView = new HashMap<>();
        sources.forEach((id, stats) -> sourceView.put(id, stats.toMap()));

        Map<String, Object> snapshot = new HashMap<>();
        snapshot.put("groups", groupView);
        snapshot.put("sources", sourceView);
        return snapshot;
    }

    public Map<String, Object> groupSnapshot(String group) {
        GroupStats stats = groups.get(group);
        return stats == null ? Map.of() : stats.toMap();
    }

    private void onRefreshCompleted(RefreshCompleted event) {
        groups.computeIfAbsent(event.group(), ignored -> new GroupStats()).recordCycle(event);
    }

    private void onSourceFetchFailed(SourceFetchFailed event) {
        sources.computeIfAbsent(event.sourceId(), ignored -> new SourceStats()).recordFailure(event);
    }

    private void onActiveSourceChanged(ActiveSourceChanged event) {
        groups.computeIfAbsent(event.group(), ignored -> new GroupStats()).recordSwitch();
    }

    private void onDegradedEscalated(DegradedEscalated event) {
        groups.computeIfAbsent(event.group(), ignored -> new GroupStats()).recordEscalation(event.timestamp());
    }

    private static final class GroupStats {
        private long cycles;
        private long successes;
        private long failures;
        private long switches;
        private long escalations;
        private String activeSourceId;
        private Instant lastCompletedAt;
        private long lastDurationMillis;
        private Instant lastEscalatedAt;

        synchronized void recordCycle(RefreshCompleted event) {
            cycles++;
            if (event.success()) {
                successes++;
            } else {
                failures++;
            }
            activeSourceId = event.activeSourceId();
            lastCompletedAt = event.timestamp();
            lastDurationMillis = event.durationMillis();
        }

        synchronized void recordSwitch() {
            switches++;
        }

        synchronized void recordEscalation(Instant at) {
            escalations++;
            lastEscalatedAt = at;
        }

        synchronized Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("cycles", cycles);
            map.put("successes", successes);
            map.put("failures", failures);
            map.put("activeSourceSwitches", switches);
            map.put("escalations", escalations);
            map.put("activeSourceId", activeSourceId);
            map.put("lastCompletedAt", lastCompletedAt == null ? null : lastCompletedAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastEscalatedAt", lastEscalatedAt == null ? null : lastEscalatedAt.toString());
            return map;
        }
    }

    private static final class SourceStats {
        private long failures;
        private String lastErrorKind;
        private String lastError;
        private Instant lastFailureAt;

        synchronized void recordFailure(SourceFetchFailed event) {
            failures++;
            lastErrorKind = event.errorKind();
            lastError = event.message();
            lastFailureAt = event.timestamp();
        }

        synchronized Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("failures", failures);
            map.put("lastErrorKind", lastErrorKind);
            map.put("lastError", lastError);
            map.put("lastFailureAt", lastFailureAt == null ? null : lastFailureAt.toString());
            return map;
        }
    }
}
