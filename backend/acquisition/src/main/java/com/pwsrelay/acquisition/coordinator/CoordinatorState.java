package com.pwsrelay.acquisition.coordinator;

import com.pwsrelay.core.model.ObservationDocument;
import com.pwsrelay.core.model.SourceConfig;
import com.pwsrelay.core.model.SourceStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of everything a refresh cycle produces. A cycle builds the next snapshot
 * off to the side and publishes it in one reference swap, so readers never see a half-applied cycle.
 */
public record CoordinatorState(
        Map<String, SourceStatus> statuses,
        SourceConfig activeSource,
        ObservationDocument activeDocument,
        boolean ready,
        boolean lastRefreshSucceeded,
        boolean degraded,
        int consecutiveFailures,
        Instant lastRefreshAt
) {
    public CoordinatorState {
        statuses = Collections.unmodifiableMap(new LinkedHashMap<>(statuses));
    }

    public static CoordinatorState initial(List<SourceConfig> sources) {
        Map<String, SourceStatus> statuses = new LinkedHashMap<>();
        for (SourceConfig source : sources) {
            statuses.put(source.id(), SourceStatus.unknown(source));
        }
        return new CoordinatorState(statuses, null, null, false, false, false, 0, null);
    }

    public CoordinatorState succeeded(
            Map<String, SourceStatus> nextStatuses,
            SourceConfig source,
            ObservationDocument document,
            Instant at
    ) {
        return new CoordinatorState(nextStatuses, source, document, true, true, false, 0, at);
    }

    // Active source and document stay as they were: stale data beats no data.
    public CoordinatorState failed(Map<String, SourceStatus> nextStatuses, Instant at) {
        return new CoordinatorState(
                nextStatuses,
                activeSource,
                activeDocument,
                ready,
                false,
                true,
                consecutiveFailures + 1,
                at
        );
    }

    public Optional<SourceConfig> active() {
        return Optional.ofNullable(activeSource);
    }

    public Optional<ObservationDocument> document() {
        return Optional.ofNullable(activeDocument);
    }
}
