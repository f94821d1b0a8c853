package com.pwsrelay.acquisition.select;

import com.pwsrelay.core.model.ObservationDocument;
import com.pwsrelay.core.model.SourceConfig;
import com.pwsrelay.core.model.SourceStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one selection cycle. {@code statuses} holds every attempted source keyed by id;
 * {@code candidates} holds the sources that succeeded this cycle in priority order.
 */
public record SelectionResult(
        Map<String, SourceStatus> statuses,
        List<SourceConfig> candidates,
        SourceConfig selected,
        ObservationDocument document
) {
    public SelectionResult {
        statuses = Map.copyOf(statuses);
        candidates = List.copyOf(candidates);
    }

    public boolean hasSelection() {
        return selected != null;
    }

    public Optional<SourceConfig> selectedSource() {
        return Optional.ofNullable(selected);
    }
}
