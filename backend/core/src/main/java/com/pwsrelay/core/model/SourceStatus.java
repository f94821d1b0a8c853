package com.pwsrelay.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Last known outcome for one source. Instances are immutable; each fetch produces a new one.
 * A failed fetch keeps the previous document for diagnostics only.
 */
public record SourceStatus(
        SourceConfig source,
        SourceState state,
        ObservationDocument lastDocument,
        Instant lastSuccess,
        String lastError
) {
    public SourceStatus {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(state, "state is required");
    }

    public static SourceStatus unknown(SourceConfig source) {
        return new SourceStatus(source, SourceState.UNKNOWN, null, null, null);
    }

    public SourceStatus recordSuccess(ObservationDocument document, Instant at) {
        Objects.requireNonNull(document, "document is required");
        return new SourceStatus(source, SourceState.ONLINE, document, at, null);
    }

    public SourceStatus recordFailure(String error) {
        return new SourceStatus(source, SourceState.OFFLINE, lastDocument, lastSuccess, error);
    }

    public Optional<ObservationDocument> document() {
        return Optional.ofNullable(lastDocument);
    }
}
