package com.pwsrelay.acquisition.select;

import com.pwsrelay.acquisition.error.AcquisitionException;
import com.pwsrelay.core.model.ObservationDocument;
import com.pwsrelay.core.model.SourceConfig;

import java.util.Optional;

public record SourceOutcome(SourceConfig source, ObservationDocument document, AcquisitionException error) {
    public static SourceOutcome success(SourceConfig source, ObservationDocument document) {
        return new SourceOutcome(source, document, null);
    }

    public static SourceOutcome failure(SourceConfig source, AcquisitionException error) {
        return new SourceOutcome(source, null, error);
    }

    public boolean succeeded() {
        return document != null;
    }

    public Optional<AcquisitionException> failure() {
        return Optional.ofNullable(error);
    }
}
