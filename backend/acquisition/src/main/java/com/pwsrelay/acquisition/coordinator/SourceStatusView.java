package com.pwsrelay.acquisition.coordinator;

import com.pwsrelay.core.model.SourceState;

import java.time.Instant;

public record SourceStatusView(
        String name,
        int priority,
        boolean active,
        Instant lastSuccessTime,
        SourceState state,
        String lastError
) {
}
