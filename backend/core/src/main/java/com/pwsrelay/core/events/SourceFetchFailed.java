package com.pwsrelay.core.events;

import java.time.Instant;

public record SourceFetchFailed(
        Instant timestamp,
        String sourceId,
        String errorKind,
        String message
) implements Event {
    @Override
    public String type() {
        return "SourceFetchFailed";
    }
}
