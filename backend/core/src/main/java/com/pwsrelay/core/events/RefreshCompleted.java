package com.pwsrelay.core.events;

import java.time.Instant;

public record RefreshCompleted(
        Instant timestamp,
        String group,
        boolean success,
        String activeSourceId,
        int onlineSources,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "RefreshCompleted";
    }
}
