package com.pwsrelay.core.events;

import java.time.Instant;

public record ActiveSourceChanged(
        Instant timestamp,
        String group,
        String previousSourceId,
        String currentSourceId
) implements Event {
    @Override
    public String type() {
        return "ActiveSourceChanged";
    }
}
