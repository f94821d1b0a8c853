package com.pwsrelay.core.events;

import java.time.Instant;

public record DegradedEscalated(Instant timestamp, String group, int consecutiveFailures) implements Event {
    @Override
    public String type() {
        return "DegradedEscalated";
    }
}
