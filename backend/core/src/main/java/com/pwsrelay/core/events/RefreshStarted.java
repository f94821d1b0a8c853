package com.pwsrelay.core.events;

import java.time.Instant;

public record RefreshStarted(Instant timestamp, String group, int sourceCount) implements Event {
    @Override
    public String type() {
        return "RefreshStarted";
    }
}
