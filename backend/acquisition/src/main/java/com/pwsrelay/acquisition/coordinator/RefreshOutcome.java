package com.pwsrelay.acquisition.coordinator;

public enum RefreshOutcome {
    SUCCEEDED,
    FAILED,
    // Another cycle was already in flight.
    SKIPPED,
    DISPOSED
}
