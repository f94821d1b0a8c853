package com.pwsrelay.core.model;

public enum SourceState {
    UNKNOWN,
    ONLINE,
    OFFLINE
}
