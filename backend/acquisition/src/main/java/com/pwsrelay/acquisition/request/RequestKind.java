package com.pwsrelay.acquisition.request;

public enum RequestKind {
    CURRENT,
    FORECAST
}
