package com.pwsrelay.core.model;

public enum Quantity {
    TEMPERATURE,
    LENGTH,
    SPEED,
    PRESSURE,
    PRECIPITATION_RATE
}
