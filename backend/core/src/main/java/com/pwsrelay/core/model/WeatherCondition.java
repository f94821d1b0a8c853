package com.pwsrelay.core.model;

public enum WeatherCondition {
    CLEAR_NIGHT("clear-night"),
    CLOUDY("cloudy"),
    EXCEPTIONAL("exceptional"),
    FOG("fog"),
    HAIL("hail"),
    LIGHTNING("lightning"),
    LIGHTNING_RAINY("lightning-rainy"),
    PARTLY_CLOUDY("partlycloudy"),
    POURING("pouring"),
    RAINY("rainy"),
    SNOWY("snowy"),
    SNOWY_RAINY("snowy-rainy"),
    SUNNY("sunny"),
    WINDY("windy"),
    WINDY_VARIANT("windy-variant");

    private final String value;

    WeatherCondition(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
