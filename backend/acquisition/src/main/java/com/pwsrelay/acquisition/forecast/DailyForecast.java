package com.pwsrelay.acquisition.forecast;

import com.pwsrelay.core.model.WeatherCondition;

import java.time.Instant;

public record DailyForecast(
        Instant time,
        WeatherCondition condition,
        Double precipitation,
        Integer precipitationProbability,
        Double temperature,
        Double templow,
        Double windSpeed,
        String windBearing
) {
}
