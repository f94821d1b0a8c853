package com.pwsrelay.acquisition.forecast;

import com.pwsrelay.acquisition.field.ConditionClassifier;
import com.pwsrelay.acquisition.field.FieldAccessor;
import com.pwsrelay.acquisition.field.FieldSchema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the daypart-indexed forecast into one entry per day.
 */
public final class DailyForecastAssembler {
    static final int FORECAST_DAYS = 5;

    private DailyForecastAssembler() {
    }

    public static List<DailyForecast> assemble(FieldAccessor accessor, boolean calendarDayTemperature) {
        String maxField = calendarDayTemperature
                ? FieldSchema.FORECAST_CALENDAR_DAY_TEMPERATURE_MAX
                : FieldSchema.FORECAST_TEMPERATURE_MAX;
        String minField = calendarDayTemperature
                ? FieldSchema.FORECAST_CALENDAR_DAY_TEMPERATURE_MIN
                : FieldSchema.FORECAST_TEMPERATURE_MIN;

        List<DailyForecast> days = new ArrayList<>();
        for (int period : periods(accessor)) {
            entry(accessor, period, maxField, minField).ifPresent(days::add);
        }
        return days;
    }

    // Day parts 0, 2, 4, 6, 8; once today's day part has passed its temperature is null, so use tonight.
    static int[] periods(FieldAccessor accessor) {
        int[] periods = new int[FORECAST_DAYS];
        for (int day = 0; day < FORECAST_DAYS; day++) {
            periods[day] = day * 2;
        }
        if (accessor.forecast(FieldSchema.FORECAST_TEMPERATURE, 0).isEmpty()) {
            periods[0] = 1;
        }
        return periods;
    }

    private static Optional<DailyForecast> entry(FieldAccessor accessor, int period, String maxField, String minField) {
        Optional<Long> validTime = accessor.forecastAsLong(FieldSchema.FORECAST_VALID_TIME_UTC, period);
        if (validTime.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DailyForecast(
                Instant.ofEpochSecond(validTime.get()),
                ConditionClassifier.iconToCondition(
                        accessor.forecastAsInt(FieldSchema.FORECAST_ICON_CODE, period).orElse(null)
                ).orElse(null),
                accessor.forecastAsDouble(FieldSchema.FORECAST_QPF, period).orElse(null),
                accessor.forecastAsInt(FieldSchema.FORECAST_PRECIP_CHANCE, period).orElse(null),
                accessor.forecastAsDouble(maxField, period).orElse(null),
                accessor.forecastAsDouble(minField, period).orElse(null),
                accessor.forecastAsDouble(FieldSchema.FORECAST_WIND_SPEED, period).orElse(null),
                accessor.forecastAsText(FieldSchema.FORECAST_WIND_DIRECTION_CARDINAL, period).orElse(null)
        ));
    }
}
