package com.pwsrelay.acquisition.field;

import java.util.Set;

/**
 * Where each field lives in an observation document.
 * Observation fields are either flat (unit-less) or nested under the unit-system sub-record.
 * Forecast fields are either per calendar day or per daypart (day/night halves).
 */
public final class FieldSchema {
    public static final String HUMIDITY = "humidity";
    public static final String WIND_DIRECTION = "winddir";
    public static final String SOLAR_RADIATION = "solarRadiation";
    public static final String UV = "uv";
    public static final String STATION_ID = "stationID";
    public static final String NEIGHBORHOOD = "neighborhood";
    public static final String OBS_TIME_LOCAL = "obsTimeLocal";
    public static final String OBS_TIME_UTC = "obsTimeUtc";
    public static final String SOFTWARE_TYPE = "softwareType";
    public static final String COUNTRY = "country";
    public static final String LONGITUDE = "lon";
    public static final String LATITUDE = "lat";
    public static final String REALTIME_FREQUENCY = "realtimeFrequency";
    public static final String EPOCH = "epoch";
    public static final String QC_STATUS = "qcStatus";
    public static final String WIND_DIRECTION_CARDINAL = "windDirectionCardinal";

    public static final String TEMPERATURE = "temp";
    public static final String PRESSURE = "pressure";
    public static final String WIND_SPEED = "windSpeed";
    public static final String WIND_GUST = "windGust";
    public static final String DEW_POINT = "dewpt";
    public static final String PRECIP_RATE = "precipRate";
    public static final String PRECIP_TOTAL = "precipTotal";

    public static final String FORECAST_VALID_TIME_UTC = "validTimeUtc";
    public static final String FORECAST_TEMPERATURE_MAX = "temperatureMax";
    public static final String FORECAST_TEMPERATURE_MIN = "temperatureMin";
    public static final String FORECAST_CALENDAR_DAY_TEMPERATURE_MAX = "calendarDayTemperatureMax";
    public static final String FORECAST_CALENDAR_DAY_TEMPERATURE_MIN = "calendarDayTemperatureMin";
    public static final String FORECAST_ICON_CODE = "iconCode";
    public static final String FORECAST_QPF = "qpf";
    public static final String FORECAST_PRECIP_CHANCE = "precipChance";
    public static final String FORECAST_TEMPERATURE = "temperature";
    public static final String FORECAST_WIND_SPEED = "windSpeed";
    public static final String FORECAST_WIND_DIRECTION_CARDINAL = "windDirectionCardinal";
    public static final String FORECAST_DAYPART_NAME = "daypartName";

    public enum ObservationKind {
        UNITLESS,
        UNIT_BEARING
    }

    public enum ForecastKind {
        FULL_DAY,
        DAYPART
    }

    private static final Set<String> UNITLESS_FIELDS = Set.of(
            HUMIDITY,
            WIND_DIRECTION,
            SOLAR_RADIATION,
            UV,
            STATION_ID,
            NEIGHBORHOOD,
            OBS_TIME_LOCAL,
            OBS_TIME_UTC,
            SOFTWARE_TYPE,
            COUNTRY,
            LONGITUDE,
            LATITUDE,
            REALTIME_FREQUENCY,
            EPOCH,
            QC_STATUS,
            WIND_DIRECTION_CARDINAL
    );

    private static final Set<String> FULL_DAY_FIELDS = Set.of(
            FORECAST_TEMPERATURE_MAX,
            FORECAST_TEMPERATURE_MIN,
            FORECAST_CALENDAR_DAY_TEMPERATURE_MAX,
            FORECAST_CALENDAR_DAY_TEMPERATURE_MIN,
            FORECAST_VALID_TIME_UTC
    );

    private FieldSchema() {
    }

    public static ObservationKind observationKind(String field) {
        return UNITLESS_FIELDS.contains(field) ? ObservationKind.UNITLESS : ObservationKind.UNIT_BEARING;
    }

    public static ForecastKind forecastKind(String field) {
        return FULL_DAY_FIELDS.contains(field) ? ForecastKind.FULL_DAY : ForecastKind.DAYPART;
    }
}
