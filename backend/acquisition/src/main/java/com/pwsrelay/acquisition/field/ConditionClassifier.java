package com.pwsrelay.acquisition.field;

import com.pwsrelay.core.model.WeatherCondition;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

public final class ConditionClassifier {
    private static final Logger LOGGER = Logger.getLogger(ConditionClassifier.class.getName());

    public static final int NOT_AVAILABLE_ICON = 44;

    private static final Map<WeatherCondition, Set<Integer>> ICONS_BY_CONDITION = new EnumMap<>(WeatherCondition.class);
    private static final Map<Integer, WeatherCondition> CONDITION_BY_ICON = new HashMap<>();

    static {
        ICONS_BY_CONDITION.put(WeatherCondition.CLEAR_NIGHT, Set.of(31, 33));
        ICONS_BY_CONDITION.put(WeatherCondition.CLOUDY, Set.of(26, 27, 28));
        ICONS_BY_CONDITION.put(WeatherCondition.EXCEPTIONAL, Set.of(0, 1, 2, 19, 22, 25, 36));
        ICONS_BY_CONDITION.put(WeatherCondition.FOG, Set.of(20, 21));
        ICONS_BY_CONDITION.put(WeatherCondition.HAIL, Set.of(17, 35));
        ICONS_BY_CONDITION.put(WeatherCondition.LIGHTNING_RAINY, Set.of(3, 4, 37, 38, 47));
        ICONS_BY_CONDITION.put(WeatherCondition.PARTLY_CLOUDY, Set.of(29, 30));
        ICONS_BY_CONDITION.put(WeatherCondition.POURING, Set.of(40));
        ICONS_BY_CONDITION.put(WeatherCondition.RAINY, Set.of(9, 11, 12, 39, 45));
        ICONS_BY_CONDITION.put(WeatherCondition.SNOWY, Set.of(13, 14, 15, 16, 41, 42, 43, 46));
        ICONS_BY_CONDITION.put(WeatherCondition.SNOWY_RAINY, Set.of(5, 6, 7, 8, 10, 18));
        ICONS_BY_CONDITION.put(WeatherCondition.SUNNY, Set.of(32, 34));
        ICONS_BY_CONDITION.put(WeatherCondition.WINDY, Set.of(23, 24));

        ICONS_BY_CONDITION.forEach((condition, icons) -> icons.forEach(icon -> {
            WeatherCondition previous = CONDITION_BY_ICON.put(icon, condition);
            if (previous != null) {
                throw new IllegalStateException("Icon " + icon + " mapped to both " + previous + " and " + condition);
            }
        }));
    }

    private ConditionClassifier() {
    }

    public static Optional<WeatherCondition> iconToCondition(Integer iconCode) {
        if (iconCode == null) {
            return Optional.empty();
        }
        WeatherCondition condition = CONDITION_BY_ICON.get(iconCode);
        if (condition == null) {
            LOGGER.warning("Unmapped iconCode from forecast API (" + NOT_AVAILABLE_ICON
                    + " is Not Available): " + iconCode);
            return Optional.empty();
        }
        return Optional.of(condition);
    }

    public static Optional<WeatherCondition> fromSolarRadiation(Double wattsPerSquareMetre) {
        if (wattsPerSquareMetre == null) {
            return Optional.empty();
        }
        if (wattsPerSquareMetre > 800) {
            return Optional.of(WeatherCondition.SUNNY);
        }
        if (wattsPerSquareMetre > 400) {
            return Optional.of(WeatherCondition.PARTLY_CLOUDY);
        }
        return Optional.of(WeatherCondition.CLOUDY);
    }

    /**
     * Current condition as displayed: the day icon (or the night icon once the day part has passed),
     * then an estimate from solar radiation when no icon maps.
     */
    public static Optional<WeatherCondition> currentCondition(FieldAccessor accessor) {
        Optional<Integer> icon = accessor.forecastAsInt(FieldSchema.FORECAST_ICON_CODE, 0)
                .or(() -> accessor.forecastAsInt(FieldSchema.FORECAST_ICON_CODE, 1));
        return iconToCondition(icon.orElse(null))
                .or(() -> fromSolarRadiation(accessor.conditionAsDouble(FieldSchema.SOLAR_RADIATION).orElse(null)));
    }
}
