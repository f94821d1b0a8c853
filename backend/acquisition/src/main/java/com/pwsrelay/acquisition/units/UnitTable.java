package com.pwsrelay.acquisition.units;

import com.pwsrelay.core.model.Quantity;
import com.pwsrelay.core.model.UnitSystem;

import java.util.EnumMap;
import java.util.Map;

public final class UnitTable {
    private static final Map<UnitSystem, Map<Quantity, String>> UNITS = new EnumMap<>(UnitSystem.class);

    static {
        Map<Quantity, String> metric = new EnumMap<>(Quantity.class);
        metric.put(Quantity.TEMPERATURE, "°C");
        metric.put(Quantity.LENGTH, "mm");
        metric.put(Quantity.SPEED, "km/h");
        metric.put(Quantity.PRESSURE, "mbar");
        metric.put(Quantity.PRECIPITATION_RATE, "mm/h");

        Map<Quantity, String> imperial = new EnumMap<>(Quantity.class);
        imperial.put(Quantity.TEMPERATURE, "°F");
        imperial.put(Quantity.LENGTH, "in");
        imperial.put(Quantity.SPEED, "mph");
        imperial.put(Quantity.PRESSURE, "inHg");
        imperial.put(Quantity.PRECIPITATION_RATE, "in/h");

        UNITS.put(UnitSystem.METRIC, metric);
        UNITS.put(UnitSystem.IMPERIAL, imperial);
    }

    private UnitTable() {
    }

    public static String unitOf(UnitSystem system, Quantity quantity) {
        return UNITS.get(system).get(quantity);
    }

    public static Map<Quantity, String> unitsFor(UnitSystem system) {
        return Map.copyOf(UNITS.get(system));
    }
}
