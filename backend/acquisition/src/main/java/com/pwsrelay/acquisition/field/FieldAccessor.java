package com.pwsrelay.acquisition.field;

import com.fasterxml.jackson.databind.JsonNode;
import com.pwsrelay.core.model.ObservationDocument;
import com.pwsrelay.core.model.UnitSystem;
import com.pwsrelay.core.util.JsonUtils;

import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over one observation document. Every lookup signals absence with an empty
 * {@link Optional}; nothing here throws for missing or malformed data.
 */
public final class FieldAccessor {
    private final ObservationDocument document;
    private final UnitSystem unitSystem;

    private FieldAccessor(ObservationDocument document, UnitSystem unitSystem) {
        this.document = document;
        this.unitSystem = Objects.requireNonNull(unitSystem, "unitSystem is required");
    }

    public static FieldAccessor of(ObservationDocument document, UnitSystem unitSystem) {
        return new FieldAccessor(document, unitSystem);
    }

    public static FieldAccessor empty(UnitSystem unitSystem) {
        return new FieldAccessor(null, unitSystem);
    }

    public boolean hasDocument() {
        return document != null;
    }

    public Optional<JsonNode> condition(String field) {
        if (document == null || field == null) {
            return Optional.empty();
        }
        Optional<JsonNode> observation = document.observation();
        if (observation.isEmpty()) {
            return Optional.empty();
        }
        JsonNode record = observation.get();
        if (FieldSchema.observationKind(field) == FieldSchema.ObservationKind.UNITLESS) {
            return JsonUtils.child(record, field);
        }
        Optional<JsonNode> nested = JsonUtils.child(record, unitSystem.recordKey())
                .flatMap(units -> JsonUtils.child(units, field));
        // Fields outside the schema may still sit on the flat record.
        return nested.isPresent() ? nested : JsonUtils.child(record, field);
    }

    public Optional<JsonNode> forecast(String field, int period) {
        if (document == null || field == null || period < 0) {
            return Optional.empty();
        }
        if (FieldSchema.forecastKind(field) == FieldSchema.ForecastKind.FULL_DAY) {
            return document.field(field).flatMap(days -> JsonUtils.element(days, period / 2));
        }
        return document.daypart()
                .flatMap(daypart -> JsonUtils.child(daypart, field))
                .flatMap(values -> JsonUtils.element(values, period));
    }

    public Optional<Double> conditionAsDouble(String field) {
        return condition(field).filter(JsonNode::isNumber).map(JsonNode::asDouble);
    }

    public Optional<Double> forecastAsDouble(String field, int period) {
        return forecast(field, period).filter(JsonNode::isNumber).map(JsonNode::asDouble);
    }

    public Optional<Long> forecastAsLong(String field, int period) {
        return forecast(field, period).filter(JsonNode::isNumber).map(JsonNode::asLong);
    }

    public Optional<Integer> forecastAsInt(String field, int period) {
        return forecast(field, period).filter(JsonNode::canConvertToInt).map(JsonNode::asInt);
    }

    public Optional<String> forecastAsText(String field, int period) {
        return forecast(field, period).filter(JsonNode::isValueNode).map(JsonNode::asText);
    }
}
