package com.pwsrelay.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

public final class JsonUtils {
    private static final ObjectMapper OBJECT_MAPPER = buildMapper();

    private JsonUtils() {
    }

    public static ObjectMapper objectMapper() {
        return OBJECT_MAPPER;
    }

    public static ObjectNode emptyObject() {
        return OBJECT_MAPPER.createObjectNode();
    }

    // Missing keys, JSON null and non-container parents all read as absent.
    public static Optional<JsonNode> child(JsonNode parent, String field) {
        if (parent == null || !parent.isObject()) {
            return Optional.empty();
        }
        JsonNode value = parent.get(field);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value);
    }

    public static Optional<JsonNode> element(JsonNode array, int index) {
        if (array == null || !array.isArray() || index < 0 || index >= array.size()) {
            return Optional.empty();
        }
        JsonNode value = array.get(index);
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value);
    }

    private static ObjectMapper buildMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        return mapper;
    }
}
