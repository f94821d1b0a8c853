package com.pwsrelay.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pwsrelay.core.util.JsonUtils;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Merged current-conditions and forecast payload from one successful fetch.
 * The backing tree is copied on construction and never handed out mutably.
 */
public final class ObservationDocument {
    public static final String OBSERVATIONS = "observations";
    public static final String DAYPART = "daypart";

    private final ObjectNode root;

    private ObservationDocument(ObjectNode root) {
        this.root = root;
    }

    public static ObservationDocument of(ObjectNode payload) {
        Objects.requireNonNull(payload, "payload is required");
        return new ObservationDocument(payload.deepCopy());
    }

    // Shallow merge; forecast keys replace current keys of the same name.
    public static ObservationDocument merge(ObjectNode current, ObjectNode forecast) {
        Objects.requireNonNull(current, "current is required");
        ObjectNode merged = current.deepCopy();
        if (forecast != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = forecast.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                merged.set(entry.getKey(), entry.getValue().deepCopy());
            }
        }
        return new ObservationDocument(merged);
    }

    public Optional<JsonNode> field(String name) {
        return JsonUtils.child(root, name);
    }

    public Optional<JsonNode> observation() {
        return field(OBSERVATIONS).flatMap(observations -> JsonUtils.element(observations, 0));
    }

    public Optional<JsonNode> daypart() {
        return field(DAYPART).flatMap(dayparts -> JsonUtils.element(dayparts, 0));
    }

    public ObjectNode copyTree() {
        return root.deepCopy();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ObservationDocument that && root.equals(that.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "ObservationDocument" + root;
    }
}
