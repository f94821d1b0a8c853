package com.pwsrelay.acquisition.coordinator;

import com.pwsrelay.core.model.Coordinates;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Coordinates used for forecast geocoding. Either fixed by configuration or learned once from the
 * first observation that carries them; the first value written is kept for the coordinator's lifetime.
 */
public final class LocationState {
    private final AtomicReference<Coordinates> coordinates;
    private final boolean configured;

    public LocationState(Coordinates configuredCoordinates) {
        this.coordinates = new AtomicReference<>(configuredCoordinates);
        this.configured = configuredCoordinates != null;
    }

    public Optional<Coordinates> current() {
        return Optional.ofNullable(coordinates.get());
    }

    public boolean isConfigured() {
        return configured;
    }

    // Returns true only for the call that actually stored the value.
    public boolean learn(Coordinates learned) {
        Objects.requireNonNull(learned, "learned is required");
        return coordinates.compareAndSet(null, learned);
    }
}
