package io.polarcraft.simulation;

import io.polarcraft.math.Vector3;

import java.util.Objects;

/**
 * Spherical detector. A ray reaching it before any element is recorded and stops.
 */
public record Sensor(String id, Vector3 position, double radius) {

    public Sensor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("sensor id must not be null or blank");
        }
        Objects.requireNonNull(position, "position must not be null");
        if (!(radius > 0.0)) {
            throw new IllegalArgumentException("radius must be > 0; got " + radius);
        }
    }
}
