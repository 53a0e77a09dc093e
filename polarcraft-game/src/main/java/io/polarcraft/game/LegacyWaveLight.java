package io.polarcraft.game;

import io.polarcraft.api.JonesVector;

import java.util.Objects;

/**
 * Legacy wave-optics light: a single Jones vector per source.
 *
 * @param globalPhase radians in [0, 2 pi)
 */
public record LegacyWaveLight(LegacyDirection direction, JonesVector jones,
                              double globalPhase, String sourceId) {

    public LegacyWaveLight {
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(jones, "jones must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
    }
}
