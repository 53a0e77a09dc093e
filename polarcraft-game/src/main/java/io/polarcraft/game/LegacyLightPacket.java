package io.polarcraft.game;

import io.polarcraft.api.PhysicsConstants;

import java.util.Objects;

/**
 * Discrete light packet of the legacy block model.
 *
 * @param intensity    0..15
 * @param phase        +1 or -1
 */
public record LegacyLightPacket(LegacyDirection direction, int intensity,
                                LegacyPolarization polarization, int phase) {

    public LegacyLightPacket {
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(polarization, "polarization must not be null");
        if (intensity < 0 || intensity > PhysicsConstants.LEGACY_INTENSITY_LEVELS) {
            throw new IllegalArgumentException("intensity must be in [0, "
                + PhysicsConstants.LEGACY_INTENSITY_LEVELS + "]; got " + intensity);
        }
        if (phase != 1 && phase != -1) {
            throw new IllegalArgumentException("phase must be +1 or -1; got " + phase);
        }
    }
}
