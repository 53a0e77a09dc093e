package io.polarcraft.simulation;

import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.math.Vector3;

import java.util.Objects;

/**
 * Emission parameters shared by every source factory.
 *
 * @param id           source identifier carried by every descendant ray
 * @param position     emission point
 * @param direction    emission direction, normalised by the factories
 * @param intensity    emitted intensity, >= 0
 * @param wavelengthNm wavelength in nanometres
 */
public record LightSourceConfig(String id, Vector3 position, Vector3 direction,
                                double intensity, double wavelengthNm) {

    public LightSourceConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("source id must not be null or blank");
        }
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        if (direction.isZero()) {
            throw new IllegalArgumentException("direction must be non-zero");
        }
        if (!(intensity >= 0.0) || Double.isInfinite(intensity)) {
            throw new IllegalArgumentException("intensity must be finite and >= 0; got " + intensity);
        }
        if (!(wavelengthNm > 0.0)) {
            throw new IllegalArgumentException("wavelengthNm must be > 0; got " + wavelengthNm);
        }
    }

    /** Source at the default wavelength. */
    public static LightSourceConfig of(String id, Vector3 position, Vector3 direction, double intensity) {
        return new LightSourceConfig(id, position, direction, intensity, PhysicsConstants.DEFAULT_WAVELENGTH_NM);
    }
}
