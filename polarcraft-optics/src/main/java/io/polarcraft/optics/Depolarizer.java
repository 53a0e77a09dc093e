package io.polarcraft.optics;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Vector3;

/**
 * Blends the state toward unpolarized light of equal intensity.
 * factor 0 leaves the state alone, 1 fully depolarizes it.
 */
public final class Depolarizer extends OpticalElement {

    private final double factor;

    public Depolarizer(String id, Vector3 position, Vector3 normal) {
        this(id, position, normal, 1.0);
    }

    /** factor is clamped to [0, 1]. */
    public Depolarizer(String id, Vector3 position, Vector3 normal, double factor) {
        super(id, position, normal);
        if (Double.isNaN(factor)) {
            throw new IllegalArgumentException("factor must not be NaN");
        }
        this.factor = Math.max(0.0, Math.min(1.0, factor));
    }

    public double factor() {
        return factor;
    }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis) {
        return InteractionResult.transmittedOnly(OutputBeam.along(input.depolarize(factor), basis));
    }
}
