package io.polarcraft.optics;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.JonesMatrices;
import io.polarcraft.math.Vector3;

/** Neutral density filter. Scales intensity by transmission, polarization unchanged. */
public final class Attenuator extends OpticalElement {

    private final double transmission;

    /** transmission is clamped to [0, 1]. */
    public Attenuator(String id, Vector3 position, Vector3 normal, double transmission) {
        super(id, position, normal);
        if (Double.isNaN(transmission)) {
            throw new IllegalArgumentException("transmission must not be NaN");
        }
        this.transmission = Math.max(0.0, Math.min(1.0, transmission));
    }

    public double transmission() {
        return transmission;
    }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis) {
        return passThrough(input.applyOperator(JonesMatrices.attenuator(transmission)), basis);
    }
}
