package io.polarcraft.optics;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Vector3;

import java.util.Objects;

/**
 * One branch leaving an optical element.
 *
 * @param state     coherency matrix expressed in basis
 * @param basis     frame of the outgoing ray
 * @param direction propagation direction, equal to basis.k
 */
public record OutputBeam(CoherencyMatrix state, PolarizationBasis basis, Vector3 direction) {

    public OutputBeam {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(basis, "basis must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
    }

    public static OutputBeam along(CoherencyMatrix state, PolarizationBasis basis) {
        return new OutputBeam(state, basis, basis.k);
    }

    public double intensity() {
        return state.intensity();
    }
}
