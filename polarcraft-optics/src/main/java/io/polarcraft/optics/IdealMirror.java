package io.polarcraft.optics;

import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.JonesMatrices;
import io.polarcraft.math.Vector3;

/**
 * Perfect reflector with a uniform phase shift on both axes.
 * Always reflects; there is no absorption branch.
 */
public final class IdealMirror extends OpticalElement {

    private final double phaseShift;

    public IdealMirror(String id, Vector3 position, Vector3 normal) {
        this(id, position, normal, PhysicsConstants.DEFAULT_MIRROR_PHASE);
    }

    public IdealMirror(String id, Vector3 position, Vector3 normal, double phaseShift) {
        super(id, position, normal);
        this.phaseShift = phaseShift;
    }

    public double phaseShift() {
        return phaseShift;
    }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis) {
        CoherencyMatrix reflected = input.applyOperator(JonesMatrices.phaseShift(phaseShift));
        PolarizationBasis reflectedBasis = basis.computeReflectedBasis(normal());
        return InteractionResult.reflectedOnly(OutputBeam.along(reflected, reflectedBasis));
    }
}
