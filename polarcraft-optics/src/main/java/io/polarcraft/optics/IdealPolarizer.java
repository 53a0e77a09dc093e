package io.polarcraft.optics;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.JonesMatrices;
import io.polarcraft.math.Vector3;

/**
 * Ideal linear polarizer. Projects the field onto the transmission axis.
 * Malus's law follows from the rank-1 projector; it is not applied separately.
 */
public final class IdealPolarizer extends OpticalElement {

    private final Vector3 transmissionAxis;

    public IdealPolarizer(String id, Vector3 position, Vector3 normal, Vector3 transmissionAxis) {
        super(id, position, normal);
        this.transmissionAxis = inPlaneAxis(transmissionAxis);
    }

    public Vector3 transmissionAxis() {
        return transmissionAxis;
    }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis) {
        double theta = axisAngle(transmissionAxis, basis);
        return passThrough(input.applyOperator(JonesMatrices.linearPolarizer(theta)), basis);
    }
}
