package io.polarcraft.optics;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.JonesMatrices;
import io.polarcraft.math.Vector3;

/**
 * Linear retarder with a fixed retardance.
 * The slow axis is delayed by retardance relative to the fast axis.
 */
public final class WavePlate extends OpticalElement {

    private final Vector3 fastAxis;
    private final double retardance;

    /**
     * @param retardance phase delay in radians (pi/2 for a quarter-wave plate)
     */
    public WavePlate(String id, Vector3 position, Vector3 normal, Vector3 fastAxis, double retardance) {
        super(id, position, normal);
        if (!Double.isFinite(retardance)) {
            throw new IllegalArgumentException("retardance must be finite; got " + retardance);
        }
        this.fastAxis = inPlaneAxis(fastAxis);
        this.retardance = retardance;
    }

    public static WavePlate quarterWave(String id, Vector3 position, Vector3 normal, Vector3 fastAxis) {
        return new WavePlate(id, position, normal, fastAxis, Math.PI / 2.0);
    }

    public static WavePlate halfWave(String id, Vector3 position, Vector3 normal, Vector3 fastAxis) {
        return new WavePlate(id, position, normal, fastAxis, Math.PI);
    }

    public Vector3 fastAxis() { return fastAxis; }
    public double retardance() { return retardance; }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis) {
        double theta = axisAngle(fastAxis, basis);
        return passThrough(input.applyOperator(JonesMatrices.wavePlate(theta, retardance)), basis);
    }
}
