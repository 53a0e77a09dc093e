package io.polarcraft.optics;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.JonesMatrices;
import io.polarcraft.math.Vector3;
import io.polarcraft.optics.material.ChiralMaterial;
import io.polarcraft.optics.material.OpticalActivity;

/**
 * Lossless rotation of the polarization plane (Faraday rotator, optically
 * active sample).
 *
 * The field is rotated by the angle and the carried basis is rotated with it,
 * so the outgoing components are unchanged while the frame they refer to has
 * turned. A half-wave plate at 45 degrees reflects the field instead and leaves
 * the frame alone.
 */
public final class OpticalRotator extends OpticalElement {

    private final double rotationAngle;

    /**
     * @param rotationAngle radians, counter-clockwise about the propagation direction
     */
    public OpticalRotator(String id, Vector3 position, Vector3 normal, double rotationAngle) {
        super(id, position, normal);
        if (!Double.isFinite(rotationAngle)) {
            throw new IllegalArgumentException("rotationAngle must be finite; got " + rotationAngle);
        }
        this.rotationAngle = rotationAngle;
    }

    /**
     * Sample cell filled with a chiral solution.
     *
     * @param concentration g/mL
     * @param pathLengthDm  cell length in decimetres
     */
    public static OpticalRotator sampleCell(String id, Vector3 position, Vector3 normal,
                                            ChiralMaterial material, double wavelengthNm,
                                            double concentration, double pathLengthDm) {
        double degrees = OpticalActivity.rotationDegrees(material, wavelengthNm, concentration, pathLengthDm);
        return new OpticalRotator(id, position, normal, Math.toRadians(degrees));
    }

    public double rotationAngle() {
        return rotationAngle;
    }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis) {
        CoherencyMatrix rotatedField = input.applyOperator(JonesMatrices.rotator(rotationAngle));
        PolarizationBasis rotatedBasis = basis.rotate(rotationAngle);
        CoherencyMatrix output = basis.transformCoherency(rotatedField, rotatedBasis);
        return InteractionResult.transmittedOnly(OutputBeam.along(output, rotatedBasis));
    }
}
