package io.polarcraft.optics;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.JonesMatrices;
import io.polarcraft.math.Vector3;
import io.polarcraft.optics.material.BirefringentMaterial;

import java.util.Objects;

/**
 * Retarder whose retardance follows from plate thickness and material:
 *   delta(lambda) = 2 pi d delta-n(lambda) / lambda
 *
 * A plate cut as a quarter-wave plate at its design wavelength is only
 * approximately quarter-wave at other colours. The two-argument interact()
 * uses the design wavelength; the tracer passes each ray's own wavelength.
 */
public final class DispersiveWavePlate extends OpticalElement {

    private final Vector3 fastAxis;
    private final BirefringentMaterial material;
    private final double thicknessUm;
    private final double designWavelengthNm;

    public DispersiveWavePlate(String id, Vector3 position, Vector3 normal, Vector3 fastAxis,
                               BirefringentMaterial material, double thicknessUm,
                               double designWavelengthNm) {
        super(id, position, normal);
        this.material = Objects.requireNonNull(material, "material must not be null");
        if (!(thicknessUm >= 0.0) || Double.isInfinite(thicknessUm)) {
            throw new IllegalArgumentException("thicknessUm must be finite and >= 0; got " + thicknessUm);
        }
        if (!(designWavelengthNm > 0.0)) {
            throw new IllegalArgumentException("designWavelengthNm must be > 0; got " + designWavelengthNm);
        }
        this.fastAxis = inPlaneAxis(fastAxis);
        this.thicknessUm = thicknessUm;
        this.designWavelengthNm = designWavelengthNm;
    }

    /** Plate of the thickness giving exactly pi/2 at designWavelengthNm. */
    public static DispersiveWavePlate designQuarterWave(String id, Vector3 position, Vector3 normal,
                                                        Vector3 fastAxis, BirefringentMaterial material,
                                                        double designWavelengthNm) {
        double thickness = material.requiredThickness(Math.PI / 2.0, designWavelengthNm);
        return new DispersiveWavePlate(id, position, normal, fastAxis, material, thickness, designWavelengthNm);
    }

    /** Plate of the thickness giving exactly pi at designWavelengthNm. */
    public static DispersiveWavePlate designHalfWave(String id, Vector3 position, Vector3 normal,
                                                     Vector3 fastAxis, BirefringentMaterial material,
                                                     double designWavelengthNm) {
        double thickness = material.requiredThickness(Math.PI, designWavelengthNm);
        return new DispersiveWavePlate(id, position, normal, fastAxis, material, thickness, designWavelengthNm);
    }

    public Vector3 fastAxis() { return fastAxis; }
    public BirefringentMaterial material() { return material; }
    public double thicknessUm() { return thicknessUm; }
    public double designWavelengthNm() { return designWavelengthNm; }

    public double retardanceAt(double wavelengthNm) {
        return material.phaseRetardation(thicknessUm, wavelengthNm);
    }

    public double designRetardance() {
        return retardanceAt(designWavelengthNm);
    }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis) {
        return interact(input, basis, designWavelengthNm);
    }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis, double wavelengthNm) {
        double theta = axisAngle(fastAxis, basis);
        double delta = retardanceAt(wavelengthNm);
        return passThrough(input.applyOperator(JonesMatrices.wavePlate(theta, delta)), basis);
    }
}
