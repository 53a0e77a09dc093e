package io.polarcraft.optics.material;

import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.math.JonesMatrices;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Optical rotation by chiral media.
 *
 * alpha = [alpha]_lambda c l with the single-term Drude scaling
 * [alpha]_lambda = [alpha]_D (589 / lambda)^2. Angles in degrees,
 * concentration in g/mL, path length in decimetres.
 */
public final class OpticalActivity {

    private OpticalActivity() {}

    public static double specificRotationAt(double specificRotationD, double wavelengthNm) {
        if (!(wavelengthNm > 0.0)) {
            throw new IllegalArgumentException("wavelengthNm must be > 0; got " + wavelengthNm);
        }
        double ratio = PhysicsConstants.SODIUM_D_WAVELENGTH_NM / wavelengthNm;
        return specificRotationD * ratio * ratio;
    }

    /** alpha = [alpha] c l, degrees. */
    public static double rotationAngle(double specificRotation, double concentration, double pathLengthDm) {
        return specificRotation * concentration * pathLengthDm;
    }

    public static double rotationDegrees(ChiralMaterial material, double wavelengthNm,
                                         double concentration, double pathLengthDm) {
        Objects.requireNonNull(material, "material must not be null");
        return rotationAngle(specificRotationAt(material.specificRotation(), wavelengthNm),
            concentration, pathLengthDm);
    }

    public static CoherencyMatrix applyRotation(CoherencyMatrix state, double rotationDeg) {
        return state.applyOperator(JonesMatrices.rotator(Math.toRadians(rotationDeg)));
    }

    /**
     * Horizontal polarizer, sample cell, analyzer at analyzerAngleDeg.
     * Transmitted intensity follows I0 cos^2(alpha - beta).
     */
    public static PolarimeterReading simulatePolarimeter(ChiralMaterial material,
                                                         double wavelengthNm,
                                                         double concentration,
                                                         double pathLengthDm,
                                                         double analyzerAngleDeg,
                                                         double inputIntensity) {
        double alpha = rotationDegrees(material, wavelengthNm, concentration, pathLengthDm);
        CoherencyMatrix afterPolarizer = CoherencyMatrix.createLinear(inputIntensity, 0.0);
        CoherencyMatrix afterSample = applyRotation(afterPolarizer, alpha);
        CoherencyMatrix output = afterSample.applyOperator(
            JonesMatrices.linearPolarizer(Math.toRadians(analyzerAngleDeg)));

        double nullPoint = ((alpha % 360.0) + 360.0) % 360.0;
        double measured = concentration > 0.0 && pathLengthDm > 0.0
            ? alpha / (concentration * pathLengthDm)
            : 0.0;
        return new PolarimeterReading(alpha, nullPoint, output.intensity(), output, alpha >= 0.0, measured);
    }

    /** Rotation against wavelength over [min, max] inclusive. */
    public static List<DispersionPoint> rotatoryDispersionCurve(ChiralMaterial material,
                                                                double concentration,
                                                                double pathLengthDm,
                                                                double minWavelengthNm,
                                                                double maxWavelengthNm,
                                                                double stepNm) {
        if (!(stepNm > 0.0)) {
            throw new IllegalArgumentException("stepNm must be > 0; got " + stepNm);
        }
        List<DispersionPoint> curve = new ArrayList<>();
        int steps = (int) Math.floor((maxWavelengthNm - minWavelengthNm) / stepNm + 1e-9);
        for (int i = 0; i <= steps; i++) {
            double lambda = minWavelengthNm + i * stepNm;
            curve.add(new DispersionPoint(lambda,
                rotationDegrees(material, lambda, concentration, pathLengthDm)));
        }
        return curve;
    }

    /**
     * @param rotationDeg                 rotation produced by the sample
     * @param nullPointDeg                analyzer angle of maximum transmission, [0, 360)
     * @param transmittedIntensity        intensity after the analyzer
     * @param outputState                 state after the analyzer
     * @param dextrorotatory              rotation is non-negative
     * @param measuredSpecificRotation    alpha / (c l), or 0 for an empty cell
     */
    public record PolarimeterReading(double rotationDeg,
                                     double nullPointDeg,
                                     double transmittedIntensity,
                                     CoherencyMatrix outputState,
                                     boolean dextrorotatory,
                                     double measuredSpecificRotation) {}

    public record DispersionPoint(double wavelengthNm, double rotationDeg) {}
}
