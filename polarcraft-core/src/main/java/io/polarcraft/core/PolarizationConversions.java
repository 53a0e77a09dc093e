package io.polarcraft.core;

import io.polarcraft.api.JonesVector;
import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.api.StokesVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Conversions between the Jones and Stokes representations, and the
 * passive-optics energy conservation check.
 */
public final class PolarizationConversions {

    private static final Logger log = LogManager.getLogger(PolarizationConversions.class);

    private PolarizationConversions() {}

    /**
     * Jones vector for a Stokes vector, defined only for fully polarized light.
     * psi = atan2(S2, S1)/2, chi = asin(S3 / |S_pol|)/2.
     */
    public static JonesView stokesToJones(StokesVector stokes) {
        Objects.requireNonNull(stokes, "stokes must not be null");
        if (stokes.s0() < PhysicsConstants.INTENSITY_EPSILON) {
            return new JonesView.NoLight();
        }
        double polarized = stokes.polarizedIntensity();
        double dop = polarized / stokes.s0();
        if (dop < PhysicsConstants.FULLY_POLARIZED_THRESHOLD) {
            return new JonesView.NotFullyPolarized(dop);
        }
        double psi = Math.atan2(stokes.s2(), stokes.s1()) / 2.0;
        double chi = Math.asin(Math.max(-1.0, Math.min(1.0, stokes.s3() / polarized))) / 2.0;
        return new JonesView.Defined(CoherencyMatrix.ellipticalJones(stokes.s0(), psi, chi));
    }

    public static StokesVector jonesToStokes(JonesVector jones) {
        Objects.requireNonNull(jones, "jones must not be null");
        return jones.toStokes();
    }

    public static ConservationReport validateConservation(PolarizationState input, PolarizationState output) {
        return validateConservation(input, output, PhysicsConstants.CONSERVATION_TOLERANCE);
    }

    /**
     * Checks output intensity does not exceed input intensity by more than tolerance.
     * A violation is a physics defect in the element that produced the output;
     * it is logged at WARN and returned, never thrown.
     */
    public static ConservationReport validateConservation(PolarizationState input,
                                                          PolarizationState output,
                                                          double tolerance) {
        Objects.requireNonNull(input, "input must not be null");
        Objects.requireNonNull(output, "output must not be null");
        double inI = input.intensity();
        if (inI < PhysicsConstants.INTENSITY_EPSILON) {
            return new ConservationReport(true, 0.0, "Input below threshold.");
        }
        double ratio = output.intensity() / inI;
        if (ratio > 1.0 + tolerance) {
            String message = String.format(
                "ENERGY CONSERVATION VIOLATION: output/input = %.6f > 1. "
                + "This is physically impossible in passive optics.", ratio);
            log.warn("[conservation] {}", message);
            return new ConservationReport(false, ratio, message);
        }
        return new ConservationReport(true, ratio, String.format("Transmittance: %.2f%%.", ratio * 100.0));
    }
}
