package io.polarcraft.core;

import io.polarcraft.api.EllipseParameters;
import io.polarcraft.api.JonesVector;
import io.polarcraft.api.MaterialContext;
import io.polarcraft.api.StokesVector;
import io.polarcraft.math.Complex;

import java.util.Objects;

import static io.polarcraft.api.PhysicsConstants.SNAPSHOT_DOP_DECIMALS;
import static io.polarcraft.api.PhysicsConstants.SNAPSHOT_ELLIPSE_DECIMALS;
import static io.polarcraft.api.PhysicsConstants.SNAPSHOT_INTENSITY_DECIMALS;
import static io.polarcraft.api.PhysicsConstants.SNAPSHOT_JONES_DECIMALS;
import static io.polarcraft.api.PhysicsConstants.SNAPSHOT_STOKES_DECIMALS;

/**
 * Flat, rounded record of a polarization state for stable snapshot comparison.
 *
 * Rounding: intensity 6 decimals, DoP 4, Stokes 6, ellipse angles 2, Jones 6.
 * Only the Stokes values and material are read back by
 * PolarizationState.fromSnapshot; every other field is derived.
 *
 * @param jones    rounded Jones vector, or null below the fully polarized threshold
 * @param material null when the state carries no material context
 */
public record PolarizationStateSnapshot(double intensity,
                                        double dop,
                                        StokesVector stokes,
                                        double orientationDeg,
                                        double ellipticityDeg,
                                        JonesVector jones,
                                        boolean fullyPolarized,
                                        boolean unpolarized,
                                        boolean linear,
                                        boolean circular,
                                        MaterialContext material) {

    public PolarizationStateSnapshot {
        Objects.requireNonNull(stokes, "stokes must not be null");
    }

    static PolarizationStateSnapshot of(PolarizationState state) {
        StokesVector s = state.stokes();
        EllipseParameters e = state.ellipse();
        JonesVector jones = state.jones().vector().map(j -> new JonesVector(
            round(j.ex(), SNAPSHOT_JONES_DECIMALS), round(j.ey(), SNAPSHOT_JONES_DECIMALS)))
            .orElse(null);
        return new PolarizationStateSnapshot(
            round(state.intensity(), SNAPSHOT_INTENSITY_DECIMALS),
            round(state.dop(), SNAPSHOT_DOP_DECIMALS),
            new StokesVector(
                round(s.s0(), SNAPSHOT_STOKES_DECIMALS),
                round(s.s1(), SNAPSHOT_STOKES_DECIMALS),
                round(s.s2(), SNAPSHOT_STOKES_DECIMALS),
                round(s.s3(), SNAPSHOT_STOKES_DECIMALS)),
            round(e.orientationDeg(), SNAPSHOT_ELLIPSE_DECIMALS),
            round(e.ellipticityDeg(), SNAPSHOT_ELLIPSE_DECIMALS),
            jones,
            state.isFullyPolarized(),
            state.isUnpolarized(),
            state.isLinear(),
            state.isCircular(),
            state.material().orElse(null));
    }

    /** Half-up rounding to a fixed number of decimals; negative zero becomes zero. */
    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale + 0.0;
    }

    private static Complex round(Complex z, int decimals) {
        return new Complex(round(z.real, decimals), round(z.imag, decimals));
    }
}
