package io.polarcraft.optics;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Complex;
import io.polarcraft.math.Matrix2x2;
import io.polarcraft.math.Vector3;

import java.util.Optional;

/**
 * Transmits the p component and reflects the s component.
 * With efficiency e the transmitted operator is diag(sqrt(1-e), sqrt(e)) and
 * the reflected operator diag(sqrt(e), sqrt(1-e)); e = 1 is a perfect splitter.
 */
public final class PolarizingBeamSplitter extends OpticalElement {

    private final double efficiency;

    public PolarizingBeamSplitter(String id, Vector3 position, Vector3 normal) {
        this(id, position, normal, 1.0);
    }

    /** efficiency is clamped to [0, 1]. */
    public PolarizingBeamSplitter(String id, Vector3 position, Vector3 normal, double efficiency) {
        super(id, position, normal);
        if (Double.isNaN(efficiency)) {
            throw new IllegalArgumentException("efficiency must not be NaN");
        }
        this.efficiency = Math.max(0.0, Math.min(1.0, efficiency));
    }

    public double efficiency() {
        return efficiency;
    }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis) {
        double pass = Math.sqrt(efficiency);
        double leak = Math.sqrt(1.0 - efficiency);

        CoherencyMatrix transmitted = input.applyOperator(
            Matrix2x2.diagonal(Complex.real(leak), Complex.real(pass)));
        CoherencyMatrix reflected = input.applyOperator(
            Matrix2x2.diagonal(Complex.real(pass), Complex.real(leak)));

        Optional<OutputBeam> transmittedBeam = transmitted.isAboveThreshold()
            ? Optional.of(OutputBeam.along(transmitted, basis))
            : Optional.empty();
        Optional<OutputBeam> reflectedBeam = reflected.isAboveThreshold()
            ? Optional.of(OutputBeam.along(reflected, basis.computeReflectedBasis(normal())))
            : Optional.empty();
        return new InteractionResult(transmittedBeam, reflectedBeam);
    }
}
