package io.polarcraft.optics;

import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Complex;
import io.polarcraft.math.Matrix2x2;
import io.polarcraft.math.Vector3;
import io.polarcraft.optics.fresnel.FresnelCoefficients;
import io.polarcraft.optics.fresnel.FresnelSolver;
import io.polarcraft.optics.fresnel.RefractiveIndices;

import java.util.Optional;

/**
 * Boundary between two dielectrics. Reflection and transmission follow the
 * Fresnel equations in the s-p frame of the surface.
 *
 * n1 is the index on the side the normal points into. Light arriving from the
 * other side sees the flipped normal and swapped indices.
 *
 * The incoming basis must be the interface basis of this surface; the tracer
 * guarantees that. Transmitted amplitudes carry the beam-area factor
 * sqrt(n2 cos(theta_t) / n1 cos(theta_i)) so reflected plus transmitted power
 * equals the incident power.
 */
public final class DielectricSurface extends OpticalElement {

    private final double n1;
    private final double n2;

    /** Air to crown glass. */
    public DielectricSurface(String id, Vector3 position, Vector3 normal) {
        this(id, position, normal, RefractiveIndices.AIR, RefractiveIndices.GLASS);
    }

    public DielectricSurface(String id, Vector3 position, Vector3 normal, double n1, double n2) {
        super(id, position, normal);
        if (!(n1 > 0.0) || !(n2 > 0.0) || Double.isInfinite(n1) || Double.isInfinite(n2)) {
            throw new IllegalArgumentException("refractive indices must be finite and > 0; got "
                + n1 + ", " + n2);
        }
        this.n1 = n1;
        this.n2 = n2;
    }

    public double n1() { return n1; }
    public double n2() { return n2; }

    @Override
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis) {
        boolean frontSide = basis.k.dot(normal()) <= 0.0;
        Vector3 facingNormal = frontSide ? normal() : normal().negate();
        double nIn = frontSide ? n1 : n2;
        double nOut = frontSide ? n2 : n1;

        double theta = PolarizationBasis.incidenceAngle(basis.k, facingNormal);
        FresnelCoefficients fresnel = FresnelSolver.solve(nIn, nOut, theta);

        Optional<OutputBeam> reflected = Optional.empty();
        if (fresnel.reflectanceS() > PhysicsConstants.INTENSITY_EPSILON
            || fresnel.reflectanceP() > PhysicsConstants.INTENSITY_EPSILON) {
            CoherencyMatrix reflectedJ = input.applyOperator(Matrix2x2.diagonal(fresnel.rs(), fresnel.rp()));
            if (reflectedJ.isAboveThreshold()) {
                reflected = Optional.of(OutputBeam.along(reflectedJ, basis.computeReflectedBasis(facingNormal)));
            }
        }

        Optional<OutputBeam> transmitted = Optional.empty();
        if (!fresnel.totalInternalReflection()) {
            Complex scale = Complex.real(fresnel.transmittedAmplitudeScale());
            Matrix2x2 transmit = Matrix2x2.diagonal(fresnel.ts().mul(scale), fresnel.tp().mul(scale));
            CoherencyMatrix transmittedJ = input.applyOperator(transmit);
            if (transmittedJ.isAboveThreshold()) {
                transmitted = basis.computeRefractedBasis(facingNormal, nIn, nOut)
                    .map(refracted -> OutputBeam.along(transmittedJ, refracted));
            }
        }
        return new InteractionResult(transmitted, reflected);
    }
}
