package io.polarcraft.core;

import io.polarcraft.api.EllipseParameters;
import io.polarcraft.api.Handedness;
import io.polarcraft.api.JonesVector;
import io.polarcraft.api.MaterialContext;
import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.api.PolarizationCategory;
import io.polarcraft.api.StokesVector;
import io.polarcraft.math.Complex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Unified view of a polarization state.
 *
 * The coherency matrix is the ground truth. Stokes, Jones and ellipse views
 * are derived from it on each access; nothing is cached because every view
 * is a handful of arithmetic operations.
 *
 * Angles taken and returned by this class are in degrees.
 */
public final class PolarizationState {

    public static final PolarizationState ZERO = new PolarizationState(CoherencyMatrix.ZERO, null);

    private final CoherencyMatrix coherency;
    private final MaterialContext material;

    private PolarizationState(CoherencyMatrix coherency, MaterialContext material) {
        this.coherency = coherency;
        this.material = material;
    }

    // -- Factories ------------------------------------------------------------

    public static PolarizationState fromCoherency(CoherencyMatrix coherency) {
        return fromCoherency(coherency, null);
    }

    /** @param material may be null */
    public static PolarizationState fromCoherency(CoherencyMatrix coherency, MaterialContext material) {
        Objects.requireNonNull(coherency, "coherency must not be null");
        return new PolarizationState(coherency, material);
    }

    public static PolarizationState fromJones(Complex ex, Complex ey) {
        return new PolarizationState(CoherencyMatrix.fromJones(ex, ey), null);
    }

    public static PolarizationState fromStokes(StokesVector stokes) {
        return fromStokes(stokes, null);
    }

    public static PolarizationState fromStokes(StokesVector stokes, MaterialContext material) {
        return new PolarizationState(CoherencyMatrix.fromStokes(stokes), material);
    }

    public static PolarizationState createLinear(double intensity, double angleDeg) {
        return new PolarizationState(
            CoherencyMatrix.createLinear(intensity, Math.toRadians(angleDeg)), null);
    }

    public static PolarizationState createCircular(double intensity, boolean rightHanded) {
        return new PolarizationState(CoherencyMatrix.createCircular(intensity, rightHanded), null);
    }

    public static PolarizationState createUnpolarized(double intensity) {
        return new PolarizationState(CoherencyMatrix.createUnpolarized(intensity), null);
    }

    public static PolarizationState createElliptical(double intensity,
                                                     double orientationDeg,
                                                     double ellipticityDeg) {
        return new PolarizationState(CoherencyMatrix.createElliptical(
            intensity, Math.toRadians(orientationDeg), Math.toRadians(ellipticityDeg)), null);
    }

    public static PolarizationState createPartiallyPolarized(double intensity, double dop, double angleDeg) {
        return new PolarizationState(
            CoherencyMatrix.createPartiallyPolarized(intensity, dop, Math.toRadians(angleDeg)), null);
    }

    public PolarizationState withMaterial(MaterialContext context) {
        return new PolarizationState(coherency, context);
    }

    // -- Views ----------------------------------------------------------------

    public CoherencyMatrix coherency() {
        return coherency;
    }

    public Optional<MaterialContext> material() {
        return Optional.ofNullable(material);
    }

    public StokesVector stokes() {
        return coherency.toStokes();
    }

    /**
     * Jones vector of the state.
     * NoLight below INTENSITY_EPSILON; NotFullyPolarized when DoP is under
     * FULLY_POLARIZED_THRESHOLD; otherwise the vector rebuilt from the ellipse.
     */
    public JonesView jones() {
        if (!coherency.isAboveThreshold()) {
            return new JonesView.NoLight();
        }
        double dop = dop();
        if (dop < PhysicsConstants.FULLY_POLARIZED_THRESHOLD) {
            return new JonesView.NotFullyPolarized(dop);
        }
        return new JonesView.Defined(CoherencyMatrix.ellipticalJones(
            intensity(), coherency.orientationAngle(), coherency.ellipticityAngle()));
    }

    public EllipseParameters ellipse() {
        return coherency.ellipse();
    }

    // -- Physical properties --------------------------------------------------

    public double intensity() {
        return coherency.intensity();
    }

    public double dop() {
        return coherency.degreeOfPolarization();
    }

    /**
     * DoP at or above FULLY_POLARIZED_THRESHOLD: the band in which a Jones vector
     * is offered. Looser than CoherencyMatrix.isFullyPolarized().
     */
    public boolean isFullyPolarized() {
        return dop() >= PhysicsConstants.FULLY_POLARIZED_THRESHOLD;
    }

    public boolean isUnpolarized() {
        return dop() <= PhysicsConstants.UNPOLARIZED_THRESHOLD;
    }

    public boolean isPartiallyPolarized() {
        double dop = dop();
        return dop > PhysicsConstants.UNPOLARIZED_THRESHOLD
            && dop < PhysicsConstants.FULLY_POLARIZED_THRESHOLD;
    }

    public boolean isLinear() {
        return coherency.isLinear() && isFullyPolarized();
    }

    public boolean isCircular() {
        return coherency.isCircular() && isFullyPolarized();
    }

    public boolean exists() {
        return coherency.isAboveThreshold();
    }

    /**
     * Shape of the polarized component. Partially polarized states are
     * classified by that component, so a 50% linear beam is LINEAR.
     */
    public PolarizationCategory category() {
        if (isUnpolarized()) {
            return PolarizationCategory.UNPOLARIZED;
        }
        if (coherency.isLinear()) {
            return PolarizationCategory.LINEAR;
        }
        if (coherency.isCircular()) {
            return PolarizationCategory.CIRCULAR;
        }
        return PolarizationCategory.ELLIPTICAL;
    }

    public Handedness handedness() {
        PolarizationCategory category = category();
        if (category == PolarizationCategory.UNPOLARIZED || category == PolarizationCategory.LINEAR) {
            return Handedness.NONE;
        }
        double s3 = stokes().s3();
        if (s3 > 0) {
            return Handedness.RIGHT;
        }
        return s3 < 0 ? Handedness.LEFT : Handedness.NONE;
    }

    // -- Validation -----------------------------------------------------------

    /** Physical-consistency violations; empty when the state is valid. */
    public List<String> validate() {
        List<String> violations = new ArrayList<>();
        double intensity = intensity();
        if (intensity < -PhysicsConstants.INTENSITY_EPSILON) {
            violations.add("Negative intensity: " + intensity);
        }
        double dop = dop();
        if (dop < -PhysicsConstants.INTENSITY_EPSILON || dop > 1.0 + PhysicsConstants.INTENSITY_EPSILON) {
            violations.add("DoP out of range [0, 1]: " + dop);
        }
        StokesVector s = stokes();
        double polarized = s.polarizedIntensity();
        if (polarized > s.s0() + PhysicsConstants.PHYSICAL_TOLERANCE) {
            violations.add(String.format(
                "Stokes constraint violated: sqrt(S1^2+S2^2+S3^2)=%.6f > S0=%.6f", polarized, s.s0()));
        }
        if (!coherency.isPhysical()) {
            violations.add("Coherency matrix is not positive semi-definite");
        }
        return violations;
    }

    public boolean isPhysical() {
        return validate().isEmpty();
    }

    // -- Snapshot -------------------------------------------------------------

    public PolarizationStateSnapshot toSnapshot() {
        return PolarizationStateSnapshot.of(this);
    }

    /** Rebuilds a state from the snapshot's Stokes values and material only. */
    public static PolarizationState fromSnapshot(PolarizationStateSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        return fromStokes(snapshot.stokes(), snapshot.material());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PolarizationState)) {
            return false;
        }
        PolarizationState other = (PolarizationState) o;
        return coherency.equals(other.coherency) && Objects.equals(material, other.material);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coherency, material);
    }

    @Override
    public String toString() {
        StokesVector s = stokes();
        EllipseParameters e = ellipse();
        return String.format(
            "PolarizationState(I=%.4f, DoP=%.3f, psi=%.1fdeg, chi=%.1fdeg, S=[%.3f, %.3f, %.3f, %.3f])",
            intensity(), dop(), e.orientationDeg(), e.ellipticityDeg(),
            s.s0(), s.s1(), s.s2(), s.s3());
    }
}
