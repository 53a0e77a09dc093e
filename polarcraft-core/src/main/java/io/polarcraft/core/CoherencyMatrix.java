package io.polarcraft.core;

import io.polarcraft.api.EllipseParameters;
import io.polarcraft.api.JonesVector;
import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.api.StokesVector;
import io.polarcraft.math.Complex;
import io.polarcraft.math.Matrix2x2;

import java.util.Objects;

/**
 * Coherency matrix J = &lt;E E-dagger&gt;: the canonical representation of a light state.
 *
 *   | &lt;|Ex|^2&gt;   &lt;Ex Ey*&gt; |
 *   | &lt;Ey Ex*&gt;   &lt;|Ey|^2&gt; |
 *
 * Represents fully, partially and un-polarized light alike. Intensity is trace(J).
 * Stokes parameters are a linear readout of the four real degrees of freedom.
 *
 * IMMUTABILITY:
 *   Every operation returns a new instance. Instances are safe to share across threads.
 *
 * VALIDITY:
 *   Factories always produce Hermitian PSD matrices. Operators applied through
 *   applyOperator preserve both properties up to floating error. Invalid states
 *   are only reported by isPhysical(), never thrown.
 */
public final class CoherencyMatrix {

    public static final CoherencyMatrix ZERO = new CoherencyMatrix(Matrix2x2.ZERO);

    // -- Predefined unit-intensity states -------------------------------------

    public static final CoherencyMatrix HORIZONTAL = createLinear(1.0, 0.0);
    public static final CoherencyMatrix VERTICAL = createLinear(1.0, Math.PI / 2.0);
    public static final CoherencyMatrix DIAGONAL = createLinear(1.0, Math.PI / 4.0);
    public static final CoherencyMatrix ANTI_DIAGONAL = createLinear(1.0, -Math.PI / 4.0);
    public static final CoherencyMatrix RIGHT_CIRCULAR = createCircular(1.0, true);
    public static final CoherencyMatrix LEFT_CIRCULAR = createCircular(1.0, false);
    public static final CoherencyMatrix UNPOLARIZED = createUnpolarized(1.0);

    private final Matrix2x2 matrix;

    private CoherencyMatrix(Matrix2x2 matrix) {
        this.matrix = matrix;
    }

    // -- Factories ------------------------------------------------------------

    /** J = E E-dagger for a fully polarized field. */
    public static CoherencyMatrix fromJones(Complex ex, Complex ey) {
        Objects.requireNonNull(ex, "ex must not be null");
        Objects.requireNonNull(ey, "ey must not be null");
        return new CoherencyMatrix(Matrix2x2.hermitian(
            ex.magnitudeSquared(), ex.mul(ey.conjugate()), ey.magnitudeSquared()));
    }

    public static CoherencyMatrix fromJones(JonesVector jones) {
        Objects.requireNonNull(jones, "jones must not be null");
        return fromJones(jones.ex(), jones.ey());
    }

    /**
     * J00 = (S0 + S1)/2, J11 = (S0 - S1)/2, J01 = (S2 + i S3)/2.
     */
    public static CoherencyMatrix fromStokes(double s0, double s1, double s2, double s3) {
        return new CoherencyMatrix(Matrix2x2.hermitian(
            (s0 + s1) / 2.0, new Complex(s2 / 2.0, s3 / 2.0), (s0 - s1) / 2.0));
    }

    public static CoherencyMatrix fromStokes(StokesVector stokes) {
        Objects.requireNonNull(stokes, "stokes must not be null");
        return fromStokes(stokes.s0(), stokes.s1(), stokes.s2(), stokes.s3());
    }

    /**
     * Wraps a raw matrix. The caller is responsible for Hermitian symmetry;
     * check with isPhysical() when the source is untrusted.
     */
    public static CoherencyMatrix fromMatrix(Matrix2x2 matrix) {
        return new CoherencyMatrix(Objects.requireNonNull(matrix, "matrix must not be null"));
    }

    /** (I/2) x identity. */
    public static CoherencyMatrix createUnpolarized(double intensity) {
        Complex half = Complex.real(Math.max(0.0, intensity) / 2.0);
        return new CoherencyMatrix(Matrix2x2.diagonal(half, half));
    }

    /**
     * @param intensity total intensity
     * @param angle     polarization angle from s, radians
     */
    public static CoherencyMatrix createLinear(double intensity, double angle) {
        double amp = Math.sqrt(Math.max(0.0, intensity));
        return fromJones(Complex.real(amp * Math.cos(angle)), Complex.real(amp * Math.sin(angle)));
    }

    /** Right-handed: Ey = -i Ex. Left-handed: Ey = +i Ex. */
    public static CoherencyMatrix createCircular(double intensity, boolean rightHanded) {
        double amp = Math.sqrt(Math.max(0.0, intensity) / 2.0);
        Complex ey = rightHanded ? new Complex(0.0, -amp) : new Complex(0.0, amp);
        return fromJones(Complex.real(amp), ey);
    }

    /**
     * @param orientation major axis angle from s, radians
     * @param ellipticity chi with tan(chi) = minor/major, in [-pi/4, pi/4]; positive is right-handed
     */
    public static CoherencyMatrix createElliptical(double intensity, double orientation, double ellipticity) {
        return fromJones(ellipticalJones(intensity, orientation, ellipticity));
    }

    /**
     * p J_linear + (1 - p) J_unpolarized with p clamped to [0, 1].
     */
    public static CoherencyMatrix createPartiallyPolarized(double intensity, double dop, double angle) {
        double p = Math.max(0.0, Math.min(1.0, dop));
        return createLinear(intensity * p, angle).add(createUnpolarized(intensity * (1.0 - p)));
    }

    /**
     * Jones vector with the given ellipse:
     *   ex = sqrt(I)(cos psi cos chi + i sin psi sin chi)
     *   ey = sqrt(I)(sin psi cos chi - i cos psi sin chi)
     */
    static JonesVector ellipticalJones(double intensity, double orientation, double ellipticity) {
        double amp = Math.sqrt(Math.max(0.0, intensity));
        double cosO = Math.cos(orientation);
        double sinO = Math.sin(orientation);
        double cosE = Math.cos(ellipticity);
        double sinE = Math.sin(ellipticity);
        return new JonesVector(
            new Complex(amp * cosO * cosE, amp * sinO * sinE),
            new Complex(amp * sinO * cosE, -amp * cosO * sinE));
    }

    // -- Physical properties --------------------------------------------------

    /** I = trace(J). */
    public double intensity() {
        return matrix.trace().real;
    }

    /**
     * DoP = sqrt(1 - 4 det(J) / trace(J)^2), clamped into [0, 1].
     * Returns 0 below INTENSITY_EPSILON instead of evaluating 0/0.
     */
    public double degreeOfPolarization() {
        double intensity = intensity();
        if (intensity < PhysicsConstants.INTENSITY_EPSILON) {
            return 0.0;
        }
        double ratio = 4.0 * matrix.determinant().real / (intensity * intensity);
        return Math.min(1.0, Math.sqrt(Math.max(0.0, 1.0 - ratio)));
    }

    public StokesVector toStokes() {
        double j00 = matrix.a00.real;
        double j11 = matrix.a11.real;
        return new StokesVector(
            j00 + j11,
            j00 - j11,
            2.0 * matrix.a01.real,
            2.0 * matrix.a01.imag);
    }

    /** Major axis angle of the polarized component, atan2(S2, S1)/2, radians. */
    public double orientationAngle() {
        StokesVector s = toStokes();
        return Math.atan2(s.s2(), s.s1()) / 2.0;
    }

    /**
     * Ellipticity angle chi in [-pi/4, pi/4], sin(2 chi) = S3 / (DoP S0).
     * Positive is right-handed. Zero when there is no polarized component.
     */
    public double ellipticityAngle() {
        StokesVector s = toStokes();
        if (s.s0() < PhysicsConstants.INTENSITY_EPSILON) {
            return 0.0;
        }
        double dop = degreeOfPolarization();
        if (dop < PhysicsConstants.INTENSITY_EPSILON) {
            return 0.0;
        }
        double sin2chi = Math.max(-1.0, Math.min(1.0, s.s3() / (dop * s.s0())));
        return Math.asin(sin2chi) / 2.0;
    }

    public EllipseParameters ellipse() {
        return EllipseParameters.fromAngles(orientationAngle(), ellipticityAngle());
    }

    // -- Classification -------------------------------------------------------

    /*
     * Numerical classifiers: DoP within CLASSIFICATION_TOLERANCE of 0 or 1.
     * These are stricter than the display bands of PolarizationState
     * (FULLY_POLARIZED_THRESHOLD / UNPOLARIZED_THRESHOLD), which decide when a
     * Jones vector is offered and how a state is labelled.
     */

    public boolean isUnpolarized() {
        return isUnpolarized(PhysicsConstants.CLASSIFICATION_TOLERANCE);
    }

    public boolean isUnpolarized(double tolerance) {
        return degreeOfPolarization() < tolerance;
    }

    public boolean isFullyPolarized() {
        return isFullyPolarized(PhysicsConstants.CLASSIFICATION_TOLERANCE);
    }

    public boolean isFullyPolarized(double tolerance) {
        return degreeOfPolarization() > 1.0 - tolerance;
    }

    public boolean isLinear() {
        return isLinear(PhysicsConstants.SHAPE_TOLERANCE);
    }

    /** |S3/S0| below tolerance. No light counts as linear. */
    public boolean isLinear(double tolerance) {
        StokesVector s = toStokes();
        if (s.s0() < PhysicsConstants.INTENSITY_EPSILON) {
            return true;
        }
        return Math.abs(s.s3() / s.s0()) < tolerance;
    }

    public boolean isCircular() {
        return isCircular(PhysicsConstants.SHAPE_TOLERANCE);
    }

    /** |S1/S0| and |S2/S0| below tolerance. No light counts as circular. */
    public boolean isCircular(double tolerance) {
        StokesVector s = toStokes();
        if (s.s0() < PhysicsConstants.INTENSITY_EPSILON) {
            return true;
        }
        return Math.abs(s.s1() / s.s0()) < tolerance && Math.abs(s.s2() / s.s0()) < tolerance;
    }

    public boolean isAboveThreshold() {
        return isAboveThreshold(PhysicsConstants.INTENSITY_EPSILON);
    }

    public boolean isAboveThreshold(double threshold) {
        return intensity() > threshold;
    }

    public boolean isPhysical() {
        return isPhysical(PhysicsConstants.PHYSICAL_TOLERANCE);
    }

    /** Hermitian and positive semi-definite within tolerance. */
    public boolean isPhysical(double tolerance) {
        return matrix.isPositiveSemiDefinite(tolerance);
    }

    // -- Operations -----------------------------------------------------------

    public Matrix2x2 rawMatrix() {
        return matrix;
    }

    /** J' = M J M-dagger. */
    public CoherencyMatrix applyOperator(Matrix2x2 operator) {
        Objects.requireNonNull(operator, "operator must not be null");
        return new CoherencyMatrix(operator.mul(matrix.mul(operator.adjoint())));
    }

    /** Incoherent superposition. */
    public CoherencyMatrix add(CoherencyMatrix other) {
        return new CoherencyMatrix(matrix.add(other.matrix));
    }

    public CoherencyMatrix scale(double factor) {
        return new CoherencyMatrix(matrix.scale(factor));
    }

    /**
     * J' = (1 - f) J + f (I/2) identity with f clamped to [0, 1].
     * f within PHYSICAL_TOLERANCE of 0 returns this; of 1 returns the unpolarized state.
     */
    public CoherencyMatrix depolarize(double factor) {
        double f = Math.max(0.0, Math.min(1.0, factor));
        if (f < PhysicsConstants.PHYSICAL_TOLERANCE) {
            return this;
        }
        CoherencyMatrix unpolarized = createUnpolarized(intensity());
        if (f > 1.0 - PhysicsConstants.PHYSICAL_TOLERANCE) {
            return unpolarized;
        }
        return new CoherencyMatrix(matrix.scale(1.0 - f).add(unpolarized.matrix.scale(f)));
    }

    public boolean approxEquals(CoherencyMatrix other, double tolerance) {
        return matrix.approxEquals(other.matrix, tolerance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CoherencyMatrix)) {
            return false;
        }
        return matrix.equals(((CoherencyMatrix) o).matrix);
    }

    @Override
    public int hashCode() {
        return matrix.hashCode();
    }

    @Override
    public String toString() {
        StokesVector s = toStokes();
        return String.format("CoherencyMatrix(I=%.4f, DoP=%.3f, theta=%.1fdeg, S=[%.3f, %.3f, %.3f, %.3f])",
            intensity(), degreeOfPolarization(), Math.toDegrees(orientationAngle()),
            s.s0(), s.s1(), s.s2(), s.s3());
    }
}
