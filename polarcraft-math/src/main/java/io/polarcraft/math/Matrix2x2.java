package io.polarcraft.math;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable 2x2 complex matrix for Jones operators and coherency matrices.
 *
 * Layout:
 *   | a00 a01 |
 *   | a10 a11 |
 *
 * Tolerance-parameterised predicates default to Complex.ZERO_TOLERANCE.
 */
public final class Matrix2x2 {

    public static final Matrix2x2 ZERO = new Matrix2x2(
        Complex.ZERO, Complex.ZERO,
        Complex.ZERO, Complex.ZERO);

    public static final Matrix2x2 IDENTITY = new Matrix2x2(
        Complex.ONE, Complex.ZERO,
        Complex.ZERO, Complex.ONE);

    public final Complex a00;
    public final Complex a01;
    public final Complex a10;
    public final Complex a11;

    public Matrix2x2(Complex a00, Complex a01, Complex a10, Complex a11) {
        this.a00 = Objects.requireNonNull(a00, "a00 must not be null");
        this.a01 = Objects.requireNonNull(a01, "a01 must not be null");
        this.a10 = Objects.requireNonNull(a10, "a10 must not be null");
        this.a11 = Objects.requireNonNull(a11, "a11 must not be null");
    }

    // -- Factories ------------------------------------------------------------

    public static Matrix2x2 fromReal(double a00, double a01, double a10, double a11) {
        return new Matrix2x2(
            Complex.real(a00), Complex.real(a01),
            Complex.real(a10), Complex.real(a11));
    }

    public static Matrix2x2 diagonal(Complex d0, Complex d1) {
        return new Matrix2x2(d0, Complex.ZERO, Complex.ZERO, d1);
    }

    public static Matrix2x2 scaledIdentity(Complex s) {
        return new Matrix2x2(s, Complex.ZERO, Complex.ZERO, s);
    }

    /**
     * Builds a Hermitian matrix from its upper triangle.
     * The lower off-diagonal element is the conjugate of j01.
     */
    public static Matrix2x2 hermitian(double j00, Complex j01, double j11) {
        return new Matrix2x2(Complex.real(j00), j01, j01.conjugate(), Complex.real(j11));
    }

    /**
     * Active SO(2) rotation by angle theta:
     *   | cos -sin |
     *   | sin  cos |
     */
    public static Matrix2x2 rotation(double theta) {
        double c = Math.cos(theta);
        double s = Math.sin(theta);
        return fromReal(c, -s, s, c);
    }

    // -- Element access -------------------------------------------------------

    public Complex get(int row, int col) {
        if (row < 0 || row > 1 || col < 0 || col > 1) {
            throw new IndexOutOfBoundsException("row/col must be 0 or 1; got " + row + "," + col);
        }
        if (row == 0) {
            return col == 0 ? a00 : a01;
        }
        return col == 0 ? a10 : a11;
    }

    // -- Arithmetic -----------------------------------------------------------

    public Matrix2x2 add(Matrix2x2 other) {
        return new Matrix2x2(
            a00.add(other.a00), a01.add(other.a01),
            a10.add(other.a10), a11.add(other.a11));
    }

    public Matrix2x2 sub(Matrix2x2 other) {
        return new Matrix2x2(
            a00.sub(other.a00), a01.sub(other.a01),
            a10.sub(other.a10), a11.sub(other.a11));
    }

    public Matrix2x2 scale(double k) {
        return new Matrix2x2(a00.scale(k), a01.scale(k), a10.scale(k), a11.scale(k));
    }

    public Matrix2x2 scale(Complex z) {
        return new Matrix2x2(a00.mul(z), a01.mul(z), a10.mul(z), a11.mul(z));
    }

    /** this x other. */
    public Matrix2x2 mul(Matrix2x2 other) {
        return new Matrix2x2(
            a00.mul(other.a00).add(a01.mul(other.a10)),
            a00.mul(other.a01).add(a01.mul(other.a11)),
            a10.mul(other.a00).add(a11.mul(other.a10)),
            a10.mul(other.a01).add(a11.mul(other.a11)));
    }

    /** M x [v0, v1]^T, returned as a two-element array. */
    public Complex[] apply(Complex v0, Complex v1) {
        return new Complex[] {
            a00.mul(v0).add(a01.mul(v1)),
            a10.mul(v0).add(a11.mul(v1))
        };
    }

    // -- Matrix properties ----------------------------------------------------

    public Complex trace() {
        return a00.add(a11);
    }

    public Complex determinant() {
        return a00.mul(a11).sub(a01.mul(a10));
    }

    /** Conjugate transpose M-dagger. adjoint(adjoint(M)) == M exactly. */
    public Matrix2x2 adjoint() {
        return new Matrix2x2(
            a00.conjugate(), a10.conjugate(),
            a01.conjugate(), a11.conjugate());
    }

    public Matrix2x2 transpose() {
        return new Matrix2x2(a00, a10, a01, a11);
    }

    public Matrix2x2 conjugate() {
        return new Matrix2x2(
            a00.conjugate(), a01.conjugate(),
            a10.conjugate(), a11.conjugate());
    }

    /**
     * Inverse, or empty when |det|^2 is below Complex.ZERO_TOLERANCE.
     * Uses the same cut-off as Complex.div, so a present result is always a true inverse.
     */
    public Optional<Matrix2x2> inverse() {
        Complex det = determinant();
        if (det.magnitudeSquared() < Complex.ZERO_TOLERANCE) {
            return Optional.empty();
        }
        Complex invDet = Complex.ONE.div(det);
        return Optional.of(new Matrix2x2(
            a11.mul(invDet), a01.negate().mul(invDet),
            a10.negate().mul(invDet), a00.mul(invDet)));
    }

    public double frobeniusNorm() {
        return Math.sqrt(a00.magnitudeSquared() + a01.magnitudeSquared()
            + a10.magnitudeSquared() + a11.magnitudeSquared());
    }

    // -- Predicates -----------------------------------------------------------

    public boolean isHermitian() {
        return isHermitian(Complex.ZERO_TOLERANCE);
    }

    /** Real diagonal and conjugate-symmetric off-diagonal within tolerance. */
    public boolean isHermitian(double tolerance) {
        return a00.isReal(tolerance)
            && a11.isReal(tolerance)
            && a01.approxEquals(a10.conjugate(), tolerance);
    }

    public boolean isUnitary(double tolerance) {
        Matrix2x2 product = mul(adjoint());
        return product.a00.sub(Complex.ONE).isZero(tolerance)
            && product.a01.isZero(tolerance)
            && product.a10.isZero(tolerance)
            && product.a11.sub(Complex.ONE).isZero(tolerance);
    }

    public boolean isZero(double tolerance) {
        return a00.isZero(tolerance) && a01.isZero(tolerance)
            && a10.isZero(tolerance) && a11.isZero(tolerance);
    }

    public boolean isPositiveSemiDefinite() {
        return isPositiveSemiDefinite(Complex.ZERO_TOLERANCE);
    }

    /**
     * Closed-form 2x2 test: Hermitian, trace >= 0 and det >= 0.
     * No eigendecomposition.
     */
    public boolean isPositiveSemiDefinite(double tolerance) {
        if (!isHermitian(tolerance)) {
            return false;
        }
        return trace().real >= -tolerance && determinant().real >= -tolerance;
    }

    public boolean approxEquals(Matrix2x2 other, double tolerance) {
        return a00.approxEquals(other.a00, tolerance)
            && a01.approxEquals(other.a01, tolerance)
            && a10.approxEquals(other.a10, tolerance)
            && a11.approxEquals(other.a11, tolerance);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Matrix2x2)) {
            return false;
        }
        Matrix2x2 other = (Matrix2x2) o;
        return a00.equals(other.a00) && a01.equals(other.a01)
            && a10.equals(other.a10) && a11.equals(other.a11);
    }

    @Override
    public int hashCode() {
        return Objects.hash(a00, a01, a10, a11);
    }

    @Override
    public String toString() {
        return "[[" + a00 + ", " + a01 + "], [" + a10 + ", " + a11 + "]]";
    }
}
