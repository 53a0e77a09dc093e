package io.polarcraft.math;

/**
 * Immutable complex scalar used by Jones and coherency algebra.
 *
 * SINGULARITY POLICY:
 *   Operations that would hit a removable singularity return a defined value
 *   instead of infinities or NaN:
 *     div by |z|^2 below ZERO_TOLERANCE  -> ZERO
 *     sqrt of |z| below ROOT_TOLERANCE    -> ZERO
 *     log of |z| below ZERO_TOLERANCE     -> LOG_OF_ZERO (large negative real)
 *     pow of |z| below ROOT_TOLERANCE     -> ZERO for n > 0, ONE for n == 0
 *   Optical scenes pass through zero-amplitude states during normal operation,
 *   so a NaN here would otherwise propagate silently through later matrix products.
 */
public final class Complex {

    /** Absolute tolerance for zero comparisons and division guards. */
    public static final double ZERO_TOLERANCE = 1e-12;

    /** Magnitude below which sqrt and pow collapse to zero. */
    public static final double ROOT_TOLERANCE = 1e-6;

    /** Real value returned by log(0). */
    public static final double LOG_OF_ZERO = -1e10;

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);
    public static final Complex I = new Complex(0.0, 1.0);

    public final double real;
    public final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    // -- Factories ------------------------------------------------------------

    public static Complex real(double value) {
        return new Complex(value, 0.0);
    }

    /** r * e^(i theta). */
    public static Complex fromPolar(double magnitude, double phase) {
        return new Complex(magnitude * Math.cos(phase), magnitude * Math.sin(phase));
    }

    /** Unit phasor e^(i theta). */
    public static Complex expI(double theta) {
        return new Complex(Math.cos(theta), Math.sin(theta));
    }

    // -- Properties -----------------------------------------------------------

    public double magnitude() {
        return Math.hypot(real, imag);
    }

    public double magnitudeSquared() {
        return real * real + imag * imag;
    }

    /** arg(z) in (-pi, pi]. */
    public double phase() {
        return Math.atan2(imag, real);
    }

    // -- Arithmetic -----------------------------------------------------------

    public Complex add(Complex other) {
        return new Complex(real + other.real, imag + other.imag);
    }

    public Complex sub(Complex other) {
        return new Complex(real - other.real, imag - other.imag);
    }

    public Complex mul(Complex other) {
        return new Complex(
            real * other.real - imag * other.imag,
            real * other.imag + imag * other.real);
    }

    /**
     * Division. Returns ZERO when the divisor is below ZERO_TOLERANCE in squared
     * magnitude: zero transmission is the physically safe reading of that case.
     */
    public Complex div(Complex other) {
        double denom = other.magnitudeSquared();
        if (denom < ZERO_TOLERANCE) {
            return ZERO;
        }
        return new Complex(
            (real * other.real + imag * other.imag) / denom,
            (imag * other.real - real * other.imag) / denom);
    }

    public Complex scale(double k) {
        return new Complex(real * k, imag * k);
    }

    public Complex conjugate() {
        return new Complex(real, -imag);
    }

    public Complex negate() {
        return new Complex(-real, -imag);
    }

    // -- Transcendental -------------------------------------------------------

    /** e^z = e^x (cos y + i sin y). */
    public Complex exp() {
        double expReal = Math.exp(real);
        return new Complex(expReal * Math.cos(imag), expReal * Math.sin(imag));
    }

    /** Principal square root. */
    public Complex sqrt() {
        double mag = magnitude();
        if (mag < ROOT_TOLERANCE) {
            return ZERO;
        }
        double halfPhase = phase() / 2.0;
        double sqrtMag = Math.sqrt(mag);
        return new Complex(sqrtMag * Math.cos(halfPhase), sqrtMag * Math.sin(halfPhase));
    }

    /** Principal natural logarithm with arg in (-pi, pi]. */
    public Complex log() {
        double mag = magnitude();
        if (mag < ZERO_TOLERANCE) {
            return new Complex(LOG_OF_ZERO, 0.0);
        }
        return new Complex(Math.log(mag), phase());
    }

    /** z^n for real n, principal branch. */
    public Complex pow(double n) {
        double mag = magnitude();
        if (mag < ROOT_TOLERANCE) {
            if (n == 0.0) {
                return ONE;
            }
            // negative powers of zero have no finite value; zero keeps downstream algebra finite
            return ZERO;
        }
        return fromPolar(Math.pow(mag, n), phase() * n);
    }

    /** z1^z2 = e^(z2 ln z1). */
    public Complex powComplex(Complex exponent) {
        if (isZero()) {
            return ZERO;
        }
        return exponent.mul(log()).exp();
    }

    // -- Comparison -----------------------------------------------------------

    public boolean isZero() {
        return isZero(ZERO_TOLERANCE);
    }

    public boolean isZero(double tolerance) {
        return Math.abs(real) < tolerance && Math.abs(imag) < tolerance;
    }

    public boolean approxEquals(Complex other, double tolerance) {
        return Math.abs(real - other.real) < tolerance
            && Math.abs(imag - other.imag) < tolerance;
    }

    public boolean isReal(double tolerance) {
        return Math.abs(imag) < tolerance;
    }

    public boolean isImaginary(double tolerance) {
        return Math.abs(real) < tolerance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Complex)) {
            return false;
        }
        Complex other = (Complex) o;
        return Double.compare(real, other.real) == 0
            && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(real) + Double.hashCode(imag);
    }

    @Override
    public String toString() {
        if (isZero()) {
            return "0";
        }
        if (isReal(ZERO_TOLERANCE)) {
            return String.format("%.4f", real);
        }
        if (isImaginary(ZERO_TOLERANCE)) {
            return String.format("%.4fi", imag);
        }
        return imag >= 0
            ? String.format("%.4f + %.4fi", real, imag)
            : String.format("%.4f - %.4fi", real, -imag);
    }
}
