package io.polarcraft.api;

/**
 * Stokes parameters [S0, S1, S2, S3].
 *
 * S0 total intensity, S1 horizontal minus vertical, S2 +45 minus -45,
 * S3 right minus left circular.
 */
public record StokesVector(double s0, double s1, double s2, double s3) {

    public static final StokesVector ZERO = new StokesVector(0, 0, 0, 0);

    public StokesVector {
        if (!Double.isFinite(s0) || !Double.isFinite(s1)
            || !Double.isFinite(s2) || !Double.isFinite(s3)) {
            throw new IllegalArgumentException(
                "Stokes components must be finite; got [" + s0 + ", " + s1 + ", " + s2 + ", " + s3 + "]");
        }
    }

    /** sqrt(S1^2 + S2^2 + S3^2). */
    public double polarizedIntensity() {
        return Math.sqrt(s1 * s1 + s2 * s2 + s3 * s3);
    }

    /** Polarized fraction clamped to [0, 1]; 0 when S0 is below INTENSITY_EPSILON. */
    public double degreeOfPolarization() {
        if (s0 < PhysicsConstants.INTENSITY_EPSILON) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, polarizedIntensity() / s0));
    }

    /** True when the polarized part does not exceed the total intensity. */
    public boolean isPhysical(double tolerance) {
        return s0 >= -tolerance && polarizedIntensity() <= s0 + tolerance;
    }

    /** Copy scaled to unit S0, or ZERO when there is no light. */
    public StokesVector normalized() {
        if (s0 < PhysicsConstants.INTENSITY_EPSILON) {
            return ZERO;
        }
        return new StokesVector(1.0, s1 / s0, s2 / s0, s3 / s0);
    }

    public double[] toArray() {
        return new double[] {s0, s1, s2, s3};
    }

    public static StokesVector of(double[] values) {
        if (values == null || values.length != 4) {
            throw new IllegalArgumentException("Stokes array must have exactly 4 components");
        }
        return new StokesVector(values[0], values[1], values[2], values[3]);
    }
}
