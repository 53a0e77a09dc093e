package io.polarcraft.api;

/**
 * Polarization ellipse of the polarized component.
 *
 * @param orientationDeg major axis angle from s, normalised into [0, 180)
 * @param ellipticityDeg ellipticity angle in [-45, 45]; positive is right-handed
 * @param azimuth        Poincare sphere longitude 2 psi, radians
 * @param elevation      Poincare sphere latitude 2 chi, radians
 */
public record EllipseParameters(double orientationDeg,
                                double ellipticityDeg,
                                double azimuth,
                                double elevation) {

    public static EllipseParameters fromAngles(double orientationRad, double ellipticityRad) {
        return new EllipseParameters(
            normalizeDegrees(Math.toDegrees(orientationRad)),
            Math.toDegrees(ellipticityRad),
            2.0 * orientationRad,
            2.0 * ellipticityRad);
    }

    /** Minor over major axis ratio, tan|chi|. */
    public double axisRatio() {
        return Math.tan(Math.toRadians(Math.abs(ellipticityDeg)));
    }

    public Handedness handedness(double toleranceDeg) {
        if (ellipticityDeg > toleranceDeg) {
            return Handedness.RIGHT;
        }
        if (ellipticityDeg < -toleranceDeg) {
            return Handedness.LEFT;
        }
        return Handedness.NONE;
    }

    /** Wraps any angle in degrees into [0, 180). */
    public static double normalizeDegrees(double deg) {
        double a = deg % 180.0;
        if (a < 0) {
            a += 180.0;
        }
        // tiny negative inputs round up to exactly 180
        return a >= 180.0 ? 0.0 : a;
    }
}
