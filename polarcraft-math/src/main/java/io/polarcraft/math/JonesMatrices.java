package io.polarcraft.math;

/**
 * Jones operators for the standard linear optical elements.
 *
 * All angles are measured in radians from the first basis axis (s) toward
 * the second (p) in the frame the operator is applied in.
 */
public final class JonesMatrices {

    private JonesMatrices() {}

    /**
     * Rank-1 projector onto the transmission axis at angle theta:
     *   | c^2 cs  |
     *   | cs  s^2 |
     */
    public static Matrix2x2 linearPolarizer(double theta) {
        double c = Math.cos(theta);
        double s = Math.sin(theta);
        return Matrix2x2.fromReal(c * c, c * s, c * s, s * s);
    }

    /**
     * Linear retarder with fast axis at theta and retardance delta applied to the slow axis.
     * M = R(theta) diag(1, e^(i delta)) R(-theta).
     */
    public static Matrix2x2 wavePlate(double fastAxis, double retardance) {
        Matrix2x2 retarder = Matrix2x2.diagonal(Complex.ONE, Complex.expI(retardance));
        return Matrix2x2.rotation(fastAxis)
            .mul(retarder)
            .mul(Matrix2x2.rotation(-fastAxis));
    }

    public static Matrix2x2 quarterWavePlate(double fastAxis) {
        return wavePlate(fastAxis, Math.PI / 2.0);
    }

    public static Matrix2x2 halfWavePlate(double fastAxis) {
        return wavePlate(fastAxis, Math.PI);
    }

    /** Lossless rotation of the field by angle. */
    public static Matrix2x2 rotator(double angle) {
        return Matrix2x2.rotation(angle);
    }

    /** Uniform phase shift on both axes. */
    public static Matrix2x2 phaseShift(double phase) {
        return Matrix2x2.scaledIdentity(Complex.expI(phase));
    }

    /** Uniform amplitude scale by sqrt(transmission). */
    public static Matrix2x2 attenuator(double transmission) {
        return Matrix2x2.scaledIdentity(Complex.real(Math.sqrt(Math.max(0.0, transmission))));
    }
}
