package io.polarcraft.api;

import io.polarcraft.math.Complex;

import java.util.Objects;

/**
 * Jones vector (Ex, Ey) of a fully polarized field in a local s-p frame.
 */
public record JonesVector(Complex ex, Complex ey) {

    public static final JonesVector ZERO = new JonesVector(Complex.ZERO, Complex.ZERO);

    public JonesVector {
        Objects.requireNonNull(ex, "ex must not be null");
        Objects.requireNonNull(ey, "ey must not be null");
    }

    /** |Ex|^2 + |Ey|^2. */
    public double intensity() {
        return ex.magnitudeSquared() + ey.magnitudeSquared();
    }

    /** Stokes readout using the Ex Ey* cross term. Always fully polarized. */
    public StokesVector toStokes() {
        double exMagSq = ex.magnitudeSquared();
        double eyMagSq = ey.magnitudeSquared();
        Complex cross = ex.mul(ey.conjugate());
        return new StokesVector(
            exMagSq + eyMagSq,
            exMagSq - eyMagSq,
            2.0 * cross.real,
            2.0 * cross.imag);
    }

    public boolean approxEquals(JonesVector other, double tolerance) {
        return ex.approxEquals(other.ex, tolerance) && ey.approxEquals(other.ey, tolerance);
    }
}
