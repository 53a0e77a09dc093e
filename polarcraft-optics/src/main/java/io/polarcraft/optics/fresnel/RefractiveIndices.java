package io.polarcraft.optics.fresnel;

/**
 * Refractive indices of common optical media at visible wavelengths, and
 * the dispersion formulas used to evaluate them at other wavelengths.
 */
public final class RefractiveIndices {

    private RefractiveIndices() {}

    public static final double VACUUM = 1.0;
    public static final double AIR = 1.00029;
    public static final double WATER = 1.333;
    /** Generic crown glass. */
    public static final double GLASS = 1.5;
    /** Schott BK7 at the sodium D line. */
    public static final double BK7 = 1.5168;
    public static final double DIAMOND = 2.417;
    public static final double SAPPHIRE = 1.77;
    /** Calcite, ordinary ray. */
    public static final double CALCITE_O = 1.6584;
    /** Calcite, extraordinary ray. */
    public static final double CALCITE_E = 1.4864;
    public static final double QUARTZ = 1.544;
    public static final double ICE = 1.31;
    public static final double ACRYLIC = 1.49;
    public static final double POLYCARBONATE = 1.586;
    public static final double CROWN = 1.52;
    public static final double FLINT = 1.65;

    // -- Sellmeier coefficients for BK7 (wavelength in micrometres) -----------

    private static final double BK7_B1 = 1.03961212;
    private static final double BK7_B2 = 0.231792344;
    private static final double BK7_B3 = 1.01046945;
    private static final double BK7_C1 = 0.00600069867;
    private static final double BK7_C2 = 0.0200179144;
    private static final double BK7_C3 = 103.560653;

    /**
     * BK7 index from the three-term Sellmeier equation.
     *
     * @param wavelengthUm wavelength in micrometres
     */
    public static double sellmeierBK7(double wavelengthUm) {
        if (!(wavelengthUm > 0.0)) {
            throw new IllegalArgumentException("wavelengthUm must be > 0; got " + wavelengthUm);
        }
        double l2 = wavelengthUm * wavelengthUm;
        double n2 = 1.0
            + BK7_B1 * l2 / (l2 - BK7_C1)
            + BK7_B2 * l2 / (l2 - BK7_C2)
            + BK7_B3 * l2 / (l2 - BK7_C3);
        return Math.sqrt(n2);
    }

    /**
     * Two-term Cauchy approximation n = A + B / lambda^2.
     * Units of B must match the square of the wavelength unit.
     */
    public static double cauchy(double wavelength, double a, double b) {
        if (!(wavelength > 0.0)) {
            throw new IllegalArgumentException("wavelength must be > 0; got " + wavelength);
        }
        return a + b / (wavelength * wavelength);
    }
}
