package io.polarcraft.api;

/**
 * Global constants for the PolarCraft physics engine.
 *
 * Tolerances are tuned together. Loosening one without the others breaks
 * the classification thresholds and the conservation checks downstream.
 */
public final class PhysicsConstants {

    private PhysicsConstants() {}

    // -- Numeric tolerances ---------------------------------------------------

    /** Intensity at or below which light is treated as absent. DoP is 0 below this. */
    public static final double INTENSITY_EPSILON = 1e-10;

    /** Slack for Hermitian/PSD checks on coherency matrices. */
    public static final double PHYSICAL_TOLERANCE = 1e-8;

    /**
     * Minimum |k x n| for a well-defined plane of incidence.
     * Below it the interface basis falls back to the least-aligned coordinate axis.
     */
    public static final double GEOMETRIC_EPSILON = 1e-8;

    /** Angular slack used when clamping incidence angles. */
    public static final double ANGLE_EPSILON = 1e-10;

    /**
     * Default tolerance for CoherencyMatrix.isUnpolarized / isFullyPolarized.
     * PolarizationState uses the wider FULLY_POLARIZED / UNPOLARIZED thresholds below.
     */
    public static final double CLASSIFICATION_TOLERANCE = 0.01;

    /** Relative tolerance for the isLinear / isCircular classifiers. */
    public static final double SHAPE_TOLERANCE = 1e-8;

    /** Output/input intensity ratio above 1 allowed before conservation is flagged. */
    public static final double CONSERVATION_TOLERANCE = 1e-4;

    // -- Polarization thresholds ----------------------------------------------

    /**
     * DoP at or above which a state is fully polarized.
     * The Jones view is only defined at or above this threshold.
     */
    public static final double FULLY_POLARIZED_THRESHOLD = 0.95;

    /** DoP at or below which a state is unpolarized. */
    public static final double UNPOLARIZED_THRESHOLD = 0.05;

    // -- Optics defaults ------------------------------------------------------

    /** Default wavelength in nanometres (green, near peak photopic response). */
    public static final double DEFAULT_WAVELENGTH_NM = 550.0;

    /** Sodium D line, the reference wavelength for tabulated material data. */
    public static final double SODIUM_D_WAVELENGTH_NM = 589.0;

    /** Default mirror phase shift on reflection, in radians. */
    public static final double DEFAULT_MIRROR_PHASE = Math.PI;

    // -- Legacy discrete representation ---------------------------------------

    /** Highest legacy intensity level. Legacy intensity = level / LEGACY_INTENSITY_LEVELS. */
    public static final int LEGACY_INTENSITY_LEVELS = 15;

    /** Legacy polarization angles are multiples of this, in degrees. */
    public static final int LEGACY_ANGLE_STEP_DEG = 45;

    /** DoP above which the legacy phase is +1. */
    public static final double LEGACY_PHASE_DOP_THRESHOLD = 0.5;

    // -- Snapshot precision ---------------------------------------------------

    public static final int SNAPSHOT_INTENSITY_DECIMALS = 6;
    public static final int SNAPSHOT_DOP_DECIMALS = 4;
    public static final int SNAPSHOT_STOKES_DECIMALS = 6;
    public static final int SNAPSHOT_ELLIPSE_DECIMALS = 2;
    public static final int SNAPSHOT_JONES_DECIMALS = 6;

    // -- Validation -----------------------------------------------------------

    /**
     * Verifies internal consistency of the constants.
     * Throws IllegalStateException if any invariant is violated.
     */
    public static void validate() {
        if (UNPOLARIZED_THRESHOLD >= FULLY_POLARIZED_THRESHOLD) {
            throw new IllegalStateException(
                "UNPOLARIZED_THRESHOLD must be < FULLY_POLARIZED_THRESHOLD; got "
                + UNPOLARIZED_THRESHOLD + " >= " + FULLY_POLARIZED_THRESHOLD);
        }
        if (FULLY_POLARIZED_THRESHOLD <= 0.0 || FULLY_POLARIZED_THRESHOLD > 1.0) {
            throw new IllegalStateException(
                "FULLY_POLARIZED_THRESHOLD must be in (0, 1]; got " + FULLY_POLARIZED_THRESHOLD);
        }
        if (INTENSITY_EPSILON >= PHYSICAL_TOLERANCE) {
            throw new IllegalStateException(
                "INTENSITY_EPSILON must be tighter than PHYSICAL_TOLERANCE");
        }
        if (LEGACY_INTENSITY_LEVELS <= 0) {
            throw new IllegalStateException(
                "LEGACY_INTENSITY_LEVELS must be positive; got " + LEGACY_INTENSITY_LEVELS);
        }
        if (180 % LEGACY_ANGLE_STEP_DEG != 0) {
            throw new IllegalStateException(
                "LEGACY_ANGLE_STEP_DEG must divide 180; got " + LEGACY_ANGLE_STEP_DEG);
        }
        if (DEFAULT_WAVELENGTH_NM <= 0.0) {
            throw new IllegalStateException("DEFAULT_WAVELENGTH_NM must be positive");
        }
    }

    static {
        validate();
    }
}
