package io.polarcraft.api;

/**
 * Coarse classification of a polarization state for game logic and display.
 */
public enum PolarizationCategory {

    /** No circular component. */
    LINEAR,

    /** No linear component. */
    CIRCULAR,

    /** Both linear and circular components present. */
    ELLIPTICAL,

    /** Degree of polarization at or below the unpolarized threshold. */
    UNPOLARIZED
}
