package io.polarcraft.core;

/**
 * Result of an energy conservation check between an input and output state.
 *
 * @param valid   false when output/input exceeds 1 beyond tolerance
 * @param ratio   output intensity over input intensity; 0 when input is below threshold
 * @param message human-readable diagnostic
 */
public record ConservationReport(boolean valid, double ratio, String message) {}
