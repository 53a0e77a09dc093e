package io.polarcraft.core;

import io.polarcraft.api.JonesVector;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of asking a polarization state for its Jones vector.
 *
 * A single Jones vector cannot describe partially polarized light, so the
 * view is one of three cases and callers must handle each explicitly.
 */
public sealed interface JonesView
        permits JonesView.Defined, JonesView.NotFullyPolarized, JonesView.NoLight {

    /** Jones vector present as a value, empty for the two undefined cases. */
    default Optional<JonesVector> vector() {
        return Optional.empty();
    }

    /** Fully polarized light with its Jones vector in the state's frame. */
    record Defined(JonesVector jones) implements JonesView {
        public Defined {
            Objects.requireNonNull(jones, "jones must not be null");
        }

        @Override
        public Optional<JonesVector> vector() {
            return Optional.of(jones);
        }
    }

    /** DoP below the fully polarized threshold; no single Jones vector exists. */
    record NotFullyPolarized(double degreeOfPolarization) implements JonesView {}

    /** Intensity below INTENSITY_EPSILON. */
    record NoLight() implements JonesView {}
}
