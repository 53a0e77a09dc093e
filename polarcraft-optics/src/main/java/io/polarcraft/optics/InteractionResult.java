package io.polarcraft.optics;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of light meeting an optical element.
 *
 * Both branches are independently optional. A ray may emerge transmitted only,
 * reflected only, both, or neither (fully absorbed).
 */
public record InteractionResult(Optional<OutputBeam> transmitted, Optional<OutputBeam> reflected) {

    private static final InteractionResult ABSORBED = new InteractionResult(Optional.empty(), Optional.empty());

    public InteractionResult {
        Objects.requireNonNull(transmitted, "transmitted must not be null");
        Objects.requireNonNull(reflected, "reflected must not be null");
    }

    public static InteractionResult absorbed() {
        return ABSORBED;
    }

    public static InteractionResult transmittedOnly(OutputBeam beam) {
        return new InteractionResult(Optional.of(beam), Optional.empty());
    }

    public static InteractionResult reflectedOnly(OutputBeam beam) {
        return new InteractionResult(Optional.empty(), Optional.of(beam));
    }

    /** True when at least one branch carries light. */
    public boolean hasOutput() {
        return transmitted.isPresent() || reflected.isPresent();
    }

    /** Sum of branch intensities. */
    public double totalIntensity() {
        return transmitted.map(OutputBeam::intensity).orElse(0.0)
            + reflected.map(OutputBeam::intensity).orElse(0.0);
    }
}
