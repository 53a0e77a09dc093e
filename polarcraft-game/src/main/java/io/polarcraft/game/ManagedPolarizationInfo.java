package io.polarcraft.game;

import io.polarcraft.api.Handedness;
import io.polarcraft.api.PolarizationCategory;
import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationState;

/**
 * Facade-issued handle. Owns the coherency matrix it summarises.
 */
final class ManagedPolarizationInfo implements PolarizationInfo {

    private final CoherencyMatrix coherency;
    private final double intensity;
    private final double angleDeg;
    private final double degreeOfPolarization;
    private final PolarizationCategory polarizationType;
    private final Handedness handedness;

    ManagedPolarizationInfo(CoherencyMatrix coherency) {
        PolarizationState state = PolarizationState.fromCoherency(coherency);
        this.coherency = coherency;
        this.intensity = state.intensity();
        this.angleDeg = state.ellipse().orientationDeg();
        this.degreeOfPolarization = state.dop();
        this.polarizationType = state.category();
        this.handedness = state.handedness();
    }

    CoherencyMatrix coherency() {
        return coherency;
    }

    @Override public double intensity() { return intensity; }
    @Override public double angleDeg() { return angleDeg; }
    @Override public double degreeOfPolarization() { return degreeOfPolarization; }
    @Override public PolarizationCategory polarizationType() { return polarizationType; }
    @Override public Handedness handedness() { return handedness; }

    @Override
    public String toString() {
        return String.format("PolarizationInfo[I=%.4f, angle=%.2f, dop=%.4f, %s, %s]",
            intensity, angleDeg, degreeOfPolarization, polarizationType, handedness);
    }
}
