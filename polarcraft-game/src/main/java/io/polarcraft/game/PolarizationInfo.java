package io.polarcraft.game;

import io.polarcraft.api.Handedness;
import io.polarcraft.api.PolarizationCategory;

/**
 * Read-only summary of a light state handed out by {@link PhysicsApi}.
 *
 * Only instances produced by a PhysicsApi can be passed back into it; the
 * facade rejects any other implementation.
 */
public interface PolarizationInfo {

    double intensity();

    /** Polarization ellipse orientation in degrees, [0, 180). */
    double angleDeg();

    double degreeOfPolarization();

    PolarizationCategory polarizationType();

    Handedness handedness();
}
