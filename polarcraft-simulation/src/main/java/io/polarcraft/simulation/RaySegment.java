package io.polarcraft.simulation;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.math.Vector3;

/**
 * Straight piece of a ray path, for rendering and inspection.
 *
 * @param state polarization at the segment start
 */
public record RaySegment(Vector3 start, Vector3 end, Vector3 direction, double intensity,
                         CoherencyMatrix state, String rayId, String sourceId) {

    public double length() {
        return end.sub(start).length();
    }
}
