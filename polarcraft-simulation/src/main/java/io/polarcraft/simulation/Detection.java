package io.polarcraft.simulation;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Vector3;

/**
 * Light arriving at a sensor.
 *
 * @param state      detected coherency matrix, expressed in basis
 * @param pathLength distance travelled from the source
 */
public record Detection(String sensorId, Vector3 position, Vector3 direction,
                        CoherencyMatrix state, PolarizationBasis basis,
                        double pathLength, String rayId, String sourceId) {

    public double intensity() {
        return state.intensity();
    }
}
