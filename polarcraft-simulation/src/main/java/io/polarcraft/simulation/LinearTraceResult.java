package io.polarcraft.simulation;

import io.polarcraft.core.CoherencyMatrix;

import java.util.List;

/**
 * States of one ray through an ordered element list.
 *
 * @param states   input state followed by the state after each element reached;
 *                 a blocked ray ends with CoherencyMatrix.ZERO
 * @param finalRay the ray after the last element, inactive if it was blocked
 */
public record LinearTraceResult(List<CoherencyMatrix> states, LightRay finalRay) {

    public LinearTraceResult {
        states = List.copyOf(states);
    }

    public CoherencyMatrix finalState() {
        return states.get(states.size() - 1);
    }

    public boolean blocked() {
        return !finalRay.isActive();
    }
}
