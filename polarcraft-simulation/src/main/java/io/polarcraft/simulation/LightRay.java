package io.polarcraft.simulation;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Vector3;

import java.util.Objects;
import java.util.Optional;

/**
 * A ray in flight: where it is, where it goes, and the polarization it carries.
 *
 * OWNERSHIP:
 *   The only mutable type in the engine. A ray belongs to the tracer worklist
 *   entry processing it. Splitting allocates fresh child rays; children never
 *   alias their parent.
 */
public final class LightRay {

    private final String id;
    private final String sourceId;
    private final String parentId;
    private final double wavelengthNm;

    private Vector3 position;
    private Vector3 direction;
    private CoherencyMatrix state;
    private PolarizationBasis basis;
    private double pathLength;
    private int bounceCount;
    private boolean active = true;

    LightRay(String id, String sourceId, String parentId,
             Vector3 position, Vector3 direction,
             CoherencyMatrix state, PolarizationBasis basis,
             double pathLength, double wavelengthNm, int bounceCount) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.parentId = parentId;
        this.position = Objects.requireNonNull(position, "position must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.basis = Objects.requireNonNull(basis, "basis must not be null");
        if (!(wavelengthNm > 0.0)) {
            throw new IllegalArgumentException("wavelengthNm must be > 0; got " + wavelengthNm);
        }
        this.pathLength = pathLength;
        this.wavelengthNm = wavelengthNm;
        this.bounceCount = bounceCount;
    }

    public String id() { return id; }
    public String sourceId() { return sourceId; }

    /** Id of the ray this one was split from; empty for rays emitted by a source. */
    public Optional<String> parentId() { return Optional.ofNullable(parentId); }

    public double wavelengthNm() { return wavelengthNm; }
    public Vector3 position() { return position; }
    public Vector3 direction() { return direction; }
    public CoherencyMatrix state() { return state; }
    public PolarizationBasis basis() { return basis; }
    public double pathLength() { return pathLength; }
    public int bounceCount() { return bounceCount; }
    public boolean isActive() { return active; }

    public double intensity() {
        return state.intensity();
    }

    // -- Mutation (tracer only) -----------------------------------------------

    void moveTo(Vector3 newPosition, double distance) {
        this.position = newPosition;
        this.pathLength += distance;
    }

    void update(CoherencyMatrix newState, PolarizationBasis newBasis, Vector3 newDirection) {
        this.state = newState;
        this.basis = newBasis;
        this.direction = newDirection;
    }

    void incrementBounces() {
        this.bounceCount++;
    }

    public void deactivate() {
        this.active = false;
    }

    /** Same identity and provenance, independent mutable state. */
    LightRay copy() {
        LightRay copy = new LightRay(id, sourceId, parentId, position, direction,
            state, basis, pathLength, wavelengthNm, bounceCount);
        copy.active = active;
        return copy;
    }

    @Override
    public String toString() {
        return "LightRay[" + id + " src=" + sourceId + " pos=" + position + " dir=" + direction
            + " I=" + String.format("%.6f", intensity()) + " bounces=" + bounceCount
            + (active ? "" : " inactive") + "]";
    }
}
