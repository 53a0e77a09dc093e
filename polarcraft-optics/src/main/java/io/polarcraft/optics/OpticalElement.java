package io.polarcraft.optics;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Vector3;

import java.util.Objects;

/**
 * Base of the closed set of optical elements a ray can meet.
 *
 * CONTRACT:
 *   interact() receives the incoming coherency matrix already expressed in the
 *   basis it is given. Elements build their Jones operator from their own
 *   geometry projected into that basis, never into a global frame.
 *   Elements are immutable and may be shared across threads and traces.
 *
 * Subclasses implement interact(input, basis). Wavelength-dependent elements
 * also override the three-argument form; everything else ignores wavelength.
 */
public abstract sealed class OpticalElement
    permits IdealPolarizer, WavePlate, DispersiveWavePlate, IdealMirror,
            OpticalRotator, PolarizingBeamSplitter, Attenuator, Depolarizer,
            DielectricSurface {

    private final String id;
    private final Vector3 position;
    private final Vector3 normal;

    protected OpticalElement(String id, Vector3 position, Vector3 normal) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("OpticalElement id must not be null or blank");
        }
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(normal, "normal must not be null");
        if (!position.isFinite() || !normal.isFinite()) {
            throw new IllegalArgumentException("position and normal must be finite; got "
                + position + ", " + normal);
        }
        if (normal.isZero()) {
            throw new IllegalArgumentException("normal must be non-zero");
        }
        this.id = id;
        this.position = position;
        this.normal = normal.normalize();
    }

    public String id() { return id; }
    public Vector3 position() { return position; }

    /** Unit surface normal. */
    public Vector3 normal() { return normal; }

    /**
     * Applies this element to light arriving in the given basis.
     *
     * @param input coherency matrix expressed in basis
     * @param basis incoming frame; basis.k is the propagation direction
     */
    public abstract InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis);

    /** Wavelength-aware form. Default ignores the wavelength. */
    public InteractionResult interact(CoherencyMatrix input, PolarizationBasis basis, double wavelengthNm) {
        return interact(input, basis);
    }

    // -- Shared helpers -------------------------------------------------------

    /**
     * Angle of an in-plane axis measured from basis.s toward basis.p after
     * projecting it perpendicular to basis.k. Zero when the axis is along k.
     */
    protected static double axisAngle(Vector3 axis, PolarizationBasis basis) {
        Vector3 projected = axis.perpendicular(basis.k).normalize();
        if (projected.isZero()) {
            return 0.0;
        }
        return Math.atan2(projected.dot(basis.p), projected.dot(basis.s));
    }

    /** Transmitted branch in the incoming frame, or absorbed at/below the intensity epsilon. */
    protected static InteractionResult passThrough(CoherencyMatrix output, PolarizationBasis basis) {
        if (!output.isAboveThreshold()) {
            return InteractionResult.absorbed();
        }
        return InteractionResult.transmittedOnly(OutputBeam.along(output, basis));
    }

    /** In-plane axis: the given direction made perpendicular to the normal. */
    protected Vector3 inPlaneAxis(Vector3 axis) {
        Objects.requireNonNull(axis, "axis must not be null");
        Vector3 inPlane = axis.perpendicular(normal).normalize();
        if (inPlane.isZero()) {
            throw new IllegalArgumentException("axis must not be parallel to the normal; got " + axis);
        }
        return inPlane;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + " @ " + position + "]";
    }
}
