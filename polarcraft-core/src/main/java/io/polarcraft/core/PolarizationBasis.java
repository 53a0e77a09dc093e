package io.polarcraft.core;

import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.math.Matrix2x2;
import io.polarcraft.math.Vector3;

import java.util.Objects;
import java.util.Optional;

/**
 * Local orthonormal frame (s, p, k) a polarization state is expressed in.
 *
 * s and p are the transverse axes; k is the propagation direction.
 * Every factory guarantees p = k x s, so s x p = k (right-handed).
 *
 * SINGULARITY:
 *   At normal incidence k x n vanishes and the plane of incidence is undefined.
 *   The interface basis then takes the coordinate axis least aligned with n
 *   (ties resolve X, Y, Z in that order), projects it perpendicular to n and
 *   uses that as s. Same input always produces the same frame.
 */
public final class PolarizationBasis {

    /** |k . Y| above which fromPropagation switches its up reference to Z. */
    private static final double UP_SWITCH_COS = 0.99;

    /** s = X, p = Y, k = Z. */
    public static final PolarizationBasis DEFAULT = new PolarizationBasis(Vector3.X, Vector3.Y, Vector3.Z);

    public final Vector3 s;
    public final Vector3 p;
    public final Vector3 k;

    private PolarizationBasis(Vector3 s, Vector3 p, Vector3 k) {
        this.s = s;
        this.p = p;
        this.k = k;
    }

    // -- Factories ------------------------------------------------------------

    /**
     * s-p frame for light with direction k meeting a surface with normal n.
     * s = normalize(k x n), perpendicular to the plane of incidence.
     */
    public static PolarizationBasis computeInterfaceBasis(Vector3 k, Vector3 normal) {
        Objects.requireNonNull(k, "k must not be null");
        Objects.requireNonNull(normal, "normal must not be null");
        Vector3 kNorm = k.normalize();
        Vector3 nNorm = normal.normalize();

        Vector3 cross = kNorm.cross(nNorm);
        double crossLength = cross.length();
        Vector3 s;
        if (crossLength < PhysicsConstants.GEOMETRIC_EPSILON) {
            Vector3 reference = Vector3.leastAlignedAxis(nNorm);
            s = reference.perpendicular(nNorm).normalize();
            // k is only parallel to n within epsilon; remove the residual
            s = s.perpendicular(kNorm).normalizeOr(s);
        } else {
            s = cross.scale(1.0 / crossLength);
        }
        return new PolarizationBasis(s, kNorm.cross(s), kNorm);
    }

    /**
     * Free-space frame for direction k. Uses Y as the up reference (Z when k is
     * within about 8 degrees of Y), s = normalize(up x k).
     * For k = +Z this yields s = X, p = Y.
     */
    public static PolarizationBasis fromPropagation(Vector3 k) {
        Objects.requireNonNull(k, "k must not be null");
        Vector3 kNorm = k.normalize();
        Vector3 up = Math.abs(kNorm.dot(Vector3.Y)) > UP_SWITCH_COS ? Vector3.Z : Vector3.Y;
        Vector3 sRaw = up.cross(kNorm);
        if (sRaw.isZero()) {
            Vector3[] tangents = Vector3.orthonormalBasis(kNorm);
            return new PolarizationBasis(tangents[0], kNorm.cross(tangents[0]), kNorm);
        }
        Vector3 s = sRaw.normalize();
        return new PolarizationBasis(s, kNorm.cross(s), kNorm);
    }

    /** Frame with the given s (made perpendicular to k) and p = k x s. */
    public static PolarizationBasis fromSAndK(Vector3 s, Vector3 k) {
        Objects.requireNonNull(s, "s must not be null");
        Objects.requireNonNull(k, "k must not be null");
        Vector3 kNorm = k.normalize();
        Vector3 sPerp = s.normalize().perpendicular(kNorm)
            .normalizeOr(Vector3.orthonormalBasis(kNorm)[0]);
        return new PolarizationBasis(sPerp, kNorm.cross(sPerp), kNorm);
    }

    // -- Frame changes --------------------------------------------------------

    /**
     * Signed angle from this.s to other.s (projected perpendicular to this.k),
     * positive counter-clockwise about this.k.
     */
    public double angleTo(PolarizationBasis other) {
        Vector3 otherSProj = other.s.perpendicular(k);
        if (otherSProj.isZero()) {
            return 0.0;
        }
        return Vector3.signedAngle(s, otherSProj.normalize(), k);
    }

    /**
     * Jones operator that re-expresses field components from this frame into target.
     * With a = angleTo(target) the components transform by R(-a).
     */
    public Matrix2x2 transformTo(PolarizationBasis target) {
        return Matrix2x2.rotation(-angleTo(target));
    }

    /** This frame turned about k by angle (right-hand rule). */
    public PolarizationBasis rotate(double angle) {
        return new PolarizationBasis(
            Vector3.rotateAroundAxis(s, k, angle),
            Vector3.rotateAroundAxis(p, k, angle),
            k);
    }

    /** J expressed in this frame, re-expressed in target. */
    public CoherencyMatrix transformCoherency(CoherencyMatrix j, PolarizationBasis target) {
        return j.applyOperator(transformTo(target));
    }

    /**
     * Re-expresses J in the s-p frame of a surface with the given normal.
     */
    public InterfaceProjection toInterfaceBasis(CoherencyMatrix j, Vector3 normal) {
        PolarizationBasis interfaceBasis = computeInterfaceBasis(k, normal);
        return new InterfaceProjection(transformCoherency(j, interfaceBasis), interfaceBasis);
    }

    /** A coherency matrix paired with the frame it is expressed in. */
    public record InterfaceProjection(CoherencyMatrix matrix, PolarizationBasis basis) {}

    // -- Reflection and refraction -------------------------------------------

    /**
     * Frame of the mirror-reflected ray. s is kept, k is reflected, p = k x s.
     */
    public PolarizationBasis computeReflectedBasis(Vector3 normal) {
        Vector3 kReflected = k.reflect(normal.normalize()).normalize();
        return withNewDirection(kReflected);
    }

    /**
     * Frame of the refracted ray, or empty under total internal reflection.
     *
     * @param normal unit normal facing the incident side
     * @param n1     incident medium index
     * @param n2     transmitted medium index
     */
    public Optional<PolarizationBasis> computeRefractedBasis(Vector3 normal, double n1, double n2) {
        return k.refract(normal.normalize(), n1 / n2)
            .map(Vector3::normalize)
            .map(this::withNewDirection);
    }

    private PolarizationBasis withNewDirection(Vector3 kNew) {
        // s is already perpendicular to kNew for an interface frame; re-project for any other frame
        Vector3 sNew = s.perpendicular(kNew).normalizeOr(Vector3.orthonormalBasis(kNew)[0]);
        return new PolarizationBasis(sNew, kNew.cross(sNew), kNew);
    }

    // -- Validation -----------------------------------------------------------

    public boolean isValid() {
        return isValid(PhysicsConstants.GEOMETRIC_EPSILON);
    }

    /** Unit axes, mutual orthogonality and s x p = k, all within tolerance. */
    public boolean isValid(double tolerance) {
        if (!s.isNormalized(tolerance) || !p.isNormalized(tolerance) || !k.isNormalized(tolerance)) {
            return false;
        }
        if (!s.isPerpendicular(p, tolerance)
            || !s.isPerpendicular(k, tolerance)
            || !p.isPerpendicular(k, tolerance)) {
            return false;
        }
        return s.cross(p).approxEquals(k, tolerance);
    }

    // -- Geometry helpers -----------------------------------------------------

    /**
     * Angle of incidence in [0, pi] for direction k meeting normal n
     * (n facing the incident side).
     */
    public static double incidenceAngle(Vector3 k, Vector3 normal) {
        double cos = -k.normalize().dot(normal.normalize());
        return Math.acos(Math.max(-1.0, Math.min(1.0, cos)));
    }

    /** True when light going from n1 to n2 at the given angle is totally reflected. */
    public static boolean willTotallyReflect(double incidenceAngle, double n1, double n2) {
        if (n1 <= n2) {
            return false;
        }
        return incidenceAngle > Math.asin(n2 / n1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PolarizationBasis)) {
            return false;
        }
        PolarizationBasis other = (PolarizationBasis) o;
        return s.equals(other.s) && p.equals(other.p) && k.equals(other.k);
    }

    @Override
    public int hashCode() {
        return Objects.hash(s, p, k);
    }

    @Override
    public String toString() {
        return "PolarizationBasis(s=" + s + ", p=" + p + ", k=" + k + ")";
    }
}
