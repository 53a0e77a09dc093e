package io.polarcraft.math;

import java.util.Optional;

/**
 * Immutable 3D real vector for ray positions, directions, normals and basis axes.
 */
public final class Vector3 {

    /** Tolerance for zero-length and parallelism checks. */
    public static final double EPSILON = 1e-10;

    public static final Vector3 ZERO = new Vector3(0, 0, 0);
    public static final Vector3 X = new Vector3(1, 0, 0);
    public static final Vector3 Y = new Vector3(0, 1, 0);
    public static final Vector3 Z = new Vector3(0, 0, 1);
    public static final Vector3 NEG_X = new Vector3(-1, 0, 0);
    public static final Vector3 NEG_Y = new Vector3(0, -1, 0);
    public static final Vector3 NEG_Z = new Vector3(0, 0, -1);

    public final double x;
    public final double y;
    public final double z;

    public Vector3(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Unit vector from spherical angles.
     *
     * @param theta azimuth in the x-y plane
     * @param phi   polar angle from +z
     */
    public static Vector3 fromSpherical(double theta, double phi) {
        double sinPhi = Math.sin(phi);
        return new Vector3(sinPhi * Math.cos(theta), sinPhi * Math.sin(theta), Math.cos(phi));
    }

    // -- Properties -----------------------------------------------------------

    public double length() {
        return Math.sqrt(lengthSquared());
    }

    public double lengthSquared() {
        return x * x + y * y + z * z;
    }

    // -- Arithmetic -----------------------------------------------------------

    public Vector3 add(Vector3 o) {
        return new Vector3(x + o.x, y + o.y, z + o.z);
    }

    public Vector3 sub(Vector3 o) {
        return new Vector3(x - o.x, y - o.y, z - o.z);
    }

    public Vector3 scale(double k) {
        return new Vector3(x * k, y * k, z * k);
    }

    public Vector3 negate() {
        return new Vector3(-x, -y, -z);
    }

    public double dot(Vector3 o) {
        return x * o.x + y * o.y + z * o.z;
    }

    public Vector3 cross(Vector3 o) {
        return new Vector3(
            y * o.z - z * o.y,
            z * o.x - x * o.z,
            x * o.y - y * o.x);
    }

    /** Unit vector, or ZERO when the length is below EPSILON. */
    public Vector3 normalize() {
        return normalizeOr(ZERO);
    }

    public Vector3 normalizeOr(Vector3 fallback) {
        double len = length();
        if (len < EPSILON) {
            return fallback;
        }
        return new Vector3(x / len, y / len, z / len);
    }

    // -- Geometry -------------------------------------------------------------

    /** v - 2(v.n)n. */
    public Vector3 reflect(Vector3 normal) {
        return sub(normal.scale(2.0 * dot(normal)));
    }

    /**
     * Snell refraction of this (unit) direction.
     *
     * @param normal unit normal pointing back toward the incident side
     * @param eta    n1 / n2
     * @return refracted direction, or empty under total internal reflection
     */
    public Optional<Vector3> refract(Vector3 normal, double eta) {
        double cosI = -dot(normal);
        double sin2I = Math.max(0.0, 1.0 - cosI * cosI);
        double sin2T = eta * eta * sin2I;
        if (sin2T > 1.0) {
            return Optional.empty();
        }
        double cosT = Math.sqrt(1.0 - sin2T);
        return Optional.of(scale(eta).add(normal.scale(eta * cosI - cosT)));
    }

    public Vector3 projectOnto(Vector3 other) {
        double otherLenSq = other.lengthSquared();
        if (otherLenSq < EPSILON) {
            return ZERO;
        }
        return other.scale(dot(other) / otherLenSq);
    }

    /** Component of this vector perpendicular to other. */
    public Vector3 perpendicular(Vector3 other) {
        return sub(projectOnto(other));
    }

    public double angleTo(Vector3 other) {
        double lenProduct = length() * other.length();
        if (lenProduct < EPSILON) {
            return 0.0;
        }
        double cos = Math.max(-1.0, Math.min(1.0, dot(other) / lenProduct));
        return Math.acos(cos);
    }

    public Vector3 lerp(Vector3 other, double t) {
        return new Vector3(
            x + (other.x - x) * t,
            y + (other.y - y) * t,
            z + (other.z - z) * t);
    }

    /** Spherical interpolation between unit vectors. */
    public Vector3 slerp(Vector3 other, double t) {
        double cos = Math.max(-1.0, Math.min(1.0, dot(other)));
        double theta = Math.acos(cos);
        if (theta < EPSILON) {
            return this;
        }
        double sinTheta = Math.sin(theta);
        if (sinTheta < EPSILON) {
            // antipodal endpoints: the arc is not unique
            return lerp(other, t).normalizeOr(this);
        }
        double a = Math.sin((1.0 - t) * theta) / sinTheta;
        double b = Math.sin(t * theta) / sinTheta;
        return scale(a).add(other.scale(b));
    }

    // -- Predicates -----------------------------------------------------------

    public boolean isParallel(Vector3 other, double tolerance) {
        return cross(other).lengthSquared() < tolerance * tolerance;
    }

    public boolean isPerpendicular(Vector3 other, double tolerance) {
        return Math.abs(dot(other)) < tolerance;
    }

    public boolean approxEquals(Vector3 other, double tolerance) {
        return Math.abs(x - other.x) < tolerance
            && Math.abs(y - other.y) < tolerance
            && Math.abs(z - other.z) < tolerance;
    }

    public boolean isZero() {
        return isZero(EPSILON);
    }

    public boolean isZero(double tolerance) {
        return lengthSquared() < tolerance * tolerance;
    }

    public boolean isNormalized(double tolerance) {
        return Math.abs(lengthSquared() - 1.0) < tolerance;
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }

    // -- Static helpers -------------------------------------------------------

    /**
     * Two unit tangents perpendicular to normal, with normal x t1 = t2.
     * The reference axis is the coordinate axis least aligned with normal.
     */
    public static Vector3[] orthonormalBasis(Vector3 normal) {
        Vector3 n = normal.normalize();
        Vector3 t1 = leastAlignedAxis(n).perpendicular(n).normalize();
        Vector3 t2 = n.cross(t1);
        return new Vector3[] {t1, t2};
    }

    /**
     * Coordinate axis with the smallest absolute component along n.
     * Ties resolve X before Y before Z so the result is deterministic.
     */
    public static Vector3 leastAlignedAxis(Vector3 n) {
        double ax = Math.abs(n.x);
        double ay = Math.abs(n.y);
        double az = Math.abs(n.z);
        if (ax <= ay && ax <= az) {
            return X;
        }
        if (ay <= az) {
            return Y;
        }
        return Z;
    }

    /** Rodrigues rotation of v about axis by angle (right-hand rule). */
    public static Vector3 rotateAroundAxis(Vector3 v, Vector3 axis, double angle) {
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        Vector3 k = axis.normalize();
        return v.scale(c)
            .add(k.cross(v).scale(s))
            .add(k.scale(k.dot(v) * (1.0 - c)));
    }

    /** Signed angle from v1 to v2, positive counter-clockwise about axis. */
    public static double signedAngle(Vector3 v1, Vector3 v2, Vector3 axis) {
        Vector3 cross = v1.cross(v2);
        double angle = Math.atan2(cross.length(), v1.dot(v2));
        return cross.dot(axis) < 0 ? -angle : angle;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Vector3)) {
            return false;
        }
        Vector3 v = (Vector3) o;
        return Double.compare(x, v.x) == 0
            && Double.compare(y, v.y) == 0
            && Double.compare(z, v.z) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(x);
        h = 31 * h + Double.hashCode(y);
        return 31 * h + Double.hashCode(z);
    }

    @Override
    public String toString() {
        return String.format("(%.4f, %.4f, %.4f)", x, y, z);
    }
}
