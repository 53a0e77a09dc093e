package io.polarcraft.simulation;

import io.polarcraft.math.Vector3;
import io.polarcraft.optics.OpticalElement;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Scene where every element is a sphere of fixed radius around its position.
 *
 * Only entry hits count: a ray starting inside a sphere does not hit it. Rays
 * transmitted by an element therefore continue without meeting it again.
 */
public final class SimpleScene implements SceneGeometry {

    public static final double DEFAULT_COLLISION_RADIUS = 0.5;

    /** Hits closer than this to the ray origin are ignored. */
    private static final double MIN_HIT_DISTANCE = 1e-3;

    private final List<OpticalElement> surfaces;
    private final List<Sensor> sensors;
    private final double collisionRadius;

    public SimpleScene(List<OpticalElement> surfaces) {
        this(surfaces, List.of(), DEFAULT_COLLISION_RADIUS);
    }

    public SimpleScene(List<OpticalElement> surfaces, List<Sensor> sensors) {
        this(surfaces, sensors, DEFAULT_COLLISION_RADIUS);
    }

    public SimpleScene(List<OpticalElement> surfaces, List<Sensor> sensors, double collisionRadius) {
        Objects.requireNonNull(surfaces, "surfaces must not be null");
        Objects.requireNonNull(sensors, "sensors must not be null");
        if (!(collisionRadius > 0.0)) {
            throw new IllegalArgumentException("collisionRadius must be > 0; got " + collisionRadius);
        }
        this.surfaces = List.copyOf(surfaces);
        this.sensors = List.copyOf(sensors);
        this.collisionRadius = collisionRadius;
    }

    @Override
    public List<OpticalElement> surfaces() {
        return surfaces;
    }

    public List<Sensor> sensors() {
        return sensors;
    }

    public double collisionRadius() {
        return collisionRadius;
    }

    @Override
    public Optional<SurfaceIntersection> intersect(Vector3 origin, Vector3 direction, double maxDistance) {
        SurfaceIntersection closest = null;
        for (OpticalElement surface : surfaces) {
            OptionalDouble t = entryDistance(origin, direction, surface.position(), collisionRadius);
            if (t.isEmpty() || t.getAsDouble() >= maxDistance) {
                continue;
            }
            double distance = t.getAsDouble();
            if (closest == null || distance < closest.distance()) {
                closest = new SurfaceIntersection(surface, distance,
                    origin.add(direction.scale(distance)), surface.normal());
            }
        }
        return Optional.ofNullable(closest);
    }

    @Override
    public Optional<SensorHit> detect(Vector3 origin, Vector3 direction, double maxDistance) {
        SensorHit closest = null;
        for (Sensor sensor : sensors) {
            OptionalDouble t = entryDistance(origin, direction, sensor.position(), sensor.radius());
            if (t.isEmpty() || t.getAsDouble() >= maxDistance) {
                continue;
            }
            double distance = t.getAsDouble();
            if (closest == null || distance < closest.distance()) {
                closest = new SensorHit(sensor, distance, origin.add(direction.scale(distance)));
            }
        }
        return Optional.ofNullable(closest);
    }

    /**
     * Distance along direction at which the ray enters the sphere, or empty if
     * it misses, starts inside, or the entry is behind MIN_HIT_DISTANCE.
     */
    static OptionalDouble entryDistance(Vector3 origin, Vector3 direction, Vector3 center, double radius) {
        Vector3 oc = origin.sub(center);
        double a = direction.dot(direction);
        if (a < Vector3.EPSILON) {
            return OptionalDouble.empty();
        }
        double b = 2.0 * oc.dot(direction);
        double c = oc.dot(oc) - radius * radius;
        double discriminant = b * b - 4.0 * a * c;
        if (discriminant < 0.0) {
            return OptionalDouble.empty();
        }
        double t = (-b - Math.sqrt(discriminant)) / (2.0 * a);
        if (t < MIN_HIT_DISTANCE) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(t);
    }
}
