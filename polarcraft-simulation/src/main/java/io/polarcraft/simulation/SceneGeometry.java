package io.polarcraft.simulation;

import io.polarcraft.math.Vector3;
import io.polarcraft.optics.OpticalElement;

import java.util.List;
import java.util.Optional;

/**
 * Collision geometry the tracer queries. Implementations must be safe to
 * query repeatedly and must not mutate during a trace.
 */
public interface SceneGeometry {

    List<OpticalElement> surfaces();

    /** Nearest element hit closer than maxDistance. */
    Optional<SurfaceIntersection> intersect(Vector3 origin, Vector3 direction, double maxDistance);

    /** Nearest sensor hit closer than maxDistance. Default: the scene has no sensors. */
    default Optional<SensorHit> detect(Vector3 origin, Vector3 direction, double maxDistance) {
        return Optional.empty();
    }
}
