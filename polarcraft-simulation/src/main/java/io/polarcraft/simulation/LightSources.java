package io.polarcraft.simulation;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Vector3;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factories for rays leaving a light source, and ray bookkeeping helpers.
 *
 * Every emitted ray carries the free-space basis of its direction
 * (PolarizationBasis.fromPropagation). Angles are in radians.
 *
 * Ray ids come from a process-wide counter ("lin_1", "child_2", ...).
 * resetRayIdCounter() makes ids reproducible between tests.
 */
public final class LightSources {

    private static final AtomicLong RAY_ID_COUNTER = new AtomicLong();

    private LightSources() {}

    public static String nextRayId(String prefix) {
        return prefix + "_" + RAY_ID_COUNTER.incrementAndGet();
    }

    public static void resetRayIdCounter() {
        RAY_ID_COUNTER.set(0);
    }

    // -- Sources --------------------------------------------------------------

    public static LightRay linear(LightSourceConfig config, double polarizationAngle) {
        return emit("lin", config, CoherencyMatrix.createLinear(config.intensity(), polarizationAngle));
    }

    public static LightRay unpolarized(LightSourceConfig config) {
        return emit("unp", config, CoherencyMatrix.createUnpolarized(config.intensity()));
    }

    public static LightRay circular(LightSourceConfig config, boolean rightHanded) {
        return emit("circ", config, CoherencyMatrix.createCircular(config.intensity(), rightHanded));
    }

    public static LightRay elliptical(LightSourceConfig config, double orientation, double ellipticity) {
        return emit("ell", config,
            CoherencyMatrix.createElliptical(config.intensity(), orientation, ellipticity));
    }

    public static LightRay partiallyPolarized(LightSourceConfig config, double degreeOfPolarization,
                                              double polarizationAngle) {
        return emit("part", config, CoherencyMatrix.createPartiallyPolarized(
            config.intensity(), degreeOfPolarization, polarizationAngle));
    }

    public static LightRay horizontal(LightSourceConfig config) {
        return linear(config, 0.0);
    }

    public static LightRay vertical(LightSourceConfig config) {
        return linear(config, Math.PI / 2.0);
    }

    public static LightRay diagonal(LightSourceConfig config) {
        return linear(config, Math.PI / 4.0);
    }

    public static LightRay antiDiagonal(LightSourceConfig config) {
        return linear(config, -Math.PI / 4.0);
    }

    public static LightRay rightCircular(LightSourceConfig config) {
        return circular(config, true);
    }

    public static LightRay leftCircular(LightSourceConfig config) {
        return circular(config, false);
    }

    /**
     * Ray carrying an arbitrary state. config.intensity() is ignored; the
     * intensity is that of the state.
     */
    public static LightRay withState(String prefix, LightSourceConfig config, CoherencyMatrix state) {
        Objects.requireNonNull(state, "state must not be null");
        return emit(prefix, config, state);
    }

    private static LightRay emit(String prefix, LightSourceConfig config, CoherencyMatrix state) {
        Objects.requireNonNull(config, "config must not be null");
        Vector3 direction = config.direction().normalize();
        return new LightRay(nextRayId(prefix), config.id(), null,
            config.position(), direction, state, PolarizationBasis.fromPropagation(direction),
            0.0, config.wavelengthNm(), 0);
    }

    // -- Ray utilities --------------------------------------------------------

    /** Copy of the ray under a fresh id, keeping its provenance and state. */
    public static LightRay cloneRay(LightRay ray) {
        Objects.requireNonNull(ray, "ray must not be null");
        LightRay clone = new LightRay(nextRayId("clone"), ray.sourceId(), ray.parentId().orElse(null),
            ray.position(), ray.direction(), ray.state(), ray.basis(),
            ray.pathLength(), ray.wavelengthNm(), ray.bounceCount());
        if (!ray.isActive()) {
            clone.deactivate();
        }
        return clone;
    }

    /**
     * Ray produced when the parent meets an element. Inherits source id,
     * position, path length and wavelength; the bounce count goes up by one.
     */
    public static LightRay childRay(LightRay parent, Vector3 direction,
                                    CoherencyMatrix state, PolarizationBasis basis) {
        Objects.requireNonNull(parent, "parent must not be null");
        return new LightRay(nextRayId("child"), parent.sourceId(), parent.id(),
            parent.position(), direction, state, basis,
            parent.pathLength(), parent.wavelengthNm(), parent.bounceCount() + 1);
    }

    /** Moves the ray forward along its direction and accumulates path length. */
    public static void advance(LightRay ray, double distance) {
        ray.moveTo(ray.position().add(ray.direction().scale(distance)), distance);
    }

    /** Active and brighter than threshold. */
    public static boolean isValid(LightRay ray, double threshold) {
        return ray.isActive() && ray.intensity() > threshold;
    }
}
