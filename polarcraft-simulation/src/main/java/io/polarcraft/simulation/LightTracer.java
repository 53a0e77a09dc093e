package io.polarcraft.simulation;

import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Vector3;
import io.polarcraft.optics.InteractionResult;
import io.polarcraft.optics.OpticalElement;
import io.polarcraft.optics.OutputBeam;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Traces rays through a scene of optical elements.
 *
 * PER-RAY STATE MACHINE:
 *   queued -> intersection test -> interacting (0-2 children, ray deactivates)
 *                               -> detected   (sensor reached, terminal)
 *                               -> escaped    (nothing hit, terminal)
 *   Rays below the intensity threshold or past maxBounces are dropped on dequeue.
 *   Falling below the threshold is a normal end; hitting maxBounces is a cut-off.
 *
 * The worklist is a FIFO queue, so splitting trees are traced breadth-first
 * with bounded stack depth. maxIterations counts dequeues across all rays.
 * Reaching it, or dropping any ray at maxBounces, marks the result incomplete.
 *
 * BASIS:
 *   Before every interaction the ray state is re-expressed in the s-p basis of
 *   the surface it hit. Elements only ever see states in their own frame.
 *
 * A tracer holds only its configuration and is safe to share between threads.
 */
public final class LightTracer {

    private static final Logger log = LogManager.getLogger(LightTracer.class);

    private final TracerConfig config;

    public LightTracer() {
        this(TracerConfig.DEFAULT);
    }

    public LightTracer(TracerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public TracerConfig config() {
        return config;
    }

    // -- Scene trace ----------------------------------------------------------

    public TraceResult trace(List<LightRay> rays, SceneGeometry scene) {
        Objects.requireNonNull(rays, "rays must not be null");
        Objects.requireNonNull(scene, "scene must not be null");

        List<RaySegment> segments = new ArrayList<>();
        List<Detection> detections = new ArrayList<>();
        ArrayDeque<LightRay> queue = new ArrayDeque<>(rays);
        log.debug("[tracer] start: {} rays, {} surfaces", rays.size(), scene.surfaces().size());

        int iterations = 0;
        int bounceCapped = 0;
        while (!queue.isEmpty() && iterations < config.maxIterations) {
            iterations++;
            LightRay ray = queue.poll();

            if (!LightSources.isValid(ray, config.intensityThreshold)) {
                ray.deactivate();
                continue;
            }
            if (ray.bounceCount() >= config.maxBounces) {
                ray.deactivate();
                bounceCapped++;
                continue;
            }

            Optional<SurfaceIntersection> hit = scene.intersect(
                ray.position(), ray.direction(), config.sceneBoundary);
            double surfaceDistance = hit.map(SurfaceIntersection::distance).orElse(config.sceneBoundary);
            Optional<SensorHit> sensorHit = scene.detect(ray.position(), ray.direction(), surfaceDistance);

            if (sensorHit.isPresent()) {
                SensorHit s = sensorHit.get();
                segments.add(segment(ray, s.point()));
                LightSources.advance(ray, s.distance());
                detections.add(new Detection(s.sensor().id(), s.point(), ray.direction(),
                    ray.state(), ray.basis(), ray.pathLength(), ray.id(), ray.sourceId()));
                ray.deactivate();
                continue;
            }

            if (hit.isEmpty()) {
                segments.add(segment(ray, ray.position().add(ray.direction().scale(config.sceneBoundary))));
                ray.deactivate();
                continue;
            }

            SurfaceIntersection intersection = hit.get();
            segments.add(segment(ray, intersection.point()));
            ray.moveTo(intersection.point(), intersection.distance());

            InteractionResult result = interact(ray, intersection.surface(), intersection.normal());
            ray.deactivate();
            if (!result.hasOutput()) {
                continue;
            }
            result.transmitted().ifPresent(beam -> queue.add(spawn(ray, beam)));
            result.reflected().ifPresent(beam -> queue.add(spawn(ray, beam)));
        }

        if (!queue.isEmpty()) {
            log.warn("[tracer] iteration ceiling {} reached with {} rays still queued",
                config.maxIterations, queue.size());
        }
        if (bounceCapped > 0) {
            log.warn("[tracer] bounce ceiling {} cut off {} rays", config.maxBounces, bounceCapped);
        }
        boolean completed = queue.isEmpty() && bounceCapped == 0;
        log.debug("[tracer] done: {} iterations, {} segments, {} detections",
            iterations, segments.size(), detections.size());
        return new TraceResult(segments, detections, iterations, completed);
    }

    private InteractionResult interact(LightRay ray, OpticalElement surface, Vector3 normal) {
        PolarizationBasis surfaceBasis = PolarizationBasis.computeInterfaceBasis(ray.direction(), normal);
        CoherencyMatrix local = ray.basis().transformCoherency(ray.state(), surfaceBasis);
        return surface.interact(local, surfaceBasis, ray.wavelengthNm());
    }

    private LightRay spawn(LightRay parent, OutputBeam beam) {
        LightRay child = LightSources.childRay(parent, beam.direction(), beam.state(), beam.basis());
        LightSources.advance(child, config.surfaceOffset);
        return child;
    }

    private static RaySegment segment(LightRay ray, Vector3 end) {
        return new RaySegment(ray.position(), end, ray.direction(), ray.intensity(),
            ray.state(), ray.id(), ray.sourceId());
    }

    // -- Linear trace ---------------------------------------------------------

    /**
     * Passes one ray through the elements in order, ignoring their positions.
     * Only transmitted branches are followed; a missing transmitted branch blocks the ray.
     * The input ray is not modified.
     */
    public LinearTraceResult traceLinear(LightRay ray, List<? extends OpticalElement> elements) {
        Objects.requireNonNull(ray, "ray must not be null");
        Objects.requireNonNull(elements, "elements must not be null");

        LightRay current = ray.copy();
        List<CoherencyMatrix> states = new ArrayList<>();
        states.add(current.state());

        for (OpticalElement element : elements) {
            InteractionResult result = interact(current, element, element.normal());
            Optional<OutputBeam> transmitted = result.transmitted();
            if (transmitted.isEmpty()) {
                current.update(CoherencyMatrix.ZERO, current.basis(), current.direction());
                current.deactivate();
                states.add(CoherencyMatrix.ZERO);
                break;
            }
            OutputBeam beam = transmitted.get();
            current.update(beam.state(), beam.basis(), beam.direction());
            current.incrementBounces();
            states.add(beam.state());
        }
        return new LinearTraceResult(states, current);
    }

    /**
     * State after passing the elements in order, starting in the free-space
     * basis of direction. Returns CoherencyMatrix.ZERO if any element blocks it.
     * The result is expressed in the basis left by the last element.
     */
    public static CoherencyMatrix traceThrough(CoherencyMatrix initial, Vector3 direction,
                                               List<? extends OpticalElement> elements) {
        return traceThrough(initial, direction, elements, PhysicsConstants.DEFAULT_WAVELENGTH_NM);
    }

    public static CoherencyMatrix traceThrough(CoherencyMatrix initial, Vector3 direction,
                                               List<? extends OpticalElement> elements,
                                               double wavelengthNm) {
        Objects.requireNonNull(initial, "initial must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(elements, "elements must not be null");

        CoherencyMatrix state = initial;
        PolarizationBasis basis = PolarizationBasis.fromPropagation(direction);
        for (OpticalElement element : elements) {
            PolarizationBasis surfaceBasis = PolarizationBasis.computeInterfaceBasis(basis.k, element.normal());
            CoherencyMatrix local = basis.transformCoherency(state, surfaceBasis);
            Optional<OutputBeam> transmitted = element.interact(local, surfaceBasis, wavelengthNm).transmitted();
            if (transmitted.isEmpty()) {
                return CoherencyMatrix.ZERO;
            }
            state = transmitted.get().state();
            basis = transmitted.get().basis();
        }
        return state;
    }
}
