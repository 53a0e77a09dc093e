package io.polarcraft.simulation;

/**
 * Immutable tracer limits. Build with {@link #builder()}; values are checked in build().
 *
 * maxIterations and maxBounces are the circuit breakers that stop cyclic
 * scenes such as two facing mirrors.
 */
public final class TracerConfig {

    public static final TracerConfig DEFAULT = builder().build();

    public final int maxIterations;
    public final int maxBounces;
    /** Rays at or below this intensity are dropped. */
    public final double intensityThreshold;
    /** Distance at which an unobstructed ray is considered to have left the scene. */
    public final double sceneBoundary;
    /** Distance child rays are pushed off a surface to avoid re-hitting it. */
    public final double surfaceOffset;

    private TracerConfig(Builder b) {
        this.maxIterations = b.maxIterations;
        this.maxBounces = b.maxBounces;
        this.intensityThreshold = b.intensityThreshold;
        this.sceneBoundary = b.sceneBoundary;
        this.surfaceOffset = b.surfaceOffset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxIterations(maxIterations)
            .maxBounces(maxBounces)
            .intensityThreshold(intensityThreshold)
            .sceneBoundary(sceneBoundary)
            .surfaceOffset(surfaceOffset);
    }

    @Override
    public String toString() {
        return "TracerConfig[maxIterations=" + maxIterations + ", maxBounces=" + maxBounces
            + ", intensityThreshold=" + intensityThreshold + ", sceneBoundary=" + sceneBoundary
            + ", surfaceOffset=" + surfaceOffset + "]";
    }

    public static final class Builder {

        private int maxIterations = 10_000;
        private int maxBounces = 50;
        private double intensityThreshold = 1e-6;
        private double sceneBoundary = 1000.0;
        private double surfaceOffset = 1e-3;

        private Builder() {}

        public Builder maxIterations(int v) { this.maxIterations = v; return this; }
        public Builder maxBounces(int v) { this.maxBounces = v; return this; }
        public Builder intensityThreshold(double v) { this.intensityThreshold = v; return this; }
        public Builder sceneBoundary(double v) { this.sceneBoundary = v; return this; }
        public Builder surfaceOffset(double v) { this.surfaceOffset = v; return this; }

        public TracerConfig build() {
            if (maxIterations <= 0) {
                throw new IllegalArgumentException("maxIterations must be > 0; got " + maxIterations);
            }
            if (maxBounces < 0) {
                throw new IllegalArgumentException("maxBounces must be >= 0; got " + maxBounces);
            }
            if (!(intensityThreshold >= 0.0)) {
                throw new IllegalArgumentException("intensityThreshold must be >= 0; got " + intensityThreshold);
            }
            if (!(sceneBoundary > 0.0) || Double.isInfinite(sceneBoundary)) {
                throw new IllegalArgumentException("sceneBoundary must be finite and > 0; got " + sceneBoundary);
            }
            if (!(surfaceOffset >= 0.0) || surfaceOffset >= sceneBoundary) {
                throw new IllegalArgumentException(
                    "surfaceOffset must be in [0, sceneBoundary); got " + surfaceOffset);
            }
            return new TracerConfig(this);
        }
    }
}
