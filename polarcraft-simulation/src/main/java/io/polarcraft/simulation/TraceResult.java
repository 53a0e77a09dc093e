package io.polarcraft.simulation;

import java.util.List;

/**
 * Output of a scene trace.
 *
 * @param completed false when the iteration ceiling left rays queued or the
 *                  bounce ceiling dropped a ray; the partial result is still returned
 */
public record TraceResult(List<RaySegment> segments, List<Detection> detections,
                          int iterations, boolean completed) {

    public TraceResult {
        segments = List.copyOf(segments);
        detections = List.copyOf(detections);
    }

    public double totalDetectedIntensity() {
        double total = 0.0;
        for (Detection d : detections) {
            total += d.intensity();
        }
        return total;
    }
}
