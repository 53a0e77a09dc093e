package io.polarcraft.simulation;

import io.polarcraft.math.Vector3;
import io.polarcraft.optics.OpticalElement;

/**
 * Nearest element hit along a ray.
 *
 * @param surface  element that was hit
 * @param distance distance from the ray origin
 * @param point    hit position
 * @param normal   surface normal at the hit
 */
public record SurfaceIntersection(OpticalElement surface, double distance, Vector3 point, Vector3 normal) {}
