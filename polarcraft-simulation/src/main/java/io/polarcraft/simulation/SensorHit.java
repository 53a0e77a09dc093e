package io.polarcraft.simulation;

import io.polarcraft.math.Vector3;

/** Nearest sensor hit along a ray. */
public record SensorHit(Sensor sensor, double distance, Vector3 point) {}
