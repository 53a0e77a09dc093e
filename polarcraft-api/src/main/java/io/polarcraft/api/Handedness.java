package io.polarcraft.api;

/**
 * Rotation sense of the field vector, seen looking into the beam.
 * Right-handed corresponds to positive S3.
 */
public enum Handedness {

    RIGHT,

    LEFT,

    /** Linear or unpolarized light. */
    NONE
}
