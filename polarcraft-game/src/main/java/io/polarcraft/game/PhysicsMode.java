package io.polarcraft.game;

/**
 * Presentation mode carried by the facade. Physics is identical in both;
 * callers use it to decide how much detail to show.
 */
public enum PhysicsMode {
    GAME,
    SCIENCE
}
