package io.polarcraft.game;

/** Integer block coordinates of the legacy world grid. */
public record BlockPosition(int x, int y, int z) {}
