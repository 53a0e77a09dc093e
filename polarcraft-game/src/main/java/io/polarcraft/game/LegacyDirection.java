package io.polarcraft.game;

import io.polarcraft.math.Vector3;

import java.util.Objects;

/** The six block-face directions of the legacy light model. */
public enum LegacyDirection {
    NORTH(new Vector3(0, 0, -1)),
    SOUTH(new Vector3(0, 0, 1)),
    EAST(new Vector3(1, 0, 0)),
    WEST(new Vector3(-1, 0, 0)),
    UP(new Vector3(0, 1, 0)),
    DOWN(new Vector3(0, -1, 0));

    private final Vector3 vector;

    LegacyDirection(Vector3 vector) {
        this.vector = vector;
    }

    public Vector3 vector() {
        return vector;
    }

    /** Direction with the largest dot product against v. Ties go to the earlier constant. */
    public static LegacyDirection nearest(Vector3 v) {
        Objects.requireNonNull(v, "v must not be null");
        Vector3 n = v.normalize();
        LegacyDirection best = NORTH;
        double bestDot = -2.0;
        for (LegacyDirection d : values()) {
            double dot = n.dot(d.vector);
            if (dot > bestDot) {
                bestDot = dot;
                best = d;
            }
        }
        return best;
    }
}
