package io.polarcraft.game;

import io.polarcraft.api.PhysicsConstants;

/** The four polarization angles of the legacy light model. */
public enum LegacyPolarization {
    DEG_0(0),
    DEG_45(45),
    DEG_90(90),
    DEG_135(135);

    private final int degrees;

    LegacyPolarization(int degrees) {
        this.degrees = degrees;
    }

    public int degrees() {
        return degrees;
    }

    public double radians() {
        return Math.toRadians(degrees);
    }

    public static LegacyPolarization fromDegrees(int degrees) {
        for (LegacyPolarization p : values()) {
            if (p.degrees == degrees) {
                return p;
            }
        }
        throw new IllegalArgumentException("legacy polarization must be 0, 45, 90 or 135; got " + degrees);
    }

    /** Folds the angle into [0, 180) and rounds it to the nearest 45 degrees (180 wraps to 0). */
    public static LegacyPolarization quantize(double radians) {
        double degrees = Math.toDegrees(radians);
        double normalized = ((degrees % 180.0) + 180.0) % 180.0;
        int step = PhysicsConstants.LEGACY_ANGLE_STEP_DEG;
        int quantized = (int) (Math.round(normalized / step) * step) % 180;
        return fromDegrees(quantized);
    }
}
