package io.polarcraft.game;

import io.polarcraft.api.JonesVector;
import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.math.Complex;
import io.polarcraft.math.Vector3;
import io.polarcraft.simulation.LightRay;
import io.polarcraft.simulation.LightSourceConfig;
import io.polarcraft.simulation.LightSources;

import java.util.Objects;

/**
 * Conversions between the legacy discrete light model and coherency matrices.
 *
 * LOSSY IN BOTH DIRECTIONS:
 *   Packets keep 16 intensity levels, four linear angles and one phase bit.
 *   Ellipticity and partial polarization are lost on the way out; packets
 *   always come back as fully polarized linear light. There is no round-trip
 *   guarantee.
 *
 * The phase bit is +1 when DoP exceeds 0.5. That rule only exists to feed the
 * legacy model and carries no physical meaning.
 */
public final class LegacyAdapter {

    /** Coherence within this of 0 or 1 is treated as exactly 0 or 1. */
    private static final double COHERENCE_SNAP = 1e-6;

    private LegacyAdapter() {}

    // -- Packets --------------------------------------------------------------

    public static CoherencyMatrix fromLightPacket(LegacyLightPacket packet) {
        Objects.requireNonNull(packet, "packet must not be null");
        return CoherencyMatrix.createLinear(normalizeIntensity(packet.intensity()),
            packet.polarization().radians());
    }

    public static LegacyLightPacket toLightPacket(CoherencyMatrix state, Vector3 direction) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        int phase = state.degreeOfPolarization() > PhysicsConstants.LEGACY_PHASE_DOP_THRESHOLD ? 1 : -1;
        return new LegacyLightPacket(
            LegacyDirection.nearest(direction),
            discretizeIntensity(state.intensity()),
            LegacyPolarization.quantize(state.orientationAngle()),
            phase);
    }

    // -- Wave light -----------------------------------------------------------

    public static CoherencyMatrix fromWaveLight(LegacyWaveLight wave) {
        Objects.requireNonNull(wave, "wave must not be null");
        return CoherencyMatrix.fromJones(wave.jones());
    }

    /**
     * Linear Jones vector carrying the polarized intensity I * DoP at the
     * state's orientation. Ellipticity and the unpolarized part are dropped.
     */
    public static LegacyWaveLight toWaveLight(CoherencyMatrix state, Vector3 direction, String sourceId) {
        Objects.requireNonNull(state, "state must not be null");
        double amplitude = Math.sqrt(state.intensity() * state.degreeOfPolarization());
        double angle = state.orientationAngle();
        JonesVector jones = new JonesVector(
            Complex.real(amplitude * Math.cos(angle)),
            Complex.real(amplitude * Math.sin(angle)));
        return new LegacyWaveLight(LegacyDirection.nearest(direction), jones, 0.0, sourceId);
    }

    /**
     * State from the legacy (intensity, Jones, coherence) triple.
     * A missing Jones vector or zero coherence yields unpolarized light of the
     * given intensity; full coherence yields the pure Jones state; anything in
     * between mixes c * J_jones + (1 - c) * J_unpolarized.
     *
     * @param jones     may be null
     * @param coherence clamped to [0, 1]
     */
    public static CoherencyMatrix fromLegacyState(double intensity, JonesVector jones, double coherence) {
        double c = Math.max(0.0, Math.min(1.0, coherence));
        if (jones == null || c < COHERENCE_SNAP) {
            return CoherencyMatrix.createUnpolarized(intensity);
        }
        CoherencyMatrix polarized = CoherencyMatrix.fromJones(jones);
        if (c >= 1.0 - COHERENCE_SNAP) {
            return polarized;
        }
        return polarized.scale(c).add(CoherencyMatrix.createUnpolarized(intensity).scale(1.0 - c));
    }

    // -- Rays -----------------------------------------------------------------

    public static LightRay rayFromPacket(LegacyLightPacket packet, Vector3 position, String sourceId) {
        LightSourceConfig config = LightSourceConfig.of(sourceId == null ? "legacy" : sourceId,
            position, packet.direction().vector(), normalizeIntensity(packet.intensity()));
        return LightSources.withState("legacy", config, fromLightPacket(packet));
    }

    public static LightRay rayFromWaveLight(LegacyWaveLight wave, Vector3 position) {
        CoherencyMatrix state = fromWaveLight(wave);
        LightSourceConfig config = LightSourceConfig.of(wave.sourceId(), position,
            wave.direction().vector(), state.intensity());
        return LightSources.withState("wave", config, state);
    }

    // -- Grid and quantisation helpers ----------------------------------------

    public static Vector3 positionFromBlock(BlockPosition block) {
        return new Vector3(block.x(), block.y(), block.z());
    }

    public static BlockPosition blockFromPosition(Vector3 position) {
        return new BlockPosition(
            (int) Math.round(position.x),
            (int) Math.round(position.y),
            (int) Math.round(position.z));
    }

    /** level / 15 clamped to [0, 1]. */
    public static double normalizeIntensity(int legacyIntensity) {
        double levels = PhysicsConstants.LEGACY_INTENSITY_LEVELS;
        return Math.max(0.0, Math.min(1.0, legacyIntensity / levels));
    }

    /** round(I * 15) clamped to [0, 15]. */
    public static int discretizeIntensity(double intensity) {
        int levels = PhysicsConstants.LEGACY_INTENSITY_LEVELS;
        return (int) Math.round(Math.max(0.0, Math.min(levels, intensity * levels)));
    }
}
