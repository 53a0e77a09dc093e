package io.polarcraft.game;

import io.polarcraft.api.StokesVector;
import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.JonesView;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.core.PolarizationState;
import io.polarcraft.math.Vector3;
import io.polarcraft.optics.Attenuator;
import io.polarcraft.optics.IdealMirror;
import io.polarcraft.optics.IdealPolarizer;
import io.polarcraft.optics.InteractionResult;
import io.polarcraft.optics.OpticalRotator;
import io.polarcraft.optics.OutputBeam;
import io.polarcraft.optics.PolarizingBeamSplitter;
import io.polarcraft.optics.WavePlate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Verb-style facade for game code. Hides coherency matrices behind
 * {@link PolarizationInfo} handles.
 *
 * All light travels along +Z in the frame s = X, p = Y. Elements sit at the
 * origin facing the light; axis angles are degrees from X toward Y.
 * Outputs are re-expressed in that frame except for mirror reflections,
 * which stay in the reflected frame.
 *
 * Passing a handle this facade did not create throws IllegalArgumentException.
 */
public final class PhysicsApi {

    private static final Logger log = LogManager.getLogger(PhysicsApi.class);

    static final String FOREIGN_HANDLE_MESSAGE = "PolarizationInfo was not created by the Physics API";

    private static final PolarizationBasis FRAME = PolarizationBasis.fromPropagation(Vector3.Z);
    private static final Vector3 ORIGIN = Vector3.ZERO;
    private static final Vector3 FACING = Vector3.NEG_Z;

    private final PhysicsMode mode;

    public PhysicsApi() {
        this(PhysicsMode.SCIENCE);
    }

    public PhysicsApi(PhysicsMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        this.mode = mode;
    }

    public PhysicsMode mode() {
        return mode;
    }

    // -- Sources --------------------------------------------------------------

    public PolarizationInfo createLinearSource(double angleDeg) {
        return createLinearSource(angleDeg, 1.0);
    }

    public PolarizationInfo createLinearSource(double angleDeg, double intensity) {
        return wrap(CoherencyMatrix.createLinear(intensity, Math.toRadians(angleDeg)));
    }

    public PolarizationInfo createCircularSource(boolean rightHanded) {
        return createCircularSource(rightHanded, 1.0);
    }

    public PolarizationInfo createCircularSource(boolean rightHanded, double intensity) {
        return wrap(CoherencyMatrix.createCircular(intensity, rightHanded));
    }

    public PolarizationInfo createUnpolarizedSource() {
        return createUnpolarizedSource(1.0);
    }

    public PolarizationInfo createUnpolarizedSource(double intensity) {
        return wrap(CoherencyMatrix.createUnpolarized(intensity));
    }

    // -- Elements -------------------------------------------------------------

    public PolarizationInfo applyPolarizer(PolarizationInfo state, double axisDeg) {
        IdealPolarizer polarizer = new IdealPolarizer("pol", ORIGIN, FACING, axisFromDeg(axisDeg));
        return transmitted(polarizer.interact(coherencyOf(state), FRAME));
    }

    public PolarizationInfo applyWavePlate(PolarizationInfo state, double retardationDeg, double fastAxisDeg) {
        WavePlate plate = new WavePlate("wp", ORIGIN, FACING, axisFromDeg(fastAxisDeg),
            Math.toRadians(retardationDeg));
        return transmitted(plate.interact(coherencyOf(state), FRAME));
    }

    public PolarizationInfo applyRotator(PolarizationInfo state, double angleDeg) {
        OpticalRotator rotator = new OpticalRotator("rot", ORIGIN, FACING, Math.toRadians(angleDeg));
        return transmitted(rotator.interact(coherencyOf(state), FRAME));
    }

    public PolarizationInfo applyMirror(PolarizationInfo state) {
        IdealMirror mirror = new IdealMirror("mirror", ORIGIN, FACING);
        return mirror.interact(coherencyOf(state), FRAME).reflected()
            .map(beam -> wrap(beam.state()))
            .orElseGet(() -> wrap(CoherencyMatrix.ZERO));
    }

    public PolarizationInfo applyAttenuation(PolarizationInfo state, double factor) {
        Attenuator attenuator = new Attenuator("att", ORIGIN, FACING, factor);
        return transmitted(attenuator.interact(coherencyOf(state), FRAME));
    }

    /** Splits into (transmitted p, reflected s). A missing branch is a zero-intensity handle. */
    public BeamSplit applyPBS(PolarizationInfo state) {
        PolarizingBeamSplitter pbs = new PolarizingBeamSplitter("pbs", ORIGIN, FACING);
        InteractionResult result = pbs.interact(coherencyOf(state), FRAME);
        PolarizationInfo transmitted = result.transmitted()
            .map(beam -> wrap(beam.state()))
            .orElseGet(() -> wrap(CoherencyMatrix.ZERO));
        PolarizationInfo reflected = result.reflected()
            .map(beam -> wrap(beam.state()))
            .orElseGet(() -> wrap(CoherencyMatrix.ZERO));
        return new BeamSplit(transmitted, reflected);
    }

    /** Output pair of a beam splitter. */
    public record BeamSplit(PolarizationInfo transmitted, PolarizationInfo reflected) {}

    // -- Conversions ----------------------------------------------------------

    public StokesVector toStokes(PolarizationInfo state) {
        return coherencyOf(state).toStokes();
    }

    /** Jones view; undefined below the fully-polarized threshold. */
    public JonesView toJones(PolarizationInfo state) {
        return PolarizationState.fromCoherency(coherencyOf(state)).jones();
    }

    public LegacyLightPacket toLegacyPacket(PolarizationInfo state, LegacyDirection direction) {
        if (direction == null) {
            throw new IllegalArgumentException("direction must not be null");
        }
        return LegacyAdapter.toLightPacket(coherencyOf(state), direction.vector());
    }

    public PolarizationInfo fromLegacyPacket(LegacyLightPacket packet) {
        if (packet == null) {
            throw new IllegalArgumentException("packet must not be null");
        }
        return wrap(LegacyAdapter.fromLightPacket(packet));
    }

    // -- Internals ------------------------------------------------------------

    private static PolarizationInfo wrap(CoherencyMatrix coherency) {
        return new ManagedPolarizationInfo(coherency);
    }

    private static PolarizationInfo transmitted(InteractionResult result) {
        Optional<OutputBeam> beam = result.transmitted();
        if (beam.isEmpty()) {
            return wrap(CoherencyMatrix.ZERO);
        }
        OutputBeam out = beam.get();
        return wrap(out.basis().transformCoherency(out.state(), FRAME));
    }

    private static CoherencyMatrix coherencyOf(PolarizationInfo info) {
        if (info instanceof ManagedPolarizationInfo) {
            return ((ManagedPolarizationInfo) info).coherency();
        }
        log.error("[api] rejected handle {}: {}", info, FOREIGN_HANDLE_MESSAGE);
        throw new IllegalArgumentException(FOREIGN_HANDLE_MESSAGE);
    }

    private static Vector3 axisFromDeg(double deg) {
        double rad = Math.toRadians(deg);
        return new Vector3(Math.cos(rad), Math.sin(rad), 0.0);
    }

    @Override
    public String toString() {
        return "PhysicsApi[" + mode + "]";
    }
}
