package io.polarcraft.test;

import io.polarcraft.api.Handedness;
import io.polarcraft.api.PolarizationCategory;
import io.polarcraft.api.StokesVector;
import io.polarcraft.core.JonesView;
import io.polarcraft.game.LegacyDirection;
import io.polarcraft.game.LegacyLightPacket;
import io.polarcraft.game.LegacyPolarization;
import io.polarcraft.game.PhysicsApi;
import io.polarcraft.game.PhysicsMode;
import io.polarcraft.game.PolarizationInfo;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PhysicsApiTest {

    private static final double EPS = 1e-9;
    private static final String FOREIGN = "PolarizationInfo was not created by the Physics API";

    private final PhysicsApi api = new PhysicsApi();

    // -- Construction --------------------------------------------------------

    @Test
    void defaultsToScienceMode() {
        assertThat(api.mode()).isEqualTo(PhysicsMode.SCIENCE);
        assertThat(new PhysicsApi(PhysicsMode.GAME).mode()).isEqualTo(PhysicsMode.GAME);
        assertThatThrownBy(() -> new PhysicsApi(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("mode must not be null");
    }

    @Test
    void gameAndScienceModesAgreeOnPhysics() {
        PhysicsApi game = new PhysicsApi(PhysicsMode.GAME);
        double science = api.applyPolarizer(api.createLinearSource(0), 60).intensity();
        double arcade = game.applyPolarizer(game.createLinearSource(0), 60).intensity();
        assertThat(arcade).isCloseTo(science, within(EPS));
    }

    // -- Sources -------------------------------------------------------------

    @Test
    void sourcesDescribeThemselves() {
        PolarizationInfo linear = api.createLinearSource(30, 2.0);
        assertThat(linear.intensity()).isCloseTo(2.0, within(EPS));
        assertThat(linear.angleDeg()).isCloseTo(30.0, within(1e-6));
        assertThat(linear.polarizationType()).isEqualTo(PolarizationCategory.LINEAR);
        assertThat(linear.handedness()).isEqualTo(Handedness.NONE);

        PolarizationInfo left = api.createCircularSource(false);
        assertThat(left.polarizationType()).isEqualTo(PolarizationCategory.CIRCULAR);
        assertThat(left.handedness()).isEqualTo(Handedness.LEFT);

        PolarizationInfo natural = api.createUnpolarizedSource();
        assertThat(natural.degreeOfPolarization()).isCloseTo(0.0, within(EPS));
        assertThat(natural.polarizationType()).isEqualTo(PolarizationCategory.UNPOLARIZED);
    }

    // -- Elements ------------------------------------------------------------

    @Test
    void polarizerAppliesMalus() {
        PolarizationInfo out = api.applyPolarizer(api.createLinearSource(0), 45);
        assertThat(out.intensity()).isCloseTo(0.5, within(EPS));
        assertThat(out.angleDeg()).isCloseTo(45.0, within(1e-6));
    }

    @Test
    void crossedPolarizersLeaveDarkHandle() {
        PolarizationInfo out = api.applyPolarizer(api.createLinearSource(0), 90);
        assertThat(out.intensity()).isCloseTo(0.0, within(EPS));
        assertThat(out.polarizationType()).isEqualTo(PolarizationCategory.UNPOLARIZED);
    }

    @Test
    void quarterWavePlateAtFortyFiveMakesRightCircular() {
        PolarizationInfo out = api.applyWavePlate(api.createLinearSource(0), 90, 45);
        assertThat(out.polarizationType()).isEqualTo(PolarizationCategory.CIRCULAR);
        assertThat(out.handedness()).isEqualTo(Handedness.RIGHT);
        assertThat(out.intensity()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void rotatorTurnsPlaneInFacadeFrame() {
        PolarizationInfo out = api.applyRotator(api.createLinearSource(0), 30);
        assertThat(out.angleDeg()).isCloseTo(30.0, within(1e-6));
        assertThat(api.applyPolarizer(out, 30).intensity()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void mirrorAndAttenuator() {
        PolarizationInfo source = api.createLinearSource(20);
        assertThat(api.applyMirror(source).intensity()).isCloseTo(1.0, within(EPS));
        assertThat(api.applyAttenuation(source, 0.25).intensity()).isCloseTo(0.25, within(EPS));
        assertThat(api.applyAttenuation(source, 0.25).angleDeg()).isCloseTo(20.0, within(1e-6));
    }

    @Test
    void beamSplitterSeparatesOrthogonalComponents() {
        PhysicsApi.BeamSplit split = api.applyPBS(api.createUnpolarizedSource());
        assertThat(split.transmitted().intensity()).isCloseTo(0.5, within(EPS));
        assertThat(split.transmitted().angleDeg()).isCloseTo(90.0, within(1e-6));
        assertThat(split.reflected().intensity()).isCloseTo(0.5, within(EPS));
        assertThat(split.reflected().angleDeg()).isCloseTo(0.0, within(1e-6));

        PhysicsApi.BeamSplit pure = api.applyPBS(api.createLinearSource(90));
        assertThat(pure.transmitted().intensity()).isCloseTo(1.0, within(EPS));
        assertThat(pure.reflected().intensity()).isCloseTo(0.0, within(EPS));
    }

    // -- Conversions ---------------------------------------------------------

    @Test
    void stokesAndJonesViews() {
        StokesVector stokes = api.toStokes(api.createLinearSource(45));
        assertThat(stokes.s0()).isCloseTo(1.0, within(EPS));
        assertThat(stokes.s2()).isCloseTo(1.0, within(EPS));

        assertThat(api.toJones(api.createLinearSource(45))).isInstanceOf(JonesView.Defined.class);
        assertThat(api.toJones(api.createUnpolarizedSource())).isInstanceOf(JonesView.NotFullyPolarized.class);
        assertThat(api.toJones(api.applyPolarizer(api.createLinearSource(0), 90)))
            .isInstanceOf(JonesView.NoLight.class);
    }

    @Test
    void legacyPacketsGoThroughAdapter() {
        LegacyLightPacket packet = api.toLegacyPacket(api.createLinearSource(90, 0.6), LegacyDirection.EAST);
        assertThat(packet.direction()).isEqualTo(LegacyDirection.EAST);
        assertThat(packet.intensity()).isEqualTo(9);
        assertThat(packet.polarization()).isEqualTo(LegacyPolarization.DEG_90);
        assertThat(packet.phase()).isEqualTo(1);

        PolarizationInfo back = api.fromLegacyPacket(
            new LegacyLightPacket(LegacyDirection.UP, 15, LegacyPolarization.DEG_135, -1));
        assertThat(back.intensity()).isCloseTo(1.0, within(EPS));
        assertThat(back.angleDeg()).isCloseTo(135.0, within(1e-6));

        assertThatThrownBy(() -> api.toLegacyPacket(back, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> api.fromLegacyPacket(null)).isInstanceOf(IllegalArgumentException.class);
    }

    // -- Handles -------------------------------------------------------------

    @Test
    void foreignHandlesAreRejected() {
        PolarizationInfo forged = new PolarizationInfo() {
            @Override public double intensity() { return 1.0; }
            @Override public double angleDeg() { return 0.0; }
            @Override public double degreeOfPolarization() { return 1.0; }
            @Override public PolarizationCategory polarizationType() { return PolarizationCategory.LINEAR; }
            @Override public Handedness handedness() { return Handedness.NONE; }
        };

        assertThatThrownBy(() -> api.applyPolarizer(forged, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage(FOREIGN);
        assertThatThrownBy(() -> api.toStokes(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage(FOREIGN);
    }

    @Test
    void handlesAreImmutableValues() {
        PolarizationInfo source = api.createLinearSource(0);
        api.applyPolarizer(source, 90);
        assertThat(source.intensity()).isCloseTo(1.0, within(EPS));
        assertThat(source.angleDeg()).isCloseTo(0.0, within(1e-6));
    }
}
