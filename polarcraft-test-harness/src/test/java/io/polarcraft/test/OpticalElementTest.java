package io.polarcraft.test;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Vector3;
import io.polarcraft.optics.Attenuator;
import io.polarcraft.optics.Depolarizer;
import io.polarcraft.optics.DielectricSurface;
import io.polarcraft.optics.IdealMirror;
import io.polarcraft.optics.IdealPolarizer;
import io.polarcraft.optics.InteractionResult;
import io.polarcraft.optics.OpticalElement;
import io.polarcraft.optics.OpticalRotator;
import io.polarcraft.optics.OutputBeam;
import io.polarcraft.optics.PolarizingBeamSplitter;
import io.polarcraft.optics.WavePlate;
import io.polarcraft.simulation.LightTracer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Element behaviour for a beam travelling along +z into elements facing -z.
 * At normal incidence the element frame is s = x, p = y, so axis angles
 * below are measured from x toward y.
 */
class OpticalElementTest {

    private static final double EPS = 1e-9;
    private static final Vector3 FACING = Vector3.NEG_Z;
    private static final PolarizationBasis FRAME = PolarizationBasis.fromPropagation(Vector3.Z);

    private static final List<CoherencyMatrix> SAMPLE_INPUTS = List.of(
        CoherencyMatrix.HORIZONTAL,
        CoherencyMatrix.DIAGONAL,
        CoherencyMatrix.RIGHT_CIRCULAR,
        CoherencyMatrix.UNPOLARIZED,
        CoherencyMatrix.createElliptical(2.0, 0.7, -0.3),
        CoherencyMatrix.createPartiallyPolarized(1.5, 0.4, 1.1));

    // -- Polarizer -----------------------------------------------------------

    @Test
    void malusLawOverFullTurn() {
        for (int deg = 0; deg < 360; deg += 15) {
            double theta = Math.toRadians(deg);
            IdealPolarizer polarizer = polarizer("p", deg);
            double out = transmitted(polarizer.interact(CoherencyMatrix.HORIZONTAL, FRAME));
            assertThat(out).as("Malus at %d", deg).isCloseTo(Math.cos(theta) * Math.cos(theta), within(EPS));
        }
    }

    @Test
    void malusLawExactAtQuarterTurns() {
        assertThat(transmitted(polarizer("p0", 0).interact(CoherencyMatrix.HORIZONTAL, FRAME))).isEqualTo(1.0);
        assertThat(polarizer("p90", 90).interact(CoherencyMatrix.HORIZONTAL, FRAME).hasOutput()).isFalse();
        assertThat(transmitted(polarizer("p180", 180).interact(CoherencyMatrix.HORIZONTAL, FRAME)))
            .isCloseTo(1.0, within(1e-15));
        assertThat(polarizer("p270", 270).interact(CoherencyMatrix.HORIZONTAL, FRAME).hasOutput()).isFalse();
    }

    @Test
    void crossedPolarizersBlockAndMiddlePolarizerRestores() {
        CoherencyMatrix blocked = LightTracer.traceThrough(CoherencyMatrix.HORIZONTAL, Vector3.Z,
            List.of(polarizer("a", 0), polarizer("b", 90)));
        assertThat(blocked).isEqualTo(CoherencyMatrix.ZERO);

        CoherencyMatrix threeStage = LightTracer.traceThrough(CoherencyMatrix.HORIZONTAL, Vector3.Z,
            List.of(polarizer("a", 0), polarizer("m", 45), polarizer("b", 90)));
        assertThat(threeStage.intensity()).isCloseTo(0.25, within(EPS));
    }

    @Test
    void polarizerAxisAlongNormalIsRejected() {
        assertThatThrownBy(() -> new IdealPolarizer("bad", Vector3.ZERO, FACING, Vector3.Z))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("parallel");
    }

    @Test
    void elementIdMustNotBeBlank() {
        assertThatThrownBy(() -> new Attenuator(" ", Vector3.ZERO, FACING, 0.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Attenuator("a", Vector3.ZERO, Vector3.ZERO, 0.5))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // -- Wave plates ---------------------------------------------------------

    @Test
    void halfWavePlateMirrorsPolarizationAboutFastAxis() {
        WavePlate hwp = WavePlate.halfWave("hwp", Vector3.ZERO, FACING, axis(22.5));
        CoherencyMatrix out = only(hwp.interact(CoherencyMatrix.HORIZONTAL, FRAME));
        assertThat(Math.toDegrees(out.orientationAngle())).isCloseTo(45.0, within(1e-7));
    }

    @Test
    void halfWavePlateTwiceIsIdentity() {
        WavePlate hwp = WavePlate.halfWave("hwp", Vector3.ZERO, FACING, axis(17));
        for (CoherencyMatrix in : SAMPLE_INPUTS) {
            CoherencyMatrix once = only(hwp.interact(in, FRAME));
            CoherencyMatrix twice = only(hwp.interact(once, FRAME));
            assertThat(twice.approxEquals(in, EPS)).as("input %s", in).isTrue();
        }
    }

    @Test
    void twoQuarterWavePlatesMakeHalfWavePlate() {
        WavePlate qwp = WavePlate.quarterWave("qwp", Vector3.ZERO, FACING, axis(30));
        WavePlate hwp = WavePlate.halfWave("hwp", Vector3.ZERO, FACING, axis(30));
        for (CoherencyMatrix in : SAMPLE_INPUTS) {
            CoherencyMatrix viaQuarters = only(qwp.interact(only(qwp.interact(in, FRAME)), FRAME));
            CoherencyMatrix viaHalf = only(hwp.interact(in, FRAME));
            assertThat(viaQuarters.approxEquals(viaHalf, EPS)).as("input %s", in).isTrue();
        }
    }

    @Test
    void waveplateAlongFastAxisLeavesLightUnchanged() {
        WavePlate qwp = WavePlate.quarterWave("qwp", Vector3.ZERO, FACING, axis(0));
        CoherencyMatrix out = only(qwp.interact(CoherencyMatrix.HORIZONTAL, FRAME));
        assertThat(out.approxEquals(CoherencyMatrix.HORIZONTAL, EPS)).isTrue();
    }

    // -- Rotator -------------------------------------------------------------

    @Test
    void rotatorTurnsPlaneSeenByNextElement() {
        OpticalRotator rotator = new OpticalRotator("rot", Vector3.ZERO, FACING, Math.toRadians(30));
        CoherencyMatrix aligned = LightTracer.traceThrough(CoherencyMatrix.HORIZONTAL, Vector3.Z,
            List.of(rotator, polarizer("a", 30)));
        assertThat(aligned.intensity()).isCloseTo(1.0, within(EPS));

        CoherencyMatrix crossed = LightTracer.traceThrough(CoherencyMatrix.HORIZONTAL, Vector3.Z,
            List.of(rotator, polarizer("b", 120)));
        assertThat(crossed.intensity()).isCloseTo(0.0, within(EPS));
    }

    @Test
    void rotatorCarriesRotationInOutputFrame() {
        OpticalRotator rotator = new OpticalRotator("rot", Vector3.ZERO, FACING, 0.5);
        OutputBeam beam = rotator.interact(CoherencyMatrix.HORIZONTAL, FRAME).transmitted().orElseThrow();
        assertThat(beam.basis().isValid()).isTrue();
        assertThat(FRAME.angleTo(beam.basis())).isCloseTo(0.5, within(EPS));
        assertThat(beam.intensity()).isCloseTo(1.0, within(EPS));
    }

    // -- Mirror --------------------------------------------------------------

    @Test
    void mirrorReflectsEverything() {
        IdealMirror mirror = new IdealMirror("m", Vector3.ZERO, FACING);
        for (CoherencyMatrix in : SAMPLE_INPUTS) {
            InteractionResult result = mirror.interact(in, FRAME);
            assertThat(result.transmitted()).isEmpty();
            OutputBeam beam = result.reflected().orElseThrow();
            assertThat(beam.intensity()).isCloseTo(in.intensity(), within(EPS));
            assertThat(beam.state().approxEquals(in, EPS)).isTrue();
            assertThat(beam.direction().approxEquals(Vector3.NEG_Z, EPS)).isTrue();
            assertThat(beam.basis().isValid()).isTrue();
        }
    }

    // -- Beam splitter -------------------------------------------------------

    @Test
    void idealSplitterTransmitsPAndReflectsS() {
        PolarizingBeamSplitter pbs = new PolarizingBeamSplitter("pbs", Vector3.ZERO, FACING);

        InteractionResult sIn = pbs.interact(CoherencyMatrix.HORIZONTAL, FRAME);
        assertThat(sIn.transmitted()).isEmpty();
        assertThat(sIn.reflected().orElseThrow().intensity()).isCloseTo(1.0, within(EPS));

        InteractionResult pIn = pbs.interact(CoherencyMatrix.VERTICAL, FRAME);
        assertThat(pIn.reflected()).isEmpty();
        assertThat(pIn.transmitted().orElseThrow().intensity()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void splitterHalvesUnpolarizedLight() {
        PolarizingBeamSplitter pbs = new PolarizingBeamSplitter("pbs", Vector3.ZERO, FACING);
        InteractionResult result = pbs.interact(CoherencyMatrix.UNPOLARIZED, FRAME);
        OutputBeam t = result.transmitted().orElseThrow();
        OutputBeam r = result.reflected().orElseThrow();
        assertThat(t.intensity()).isCloseTo(0.5, within(EPS));
        assertThat(r.intensity()).isCloseTo(0.5, within(EPS));
        assertThat(t.state().degreeOfPolarization()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void leakySplitterConservesEnergy() {
        PolarizingBeamSplitter pbs = new PolarizingBeamSplitter("pbs", Vector3.ZERO, FACING, 0.9);
        InteractionResult result = pbs.interact(CoherencyMatrix.HORIZONTAL, FRAME);
        assertThat(transmitted(result)).isCloseTo(0.1, within(EPS));
        assertThat(result.totalIntensity()).isCloseTo(1.0, within(EPS));
        assertThat(new PolarizingBeamSplitter("c", Vector3.ZERO, FACING, 3.0).efficiency()).isEqualTo(1.0);
    }

    // -- Attenuator and depolarizer ------------------------------------------

    @Test
    void attenuatorScalesIntensityOnly() {
        Attenuator attenuator = new Attenuator("att", Vector3.ZERO, FACING, 0.25);
        CoherencyMatrix in = CoherencyMatrix.createPartiallyPolarized(2.0, 0.6, 0.3);
        CoherencyMatrix out = only(attenuator.interact(in, FRAME));
        assertThat(out.intensity()).isCloseTo(0.5, within(EPS));
        assertThat(out.degreeOfPolarization()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void attenuatorClampsTransmission() {
        assertThat(new Attenuator("a", Vector3.ZERO, FACING, 2.0).transmission()).isEqualTo(1.0);
        assertThat(new Attenuator("a", Vector3.ZERO, FACING, -1.0).transmission()).isEqualTo(0.0);
        assertThat(new Attenuator("a", Vector3.ZERO, FACING, 0.0).interact(CoherencyMatrix.HORIZONTAL, FRAME)
            .hasOutput()).isFalse();
        assertThatThrownBy(() -> new Attenuator("a", Vector3.ZERO, FACING, Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void depolarizerScramblesPolarization() {
        CoherencyMatrix full = only(new Depolarizer("d", Vector3.ZERO, FACING)
            .interact(CoherencyMatrix.RIGHT_CIRCULAR, FRAME));
        assertThat(full.degreeOfPolarization()).isCloseTo(0.0, within(EPS));
        assertThat(full.intensity()).isCloseTo(1.0, within(EPS));

        CoherencyMatrix partial = only(new Depolarizer("d", Vector3.ZERO, FACING, 0.5)
            .interact(CoherencyMatrix.HORIZONTAL, FRAME));
        assertThat(partial.degreeOfPolarization()).isCloseTo(0.5, within(1e-9));
    }

    // -- Dielectric ----------------------------------------------------------

    @Test
    void dielectricSplitsEnergyAtNormalIncidence() {
        DielectricSurface glass = new DielectricSurface("g", Vector3.ZERO, FACING, 1.0, 1.5);
        InteractionResult result = glass.interact(CoherencyMatrix.UNPOLARIZED, FRAME);
        assertThat(result.reflected().orElseThrow().intensity()).isCloseTo(0.04, within(EPS));
        assertThat(transmitted(result)).isCloseTo(0.96, within(EPS));
    }

    @Test
    void dielectricConservesEnergyAtOblique() {
        DielectricSurface glass = new DielectricSurface("g", Vector3.ZERO, FACING, 1.0, 1.5);
        for (int deg = 5; deg < 90; deg += 10) {
            Vector3 k = tilted(deg);
            PolarizationBasis basis = PolarizationBasis.computeInterfaceBasis(k, FACING);
            for (CoherencyMatrix in : SAMPLE_INPUTS) {
                InteractionResult result = glass.interact(in, basis);
                assertThat(result.totalIntensity()).as("%d deg, %s", deg, in)
                    .isCloseTo(in.intensity(), within(EPS));
            }
        }
    }

    @Test
    void dielectricRefractsBySnell() {
        DielectricSurface glass = new DielectricSurface("g", Vector3.ZERO, FACING, 1.0, 1.5);
        Vector3 k = tilted(50);
        PolarizationBasis basis = PolarizationBasis.computeInterfaceBasis(k, FACING);
        OutputBeam t = glass.interact(CoherencyMatrix.UNPOLARIZED, basis).transmitted().orElseThrow();
        assertThat(t.direction().x).isCloseTo(Math.sin(Math.toRadians(50)) / 1.5, within(EPS));
        assertThat(t.basis().isValid()).isTrue();
    }

    @Test
    void pPolarizedLightAtBrewsterIsNotReflected() {
        DielectricSurface glass = new DielectricSurface("g", Vector3.ZERO, FACING, 1.0, 1.5);
        Vector3 k = tilted(Math.toDegrees(Math.atan(1.5)));
        PolarizationBasis basis = PolarizationBasis.computeInterfaceBasis(k, FACING);
        InteractionResult result = glass.interact(CoherencyMatrix.VERTICAL, basis);
        assertThat(result.reflected()).isEmpty();
        assertThat(transmitted(result)).isCloseTo(1.0, within(EPS));
    }

    @Test
    void backSideHitSwapsMediaAndCanTotallyReflect() {
        // normal along +z: the beam leaves the glass through this surface
        DielectricSurface exit = new DielectricSurface("exit", Vector3.ZERO, Vector3.Z, 1.0, 1.5);
        Vector3 k = tilted(60);
        PolarizationBasis basis = PolarizationBasis.computeInterfaceBasis(k, Vector3.Z);
        InteractionResult result = exit.interact(CoherencyMatrix.UNPOLARIZED, basis);
        assertThat(result.transmitted()).isEmpty();
        OutputBeam r = result.reflected().orElseThrow();
        assertThat(r.intensity()).isCloseTo(1.0, within(EPS));
        assertThat(r.direction().z).isLessThan(0.0);
    }

    @Test
    void dielectricRejectsBadIndices() {
        assertThatThrownBy(() -> new DielectricSurface("g", Vector3.ZERO, FACING, 0.0, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DielectricSurface("g", Vector3.ZERO, FACING, 1.0, Double.POSITIVE_INFINITY))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // -- Energy conservation across all passive elements ---------------------

    @Test
    void noElementCreatesEnergy() {
        List<OpticalElement> elements = List.of(
            polarizer("p", 37),
            WavePlate.quarterWave("q", Vector3.ZERO, FACING, axis(12)),
            new IdealMirror("m", Vector3.ZERO, FACING),
            new OpticalRotator("r", Vector3.ZERO, FACING, 1.1),
            new PolarizingBeamSplitter("s", Vector3.ZERO, FACING, 0.8),
            new Attenuator("a", Vector3.ZERO, FACING, 0.3),
            new Depolarizer("d", Vector3.ZERO, FACING, 0.6),
            new DielectricSurface("g", Vector3.ZERO, FACING));
        for (OpticalElement element : elements) {
            for (CoherencyMatrix in : SAMPLE_INPUTS) {
                InteractionResult result = element.interact(in, FRAME);
                assertThat(result.totalIntensity()).as("%s with %s", element, in)
                    .isLessThanOrEqualTo(in.intensity() + EPS);
                result.transmitted().ifPresent(b -> assertThat(b.state().isPhysical()).isTrue());
                result.reflected().ifPresent(b -> assertThat(b.state().isPhysical()).isTrue());
            }
        }
    }

    // -- Helpers -------------------------------------------------------------

    private static Vector3 axis(double degrees) {
        double a = Math.toRadians(degrees);
        return new Vector3(Math.cos(a), Math.sin(a), 0);
    }

    private static IdealPolarizer polarizer(String id, double degrees) {
        return new IdealPolarizer(id, Vector3.ZERO, FACING, axis(degrees));
    }

    /** Direction along +z tilted toward +x. */
    private static Vector3 tilted(double degrees) {
        double a = Math.toRadians(degrees);
        return new Vector3(Math.sin(a), 0, Math.cos(a));
    }

    private static double transmitted(InteractionResult result) {
        return result.transmitted().map(OutputBeam::intensity).orElse(0.0);
    }

    private static CoherencyMatrix only(InteractionResult result) {
        assertThat(result.reflected()).isEmpty();
        return result.transmitted().orElseThrow().state();
    }
}
