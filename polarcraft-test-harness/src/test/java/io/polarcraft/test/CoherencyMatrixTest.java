package io.polarcraft.test;

import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.api.StokesVector;
import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.math.Complex;
import io.polarcraft.math.JonesMatrices;
import io.polarcraft.math.Matrix2x2;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CoherencyMatrixTest {

    private static final double EPS = 1e-10;

    // -- Factories -----------------------------------------------------------

    @Test
    void constantsValidateOnLoad() {
        assertThatCode(PhysicsConstants::validate).doesNotThrowAnyException();
    }

    @Test
    void linearStateHasFullPolarization() {
        CoherencyMatrix j = CoherencyMatrix.createLinear(2.0, Math.toRadians(30));
        assertThat(j.intensity()).isCloseTo(2.0, within(EPS));
        assertThat(j.degreeOfPolarization()).isCloseTo(1.0, within(1e-6));
        assertThat(Math.toDegrees(j.orientationAngle())).isCloseTo(30.0, within(1e-9));
        assertThat(j.isLinear()).isTrue();
        assertThat(j.isCircular()).isFalse();
    }

    @Test
    void unpolarizedStateHasZeroDop() {
        CoherencyMatrix j = CoherencyMatrix.createUnpolarized(3.0);
        assertThat(j.intensity()).isCloseTo(3.0, within(EPS));
        assertThat(j.degreeOfPolarization()).isCloseTo(0.0, within(EPS));
        assertThat(j.isUnpolarized()).isTrue();
    }

    @Test
    void rightCircularHasPositiveS3() {
        StokesVector s = CoherencyMatrix.RIGHT_CIRCULAR.toStokes();
        assertThat(s.s0()).isCloseTo(1.0, within(EPS));
        assertThat(s.s1()).isCloseTo(0.0, within(EPS));
        assertThat(s.s2()).isCloseTo(0.0, within(EPS));
        assertThat(s.s3()).isCloseTo(1.0, within(EPS));
        assertThat(CoherencyMatrix.LEFT_CIRCULAR.toStokes().s3()).isCloseTo(-1.0, within(EPS));
        assertThat(CoherencyMatrix.RIGHT_CIRCULAR.isCircular()).isTrue();
    }

    @Test
    void partiallyPolarizedHasRequestedDop() {
        CoherencyMatrix j = CoherencyMatrix.createPartiallyPolarized(1.0, 0.6, 0.2);
        assertThat(j.degreeOfPolarization()).isCloseTo(0.6, within(1e-9));
        assertThat(j.intensity()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void ellipticalStateCarriesOrientationAndEllipticity() {
        CoherencyMatrix j = CoherencyMatrix.createElliptical(1.0, Math.toRadians(20), Math.toRadians(15));
        assertThat(Math.toDegrees(j.orientationAngle())).isCloseTo(20.0, within(1e-9));
        assertThat(Math.toDegrees(j.ellipticityAngle())).isCloseTo(15.0, within(1e-9));
        assertThat(j.degreeOfPolarization()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void dopIsZeroForNoLight() {
        assertThat(CoherencyMatrix.ZERO.degreeOfPolarization()).isEqualTo(0.0);
        assertThat(CoherencyMatrix.ZERO.isAboveThreshold()).isFalse();
    }

    // -- Stokes round trip ---------------------------------------------------

    @Test
    void stokesRoundTripIsExactForPhysicalStates() {
        List<CoherencyMatrix> states = List.of(
            CoherencyMatrix.HORIZONTAL,
            CoherencyMatrix.DIAGONAL,
            CoherencyMatrix.LEFT_CIRCULAR,
            CoherencyMatrix.createPartiallyPolarized(0.7, 0.3, 1.1),
            CoherencyMatrix.createElliptical(2.0, -0.4, 0.3),
            CoherencyMatrix.fromMatrix(Matrix2x2.hermitian(0.8, new Complex(0.1, -0.2), 0.4)));
        for (CoherencyMatrix j : states) {
            CoherencyMatrix back = CoherencyMatrix.fromStokes(j.toStokes());
            assertThat(back.approxEquals(j, 1e-12)).as("round trip of %s", j).isTrue();
        }
    }

    // -- Operators -----------------------------------------------------------

    @Test
    void applyOperatorIsSimilarityTransform() {
        CoherencyMatrix j = CoherencyMatrix.createPartiallyPolarized(1.0, 0.5, 0.3);
        Matrix2x2 m = JonesMatrices.wavePlate(0.7, 1.3);
        Matrix2x2 expected = m.mul(j.rawMatrix()).mul(m.adjoint());
        assertThat(j.applyOperator(m).rawMatrix().approxEquals(expected, 1e-14)).isTrue();
    }

    @Test
    void unitaryOperatorPreservesIntensityAndDop() {
        CoherencyMatrix j = CoherencyMatrix.createPartiallyPolarized(1.0, 0.42, 0.9);
        CoherencyMatrix out = j.applyOperator(JonesMatrices.wavePlate(0.2, 2.2));
        assertThat(out.intensity()).isCloseTo(1.0, within(EPS));
        assertThat(out.degreeOfPolarization()).isCloseTo(0.42, within(1e-9));
        assertThat(out.isPhysical()).isTrue();
    }

    @Test
    void depolarizeInterpolatesTowardUnpolarized() {
        CoherencyMatrix j = CoherencyMatrix.HORIZONTAL;
        assertThat(j.depolarize(0.0)).isSameAs(j);
        assertThat(j.depolarize(1.0).approxEquals(CoherencyMatrix.UNPOLARIZED, EPS)).isTrue();
        CoherencyMatrix half = j.depolarize(0.5);
        assertThat(half.intensity()).isCloseTo(1.0, within(EPS));
        assertThat(half.degreeOfPolarization()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void depolarizeClampsFactor() {
        CoherencyMatrix j = CoherencyMatrix.VERTICAL;
        assertThat(j.depolarize(-3.0)).isSameAs(j);
        assertThat(j.depolarize(7.0).approxEquals(CoherencyMatrix.UNPOLARIZED, EPS)).isTrue();
    }

    @Test
    void incoherentSumOfOrthogonalStatesIsUnpolarized() {
        CoherencyMatrix sum = CoherencyMatrix.HORIZONTAL.scale(0.5).add(CoherencyMatrix.VERTICAL.scale(0.5));
        assertThat(sum.approxEquals(CoherencyMatrix.UNPOLARIZED, EPS)).isTrue();
    }

    @Test
    void nonPhysicalMatrixIsReportedNotThrown() {
        CoherencyMatrix bad = CoherencyMatrix.fromStokes(1.0, 0.9, 0.9, 0.0);
        assertThat(bad.isPhysical()).isFalse();
    }

    // -- Classifier tolerances -----------------------------------------------

    @Test
    void classifiersHonourExplicitTolerance() {
        CoherencyMatrix nearlyLinear = CoherencyMatrix.createElliptical(1.0, 0.0, 0.001);
        assertThat(nearlyLinear.isLinear()).isFalse();
        assertThat(nearlyLinear.isLinear(0.01)).isTrue();

        CoherencyMatrix dop97 = CoherencyMatrix.createPartiallyPolarized(1.0, 0.97, 0.0);
        assertThat(dop97.isFullyPolarized()).isFalse();
        assertThat(dop97.isFullyPolarized(0.05)).isTrue();
    }
}
