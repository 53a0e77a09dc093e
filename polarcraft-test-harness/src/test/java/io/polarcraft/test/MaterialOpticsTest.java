package io.polarcraft.test;

import io.polarcraft.core.CoherencyMatrix;
import io.polarcraft.core.PolarizationBasis;
import io.polarcraft.math.Vector3;
import io.polarcraft.optics.DispersiveWavePlate;
import io.polarcraft.optics.OpticalRotator;
import io.polarcraft.optics.material.BirefringentMaterial;
import io.polarcraft.optics.material.ChiralMaterial;
import io.polarcraft.optics.material.OpticalActivity;
import io.polarcraft.optics.material.SpectralLine;
import io.polarcraft.simulation.LightTracer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Wavelength-dependent behaviour: birefringent plates and optically active samples.
 */
class MaterialOpticsTest {

    private static final double EPS = 1e-9;
    private static final PolarizationBasis FRAME = PolarizationBasis.fromPropagation(Vector3.Z);
    private static final Vector3 DIAGONAL_AXIS = new Vector3(1, 1, 0).normalize();

    // -- Birefringent materials ----------------------------------------------

    @Test
    void dispersiveMaterialHasLargerBirefringenceInBlue() {
        BirefringentMaterial quartz = BirefringentMaterial.QUARTZ;
        assertThat(quartz.hasDispersion()).isTrue();
        assertThat(quartz.birefringenceAt(450)).isGreaterThan(quartz.birefringenceAt(650));
        assertThat(quartz.birefringenceAt(589)).isCloseTo(0.00875 + 450.0 / (589.0 * 589.0), within(1e-15));
    }

    @Test
    void constantMaterialIgnoresWavelength() {
        BirefringentMaterial mica = BirefringentMaterial.MICA;
        assertThat(mica.hasDispersion()).isFalse();
        assertThat(mica.birefringenceAt(400)).isEqualTo(mica.birefringenceAt(700)).isEqualTo(0.036);
    }

    @Test
    void requiredThicknessHitsTargetRetardance() {
        for (BirefringentMaterial material : BirefringentMaterial.catalogue()) {
            double thickness = material.requiredThickness(Math.PI / 2, 550);
            assertThat(material.phaseRetardation(thickness, 550)).as(material.name())
                .isCloseTo(Math.PI / 2, within(1e-12));
        }
    }

    @Test
    void isotropicMaterialNeedsInfinitePlate() {
        BirefringentMaterial glass = BirefringentMaterial.constant("glass", 0.0, 550);
        assertThat(glass.requiredThickness(Math.PI, 550)).isInfinite();
        assertThat(glass.phaseRetardation(100, 550)).isZero();
    }

    @Test
    void catalogueLookupIsCaseInsensitive() {
        assertThat(BirefringentMaterial.byName("calcite (iceland spar)")).contains(BirefringentMaterial.CALCITE);
        assertThat(BirefringentMaterial.byName("unobtainium")).isEmpty();
        assertThatThrownBy(() -> BirefringentMaterial.QUARTZ.birefringenceAt(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // -- Dispersive wave plate -----------------------------------------------

    @Test
    void designedQuarterWavePlateIsExactAtDesignWavelength() {
        DispersiveWavePlate plate = quartzQuarterWave();
        assertThat(plate.designRetardance()).isCloseTo(Math.PI / 2, within(1e-12));
        assertThat(plate.retardanceAt(450)).isGreaterThan(Math.PI / 2);
        assertThat(plate.retardanceAt(650)).isLessThan(Math.PI / 2);
    }

    @Test
    void dispersivePlateMakesCircularLightOnlyAtDesignWavelength() {
        DispersiveWavePlate plate = quartzQuarterWave();
        CoherencyMatrix atDesign = plate.interact(CoherencyMatrix.HORIZONTAL, FRAME, 550)
            .transmitted().orElseThrow().state();
        assertThat(atDesign.toStokes().s3()).isCloseTo(1.0, within(EPS));

        CoherencyMatrix detuned = plate.interact(CoherencyMatrix.HORIZONTAL, FRAME, 450)
            .transmitted().orElseThrow().state();
        assertThat(Math.abs(detuned.toStokes().s3())).isLessThan(0.99);
        assertThat(detuned.intensity()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void wavelengthFreeInteractionUsesDesignWavelength() {
        DispersiveWavePlate plate = quartzQuarterWave();
        CoherencyMatrix implicit = plate.interact(CoherencyMatrix.DIAGONAL, FRAME)
            .transmitted().orElseThrow().state();
        CoherencyMatrix explicit = plate.interact(CoherencyMatrix.DIAGONAL, FRAME, 550)
            .transmitted().orElseThrow().state();
        assertThat(implicit.approxEquals(explicit, 1e-15)).isTrue();
    }

    @Test
    void tracerPassesRayWavelengthToPlate() {
        DispersiveWavePlate plate = quartzQuarterWave();
        CoherencyMatrix traced = LightTracer.traceThrough(CoherencyMatrix.HORIZONTAL, Vector3.Z, List.of(plate), 450);
        CoherencyMatrix direct = plate.interact(CoherencyMatrix.HORIZONTAL, FRAME, 450)
            .transmitted().orElseThrow().state();
        assertThat(traced.approxEquals(direct, EPS)).isTrue();
    }

    @Test
    void plateRejectsNegativeThickness() {
        assertThatThrownBy(() -> new DispersiveWavePlate("bad", Vector3.ZERO, Vector3.NEG_Z, Vector3.X,
            BirefringentMaterial.MICA, -1.0, 550))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // -- Optical activity ----------------------------------------------------

    @Test
    void specificRotationScalesWithInverseSquareWavelength() {
        assertThat(OpticalActivity.specificRotationAt(66.5, 589)).isCloseTo(66.5, within(1e-12));
        double violet = OpticalActivity.specificRotationAt(66.5, SpectralLine.MERCURY_VIOLET.wavelengthNm());
        assertThat(violet).isCloseTo(66.5 * (589.0 / 436.0) * (589.0 / 436.0), within(1e-9));
    }

    @Test
    void polarimeterFindsNullPointAtSampleRotation() {
        OpticalActivity.PolarimeterReading aligned =
            OpticalActivity.simulatePolarimeter(ChiralMaterial.SUCROSE, 589, 0.2, 2.0, 26.6, 1.0);
        assertThat(aligned.rotationDeg()).isCloseTo(26.6, within(1e-9));
        assertThat(aligned.transmittedIntensity()).isCloseTo(1.0, within(EPS));
        assertThat(aligned.dextrorotatory()).isTrue();
        assertThat(aligned.measuredSpecificRotation()).isCloseTo(66.5, within(1e-9));

        OpticalActivity.PolarimeterReading crossed =
            OpticalActivity.simulatePolarimeter(ChiralMaterial.SUCROSE, 589, 0.2, 2.0, 116.6, 1.0);
        assertThat(crossed.transmittedIntensity()).isCloseTo(0.0, within(EPS));
    }

    @Test
    void levorotatorySampleWrapsNullPoint() {
        OpticalActivity.PolarimeterReading reading =
            OpticalActivity.simulatePolarimeter(ChiralMaterial.FRUCTOSE, 589, 0.1, 1.0, 0.0, 1.0);
        assertThat(reading.rotationDeg()).isCloseTo(-9.2, within(1e-9));
        assertThat(reading.nullPointDeg()).isCloseTo(350.8, within(1e-9));
        assertThat(reading.dextrorotatory()).isFalse();
        assertThat(ChiralMaterial.FRUCTOSE.isDextrorotatory()).isFalse();
    }

    @Test
    void emptyCellReportsZeroSpecificRotation() {
        OpticalActivity.PolarimeterReading reading =
            OpticalActivity.simulatePolarimeter(ChiralMaterial.GLUCOSE, 589, 0.0, 1.0, 0.0, 1.0);
        assertThat(reading.measuredSpecificRotation()).isZero();
        assertThat(reading.transmittedIntensity()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void rotatoryDispersionCurveIsInclusiveAndFalling() {
        List<OpticalActivity.DispersionPoint> curve =
            OpticalActivity.rotatoryDispersionCurve(ChiralMaterial.SUCROSE, 1.0, 1.0, 400, 700, 100);
        assertThat(curve).extracting(OpticalActivity.DispersionPoint::wavelengthNm)
            .containsExactly(400.0, 500.0, 600.0, 700.0);
        for (int i = 1; i < curve.size(); i++) {
            assertThat(curve.get(i).rotationDeg()).isLessThan(curve.get(i - 1).rotationDeg());
        }
        assertThatThrownBy(() -> OpticalActivity.rotatoryDispersionCurve(ChiralMaterial.SUCROSE, 1, 1, 400, 700, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sampleCellRotatorMatchesPolarimeter() {
        OpticalRotator cell = OpticalRotator.sampleCell("cell", Vector3.ZERO, Vector3.NEG_Z,
            ChiralMaterial.SUCROSE, 589, 0.5, 1.0);
        assertThat(Math.toDegrees(cell.rotationAngle())).isCloseTo(33.25, within(1e-9));
        CoherencyMatrix rotated = OpticalActivity.applyRotation(CoherencyMatrix.HORIZONTAL, 33.25);
        assertThat(Math.toDegrees(rotated.orientationAngle())).isCloseTo(33.25, within(1e-9));
    }

    @Test
    void chiralCatalogue() {
        assertThat(ChiralMaterial.byName("SUCROSE")).contains(ChiralMaterial.SUCROSE);
        assertThat(ChiralMaterial.catalogue()).hasSize(6);
        assertThat(SpectralLine.all()).contains(SpectralLine.SODIUM_D).hasSize(5);
        assertThatThrownBy(() -> new ChiralMaterial("x", 1.0, 0.5, 0.1, ""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static DispersiveWavePlate quartzQuarterWave() {
        return DispersiveWavePlate.designQuarterWave("qwp", Vector3.ZERO, Vector3.NEG_Z,
            DIAGONAL_AXIS, BirefringentMaterial.QUARTZ, 550);
    }
}
