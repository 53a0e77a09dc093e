package io.polarcraft.optics.material;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Birefringent crystal or film used to build retarders.
 *
 * Birefringence is either constant or follows a two-term Cauchy model
 * delta-n(lambda) = A + B / lambda^2 with lambda in nanometres.
 */
public final class BirefringentMaterial {

    public static final BirefringentMaterial QUARTZ =
        dispersive("Crystalline Quartz", 0.009, 589.0, 0.00875, 450.0);
    public static final BirefringentMaterial CALCITE =
        dispersive("Calcite (Iceland Spar)", 0.172, 589.0, 0.170, 660.0);
    public static final BirefringentMaterial MICA =
        constant("Muscovite Mica", 0.036, 589.0);
    public static final BirefringentMaterial MAGNESIUM_FLUORIDE =
        constant("Magnesium Fluoride", 0.012, 589.0);
    public static final BirefringentMaterial SCOTCH_TAPE =
        constant("Scotch Tape (Cellulose Acetate)", 0.009, 550.0);
    public static final BirefringentMaterial POLYETHYLENE =
        constant("Stretched Polyethylene", 0.003, 550.0);

    private static final List<BirefringentMaterial> CATALOGUE = List.of(
        QUARTZ, CALCITE, MICA, MAGNESIUM_FLUORIDE, SCOTCH_TAPE, POLYETHYLENE);

    /** |delta-n| below which no finite plate reaches a target retardance. */
    private static final double MIN_BIREFRINGENCE = 1e-12;

    private final String name;
    private final double birefringence;
    private final double referenceWavelengthNm;
    private final boolean hasDispersion;
    private final double cauchyA;
    private final double cauchyBNm2;

    private BirefringentMaterial(String name, double birefringence, double referenceWavelengthNm,
                                 boolean hasDispersion, double cauchyA, double cauchyBNm2) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (!(referenceWavelengthNm > 0.0)) {
            throw new IllegalArgumentException(
                "referenceWavelengthNm must be > 0; got " + referenceWavelengthNm);
        }
        this.birefringence = birefringence;
        this.referenceWavelengthNm = referenceWavelengthNm;
        this.hasDispersion = hasDispersion;
        this.cauchyA = cauchyA;
        this.cauchyBNm2 = cauchyBNm2;
    }

    public static BirefringentMaterial constant(String name, double birefringence,
                                                double referenceWavelengthNm) {
        return new BirefringentMaterial(name, birefringence, referenceWavelengthNm, false, 0.0, 0.0);
    }

    public static BirefringentMaterial dispersive(String name, double birefringence,
                                                  double referenceWavelengthNm,
                                                  double cauchyA, double cauchyBNm2) {
        return new BirefringentMaterial(name, birefringence, referenceWavelengthNm, true, cauchyA, cauchyBNm2);
    }

    public static List<BirefringentMaterial> catalogue() {
        return CATALOGUE;
    }

    public static Optional<BirefringentMaterial> byName(String name) {
        return CATALOGUE.stream().filter(m -> m.name.equalsIgnoreCase(name)).findFirst();
    }

    public String name() {
        return name;
    }

    /** Tabulated birefringence at the reference wavelength. */
    public double birefringence() {
        return birefringence;
    }

    public double referenceWavelengthNm() {
        return referenceWavelengthNm;
    }

    public boolean hasDispersion() {
        return hasDispersion;
    }

    /** delta-n at the given wavelength; constant materials ignore the wavelength. */
    public double birefringenceAt(double wavelengthNm) {
        if (!(wavelengthNm > 0.0)) {
            throw new IllegalArgumentException("wavelengthNm must be > 0; got " + wavelengthNm);
        }
        if (hasDispersion) {
            return cauchyA + cauchyBNm2 / (wavelengthNm * wavelengthNm);
        }
        return birefringence;
    }

    /**
     * delta = 2 pi d delta-n(lambda) / lambda, radians.
     *
     * @param thicknessUm plate thickness in micrometres
     */
    public double phaseRetardation(double thicknessUm, double wavelengthNm) {
        double thicknessNm = thicknessUm * 1000.0;
        return 2.0 * Math.PI * thicknessNm * birefringenceAt(wavelengthNm) / wavelengthNm;
    }

    /**
     * Plate thickness in micrometres giving the target retardance at the wavelength.
     * Infinite when the material is effectively isotropic.
     */
    public double requiredThickness(double targetRetardance, double wavelengthNm) {
        double deltaN = birefringenceAt(wavelengthNm);
        if (Math.abs(deltaN) < MIN_BIREFRINGENCE) {
            return Double.POSITIVE_INFINITY;
        }
        double thicknessNm = targetRetardance * wavelengthNm / (2.0 * Math.PI * deltaN);
        return thicknessNm / 1000.0;
    }

    @Override
    public String toString() {
        return "BirefringentMaterial[" + name + ", dn=" + birefringence + " @ " + referenceWavelengthNm + "nm]";
    }
}
