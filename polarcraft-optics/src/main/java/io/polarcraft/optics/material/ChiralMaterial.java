package io.polarcraft.optics.material;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Optically active substance.
 *
 * @param name               display name
 * @param specificRotation   [alpha]_D at 589 nm, degrees per (dm g/mL); negative is levorotatory
 * @param minConcentration   lower end of the typical concentration range, g/mL
 * @param maxConcentration   upper end of the typical concentration range, g/mL
 * @param formula            chemical formula, empty for solids
 */
public record ChiralMaterial(String name,
                             double specificRotation,
                             double minConcentration,
                             double maxConcentration,
                             String formula) {

    public static final ChiralMaterial SUCROSE =
        new ChiralMaterial("Sucrose", 66.5, 0.0, 0.5, "C12H22O11");
    public static final ChiralMaterial GLUCOSE =
        new ChiralMaterial("D-Glucose", 52.7, 0.0, 0.4, "C6H12O6");
    public static final ChiralMaterial FRUCTOSE =
        new ChiralMaterial("D-Fructose", -92.0, 0.0, 0.3, "C6H12O6");
    public static final ChiralMaterial TARTARIC_ACID =
        new ChiralMaterial("L-Tartaric Acid", 12.0, 0.0, 0.3, "C4H6O6");
    public static final ChiralMaterial L_ALANINE =
        new ChiralMaterial("L-Alanine", 2.7, 0.0, 0.2, "C3H7NO2");
    /** Specific rotation is per millimetre of crystal; concentration is fixed at 1. */
    public static final ChiralMaterial QUARTZ =
        new ChiralMaterial("Crystalline Quartz", 21.7, 1.0, 1.0, "");

    private static final List<ChiralMaterial> CATALOGUE = List.of(
        SUCROSE, GLUCOSE, FRUCTOSE, TARTARIC_ACID, L_ALANINE, QUARTZ);

    public ChiralMaterial {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(formula, "formula must not be null");
        if (minConcentration > maxConcentration) {
            throw new IllegalArgumentException(
                "minConcentration must be <= maxConcentration; got " + minConcentration + " > " + maxConcentration);
        }
    }

    public static List<ChiralMaterial> catalogue() {
        return CATALOGUE;
    }

    public static Optional<ChiralMaterial> byName(String name) {
        return CATALOGUE.stream().filter(m -> m.name.equalsIgnoreCase(name)).findFirst();
    }

    /** Rotates the plane clockwise looking into the beam. */
    public boolean isDextrorotatory() {
        return specificRotation >= 0.0;
    }
}
