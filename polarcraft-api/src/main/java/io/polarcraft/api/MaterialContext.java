package io.polarcraft.api;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Optional metadata describing the material that produced a polarization state.
 * Carried through serialization unchanged. Has no effect on the physics.
 */
public final class MaterialContext {

    private final String material;
    private final double thicknessUm;
    private final double birefringence;
    private final double wavelengthNm;

    private MaterialContext(String material, double thicknessUm,
                            double birefringence, double wavelengthNm) {
        this.material = material;
        this.thicknessUm = thicknessUm;
        this.birefringence = birefringence;
        this.wavelengthNm = wavelengthNm;
    }

    public static MaterialContext named(String material) {
        Objects.requireNonNull(material, "material must not be null");
        return new MaterialContext(material, Double.NaN, Double.NaN, Double.NaN);
    }

    public static MaterialContext of(String material, double thicknessUm,
                                     double birefringence, double wavelengthNm) {
        if (thicknessUm < 0) {
            throw new IllegalArgumentException("thicknessUm must be >= 0; got " + thicknessUm);
        }
        if (wavelengthNm <= 0) {
            throw new IllegalArgumentException("wavelengthNm must be > 0; got " + wavelengthNm);
        }
        return new MaterialContext(material, thicknessUm, birefringence, wavelengthNm);
    }

    public Optional<String> material() {
        return Optional.ofNullable(material);
    }

    public OptionalDouble thicknessUm() {
        return optional(thicknessUm);
    }

    public OptionalDouble birefringence() {
        return optional(birefringence);
    }

    public OptionalDouble wavelengthNm() {
        return optional(wavelengthNm);
    }

    public MaterialContext withWavelength(double nm) {
        if (nm <= 0) {
            throw new IllegalArgumentException("wavelengthNm must be > 0; got " + nm);
        }
        return new MaterialContext(material, thicknessUm, birefringence, nm);
    }

    private static OptionalDouble optional(double value) {
        return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MaterialContext)) {
            return false;
        }
        MaterialContext other = (MaterialContext) o;
        return Objects.equals(material, other.material)
            && Double.compare(thicknessUm, other.thicknessUm) == 0
            && Double.compare(birefringence, other.birefringence) == 0
            && Double.compare(wavelengthNm, other.wavelengthNm) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(material, thicknessUm, birefringence, wavelengthNm);
    }

    @Override
    public String toString() {
        return "MaterialContext[" + material
            + ", thicknessUm=" + thicknessUm
            + ", birefringence=" + birefringence
            + ", wavelengthNm=" + wavelengthNm + "]";
    }
}
