package io.polarcraft.optics.material;

import java.util.List;

/**
 * Emission line commonly used as a polarimeter light source.
 */
public record SpectralLine(String id, String name, double wavelengthNm) {

    public static final SpectralLine SODIUM_D = new SpectralLine("na-d", "589 nm (D-line)", 589.0);
    public static final SpectralLine HYDROGEN_ALPHA = new SpectralLine("h-alpha", "656 nm (H-alpha)", 656.0);
    public static final SpectralLine MERCURY_GREEN = new SpectralLine("hg-green", "546 nm (Hg)", 546.0);
    public static final SpectralLine HYDROGEN_BETA = new SpectralLine("h-beta", "486 nm (H-beta)", 486.0);
    public static final SpectralLine MERCURY_VIOLET = new SpectralLine("hg-violet", "436 nm (Hg)", 436.0);

    public static List<SpectralLine> all() {
        return List.of(SODIUM_D, HYDROGEN_ALPHA, MERCURY_GREEN, HYDROGEN_BETA, MERCURY_VIOLET);
    }
}
