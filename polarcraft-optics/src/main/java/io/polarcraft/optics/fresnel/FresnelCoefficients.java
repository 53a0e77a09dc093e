package io.polarcraft.optics.fresnel;

import io.polarcraft.math.Complex;

/**
 * Fresnel coefficients for one dielectric interface at one angle of incidence.
 *
 * @param rs             s amplitude reflection coefficient
 * @param rp             p amplitude reflection coefficient
 * @param ts             s amplitude transmission coefficient
 * @param tp             p amplitude transmission coefficient
 * @param reflectanceS   |rs|^2
 * @param reflectanceP   |rp|^2
 * @param transmittanceS beamRatio |ts|^2
 * @param transmittanceP beamRatio |tp|^2
 * @param thetaT         transmission angle in radians; NaN under total internal reflection
 * @param beamRatio      n2 cos(thetaT) / (n1 cos(thetaI)); 0 under total internal reflection
 * @param totalInternalReflection true when no transmitted wave exists
 */
public record FresnelCoefficients(Complex rs,
                                  Complex rp,
                                  Complex ts,
                                  Complex tp,
                                  double reflectanceS,
                                  double reflectanceP,
                                  double transmittanceS,
                                  double transmittanceP,
                                  double thetaT,
                                  double beamRatio,
                                  boolean totalInternalReflection) {

    /** Reflectance seen by unpolarized light. */
    public double averageReflectance() {
        return (reflectanceS + reflectanceP) / 2.0;
    }

    /** Transmittance seen by unpolarized light. */
    public double averageTransmittance() {
        return (transmittanceS + transmittanceP) / 2.0;
    }

    /**
     * Factor that turns an amplitude transmission coefficient into one whose
     * squared magnitude is a power transmittance: sqrt(beamRatio).
     */
    public double transmittedAmplitudeScale() {
        return Math.sqrt(Math.max(0.0, beamRatio));
    }
}
