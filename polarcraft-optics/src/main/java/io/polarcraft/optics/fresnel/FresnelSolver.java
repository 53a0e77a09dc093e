package io.polarcraft.optics.fresnel;

import io.polarcraft.api.PhysicsConstants;
import io.polarcraft.math.Complex;

/**
 * Closed-form Fresnel equations for a planar interface between two dielectrics.
 *
 * Beyond the critical angle cos(thetaT) is purely imaginary; the reflection
 * coefficients are evaluated with that imaginary cosine so their phase stays
 * correct for phase-sensitive composition, while |r| = 1 and t = 0.
 */
public final class FresnelSolver {

    private FresnelSolver() {}

    /**
     * @param n1     incident medium index
     * @param n2     transmitted medium index
     * @param thetaI angle of incidence in radians, clamped into [0, pi/2]
     */
    public static FresnelCoefficients solve(double n1, double n2, double thetaI) {
        if (!(n1 > 0.0) || !(n2 > 0.0)) {
            throw new IllegalArgumentException(
                "refractive indices must be positive; got n1=" + n1 + ", n2=" + n2);
        }
        double theta = Math.max(0.0, Math.min(Math.PI / 2.0, thetaI));
        double cosI = Math.cos(theta);
        double sinT = (n1 / n2) * Math.sin(theta);
        double sinT2 = sinT * sinT;
        if (sinT2 > 1.0) {
            return totalInternalReflection(n1, n2, cosI, sinT2);
        }
        double cosT = Math.sqrt(1.0 - sinT2);
        return ordinaryTransmission(n1, n2, cosI, cosT, Math.asin(sinT));
    }

    private static FresnelCoefficients totalInternalReflection(double n1, double n2,
                                                               double cosI, double sinT2) {
        // cos(thetaT) = i kappa
        double kappa = Math.sqrt(sinT2 - 1.0);
        Complex rs = new Complex(n1 * cosI, -n2 * kappa).div(new Complex(n1 * cosI, n2 * kappa));
        Complex rp = new Complex(n2 * cosI, -n1 * kappa).div(new Complex(n2 * cosI, n1 * kappa));
        return new FresnelCoefficients(
            rs, rp, Complex.ZERO, Complex.ZERO,
            1.0, 1.0, 0.0, 0.0,
            Double.NaN, 0.0, true);
    }

    private static FresnelCoefficients ordinaryTransmission(double n1, double n2,
                                                            double cosI, double cosT, double thetaT) {
        double n1CosI = n1 * cosI;
        double n1CosT = n1 * cosT;
        double n2CosI = n2 * cosI;
        double n2CosT = n2 * cosT;

        double sDenom = n1CosI + n2CosT;
        boolean sDegenerate = Math.abs(sDenom) < PhysicsConstants.ANGLE_EPSILON;
        double rs = sDegenerate ? 0.0 : (n1CosI - n2CosT) / sDenom;
        double ts = sDegenerate ? 1.0 : 2.0 * n1CosI / sDenom;

        double pDenom = n2CosI + n1CosT;
        boolean pDegenerate = Math.abs(pDenom) < PhysicsConstants.ANGLE_EPSILON;
        double rp = pDegenerate ? 0.0 : (n2CosI - n1CosT) / pDenom;
        double tp = pDegenerate ? 1.0 : 2.0 * n1CosI / pDenom;

        // grazing incidence carries no power across the interface
        double beamRatio = n1CosI < PhysicsConstants.ANGLE_EPSILON ? 0.0 : n2CosT / n1CosI;

        return new FresnelCoefficients(
            Complex.real(rs), Complex.real(rp), Complex.real(ts), Complex.real(tp),
            rs * rs, rp * rp,
            beamRatio * ts * ts, beamRatio * tp * tp,
            thetaT, beamRatio, false);
    }

    /** tan(thetaB) = n2/n1; p reflectance vanishes at this angle. */
    public static double brewsterAngle(double n1, double n2) {
        return Math.atan(n2 / n1);
    }

    /** asin(n2/n1), or NaN when n1 <= n2 and total internal reflection cannot occur. */
    public static double criticalAngle(double n1, double n2) {
        if (n1 <= n2) {
            return Double.NaN;
        }
        return Math.asin(n2 / n1);
    }
}
