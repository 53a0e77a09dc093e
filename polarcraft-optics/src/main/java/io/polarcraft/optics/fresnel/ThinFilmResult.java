package io.polarcraft.optics.fresnel;

import io.polarcraft.core.MuellerMatrix;
import io.polarcraft.math.Complex;
import io.polarcraft.math.Matrix2x2;

/**
 * Reflection and transmission of an ambient / film / substrate stack.
 *
 * @param rs              s amplitude reflection coefficient of the whole stack
 * @param rp              p amplitude reflection coefficient of the whole stack
 * @param ts              s amplitude transmission coefficient into the substrate
 * @param tp              p amplitude transmission coefficient into the substrate
 * @param beamRatio       n3 cos(theta3) / (n1 cos(theta1)); 0 when nothing is transmitted
 * @param phaseThickness  single-pass phase delta in the film, radians
 * @param totalReflection true when the stack transmits nothing
 */
public record ThinFilmResult(Complex rs,
                             Complex rp,
                             Complex ts,
                             Complex tp,
                             double beamRatio,
                             double phaseThickness,
                             boolean totalReflection) {

    public double reflectanceS() {
        return rs.magnitudeSquared();
    }

    public double reflectanceP() {
        return rp.magnitudeSquared();
    }

    public double transmittanceS() {
        return beamRatio * ts.magnitudeSquared();
    }

    public double transmittanceP() {
        return beamRatio * tp.magnitudeSquared();
    }

    public double averageReflectance() {
        return (reflectanceS() + reflectanceP()) / 2.0;
    }

    public double averageTransmittance() {
        return (transmittanceS() + transmittanceP()) / 2.0;
    }

    /** Jones operator of the reflected beam in the interface s-p frame. */
    public Matrix2x2 reflectionJones() {
        return Matrix2x2.diagonal(rs, rp);
    }

    /** Jones operator of the transmitted beam, amplitude-scaled so |t|^2 is power. */
    public Matrix2x2 transmissionJones() {
        return Matrix2x2.diagonal(ts, tp).scale(Math.sqrt(Math.max(0.0, beamRatio)));
    }

    public MuellerMatrix reflectionMueller() {
        return MuellerMatrix.fromJones(reflectionJones());
    }

    public MuellerMatrix transmissionMueller() {
        return MuellerMatrix.fromJones(transmissionJones());
    }
}
