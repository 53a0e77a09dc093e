package io.polarcraft.optics.fresnel;

import io.polarcraft.math.Complex;

/**
 * Single dielectric layer between an ambient medium and a substrate.
 *
 * Multiple-beam interference is summed in closed form (Airy):
 *   r = (r12 + r23 e^(-2i delta)) / (1 + r12 r23 e^(-2i delta))
 *   t = t12 t23 e^(-i delta)     / (1 + r12 r23 e^(-2i delta))
 * with delta = (2 pi / lambda) n_film d cos(theta_film).
 *
 * Both interfaces are evaluated with FresnelSolver, so total internal
 * reflection at the film/substrate boundary keeps its complex phase.
 * Wavelength and thickness share a unit (nanometres by convention).
 */
public final class ThinFilmSolver {

    private ThinFilmSolver() {}

    /**
     * @param nAmbient    index of the incident medium
     * @param nFilm       index of the layer
     * @param nSubstrate  index of the substrate
     * @param thicknessNm layer thickness
     * @param wavelengthNm vacuum wavelength
     * @param thetaI      angle of incidence in the ambient medium, radians
     */
    public static ThinFilmResult solve(double nAmbient, double nFilm, double nSubstrate,
                                       double thicknessNm, double wavelengthNm, double thetaI) {
        if (thicknessNm < 0.0) {
            throw new IllegalArgumentException("thicknessNm must be >= 0; got " + thicknessNm);
        }
        if (!(wavelengthNm > 0.0)) {
            throw new IllegalArgumentException("wavelengthNm must be > 0; got " + wavelengthNm);
        }
        FresnelCoefficients top = FresnelSolver.solve(nAmbient, nFilm, thetaI);
        if (top.totalInternalReflection()) {
            // no field enters the film
            return new ThinFilmResult(top.rs(), top.rp(), Complex.ZERO, Complex.ZERO, 0.0, 0.0, true);
        }

        double thetaFilm = top.thetaT();
        FresnelCoefficients bottom = FresnelSolver.solve(nFilm, nSubstrate, thetaFilm);
        double delta = phaseThickness(nFilm, thicknessNm, wavelengthNm, thetaFilm);

        Complex roundTrip = Complex.expI(-2.0 * delta);
        Complex singlePass = Complex.expI(-delta);

        Complex rs = airyReflection(top.rs(), bottom.rs(), roundTrip);
        Complex rp = airyReflection(top.rp(), bottom.rp(), roundTrip);

        if (bottom.totalInternalReflection()) {
            return new ThinFilmResult(rs, rp, Complex.ZERO, Complex.ZERO, 0.0, delta, true);
        }

        Complex ts = airyTransmission(top.ts(), bottom.ts(), top.rs(), bottom.rs(), singlePass, roundTrip);
        Complex tp = airyTransmission(top.tp(), bottom.tp(), top.rp(), bottom.rp(), singlePass, roundTrip);

        double cosI = Math.cos(Math.max(0.0, Math.min(Math.PI / 2.0, thetaI)));
        double beamRatio = nAmbient * cosI < 1e-10
            ? 0.0
            : nSubstrate * Math.cos(bottom.thetaT()) / (nAmbient * cosI);
        return new ThinFilmResult(rs, rp, ts, tp, beamRatio, delta, false);
    }

    private static Complex airyReflection(Complex r12, Complex r23, Complex roundTrip) {
        Complex delayed = r23.mul(roundTrip);
        return r12.add(delayed).div(Complex.ONE.add(r12.mul(delayed)));
    }

    private static Complex airyTransmission(Complex t12, Complex t23, Complex r12, Complex r23,
                                            Complex singlePass, Complex roundTrip) {
        Complex numerator = t12.mul(t23).mul(singlePass);
        return numerator.div(Complex.ONE.add(r12.mul(r23).mul(roundTrip)));
    }

    /** delta = (2 pi / lambda) n d cos(theta). */
    public static double phaseThickness(double nFilm, double thickness, double wavelength, double angleInFilm) {
        return 2.0 * Math.PI / wavelength * nFilm * thickness * Math.cos(angleInFilm);
    }

    /** Physical thickness of a lambda/4 layer at normal incidence: lambda / (4 n). */
    public static double quarterWaveThickness(double wavelength, double nFilm) {
        return wavelength / (4.0 * nFilm);
    }

    /**
     * Ideal single-layer anti-reflection coating: n_film = sqrt(n1 n3),
     * quarter-wave thick at the design wavelength.
     */
    public static ArCoating idealArCoating(double wavelength, double nAmbient, double nSubstrate) {
        double nFilm = Math.sqrt(nAmbient * nSubstrate);
        return new ArCoating(nFilm, quarterWaveThickness(wavelength, nFilm));
    }

    public record ArCoating(double filmIndex, double thickness) {}
}
