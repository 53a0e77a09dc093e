package io.polarcraft.core;

import io.polarcraft.api.StokesVector;
import io.polarcraft.math.Complex;
import io.polarcraft.math.JonesMatrices;
import io.polarcraft.math.Matrix2x2;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable 4x4 real Mueller matrix acting on Stokes vectors.
 *
 * Used as an independent cross-check of the coherency engine: a Jones operator M
 * applied to J must give the same Stokes vector as fromJones(M) applied to
 * J's Stokes vector. Angles are in radians.
 *
 * LAYOUT:
 *   Row-major, element (i, j) at index 4i + j.
 */
public final class MuellerMatrix {

    private static final int SIZE = 4;

    /**
     * Stokes basis matrices: S_i = trace(SIGMA[i] J).
     * SIGMA[3] is minus the usual Pauli sigma-y because S3 = 2 Im(J01).
     */
    private static final Matrix2x2[] SIGMA = {
        Matrix2x2.IDENTITY,
        Matrix2x2.fromReal(1, 0, 0, -1),
        Matrix2x2.fromReal(0, 1, 1, 0),
        new Matrix2x2(Complex.ZERO, Complex.I, Complex.I.negate(), Complex.ZERO)
    };

    public static final MuellerMatrix IDENTITY = new MuellerMatrix(new double[] {
        1, 0, 0, 0,
        0, 1, 0, 0,
        0, 0, 1, 0,
        0, 0, 0, 1
    });

    private final double[] elements;

    private MuellerMatrix(double[] elements) {
        this.elements = elements;
    }

    /** @param rowMajor 16 elements; copied */
    public static MuellerMatrix of(double... rowMajor) {
        if (rowMajor == null || rowMajor.length != SIZE * SIZE) {
            throw new IllegalArgumentException("Mueller matrix requires exactly 16 elements");
        }
        return new MuellerMatrix(rowMajor.clone());
    }

    public double get(int row, int col) {
        if (row < 0 || row >= SIZE || col < 0 || col >= SIZE) {
            throw new IndexOutOfBoundsException("row/col must be in [0, 3]; got " + row + "," + col);
        }
        return elements[row * SIZE + col];
    }

    // -- Algebra --------------------------------------------------------------

    /** this x other: other is applied first. */
    public MuellerMatrix mul(MuellerMatrix other) {
        double[] result = new double[SIZE * SIZE];
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                double sum = 0.0;
                for (int k = 0; k < SIZE; k++) {
                    sum += elements[i * SIZE + k] * other.elements[k * SIZE + j];
                }
                result[i * SIZE + j] = sum;
            }
        }
        return new MuellerMatrix(result);
    }

    public StokesVector apply(StokesVector stokes) {
        double[] in = stokes.toArray();
        double[] out = new double[SIZE];
        for (int i = 0; i < SIZE; i++) {
            double sum = 0.0;
            for (int j = 0; j < SIZE; j++) {
                sum += elements[i * SIZE + j] * in[j];
            }
            out[i] = sum;
        }
        return StokesVector.of(out);
    }

    public MuellerMatrix scale(double factor) {
        double[] result = new double[SIZE * SIZE];
        for (int i = 0; i < result.length; i++) {
            result[i] = elements[i] * factor;
        }
        return new MuellerMatrix(result);
    }

    public MuellerMatrix add(MuellerMatrix other) {
        double[] result = new double[SIZE * SIZE];
        for (int i = 0; i < result.length; i++) {
            result[i] = elements[i] + other.elements[i];
        }
        return new MuellerMatrix(result);
    }

    public MuellerMatrix transpose() {
        double[] result = new double[SIZE * SIZE];
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                result[j * SIZE + i] = elements[i * SIZE + j];
            }
        }
        return new MuellerMatrix(result);
    }

    // -- Properties -----------------------------------------------------------

    /**
     * Necessary conditions only: m00 >= 0 and every |mij| <= m00.
     * Does not check positivity of the associated coherency matrix.
     */
    public boolean isPhysical(double tolerance) {
        double m00 = elements[0];
        if (m00 < -tolerance) {
            return false;
        }
        for (double e : elements) {
            if (Math.abs(e) > m00 + tolerance) {
                return false;
            }
        }
        return true;
    }

    /**
     * DI = sqrt(sum mij^2 - m00^2) / (sqrt(3) m00).
     * 0 for a total depolarizer, 1 for any Jones-representable element.
     */
    public double depolarizationIndex() {
        double m00 = elements[0];
        if (m00 < Complex.ZERO_TOLERANCE) {
            return 0.0;
        }
        double sumSq = 0.0;
        for (double e : elements) {
            sumSq += e * e;
        }
        return Math.sqrt(Math.max(0.0, sumSq - m00 * m00)) / (Math.sqrt(3.0) * m00);
    }

    public boolean isNonDepolarizing(double tolerance) {
        return Math.abs(depolarizationIndex() - 1.0) < tolerance;
    }

    public boolean approxEquals(MuellerMatrix other, double tolerance) {
        for (int i = 0; i < elements.length; i++) {
            if (Math.abs(elements[i] - other.elements[i]) >= tolerance) {
                return false;
            }
        }
        return true;
    }

    // -- Factories ------------------------------------------------------------

    /**
     * Mueller equivalent of a Jones operator: M_ij = (1/2) trace(sigma_i J sigma_j J-dagger).
     * Global phase of the Jones operator drops out.
     */
    public static MuellerMatrix fromJones(Matrix2x2 jones) {
        Objects.requireNonNull(jones, "jones must not be null");
        Matrix2x2 adjoint = jones.adjoint();
        double[] result = new double[SIZE * SIZE];
        for (int i = 0; i < SIZE; i++) {
            for (int j = 0; j < SIZE; j++) {
                Complex trace = SIGMA[i].mul(jones).mul(SIGMA[j]).mul(adjoint).trace();
                result[i * SIZE + j] = 0.5 * trace.real;
            }
        }
        return new MuellerMatrix(result);
    }

    public static MuellerMatrix linearPolarizer(double angle) {
        return fromJones(JonesMatrices.linearPolarizer(angle));
    }

    public static MuellerMatrix wavePlate(double retardance, double fastAxis) {
        return fromJones(JonesMatrices.wavePlate(fastAxis, retardance));
    }

    public static MuellerMatrix quarterWavePlate(double fastAxis) {
        return wavePlate(Math.PI / 2.0, fastAxis);
    }

    public static MuellerMatrix halfWavePlate(double fastAxis) {
        return wavePlate(Math.PI, fastAxis);
    }

    public static MuellerMatrix rotator(double angle) {
        return fromJones(JonesMatrices.rotator(angle));
    }

    /** Output is unpolarized with S0 scaled by transmission. */
    public static MuellerMatrix depolarizer(double transmission) {
        double[] result = new double[SIZE * SIZE];
        result[0] = transmission;
        return new MuellerMatrix(result);
    }

    /** diag(1, d, d, d) with d = 1 - factor. */
    public static MuellerMatrix partialDepolarizer(double factor) {
        double d = 1.0 - Math.max(0.0, Math.min(1.0, factor));
        return of(
            1, 0, 0, 0,
            0, d, 0, 0,
            0, 0, d, 0,
            0, 0, 0, d);
    }

    /**
     * Normal-incidence mirror measured in a frame that keeps s and reverses p,
     * equivalent to the Jones operator diag(1, -1). Flips S2 and S3.
     */
    public static MuellerMatrix mirror() {
        return of(
            1, 0, 0, 0,
            0, 1, 0, 0,
            0, 0, -1, 0,
            0, 0, 0, -1);
    }

    public static MuellerMatrix attenuator(double transmission) {
        return IDENTITY.scale(transmission);
    }

    /**
     * Combined matrix of a train of elements listed in the order light meets them:
     * M_total = M_n ... M_2 M_1.
     */
    public static MuellerMatrix chain(List<MuellerMatrix> elementsInOrder) {
        MuellerMatrix result = IDENTITY;
        for (MuellerMatrix m : elementsInOrder) {
            result = m.mul(result);
        }
        return result;
    }

    public static StokesVector applyChain(StokesVector stokes, List<MuellerMatrix> elementsInOrder) {
        return chain(elementsInOrder).apply(stokes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MuellerMatrix)) {
            return false;
        }
        return Arrays.equals(elements, ((MuellerMatrix) o).elements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(elements);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Mueller[");
        for (int i = 0; i < SIZE; i++) {
            sb.append(i == 0 ? "[" : ", [");
            for (int j = 0; j < SIZE; j++) {
                if (j > 0) {
                    sb.append(", ");
                }
                sb.append(String.format("%.4f", elements[i * SIZE + j]));
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }
}
