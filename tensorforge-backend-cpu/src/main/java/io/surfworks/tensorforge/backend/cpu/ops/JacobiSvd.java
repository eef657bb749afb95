package io.surfworks.tensorforge.backend.cpu.ops;

import java.util.Arrays;

/**
 * Thin singular value decomposition by one-sided Jacobi rotations.
 *
 * <p>For an {@code m x n} matrix {@code A} returns {@code U (m x k)}, {@code s (k)} and
 * {@code Vt (k x n)} with {@code k = min(m, n)}, singular values in descending order and
 * {@code A = U diag(s) Vt}.
 */
public final class JacobiSvd {

    private static final int MAX_SWEEPS = 64;
    private static final double EPSILON = 1e-15;

    private JacobiSvd() {} // Utility class

    /**
     * Factors of a decomposition.
     */
    public record Result(double[][] u, double[] s, double[][] vt) {

        public int k() {
            return s.length;
        }
    }

    public static Result decompose(double[][] a, int m, int n) {
        if (m < n) {
            // A^T = U' S V'^T, so A = V' S U'^T
            Result t = decomposeTall(transpose(a, m, n), n, m);
            return new Result(transpose(t.vt(), t.k(), m), t.s(), transpose(t.u(), n, t.k()));
        }
        return decomposeTall(a, m, n);
    }

    /**
     * Requires {@code m >= n}.
     */
    private static Result decomposeTall(double[][] a, int m, int n) {
        double[][] w = new double[m][];
        for (int i = 0; i < m; i++) {
            w[i] = a[i].clone();
        }
        double[][] v = new double[n][n];
        for (int i = 0; i < n; i++) {
            v[i][i] = 1.0;
        }

        for (int sweep = 0; sweep < MAX_SWEEPS; sweep++) {
            boolean rotated = false;
            for (int p = 0; p < n - 1; p++) {
                for (int q = p + 1; q < n; q++) {
                    double alpha = 0;
                    double beta = 0;
                    double gamma = 0;
                    for (int i = 0; i < m; i++) {
                        alpha += w[i][p] * w[i][p];
                        beta += w[i][q] * w[i][q];
                        gamma += w[i][p] * w[i][q];
                    }
                    if (gamma == 0.0 || Math.abs(gamma) <= EPSILON * Math.sqrt(alpha * beta)) {
                        continue;
                    }
                    rotated = true;
                    double zeta = (beta - alpha) / (2.0 * gamma);
                    double t = Math.signum(zeta) / (Math.abs(zeta) + Math.sqrt(1.0 + zeta * zeta));
                    if (zeta == 0.0) {
                        t = 1.0;
                    }
                    double c = 1.0 / Math.sqrt(1.0 + t * t);
                    double s = c * t;
                    rotate(w, m, p, q, c, s);
                    rotate(v, n, p, q, c, s);
                }
            }
            if (!rotated) {
                break;
            }
        }

        double[] sigma = new double[n];
        for (int j = 0; j < n; j++) {
            double norm = 0;
            for (int i = 0; i < m; i++) {
                norm += w[i][j] * w[i][j];
            }
            sigma[j] = Math.sqrt(norm);
        }

        Integer[] order = new Integer[n];
        for (int j = 0; j < n; j++) {
            order[j] = j;
        }
        Arrays.sort(order, (x, y) -> Double.compare(sigma[y], sigma[x]));

        double[][] u = new double[m][n];
        double[] s = new double[n];
        double[][] vt = new double[n][n];
        for (int r = 0; r < n; r++) {
            int j = order[r];
            s[r] = sigma[j];
            for (int i = 0; i < m; i++) {
                u[i][r] = sigma[j] > 0 ? w[i][j] / sigma[j] : 0.0;
            }
            for (int i = 0; i < n; i++) {
                vt[r][i] = v[i][j];
            }
        }
        return new Result(u, s, vt);
    }

    private static void rotate(double[][] x, int rows, int p, int q, double c, double s) {
        for (int i = 0; i < rows; i++) {
            double xp = x[i][p];
            double xq = x[i][q];
            x[i][p] = c * xp - s * xq;
            x[i][q] = s * xp + c * xq;
        }
    }

    private static double[][] transpose(double[][] x, int rows, int cols) {
        double[][] t = new double[cols][rows];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                t[j][i] = x[i][j];
            }
        }
        return t;
    }
}
