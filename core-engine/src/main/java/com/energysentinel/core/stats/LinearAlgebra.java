package com.energysentinel.core.stats;

/**
 * Least-squares solvers used by the forecasters.
 *
 * <p>
 * Problems here are small (tens of coefficients, a few thousand rows), so the
 * normal equations are formed explicitly and solved by Gaussian elimination
 * with partial pivoting.
 * </p>
 *
 * @since 1.0.0
 */
public final class LinearAlgebra {

    private static final double SINGULAR_TOLERANCE = 1e-12;

    private LinearAlgebra() {
        // utility class, not instantiable
    }

    /**
     * Ordinary least squares, {@code argmin ||y - X b||²}.
     *
     * @throws ArithmeticException if the design matrix is rank deficient
     */
    public static double[] leastSquares(double[][] design, double[] target) {
        return ridge(design, target, new double[design.length == 0 ? 0 : design[0].length]);
    }

    /**
     * Ridge regression with a separate penalty per coefficient,
     * {@code argmin ||y - X b||² + Σ penalty_j b_j²}.
     *
     * @param design    n × p design matrix
     * @param target    n targets
     * @param penalties p non-negative penalties
     * @return the p coefficients
     * @throws IllegalArgumentException if the dimensions do not match
     * @throws ArithmeticException      if the system is singular
     */
    public static double[] ridge(double[][] design, double[] target, double[] penalties) {
        int n = design.length;
        if (n != target.length) {
            throw new IllegalArgumentException("design has " + n + " rows but target has " + target.length);
        }
        int p = penalties.length;
        double[][] gram = new double[p][p];
        double[] moment = new double[p];
        for (int r = 0; r < n; r++) {
            double[] row = design[r];
            if (row.length != p) {
                throw new IllegalArgumentException("row " + r + " has " + row.length + " columns, expected " + p);
            }
            for (int i = 0; i < p; i++) {
                double xi = row[i];
                if (xi == 0) {
                    continue;
                }
                moment[i] += xi * target[r];
                for (int j = i; j < p; j++) {
                    gram[i][j] += xi * row[j];
                }
            }
        }
        for (int i = 0; i < p; i++) {
            for (int j = 0; j < i; j++) {
                gram[i][j] = gram[j][i];
            }
            gram[i][i] += penalties[i];
        }
        return solve(gram, moment);
    }

    /**
     * Solve {@code A x = b} in place on copies of the inputs.
     *
     * @throws ArithmeticException if {@code A} is singular
     */
    public static double[] solve(double[][] a, double[] b) {
        int n = b.length;
        double[][] m = new double[n][];
        for (int i = 0; i < n; i++) {
            m[i] = a[i].clone();
        }
        double[] x = b.clone();

        for (int col = 0; col < n; col++) {
            int pivot = col;
            double best = Math.abs(m[col][col]);
            for (int r = col + 1; r < n; r++) {
                double candidate = Math.abs(m[r][col]);
                if (candidate > best) {
                    best = candidate;
                    pivot = r;
                }
            }
            if (best < SINGULAR_TOLERANCE || Double.isNaN(best)) {
                throw new ArithmeticException("Singular system at column " + col);
            }
            if (pivot != col) {
                double[] tmpRow = m[pivot];
                m[pivot] = m[col];
                m[col] = tmpRow;
                double tmp = x[pivot];
                x[pivot] = x[col];
                x[col] = tmp;
            }
            for (int r = col + 1; r < n; r++) {
                double factor = m[r][col] / m[col][col];
                if (factor == 0) {
                    continue;
                }
                for (int c = col; c < n; c++) {
                    m[r][c] -= factor * m[col][c];
                }
                x[r] -= factor * x[col];
            }
        }
        for (int row = n - 1; row >= 0; row--) {
            double sum = x[row];
            for (int c = row + 1; c < n; c++) {
                sum -= m[row][c] * x[c];
            }
            x[row] = sum / m[row][row];
        }
        return x;
    }
}
