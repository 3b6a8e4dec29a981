package com.pharma.signal.engine.forecast;

/**
 * Ordinary least squares via the normal equations, solved with Gaussian
 * elimination and partial pivoting. Sized for the handful of columns a
 * quarterly trend model needs.
 */
final class LeastSquares {

    private static final double SINGULAR_TOLERANCE = 1e-10;

    private LeastSquares() {}

    /**
     * @param design n x m design matrix (row per observation)
     * @param y      n observations
     * @return the m coefficients, or null when the design is rank deficient
     */
    static double[] solve(double[][] design, double[] y) {
        int n = design.length;
        int m = design[0].length;

        double[][] augmented = new double[m][m + 1];
        for (int i = 0; i < n; i++) {
            double[] row = design[i];
            for (int a = 0; a < m; a++) {
                for (int b = 0; b < m; b++) {
                    augmented[a][b] += row[a] * row[b];
                }
                augmented[a][m] += row[a] * y[i];
            }
        }

        double scale = 0.0;
        for (int a = 0; a < m; a++) {
            scale = Math.max(scale, Math.abs(augmented[a][a]));
        }
        if (scale == 0.0) {
            return null;
        }

        for (int col = 0; col < m; col++) {
            int pivot = col;
            for (int row = col + 1; row < m; row++) {
                if (Math.abs(augmented[row][col]) > Math.abs(augmented[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(augmented[pivot][col]) < SINGULAR_TOLERANCE * scale) {
                return null;
            }
            double[] tmp = augmented[col];
            augmented[col] = augmented[pivot];
            augmented[pivot] = tmp;

            for (int row = col + 1; row < m; row++) {
                double factor = augmented[row][col] / augmented[col][col];
                for (int k = col; k <= m; k++) {
                    augmented[row][k] -= factor * augmented[col][k];
                }
            }
        }

        double[] beta = new double[m];
        for (int row = m - 1; row >= 0; row--) {
            double sum = augmented[row][m];
            for (int k = row + 1; k < m; k++) {
                sum -= augmented[row][k] * beta[k];
            }
            beta[row] = sum / augmented[row][row];
        }
        return beta;
    }

    static double sumOfSquaredResiduals(double[][] design, double[] y, double[] beta) {
        double sse = 0.0;
        for (int i = 0; i < y.length; i++) {
            double residual = y[i] - dot(design[i], beta);
            sse += residual * residual;
        }
        return sse;
    }

    static double dot(double[] row, double[] beta) {
        double sum = 0.0;
        for (int k = 0; k < beta.length; k++) {
            sum += row[k] * beta[k];
        }
        return sum;
    }
}
