package com.panorama.homography;

/**
 * Closed-form homography from exactly four point pairs, fixing h33 = 1 and solving the 8x8 linear system.
 */
public class HomographyDLT {
    private static final double RELATIVE_PIVOT_TOLERANCE = 1e-10;

    /**
     * @param pairs four correspondences, point1 in the source frame and point2 in the destination frame
     * @return the homography, or {@link HomographyMatrix#zero()} when the configuration is degenerate
     */
    public static HomographyMatrix computeHomography(CorrespondencePair[] pairs) {
        if (pairs.length != 4) {
            throw new IllegalArgumentException("A homography needs exactly 4 pairs, got " + pairs.length);
        }
        double[][] A = new double[8][8];
        double[] b = new double[8];

        for (int i = 0; i < 4; i++) {
            double x = pairs[i].point1[0];
            double y = pairs[i].point1[1];
            double u = pairs[i].point2[0];
            double v = pairs[i].point2[1];

            A[2 * i][0] = x;
            A[2 * i][1] = y;
            A[2 * i][2] = 1;
            A[2 * i][6] = -x * u;
            A[2 * i][7] = -y * u;
            b[2 * i] = u;

            A[2 * i + 1][3] = x;
            A[2 * i + 1][4] = y;
            A[2 * i + 1][5] = 1;
            A[2 * i + 1][6] = -x * v;
            A[2 * i + 1][7] = -y * v;
            b[2 * i + 1] = v;
        }

        double[] h = lsolve(A, b);
        if (h == null) return HomographyMatrix.zero();

        return new HomographyMatrix(new double[][]{
                {h[0], h[1], h[2]},
                {h[3], h[4], h[5]},
                {h[6], h[7], 1.0}
        });
    }

    /**
     * Gaussian elimination with partial pivoting. Works on copies of its arguments.
     *
     * @return the solution, or null if a pivot vanishes relative to the largest coefficient
     */
    static double[] lsolve(double[][] A, double[] b) {
        int n = b.length;
        double[][] a = new double[n][];
        for (int i = 0; i < n; i++) a[i] = A[i].clone();
        double[] rhs = b.clone();

        double scale = 0;
        for (double[] row : a)
            for (double v : row) scale = Math.max(scale, Math.abs(v));
        if (scale == 0) return null;
        double tolerance = RELATIVE_PIVOT_TOLERANCE * scale;

        for (int p = 0; p < n; p++) {
            int max = p;
            for (int i = p + 1; i < n; i++) {
                if (Math.abs(a[i][p]) > Math.abs(a[max][p])) max = i;
            }
            double[] tmpRow = a[p]; a[p] = a[max]; a[max] = tmpRow;
            double tmp = rhs[p]; rhs[p] = rhs[max]; rhs[max] = tmp;

            if (Math.abs(a[p][p]) <= tolerance) return null;

            for (int i = p + 1; i < n; i++) {
                double alpha = a[i][p] / a[p][p];
                rhs[i] -= alpha * rhs[p];
                for (int j = p; j < n; j++) a[i][j] -= alpha * a[p][j];
            }
        }

        double[] x = new double[n];
        for (int i = n - 1; i >= 0; i--) {
            double sum = 0;
            for (int j = i + 1; j < n; j++) sum += a[i][j] * x[j];
            x[i] = (rhs[i] - sum) / a[i][i];
        }
        return x;
    }
}
