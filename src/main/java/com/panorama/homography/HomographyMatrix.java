package com.panorama.homography;

import java.util.Arrays;

/**
 * Immutable 3x3 projective transform acting on homogeneous column vectors (x, y, w).
 */
public final class HomographyMatrix {
    private final double[][] data;

    public HomographyMatrix(double[][] data) {
        if (data.length != 3 || data[0].length != 3 || data[1].length != 3 || data[2].length != 3) {
            throw new IllegalArgumentException("Homography must be 3x3");
        }
        this.data = new double[3][3];
        for (int r = 0; r < 3; r++) this.data[r] = Arrays.copyOf(data[r], 3);
    }

    public static HomographyMatrix identity() {
        return new HomographyMatrix(new double[][]{
                {1, 0, 0},
                {0, 1, 0},
                {0, 0, 1}
        });
    }

    public static HomographyMatrix translation(double tx, double ty) {
        return new HomographyMatrix(new double[][]{
                {1, 0, tx},
                {0, 1, ty},
                {0, 0, 1}
        });
    }

    public static HomographyMatrix zero() {
        return new HomographyMatrix(new double[3][3]);
    }

    public double get(int row, int col) {
        return data[row][col];
    }

    public double[][] getData() {
        double[][] copy = new double[3][];
        for (int r = 0; r < 3; r++) copy[r] = Arrays.copyOf(data[r], 3);
        return copy;
    }

    /** Row-major copy, the layout OpenCV expects for a 3x3 CV_64F matrix. */
    public double[] toRowMajor() {
        double[] out = new double[9];
        for (int r = 0; r < 3; r++) System.arraycopy(data[r], 0, out, r * 3, 3);
        return out;
    }

    public double determinant() {
        return data[0][0] * (data[1][1] * data[2][2] - data[1][2] * data[2][1])
                - data[0][1] * (data[1][0] * data[2][2] - data[1][2] * data[2][0])
                + data[0][2] * (data[1][0] * data[2][1] - data[1][1] * data[2][0]);
    }

    public double trace() {
        return data[0][0] + data[1][1] + data[2][2];
    }

    public boolean isFinite() {
        for (double[] row : data)
            for (double v : row)
                if (!Double.isFinite(v)) return false;
        return true;
    }

    /** Singular means exactly zero determinant or a non-finite entry. */
    public boolean isSingular() {
        return !isFinite() || determinant() == 0.0;
    }

    public HomographyMatrix multiply(HomographyMatrix other) {
        double[][] out = new double[3][3];
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++) {
                double sum = 0;
                for (int k = 0; k < 3; k++) sum += data[r][k] * other.data[k][c];
                out[r][c] = sum;
            }
        return new HomographyMatrix(out);
    }

    public double[] apply(double[] v) {
        if (v.length != 3) throw new IllegalArgumentException("Expected a homogeneous 3-vector");
        double[] out = new double[3];
        for (int r = 0; r < 3; r++) {
            out[r] = data[r][0] * v[0] + data[r][1] * v[1] + data[r][2] * v[2];
        }
        return out;
    }

    /**
     * Maps (x, y) and divides by the homogeneous coordinate.
     *
     * @return projected point, or null when it lands on the line at infinity
     */
    public double[] project(double x, double y) {
        double[] p = apply(new double[]{x, y, 1});
        if (Math.abs(p[2]) < 1e-10) return null;
        return new double[]{p[0] / p[2], p[1] / p[2]};
    }

    /**
     * Inverse through the adjugate.
     *
     * @throws ArithmeticException when the matrix is singular
     */
    public HomographyMatrix inverse() {
        double det = determinant();
        if (det == 0.0 || !Double.isFinite(det)) {
            throw new ArithmeticException("Singular homography has no inverse");
        }
        double[][] m = data;
        double[][] inv = new double[3][3];
        inv[0][0] = (m[1][1] * m[2][2] - m[1][2] * m[2][1]) / det;
        inv[0][1] = (m[0][2] * m[2][1] - m[0][1] * m[2][2]) / det;
        inv[0][2] = (m[0][1] * m[1][2] - m[0][2] * m[1][1]) / det;
        inv[1][0] = (m[1][2] * m[2][0] - m[1][0] * m[2][2]) / det;
        inv[1][1] = (m[0][0] * m[2][2] - m[0][2] * m[2][0]) / det;
        inv[1][2] = (m[0][2] * m[1][0] - m[0][0] * m[1][2]) / det;
        inv[2][0] = (m[1][0] * m[2][1] - m[1][1] * m[2][0]) / det;
        inv[2][1] = (m[0][1] * m[2][0] - m[0][0] * m[2][1]) / det;
        inv[2][2] = (m[0][0] * m[1][1] - m[0][1] * m[1][0]) / det;
        return new HomographyMatrix(inv);
    }

    /** Scales so that the bottom-right entry is 1, when it is not zero. */
    public HomographyMatrix normalized() {
        double s = data[2][2];
        if (s == 0.0) return this;
        double[][] out = new double[3][3];
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++) out[r][c] = data[r][c] / s;
        return new HomographyMatrix(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HomographyMatrix)) return false;
        return Arrays.deepEquals(data, ((HomographyMatrix) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(data);
    }

    @Override
    public String toString() {
        return String.format("[[%.6f, %.6f, %.6f], [%.6f, %.6f, %.6f], [%.6f, %.6f, %.6f]]",
                data[0][0], data[0][1], data[0][2],
                data[1][0], data[1][1], data[1][2],
                data[2][0], data[2][1], data[2][2]);
    }
}
