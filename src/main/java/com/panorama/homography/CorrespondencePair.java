package com.panorama.homography;

/**
 * Two homogeneous points (x, y, 1): point1 in the source image, point2 in the destination image.
 */
public final class CorrespondencePair {
    public final double[] point1;
    public final double[] point2;

    public CorrespondencePair(double x1, double y1, double x2, double y2) {
        this.point1 = new double[]{x1, y1, 1};
        this.point2 = new double[]{x2, y2, 1};
    }

    @Override
    public String toString() {
        return String.format("(%.1f, %.1f) -> (%.1f, %.1f)", point1[0], point1[1], point2[0], point2[1]);
    }
}
