package com.panorama.homography;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Inclusive integer pixel box [x1, x2] x [y1, y2].
 */
@Getter
@AllArgsConstructor
public class BoundingBox {
    private static final double SNAP = 1e-6;

    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    public int width() {
        return x2 - x1 + 1;
    }

    public int height() {
        return y2 - y1 + 1;
    }

    /**
     * Box around the four corner pixels of a width x height image after mapping them through H.
     */
    public static BoundingBox computeTransformedBoundingBox(int width, int height, HomographyMatrix H) {
        double[][] corners = {
                {0, 0},
                {width - 1, 0},
                {0, height - 1},
                {width - 1, height - 1}
        };
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (double[] corner : corners) {
            double[] p = H.project(corner[0], corner[1]);
            if (p == null) {
                throw new IllegalArgumentException("Homography maps image corner " + corner[0] + "," + corner[1] + " to infinity");
            }
            minX = Math.min(minX, p[0]);
            minY = Math.min(minY, p[1]);
            maxX = Math.max(maxX, p[0]);
            maxY = Math.max(maxY, p[1]);
        }
        return new BoundingBox(floor(minX), floor(minY), ceil(maxX), ceil(maxY));
    }

    // absorb round-off so an exact integer shift does not grow the box by a pixel
    private static int floor(double v) {
        return (int) Math.floor(v + SNAP);
    }

    private static int ceil(double v) {
        return (int) Math.ceil(v - SNAP);
    }

    public static BoundingBox unionBoundingBox(BoundingBox a, BoundingBox b) {
        return new BoundingBox(Math.min(a.x1, b.x1), Math.min(a.y1, b.y1),
                Math.max(a.x2, b.x2), Math.max(a.y2, b.y2));
    }

    /** Translation that moves the box's top-left corner to the origin. */
    public static HomographyMatrix translationFor(BoundingBox box) {
        return HomographyMatrix.translation(-box.x1, -box.y1);
    }

    @Override
    public String toString() {
        return "BoundingBox[(" + x1 + ", " + y1 + ") - (" + x2 + ", " + y2 + ")]";
    }
}
