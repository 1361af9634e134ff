package com.panorama.gradient;

import com.panorama.imageOperator.FloatImage;

/**
 * Sobel derivatives of the first channel, borders clamped.
 * Each tap pair is differenced before weighting, so a flat neighbourhood gives exactly zero.
 */
public class ImageGradient {

    /** Kernel [[-1, 0, 1], [-2, 0, 2], [-1, 0, 1]]. */
    public static FloatImage gradientX(FloatImage image) {
        FloatImage output = new FloatImage(image.getWidth(), image.getHeight(), 1);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                float above = image.getClamped(x + 1, y - 1, 0) - image.getClamped(x - 1, y - 1, 0);
                float centre = image.getClamped(x + 1, y, 0) - image.getClamped(x - 1, y, 0);
                float below = image.getClamped(x + 1, y + 1, 0) - image.getClamped(x - 1, y + 1, 0);
                output.set(x, y, above + 2 * centre + below);
            }
        }
        return output;
    }

    /** Kernel [[-1, -2, -1], [0, 0, 0], [1, 2, 1]]. */
    public static FloatImage gradientY(FloatImage image) {
        FloatImage output = new FloatImage(image.getWidth(), image.getHeight(), 1);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                float left = image.getClamped(x - 1, y + 1, 0) - image.getClamped(x - 1, y - 1, 0);
                float centre = image.getClamped(x, y + 1, 0) - image.getClamped(x, y - 1, 0);
                float right = image.getClamped(x + 1, y + 1, 0) - image.getClamped(x + 1, y - 1, 0);
                output.set(x, y, left + 2 * centre + right);
            }
        }
        return output;
    }
}
