package com.panorama.gradient;

import com.panorama.imageOperator.FloatImage;

public class MaximumFilter {

    /**
     * Per-pixel maximum over the square window of half-width diameter / 2 centred on the pixel.
     * Pixels outside the image are ignored rather than padded.
     */
    public static FloatImage maximumFilter(FloatImage image, int diameter) {
        if (diameter < 1) {
            throw new IllegalArgumentException("Maximum filter diameter must be at least 1, got " + diameter);
        }
        int radius = diameter / 2;
        int width = image.getWidth();
        int height = image.getHeight();
        int channels = image.getChannels();

        // separable: a square max is a row max followed by a column max
        FloatImage rowMax = new FloatImage(width, height, channels);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < channels; c++) {
                    float m = Float.NEGATIVE_INFINITY;
                    for (int xx = Math.max(0, x - radius); xx <= Math.min(width - 1, x + radius); xx++) {
                        m = Math.max(m, image.get(xx, y, c));
                    }
                    rowMax.set(x, y, c, m);
                }
            }
        }

        FloatImage output = new FloatImage(width, height, channels);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < channels; c++) {
                    float m = Float.NEGATIVE_INFINITY;
                    for (int yy = Math.max(0, y - radius); yy <= Math.min(height - 1, y + radius); yy++) {
                        m = Math.max(m, rowMax.get(x, yy, c));
                    }
                    output.set(x, y, c, m);
                }
            }
        }
        return output;
    }
}
