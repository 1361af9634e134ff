package com.panorama.imageOperator;

import lombok.AllArgsConstructor;
import lombok.Getter;

public class ColourImageToGray {
    public static final double RED_WEIGHT = 0.299;
    public static final double GREEN_WEIGHT = 0.587;
    public static final double BLUE_WEIGHT = 0.114;

    /** Luminance plus the colour ratios that restore the original when multiplied back. */
    @Getter
    @AllArgsConstructor
    public static class LumiChromi {
        private final FloatImage luminance;
        private final FloatImage chrominance;
    }

    /**
     * Luminance as the weighted sum of the RGB channels. A single channel image is its own luminance.
     */
    public static FloatImage luminance(FloatImage image) {
        if (image.getChannels() == 1) return image.copy();
        if (image.getChannels() < 3) {
            throw new IllegalArgumentException("Expected 1 or at least 3 channels, got " + image.getChannels());
        }

        FloatImage lumi = new FloatImage(image.getWidth(), image.getHeight(), 1);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                double value = RED_WEIGHT * image.get(x, y, 0)
                        + GREEN_WEIGHT * image.get(x, y, 1)
                        + BLUE_WEIGHT * image.get(x, y, 2);
                lumi.set(x, y, (float) value);
            }
        }
        return lumi;
    }

    public static LumiChromi lumiChromi(FloatImage image) {
        FloatImage lumi = luminance(image);
        FloatImage chromi = new FloatImage(image.getWidth(), image.getHeight(), image.getChannels());
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                float l = lumi.get(x, y);
                for (int c = 0; c < image.getChannels(); c++) {
                    // black pixels carry no colour information
                    chromi.set(x, y, c, l > 0 ? image.get(x, y, c) / l : 0f);
                }
            }
        }
        return new LumiChromi(lumi, chromi);
    }
}
