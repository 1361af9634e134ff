package com.panorama.filter_convolution_gauss;

import com.panorama.imageOperator.FloatImage;

public class SeparabilityGauss {
    /** Kernel half-width in units of sigma. */
    public static final double TRUNCATE = 3.0;

    /**
     * Normalized 1D Gaussian kernel of radius ceil(3 * sigma).
     */
    public static float[] create1DGaussianKernel(double sigma) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("Gaussian sigma must be positive, got " + sigma);
        }
        int radius = (int) Math.ceil(TRUNCATE * sigma);
        int size = 2 * radius + 1;
        float[] kernel = new float[size];
        double sum = 0;
        for (int i = 0; i < size; i++) {
            int d = i - radius;
            double value = Math.exp(-(d * d) / (2 * sigma * sigma));
            kernel[i] = (float) value;
            sum += value;
        }
        for (int i = 0; i < size; i++) kernel[i] /= (float) sum;
        return kernel;
    }

    /**
     * Separable Gaussian blur applied to every channel independently.
     * Borders repeat the edge pixel (clamp), so a constant image stays constant.
     *
     * @param image input, left untouched
     * @param sigma standard deviation in pixels
     * @return blurred copy with the same dimensions
     */
    public static FloatImage gaussianBlur(FloatImage image, double sigma) {
        float[] kernel = create1DGaussianKernel(sigma);
        int radius = kernel.length / 2;
        int width = image.getWidth();
        int height = image.getHeight();
        int channels = image.getChannels();

        FloatImage tempImage = new FloatImage(width, height, channels);
        FloatImage outputImage = new FloatImage(width, height, channels);

        // horizontal pass
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < channels; c++) {
                    float sum = 0;
                    for (int k = 0; k < kernel.length; k++) {
                        sum += image.getClamped(x + k - radius, y, c) * kernel[k];
                    }
                    tempImage.set(x, y, c, sum);
                }
            }
        }

        // vertical pass
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < channels; c++) {
                    float sum = 0;
                    for (int k = 0; k < kernel.length; k++) {
                        sum += tempImage.getClamped(x, y + k - radius, c) * kernel[k];
                    }
                    outputImage.set(x, y, c, sum);
                }
            }
        }
        return outputImage;
    }
}
