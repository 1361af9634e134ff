package com.panorama.imageOperator;

import lombok.Getter;

import java.util.Arrays;

/**
 * Planar-interleaved float raster: pixel (x, y, c) lives at ((y * width) + x) * channels + c.
 * x is the column (width), y is the row (height).
 */
@Getter
public class FloatImage {
    private final int width;
    private final int height;
    private final int channels;
    private final float[] data;

    public FloatImage(int width, int height, int channels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image must have a positive area, got " + width + "x" + height);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("Image must have at least one channel, got " + channels);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = new float[width * height * channels];
    }

    public FloatImage(int width, int height) {
        this(width, height, 1);
    }

    private int index(int x, int y, int c) {
        if (x < 0 || x >= width || y < 0 || y >= height || c < 0 || c >= channels) {
            throw new IndexOutOfBoundsException(
                    "Pixel (" + x + ", " + y + ", " + c + ") outside " + width + "x" + height + "x" + channels);
        }
        return (y * width + x) * channels + c;
    }

    public float get(int x, int y, int c) {
        return data[index(x, y, c)];
    }

    public float get(int x, int y) {
        return get(x, y, 0);
    }

    /** Reads with edge clamping: coordinates outside the image repeat the nearest border pixel. */
    public float getClamped(int x, int y, int c) {
        int cx = Math.max(0, Math.min(x, width - 1));
        int cy = Math.max(0, Math.min(y, height - 1));
        return data[(cy * width + cx) * channels + c];
    }

    public void set(int x, int y, int c, float value) {
        data[index(x, y, c)] = value;
    }

    public void set(int x, int y, float value) {
        set(x, y, 0, value);
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public FloatImage copy() {
        FloatImage out = new FloatImage(width, height, channels);
        System.arraycopy(data, 0, out.data, 0, data.length);
        return out;
    }

    public float max() {
        float m = Float.NEGATIVE_INFINITY;
        for (float v : data) m = Math.max(m, v);
        return m;
    }

    public double mean() {
        double sum = 0;
        for (float v : data) sum += v;
        return sum / data.length;
    }

    /** Population variance over every stored value. */
    public double variance() {
        double m = mean();
        double sum = 0;
        for (float v : data) {
            double d = v - m;
            sum += d * d;
        }
        return sum / data.length;
    }

    public void fill(float value) {
        Arrays.fill(data, value);
    }

    @Override
    public String toString() {
        return String.format("FloatImage[%dx%dx%d]", width, height, channels);
    }
}
