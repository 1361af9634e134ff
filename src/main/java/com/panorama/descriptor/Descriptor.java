package com.panorama.descriptor;

import com.panorama.imageOperator.FloatImage;

/**
 * Square descriptor patch. {@link DescriptorBuilder} produces normalized ones; the constructor takes values as given.
 */
public final class Descriptor {
    private final FloatImage patch;

    public Descriptor(FloatImage patch) {
        if (patch.getWidth() != patch.getHeight() || patch.getWidth() % 2 == 0 || patch.getChannels() != 1) {
            throw new IllegalArgumentException("Descriptor patch must be a single channel odd square, got " + patch);
        }
        this.patch = patch.copy();
    }

    public int size() {
        return patch.getWidth();
    }

    public int radius() {
        return patch.getWidth() / 2;
    }

    public float get(int x, int y) {
        return patch.get(x, y);
    }

    public double mean() {
        return patch.mean();
    }

    public double variance() {
        return patch.variance();
    }

    /** Sum of squared element-wise differences. */
    public double squaredDistance(Descriptor other) {
        if (other.size() != size()) {
            throw new IllegalArgumentException("Descriptor sizes differ: " + size() + " vs " + other.size());
        }
        float[] a = patch.getData();
        float[] b = other.patch.getData();
        double dist = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            dist += d * d;
        }
        return dist;
    }
}
