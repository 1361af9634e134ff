package com.panorama.harris;

import com.panorama.imageOperator.FloatImage;
import lombok.Getter;

/**
 * Blurred per-pixel gradient outer products, stored as channels (Ix², IxIy, Iy²).
 */
public class StructureTensorField {
    public static final int XX = 0;
    public static final int XY = 1;
    public static final int YY = 2;

    @Getter
    private final FloatImage tensor;

    public StructureTensorField(FloatImage tensor) {
        if (tensor.getChannels() != 3) {
            throw new IllegalArgumentException("Structure tensor needs 3 channels, got " + tensor.getChannels());
        }
        this.tensor = tensor;
    }

    public int width() {
        return tensor.getWidth();
    }

    public int height() {
        return tensor.getHeight();
    }

    public float ixx(int x, int y) {
        return tensor.get(x, y, XX);
    }

    public float ixy(int x, int y) {
        return tensor.get(x, y, XY);
    }

    public float iyy(int x, int y) {
        return tensor.get(x, y, YY);
    }
}
