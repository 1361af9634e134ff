package com.panorama.harris;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Integer pixel position, x along the width and y along the height.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public final class Point {
    private final int x;
    private final int y;

    public double[] toHomogeneous() {
        return new double[]{x, y, 1};
    }

    public double distanceTo(Point other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
