package com.panorama.exception;

import com.panorama.harris.Point;
import lombok.Getter;

/**
 * A descriptor window around a corner would read outside the image.
 */
@Getter
public class DescriptorOutOfBoundsException extends StitchingException {
    private final Point point;
    private final int radius;

    public DescriptorOutOfBoundsException(Point point, int radius, int width, int height) {
        super(String.format("Descriptor window of radius %d around %s leaves the %dx%d image",
                radius, point, width, height));
        this.point = point;
        this.radius = radius;
    }
}
