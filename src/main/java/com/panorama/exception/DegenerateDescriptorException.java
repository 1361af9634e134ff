package com.panorama.exception;

import com.panorama.harris.Point;
import lombok.Getter;

/**
 * The patch around a corner is flat, so it cannot be normalized to unit variance.
 */
@Getter
public class DegenerateDescriptorException extends StitchingException {
    private final Point point;

    public DegenerateDescriptorException(Point point) {
        super("Zero-variance descriptor patch at " + point);
        this.point = point;
    }
}
