package com.panorama.exception;

/**
 * Failure of the stitching pipeline caused by its input images or correspondences.
 */
public class StitchingException extends RuntimeException {
    public StitchingException(String message) {
        super(message);
    }
}
