package com.panorama.exception;

import lombok.Getter;

@Getter
public class InsufficientCorrespondencesException extends StitchingException {
    private final int available;
    private final int required;

    public InsufficientCorrespondencesException(int available, int required) {
        super("Need at least " + required + " correspondences to estimate a homography, got " + available);
        this.available = available;
        this.required = required;
    }
}
