package com.panorama.harris;

import com.panorama.imageOperator.FloatImage;
import lombok.Getter;

/**
 * Harris scores, one per pixel. Non-positive scores are stored as 0 and reported as non-candidates.
 */
public class CornerResponseMap {
    @Getter
    private final FloatImage response;

    public CornerResponseMap(FloatImage response) {
        if (response.getChannels() != 1) {
            throw new IllegalArgumentException("Corner response must be single channel");
        }
        this.response = response;
    }

    public int width() {
        return response.getWidth();
    }

    public int height() {
        return response.getHeight();
    }

    public float get(int x, int y) {
        return response.get(x, y);
    }

    public boolean isCandidate(int x, int y) {
        return response.get(x, y) > 0;
    }
}
