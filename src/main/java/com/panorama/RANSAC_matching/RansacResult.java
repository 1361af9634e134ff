package com.panorama.RANSAC_matching;

import com.panorama.homography.HomographyMatrix;
import lombok.Getter;

import java.util.Arrays;

/**
 * Best homography of a RANSAC run with its inlier mask over the full correspondence list.
 */
@Getter
public class RansacResult {
    private final HomographyMatrix homography;
    private final boolean[] inlierMask;
    private final int inlierCount;
    /** Score the winning hypothesis reached in its own consensus scope. */
    private final int bestScore;

    public RansacResult(HomographyMatrix homography, boolean[] inlierMask, int bestScore) {
        this.homography = homography;
        this.inlierMask = Arrays.copyOf(inlierMask, inlierMask.length);
        this.inlierCount = RANSAC.countInliers(inlierMask);
        this.bestScore = bestScore;
    }

    public boolean[] getInlierMask() {
        return Arrays.copyOf(inlierMask, inlierMask.length);
    }

    public boolean isInlier(int index) {
        return inlierMask[index];
    }
}
