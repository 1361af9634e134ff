package com.panorama.imageStitching;

import com.panorama.RANSAC_matching.FeatureCorrespondence;
import com.panorama.RANSAC_matching.RansacResult;
import com.panorama.descriptor.Feature;
import com.panorama.harris.Point;
import com.panorama.homography.HomographyMatrix;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;

/**
 * Everything one autostitch run produced, for callers that want to inspect or visualize the stages.
 */
@Getter
@AllArgsConstructor
public class StitchResult {
    private final List<Point> cornersA;
    private final List<Point> cornersB;
    private final List<Feature> featuresA;
    private final List<Feature> featuresB;
    private final List<FeatureCorrespondence> correspondences;
    private final RansacResult ransac;
    /** Null when the run only estimated the homography. */
    private final Mat panorama;

    public HomographyMatrix getHomography() {
        return ransac.getHomography();
    }
}
