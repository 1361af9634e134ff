package com.panorama.imageStitching;

import com.panorama.RANSAC_matching.FeatureCorrespondence;
import com.panorama.RANSAC_matching.FeatureMatcher;
import com.panorama.RANSAC_matching.RANSAC;
import com.panorama.RANSAC_matching.RansacResult;
import com.panorama.config.StitchingParameters;
import com.panorama.descriptor.DescriptorBuilder;
import com.panorama.descriptor.Feature;
import com.panorama.harris.HarrisCornerDetector;
import com.panorama.harris.Point;
import com.panorama.imageOperator.FloatImage;
import com.panorama.imageOperator.Matrix_Image;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.List;
import java.util.Random;

/**
 * Two-image pipeline: Harris corners, patch descriptors, ratio-test matching, RANSAC, compositing.
 * Image A is warped into the frame of image B.
 */
@Slf4j
@Getter
public class PanoramaStitcher {
    private final StitchingParameters parameters;
    private final HarrisCornerDetector cornerDetector;
    private final DescriptorBuilder descriptorBuilder;
    private final FeatureMatcher matcher;
    private final RANSAC ransac;

    public PanoramaStitcher(StitchingParameters parameters) {
        this.parameters = parameters;
        this.cornerDetector = new HarrisCornerDetector(parameters);
        this.descriptorBuilder = new DescriptorBuilder(parameters);
        this.matcher = new FeatureMatcher(parameters.getMatchThreshold());
        this.ransac = new RANSAC(parameters);
    }

    public PanoramaStitcher() {
        this(StitchingParameters.defaults());
    }

    public StitchResult autostitch(Mat imageA, Mat imageB, Random random) {
        StitchResult estimate = estimate(Matrix_Image.toFloatImage(imageA), Matrix_Image.toFloatImage(imageB), random);
        Mat panorama = Compositor.composite(imageA, imageB, estimate.getHomography());
        return new StitchResult(estimate.getCornersA(), estimate.getCornersB(),
                estimate.getFeaturesA(), estimate.getFeaturesB(),
                estimate.getCorrespondences(), estimate.getRansac(), panorama);
    }

    /**
     * Runs every stage except compositing. Corners whose descriptor patch is flat are left without a feature.
     *
     * @throws com.panorama.exception.InsufficientCorrespondencesException when fewer than four matches survive
     */
    public StitchResult estimate(FloatImage imageA, FloatImage imageB, Random random) {
        log.info("Stitching {} onto {} with {}", imageA, imageB, parameters);

        List<Point> cornersA = detect(imageA);
        List<Point> cornersB = detect(imageB);
        log.info("Corners: {} in A, {} in B", cornersA.size(), cornersB.size());

        List<Feature> featuresA = descriptorBuilder.computeUsableFeatures(imageA, cornersA);
        List<Feature> featuresB = descriptorBuilder.computeUsableFeatures(imageB, cornersB);
        log.info("Features: {} in A, {} in B", featuresA.size(), featuresB.size());

        List<FeatureCorrespondence> correspondences = matcher.findCorrespondences(featuresA, featuresB);
        log.info("Correspondences after ratio test: {}", correspondences.size());

        RansacResult result = ransac.run(correspondences, random);
        log.info("Homography A -> B: {}", result.getHomography());

        return new StitchResult(cornersA, cornersB, featuresA, featuresB, correspondences, result, null);
    }

    private List<Point> detect(FloatImage image) {
        List<Point> corners = cornerDetector.detect(image);
        return descriptorBuilder.filterCorners(corners, image.getWidth(), image.getHeight());
    }
}
