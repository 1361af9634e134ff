package com.panorama.RANSAC_matching;

import com.panorama.config.PanoramaConfig;
import com.panorama.config.StitchingParameters;
import com.panorama.exception.InsufficientCorrespondencesException;
import com.panorama.homography.CorrespondencePair;
import com.panorama.homography.HomographyDLT;
import com.panorama.homography.HomographyMatrix;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Random sample consensus over four-point homographies.
 */
@Slf4j
@Getter
public class RANSAC {
    private final int numIterations;
    private final double epsilon;
    private final ConsensusScope scope;

    public RANSAC(int numIterations, double epsilon, ConsensusScope scope) {
        if (numIterations <= 0) {
            throw new IllegalArgumentException("RANSAC needs at least one iteration, got " + numIterations);
        }
        if (!(epsilon > 0)) {
            throw new IllegalArgumentException("Inlier tolerance must be positive, got " + epsilon);
        }
        this.numIterations = numIterations;
        this.epsilon = epsilon;
        this.scope = scope;
    }

    public RANSAC(int numIterations, double epsilon) {
        this(numIterations, epsilon, ConsensusScope.ALL);
    }

    public RANSAC(StitchingParameters params) {
        this(params.getRansacIterations(), params.getRansacEpsilon(), params.getConsensusScope());
    }

    /**
     * Keeps the hypothesis with the most inliers; on ties the later one wins. A singular fit is replaced
     * by the identity, which is also the result when no hypothesis has any inlier. The caller's list is
     * never reordered.
     *
     * @param random source of the samples, seed it for repeatable runs
     * @throws InsufficientCorrespondencesException with fewer than four correspondences
     */
    public RansacResult run(List<FeatureCorrespondence> correspondences, Random random) {
        int required = PanoramaConfig.MINIMAL_SAMPLE;
        if (correspondences.size() < required) {
            throw new InsufficientCorrespondencesException(correspondences.size(), required);
        }

        HomographyMatrix bestH = HomographyMatrix.identity();
        int maxInliers = 0;
        List<FeatureCorrespondence> shuffled = new ArrayList<>(correspondences);

        for (int i = 0; i < numIterations; i++) {
            Collections.shuffle(shuffled, random);
            List<FeatureCorrespondence> sample = shuffled.subList(0, required);

            CorrespondencePair[] pairs = new CorrespondencePair[required];
            for (int k = 0; k < required; k++) pairs[k] = sample.get(k).toCorrespondencePair();

            HomographyMatrix H = HomographyDLT.computeHomography(pairs);
            if (H.isSingular()) {
                H = HomographyMatrix.identity();
            }

            List<FeatureCorrespondence> scored = scope == ConsensusScope.SAMPLE ? sample : correspondences;
            int currentInliers = countInliers(inliers(H, scored, epsilon));

            // zero-inlier hypotheses never replace the identity default
            if (currentInliers > 0 && currentInliers >= maxInliers) {
                maxInliers = currentInliers;
                bestH = H;
            }
        }

        boolean[] mask = inliers(bestH, correspondences, epsilon);
        RansacResult result = new RansacResult(bestH, mask, maxInliers);
        log.info("RANSAC done after {} iterations: {}/{} inliers", numIterations, result.getInlierCount(), correspondences.size());
        return result;
    }

    /**
     * Inlier flags, aligned with the input: point1 mapped by H lies closer than epsilon to point2.
     * The distance is Euclidean in pixel coordinates, taken after dividing the mapped point by its
     * w component. It is not a distance between homogeneous vectors, so the result does not depend
     * on the scale of H. Points sent to infinity (|w| < 1e-10) are outliers.
     */
    public static boolean[] inliers(HomographyMatrix H, List<FeatureCorrespondence> correspondences, double epsilon) {
        boolean[] mask = new boolean[correspondences.size()];
        for (int i = 0; i < mask.length; i++) {
            CorrespondencePair pair = correspondences.get(i).toCorrespondencePair();
            double[] projected = H.project(pair.point1[0], pair.point1[1]);
            if (projected == null) continue;
            double dx = projected[0] - pair.point2[0];
            double dy = projected[1] - pair.point2[1];
            mask[i] = Math.sqrt(dx * dx + dy * dy) < epsilon;
        }
        return mask;
    }

    public static int countInliers(boolean[] mask) {
        int count = 0;
        for (boolean inlier : mask) if (inlier) count++;
        return count;
    }
}
