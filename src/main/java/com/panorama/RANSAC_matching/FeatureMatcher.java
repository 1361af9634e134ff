package com.panorama.RANSAC_matching;

import com.panorama.descriptor.Feature;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Getter
public class FeatureMatcher {
    private final double threshold;

    /**
     * @param threshold ratio-test threshold; the squared distance of the runner-up must be at least
     *                  threshold² times that of the best match
     */
    public FeatureMatcher(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("Ratio threshold must be positive, got " + threshold);
        }
        this.threshold = threshold;
    }

    public static double l2Features(Feature f1, Feature f2) {
        return f1.getDescriptor().squaredDistance(f2.getDescriptor());
    }

    /**
     * Nearest neighbour in featuresB for every feature of featuresA, kept only when it is clearly
     * better than the second nearest. Earlier features of featuresB win distance ties.
     * With fewer than two features in featuresB the ratio test cannot run and nothing is returned.
     *
     * @return correspondences in the order of featuresA
     */
    public List<FeatureCorrespondence> findCorrespondences(List<Feature> featuresA, List<Feature> featuresB) {
        List<FeatureCorrespondence> correspondences = new ArrayList<>();
        if (featuresB.size() < 2) {
            log.debug("Second image has {} features, ratio test needs 2", featuresB.size());
            return correspondences;
        }
        double thresholdSquared = threshold * threshold;

        for (Feature f1 : featuresA) {
            double bestDist = Double.POSITIVE_INFINITY;
            double secondBest = Double.POSITIVE_INFINITY;
            Feature bestMatch = null;

            for (Feature f2 : featuresB) {
                double dist = l2Features(f1, f2);
                if (dist < bestDist) {
                    secondBest = bestDist;
                    bestDist = dist;
                    bestMatch = f2;
                } else if (dist < secondBest) {
                    secondBest = dist;
                }
            }

            if (passesRatioTest(bestDist, secondBest, thresholdSquared)) {
                correspondences.add(new FeatureCorrespondence(f1, bestMatch, bestDist));
            }
        }

        log.debug("{} of {} features passed the ratio test", correspondences.size(), featuresA.size());
        return correspondences;
    }

    /**
     * second / best >= threshold². An exact best match is accepted only if the runner-up is not exact too.
     */
    static boolean passesRatioTest(double bestDist, double secondBest, double thresholdSquared) {
        if (bestDist == 0) return secondBest > 0;
        return secondBest / bestDist >= thresholdSquared;
    }
}
