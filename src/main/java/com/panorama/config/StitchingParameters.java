package com.panorama.config;

import com.panorama.RANSAC_matching.ConsensusScope;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tuning knobs for one stitching run. Unset fields fall back to {@link PanoramaConfig}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class StitchingParameters {
    @Builder.Default private final double harrisK = PanoramaConfig.HARRIS_K;
    @Builder.Default private final double sigmaG = PanoramaConfig.SIGMA_G;
    @Builder.Default private final double factorSigma = PanoramaConfig.FACTOR_SIGMA;
    @Builder.Default private final int maxiDiameter = PanoramaConfig.MAXI_DIAMETER;
    @Builder.Default private final int boundarySize = PanoramaConfig.BOUNDARY_SIZE;

    @Builder.Default private final double sigmaBlurDescriptor = PanoramaConfig.SIGMA_BLUR_DESCRIPTOR;
    @Builder.Default private final int radiusDescriptor = PanoramaConfig.RADIUS_DESCRIPTOR;

    @Builder.Default private final double matchThreshold = PanoramaConfig.MATCH_THRESHOLD;

    @Builder.Default private final int ransacIterations = PanoramaConfig.RANSAC_ITERATIONS;
    @Builder.Default private final double ransacEpsilon = PanoramaConfig.RANSAC_EPSILON;
    @Builder.Default private final ConsensusScope consensusScope = PanoramaConfig.CONSENSUS_SCOPE;

    public static StitchingParameters defaults() {
        return StitchingParameters.builder().build();
    }
}
