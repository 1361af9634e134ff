package com.panorama.API;

import com.panorama.RANSAC_matching.ConsensusScope;
import com.panorama.config.PanoramaConfig;
import com.panorama.config.StitchingParameters;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds the {@code panorama.*} keys of application.properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "panorama")
public class StitchingProperties {
    private String uploadsDir = "uploads";
    private String outputDir = "stitch";
    private String publicBaseUrl = "http://localhost:8080";

    private double harrisK = PanoramaConfig.HARRIS_K;
    private double sigmaG = PanoramaConfig.SIGMA_G;
    private double factorSigma = PanoramaConfig.FACTOR_SIGMA;
    private int maxiDiameter = PanoramaConfig.MAXI_DIAMETER;
    private int boundarySize = PanoramaConfig.BOUNDARY_SIZE;
    private double sigmaBlurDescriptor = PanoramaConfig.SIGMA_BLUR_DESCRIPTOR;
    private int radiusDescriptor = PanoramaConfig.RADIUS_DESCRIPTOR;
    private double matchThreshold = PanoramaConfig.MATCH_THRESHOLD;
    private int ransacIterations = PanoramaConfig.RANSAC_ITERATIONS;
    private double ransacEpsilon = PanoramaConfig.RANSAC_EPSILON;
    private ConsensusScope consensusScope = PanoramaConfig.CONSENSUS_SCOPE;

    public StitchingParameters toParameters() {
        return StitchingParameters.builder()
                .harrisK(harrisK)
                .sigmaG(sigmaG)
                .factorSigma(factorSigma)
                .maxiDiameter(maxiDiameter)
                .boundarySize(boundarySize)
                .sigmaBlurDescriptor(sigmaBlurDescriptor)
                .radiusDescriptor(radiusDescriptor)
                .matchThreshold(matchThreshold)
                .ransacIterations(ransacIterations)
                .ransacEpsilon(ransacEpsilon)
                .consensusScope(consensusScope)
                .build();
    }
}
