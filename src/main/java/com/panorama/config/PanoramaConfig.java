package com.panorama.config;

import com.panorama.RANSAC_matching.ConsensusScope;

public class PanoramaConfig {
    // Harris corners
    public static final double HARRIS_K = 0.15;
    public static final double SIGMA_G = 1.0;
    public static final double FACTOR_SIGMA = 4.0;
    public static final int MAXI_DIAMETER = 7;
    public static final int BOUNDARY_SIZE = 5;

    // Descriptors
    public static final double SIGMA_BLUR_DESCRIPTOR = 0.5;
    public static final int RADIUS_DESCRIPTOR = 4;

    // Matching
    public static final double MATCH_THRESHOLD = 1.0;

    // RANSAC
    public static final int RANSAC_ITERATIONS = 500;
    public static final double RANSAC_EPSILON = 4.0;
    public static final ConsensusScope CONSENSUS_SCOPE = ConsensusScope.ALL;
    public static final int MINIMAL_SAMPLE = 4;
}
