package com.panorama.RANSAC_matching;

/**
 * Which correspondences a RANSAC hypothesis is scored against.
 */
public enum ConsensusScope {
    /** Every correspondence passed to the estimator. */
    ALL,
    /** Only the four correspondences the hypothesis was fitted from. */
    SAMPLE
}
