package com.panorama.harris;

import com.panorama.config.StitchingParameters;
import com.panorama.gradient.MaximumFilter;
import com.panorama.imageOperator.FloatImage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Harris corners: local maxima of the corner response, away from the image border.
 */
@Slf4j
@Getter
public class HarrisCornerDetector {
    private final double k;
    private final double sigmaG;
    private final double factorSigma;
    private final int maxiDiameter;
    private final int boundarySize;

    public HarrisCornerDetector(double k, double sigmaG, double factorSigma, int maxiDiameter, int boundarySize) {
        if (!(sigmaG > 0) || !(factorSigma > 0)) {
            throw new IllegalArgumentException("sigmaG and factorSigma must be positive");
        }
        if (maxiDiameter < 1) {
            throw new IllegalArgumentException("Maximum filter diameter must be at least 1, got " + maxiDiameter);
        }
        if (boundarySize < 0) {
            throw new IllegalArgumentException("Boundary size must not be negative, got " + boundarySize);
        }
        this.k = k;
        this.sigmaG = sigmaG;
        this.factorSigma = factorSigma;
        this.maxiDiameter = maxiDiameter;
        this.boundarySize = boundarySize;
    }

    public HarrisCornerDetector(StitchingParameters params) {
        this(params.getHarrisK(), params.getSigmaG(), params.getFactorSigma(),
                params.getMaxiDiameter(), params.getBoundarySize());
    }

    public CornerResponseMap cornerResponse(FloatImage image) {
        return CornerScorer.cornerResponse(image, k, sigmaG, factorSigma);
    }

    public List<Point> detect(FloatImage image) {
        List<Point> corners = extractCorners(cornerResponse(image), maxiDiameter, boundarySize);
        log.debug("Found {} Harris corners in {}", corners.size(), image);
        return corners;
    }

    /**
     * Non-maximum suppression in raster order (rows outer, columns inner).
     * A pixel is kept when it is more than boundarySize pixels from every edge, its neighbourhood
     * maximum is positive and its own response equals that maximum. Plateaus yield every tied pixel.
     */
    public static List<Point> extractCorners(CornerResponseMap response, int maxiDiameter, int boundarySize) {
        FloatImage maxima = MaximumFilter.maximumFilter(response.getResponse(), maxiDiameter);
        List<Point> corners = new ArrayList<>();
        for (int y = boundarySize + 1; y < response.height() - 1 - boundarySize; y++) {
            for (int x = boundarySize + 1; x < response.width() - 1 - boundarySize; x++) {
                float localMax = maxima.get(x, y);
                if (localMax > 0 && response.get(x, y) == localMax) {
                    corners.add(new Point(x, y));
                }
            }
        }
        return corners;
    }
}
