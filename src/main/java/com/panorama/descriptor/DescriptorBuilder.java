package com.panorama.descriptor;

import com.panorama.config.StitchingParameters;
import com.panorama.exception.DegenerateDescriptorException;
import com.panorama.exception.DescriptorOutOfBoundsException;
import com.panorama.filter_convolution_gauss.SeparabilityGauss;
import com.panorama.harris.Point;
import com.panorama.imageOperator.ColourImageToGray;
import com.panorama.imageOperator.FloatImage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds one normalized (2r+1) x (2r+1) luminance patch per corner.
 */
@Slf4j
@Getter
public class DescriptorBuilder {
    private final double sigmaBlurDescriptor;
    private final int radiusDescriptor;

    public DescriptorBuilder(double sigmaBlurDescriptor, int radiusDescriptor) {
        if (!(sigmaBlurDescriptor > 0)) {
            throw new IllegalArgumentException("Descriptor blur must be positive, got " + sigmaBlurDescriptor);
        }
        if (radiusDescriptor < 1) {
            throw new IllegalArgumentException("Descriptor radius must be at least 1, got " + radiusDescriptor);
        }
        this.sigmaBlurDescriptor = sigmaBlurDescriptor;
        this.radiusDescriptor = radiusDescriptor;
    }

    public DescriptorBuilder(StitchingParameters params) {
        this(params.getSigmaBlurDescriptor(), params.getRadiusDescriptor());
    }

    public static boolean isWithinBounds(Point p, int width, int height, int radius) {
        return p.getX() - radius >= 0 && p.getX() + radius < width
                && p.getY() - radius >= 0 && p.getY() + radius < height;
    }

    /** Corners whose descriptor window fits inside a width x height image, in input order. */
    public List<Point> filterCorners(List<Point> corners, int width, int height) {
        List<Point> kept = new ArrayList<>(corners.size());
        for (Point p : corners) {
            if (isWithinBounds(p, width, height, radiusDescriptor)) kept.add(p);
        }
        if (kept.size() < corners.size()) {
            log.debug("Dropped {} corners too close to the border for radius {}", corners.size() - kept.size(), radiusDescriptor);
        }
        return kept;
    }

    /**
     * @throws DescriptorOutOfBoundsException if a window leaves the image
     * @throws DegenerateDescriptorException  if a window is flat
     */
    public List<Feature> computeFeatures(FloatImage image, List<Point> corners) {
        FloatImage blurred = blurredLuminance(image);

        List<Feature> features = new ArrayList<>(corners.size());
        for (Point p : corners) {
            features.add(new Feature(p, descriptor(blurred, p, radiusDescriptor)));
        }
        return features;
    }

    /**
     * Like {@link #computeFeatures} but corners whose window leaves the image or is flat are skipped.
     * A corner response spreads as far as the tensor blur, so maxima can land in untextured areas.
     *
     * @return features of the usable corners, in input order
     */
    public List<Feature> computeUsableFeatures(FloatImage image, List<Point> corners) {
        FloatImage blurred = blurredLuminance(image);
        int width = blurred.getWidth();
        int height = blurred.getHeight();

        List<Feature> features = new ArrayList<>(corners.size());
        int outside = 0;
        int flat = 0;
        for (Point p : corners) {
            if (!isWithinBounds(p, width, height, radiusDescriptor)) {
                outside++;
                continue;
            }
            try {
                features.add(new Feature(p, descriptor(blurred, p, radiusDescriptor)));
            } catch (DegenerateDescriptorException e) {
                flat++;
            }
        }
        if (outside + flat > 0) {
            log.debug("Skipped {} corners near the border and {} with a flat patch", outside, flat);
        }
        return features;
    }

    private FloatImage blurredLuminance(FloatImage image) {
        FloatImage lumi = ColourImageToGray.lumiChromi(image).getLuminance();
        return SeparabilityGauss.gaussianBlur(lumi, sigmaBlurDescriptor);
    }

    /**
     * Crops the window around p from an already blurred luminance image and normalizes it to zero
     * mean and unit variance.
     */
    public static Descriptor descriptor(FloatImage blurredLumi, Point p, int radius) {
        int width = blurredLumi.getWidth();
        int height = blurredLumi.getHeight();
        if (!isWithinBounds(p, width, height, radius)) {
            throw new DescriptorOutOfBoundsException(p, radius, width, height);
        }

        int size = 2 * radius + 1;
        FloatImage patch = new FloatImage(size, size, 1);
        for (int dy = 0; dy < size; dy++) {
            for (int dx = 0; dx < size; dx++) {
                patch.set(dx, dy, blurredLumi.get(p.getX() - radius + dx, p.getY() - radius + dy));
            }
        }

        double mean = patch.mean();
        double variance = patch.variance();
        if (!(variance > 0)) {
            throw new DegenerateDescriptorException(p);
        }
        double std = Math.sqrt(variance);
        for (int dy = 0; dy < size; dy++) {
            for (int dx = 0; dx < size; dx++) {
                patch.set(dx, dy, (float) ((patch.get(dx, dy) - mean) / std));
            }
        }
        return new Descriptor(patch);
    }
}
