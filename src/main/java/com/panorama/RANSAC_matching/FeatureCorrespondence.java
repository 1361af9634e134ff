package com.panorama.RANSAC_matching;

import com.panorama.descriptor.Feature;
import com.panorama.homography.CorrespondencePair;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** A feature of the first image paired with its best match in the second. */
@Getter
@AllArgsConstructor
public final class FeatureCorrespondence {
    private final Feature feature1;
    private final Feature feature2;
    private final double distance;

    public CorrespondencePair toCorrespondencePair() {
        return new CorrespondencePair(
                feature1.getPoint().getX(), feature1.getPoint().getY(),
                feature2.getPoint().getX(), feature2.getPoint().getY());
    }

    @Override
    public String toString() {
        return feature1.getPoint() + " -> " + feature2.getPoint();
    }
}
