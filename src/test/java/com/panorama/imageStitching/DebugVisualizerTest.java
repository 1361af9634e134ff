package com.panorama.imageStitching;

import com.panorama.RANSAC_matching.FeatureCorrespondence;
import com.panorama.descriptor.Descriptor;
import com.panorama.descriptor.Feature;
import com.panorama.harris.Point;
import com.panorama.homography.HomographyMatrix;
import com.panorama.imageOperator.FloatImage;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;

public class DebugVisualizerTest {

    private static Mat black(int width, int height) {
        return new Mat(height, width, CV_8UC3, new Scalar(0, 0, 0, 0));
    }

    @Test
    public void testCornersAreDrawnOnACopy() {
        final Mat image = black(20, 20);

        final Mat vis = DebugVisualizer.drawCorners(image, Collections.singletonList(new Point(10, 5)));

        final UByteIndexer visIdx = vis.createIndexer();
        Assert.assertEquals("corner marker is green", 255, visIdx.get(5, 10, 1));
        visIdx.release();
        final UByteIndexer idx = image.createIndexer();
        Assert.assertEquals("input must stay untouched", 0, idx.get(5, 10, 1));
        idx.release();
    }

    @Test
    public void testFeaturesShowDescriptorSign() {
        final FloatImage patch = new FloatImage(3, 3, 1);
        patch.set(0, 0, -1f);
        patch.set(2, 2, 1f);
        final Feature feature = new Feature(new Point(5, 5), new Descriptor(patch));

        final Mat vis = DebugVisualizer.drawFeatures(black(10, 10), Collections.singletonList(feature));

        final UByteIndexer idx = vis.createIndexer();
        Assert.assertEquals("negative values are red", 255, idx.get(4, 4, 2));
        Assert.assertEquals("positive values are green", 255, idx.get(6, 6, 1));
        idx.release();
    }

    @Test
    public void testCorrespondencesSideBySide() {
        final Descriptor descriptor = new Descriptor(new FloatImage(1, 1, 1));
        final List<FeatureCorrespondence> correspondences = Arrays.asList(
                new FeatureCorrespondence(new Feature(new Point(2, 2), descriptor), new Feature(new Point(3, 2), descriptor), 0),
                new FeatureCorrespondence(new Feature(new Point(2, 8), descriptor), new Feature(new Point(9, 1), descriptor), 0));

        final Mat vis = DebugVisualizer.drawCorrespondences(black(10, 10), black(12, 14), correspondences,
                                                            new boolean[]{true, false});

        Assert.assertEquals(22, vis.cols());
        Assert.assertEquals(14, vis.rows());
        final UByteIndexer idx = vis.createIndexer();
        Assert.assertEquals("inlier line is green", 255, idx.get(2, 2, 1));
        Assert.assertEquals("outlier line is red", 255, idx.get(8, 2, 2));
        idx.release();

        final Mat[] reprojection = DebugVisualizer.drawReprojection(black(10, 10), black(12, 14),
                                                                    HomographyMatrix.translation(1, 0),
                                                                    correspondences, new boolean[]{true, false});
        Assert.assertEquals(2, reprojection.length);
        Assert.assertEquals(12, reprojection[1].cols());
    }
}
