package com.panorama.RANSAC_matching;

import com.panorama.descriptor.Descriptor;
import com.panorama.descriptor.Feature;
import com.panorama.exception.InsufficientCorrespondencesException;
import com.panorama.harris.Point;
import com.panorama.homography.HomographyMatrix;
import com.panorama.imageOperator.FloatImage;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class RANSACTest {

    /** Integer affine map, so every mapped pixel lands exactly on a pixel. */
    private static final HomographyMatrix AFFINE = new HomographyMatrix(new double[][]{
            {2, 1, 5},
            {0, 1, -3},
            {0, 0, 1}
    });

    private static final Descriptor DUMMY = new Descriptor(new FloatImage(1, 1, 1));

    private static FeatureCorrespondence correspondence(int x1, int y1, int x2, int y2) {
        return new FeatureCorrespondence(new Feature(new Point(x1, y1), DUMMY), new Feature(new Point(x2, y2), DUMMY), 0);
    }

    /** Points (3k, k²) lie on a parabola, so no three of them are collinear. */
    private static List<FeatureCorrespondence> exactCorrespondences(HomographyMatrix h, int count) {
        final List<FeatureCorrespondence> list = new ArrayList<>();
        for (int k = 0; k < count; k++) {
            final int x = 3 * k;
            final int y = k * k;
            final double[] p = h.project(x, y);
            list.add(correspondence(x, y, (int) Math.round(p[0]), (int) Math.round(p[1])));
        }
        return list;
    }

    private static void assertMatrixEquals(HomographyMatrix expected, HomographyMatrix actual, double delta) {
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                Assert.assertEquals("entry " + r + "," + c + " of " + actual, expected.get(r, c), actual.get(r, c), delta);
    }

    @Test
    public void testRecoversExactModel() {
        final List<FeatureCorrespondence> list = exactCorrespondences(AFFINE, 12);

        final RansacResult result = new RANSAC(100, 1.0).run(list, new Random(1));

        assertMatrixEquals(AFFINE, result.getHomography(), 1e-4);
        Assert.assertEquals("every correspondence is an inlier", 12, result.getInlierCount());
        Assert.assertEquals(12, result.getBestScore());
    }

    @Test
    public void testOutliersAreRejected() {
        final List<FeatureCorrespondence> list = exactCorrespondences(AFFINE, 20);
        final Random noise = new Random(17);
        for (int i = 0; i < 8; i++) {
            final int x = 3 * i + 1;
            final int y = 7 * i;
            final double[] p = AFFINE.project(x, y);
            // at least 30 pixels away from the true position
            list.add(correspondence(x, y, (int) p[0] + 30 + noise.nextInt(30), (int) p[1] - 30 - noise.nextInt(30)));
        }

        final RansacResult result = new RANSAC(300, 2.0).run(list, new Random(2));

        assertMatrixEquals(AFFINE, result.getHomography(), 1e-4);
        Assert.assertEquals(20, result.getInlierCount());
        for (int i = 0; i < list.size(); i++) {
            Assert.assertEquals("mask entry " + i, i < 20, result.isInlier(i));
        }
    }

    @Test
    public void testInliersReprojectWithinTolerance() {
        final List<FeatureCorrespondence> list = exactCorrespondences(AFFINE, 10);
        list.add(correspondence(4, 4, 200, 0));
        final double epsilon = 3.0;

        final RansacResult result = new RANSAC(200, epsilon).run(list, new Random(3));

        for (int i = 0; i < list.size(); i++) {
            if (!result.isInlier(i)) continue;
            final Point p1 = list.get(i).getFeature1().getPoint();
            final Point p2 = list.get(i).getFeature2().getPoint();
            final double[] projected = result.getHomography().project(p1.getX(), p1.getY());
            Assert.assertTrue(Math.hypot(projected[0] - p2.getX(), projected[1] - p2.getY()) < epsilon);
        }
        Assert.assertFalse(result.isInlier(10));
    }

    @Test
    public void testSameSeedSameResult() {
        final List<FeatureCorrespondence> list = exactCorrespondences(HomographyMatrix.translation(4, -2), 8);
        list.add(correspondence(1, 1, 50, 50));
        list.add(correspondence(2, 30, 0, 0));

        final RansacResult first = new RANSAC(50, 1.0).run(list, new Random(99));
        final RansacResult second = new RANSAC(50, 1.0).run(list, new Random(99));

        Assert.assertEquals(first.getHomography(), second.getHomography());
        Assert.assertArrayEquals(first.getInlierMask(), second.getInlierMask());
    }

    @Test
    public void testCallerListIsNotReordered() {
        final List<FeatureCorrespondence> list = exactCorrespondences(AFFINE, 9);
        final List<FeatureCorrespondence> before = new ArrayList<>(list);

        new RANSAC(40, 1.0).run(list, new Random(4));

        Assert.assertEquals(before, list);
    }

    @Test
    public void testDegenerateSamplesFallBackToIdentity() {
        final List<FeatureCorrespondence> list = new ArrayList<>(Collections.nCopies(5, correspondence(5, 5, 5, 5)));

        final RansacResult result = new RANSAC(10, 1.0).run(list, new Random(5));

        Assert.assertEquals(HomographyMatrix.identity(), result.getHomography());
        Assert.assertEquals(5, result.getInlierCount());
    }

    @Test
    public void testNoConsensusKeepsIdentity() {
        final List<FeatureCorrespondence> list = new ArrayList<>(Collections.nCopies(4, correspondence(5, 5, 80, 5)));

        final RansacResult result = new RANSAC(10, 1.0).run(list, new Random(6));

        Assert.assertEquals(HomographyMatrix.identity(), result.getHomography());
        Assert.assertEquals(0, result.getInlierCount());
    }

    @Test
    public void testSampleScopeScoresOnlyTheSample() {
        final List<FeatureCorrespondence> list = exactCorrespondences(AFFINE, 12);

        final RansacResult result = new RANSAC(20, 1.0, ConsensusScope.SAMPLE).run(list, new Random(7));

        Assert.assertEquals("a sample can agree with at most four points", 4, result.getBestScore());
        Assert.assertEquals("the mask still covers the full list", 12, result.getInlierMask().length);
    }

    @Test
    public void testInlierFlags() {
        final List<FeatureCorrespondence> list = new ArrayList<>();
        list.add(correspondence(0, 0, 10, 0));
        list.add(correspondence(5, 5, 16, 5));
        list.add(correspondence(5, 5, 18, 5));

        final boolean[] mask = RANSAC.inliers(HomographyMatrix.translation(10, 0), list, 2.0);

        Assert.assertArrayEquals(new boolean[]{true, true, false}, mask);
        Assert.assertEquals(2, RANSAC.countInliers(mask));
    }

    @Test(expected = InsufficientCorrespondencesException.class)
    public void testTooFewCorrespondences() {
        new RANSAC(10, 1.0).run(exactCorrespondences(AFFINE, 3), new Random(8));
    }

    @Test(expected = InsufficientCorrespondencesException.class)
    public void testNoCorrespondences() {
        new RANSAC(10, 1.0).run(Collections.<FeatureCorrespondence>emptyList(), new Random(9));
    }
}
