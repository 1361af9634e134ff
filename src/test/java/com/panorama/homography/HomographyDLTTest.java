package com.panorama.homography;

import org.junit.Assert;
import org.junit.Test;

public class HomographyDLTTest {

    private static final HomographyMatrix PROJECTIVE = new HomographyMatrix(new double[][]{
            {1.1, 0.05, 12},
            {-0.03, 0.95, -7},
            {1e-4, 2e-4, 1}
    });

    private static CorrespondencePair mapped(HomographyMatrix h, double x, double y) {
        final double[] p = h.project(x, y);
        return new CorrespondencePair(x, y, p[0], p[1]);
    }

    @Test
    public void testExactFromFourPairs() {
        final CorrespondencePair[] pairs = {
                mapped(PROJECTIVE, 0, 0),
                mapped(PROJECTIVE, 100, 0),
                mapped(PROJECTIVE, 0, 80),
                mapped(PROJECTIVE, 120, 90)
        };

        final HomographyMatrix h = HomographyDLT.computeHomography(pairs);

        Assert.assertEquals("h33 is fixed to one", 1.0, h.get(2, 2), 0);
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++)
                Assert.assertEquals("entry " + r + "," + c, PROJECTIVE.get(r, c), h.get(r, c), 1e-6);

        for (final CorrespondencePair pair : pairs) {
            final double[] p = h.project(pair.point1[0], pair.point1[1]);
            Assert.assertEquals(pair.point2[0], p[0], 1e-6);
            Assert.assertEquals(pair.point2[1], p[1], 1e-6);
        }
    }

    @Test
    public void testPureTranslation() {
        final HomographyMatrix t = HomographyMatrix.translation(10, -4);
        final HomographyMatrix h = HomographyDLT.computeHomography(new CorrespondencePair[]{
                mapped(t, 3, 3), mapped(t, 40, 5), mapped(t, 7, 33), mapped(t, 50, 60)
        });

        Assert.assertEquals(10, h.get(0, 2), 1e-7);
        Assert.assertEquals(-4, h.get(1, 2), 1e-7);
        Assert.assertEquals(1, h.get(0, 0), 1e-7);
        Assert.assertEquals(0, h.get(2, 0), 1e-9);
    }

    @Test
    public void testRepeatedPointsAreDegenerate() {
        final CorrespondencePair same = new CorrespondencePair(5, 5, 9, 9);

        final HomographyMatrix h = HomographyDLT.computeHomography(new CorrespondencePair[]{same, same, same, same});

        Assert.assertTrue("repeated points cannot define a homography", h.isSingular());
    }

    @Test
    public void testCollinearPointsAreDegenerate() {
        final HomographyMatrix h = HomographyDLT.computeHomography(new CorrespondencePair[]{
                new CorrespondencePair(0, 0, 1, 1),
                new CorrespondencePair(1, 1, 2, 2),
                new CorrespondencePair(2, 2, 3, 3),
                new CorrespondencePair(3, 3, 4, 4)
        });

        Assert.assertTrue(h.isSingular());
    }

    @Test
    public void testLinearSolver() {
        final double[][] a = {{2, 1}, {1, 3}};
        final double[] b = {3, 5};

        final double[] x = HomographyDLT.lsolve(a, b);

        Assert.assertArrayEquals(new double[]{0.8, 1.4}, x, 1e-12);
        Assert.assertEquals("inputs must be left untouched", 2, a[0][0], 0);
        Assert.assertNull(HomographyDLT.lsolve(new double[][]{{1, 2}, {2, 4}}, new double[]{1, 2}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrongPairCount() {
        HomographyDLT.computeHomography(new CorrespondencePair[3]);
    }
}
