package com.panorama.RANSAC_matching;

import com.panorama.descriptor.Descriptor;
import com.panorama.descriptor.Feature;
import com.panorama.harris.Point;
import com.panorama.imageOperator.FloatImage;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public class FeatureMatcherTest {

    /** Single value descriptor, so squared distances are plain squared differences. */
    private static Feature feature(int x, int y, float value) {
        final FloatImage patch = new FloatImage(1, 1, 1);
        patch.set(0, 0, value);
        return new Feature(new Point(x, y), new Descriptor(patch));
    }

    @Test
    public void testNearestNeighbourIsChosen() {
        final List<Feature> a = Arrays.asList(feature(0, 0, 0f), feature(1, 0, 10f));
        final List<Feature> b = Arrays.asList(feature(5, 5, 9f), feature(6, 6, 1f), feature(7, 7, 30f));

        final List<FeatureCorrespondence> matches = new FeatureMatcher(1.0).findCorrespondences(a, b);

        Assert.assertEquals(2, matches.size());
        Assert.assertEquals(new Point(6, 6), matches.get(0).getFeature2().getPoint());
        Assert.assertEquals(1.0, matches.get(0).getDistance(), 1e-9);
        Assert.assertEquals("results follow the order of the first list", new Point(1, 0), matches.get(1).getFeature1().getPoint());
        Assert.assertEquals(new Point(5, 5), matches.get(1).getFeature2().getPoint());
    }

    @Test
    public void testRatioTestRejectsAmbiguousMatches() {
        // best squared distance 1, runner-up 2.25
        final List<Feature> a = Collections.singletonList(feature(0, 0, 0f));
        final List<Feature> b = Arrays.asList(feature(1, 1, 1f), feature(2, 2, -1.5f));

        Assert.assertEquals(1, new FeatureMatcher(1.2).findCorrespondences(a, b).size());
        Assert.assertEquals("ratio exactly threshold² is accepted", 1, new FeatureMatcher(1.5).findCorrespondences(a, b).size());
        Assert.assertTrue(new FeatureMatcher(1.6).findCorrespondences(a, b).isEmpty());
    }

    @Test
    public void testFewerThanTwoCandidates() {
        final List<Feature> a = Arrays.asList(feature(0, 0, 0f), feature(1, 1, 3f));

        Assert.assertTrue(new FeatureMatcher(1.0).findCorrespondences(a, Collections.singletonList(feature(2, 2, 0.5f))).isEmpty());
        Assert.assertTrue(new FeatureMatcher(1.0).findCorrespondences(a, Collections.<Feature>emptyList()).isEmpty());
        Assert.assertTrue(new FeatureMatcher(1.0).findCorrespondences(Collections.<Feature>emptyList(), a).isEmpty());
    }

    @Test
    public void testMatchingIsDirectional() {
        final List<Feature> a = Collections.singletonList(feature(0, 0, 0f));
        final List<Feature> b = Arrays.asList(feature(1, 1, 1f), feature(2, 2, 5f));

        Assert.assertEquals(1, new FeatureMatcher(1.0).findCorrespondences(a, b).size());
        Assert.assertTrue(new FeatureMatcher(1.0).findCorrespondences(b, a).isEmpty());
    }

    @Test
    public void testEarlierCandidateWinsTies() {
        final List<Feature> a = Collections.singletonList(feature(0, 0, 0f));
        final List<Feature> b = Arrays.asList(feature(3, 3, 2f), feature(4, 4, 2f));

        final List<FeatureCorrespondence> matches = new FeatureMatcher(1.0).findCorrespondences(a, b);

        Assert.assertEquals(1, matches.size());
        Assert.assertEquals(new Point(3, 3), matches.get(0).getFeature2().getPoint());
    }

    @Test
    public void testExactMatches() {
        final List<Feature> a = Collections.singletonList(feature(0, 0, 1f));

        final List<Feature> unique = Arrays.asList(feature(1, 1, 1f), feature(2, 2, 4f));
        Assert.assertEquals("an exact unique match is kept", 1, new FeatureMatcher(1.0).findCorrespondences(a, unique).size());

        final List<Feature> duplicated = Arrays.asList(feature(1, 1, 1f), feature(2, 2, 1f));
        Assert.assertTrue("two exact matches are ambiguous", new FeatureMatcher(1.0).findCorrespondences(a, duplicated).isEmpty());
    }

    @Test
    public void testHigherThresholdNeverAddsMatches() {
        final Random random = new Random(5);
        final List<Feature> a = new ArrayList<>();
        final List<Feature> b = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            a.add(feature(i, 0, random.nextFloat()));
            b.add(feature(i, 1, random.nextFloat()));
        }

        int previous = Integer.MAX_VALUE;
        for (final double threshold : new double[]{0.5, 1.0, 1.2, 1.5, 2.0, 3.0}) {
            final int count = new FeatureMatcher(threshold).findCorrespondences(a, b).size();
            Assert.assertTrue("threshold " + threshold + " gave more matches", count <= previous);
            previous = count;
        }
    }

    @Test
    public void testRatioPredicate() {
        Assert.assertTrue(FeatureMatcher.passesRatioTest(0, 1, 4));
        Assert.assertFalse(FeatureMatcher.passesRatioTest(0, 0, 4));
        Assert.assertTrue(FeatureMatcher.passesRatioTest(1, 4, 4));
        Assert.assertFalse(FeatureMatcher.passesRatioTest(1, 3.9, 4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveThreshold() {
        new FeatureMatcher(0);
    }
}
