package com.panorama.imageStitching;

import com.panorama.RANSAC_matching.FeatureCorrespondence;
import com.panorama.descriptor.Descriptor;
import com.panorama.descriptor.Feature;
import com.panorama.harris.Point;
import com.panorama.homography.HomographyMatrix;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgproc.FILLED;
import static org.bytedeco.opencv.global.opencv_imgproc.LINE_8;
import static org.bytedeco.opencv.global.opencv_imgproc.circle;
import static org.bytedeco.opencv.global.opencv_imgproc.line;

/**
 * Diagnostic drawings of the pipeline stages. All methods return new images.
 */
public class DebugVisualizer {
    // BGR
    public static final Scalar GREEN = new Scalar(0, 255, 0, 0);
    public static final Scalar RED = new Scalar(0, 0, 255, 0);
    public static final Scalar BLUE = new Scalar(255, 0, 0, 0);
    public static final Scalar YELLOW = new Scalar(0, 255, 255, 0);

    public static Mat drawCorners(Mat image, List<Point> corners, int radius, Scalar color) {
        Mat vis = Compositor.toBgr(image).clone();
        for (Point p : corners) {
            circle(vis, toCv(p), radius, color, FILLED, LINE_8, 0);
        }
        return vis;
    }

    public static Mat drawCorners(Mat image, List<Point> corners) {
        return drawCorners(image, corners, 2, GREEN);
    }

    /**
     * Paints each descriptor window: green where the normalized value is positive, red where negative.
     * Windows are assumed to lie inside the image.
     */
    public static Mat drawFeatures(Mat image, List<Feature> features) {
        Mat vis = Compositor.toBgr(image).clone();
        UByteIndexer idx = vis.createIndexer();
        for (Feature f : features) {
            Descriptor d = f.getDescriptor();
            int r = d.radius();
            int px = f.getPoint().getX();
            int py = f.getPoint().getY();
            for (int dy = 0; dy < d.size(); dy++) {
                for (int dx = 0; dx < d.size(); dx++) {
                    int x = px - r + dx;
                    int y = py - r + dy;
                    float v = d.get(dx, dy);
                    idx.put(y, x, 0, 0);
                    idx.put(y, x, 1, v > 0 ? 255 : 0);
                    idx.put(y, x, 2, v < 0 ? 255 : 0);
                }
            }
        }
        idx.release();
        return vis;
    }

    /** A and B side by side, matches joined by lines. Inliers green, outliers red; a null mask draws all green. */
    public static Mat drawCorrespondences(Mat imageA, Mat imageB, List<FeatureCorrespondence> correspondences,
                                          boolean[] inlierMask) {
        Mat a = Compositor.toBgr(imageA);
        Mat b = Compositor.toBgr(imageB);
        Mat vis = Mat.zeros(new Size(a.cols() + b.cols(), Math.max(a.rows(), b.rows())), CV_8UC3).asMat();
        a.copyTo(vis.apply(new Rect(0, 0, a.cols(), a.rows())));
        b.copyTo(vis.apply(new Rect(a.cols(), 0, b.cols(), b.rows())));

        for (int i = 0; i < correspondences.size(); i++) {
            FeatureCorrespondence c = correspondences.get(i);
            Point p1 = c.getFeature1().getPoint();
            Point p2 = c.getFeature2().getPoint();
            Scalar color = inlierMask == null || inlierMask[i] ? GREEN : RED;
            line(vis, toCv(p1), new org.bytedeco.opencv.opencv_core.Point(p2.getX() + a.cols(), p2.getY()),
                    color, 1, LINE_8, 0);
        }
        return vis;
    }

    /**
     * Detected corners against their reprojections through H (A side) and H⁻¹ (B side).
     * Inliers: detected green, reprojected red. Outliers: detected yellow, reprojected blue.
     *
     * @return {visA, visB}
     */
    public static Mat[] drawReprojection(Mat imageA, Mat imageB, HomographyMatrix H,
                                         List<FeatureCorrespondence> correspondences, boolean[] inlierMask) {
        HomographyMatrix inverse = H.inverse();
        Mat visA = Compositor.toBgr(imageA).clone();
        Mat visB = Compositor.toBgr(imageB).clone();

        for (int i = 0; i < correspondences.size(); i++) {
            Point p1 = correspondences.get(i).getFeature1().getPoint();
            Point p2 = correspondences.get(i).getFeature2().getPoint();
            boolean inlier = inlierMask[i];

            circle(visA, toCv(p1), 2, inlier ? GREEN : YELLOW, FILLED, LINE_8, 0);
            circle(visB, toCv(p2), 2, inlier ? GREEN : YELLOW, FILLED, LINE_8, 0);

            double[] back = inverse.project(p2.getX(), p2.getY());
            if (back != null) {
                circle(visA, toCv(back), 1, inlier ? RED : BLUE, FILLED, LINE_8, 0);
            }
            double[] forward = H.project(p1.getX(), p1.getY());
            if (forward != null) {
                circle(visB, toCv(forward), 1, inlier ? RED : BLUE, FILLED, LINE_8, 0);
            }
        }
        return new Mat[]{visA, visB};
    }

    private static org.bytedeco.opencv.opencv_core.Point toCv(Point p) {
        return new org.bytedeco.opencv.opencv_core.Point(p.getX(), p.getY());
    }

    private static org.bytedeco.opencv.opencv_core.Point toCv(double[] p) {
        return new org.bytedeco.opencv.opencv_core.Point((int) Math.round(p[0]), (int) Math.round(p[1]));
    }
}
