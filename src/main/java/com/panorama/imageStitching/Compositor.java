package com.panorama.imageStitching;

import com.panorama.exception.StitchingException;
import com.panorama.homography.BoundingBox;
import com.panorama.homography.HomographyMatrix;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.BORDER_TRANSPARENT;
import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_core.CV_8U;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGRA2BGR;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_GRAY2BGR;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_LINEAR;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;
import static org.bytedeco.opencv.global.opencv_imgproc.warpPerspective;

/**
 * Warps image A (through H) and image B (unchanged) onto one canvas. No blending: A is drawn last.
 */
@Slf4j
public class Compositor {
    private static final int MAX_CANVAS_SIDE = 60000;

    /** Canvas geometry: the union box in B's frame and the translation that moves it to the origin. */
    @Getter
    @AllArgsConstructor
    public static class Canvas {
        private final BoundingBox bounds;
        private final HomographyMatrix translation;

        public int width() {
            return bounds.width();
        }

        public int height() {
            return bounds.height();
        }
    }

    public static Canvas computeCanvas(int widthA, int heightA, int widthB, int heightB, HomographyMatrix H) {
        BoundingBox boxA = BoundingBox.computeTransformedBoundingBox(widthA, heightA, H);
        BoundingBox boxB = BoundingBox.computeTransformedBoundingBox(widthB, heightB, HomographyMatrix.identity());
        BoundingBox union = BoundingBox.unionBoundingBox(boxA, boxB);

        if (union.width() <= 0 || union.height() <= 0
                || union.width() > MAX_CANVAS_SIDE || union.height() > MAX_CANVAS_SIDE) {
            throw new StitchingException("Invalid canvas size: " + union.width() + "x" + union.height()
                    + " for homography " + H);
        }
        return new Canvas(union, BoundingBox.translationFor(union));
    }

    public static Mat composite(Mat imageA, Mat imageB, HomographyMatrix H) {
        Mat a = toBgr(imageA);
        Mat b = toBgr(imageB);
        Canvas canvas = computeCanvas(a.cols(), a.rows(), b.cols(), b.rows(), H);
        log.info("Compositing onto a {}x{} canvas", canvas.width(), canvas.height());

        Mat out = Mat.zeros(new Size(canvas.width(), canvas.height()), CV_8UC3).asMat();
        HomographyMatrix T = canvas.getTranslation();
        applyHomography(b, T, out);
        applyHomography(a, T.multiply(H), out);
        return out;
    }

    /**
     * Resamples src into dst in place with bilinear interpolation. Destination pixels that do not map
     * inside src keep their value.
     */
    public static void applyHomography(Mat src, HomographyMatrix transform, Mat dst) {
        Mat M = toMat(transform);
        warpPerspective(src, dst, M, dst.size(), INTER_LINEAR, BORDER_TRANSPARENT, new Scalar(0, 0, 0, 0));
        M.release();
    }

    public static Mat toMat(HomographyMatrix H) {
        Mat M = new Mat(3, 3, CV_64F);
        DoubleIndexer idx = M.createIndexer();
        for (int r = 0; r < 3; r++)
            for (int c = 0; c < 3; c++) idx.put(r, c, H.get(r, c));
        idx.release();
        return M;
    }

    static Mat toBgr(Mat image) {
        Mat src = image;
        if (src.depth() != CV_8U) {
            Mat converted = new Mat();
            src.convertTo(converted, CV_8U);
            src = converted;
        }
        if (src.channels() == 3) return src;
        Mat bgr = new Mat();
        if (src.channels() == 1) {
            cvtColor(src, bgr, COLOR_GRAY2BGR);
        } else if (src.channels() == 4) {
            cvtColor(src, bgr, COLOR_BGRA2BGR);
        } else {
            throw new IllegalArgumentException("Unsupported channel count: " + src.channels());
        }
        return bgr;
    }
}
