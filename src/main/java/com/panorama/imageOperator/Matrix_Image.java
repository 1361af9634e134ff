package com.panorama.imageOperator;

import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_core.CV_8U;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGRA2BGR;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;

/**
 * Bridges OpenCV 8-bit BGR matrices and {@link FloatImage} buffers holding RGB values in [0, 1].
 */
@Slf4j
public class Matrix_Image {

    public static Mat readImage(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image not found: " + path.toAbsolutePath());
        }
        Mat mat = imread(path.toAbsolutePath().toString());
        if (mat == null || mat.empty()) {
            throw new IOException("Unreadable image: " + path.toAbsolutePath());
        }
        log.debug("Read {} ({}x{}, {} channels)", path.getFileName(), mat.cols(), mat.rows(), mat.channels());
        return mat;
    }

    public static void writeImage(Path path, Mat mat) throws IOException {
        if (!imwrite(path.toAbsolutePath().toString(), mat)) {
            throw new IOException("Could not write image: " + path.toAbsolutePath());
        }
        log.debug("Wrote {}", path.toAbsolutePath());
    }

    public static FloatImage toFloatImage(Mat source) {
        Mat mat = source;
        if (mat.depth() != CV_8U) {
            Mat converted = new Mat();
            mat.convertTo(converted, CV_8U);
            mat = converted;
        }
        if (mat.channels() == 4) {
            Mat bgr = new Mat();
            cvtColor(mat, bgr, COLOR_BGRA2BGR);
            mat = bgr;
        }
        int channels = mat.channels();
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }

        FloatImage image = new FloatImage(mat.cols(), mat.rows(), channels);
        UByteIndexer idx = mat.createIndexer();
        for (int y = 0; y < mat.rows(); y++) {
            for (int x = 0; x < mat.cols(); x++) {
                if (channels == 1) {
                    image.set(x, y, 0, idx.get(y, x, 0) / 255f);
                } else {
                    // OpenCV stores BGR, the float buffer stores RGB
                    image.set(x, y, 0, idx.get(y, x, 2) / 255f);
                    image.set(x, y, 1, idx.get(y, x, 1) / 255f);
                    image.set(x, y, 2, idx.get(y, x, 0) / 255f);
                }
            }
        }
        idx.release();
        return image;
    }

    public static Mat toMat(FloatImage image) {
        int channels = image.getChannels();
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        Mat mat = new Mat(image.getHeight(), image.getWidth(), channels == 1 ? CV_8UC1 : CV_8UC3);
        UByteIndexer idx = mat.createIndexer();
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                if (channels == 1) {
                    idx.put(y, x, 0, toByte(image.get(x, y, 0)));
                } else {
                    idx.put(y, x, 2, toByte(image.get(x, y, 0)));
                    idx.put(y, x, 1, toByte(image.get(x, y, 1)));
                    idx.put(y, x, 0, toByte(image.get(x, y, 2)));
                }
            }
        }
        idx.release();
        return mat;
    }

    /**
     * Rescales a single channel map so its maximum becomes white. Used to dump response maps.
     */
    public static Mat toNormalizedMat(FloatImage map) {
        float max = map.max();
        FloatImage scaled = new FloatImage(map.getWidth(), map.getHeight(), 1);
        for (int y = 0; y < map.getHeight(); y++) {
            for (int x = 0; x < map.getWidth(); x++) {
                scaled.set(x, y, max > 0 ? map.get(x, y, 0) / max : 0f);
            }
        }
        return toMat(scaled);
    }

    private static int toByte(float value) {
        int v = Math.round(value * 255f);
        return Math.max(0, Math.min(255, v));
    }
}
