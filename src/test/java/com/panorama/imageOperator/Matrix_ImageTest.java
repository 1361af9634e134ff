package com.panorama.imageOperator;

import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;

public class Matrix_ImageTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testBgrMatBecomesRgbFloats() {
        // OpenCV order: blue, green, red
        final Mat mat = new Mat(2, 3, CV_8UC3, new Scalar(0, 51, 255, 0));

        final FloatImage image = Matrix_Image.toFloatImage(mat);

        Assert.assertEquals(3, image.getWidth());
        Assert.assertEquals(2, image.getHeight());
        Assert.assertEquals("red", 1f, image.get(1, 1, 0), 1e-6);
        Assert.assertEquals("green", 0.2f, image.get(1, 1, 1), 1e-6);
        Assert.assertEquals("blue", 0f, image.get(1, 1, 2), 1e-6);
    }

    @Test
    public void testFloatImageBackToBgr() {
        final FloatImage image = new FloatImage(2, 2, 3);
        image.set(1, 0, 0, 1f);
        image.set(1, 0, 2, 2f);

        final Mat mat = Matrix_Image.toMat(image);
        final UByteIndexer idx = mat.createIndexer();

        Assert.assertEquals("blue is clamped to 255", 255, idx.get(0, 1, 0));
        Assert.assertEquals(0, idx.get(0, 1, 1));
        Assert.assertEquals(255, idx.get(0, 1, 2));
        idx.release();
    }

    @Test
    public void testWriteThenRead() throws IOException {
        final Path path = folder.getRoot().toPath().resolve("square.png");
        Matrix_Image.writeImage(path, new Mat(4, 5, CV_8UC3, new Scalar(10, 20, 30, 0)));

        final Mat read = Matrix_Image.readImage(path);

        Assert.assertEquals(5, read.cols());
        Assert.assertEquals(4, read.rows());
    }

    @Test(expected = IOException.class)
    public void testMissingFile() throws IOException {
        Matrix_Image.readImage(folder.getRoot().toPath().resolve("missing.png"));
    }
}
