package com.panorama.API;

import com.panorama.imageOperator.Matrix_Image;
import com.panorama.imageStitching.PanoramaStitcher;
import com.panorama.imageStitching.StitchResult;
import com.panorama.osDirectoriesCreate.CreateFolderOrFile;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;

@Slf4j
@Service
public class StitchingService {
    private final StitchingProperties properties;

    public StitchingService(StitchingProperties properties) {
        this.properties = properties;
    }

    @Getter
    @AllArgsConstructor
    public static class StitchSummary {
        private final String imageUrl;
        private final int correspondences;
        private final int inliers;
    }

    /**
     * Stitches imageA into the frame of imageB and publishes the panorama under /stitch/ as
     * {@code <jobId>.jpg}, so concurrent requests never share an output file.
     *
     * @param seed RANSAC seed, or null for a random one
     */
    public StitchSummary stitchImages(String jobId, Path imageA, Path imageB, Long seed) throws IOException {
        Mat a = Matrix_Image.readImage(imageA);
        Mat b = Matrix_Image.readImage(imageB);

        PanoramaStitcher stitcher = new PanoramaStitcher(properties.toParameters());
        StitchResult result = stitcher.autostitch(a, b, seed == null ? new Random() : new Random(seed));

        String outputName = outputName(jobId);
        Path outputDir = CreateFolderOrFile.createFolder(Paths.get(properties.getOutputDir()));
        Matrix_Image.writeImage(outputDir.resolve(outputName), result.getPanorama());
        log.info("Panorama of {} and {} written to {}", imageA.getFileName(), imageB.getFileName(), outputDir.resolve(outputName));

        return new StitchSummary(properties.getPublicBaseUrl() + "/stitch/" + outputName,
                result.getCorrespondences().size(), result.getRansac().getInlierCount());
    }

    static String outputName(String jobId) {
        return jobId + ".jpg";
    }
}
