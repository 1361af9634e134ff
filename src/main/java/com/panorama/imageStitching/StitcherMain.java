package com.panorama.imageStitching;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.panorama.RANSAC_matching.ConsensusScope;
import com.panorama.config.PanoramaConfig;
import com.panorama.config.StitchingParameters;
import com.panorama.exception.StitchingException;
import com.panorama.imageOperator.Matrix_Image;
import com.panorama.osDirectoriesCreate.CreateFolderOrFile;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Random;

/**
 * Command line entry point: stitches image A into the frame of image B.
 */
@Slf4j
public class StitcherMain {

    public static class Parameters {
        @Parameter(names = "--imageA", description = "Image warped into the frame of image B", required = true)
        public String imageA;

        @Parameter(names = "--imageB", description = "Reference image", required = true)
        public String imageB;

        @Parameter(names = "--output", description = "Path of the panorama to write", required = true)
        public String output;

        @Parameter(names = "--debugDir", description = "Write corner, feature and match visualizations here")
        public String debugDir;

        @Parameter(names = "--seed", description = "Seed for RANSAC sampling (random when omitted)")
        public Long seed;

        @Parameter(names = "--k", description = "Harris sensitivity")
        public double k = PanoramaConfig.HARRIS_K;

        @Parameter(names = "--sigmaG", description = "Luminance blur before differentiation")
        public double sigmaG = PanoramaConfig.SIGMA_G;

        @Parameter(names = "--factorSigma", description = "Tensor blur as a multiple of sigmaG")
        public double factorSigma = PanoramaConfig.FACTOR_SIGMA;

        @Parameter(names = "--maxiDiam", description = "Non-maximum suppression window diameter")
        public int maxiDiameter = PanoramaConfig.MAXI_DIAMETER;

        @Parameter(names = "--boundarySize", description = "Corners this close to an edge are dropped")
        public int boundarySize = PanoramaConfig.BOUNDARY_SIZE;

        @Parameter(names = "--sigmaBlurDescriptor", description = "Luminance blur before patch extraction")
        public double sigmaBlurDescriptor = PanoramaConfig.SIGMA_BLUR_DESCRIPTOR;

        @Parameter(names = "--radiusDescriptor", description = "Descriptor patch radius")
        public int radiusDescriptor = PanoramaConfig.RADIUS_DESCRIPTOR;

        @Parameter(names = "--threshold", description = "Second-best ratio test threshold")
        public double threshold = PanoramaConfig.MATCH_THRESHOLD;

        @Parameter(names = "--iterations", description = "RANSAC iterations")
        public int iterations = PanoramaConfig.RANSAC_ITERATIONS;

        @Parameter(names = "--epsilon", description = "RANSAC inlier distance in pixels")
        public double epsilon = PanoramaConfig.RANSAC_EPSILON;

        @Parameter(names = "--scope", description = "RANSAC consensus scope: ALL or SAMPLE")
        public ConsensusScope scope = PanoramaConfig.CONSENSUS_SCOPE;

        @Parameter(names = "--help", help = true, description = "Display this note")
        public boolean help;

        public StitchingParameters toStitchingParameters() {
            return StitchingParameters.builder()
                    .harrisK(k)
                    .sigmaG(sigmaG)
                    .factorSigma(factorSigma)
                    .maxiDiameter(maxiDiameter)
                    .boundarySize(boundarySize)
                    .sigmaBlurDescriptor(sigmaBlurDescriptor)
                    .radiusDescriptor(radiusDescriptor)
                    .matchThreshold(threshold)
                    .ransacIterations(iterations)
                    .ransacEpsilon(epsilon)
                    .consensusScope(scope)
                    .build();
        }
    }

    public static void main(String[] args) {
        Parameters parameters = new Parameters();
        JCommander jCommander = JCommander.newBuilder().addObject(parameters).build();
        jCommander.setProgramName(StitcherMain.class.getName());
        try {
            jCommander.parse(args);
        } catch (ParameterException pe) {
            System.err.println("ERROR: failed to parse command line arguments\n\n" + pe.getMessage());
            jCommander.usage();
            System.exit(1);
        }
        if (parameters.help) {
            jCommander.usage();
            return;
        }

        try {
            run(parameters);
        } catch (IOException | StitchingException e) {
            log.error("Stitching failed", e);
            System.exit(2);
        }
    }

    public static StitchResult run(Parameters parameters) throws IOException {
        Mat imageA = Matrix_Image.readImage(Paths.get(parameters.imageA));
        Mat imageB = Matrix_Image.readImage(Paths.get(parameters.imageB));
        Random random = parameters.seed == null ? new Random() : new Random(parameters.seed);

        PanoramaStitcher stitcher = new PanoramaStitcher(parameters.toStitchingParameters());
        StitchResult result = stitcher.autostitch(imageA, imageB, random);

        Path output = Paths.get(parameters.output);
        if (output.toAbsolutePath().getParent() != null) {
            CreateFolderOrFile.createFolder(output.toAbsolutePath().getParent());
        }
        Matrix_Image.writeImage(output, result.getPanorama());
        log.info("Panorama written to {}", output.toAbsolutePath());

        if (parameters.debugDir != null) {
            writeDebugImages(CreateFolderOrFile.createFolder(Paths.get(parameters.debugDir)), stitcher, imageA, imageB, result);
        }
        return result;
    }

    static void writeDebugImages(Path dir, PanoramaStitcher stitcher, Mat imageA, Mat imageB, StitchResult result)
            throws IOException {
        boolean[] mask = result.getRansac().getInlierMask();
        Matrix_Image.writeImage(dir.resolve("corner_response_A.png"), Matrix_Image.toNormalizedMat(
                stitcher.getCornerDetector().cornerResponse(Matrix_Image.toFloatImage(imageA)).getResponse()));
        Matrix_Image.writeImage(dir.resolve("corner_response_B.png"), Matrix_Image.toNormalizedMat(
                stitcher.getCornerDetector().cornerResponse(Matrix_Image.toFloatImage(imageB)).getResponse()));
        Matrix_Image.writeImage(dir.resolve("corners_A.png"), DebugVisualizer.drawCorners(imageA, result.getCornersA()));
        Matrix_Image.writeImage(dir.resolve("corners_B.png"), DebugVisualizer.drawCorners(imageB, result.getCornersB()));
        Matrix_Image.writeImage(dir.resolve("features_A.png"), DebugVisualizer.drawFeatures(imageA, result.getFeaturesA()));
        Matrix_Image.writeImage(dir.resolve("features_B.png"), DebugVisualizer.drawFeatures(imageB, result.getFeaturesB()));
        Matrix_Image.writeImage(dir.resolve("correspondences.png"),
                DebugVisualizer.drawCorrespondences(imageA, imageB, result.getCorrespondences(), null));
        Matrix_Image.writeImage(dir.resolve("inliers.png"),
                DebugVisualizer.drawCorrespondences(imageA, imageB, result.getCorrespondences(), mask));
        if (!result.getHomography().isSingular()) {
            Mat[] reprojection = DebugVisualizer.drawReprojection(imageA, imageB, result.getHomography(),
                    result.getCorrespondences(), mask);
            Matrix_Image.writeImage(dir.resolve("reprojection_A.png"), reprojection[0]);
            Matrix_Image.writeImage(dir.resolve("reprojection_B.png"), reprojection[1]);
        }
        log.info("Debug images written to {}", dir.toAbsolutePath());
    }
}
