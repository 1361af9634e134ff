package com.panorama.harris;

import com.panorama.filter_convolution_gauss.SeparabilityGauss;
import com.panorama.gradient.ImageGradient;
import com.panorama.imageOperator.ColourImageToGray;
import com.panorama.imageOperator.FloatImage;

public class StructureTensorBuilder {

    /**
     * Structure tensor of the luminance.
     *
     * @param image       colour or grayscale input
     * @param sigmaG      blur applied to the luminance before differentiation
     * @param factorSigma the tensor itself is blurred with sigmaG * factorSigma
     */
    public static StructureTensorField computeTensor(FloatImage image, double sigmaG, double factorSigma) {
        FloatImage lumi = ColourImageToGray.lumiChromi(image).getLuminance();
        FloatImage blurred = SeparabilityGauss.gaussianBlur(lumi, sigmaG);
        FloatImage gx = ImageGradient.gradientX(blurred);
        FloatImage gy = ImageGradient.gradientY(blurred);

        FloatImage contributions = new FloatImage(image.getWidth(), image.getHeight(), 3);
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                float ix = gx.get(x, y);
                float iy = gy.get(x, y);
                contributions.set(x, y, StructureTensorField.XX, ix * ix);
                contributions.set(x, y, StructureTensorField.XY, ix * iy);
                contributions.set(x, y, StructureTensorField.YY, iy * iy);
            }
        }

        return new StructureTensorField(SeparabilityGauss.gaussianBlur(contributions, sigmaG * factorSigma));
    }
}
