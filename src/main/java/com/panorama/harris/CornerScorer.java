package com.panorama.harris;

import com.panorama.imageOperator.FloatImage;

public class CornerScorer {

    public static CornerResponseMap cornerResponse(FloatImage image, double k, double sigmaG, double factorSigma) {
        return score(StructureTensorBuilder.computeTensor(image, sigmaG, factorSigma), k);
    }

    /**
     * R = det(M) - k * trace(M)^2 with M = [[Ix², IxIy], [IxIy, Iy²]], kept only where positive.
     */
    public static CornerResponseMap score(StructureTensorField tensor, double k) {
        FloatImage response = new FloatImage(tensor.width(), tensor.height(), 1);
        for (int y = 0; y < tensor.height(); y++) {
            for (int x = 0; x < tensor.width(); x++) {
                double a = tensor.ixx(x, y);
                double b = tensor.ixy(x, y);
                double d = tensor.iyy(x, y);
                double det = a * d - b * b;
                double trace = a + d;
                double r = det - k * trace * trace;
                if (r > 0) {
                    response.set(x, y, (float) r);
                }
            }
        }
        return new CornerResponseMap(response);
    }
}
