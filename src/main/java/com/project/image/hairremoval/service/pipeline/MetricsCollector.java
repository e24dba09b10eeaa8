package com.project.image.hairremoval.service.pipeline;

import com.project.image.hairremoval.DTOs.PipelineStats;
import com.project.image.hairremoval.exceptions.DimensionMismatchException;
import org.opencv.core.Core;
import org.opencv.core.Mat;

public final class MetricsCollector {

    public PipelineStats collect(Mat candidateMask, Mat finalMask, Mat original, Mat reconstructed,
                                 double threshold) {
        if (!original.size().equals(reconstructed.size())) {
            throw new DimensionMismatchException("Reconstructed image", original.size(), reconstructed.size());
        }
        int finalPixels = Core.countNonZero(finalMask);
        return new PipelineStats(
                coverage(candidateMask),
                100.0 * finalPixels / finalMask.total(),
                finalPixels,
                psnr(original, reconstructed),
                threshold
        );
    }

    /** Percentage of non-zero pixels; masks only hold 0 and 255. */
    public static double coverage(Mat mask) {
        return 100.0 * Core.countNonZero(mask) / mask.total();
    }

    /** {@code 20 log10(255 / sqrt(MSE))} over all channels, infinite when the images are identical. */
    public static double psnr(Mat original, Mat reconstructed) {
        double squaredError = Core.norm(original, reconstructed, Core.NORM_L2SQR);
        if (squaredError == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double mse = squaredError / ((double) original.total() * original.channels());
        return 20.0 * Math.log10(255.0 / Math.sqrt(mse));
    }
}
