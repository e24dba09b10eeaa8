package com.project.image.hairremoval.DTOs;

/**
 * Quality statistics of one pipeline run.
 *
 * @param initialHairCoverage percentage of pixels flagged by thresholding
 * @param finalHairCoverage   percentage of pixels left after mask cleaning
 * @param finalHairPixels     number of pixels in the final mask
 * @param psnr                PSNR in dB between the resized original and the output,
 *                            {@link Double#POSITIVE_INFINITY} when both are identical
 * @param threshold           threshold chosen by Otsu's method, -1 in adaptive mode
 */
public record PipelineStats(
        double initialHairCoverage,
        double finalHairCoverage,
        int finalHairPixels,
        double psnr,
        double threshold
) {
    public boolean identicalToOriginal() {
        return Double.isInfinite(psnr);
    }
}
