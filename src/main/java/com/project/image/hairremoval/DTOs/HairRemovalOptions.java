package com.project.image.hairremoval.DTOs;

/**
 * Immutable tuning of the hair removal pipeline. One instance is passed into every run;
 * nothing here is shared mutable state, so independent runs can proceed concurrently.
 *
 * <p>The component area threshold and the adaptive block size are tuned for the default
 * 720x720 working size and are not rescaled when the working size changes.
 */
public record HairRemovalOptions(
        int workingWidth,
        int workingHeight,
        int topHatRadius,
        double brighteningFactor,
        double ffcSigma,
        ThresholdMode thresholdMode,
        int adaptiveBlockSize,
        boolean multiChannel,
        InpaintingMode inpaintingMode,
        int inpaintingRadius,
        boolean preserveDetails
) {
    public static final int DEFAULT_WORKING_SIZE = 720;
    public static final int DEFAULT_TOPHAT_RADIUS = 18;
    public static final double DEFAULT_BRIGHTENING_FACTOR = 0.7;
    public static final double DEFAULT_FFC_SIGMA = 30;
    public static final int DEFAULT_ADAPTIVE_BLOCK_SIZE = 35;
    public static final int DEFAULT_INPAINTING_RADIUS = 3;

    public HairRemovalOptions {
        if (workingWidth <= 0 || workingHeight <= 0) {
            throw new IllegalArgumentException(
                    "Working size must be positive, got " + workingWidth + "x" + workingHeight);
        }
        if (topHatRadius < 1) {
            throw new IllegalArgumentException("Top-hat radius must be at least 1, got " + topHatRadius);
        }
        if (brighteningFactor < 0.0 || brighteningFactor > 1.0) {
            throw new IllegalArgumentException("Brightening factor must be within [0, 1], got " + brighteningFactor);
        }
        if (ffcSigma <= 0.0) {
            throw new IllegalArgumentException("FFC sigma must be positive, got " + ffcSigma);
        }
        if (thresholdMode == null || inpaintingMode == null) {
            throw new IllegalArgumentException("Threshold and inpainting modes are required");
        }
        if (adaptiveBlockSize < 3 || adaptiveBlockSize % 2 == 0) {
            throw new IllegalArgumentException("Adaptive block size must be odd and >= 3, got " + adaptiveBlockSize);
        }
        if (inpaintingRadius < 1) {
            throw new IllegalArgumentException("Inpainting radius must be at least 1, got " + inpaintingRadius);
        }
    }

    public static HairRemovalOptions defaults() {
        return new HairRemovalOptions(
                DEFAULT_WORKING_SIZE, DEFAULT_WORKING_SIZE,
                DEFAULT_TOPHAT_RADIUS, DEFAULT_BRIGHTENING_FACTOR, DEFAULT_FFC_SIGMA,
                ThresholdMode.OTSU, DEFAULT_ADAPTIVE_BLOCK_SIZE,
                true,
                InpaintingMode.CAREFUL_BLEND, DEFAULT_INPAINTING_RADIUS,
                true
        );
    }

    public HairRemovalOptions withWorkingSize(int width, int height) {
        return new HairRemovalOptions(width, height, topHatRadius, brighteningFactor, ffcSigma,
                thresholdMode, adaptiveBlockSize, multiChannel, inpaintingMode, inpaintingRadius, preserveDetails);
    }

    public HairRemovalOptions withThresholdMode(ThresholdMode mode) {
        return new HairRemovalOptions(workingWidth, workingHeight, topHatRadius, brighteningFactor, ffcSigma,
                mode, adaptiveBlockSize, multiChannel, inpaintingMode, inpaintingRadius, preserveDetails);
    }

    public HairRemovalOptions withMultiChannel(boolean enabled) {
        return new HairRemovalOptions(workingWidth, workingHeight, topHatRadius, brighteningFactor, ffcSigma,
                thresholdMode, adaptiveBlockSize, enabled, inpaintingMode, inpaintingRadius, preserveDetails);
    }

    public HairRemovalOptions withInpaintingMode(InpaintingMode mode) {
        return new HairRemovalOptions(workingWidth, workingHeight, topHatRadius, brighteningFactor, ffcSigma,
                thresholdMode, adaptiveBlockSize, multiChannel, mode, inpaintingRadius, preserveDetails);
    }

    public HairRemovalOptions withPreserveDetails(boolean enabled) {
        return new HairRemovalOptions(workingWidth, workingHeight, topHatRadius, brighteningFactor, ffcSigma,
                thresholdMode, adaptiveBlockSize, multiChannel, inpaintingMode, inpaintingRadius, enabled);
    }
}
