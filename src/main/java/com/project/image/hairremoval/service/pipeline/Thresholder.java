package com.project.image.hairremoval.service.pipeline;

import com.project.image.hairremoval.DTOs.ThresholdMode;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Thresholder {
    private static final Logger log = LoggerFactory.getLogger(Thresholder.class);

    /** Candidate mask plus the global threshold used, -1 for adaptive thresholding. */
    public record Thresholded(Mat mask, double threshold) {}

    private final ThresholdMode mode;
    private final int blockSize;

    public Thresholder(ThresholdMode mode, int blockSize) {
        this.mode = mode;
        this.blockSize = blockSize;
    }

    public Thresholded apply(Mat hairness) {
        Core.MinMaxLocResult range = Core.minMaxLoc(hairness);
        if (range.minVal == range.maxVal) {
            // Otsu degenerates to 0 on a flat histogram and would flag every pixel
            log.debug("Hairness map is uniform ({}), no hair candidates", range.maxVal);
            return new Thresholded(Mat.zeros(hairness.size(), CvType.CV_8UC1),
                    mode == ThresholdMode.OTSU ? range.maxVal : -1);
        }

        Mat mask = new Mat();
        if (mode == ThresholdMode.OTSU) {
            double threshold = Imgproc.threshold(hairness, mask, 0, 255,
                    Imgproc.THRESH_BINARY | Imgproc.THRESH_OTSU);
            log.debug("Otsu threshold: {}", threshold);
            return new Thresholded(mask, threshold);
        }

        Imgproc.adaptiveThreshold(hairness, mask, 255,
                Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, Imgproc.THRESH_BINARY, blockSize, 0);
        log.debug("Adaptive threshold applied with block size {}", blockSize);
        return new Thresholded(mask, -1);
    }
}
