package com.project.image.hairremoval.service.pipeline;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes noise from the candidate mask: 3x3 elliptical opening, one dilation held inside
 * the candidate pixels, then drops every 8-connected component smaller than the minimum area.
 * The result is always a subset of the candidate mask.
 */
public final class MaskCleaner {
    private static final Logger log = LoggerFactory.getLogger(MaskCleaner.class);

    public static final int DEFAULT_MIN_COMPONENT_AREA = 10;

    private final Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(3, 3));
    private final int minComponentArea;

    public MaskCleaner() {
        this(DEFAULT_MIN_COMPONENT_AREA);
    }

    public MaskCleaner(int minComponentArea) {
        this.minComponentArea = minComponentArea;
    }

    public Mat clean(Mat candidate) {
        Mat opened = new Mat();
        Imgproc.morphologyEx(candidate, opened, Imgproc.MORPH_OPEN, kernel);

        Mat regrown = new Mat();
        Imgproc.dilate(opened, regrown, kernel, new Point(-1, -1), 1);
        Core.bitwise_and(regrown, candidate, regrown);

        return removeSmallComponents(regrown);
    }

    Mat removeSmallComponents(Mat mask) {
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        int count = Imgproc.connectedComponentsWithStats(mask, labels, stats, centroids, 8, CvType.CV_32S);

        // label 0 is the background
        boolean[] keep = new boolean[count];
        int kept = 0;
        for (int label = 1; label < count; label++) {
            int area = (int) stats.get(label, Imgproc.CC_STAT_AREA)[0];
            if (area >= minComponentArea) {
                keep[label] = true;
                kept++;
            }
        }
        log.debug("Kept {} of {} components (min area {})", kept, count - 1, minComponentArea);

        int[] labelData = new int[(int) labels.total()];
        labels.get(0, 0, labelData);
        byte[] out = new byte[labelData.length];
        for (int i = 0; i < labelData.length; i++) {
            if (keep[labelData[i]]) out[i] = (byte) 255;
        }

        Mat cleaned = new Mat(mask.size(), CvType.CV_8UC1);
        cleaned.put(0, 0, out);
        return cleaned;
    }
}
