package com.project.image.hairremoval.service.pipeline;

import com.project.image.hairremoval.exceptions.InvalidImageException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

public final class Resizer {
    private final Size target;

    public Resizer(int width, int height) {
        this.target = new Size(width, height);
    }

    public Mat resize(Mat rgb) {
        if (rgb == null || rgb.empty()) {
            throw new InvalidImageException("Input image is missing or empty");
        }
        if (rgb.type() != CvType.CV_8UC3) {
            throw new InvalidImageException(
                    "Expected an 8-bit RGB image, got " + CvType.typeToString(rgb.type()));
        }
        Mat resized = new Mat();
        // aspect ratio is not preserved
        Imgproc.resize(rgb, resized, target, 0, 0, Imgproc.INTER_AREA);
        return resized;
    }
}
