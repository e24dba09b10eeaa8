package com.project.image.hairremoval.service.pipeline;

import org.opencv.core.Mat;

final class Quantizer {

    // convertTo rounds half to even; shifting by just under half a level makes it floor non-negative values
    static final double TRUNCATION_BIAS = 0.5 - 1e-4;

    private Quantizer() {}

    static Mat truncate(Mat src, int type, double alpha, double beta) {
        Mat out = new Mat();
        src.convertTo(out, type, alpha, beta - TRUNCATION_BIAS);
        return out;
    }

    static Mat truncate(Mat src, int type) {
        return truncate(src, type, 1.0, 0.0);
    }
}
