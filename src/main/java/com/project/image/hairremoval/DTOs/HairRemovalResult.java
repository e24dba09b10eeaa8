package com.project.image.hairremoval.DTOs;

import org.opencv.core.Mat;

public record HairRemovalResult(
        Mat hairFree,   // CV_8UC3, R,G,B order, working resolution
        Mat mask,       // CV_8UC1, 255 = hair
        PipelineStats stats
) {}
