package com.project.image.hairremoval.DTOs;

/** How the fused hairness map is binarized into the candidate mask. */
public enum ThresholdMode {
    /** One global threshold chosen by Otsu's method. */
    OTSU,
    /** Per-pixel threshold from a Gaussian-weighted neighbourhood mean. */
    ADAPTIVE
}
