package com.project.image.hairremoval.DTOs;

/**
 * Reconstruction strategy for the pixels under the hair mask.
 * CAREFUL_BLEND averages fast-marching (radius 2) and Navier-Stokes (radius 3) results;
 * SINGLE_FAST runs fast-marching only, with the configured radius.
 */
public enum InpaintingMode {
    CAREFUL_BLEND,
    SINGLE_FAST
}
