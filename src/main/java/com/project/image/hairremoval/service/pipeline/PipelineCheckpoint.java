package com.project.image.hairremoval.service.pipeline;

/** Fixed points at which a run reports progress, with the share of work done so far. */
public enum PipelineCheckpoint {
    ENHANCEMENT_DONE(10, "Enhancement done"),
    THRESHOLDING_DONE(30, "Thresholding done"),
    CLEANING_DONE(50, "Cleaning done"),
    INPAINTING_STARTED(60, "Inpainting..."),
    INPAINTING_DONE(75, "Inpainting done"),
    SELECTIVE_ENHANCEMENT_DONE(90, "Final enhancement..."),
    COMPLETE(100, "Complete");

    private final int percent;
    private final String label;

    PipelineCheckpoint(int percent, String label) {
        this.percent = percent;
        this.label = label;
    }

    public int percent() { return percent; }

    public String label() { return label; }
}
