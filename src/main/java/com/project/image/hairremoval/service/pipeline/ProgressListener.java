package com.project.image.hairremoval.service.pipeline;

/**
 * Synchronous progress sink. Called on the pipeline thread at every {@link PipelineCheckpoint};
 * implementations must return quickly. Exceptions thrown here are logged and ignored.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = checkpoint -> { };

    void onCheckpoint(PipelineCheckpoint checkpoint);
}
