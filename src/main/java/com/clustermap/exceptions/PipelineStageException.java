package com.clustermap.exceptions;

import com.clustermap.model.PipelineStage;

/**
 * Fatal failure of one pipeline stage. Carries the stage so the caller can report which
 * of the seven stages stopped the run.
 */
public class PipelineStageException extends Exception {

    private final PipelineStage stage;

    public PipelineStageException(PipelineStage stage, String message) {
        super(stage + ": " + message);
        this.stage = stage;
    }

    public PipelineStageException(PipelineStage stage, String message, Throwable cause) {
        super(stage + ": " + message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
