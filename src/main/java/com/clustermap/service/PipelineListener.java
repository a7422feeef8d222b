package com.clustermap.service;

import com.clustermap.model.FitRecord;
import com.clustermap.model.MergeEvent;
import com.clustermap.model.PipelineStage;

/**
 * Progress callbacks for whatever front end drives the pipeline. The engine itself only
 * logs; user-facing status goes through this interface. Callbacks arrive on the thread
 * that runs the stage.
 */
public interface PipelineListener {

    PipelineListener NONE = new PipelineListener() {};

    default void stageStarted(PipelineStage stage) {}

    default void stageCompleted(PipelineStage stage, String summary) {}

    default void regionMerged(MergeEvent merge) {}

    /**
     * @param completed records written so far in this run
     * @param total     regions submitted in this run
     */
    default void regionFitted(FitRecord record, int completed, int total) {}
}
