package com.museum.curation.pipeline;

import com.museum.curation.core.model.MuseumRecord;

/**
 * One enrichment step, called by the orchestrator once per record.
 */
public interface PipelineStage {

    StageName name();

    /**
     * Whether the stage has anything to do for this record. Skipped records are
     * neither processed nor counted.
     */
    default boolean appliesTo(MuseumRecord record, StageContext context) {
        return true;
    }

    /**
     * Cost of {@link #process} for this record, checked against the budget before the call.
     */
    default CostEstimate estimateCost(MuseumRecord record) {
        return CostEstimate.free();
    }

    /**
     * When true, only the run's top-N targets receive this stage.
     */
    default boolean isTargeted() {
        return false;
    }

    /**
     * @throws StageException if the underlying source call fails
     */
    StageOutput process(MuseumRecord record, StageContext context);

    /**
     * Whether the record already carries this stage's outputs. The next stage's
     * prerequisite check counts these.
     */
    boolean hasOutput(MuseumRecord record);
}
