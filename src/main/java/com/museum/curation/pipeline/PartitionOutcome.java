package com.museum.curation.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * What happened to one partition during a run.
 *
 * @param stagesRun       stages that ran to completion on the partition
 * @param validationError prerequisite or load failure that stopped the partition, or null
 */
public record PartitionOutcome(
        String partitionId,
        int recordCount,
        List<StageName> stagesRun,
        String validationError
) {
    public PartitionOutcome {
        stagesRun = stagesRun != null ? List.copyOf(stagesRun) : List.of();
    }

    @JsonIgnore
    public boolean isValid() {
        return validationError == null;
    }
}
