package com.museum.curation.pipeline;

import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.core.model.ProvenanceEntry;
import com.museum.curation.store.PartitionSnapshot;

import java.util.List;
import java.util.Set;

/**
 * Read-only view a stage gets of the run: the partition being processed and the
 * records chosen for targeted stages.
 */
public class StageContext {

    private final String runId;
    private final PartitionSnapshot snapshot;
    private final Set<String> targets;
    private final RunOptions options;

    public StageContext(String runId, PartitionSnapshot snapshot, Set<String> targets, RunOptions options) {
        this.runId = runId;
        this.snapshot = snapshot;
        this.targets = targets != null ? Set.copyOf(targets) : Set.of();
        this.options = options;
    }

    public String getRunId() {
        return runId;
    }

    public String getPartitionId() {
        return snapshot.getPartitionId();
    }

    /**
     * All records of the partition, for stages that look at siblings.
     */
    public List<MuseumRecord> getPartitionRecords() {
        return snapshot.getRecords();
    }

    /**
     * Stored provenance of a field, or null when none was recorded.
     */
    public ProvenanceEntry getProvenance(String recordId, String fieldName) {
        return snapshot.getProvenance(recordId, fieldName);
    }

    public boolean isTarget(String recordId) {
        return targets.contains(recordId);
    }

    public RunOptions getOptions() {
        return options;
    }
}
