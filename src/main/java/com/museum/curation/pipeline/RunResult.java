package com.museum.curation.pipeline;

import com.museum.curation.drift.DriftReport;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Typed outcome of a curation run. Aborts are reported through {@link #status()},
 * never thrown.
 *
 * @param abortReason       why the run stopped early, null when completed
 * @param changes           per-record, per-stage field outcomes
 * @param driftReport       gold-set comparison, null when the check did not run
 * @param driftError        why the gold set could not be evaluated, or null
 * @param artifactDirectory where artifacts were written, null when none were
 * @param artifactErrors    artifacts that failed to write
 */
public record RunResult(
        String runId,
        RunStatus status,
        String abortReason,
        Instant startedAt,
        Instant finishedAt,
        List<PartitionOutcome> partitions,
        List<RecordChange> changes,
        double budgetTotal,
        double budgetSpent,
        int recordsProcessed,
        int recordsFailed,
        int reviewItemsQueued,
        DriftReport driftReport,
        String driftError,
        boolean indexRebuilt,
        boolean dryRun,
        String artifactDirectory,
        List<String> artifactErrors
) {
    public RunResult {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(status, "status is required");
        partitions = partitions != null ? List.copyOf(partitions) : List.of();
        changes = changes != null ? List.copyOf(changes) : List.of();
        artifactErrors = artifactErrors != null ? List.copyOf(artifactErrors) : List.of();
    }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    public double budgetRemaining() {
        return Math.max(0.0, budgetTotal - budgetSpent);
    }

    public double failureRate() {
        return recordsProcessed == 0 ? 0.0 : (double) recordsFailed / recordsProcessed;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public List<PartitionOutcome> failedPartitions() {
        return partitions.stream().filter(p -> !p.isValid()).toList();
    }

    @Override
    public String toString() {
        return "RunResult{" +
                "runId='" + runId + '\'' +
                ", status=" + status +
                ", partitions=" + partitions.size() +
                ", changes=" + changes.size() +
                ", spent=" + budgetSpent +
                ", processed=" + recordsProcessed +
                ", failed=" + recordsFailed +
                ", dryRun=" + dryRun +
                '}';
    }
}
