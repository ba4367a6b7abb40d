package com.museum.curation.drift;

import java.util.List;

/**
 * Result of comparing the store with a gold set.
 *
 * @param recordsChecked gold records found in the store
 * @param recordsSkipped gold records absent from the store
 * @param fieldsChecked  total fields compared
 * @param fieldsDrifted  fields whose value differed
 * @param driftRate      drifted / checked, 0 when nothing was checked
 * @param diffs          one entry per drifted field
 */
public record DriftReport(
        int recordsChecked,
        List<String> recordsSkipped,
        int fieldsChecked,
        int fieldsDrifted,
        double driftRate,
        List<DriftDiff> diffs
) {
    public static final double DEFAULT_THRESHOLD = 0.02;

    public DriftReport {
        recordsSkipped = recordsSkipped != null ? List.copyOf(recordsSkipped) : List.of();
        diffs = diffs != null ? List.copyOf(diffs) : List.of();
    }

    /**
     * True when the drift rate is strictly above the threshold.
     */
    public boolean exceeds(double threshold) {
        return driftRate > threshold;
    }
}
