package com.museum.curation.scoring;

import java.util.List;

/**
 * Every component of a priority computation. When {@link #missingInputs()} is
 * non-empty the record could not be scored and all computed values are null.
 *
 * @param recordId             scored record
 * @param primaryStrength      max of the two art strengths
 * @param artComponent         (6 - primaryStrength) * 3
 * @param historyComponent     (6 - historical context) * 2
 * @param reputationPenalty    0 (international) to 3 (local)
 * @param collectionPenalty    0 (flagship) to 3 (small)
 * @param dualStrengthBonus    2 when both strengths are at least 4
 * @param clusterBonus         1 when three or more museums share the city
 * @param priorityScore        lower means higher visit priority
 * @param overallQualityScore  higher means a stronger museum overall
 * @param primaryArt           label of the stronger art focus
 * @param missingInputs        required inputs that were absent
 */
public record ScoreBreakdown(
        String recordId,
        Integer primaryStrength,
        Integer artComponent,
        Integer historyComponent,
        Integer reputationPenalty,
        Integer collectionPenalty,
        int dualStrengthBonus,
        int clusterBonus,
        Integer priorityScore,
        Integer overallQualityScore,
        String primaryArt,
        List<String> missingInputs
) {
    public ScoreBreakdown {
        missingInputs = missingInputs != null ? List.copyOf(missingInputs) : List.of();
    }

    static ScoreBreakdown unscorable(String recordId, List<String> missingInputs) {
        return new ScoreBreakdown(recordId, null, null, null, null, null, 0, 0,
                null, null, null, missingInputs);
    }

    public boolean isScored() {
        return priorityScore != null;
    }
}
