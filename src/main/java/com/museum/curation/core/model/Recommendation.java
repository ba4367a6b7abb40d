package com.museum.curation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A proposed change that did not pass auto-apply gating, or that a source flagged
 * for human review. Carries the candidate's provenance plus a readable reason.
 * Recommendations are consumed by the review queue and never auto-applied.
 */
public record Recommendation(
        String recordId,
        String fieldName,
        Object currentValue,
        Object proposedValue,
        String reason,
        int confidence,
        String evidence,
        String source,
        TrustLevel trustLevel,
        Instant retrievedAt
) {
    public Recommendation {
        Objects.requireNonNull(fieldName, "fieldName is required");
        Objects.requireNonNull(reason, "reason is required");
        trustLevel = trustLevel != null ? trustLevel : TrustLevel.UNKNOWN;
        retrievedAt = retrievedAt != null ? retrievedAt : Instant.now();
    }

    /**
     * Builds a recommendation from a candidate the applier refused to auto-apply.
     */
    public static Recommendation fromCandidate(String recordId, FieldCandidate candidate,
                                               Object currentValue, String reason) {
        EnrichedField<?> field = candidate.field();
        return new Recommendation(recordId, candidate.fieldName(), currentValue, field.value(), reason,
                field.confidence(), null, field.source(), field.trustLevel(), field.retrievedAt());
    }

    public Recommendation withRecordId(String id) {
        return new Recommendation(id, fieldName, currentValue, proposedValue, reason, confidence,
                evidence, source, trustLevel, retrievedAt);
    }
}
