package com.museum.curation.update;

import com.museum.curation.core.model.Recommendation;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of applying one candidate batch to one record.
 *
 * @param recordId        the record the batch targeted
 * @param appliedFields   fields whose value and provenance were committed, in batch order
 * @param rejectedFields  rejections from every gate, in batch order
 * @param recommendations low-confidence candidates routed to human review
 */
public record ApplyResult(
        String recordId,
        List<String> appliedFields,
        List<FieldRejection> rejectedFields,
        List<Recommendation> recommendations
) {
    public ApplyResult {
        Objects.requireNonNull(recordId, "recordId is required");
        appliedFields = appliedFields != null ? List.copyOf(appliedFields) : List.of();
        rejectedFields = rejectedFields != null ? List.copyOf(rejectedFields) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public static ApplyResult empty(String recordId) {
        return new ApplyResult(recordId, List.of(), List.of(), List.of());
    }

    public boolean hasChanges() {
        return !appliedFields.isEmpty();
    }

    /**
     * Rejection reason for a field, or null when the field was not rejected.
     */
    public String reasonFor(String field) {
        return rejectedFields.stream()
                .filter(r -> r.field().equals(field))
                .map(FieldRejection::reason)
                .findFirst()
                .orElse(null);
    }
}
