package com.museum.curation.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.museum.curation.update.FieldRejection;

import java.util.List;

/**
 * Field-level outcome of one stage on one record, as reported in {@code changes.json}.
 *
 * @param derivedFields deterministic fields written directly by the stage
 */
public record RecordChange(
        String partitionId,
        String recordId,
        StageName stage,
        List<String> appliedFields,
        List<FieldRejection> rejectedFields,
        List<String> derivedFields
) {
    public RecordChange {
        appliedFields = appliedFields != null ? List.copyOf(appliedFields) : List.of();
        rejectedFields = rejectedFields != null ? List.copyOf(rejectedFields) : List.of();
        derivedFields = derivedFields != null ? List.copyOf(derivedFields) : List.of();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return appliedFields.isEmpty() && rejectedFields.isEmpty() && derivedFields.isEmpty();
    }
}
