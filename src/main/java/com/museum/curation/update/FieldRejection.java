package com.museum.curation.update;

import java.util.Objects;

/**
 * A candidate the applier did not commit, with the gate's reason code.
 *
 * @param field         field name of the candidate
 * @param reason        reason code, e.g. {@code low_confidence} or a merge reason
 * @param proposedValue the candidate value as proposed (before normalization)
 */
public record FieldRejection(String field, String reason, Object proposedValue) {

    public FieldRejection {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(reason, "reason is required");
    }
}
