package com.museum.curation.core.model;

import java.util.Objects;

/**
 * A candidate value for one named field of a record.
 */
public record FieldCandidate(String fieldName, EnrichedField<?> field) {

    public FieldCandidate {
        Objects.requireNonNull(fieldName, "fieldName is required");
        Objects.requireNonNull(field, "field is required");
    }

    public static FieldCandidate of(String fieldName, Object value, String source, TrustLevel trust, int confidence) {
        return new FieldCandidate(fieldName, EnrichedField.of(value, source, trust, confidence));
    }

    public Object value() {
        return field.value();
    }
}
