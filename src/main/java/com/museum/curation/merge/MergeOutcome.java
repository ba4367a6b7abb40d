package com.museum.curation.merge;

import com.museum.curation.core.model.ProvenanceEntry;

import java.util.Objects;

/**
 * Result of merging one candidate into one field.
 * On rejection {@code value} and {@code provenance} are the unchanged inputs, so
 * callers must consult {@link #accepted()} rather than compare values.
 */
public record MergeOutcome(Object value, ProvenanceEntry provenance, MergeReason reason) {

    public MergeOutcome {
        Objects.requireNonNull(reason, "reason is required");
    }

    public boolean accepted() {
        return reason.isAccepting();
    }

    public boolean rejected() {
        return !reason.isAccepting();
    }
}
