package com.museum.curation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Provenance envelope for a candidate field value produced by a source adapter.
 * Immutable; invalid envelopes are rejected at construction time.
 *
 * @param value       the candidate value (may be null, which the merge engine treats as "no value")
 * @param source      specific origin, e.g. {@code wikidata} or {@code official_site}
 * @param trustLevel  reliability of the source
 * @param confidence  confidence in the value, 1 (lowest) to 5 (highest)
 * @param retrievedAt when the value was retrieved from the source
 */
public record EnrichedField<T>(
        T value,
        String source,
        TrustLevel trustLevel,
        int confidence,
        Instant retrievedAt
) {
    public static final int MIN_CONFIDENCE = 1;
    public static final int MAX_CONFIDENCE = 5;

    public EnrichedField {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(trustLevel, "trustLevel is required");
        if (source.isBlank()) {
            throw new IllegalArgumentException("source must not be blank");
        }
        if (confidence < MIN_CONFIDENCE || confidence > MAX_CONFIDENCE) {
            throw new IllegalArgumentException(
                    "confidence must be between " + MIN_CONFIDENCE + " and " + MAX_CONFIDENCE + ", was " + confidence);
        }
        retrievedAt = retrievedAt != null ? retrievedAt : Instant.now();
    }

    public static <T> EnrichedField<T> of(T value, String source, TrustLevel trustLevel, int confidence) {
        return new EnrichedField<>(value, source, trustLevel, confidence, Instant.now());
    }

    /**
     * Creates a manual override envelope. This is the only path that should
     * produce {@link TrustLevel#MANUAL_OVERRIDE}; it is reserved for human actions.
     */
    public static <T> EnrichedField<T> manualOverride(T value, String reviewerId, Instant at) {
        Objects.requireNonNull(reviewerId, "reviewerId is required");
        return new EnrichedField<>(value, "manual:" + reviewerId, TrustLevel.MANUAL_OVERRIDE, MAX_CONFIDENCE, at);
    }

    /**
     * Returns a copy carrying a different value, keeping all provenance.
     */
    public <R> EnrichedField<R> withValue(R newValue) {
        return new EnrichedField<>(newValue, source, trustLevel, confidence, retrievedAt);
    }

    public boolean isManualOverride() {
        return trustLevel == TrustLevel.MANUAL_OVERRIDE;
    }
}
