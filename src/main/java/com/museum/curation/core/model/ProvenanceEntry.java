package com.museum.curation.core.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Stored provenance of a field's current value.
 * {@code retrievedAt} is kept in its serialized form because sidecars written by
 * older tooling may hold missing or malformed timestamps; those parse as empty.
 *
 * @param source      origin of the stored value
 * @param trustLevel  trust of the origin
 * @param retrievedAt ISO-8601 timestamp as persisted, possibly null or malformed
 * @param confidence  confidence 1-5, null when the legacy entry had none
 */
public record ProvenanceEntry(
        String source,
        TrustLevel trustLevel,
        String retrievedAt,
        Integer confidence
) {
    public ProvenanceEntry {
        trustLevel = trustLevel != null ? trustLevel : TrustLevel.UNKNOWN;
    }

    /**
     * Builds the provenance recorded when a candidate is accepted.
     */
    public static ProvenanceEntry from(EnrichedField<?> field) {
        return new ProvenanceEntry(field.source(), field.trustLevel(),
                field.retrievedAt().toString(), field.confidence());
    }

    /**
     * Parses the stored timestamp. Zone-less timestamps are read as UTC.
     */
    public Optional<Instant> retrievedAtInstant() {
        if (retrievedAt == null || retrievedAt.isBlank()) {
            return Optional.empty();
        }
        String text = retrievedAt.trim();
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException ignored) {
            // not an instant, try with an explicit offset
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException ignored) {
            // no offset either, try a local timestamp
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
