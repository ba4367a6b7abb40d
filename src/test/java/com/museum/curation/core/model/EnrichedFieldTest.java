package com.museum.curation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EnrichedField")
class EnrichedFieldTest {

    private static final Instant AT = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    @DisplayName("Confidence must be between 1 and 5")
    void confidenceRange() {
        assertThrows(IllegalArgumentException.class,
                () -> EnrichedField.of("Denver", "wikipedia", TrustLevel.ENCYCLOPEDIA_SUMMARY, 0));
        assertThrows(IllegalArgumentException.class,
                () -> EnrichedField.of("Denver", "wikipedia", TrustLevel.ENCYCLOPEDIA_SUMMARY, 6));
        assertEquals(5, EnrichedField.of("Denver", "wikipedia", TrustLevel.ENCYCLOPEDIA_SUMMARY, 5).confidence());
    }

    @Test
    @DisplayName("A source is required")
    void sourceRequired() {
        assertThrows(NullPointerException.class, () -> EnrichedField.of("Denver", null, TrustLevel.UNKNOWN, 3));
        assertThrows(IllegalArgumentException.class, () -> EnrichedField.of("Denver", " ", TrustLevel.UNKNOWN, 3));
    }

    @Test
    @DisplayName("Manual overrides carry the reviewer, top trust and full confidence")
    void manualOverride() {
        EnrichedField<String> field = EnrichedField.manualOverride("National", "curator", AT);

        assertEquals("manual:curator", field.source());
        assertEquals(TrustLevel.MANUAL_OVERRIDE, field.trustLevel());
        assertEquals(5, field.confidence());
        assertEquals(AT, field.retrievedAt());
        assertTrue(field.isManualOverride());
    }

    @Test
    @DisplayName("withValue keeps provenance and provenance entries mirror it")
    void withValue() {
        EnrichedField<String> field = new EnrichedField<>("denverartmuseum.org", "imls",
                TrustLevel.OFFICIAL_STRUCTURED_DATA, 5, AT);

        EnrichedField<String> normalized = field.withValue("https://denverartmuseum.org");
        ProvenanceEntry entry = ProvenanceEntry.from(normalized);

        assertEquals("imls", normalized.source());
        assertEquals(AT, normalized.retrievedAt());
        assertEquals(TrustLevel.OFFICIAL_STRUCTURED_DATA, entry.trustLevel());
        assertEquals(Optional.of(AT), entry.retrievedAtInstant());
    }

    @Test
    @DisplayName("Provenance timestamps accept offsets and local times as UTC")
    void provenanceTimestamps() {
        assertEquals(Optional.of(AT),
                new ProvenanceEntry("x", null, "2024-06-01T14:00:00+02:00", null).retrievedAtInstant());
        assertEquals(Optional.of(AT),
                new ProvenanceEntry("x", null, "2024-06-01T12:00:00", null).retrievedAtInstant());
        assertEquals(Optional.empty(), new ProvenanceEntry("x", null, " ", null).retrievedAtInstant());
        assertEquals(TrustLevel.UNKNOWN, new ProvenanceEntry("x", null, null, null).trustLevel());
    }
}
