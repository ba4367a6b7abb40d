package com.museum.curation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TrustLevel")
class TrustLevelTest {

    @Test
    @DisplayName("Ranks order sources from guesses to manual overrides")
    void ranks() {
        assertEquals(0, TrustLevel.UNKNOWN.getRank());
        assertEquals(3, TrustLevel.ENCYCLOPEDIA_SUMMARY.getRank());
        assertEquals(6, TrustLevel.OFFICIAL_STRUCTURED_DATA.getRank());
        assertEquals(10, TrustLevel.MANUAL_OVERRIDE.getRank());
        assertTrue(TrustLevel.KNOWLEDGE_BASE.isHigherThan(TrustLevel.ENCYCLOPEDIA_SUMMARY));
        assertTrue(TrustLevel.MODEL_EXTRACTED.isBelow(TrustLevel.ENCYCLOPEDIA_SUMMARY));
        assertTrue(TrustLevel.ENCYCLOPEDIA_SUMMARY.isAtLeast(TrustLevel.ENCYCLOPEDIA_SUMMARY));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "4, KNOWLEDGE_BASE",
            "' 10 ', MANUAL_OVERRIDE",
            "official_source_extract, OFFICIAL_SOURCE_EXTRACT",
            "7, UNKNOWN",
            "trusted, UNKNOWN",
            "'', UNKNOWN"
    })
    @DisplayName("Persisted values parse from ranks or names")
    void parse(String raw, TrustLevel expected) {
        assertEquals(expected, TrustLevel.parse(raw));
    }

    @Test
    @DisplayName("Numbers and nulls parse too")
    void parseObjects() {
        assertEquals(TrustLevel.MODEL_GUESS, TrustLevel.parse(1));
        assertEquals(TrustLevel.MODEL_EXTRACTED, TrustLevel.parse(2.0));
        assertEquals(TrustLevel.UNKNOWN, TrustLevel.parse(null));
        assertEquals(TrustLevel.UNKNOWN, TrustLevel.fromRank(-1));
    }
}
