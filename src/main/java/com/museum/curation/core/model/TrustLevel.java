package com.museum.curation.core.model;

/**
 * Hierarchy of source reliability for field-level provenance.
 * Declaration order is the trust order, lowest first.
 *
 * <p>The numeric rank is what gets persisted in provenance sidecars. Ranks
 * leave a gap below {@link #MANUAL_OVERRIDE} so new automated sources can be
 * slotted in without renumbering stored data.</p>
 */
public enum TrustLevel {
    UNKNOWN(0),
    MODEL_GUESS(1),
    MODEL_EXTRACTED(2),
    ENCYCLOPEDIA_SUMMARY(3),
    KNOWLEDGE_BASE(4),
    OFFICIAL_SOURCE_EXTRACT(5),
    OFFICIAL_STRUCTURED_DATA(6),
    MANUAL_OVERRIDE(10);

    private final int rank;

    TrustLevel(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isHigherThan(TrustLevel other) {
        return rank > other.rank;
    }

    public boolean isAtLeast(TrustLevel other) {
        return rank >= other.rank;
    }

    public boolean isBelow(TrustLevel other) {
        return rank < other.rank;
    }

    /**
     * Resolves a persisted rank. Unrecognized ranks map to {@link #UNKNOWN}.
     */
    public static TrustLevel fromRank(int rank) {
        for (TrustLevel level : values()) {
            if (level.rank == rank) {
                return level;
            }
        }
        return UNKNOWN;
    }

    /**
     * Resolves a persisted value that may be a rank (number or numeric string)
     * or an enum name. Anything unrecognized maps to {@link #UNKNOWN}.
     */
    public static TrustLevel parse(Object raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        if (raw instanceof TrustLevel level) {
            return level;
        }
        if (raw instanceof Number number) {
            return fromRank(number.intValue());
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return UNKNOWN;
        }
        try {
            return fromRank(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            for (TrustLevel level : values()) {
                if (level.name().equalsIgnoreCase(text)) {
                    return level;
                }
            }
            return UNKNOWN;
        }
    }
}
