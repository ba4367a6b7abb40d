package com.museum.curation.merge;

/**
 * Outcome codes of a merge decision. The code is the stable string written to
 * run artifacts and the review queue.
 */
public enum MergeReason {
    CANNOT_REPLACE_KNOWN_WITH_NULL("cannot_replace_known_with_null", false),
    MANUAL_LOCK("manual_lock", false),
    PLACEHOLDER_BLOCKED("placeholder_blocked", false),
    NO_EXISTING_PROVENANCE("no_existing_provenance", true),
    HIGHER_TRUST("higher_trust", true),
    EQUAL_TRUST_NEWER("equal_trust_newer", true),
    EQUAL_TRUST_NO_TIMESTAMP("equal_trust_no_timestamp", true),
    LOWER_TRUST_OR_OLDER("lower_trust_or_older", false);

    private final String code;
    private final boolean accepting;

    MergeReason(String code, boolean accepting) {
        this.code = code;
        this.accepting = accepting;
    }

    public String getCode() {
        return code;
    }

    public boolean isAccepting() {
        return accepting;
    }

    @Override
    public String toString() {
        return code;
    }
}
