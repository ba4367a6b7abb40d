package com.museum.curation.review;

/**
 * Why an item entered the review queue.
 */
public enum ReviewKind {
    /** A field candidate that failed auto-apply gating, e.g. low confidence. */
    FIELD_REJECTION,
    /** A source-flagged change that is never auto-applied. */
    RECOMMENDATION,
    /** A stage call that failed for one record. */
    STAGE_FAILURE
}
