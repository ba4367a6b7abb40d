package com.museum.curation.audit;

/**
 * Types of auditable actions in a curation run.
 */
public enum AuditAction {
    RUN_STARTED,
    RUN_FINISHED,
    FIELD_APPLIED,
    FIELD_REJECTED,
    RECOMMENDATION_QUEUED,
    STAGE_FAILED,
    MANUAL_OVERRIDE_APPLIED
}
