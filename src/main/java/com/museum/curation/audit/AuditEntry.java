package com.museum.curation.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One decision or lifecycle event in the curation trail.
 *
 * @param runId       run that produced the entry, null outside a run
 * @param partitionId partition being processed, null for run-level events
 * @param recordId    museum record concerned, null for run-level events
 * @param details     decision details in insertion order
 */
public record AuditEntry(
        String id,
        String runId,
        String partitionId,
        AuditAction action,
        String recordId,
        String actorId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public boolean isFieldDecision() {
        return action == AuditAction.FIELD_APPLIED
                || action == AuditAction.FIELD_REJECTED
                || action == AuditAction.MANUAL_OVERRIDE_APPLIED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String runId;
        private String partitionId;
        private AuditAction action;
        private String recordId;
        private String actorId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder partitionId(String partitionId) {
            this.partitionId = partitionId;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, runId, partitionId, action, recordId, actorId, details, timestamp);
        }
    }
}
