package com.museum.curation.review;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.museum.curation.core.model.Recommendation;
import com.museum.curation.core.model.TrustLevel;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An entry of the review queue: either a proposed field change waiting for a human
 * decision, or a failed stage call to investigate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReviewItem {

    private final String id;
    private final ReviewKind kind;
    private final String partitionId;
    private final String recordId;
    private final String stage;
    private final String fieldName;
    private final Object currentValue;
    private final Object proposedValue;
    private final String reason;
    private final String source;
    private final TrustLevel trustLevel;
    private final Integer confidence;
    private final String evidence;
    private ReviewStatus status;
    private final Instant submittedAt;
    private Instant reviewedAt;
    private String reviewerId;
    private String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.recordId = Objects.requireNonNull(builder.recordId, "recordId is required");
        this.reason = Objects.requireNonNull(builder.reason, "reason is required");
        this.partitionId = builder.partitionId;
        this.stage = builder.stage;
        this.fieldName = builder.fieldName;
        this.currentValue = builder.currentValue;
        this.proposedValue = builder.proposedValue;
        this.source = builder.source;
        this.trustLevel = builder.trustLevel;
        this.confidence = builder.confidence;
        this.evidence = builder.evidence;
        this.status = builder.status != null ? builder.status : ReviewStatus.PENDING;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        if (kind != ReviewKind.STAGE_FAILURE && fieldName == null) {
            throw new IllegalArgumentException("fieldName is required for " + kind);
        }
    }

    /**
     * Item for a candidate the applier routed to review, or a source recommendation.
     */
    public static ReviewItem forRecommendation(String partitionId, String stage, ReviewKind kind,
                                               Recommendation recommendation) {
        return builder()
                .kind(kind)
                .partitionId(partitionId)
                .stage(stage)
                .recordId(recommendation.recordId())
                .fieldName(recommendation.fieldName())
                .currentValue(recommendation.currentValue())
                .proposedValue(recommendation.proposedValue())
                .reason(recommendation.reason())
                .source(recommendation.source())
                .trustLevel(recommendation.trustLevel())
                .confidence(recommendation.confidence())
                .evidence(recommendation.evidence())
                .build();
    }

    public static ReviewItem forStageFailure(String partitionId, String recordId, String stage, String reason) {
        return builder()
                .kind(ReviewKind.STAGE_FAILURE)
                .partitionId(partitionId)
                .recordId(recordId)
                .stage(stage)
                .reason(reason)
                .build();
    }

    public String getId() {
        return id;
    }

    public ReviewKind getKind() {
        return kind;
    }

    public String getPartitionId() {
        return partitionId;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getStage() {
        return stage;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Object getCurrentValue() {
        return currentValue;
    }

    public Object getProposedValue() {
        return proposedValue;
    }

    public String getReason() {
        return reason;
    }

    public String getSource() {
        return source;
    }

    public TrustLevel getTrustLevel() {
        return trustLevel;
    }

    public Integer getConfidence() {
        return confidence;
    }

    public String getEvidence() {
        return evidence;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    /**
     * True for items that carry a field value a reviewer can approve into the record.
     */
    @JsonIgnore
    public boolean isApplicable() {
        return kind != ReviewKind.STAGE_FAILURE;
    }

    void markApproved(String reviewerId, String notes) {
        this.status = ReviewStatus.APPROVED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    void markRejected(String reviewerId, String notes) {
        this.status = ReviewStatus.REJECTED;
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                ", recordId='" + recordId + '\'' +
                ", field=" + fieldName +
                ", reason='" + reason + '\'' +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ReviewKind kind;
        private String partitionId;
        private String recordId;
        private String stage;
        private String fieldName;
        private Object currentValue;
        private Object proposedValue;
        private String reason;
        private String source;
        private TrustLevel trustLevel;
        private Integer confidence;
        private String evidence;
        private ReviewStatus status;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(ReviewKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder partitionId(String partitionId) {
            this.partitionId = partitionId;
            return this;
        }

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder stage(String stage) {
            this.stage = stage;
            return this;
        }

        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder currentValue(Object currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder proposedValue(Object proposedValue) {
            this.proposedValue = proposedValue;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder trustLevel(TrustLevel trustLevel) {
            this.trustLevel = trustLevel;
            return this;
        }

        public Builder confidence(Integer confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder evidence(String evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder status(ReviewStatus status) {
            this.status = status;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
