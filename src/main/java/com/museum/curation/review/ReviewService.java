package com.museum.curation.review;

import com.museum.curation.audit.AuditAction;
import com.museum.curation.audit.AuditService;
import com.museum.curation.core.model.Recommendation;
import com.museum.curation.update.ApplyOptions;
import com.museum.curation.update.ApplyResult;
import com.museum.curation.update.RecordUpdateApplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Coordinates the review queue with the audit trail and the applier.
 * Approving a field item writes the proposed value as a manual override.
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final RecordUpdateApplier applier;
    private final AuditService auditService;
    private final ApplyOptions overrideOptions;

    public ReviewService(ReviewQueue reviewQueue, RecordUpdateApplier applier, AuditService auditService) {
        this(reviewQueue, applier, auditService, ApplyOptions.defaults());
    }

    /**
     * @param overrideOptions options approved values are applied with; their domain
     *                        eligibility should match the one automated runs use
     */
    public ReviewService(ReviewQueue reviewQueue, RecordUpdateApplier applier, AuditService auditService,
                         ApplyOptions overrideOptions) {
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue is required");
        this.applier = applier;
        this.auditService = auditService != null ? auditService : new AuditService();
        this.overrideOptions = overrideOptions != null ? overrideOptions : ApplyOptions.defaults();
    }

    public ReviewItem submitRecommendation(String partitionId, String stage, ReviewKind kind,
                                           Recommendation recommendation) {
        ReviewItem submitted = reviewQueue.submit(
                ReviewItem.forRecommendation(partitionId, stage, kind, recommendation));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reviewItemId", submitted.getId());
        details.put("field", submitted.getFieldName());
        details.put("reason", submitted.getReason());
        details.put("stage", stage);
        auditService.record(AuditAction.RECOMMENDATION_QUEUED, submitted.getRecordId(), "SYSTEM", details);
        log.debug("review.submitted reviewItemId={} recordId={} field={} reason={}",
                submitted.getId(), submitted.getRecordId(), submitted.getFieldName(), submitted.getReason());
        return submitted;
    }

    public ReviewItem submitStageFailure(String partitionId, String recordId, String stage, String reason) {
        ReviewItem submitted = reviewQueue.submit(ReviewItem.forStageFailure(partitionId, recordId, stage, reason));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reviewItemId", submitted.getId());
        details.put("stage", stage);
        details.put("reason", reason);
        auditService.record(AuditAction.STAGE_FAILED, recordId, "SYSTEM", details);
        return submitted;
    }

    /**
     * Approves an item. For field items the proposed value is applied to the stored
     * partition with manual-override trust; stage failures are only marked approved.
     *
     * @param lockAfter whether the approved field is locked against automated updates
     */
    public ApplyResult approve(String reviewId, String reviewerId, String notes, boolean lockAfter) {
        ReviewItem item = requireItem(reviewId);
        reviewQueue.approve(reviewId, reviewerId, notes);

        if (!item.isApplicable()) {
            return ApplyResult.empty(item.getRecordId());
        }
        if (applier == null || item.getPartitionId() == null) {
            throw new IllegalStateException("Cannot apply review item " + reviewId + ": no partition or applier");
        }
        ApplyResult result = applier.applyManualOverride(item.getPartitionId(), item.getRecordId(),
                item.getFieldName(), item.getProposedValue(), reviewerId, lockAfter, overrideOptions);
        log.info("review.approved reviewItemId={} recordId={} field={} applied={}",
                reviewId, item.getRecordId(), item.getFieldName(), result.hasChanges());
        return result;
    }

    public void reject(String reviewId, String reviewerId, String notes) {
        ReviewItem item = requireItem(reviewId);
        reviewQueue.reject(reviewId, reviewerId, notes);
        log.info("review.rejected reviewItemId={} recordId={} field={}",
                reviewId, item.getRecordId(), item.getFieldName());
    }

    public ReviewQueue getQueue() {
        return reviewQueue;
    }

    private ReviewItem requireItem(String reviewId) {
        ReviewItem item = reviewQueue.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }
}
