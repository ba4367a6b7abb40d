package com.museum.curation.review;

import java.util.List;

/**
 * Queue of changes and failures waiting for a human decision.
 */
public interface ReviewQueue {

    ReviewItem submit(ReviewItem item);

    /**
     * Pending items in submission order.
     */
    List<ReviewItem> getPending();

    List<ReviewItem> getPendingForRecord(String recordId);

    /**
     * Every item ever submitted, in submission order.
     */
    List<ReviewItem> getAll();

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void approve(String reviewId, String reviewerId, String notes);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void reject(String reviewId, String reviewerId, String notes);

    /**
     * @return the item, or null if not found
     */
    ReviewItem get(String reviewId);

    long countPending();
}
