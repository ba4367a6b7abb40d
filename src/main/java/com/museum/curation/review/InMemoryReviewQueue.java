package com.museum.curation.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ReviewQueue}.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();
    private final List<ReviewItem> order = new CopyOnWriteArrayList<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        if (items.putIfAbsent(item.getId(), item) == null) {
            order.add(item);
        }
        log.debug("Submitted review item {} (kind={}, record={}, field={}, reason={})",
                item.getId(), item.getKind(), item.getRecordId(), item.getFieldName(), item.getReason());
        return item;
    }

    @Override
    public List<ReviewItem> getPending() {
        return order.stream().filter(ReviewItem::isPending).toList();
    }

    @Override
    public List<ReviewItem> getPendingForRecord(String recordId) {
        return order.stream()
                .filter(ReviewItem::isPending)
                .filter(item -> recordId.equals(item.getRecordId()))
                .toList();
    }

    @Override
    public List<ReviewItem> getAll() {
        return new ArrayList<>(order);
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        ReviewItem item = pendingItem(reviewId);
        item.markApproved(reviewerId, notes);
        log.info("Review item {} approved by {}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        ReviewItem item = pendingItem(reviewId);
        item.markRejected(reviewerId, notes);
        log.info("Review item {} rejected by {}", reviewId, reviewerId);
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem pendingItem(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }
}
