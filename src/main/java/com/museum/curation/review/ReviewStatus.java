package com.museum.curation.review;

/**
 * Status of a review item.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
