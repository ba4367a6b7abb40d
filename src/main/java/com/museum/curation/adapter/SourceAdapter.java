package com.museum.curation.adapter;

import com.museum.curation.pipeline.CostEstimate;

/**
 * Boundary to an external source (open data, encyclopedia, knowledge base, model judge).
 * Implementations turn raw payloads into {@code EnrichedField} candidates; the
 * curation core never sees the payloads. Timeouts and retries belong to the implementation.
 */
public interface SourceAdapter {

    /**
     * Stable adapter name, used in cache keys and logs.
     */
    String name();

    /**
     * Calls the source.
     *
     * @throws SourceException if the call fails
     */
    SourceResponse fetch(SourceRequest request);

    /**
     * Estimated cost of {@link #fetch}. Unpaid sources return {@link CostEstimate#free()}.
     */
    default CostEstimate estimateCost(SourceRequest request) {
        return CostEstimate.free();
    }
}
