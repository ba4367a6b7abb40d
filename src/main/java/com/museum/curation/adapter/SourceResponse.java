package com.museum.curation.adapter;

import com.museum.curation.core.model.FieldCandidate;
import com.museum.curation.core.model.Recommendation;

import java.util.List;

/**
 * What a source returned: field candidates to merge and recommendations for review.
 */
public record SourceResponse(List<FieldCandidate> candidates, List<Recommendation> recommendations) {

    public SourceResponse {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public static SourceResponse of(List<FieldCandidate> candidates) {
        return new SourceResponse(candidates, List.of());
    }

    public static SourceResponse empty() {
        return new SourceResponse(List.of(), List.of());
    }

    public boolean isEmpty() {
        return candidates.isEmpty() && recommendations.isEmpty();
    }
}
