package com.museum.curation.pipeline;

import com.museum.curation.core.model.FieldCandidate;
import com.museum.curation.core.model.Recommendation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a stage produced for one record.
 *
 * @param candidates      provenance-carrying values, merged through the applier
 * @param derivedFields   deterministic values written directly (never null over non-null)
 * @param recommendations proposals that only a reviewer may apply
 */
public record StageOutput(
        List<FieldCandidate> candidates,
        Map<String, Object> derivedFields,
        List<Recommendation> recommendations
) {
    public StageOutput {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        derivedFields = derivedFields != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(derivedFields))
                : Map.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    public static StageOutput empty() {
        return new StageOutput(List.of(), Map.of(), List.of());
    }

    public static StageOutput of(List<FieldCandidate> candidates) {
        return new StageOutput(candidates, Map.of(), List.of());
    }

    public static StageOutput derived(Map<String, Object> derivedFields) {
        return new StageOutput(List.of(), derivedFields, List.of());
    }
}
