package com.museum.curation.rules;

import com.museum.curation.core.model.EnrichedField;
import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.TrustLevel;

import java.util.Objects;
import java.util.Set;

/**
 * Stricter auto-apply bar for high-churn fields (subjective scores, tier labels,
 * visit-duration estimates). Such a field auto-applies only when its source is
 * trusted at least {@link #minimumTrust()} and its confidence meets the run's threshold.
 *
 * @param highChurnFields fields subject to the bar
 * @param minimumTrust    lowest trust level allowed to auto-apply
 */
public record VolatilityPolicy(Set<String> highChurnFields, TrustLevel minimumTrust) {

    public static final String LOW_CONFIDENCE = "low_confidence";

    public VolatilityPolicy {
        Objects.requireNonNull(minimumTrust, "minimumTrust is required");
        highChurnFields = highChurnFields != null ? Set.copyOf(highChurnFields) : Set.of();
    }

    public static VolatilityPolicy defaults() {
        return new VolatilityPolicy(MuseumFields.HIGH_CHURN_FIELDS, TrustLevel.ENCYCLOPEDIA_SUMMARY);
    }

    public static VolatilityPolicy of(Set<String> highChurnFields) {
        return new VolatilityPolicy(highChurnFields, TrustLevel.ENCYCLOPEDIA_SUMMARY);
    }

    public boolean isHighChurn(String fieldName) {
        return highChurnFields.contains(fieldName);
    }

    /**
     * Returns true when the candidate may auto-apply for this field.
     */
    public boolean allowsAutoApply(String fieldName, EnrichedField<?> candidate, int confidenceThreshold) {
        if (!isHighChurn(fieldName)) {
            return true;
        }
        return candidate.trustLevel().isAtLeast(minimumTrust)
                && candidate.confidence() >= confidenceThreshold;
    }
}
