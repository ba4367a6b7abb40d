package com.museum.curation.rules;

/**
 * Outcome of normalizing one field value.
 *
 * @param value         the canonical value, or the original value when normalization failed
 * @param failureReason null on success, otherwise the rejection reason code
 */
public record NormalizationResult(Object value, String failureReason) {

    public static NormalizationResult ok(Object value) {
        return new NormalizationResult(value, null);
    }

    public static NormalizationResult failed(Object original, String reason) {
        return new NormalizationResult(original, reason);
    }

    public boolean isValid() {
        return failureReason == null;
    }
}
