package com.museum.curation.rules;

/**
 * Canonicalizes the value of one field before it reaches the merge engine.
 */
@FunctionalInterface
public interface FieldNormalizer {

    /**
     * Normalizes a candidate value.
     *
     * @param value the raw candidate value, possibly null
     * @return the canonical value, or a failure carrying a reason code
     */
    NormalizationResult normalize(Object value);
}
