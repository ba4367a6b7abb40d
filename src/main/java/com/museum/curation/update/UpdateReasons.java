package com.museum.curation.update;

/**
 * Rejection codes raised by the applier itself, before the merge engine is consulted.
 * Normalizer, domain and volatility codes live next to their rules.
 */
public final class UpdateReasons {

    public static final String UNKNOWN_FIELD = "unknown_field";
    public static final String MANUAL_OVERRIDE_NOT_ALLOWED = "manual_override_not_allowed";

    private UpdateReasons() {
    }
}
