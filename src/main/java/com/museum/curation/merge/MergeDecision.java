package com.museum.curation.merge;

import java.util.Objects;

/**
 * Whether a candidate may replace the stored value, and why.
 */
public record MergeDecision(boolean accepted, MergeReason reason) {

    public MergeDecision {
        Objects.requireNonNull(reason, "reason is required");
        if (accepted != reason.isAccepting()) {
            throw new IllegalArgumentException("reason " + reason + " does not match accepted=" + accepted);
        }
    }

    static MergeDecision accept(MergeReason reason) {
        return new MergeDecision(true, reason);
    }

    static MergeDecision reject(MergeReason reason) {
        return new MergeDecision(false, reason);
    }
}
