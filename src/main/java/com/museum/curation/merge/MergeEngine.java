package com.museum.curation.merge;

import com.museum.curation.core.model.EnrichedField;
import com.museum.curation.core.model.ProvenanceEntry;
import com.museum.curation.core.model.TrustLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Provenance-aware conflict resolution for a single field.
 *
 * <p>Rules are evaluated in a fixed order and the first one that applies wins:</p>
 * <ol>
 *   <li>null protection: an empty candidate never replaces a meaningful value</li>
 *   <li>manual lock: locked fields only accept {@link TrustLevel#MANUAL_OVERRIDE}</li>
 *   <li>placeholder tokens are blocked</li>
 *   <li>a field without provenance accepts the candidate</li>
 *   <li>strictly higher trust wins</li>
 *   <li>equal trust wins only with a strictly newer retrieval time
 *       (or when the stored time is missing or unparseable)</li>
 *   <li>everything else is rejected</li>
 * </ol>
 *
 * <p>The engine is stateless and reads no clock, so the same inputs always yield
 * the same outcome.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    /**
     * Decides whether {@code candidate} may replace the stored value.
     */
    public MergeDecision decide(Object currentValue, ProvenanceEntry currentProvenance,
                                EnrichedField<?> candidate, boolean manualLock) {
        Objects.requireNonNull(candidate, "candidate is required");

        if (Placeholders.isNullOrEmpty(candidate.value()) && Placeholders.isMeaningful(currentValue)) {
            return MergeDecision.reject(MergeReason.CANNOT_REPLACE_KNOWN_WITH_NULL);
        }

        if (manualLock && candidate.trustLevel().isBelow(TrustLevel.MANUAL_OVERRIDE)) {
            return MergeDecision.reject(MergeReason.MANUAL_LOCK);
        }

        if (Placeholders.isPlaceholder(candidate.value())) {
            return MergeDecision.reject(MergeReason.PLACEHOLDER_BLOCKED);
        }

        if (currentProvenance == null) {
            return MergeDecision.accept(MergeReason.NO_EXISTING_PROVENANCE);
        }

        TrustLevel storedTrust = currentProvenance.trustLevel();
        TrustLevel candidateTrust = candidate.trustLevel();

        if (candidateTrust.isHigherThan(storedTrust)) {
            return MergeDecision.accept(MergeReason.HIGHER_TRUST);
        }

        if (candidateTrust == storedTrust) {
            Optional<Instant> storedAt = currentProvenance.retrievedAtInstant();
            if (storedAt.isEmpty()) {
                return MergeDecision.accept(MergeReason.EQUAL_TRUST_NO_TIMESTAMP);
            }
            if (candidate.retrievedAt().isAfter(storedAt.get())) {
                return MergeDecision.accept(MergeReason.EQUAL_TRUST_NEWER);
            }
        }

        return MergeDecision.reject(MergeReason.LOWER_TRUST_OR_OLDER);
    }

    /**
     * Merges {@code candidate} into the field. Accepted candidates produce a fresh
     * provenance entry; rejected ones return the current value and provenance untouched.
     */
    public MergeOutcome merge(Object currentValue, ProvenanceEntry currentProvenance,
                              EnrichedField<?> candidate, boolean manualLock) {
        MergeDecision decision = decide(currentValue, currentProvenance, candidate, manualLock);
        if (!decision.accepted()) {
            log.trace("merge.rejected reason={} source={} trust={}",
                    decision.reason(), candidate.source(), candidate.trustLevel());
            return new MergeOutcome(currentValue, currentProvenance, decision.reason());
        }
        return new MergeOutcome(candidate.value(), ProvenanceEntry.from(candidate), decision.reason());
    }
}
