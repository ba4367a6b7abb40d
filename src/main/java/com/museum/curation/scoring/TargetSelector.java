package com.museum.curation.scoring;

import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.rules.DomainEligibility;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Picks the records that receive the most expensive enrichment stage: the top N
 * eligible records by priority score (lower first, unscorable last), ties broken by
 * reputation, then collection tier, then record id.
 */
public class TargetSelector {

    private final PriorityScorer scorer;
    private final DomainEligibility eligibility;

    public TargetSelector() {
        this(new PriorityScorer(), DomainEligibility.defaults());
    }

    public TargetSelector(PriorityScorer scorer, DomainEligibility eligibility) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.eligibility = Objects.requireNonNull(eligibility, "eligibility is required");
    }

    /**
     * Returns the ids of the selected records in rank order.
     */
    public Set<String> selectTopN(Collection<MuseumRecord> records, int topN) {
        if (topN <= 0) {
            return Set.of();
        }
        List<Ranked> ranked = records.stream()
                .filter(r -> eligibility.isEligibleDomain(r.getPrimaryDomain()))
                .map(this::rank)
                .sorted(ORDER)
                .limit(topN)
                .toList();
        Set<String> ids = new LinkedHashSet<>();
        ranked.forEach(r -> ids.add(r.recordId()));
        return ids;
    }

    private Ranked rank(MuseumRecord record) {
        ScoreBreakdown breakdown = scoreQuietly(record);
        Integer reputation = breakdown.reputationPenalty() != null
                ? breakdown.reputationPenalty()
                : record.getInt(MuseumFields.REPUTATION).orElse(null);
        Integer collection = breakdown.collectionPenalty() != null
                ? breakdown.collectionPenalty()
                : record.getInt(MuseumFields.COLLECTION_TIER).orElse(null);
        return new Ranked(record.getRecordId(), breakdown.priorityScore(), reputation, collection);
    }

    /**
     * Out-of-range inputs rank as unscorable instead of aborting selection.
     */
    private ScoreBreakdown scoreQuietly(MuseumRecord record) {
        try {
            return scorer.score(record);
        } catch (IllegalArgumentException e) {
            return ScoreBreakdown.unscorable(record.getRecordId(), List.of(e.getMessage()));
        }
    }

    private static final Comparator<Ranked> ORDER = Comparator
            .comparing(Ranked::score, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Ranked::reputation, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Ranked::collectionTier, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Ranked::recordId);

    private record Ranked(String recordId, Integer score, Integer reputation, Integer collectionTier) {
    }
}
