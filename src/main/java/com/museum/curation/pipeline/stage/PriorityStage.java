package com.museum.curation.pipeline.stage;

import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.pipeline.PipelineStage;
import com.museum.curation.pipeline.StageContext;
import com.museum.curation.pipeline.StageException;
import com.museum.curation.pipeline.StageName;
import com.museum.curation.pipeline.StageOutput;
import com.museum.curation.rules.DomainEligibility;
import com.museum.curation.scoring.PriorityScorer;
import com.museum.curation.scoring.ScoreBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the priority score and its companions as derived fields on art records.
 * Records missing a scoring input get nothing; an existing score is never cleared.
 */
public class PriorityStage implements PipelineStage {
    private static final Logger log = LoggerFactory.getLogger(PriorityStage.class);

    private final PriorityScorer scorer;
    private final DomainEligibility eligibility;

    public PriorityStage() {
        this(new PriorityScorer(), DomainEligibility.defaults());
    }

    public PriorityStage(PriorityScorer scorer, DomainEligibility eligibility) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.eligibility = Objects.requireNonNull(eligibility, "eligibility is required");
    }

    @Override
    public StageName name() {
        return StageName.PRIORITY_CALCULATION;
    }

    @Override
    public boolean appliesTo(MuseumRecord record, StageContext context) {
        return eligibility.isEligibleDomain(record.getPrimaryDomain());
    }

    /**
     * @throws StageException if a scoring input is out of range
     */
    @Override
    public StageOutput process(MuseumRecord record, StageContext context) {
        ScoreBreakdown breakdown;
        try {
            breakdown = scorer.score(record);
        } catch (IllegalArgumentException e) {
            throw new StageException("Cannot score " + record.getRecordId() + ": " + e.getMessage(), e);
        }
        if (!breakdown.isScored()) {
            log.debug("priority.unscorable missing={}", breakdown.missingInputs());
            return StageOutput.empty();
        }
        Map<String, Object> derived = new LinkedHashMap<>();
        derived.put(MuseumFields.PRIORITY_SCORE, breakdown.priorityScore());
        derived.put(MuseumFields.OVERALL_QUALITY_SCORE, breakdown.overallQualityScore());
        derived.put(MuseumFields.PRIMARY_ART, breakdown.primaryArt());
        derived.put(MuseumFields.SCORING_VERSION, PriorityScorer.SCORING_VERSION);
        return StageOutput.derived(derived);
    }

    @Override
    public boolean hasOutput(MuseumRecord record) {
        return record.get(MuseumFields.PRIORITY_SCORE) != null;
    }
}
