package com.museum.curation.update;

import com.museum.curation.core.model.EnrichedField;
import com.museum.curation.rules.DomainEligibility;
import com.museum.curation.rules.VolatilityPolicy;

/**
 * Gate configuration for one application of a candidate batch.
 * Use {@link #builder()} to create instances.
 */
public class ApplyOptions {

    public static final int DEFAULT_CONFIDENCE_THRESHOLD = 4;
    public static final String DEFAULT_ACTOR = "SYSTEM";

    private final int confidenceThreshold;
    private final VolatilityPolicy volatilityPolicy;
    private final DomainEligibility domainEligibility;
    private final boolean dryRun;
    private final String actorId;

    private ApplyOptions(Builder builder) {
        this.confidenceThreshold = builder.confidenceThreshold;
        this.volatilityPolicy = builder.volatilityPolicy;
        this.domainEligibility = builder.domainEligibility;
        this.dryRun = builder.dryRun;
        this.actorId = builder.actorId;
    }

    public static ApplyOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public VolatilityPolicy getVolatilityPolicy() {
        return volatilityPolicy;
    }

    public DomainEligibility getDomainEligibility() {
        return domainEligibility;
    }

    /**
     * When true, {@code applyAndPersist} computes changes but does not write the partition.
     */
    public boolean isDryRun() {
        return dryRun;
    }

    public String getActorId() {
        return actorId;
    }

    @Override
    public String toString() {
        return "ApplyOptions{" +
                "confidenceThreshold=" + confidenceThreshold +
                ", dryRun=" + dryRun +
                ", actorId='" + actorId + '\'' +
                '}';
    }

    public static class Builder {
        private int confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private VolatilityPolicy volatilityPolicy = VolatilityPolicy.defaults();
        private DomainEligibility domainEligibility = DomainEligibility.defaults();
        private boolean dryRun = false;
        private String actorId = DEFAULT_ACTOR;

        public Builder confidenceThreshold(int confidenceThreshold) {
            if (confidenceThreshold < EnrichedField.MIN_CONFIDENCE || confidenceThreshold > EnrichedField.MAX_CONFIDENCE) {
                throw new IllegalArgumentException("Confidence threshold must be between "
                        + EnrichedField.MIN_CONFIDENCE + " and " + EnrichedField.MAX_CONFIDENCE);
            }
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder volatilityPolicy(VolatilityPolicy volatilityPolicy) {
            if (volatilityPolicy == null) {
                throw new IllegalArgumentException("volatilityPolicy must not be null");
            }
            this.volatilityPolicy = volatilityPolicy;
            return this;
        }

        public Builder domainEligibility(DomainEligibility domainEligibility) {
            if (domainEligibility == null) {
                throw new IllegalArgumentException("domainEligibility must not be null");
            }
            this.domainEligibility = domainEligibility;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder actorId(String actorId) {
            if (actorId == null || actorId.isBlank()) {
                throw new IllegalArgumentException("actorId must not be blank");
            }
            this.actorId = actorId;
            return this;
        }

        public ApplyOptions build() {
            return new ApplyOptions(this);
        }
    }
}
