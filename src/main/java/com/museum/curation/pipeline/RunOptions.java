package com.museum.curation.pipeline;

import com.museum.curation.core.model.EnrichedField;
import com.museum.curation.core.model.PrimaryDomain;
import com.museum.curation.core.model.TrustLevel;
import com.museum.curation.rules.DomainEligibility;
import com.museum.curation.rules.VolatilityPolicy;
import com.museum.curation.update.ApplyOptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration options for a curation run.
 * Use {@link #builder()} to create instances, or {@link #fromProperties(Properties)}
 * to read {@code curation.*} keys.
 */
public class RunOptions {

    public static final String DEFAULTS_RESOURCE = "curation-defaults.properties";

    public static final double DEFAULT_TOTAL_BUDGET = 5.0;
    public static final double DEFAULT_RESERVE_RATIO = 0.15;
    public static final int DEFAULT_TOP_N = 100;
    public static final double DEFAULT_FAILURE_RATE_THRESHOLD = 0.10;
    public static final double DEFAULT_DRIFT_RATE_THRESHOLD = 0.02;
    public static final double DEFAULT_PREREQUISITE_RATIO = 0.5;

    private final double totalBudget;
    private final double reserveRatio;
    private final int confidenceThreshold;
    private final VolatilityPolicy volatilityPolicy;
    private final DomainEligibility domainEligibility;
    private final int topN;
    private final double failureRateThreshold;
    private final double driftRateThreshold;
    private final boolean driftCheckEnabled;
    private final Path goldSetPath;
    private final double prerequisiteRatio;
    private final boolean skipValidation;
    private final boolean dryRun;
    private final Set<StageName> stages;
    private final StageName startStage;
    private final Path artifactRoot;

    private RunOptions(Builder builder) {
        this.totalBudget = builder.totalBudget;
        this.reserveRatio = builder.reserveRatio;
        this.confidenceThreshold = builder.confidenceThreshold;
        this.volatilityPolicy = builder.volatilityPolicy;
        this.domainEligibility = builder.domainEligibility;
        this.topN = builder.topN;
        this.failureRateThreshold = builder.failureRateThreshold;
        this.driftRateThreshold = builder.driftRateThreshold;
        this.driftCheckEnabled = builder.driftCheckEnabled;
        this.goldSetPath = builder.goldSetPath;
        this.prerequisiteRatio = builder.prerequisiteRatio;
        this.skipValidation = builder.skipValidation;
        this.dryRun = builder.dryRun;
        this.stages = builder.stages == null
                ? Collections.unmodifiableSet(EnumSet.allOf(StageName.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.stages));
        this.startStage = builder.startStage;
        this.artifactRoot = builder.artifactRoot;
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from the bundled {@value #DEFAULTS_RESOURCE}.
     */
    public static RunOptions loadDefaults() {
        Properties properties = new Properties();
        try (InputStream in = RunOptions.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        return fromProperties(properties);
    }

    /**
     * Builds options from {@code curation.*} properties. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static RunOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = prop(properties, "budget.total")) != null) {
            builder.totalBudget(Double.parseDouble(value));
        }
        if ((value = prop(properties, "budget.reserve-ratio")) != null) {
            builder.reserveRatio(Double.parseDouble(value));
        }
        if ((value = prop(properties, "confidence-threshold")) != null) {
            builder.confidenceThreshold(Integer.parseInt(value));
        }
        if ((value = prop(properties, "volatility.fields")) != null) {
            TrustLevel minimum = TrustLevel.ENCYCLOPEDIA_SUMMARY;
            String trust = prop(properties, "volatility.minimum-trust");
            if (trust != null) {
                minimum = TrustLevel.parse(trust);
            }
            builder.volatilityPolicy(new VolatilityPolicy(splitList(value), minimum));
        }
        if ((value = prop(properties, "eligibility.fields")) != null) {
            PrimaryDomain domain = PrimaryDomain.ART;
            String required = prop(properties, "eligibility.required-domain");
            if (required != null) {
                domain = PrimaryDomain.fromValue(required).orElseThrow(() ->
                        new IllegalArgumentException("Unknown primary domain: " + required));
            }
            builder.domainEligibility(new DomainEligibility(splitList(value), domain));
        }
        if ((value = prop(properties, "top-n")) != null) {
            builder.topN(Integer.parseInt(value));
        }
        if ((value = prop(properties, "failure-rate-threshold")) != null) {
            builder.failureRateThreshold(Double.parseDouble(value));
        }
        if ((value = prop(properties, "drift.rate-threshold")) != null) {
            builder.driftRateThreshold(Double.parseDouble(value));
        }
        if ((value = prop(properties, "drift.enabled")) != null) {
            builder.driftCheckEnabled(Boolean.parseBoolean(value));
        }
        if ((value = prop(properties, "drift.gold-set")) != null) {
            builder.goldSetPath(Path.of(value));
        }
        if ((value = prop(properties, "prerequisite-ratio")) != null) {
            builder.prerequisiteRatio(Double.parseDouble(value));
        }
        if ((value = prop(properties, "skip-validation")) != null) {
            builder.skipValidation(Boolean.parseBoolean(value));
        }
        if ((value = prop(properties, "dry-run")) != null) {
            builder.dryRun(Boolean.parseBoolean(value));
        }
        if ((value = prop(properties, "stages")) != null) {
            builder.stages(splitList(value).stream().map(StageName::parse).collect(Collectors.toSet()));
        }
        if ((value = prop(properties, "start-stage")) != null) {
            builder.startStage(StageName.parse(value));
        }
        if ((value = prop(properties, "artifact-root")) != null) {
            builder.artifactRoot(Path.of(value));
        }
        return builder.build();
    }

    public double getTotalBudget() {
        return totalBudget;
    }

    public double getReserveRatio() {
        return reserveRatio;
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

    public int getTopN() {
        return topN;
    }

    public double getFailureRateThreshold() {
        return failureRateThreshold;
    }

    public double getDriftRateThreshold() {
        return driftRateThreshold;
    }

    public boolean isDriftCheckEnabled() {
        return driftCheckEnabled;
    }

    public Path getGoldSetPath() {
        return goldSetPath;
    }

    public double getPrerequisiteRatio() {
        return prerequisiteRatio;
    }

    public boolean isSkipValidation() {
        return skipValidation;
    }

    /**
     * When true, no partition or index is written; changes are still computed and reported.
     */
    public boolean isDryRun() {
        return dryRun;
    }

    public Set<StageName> getStages() {
        return stages;
    }

    public StageName getStartStage() {
        return startStage;
    }

    /**
     * Root directory for run artifacts, or null to skip writing them.
     */
    public Path getArtifactRoot() {
        return artifactRoot;
    }

    /**
     * Whether a stage is selected by the stage subset and the start stage.
     */
    public boolean isStageEnabled(StageName stage) {
        if (!stages.contains(stage)) {
            return false;
        }
        return startStage == null || stage.compareTo(startStage) >= 0;
    }

    /**
     * Gate options the applier uses for automated candidates of this run.
     */
    public ApplyOptions toApplyOptions() {
        return ApplyOptions.builder()
                .confidenceThreshold(confidenceThreshold)
                .volatilityPolicy(volatilityPolicy)
                .domainEligibility(domainEligibility)
                .dryRun(dryRun)
                .build();
    }

    @Override
    public String toString() {
        return "RunOptions{" +
                "totalBudget=" + totalBudget +
                ", reserveRatio=" + reserveRatio +
                ", confidenceThreshold=" + confidenceThreshold +
                ", topN=" + topN +
                ", failureRateThreshold=" + failureRateThreshold +
                ", driftRateThreshold=" + driftRateThreshold +
                ", driftCheckEnabled=" + driftCheckEnabled +
                ", dryRun=" + dryRun +
                ", stages=" + stages +
                ", startStage=" + startStage +
                '}';
    }

    private static String prop(Properties properties, String key) {
        String value = properties.getProperty("curation." + key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Set<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public static class Builder {
        private double totalBudget = DEFAULT_TOTAL_BUDGET;
        private double reserveRatio = DEFAULT_RESERVE_RATIO;
        private int confidenceThreshold = ApplyOptions.DEFAULT_CONFIDENCE_THRESHOLD;
        private VolatilityPolicy volatilityPolicy = VolatilityPolicy.defaults();
        private DomainEligibility domainEligibility = DomainEligibility.defaults();
        private int topN = DEFAULT_TOP_N;
        private double failureRateThreshold = DEFAULT_FAILURE_RATE_THRESHOLD;
        private double driftRateThreshold = DEFAULT_DRIFT_RATE_THRESHOLD;
        private boolean driftCheckEnabled = false;
        private Path goldSetPath;
        private double prerequisiteRatio = DEFAULT_PREREQUISITE_RATIO;
        private boolean skipValidation = false;
        private boolean dryRun = false;
        private Set<StageName> stages;
        private StageName startStage;
        private Path artifactRoot;

        public Builder totalBudget(double totalBudget) {
            if (totalBudget < 0 || Double.isNaN(totalBudget)) {
                throw new IllegalArgumentException("Total budget must be >= 0");
            }
            this.totalBudget = totalBudget;
            return this;
        }

        public Builder reserveRatio(double reserveRatio) {
            if (reserveRatio < 0.0 || reserveRatio >= 1.0) {
                throw new IllegalArgumentException("Reserve ratio must be in [0, 1)");
            }
            this.reserveRatio = reserveRatio;
            return this;
        }

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

        /**
         * Shorthand for a volatility policy over the given fields with the default minimum trust.
         */
        public Builder volatilityFields(Set<String> fields) {
            return volatilityPolicy(VolatilityPolicy.of(fields));
        }

        public Builder domainEligibility(DomainEligibility domainEligibility) {
            if (domainEligibility == null) {
                throw new IllegalArgumentException("domainEligibility must not be null");
            }
            this.domainEligibility = domainEligibility;
            return this;
        }

        public Builder topN(int topN) {
            if (topN < 0) {
                throw new IllegalArgumentException("topN must be >= 0");
            }
            this.topN = topN;
            return this;
        }

        public Builder failureRateThreshold(double failureRateThreshold) {
            if (failureRateThreshold < 0.0 || failureRateThreshold > 1.0) {
                throw new IllegalArgumentException("Failure rate threshold must be in [0, 1]");
            }
            this.failureRateThreshold = failureRateThreshold;
            return this;
        }

        public Builder driftRateThreshold(double driftRateThreshold) {
            if (driftRateThreshold < 0.0 || driftRateThreshold > 1.0) {
                throw new IllegalArgumentException("Drift rate threshold must be in [0, 1]");
            }
            this.driftRateThreshold = driftRateThreshold;
            return this;
        }

        public Builder driftCheckEnabled(boolean driftCheckEnabled) {
            this.driftCheckEnabled = driftCheckEnabled;
            return this;
        }

        public Builder goldSetPath(Path goldSetPath) {
            this.goldSetPath = goldSetPath;
            return this;
        }

        public Builder prerequisiteRatio(double prerequisiteRatio) {
            if (prerequisiteRatio < 0.0 || prerequisiteRatio > 1.0) {
                throw new IllegalArgumentException("Prerequisite ratio must be in [0, 1]");
            }
            this.prerequisiteRatio = prerequisiteRatio;
            return this;
        }

        public Builder skipValidation(boolean skipValidation) {
            this.skipValidation = skipValidation;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder stages(Set<StageName> stages) {
            if (stages == null || stages.isEmpty()) {
                throw new IllegalArgumentException("stages must not be empty");
            }
            this.stages = EnumSet.copyOf(stages);
            return this;
        }

        public Builder startStage(StageName startStage) {
            this.startStage = startStage;
            return this;
        }

        public Builder artifactRoot(Path artifactRoot) {
            this.artifactRoot = artifactRoot;
            return this;
        }

        public RunOptions build() {
            if (driftCheckEnabled && goldSetPath == null) {
                throw new IllegalArgumentException("A gold set path is required when the drift check is enabled");
            }
            return new RunOptions(this);
        }
    }
}
