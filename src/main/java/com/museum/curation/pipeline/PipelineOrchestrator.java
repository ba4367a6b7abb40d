package com.museum.curation.pipeline;

import com.museum.curation.audit.ArtifactWriteException;
import com.museum.curation.audit.AuditAction;
import com.museum.curation.audit.AuditEntry;
import com.museum.curation.audit.AuditService;
import com.museum.curation.audit.RunArtifactWriter;
import com.museum.curation.cache.CacheStats;
import com.museum.curation.cache.ResponseCache;
import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.core.model.Recommendation;
import com.museum.curation.drift.DriftGate;
import com.museum.curation.drift.DriftReport;
import com.museum.curation.drift.GoldSet;
import com.museum.curation.drift.GoldSetException;
import com.museum.curation.drift.GoldSetLoader;
import com.museum.curation.lock.LocalPartitionLock;
import com.museum.curation.lock.LockAcquisitionException;
import com.museum.curation.lock.PartitionLock;
import com.museum.curation.logging.LogContext;
import com.museum.curation.merge.MergeEngine;
import com.museum.curation.metrics.MetricsService;
import com.museum.curation.metrics.NoOpMetricsService;
import com.museum.curation.pipeline.stage.IndexRebuilder;
import com.museum.curation.review.InMemoryReviewQueue;
import com.museum.curation.review.ReviewItem;
import com.museum.curation.review.ReviewKind;
import com.museum.curation.review.ReviewService;
import com.museum.curation.rules.NormalizationEngine;
import com.museum.curation.scoring.TargetSelector;
import com.museum.curation.store.PartitionSnapshot;
import com.museum.curation.store.PartitionStore;
import com.museum.curation.store.PartitionStoreException;
import com.museum.curation.update.ApplyOptions;
import com.museum.curation.update.ApplyResult;
import com.museum.curation.update.RecordUpdateApplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs the registered stages over a list of partitions under budget, failure-rate
 * and drift governance.
 *
 * <p>For each partition, each enabled stage locks the partition, loads it once,
 * checks that the previous stage's outputs cover enough records, processes every
 * record and writes the partition once. A budget or failure-rate breach stops the
 * whole run; the in-flight partition's committed changes are still written. After
 * the partitions the index is rebuilt, the gold set is compared, and the run
 * artifacts are written whatever the terminal state.</p>
 *
 * <pre>
 * PipelineOrchestrator orchestrator = PipelineOrchestrator.builder()
 *         .store(store)
 *         .stage(backboneStage)
 *         .stage(priorityStage)
 *         .build();
 * RunResult result = orchestrator.run(List.of("us-ca", "us-ny"), RunOptions.defaults());
 * </pre>
 */
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private static final String ACTOR = "PIPELINE";

    private final PartitionStore store;
    private final PartitionLock lock;
    private final RecordUpdateApplier applier;
    private final ReviewService reviewService;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final List<PipelineStage> stages;
    private final TargetSelector targetSelector;
    private final DriftGate driftGate;
    private final GoldSetLoader goldSetLoader;
    private final ResponseCache responseCache;
    private final IndexRebuilder indexRebuilder;
    private final Supplier<String> runIdSupplier;

    private PipelineOrchestrator(Builder builder) {
        this.store = builder.store;
        this.lock = builder.lock;
        this.applier = builder.applier;
        this.reviewService = builder.reviewService;
        this.auditService = builder.auditService;
        this.metricsService = builder.metricsService;
        this.clock = builder.clock;
        this.stages = builder.stages.stream()
                .sorted(Comparator.comparing(PipelineStage::name))
                .toList();
        this.targetSelector = builder.targetSelector;
        this.driftGate = builder.driftGate;
        this.goldSetLoader = builder.goldSetLoader;
        this.responseCache = builder.responseCache;
        this.indexRebuilder = new IndexRebuilder(builder.store);
        this.runIdSupplier = builder.runIdSupplier;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the pipeline. Never throws for budget, failure-rate or drift breaches;
     * those are reported in the result's status.
     */
    public RunResult run(List<String> partitionIds, RunOptions options) {
        Objects.requireNonNull(partitionIds, "partitionIds is required");
        RunOptions opts = options != null ? options : RunOptions.defaults();
        String runId = runIdSupplier.get();
        RunState state = new RunState(runId, opts, clock.instant());
        state.cacheBaseline = responseCache != null ? responseCache.getStats() : null;

        try (LogContext ignored = LogContext.forRun(runId)) {
            log.info("run.started partitions={} stages={} dryRun={} budget={}",
                    partitionIds.size(), enabledStageNames(opts), opts.isDryRun(), opts.getTotalBudget());
            Map<String, Object> startDetails = new LinkedHashMap<>();
            startDetails.put("partitions", partitionIds.size());
            startDetails.put("dryRun", opts.isDryRun());
            auditService.record(AuditAction.RUN_STARTED, null, ACTOR, startDetails);

            RunResult result;
            try {
                state.targets = selectTargets(partitionIds, opts);

                for (String partitionId : partitionIds) {
                    if (state.isAborted()) {
                        break;
                    }
                    processPartition(partitionId, state);
                }

                rebuildIndexIfAllowed(partitionIds, state);
                checkDrift(state);
            } finally {
                result = finish(state);
            }
            return result;
        }
    }

    /**
     * Writes the artifacts and the closing audit entry. Runs even when the run body throws.
     */
    private RunResult finish(RunState state) {
        state.finishedAt = clock.instant();
        writeArtifacts(state);

        RunResult result = state.toResult();
        Map<String, Object> finishDetails = new LinkedHashMap<>();
        finishDetails.put("status", result.status().code());
        finishDetails.put("abortReason", result.abortReason());
        finishDetails.put("processed", result.recordsProcessed());
        finishDetails.put("failed", result.recordsFailed());
        finishDetails.put("spent", result.budgetSpent());
        auditService.record(AuditAction.RUN_FINISHED, null, ACTOR, finishDetails);
        log.info("run.finished status={} processed={} failed={} spent={} changes={} reviewItems={}",
                result.status(), result.recordsProcessed(), result.recordsFailed(),
                result.budgetSpent(), result.changes().size(), result.reviewItemsQueued());
        return result;
    }

    public List<PipelineStage> getStages() {
        return stages;
    }

    private Set<String> selectTargets(List<String> partitionIds, RunOptions opts) {
        boolean needsTargets = stages.stream()
                .anyMatch(s -> s.isTargeted() && opts.isStageEnabled(s.name()));
        if (!needsTargets) {
            return Set.of();
        }
        List<MuseumRecord> candidates = new ArrayList<>();
        for (String partitionId : partitionIds) {
            try {
                candidates.addAll(store.load(partitionId).getRecords());
            } catch (PartitionStoreException e) {
                log.warn("targets.partition_unreadable partition={} error={}", partitionId, e.getMessage());
            }
        }
        Set<String> targets = targetSelector.selectTopN(candidates, opts.getTopN());
        log.info("targets.selected candidates={} topN={} selected={}",
                candidates.size(), opts.getTopN(), targets.size());
        return targets;
    }

    private void processPartition(String partitionId, RunState state) {
        RunOptions opts = state.options;
        List<StageName> stagesRun = new ArrayList<>();
        String validationError = null;
        int recordCount = 0;
        PipelineStage previous = null;

        try (LogContext ignored = LogContext.forPartition(state.runId, partitionId)) {
            log.info("partition.started");
            for (PipelineStage stage : stages) {
                if (!opts.isStageEnabled(stage.name())) {
                    previous = advancePrerequisite(previous, stage);
                    continue;
                }
                try (LogContext stageCtx = LogContext.forStage(stage.name().code())) {
                    lock.tryLock(partitionId);
                    try {
                        PartitionSnapshot snapshot = loadForStage(partitionId, state);
                        recordCount = snapshot.size();
                        validationError = validate(snapshot, previous, opts);
                        if (validationError != null) {
                            log.warn("partition.validation_failed stage={} error={}",
                                    stage.name().code(), validationError);
                            break;
                        }
                        boolean modified = runStage(stage, snapshot, state);
                        if (modified && !opts.isDryRun()) {
                            snapshot.setUpdatedAt(clock.instant());
                            store.save(snapshot);
                        }
                        if (!state.isAborted()) {
                            stagesRun.add(stage.name());
                        }
                    } finally {
                        lock.unlock(partitionId);
                    }
                } catch (PartitionStoreException | LockAcquisitionException e) {
                    validationError = stage.name().code() + ": " + e.getMessage();
                    log.warn("partition.failed stage={} error={}", stage.name().code(), e.getMessage());
                    break;
                }
                if (state.isAborted()) {
                    break;
                }
                previous = advancePrerequisite(previous, stage);
            }
            state.partitions.add(new PartitionOutcome(partitionId, recordCount, stagesRun, validationError));
            log.info("partition.finished stagesRun={} valid={}", stagesRun.size(), validationError == null);
        }
    }

    /**
     * Targeted stages only cover a subset of records, so they never act as the
     * prerequisite of the stage after them.
     */
    private static PipelineStage advancePrerequisite(PipelineStage previous, PipelineStage stage) {
        return stage.isTargeted() ? previous : stage;
    }

    private PartitionSnapshot loadForStage(String partitionId, RunState state) {
        if (!state.options.isDryRun()) {
            return store.load(partitionId);
        }
        PartitionSnapshot pending = state.dryRunSnapshots.get(partitionId);
        if (pending == null) {
            pending = store.load(partitionId);
            state.dryRunSnapshots.put(partitionId, pending);
        }
        return pending;
    }

    /**
     * Returns a validation error, or null when the stage may run.
     */
    private static String validate(PartitionSnapshot snapshot, PipelineStage previous, RunOptions opts) {
        if (snapshot.isEmpty()) {
            return "partition is empty";
        }
        if (opts.isSkipValidation() || previous == null) {
            return null;
        }
        long satisfied = snapshot.getRecords().stream().filter(previous::hasOutput).count();
        double ratio = (double) satisfied / snapshot.size();
        if (ratio < opts.getPrerequisiteRatio()) {
            return String.format("prerequisite %s satisfied by %d/%d records (required %.2f)",
                    previous.name().code(), satisfied, snapshot.size(), opts.getPrerequisiteRatio());
        }
        return null;
    }

    /**
     * Processes every record of a loaded partition.
     *
     * @return true if any record was modified
     */
    private boolean runStage(PipelineStage stage, PartitionSnapshot snapshot, RunState state) {
        StageContext context = new StageContext(state.runId, snapshot, state.targets, state.options);
        ApplyOptions applyOptions = state.options.toApplyOptions();
        String stageCode = stage.name().code();
        boolean modified = false;
        int attempted = 0;

        for (MuseumRecord record : snapshot.getRecords()) {
            if (stage.isTargeted() && !context.isTarget(record.getRecordId())) {
                continue;
            }
            if (!stage.appliesTo(record, context)) {
                continue;
            }
            try (LogContext ignored = LogContext.forRecord(record.getRecordId())) {
                long start = System.nanoTime();
                CostEstimate estimate;
                try {
                    estimate = stage.estimateCost(record);
                } catch (RuntimeException e) {
                    attempted++;
                    if (recordFailure(stageCode, snapshot, record, e, start, state)) {
                        return modified;
                    }
                    continue;
                }
                if (!estimate.isFree() && !state.budget.canSpend(estimate)) {
                    state.abort(RunStatus.ABORTED_BUDGET, String.format(
                            "budget ceiling %.4f reached: spent %.4f, next call estimated %.4f",
                            state.budget.ceiling(), state.budget.getSpent(), estimate.dollars()));
                    log.warn("run.aborted_budget spent={} estimate={} ceiling={}",
                            state.budget.getSpent(), estimate.dollars(), state.budget.ceiling());
                    return modified;
                }

                attempted++;
                try {
                    StageOutput output = stage.process(record, context);
                    if (!estimate.isFree()) {
                        state.budget.spend(estimate.dollars());
                        metricsService.recordBudgetSpent(estimate.dollars());
                    }
                    modified |= applyOutput(stage, snapshot, record, output, applyOptions, state);
                } catch (RuntimeException e) {
                    if (recordFailure(stageCode, snapshot, record, e, start, state)) {
                        return modified;
                    }
                    continue;
                }
                metricsService.recordStageDuration(stageCode, true, Duration.ofNanos(System.nanoTime() - start));
                state.breaker.recordSuccess();
                if (checkFailureRate(state)) {
                    return modified;
                }
            }
        }
        log.info("stage.finished attempted={} modified={}", attempted, modified);
        return modified;
    }

    /**
     * Counts a failed record and queues it for review.
     *
     * @return true if the failure rate now aborts the run
     */
    private boolean recordFailure(String stageCode, PartitionSnapshot snapshot, MuseumRecord record,
                                  RuntimeException e, long start, RunState state) {
        metricsService.recordStageDuration(stageCode, false, Duration.ofNanos(System.nanoTime() - start));
        metricsService.incrementStageFailure(stageCode);
        state.breaker.recordFailure();
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        state.reviewItems.add(reviewService.submitStageFailure(
                snapshot.getPartitionId(), record.getRecordId(), stageCode, reason));
        log.warn("record.failed stage={} error={}", stageCode, reason);
        return checkFailureRate(state);
    }

    private boolean applyOutput(PipelineStage stage, PartitionSnapshot snapshot, MuseumRecord record,
                                StageOutput output, ApplyOptions applyOptions, RunState state) {
        String recordId = record.getRecordId();
        String partitionId = snapshot.getPartitionId();
        String stageCode = stage.name().code();

        ApplyResult result = applier.apply(snapshot, recordId, output.candidates(), applyOptions);
        for (Recommendation recommendation : result.recommendations()) {
            state.reviewItems.add(reviewService.submitRecommendation(
                    partitionId, stageCode, ReviewKind.FIELD_REJECTION, recommendation));
        }
        for (Recommendation recommendation : output.recommendations()) {
            Recommendation scoped = recommendation.recordId() == null
                    ? recommendation.withRecordId(recordId)
                    : recommendation;
            state.reviewItems.add(reviewService.submitRecommendation(
                    partitionId, stageCode, ReviewKind.RECOMMENDATION, scoped));
        }

        List<String> derived = writeDerived(record, output.derivedFields());
        RecordChange change = new RecordChange(partitionId, recordId, stage.name(),
                result.appliedFields(), result.rejectedFields(), derived);
        if (!change.isEmpty()) {
            state.changes.add(change);
        }
        return result.hasChanges() || !derived.isEmpty();
    }

    /**
     * Writes deterministic stage outputs. Never replaces a non-null value with null
     * and never touches provenance-carrying fields.
     */
    private List<String> writeDerived(MuseumRecord record, Map<String, Object> derivedFields) {
        List<String> written = new ArrayList<>();
        for (Map.Entry<String, Object> entry : derivedFields.entrySet()) {
            String field = entry.getKey();
            Object value = entry.getValue();
            if (!MuseumFields.DERIVED_FIELDS.contains(field)) {
                log.warn("derived.not_allowed field={}", field);
                continue;
            }
            Object current = record.get(field);
            if (value == null && current != null) {
                continue;
            }
            if (Objects.equals(current, value)) {
                continue;
            }
            record.set(field, value);
            written.add(field);
        }
        if (!written.isEmpty()) {
            record.touch(clock.instant());
            log.debug("derived.written fields={}", written);
        }
        return written;
    }

    private boolean checkFailureRate(RunState state) {
        FailureRateBreaker breaker = state.breaker;
        if (!breaker.isTripped()) {
            return false;
        }
        state.abort(RunStatus.ABORTED_FAILURE_RATE, String.format(
                "failure rate %.4f exceeded threshold %.4f (%d/%d)",
                breaker.failureRate(), breaker.getThreshold(), breaker.getFailed(), breaker.getProcessed()));
        log.warn("run.aborted_failure_rate failed={} processed={} rate={}",
                breaker.getFailed(), breaker.getProcessed(), breaker.failureRate());
        return true;
    }

    private void rebuildIndexIfAllowed(List<String> partitionIds, RunState state) {
        RunOptions opts = state.options;
        if (!opts.isStageEnabled(StageName.INDEX_REBUILD) || partitionIds.isEmpty()) {
            return;
        }
        if (opts.isDryRun()) {
            log.info("index.skipped reason=dry_run");
            return;
        }
        if (state.isAborted()) {
            log.info("index.skipped reason={}", state.status.code());
            return;
        }
        if (state.partitions.stream().anyMatch(p -> !p.isValid())) {
            log.info("index.skipped reason=partition_failed");
            return;
        }
        try {
            indexRebuilder.rebuild();
            state.indexRebuilt = true;
        } catch (PartitionStoreException e) {
            log.warn("index.failed error={}", e.getMessage());
        }
    }

    private void checkDrift(RunState state) {
        RunOptions opts = state.options;
        if (!opts.isDriftCheckEnabled()) {
            return;
        }
        try {
            GoldSet goldSet = goldSetLoader.load(opts.getGoldSetPath());
            DriftReport report = driftGate.evaluate(goldSet, currentRecords(state).values());
            state.driftReport = report;
            metricsService.recordDriftRate(report.driftRate());
            if (report.exceeds(opts.getDriftRateThreshold())) {
                log.warn("drift.exceeded rate={} threshold={} diffs={}",
                        report.driftRate(), opts.getDriftRateThreshold(), report.diffs().size());
                if (!state.isAborted()) {
                    state.abort(RunStatus.ABORTED_DRIFT, String.format("drift rate %.4f exceeded threshold %.4f",
                            report.driftRate(), opts.getDriftRateThreshold()));
                }
            }
        } catch (GoldSetException e) {
            state.driftError = e.getMessage();
            log.warn("drift.unavailable error={}", e.getMessage());
        }
    }

    /**
     * Current state of every stored record, with this run's unsaved dry-run copies on top.
     */
    private Map<String, MuseumRecord> currentRecords(RunState state) {
        Map<String, MuseumRecord> byId = new LinkedHashMap<>();
        for (String partitionId : store.listPartitions()) {
            if (state.dryRunSnapshots.containsKey(partitionId)) {
                continue;
            }
            try {
                store.load(partitionId).getRecords().forEach(r -> byId.put(r.getRecordId(), r));
            } catch (PartitionStoreException e) {
                log.warn("drift.partition_unreadable partition={} error={}", partitionId, e.getMessage());
            }
        }
        state.dryRunSnapshots.values()
                .forEach(s -> s.getRecords().forEach(r -> byId.put(r.getRecordId(), r)));
        return byId;
    }

    private void writeArtifacts(RunState state) {
        Path root = state.options.getArtifactRoot();
        if (root == null) {
            return;
        }
        RunArtifactWriter writer = new RunArtifactWriter(root, state.runId);
        state.artifactDirectory = writer.getRunDirectory().toString();
        writeArtifact(writer, RunArtifactWriter.CHANGES, state.changes, state);
        writeArtifact(writer, RunArtifactWriter.REVIEW_QUEUE, state.reviewItems, state);
        writeArtifact(writer, RunArtifactWriter.METRICS, metricsArtifact(state), state);
        if (state.options.isDriftCheckEnabled()) {
            Object drift = state.driftReport != null
                    ? state.driftReport
                    : Map.of("error", String.valueOf(state.driftError));
            writeArtifact(writer, RunArtifactWriter.DRIFT_REPORT, drift, state);
        }
        writeArtifact(writer, RunArtifactWriter.SUMMARY, summaryArtifact(state), state);
    }

    private void writeArtifact(RunArtifactWriter writer, String name, Object content, RunState state) {
        try {
            writer.write(name, content);
        } catch (ArtifactWriteException e) {
            state.artifactErrors.add(name + ": " + e.getMessage());
            log.warn("artifact.failed name={} error={}", name, e.getMessage());
        }
    }

    private Map<String, Object> metricsArtifact(RunState state) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("budget_total", state.budget.getTotal());
        metrics.put("budget_ceiling", state.budget.ceiling());
        metrics.put("budget_spent", state.budget.getSpent());
        metrics.put("budget_remaining", state.budget.getRemaining());
        metrics.put("records_processed", state.breaker.getProcessed());
        metrics.put("records_failed", state.breaker.getFailed());
        metrics.put("failure_rate", state.breaker.failureRate());
        metrics.put("fields_applied", state.changes.stream().mapToInt(c -> c.appliedFields().size()).sum());
        metrics.put("fields_rejected", state.changes.stream().mapToInt(c -> c.rejectedFields().size()).sum());
        metrics.put("review_items", state.reviewItems.size());
        if (responseCache != null) {
            metrics.put("cache", responseCache.getStats().since(state.cacheBaseline).toArtifact());
        }
        return metrics;
    }

    private Map<String, Object> summaryArtifact(RunState state) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("run_id", state.runId);
        summary.put("status", state.status.code());
        summary.put("abort_reason", state.abortReason);
        summary.put("started_at", state.startedAt);
        summary.put("finished_at", state.finishedAt);
        summary.put("dry_run", state.options.isDryRun());
        summary.put("partitions", state.partitions);
        summary.put("index_rebuilt", state.indexRebuilt);
        summary.put("drift_rate", state.driftReport != null ? state.driftReport.driftRate() : null);
        summary.put("drift_error", state.driftError);
        List<AuditEntry> audited = auditService.getEntriesForRun(state.runId);
        summary.put("audit_entries", audited.size());
        summary.put("audited_field_decisions", audited.stream().filter(AuditEntry::isFieldDecision).count());
        return summary;
    }

    private List<String> enabledStageNames(RunOptions opts) {
        return stages.stream()
                .map(PipelineStage::name)
                .filter(opts::isStageEnabled)
                .map(StageName::code)
                .toList();
    }

    /**
     * Mutable bookkeeping of one run.
     */
    private static final class RunState {
        final String runId;
        final RunOptions options;
        final Instant startedAt;
        final BudgetState budget;
        final FailureRateBreaker breaker;
        final List<PartitionOutcome> partitions = new ArrayList<>();
        final List<RecordChange> changes = new ArrayList<>();
        final List<ReviewItem> reviewItems = new ArrayList<>();
        final List<String> artifactErrors = new ArrayList<>();
        final Map<String, PartitionSnapshot> dryRunSnapshots = new HashMap<>();
        Set<String> targets = Set.of();
        RunStatus status = RunStatus.COMPLETED;
        String abortReason;
        Instant finishedAt;
        DriftReport driftReport;
        String driftError;
        boolean indexRebuilt;
        String artifactDirectory;
        CacheStats cacheBaseline;

        RunState(String runId, RunOptions options, Instant startedAt) {
            this.runId = runId;
            this.options = options;
            this.startedAt = startedAt;
            this.budget = new BudgetState(options.getTotalBudget(), options.getReserveRatio());
            this.breaker = new FailureRateBreaker(options.getFailureRateThreshold());
        }

        boolean isAborted() {
            return status.isAborted();
        }

        void abort(RunStatus abortStatus, String reason) {
            this.status = abortStatus;
            this.abortReason = reason;
        }

        RunResult toResult() {
            return new RunResult(runId, status, abortReason, startedAt, finishedAt, partitions, changes,
                    budget.getTotal(), budget.getSpent(), breaker.getProcessed(), breaker.getFailed(),
                    reviewItems.size(), driftReport, driftError, indexRebuilt, options.isDryRun(),
                    artifactDirectory, artifactErrors);
        }
    }

    public static class Builder {
        private PartitionStore store;
        private PartitionLock lock;
        private RecordUpdateApplier applier;
        private ReviewService reviewService;
        private AuditService auditService;
        private MetricsService metricsService;
        private Clock clock;
        private final List<PipelineStage> stages = new ArrayList<>();
        private TargetSelector targetSelector;
        private DriftGate driftGate;
        private GoldSetLoader goldSetLoader;
        private ResponseCache responseCache;
        private Supplier<String> runIdSupplier = LogContext::generateRunId;

        public Builder store(PartitionStore store) {
            this.store = store;
            return this;
        }

        public Builder lock(PartitionLock lock) {
            this.lock = lock;
            return this;
        }

        /**
         * Sets the applier. When unset, one is built over the same store, lock, audit trail and clock.
         */
        public Builder applier(RecordUpdateApplier applier) {
            this.applier = applier;
            return this;
        }

        public Builder reviewService(ReviewService reviewService) {
            this.reviewService = reviewService;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Registers a stage. Stages run in {@link StageName} order whatever the registration order.
         */
        public Builder stage(PipelineStage stage) {
            Objects.requireNonNull(stage, "stage is required");
            if (!stage.name().isPerPartition()) {
                throw new IllegalArgumentException(stage.name() + " is run by the orchestrator itself");
            }
            if (stages.stream().anyMatch(s -> s.name() == stage.name())) {
                throw new IllegalArgumentException("Stage already registered: " + stage.name());
            }
            stages.add(stage);
            return this;
        }

        public Builder stages(List<? extends PipelineStage> stages) {
            stages.forEach(this::stage);
            return this;
        }

        public Builder targetSelector(TargetSelector targetSelector) {
            this.targetSelector = targetSelector;
            return this;
        }

        public Builder driftGate(DriftGate driftGate) {
            this.driftGate = driftGate;
            return this;
        }

        public Builder goldSetLoader(GoldSetLoader goldSetLoader) {
            this.goldSetLoader = goldSetLoader;
            return this;
        }

        /**
         * Sets the response cache shared by the adapter stages, whose per-run counters
         * are then reported in {@code metrics.json}.
         */
        public Builder responseCache(ResponseCache responseCache) {
            this.responseCache = responseCache;
            return this;
        }

        public Builder runIdSupplier(Supplier<String> runIdSupplier) {
            this.runIdSupplier = Objects.requireNonNull(runIdSupplier, "runIdSupplier is required");
            return this;
        }

        public PipelineOrchestrator build() {
            Objects.requireNonNull(store, "store is required");
            if (lock == null) {
                lock = new LocalPartitionLock();
            }
            if (auditService == null) {
                auditService = new AuditService();
            }
            if (metricsService == null) {
                metricsService = new NoOpMetricsService();
            }
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            if (applier == null) {
                applier = new RecordUpdateApplier(new MergeEngine(), NormalizationEngine.createDefaultEngine(),
                        store, lock, auditService, metricsService, clock);
            }
            if (reviewService == null) {
                reviewService = new ReviewService(new InMemoryReviewQueue(), applier, auditService);
            }
            if (targetSelector == null) {
                targetSelector = new TargetSelector();
            }
            if (driftGate == null) {
                driftGate = new DriftGate();
            }
            if (goldSetLoader == null) {
                goldSetLoader = new GoldSetLoader();
            }
            return new PipelineOrchestrator(this);
        }
    }
}
