package com.museum.curation.update;

import com.museum.curation.audit.AuditAction;
import com.museum.curation.audit.AuditService;
import com.museum.curation.core.model.EnrichedField;
import com.museum.curation.core.model.FieldCandidate;
import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.core.model.PrimaryDomain;
import com.museum.curation.core.model.ProvenanceEntry;
import com.museum.curation.core.model.Recommendation;
import com.museum.curation.lock.LocalPartitionLock;
import com.museum.curation.lock.PartitionLock;
import com.museum.curation.merge.MergeEngine;
import com.museum.curation.merge.MergeOutcome;
import com.museum.curation.metrics.MetricsService;
import com.museum.curation.metrics.NoOpMetricsService;
import com.museum.curation.rules.DomainEligibility;
import com.museum.curation.rules.NormalizationEngine;
import com.museum.curation.rules.NormalizationResult;
import com.museum.curation.rules.VolatilityPolicy;
import com.museum.curation.store.PartitionSnapshot;
import com.museum.curation.store.PartitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Applies candidate batches to records, gating each field before it reaches the
 * {@link MergeEngine}.
 *
 * <p>Per field, in order: schema check, automated-override check, normalization,
 * domain eligibility, volatility, merge. Accepted fields write value and provenance,
 * append the candidate's source to the record's data sources and stamp the record's
 * update time. Every decision is recorded in the audit trail.</p>
 */
public class RecordUpdateApplier {
    private static final Logger log = LoggerFactory.getLogger(RecordUpdateApplier.class);

    private final MergeEngine mergeEngine;
    private final NormalizationEngine normalizationEngine;
    private final PartitionStore store;
    private final PartitionLock lock;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;

    public RecordUpdateApplier(PartitionStore store) {
        this(new MergeEngine(), NormalizationEngine.createDefaultEngine(), store, new LocalPartitionLock(),
                new AuditService(), new NoOpMetricsService(), Clock.systemUTC());
    }

    public RecordUpdateApplier(MergeEngine mergeEngine, NormalizationEngine normalizationEngine,
                               PartitionStore store, PartitionLock lock, AuditService auditService,
                               MetricsService metricsService, Clock clock) {
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine is required");
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
        this.store = store;
        this.lock = lock != null ? lock : new LocalPartitionLock();
        this.auditService = auditService != null ? auditService : new AuditService();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Applies a batch to a record of an already-loaded partition. A record missing
     * from the snapshot is created as a stub.
     */
    public ApplyResult apply(PartitionSnapshot snapshot, String recordId, List<FieldCandidate> batch,
                             ApplyOptions options) {
        Objects.requireNonNull(snapshot, "snapshot is required");
        Objects.requireNonNull(recordId, "recordId is required");
        ApplyOptions opts = options != null ? options : ApplyOptions.defaults();
        if (batch == null || batch.isEmpty()) {
            return ApplyResult.empty(recordId);
        }

        MuseumRecord record = recordFor(snapshot, recordId);
        Optional<PrimaryDomain> domain = resolveDomain(record, batch);

        List<String> applied = new ArrayList<>();
        List<FieldRejection> rejected = new ArrayList<>();
        List<Recommendation> recommendations = new ArrayList<>();

        for (FieldCandidate candidate : batch) {
            String field = candidate.fieldName();
            GateResult gate = gate(candidate, domain, opts);
            if (gate.rejection() != null) {
                reject(recordId, candidate, gate.rejection(), rejected, opts);
                if (VolatilityPolicy.LOW_CONFIDENCE.equals(gate.rejection())) {
                    recommendations.add(Recommendation.fromCandidate(
                            recordId, candidate, record.get(field), gate.rejection()));
                }
                continue;
            }

            EnrichedField<?> envelope = candidate.field().withValue(gate.normalizedValue());
            MergeOutcome outcome = mergeEngine.merge(record.get(field), snapshot.getProvenance(recordId, field),
                    envelope, record.isLocked(field));

            if (outcome.accepted()) {
                commit(snapshot, record, field, outcome, envelope.source());
                applied.add(field);
                auditService.record(AuditAction.FIELD_APPLIED, recordId, opts.getActorId(), details(
                        field, outcome.reason().getCode(), envelope));
                metricsService.incrementFieldApplied(field);
                log.debug("field.applied recordId={} field={} reason={} source={}",
                        recordId, field, outcome.reason(), envelope.source());
            } else {
                reject(recordId, candidate, outcome.reason().getCode(), rejected, opts);
            }
        }

        if (!applied.isEmpty()) {
            record.touch(clock.instant());
        }
        return new ApplyResult(recordId, applied, rejected, recommendations);
    }

    /**
     * Loads the partition under its lock, applies the batch and atomically rewrites
     * the partition. Nothing is written in dry-run mode or when nothing was applied.
     */
    public ApplyResult applyAndPersist(String partitionId, String recordId, List<FieldCandidate> batch,
                                       ApplyOptions options) {
        ApplyOptions opts = options != null ? options : ApplyOptions.defaults();
        return withPartition(partitionId, opts.isDryRun(),
                snapshot -> apply(snapshot, recordId, batch, opts));
    }

    /**
     * Applies a human decision with {@code MANUAL_OVERRIDE} trust. The value is still
     * normalized and still subject to domain eligibility and the null/placeholder
     * rules; it passes manual locks and outranks every automated source.
     *
     * @param lockAfter when true the field is added to the record's manual locks
     */
    public ApplyResult applyManualOverride(PartitionSnapshot snapshot, String recordId, String field,
                                           Object value, String reviewerId, boolean lockAfter) {
        return applyManualOverride(snapshot, recordId, field, value, reviewerId, lockAfter, ApplyOptions.defaults());
    }

    /**
     * Manual override gated by the domain eligibility of {@code options}. Confidence and
     * volatility settings do not apply to human decisions.
     */
    public ApplyResult applyManualOverride(PartitionSnapshot snapshot, String recordId, String field,
                                           Object value, String reviewerId, boolean lockAfter,
                                           ApplyOptions options) {
        Objects.requireNonNull(reviewerId, "reviewerId is required");
        ApplyOptions opts = options != null ? options : ApplyOptions.defaults();
        if (!MuseumFields.CANDIDATE_FIELDS.contains(field)) {
            return new ApplyResult(recordId, List.of(),
                    List.of(new FieldRejection(field, UpdateReasons.UNKNOWN_FIELD, value)), List.of());
        }
        MuseumRecord record = recordFor(snapshot, recordId);
        EnrichedField<Object> override = EnrichedField.manualOverride(value, reviewerId, clock.instant());
        FieldCandidate candidate = new FieldCandidate(field, override);

        NormalizationResult normalized = normalizationEngine.normalize(field, value);
        if (!normalized.isValid()) {
            return rejectManual(recordId, candidate, normalized.failureReason(), reviewerId);
        }
        DomainEligibility eligibility = opts.getDomainEligibility();
        Optional<PrimaryDomain> domain = resolveDomain(record, List.of(candidate));
        if (!eligibility.isEligible(field, domain)) {
            return rejectManual(recordId, candidate, DomainEligibility.INELIGIBLE_DOMAIN, reviewerId);
        }

        EnrichedField<?> envelope = override.withValue(normalized.value());
        MergeOutcome outcome = mergeEngine.merge(record.get(field), snapshot.getProvenance(recordId, field),
                envelope, record.isLocked(field));
        if (outcome.rejected()) {
            return rejectManual(recordId, candidate, outcome.reason().getCode(), reviewerId);
        }

        commit(snapshot, record, field, outcome, envelope.source());
        if (lockAfter) {
            record.lockField(field);
        }
        record.touch(clock.instant());
        auditService.record(AuditAction.MANUAL_OVERRIDE_APPLIED, recordId, reviewerId,
                details(field, outcome.reason().getCode(), envelope));
        metricsService.incrementFieldApplied(field);
        log.info("field.manual_override recordId={} field={} reviewer={} locked={}",
                recordId, field, reviewerId, lockAfter);
        return new ApplyResult(recordId, List.of(field), List.of(), List.of());
    }

    public ApplyResult applyManualOverride(String partitionId, String recordId, String field, Object value,
                                           String reviewerId, boolean lockAfter) {
        return applyManualOverride(partitionId, recordId, field, value, reviewerId, lockAfter,
                ApplyOptions.defaults());
    }

    public ApplyResult applyManualOverride(String partitionId, String recordId, String field, Object value,
                                           String reviewerId, boolean lockAfter, ApplyOptions options) {
        ApplyOptions opts = options != null ? options : ApplyOptions.defaults();
        return withPartition(partitionId, opts.isDryRun(),
                snapshot -> applyManualOverride(snapshot, recordId, field, value, reviewerId, lockAfter, opts));
    }

    /**
     * Clears a field by human decision. This is the only path that may replace a
     * known value with null; the cleared field gets {@code MANUAL_OVERRIDE} provenance.
     */
    public ApplyResult clearField(PartitionSnapshot snapshot, String recordId, String field, String reviewerId) {
        Objects.requireNonNull(reviewerId, "reviewerId is required");
        MuseumRecord record = snapshot.getRecord(recordId)
                .orElseThrow(() -> new IllegalArgumentException("Record not found: " + recordId));
        EnrichedField<Object> cleared = EnrichedField.manualOverride(null, reviewerId, clock.instant());
        Object previous = record.get(field);

        record.set(field, null);
        snapshot.putProvenance(recordId, field, ProvenanceEntry.from(cleared));
        record.addDataSource(cleared.source());
        record.touch(clock.instant());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        details.put("reason", "manual_clear");
        details.put("previousValue", previous != null ? previous.toString() : null);
        auditService.record(AuditAction.MANUAL_OVERRIDE_APPLIED, recordId, reviewerId, details);
        log.info("field.cleared recordId={} field={} reviewer={}", recordId, field, reviewerId);
        return new ApplyResult(recordId, List.of(field), List.of(), List.of());
    }

    public ApplyResult clearField(String partitionId, String recordId, String field, String reviewerId) {
        return withPartition(partitionId, false, snapshot -> clearField(snapshot, recordId, field, reviewerId));
    }

    /**
     * Runs the gates that precede the merge engine, in order.
     */
    private GateResult gate(FieldCandidate candidate, Optional<PrimaryDomain> domain, ApplyOptions opts) {
        String field = candidate.fieldName();
        if (!MuseumFields.CANDIDATE_FIELDS.contains(field)) {
            return GateResult.rejected(UpdateReasons.UNKNOWN_FIELD);
        }
        if (candidate.field().isManualOverride()) {
            return GateResult.rejected(UpdateReasons.MANUAL_OVERRIDE_NOT_ALLOWED);
        }
        NormalizationResult normalized = normalizationEngine.normalize(field, candidate.value());
        if (!normalized.isValid()) {
            return GateResult.rejected(normalized.failureReason());
        }
        if (!opts.getDomainEligibility().isEligible(field, domain)) {
            return GateResult.rejected(DomainEligibility.INELIGIBLE_DOMAIN);
        }
        if (!opts.getVolatilityPolicy().allowsAutoApply(field, candidate.field(), opts.getConfidenceThreshold())) {
            return GateResult.rejected(VolatilityPolicy.LOW_CONFIDENCE);
        }
        return new GateResult(null, normalized.value());
    }

    private void commit(PartitionSnapshot snapshot, MuseumRecord record, String field,
                        MergeOutcome outcome, String source) {
        record.set(field, outcome.value());
        snapshot.putProvenance(record.getRecordId(), field, outcome.provenance());
        record.addDataSource(source);
    }

    private void reject(String recordId, FieldCandidate candidate, String reason,
                        List<FieldRejection> rejected, ApplyOptions opts) {
        rejected.add(new FieldRejection(candidate.fieldName(), reason, candidate.value()));
        auditService.record(AuditAction.FIELD_REJECTED, recordId, opts.getActorId(),
                details(candidate.fieldName(), reason, candidate.field()));
        metricsService.incrementFieldRejected(reason);
        log.debug("field.rejected recordId={} field={} reason={} source={}",
                recordId, candidate.fieldName(), reason, candidate.field().source());
    }

    private ApplyResult rejectManual(String recordId, FieldCandidate candidate, String reason, String reviewerId) {
        List<FieldRejection> rejected = new ArrayList<>();
        reject(recordId, candidate, reason, rejected, ApplyOptions.builder().actorId(reviewerId).build());
        return new ApplyResult(recordId, List.of(), rejected, List.of());
    }

    private ApplyResult withPartition(String partitionId, boolean dryRun,
                                      Function<PartitionSnapshot, ApplyResult> action) {
        if (store == null) {
            throw new IllegalStateException("No partition store configured");
        }
        lock.tryLock(partitionId);
        try {
            PartitionSnapshot snapshot = store.load(partitionId);
            ApplyResult result = action.apply(snapshot);
            if (!dryRun && result.hasChanges()) {
                snapshot.setUpdatedAt(clock.instant());
                store.save(snapshot);
            }
            return result;
        } finally {
            lock.unlock(partitionId);
        }
    }

    private static MuseumRecord recordFor(PartitionSnapshot snapshot, String recordId) {
        return snapshot.getRecord(recordId).orElseGet(() -> {
            MuseumRecord stub = MuseumRecord.builder().recordId(recordId).build();
            snapshot.putRecord(stub);
            log.debug("record.stub_created recordId={} partition={}", recordId, snapshot.getPartitionId());
            return stub;
        });
    }

    /**
     * The domain proposed in the batch wins over the stored one, so a record classified
     * in the same batch is gated against its new domain.
     */
    private static Optional<PrimaryDomain> resolveDomain(MuseumRecord record, List<FieldCandidate> batch) {
        for (FieldCandidate candidate : batch) {
            if (MuseumFields.PRIMARY_DOMAIN.equals(candidate.fieldName())) {
                Optional<PrimaryDomain> proposed = PrimaryDomain.fromValue(candidate.value());
                if (proposed.isPresent()) {
                    return proposed;
                }
            }
        }
        return record.getPrimaryDomain();
    }

    private static Map<String, Object> details(String field, String reason, EnrichedField<?> envelope) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        details.put("reason", reason);
        details.put("source", envelope.source());
        details.put("trustLevel", envelope.trustLevel().name());
        details.put("confidence", envelope.confidence());
        details.put("value", envelope.value() != null ? envelope.value().toString() : null);
        return details;
    }

    private record GateResult(String rejection, Object normalizedValue) {
        static GateResult rejected(String reason) {
            return new GateResult(reason, null);
        }
    }
}
