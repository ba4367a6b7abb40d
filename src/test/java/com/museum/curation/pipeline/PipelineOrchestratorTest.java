package com.museum.curation.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.museum.curation.adapter.CachingSourceAdapter;
import com.museum.curation.adapter.SourceAdapter;
import com.museum.curation.adapter.SourceRequest;
import com.museum.curation.adapter.SourceResponse;
import com.museum.curation.audit.AuditAction;
import com.museum.curation.audit.AuditService;
import com.museum.curation.audit.RunArtifactWriter;
import com.museum.curation.cache.CacheConfig;
import com.museum.curation.cache.CaffeineResponseCache;
import com.museum.curation.cache.ResponseCache;
import com.museum.curation.core.model.FieldCandidate;
import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.core.model.Recommendation;
import com.museum.curation.core.model.TrustLevel;
import com.museum.curation.lock.LockAcquisitionException;
import com.museum.curation.lock.PartitionLock;
import com.museum.curation.review.InMemoryReviewQueue;
import com.museum.curation.review.ReviewItem;
import com.museum.curation.review.ReviewKind;
import com.museum.curation.review.ReviewService;
import com.museum.curation.store.InMemoryPartitionStore;
import com.museum.curation.store.PartitionSnapshot;
import com.museum.curation.update.RecordUpdateApplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

@DisplayName("PipelineOrchestrator")
class PipelineOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-07-01T12:00:00Z");

    private InMemoryPartitionStore store;
    private AuditService auditService;
    private InMemoryReviewQueue reviewQueue;

    @BeforeEach
    void setUp() {
        store = new InMemoryPartitionStore();
        auditService = new AuditService();
        reviewQueue = new InMemoryReviewQueue();
    }

    private PipelineOrchestrator.Builder orchestrator() {
        return PipelineOrchestrator.builder()
                .store(store)
                .auditService(auditService)
                .reviewService(new ReviewService(reviewQueue, null, auditService))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .runIdSupplier(() -> "run-test");
    }

    private void seed(String partitionId, MuseumRecord... records) {
        PartitionSnapshot snapshot = new PartitionSnapshot(partitionId);
        for (MuseumRecord record : records) {
            snapshot.putRecord(record);
        }
        store.save(snapshot);
    }

    private static MuseumRecord museum(String id) {
        return MuseumRecord.builder()
                .recordId(id)
                .field(MuseumFields.MUSEUM_NAME, "Museum " + id)
                .field(MuseumFields.CITY, "Denver")
                .field(MuseumFields.PRIMARY_DOMAIN, "Art")
                .build();
    }

    private static MuseumRecord scoredArt(String id, int strength) {
        return MuseumRecord.builder(museum(id))
                .field(MuseumFields.IMPRESSIONIST_STRENGTH, strength)
                .field(MuseumFields.MODERN_CONTEMPORARY_STRENGTH, strength)
                .field(MuseumFields.HISTORICAL_CONTEXT_SCORE, 3)
                .field(MuseumFields.REPUTATION, 1)
                .field(MuseumFields.COLLECTION_TIER, 1)
                .build();
    }

    private static StageOutput phoneCandidate(MuseumRecord record) {
        return StageOutput.of(List.of(FieldCandidate.of(MuseumFields.PHONE, "303-555-" + record.getRecordId(),
                "wikidata", TrustLevel.KNOWLEDGE_BASE, 4)));
    }

    private MuseumRecord stored(String partitionId, String recordId) {
        return store.load(partitionId).getRecord(recordId).orElseThrow();
    }

    @Nested
    @DisplayName("Completed runs")
    class Completed {

        @Test
        @DisplayName("Stages apply candidates and derived fields, then the index is rebuilt")
        void happyPath() {
            seed("us-co", museum("a"), museum("b"));
            FakeStage backbone = new FakeStage(StageName.BACKBONE_NORMALIZATION)
                    .processing(r -> new StageOutput(phoneCandidate(r).candidates(),
                            Map.of(MuseumFields.NEARBY_MUSEUM_COUNT, 2), List.of()))
                    .hasOutputWhen(r -> r.get(MuseumFields.NEARBY_MUSEUM_COUNT) != null);
            FakeStage priority = new FakeStage(StageName.PRIORITY_CALCULATION);

            RunResult result = orchestrator().stage(priority).stage(backbone).build()
                    .run(List.of("us-co"), RunOptions.defaults());

            assertEquals(RunStatus.COMPLETED, result.status());
            assertTrue(result.isCompleted());
            assertEquals(4, result.recordsProcessed());
            assertEquals(0, result.recordsFailed());
            assertEquals(2, result.changes().size());
            assertEquals(List.of(MuseumFields.PHONE), result.changes().get(0).appliedFields());
            assertEquals(List.of(MuseumFields.NEARBY_MUSEUM_COUNT), result.changes().get(0).derivedFields());
            assertEquals("303-555-a", stored("us-co", "a").get(MuseumFields.PHONE));
            assertEquals(2, stored("us-co", "b").get(MuseumFields.NEARBY_MUSEUM_COUNT));
            assertEquals(NOW, stored("us-co", "a").getUpdatedAt());
            assertEquals(List.of(StageName.BACKBONE_NORMALIZATION, StageName.PRIORITY_CALCULATION),
                    result.partitions().get(0).stagesRun());
            assertTrue(result.indexRebuilt());
            assertEquals(2, store.getIndex().size());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RUN_STARTED).size());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RUN_FINISHED).size());
        }

        @Test
        @DisplayName("Stages are ordered by name regardless of registration")
        void stageOrder() {
            PipelineOrchestrator orchestrator = orchestrator()
                    .stage(new FakeStage(StageName.PRIORITY_CALCULATION))
                    .stage(new FakeStage(StageName.IDENTITY_RESOLUTION))
                    .stage(new FakeStage(StageName.ENCYCLOPEDIA_LOOKUP))
                    .build();

            assertEquals(List.of(StageName.IDENTITY_RESOLUTION, StageName.ENCYCLOPEDIA_LOOKUP,
                    StageName.PRIORITY_CALCULATION),
                    orchestrator.getStages().stream().map(PipelineStage::name).toList());
        }

        @Test
        @DisplayName("Duplicate and index stages cannot be registered")
        void builderValidation() {
            PipelineOrchestrator.Builder builder = orchestrator().stage(new FakeStage(StageName.ENCYCLOPEDIA_LOOKUP));

            assertThrows(IllegalArgumentException.class,
                    () -> builder.stage(new FakeStage(StageName.ENCYCLOPEDIA_LOOKUP)));
            assertThrows(IllegalArgumentException.class,
                    () -> builder.stage(new FakeStage(StageName.INDEX_REBUILD)));
            assertThrows(NullPointerException.class, () -> PipelineOrchestrator.builder().build());
        }

        @Test
        @DisplayName("Derived fields outside the derived set are not written")
        void derivedRestricted() {
            seed("us-co", museum("a"));
            FakeStage stage = new FakeStage(StageName.PRIORITY_CALCULATION)
                    .processing(r -> StageOutput.derived(Map.of(
                            MuseumFields.CITY, "Boulder",
                            MuseumFields.PRIORITY_SCORE, 7)));

            RunResult result = orchestrator().stage(stage).build().run(List.of("us-co"), RunOptions.defaults());

            assertEquals("Denver", stored("us-co", "a").get(MuseumFields.CITY));
            assertEquals(7, stored("us-co", "a").get(MuseumFields.PRIORITY_SCORE));
            assertEquals(List.of(MuseumFields.PRIORITY_SCORE), result.changes().get(0).derivedFields());
        }

        @Test
        @DisplayName("Derived nulls never erase a stored value")
        void derivedNullIgnored() {
            seed("us-co", MuseumRecord.builder(museum("a")).field(MuseumFields.PRIORITY_SCORE, 9).build());
            Map<String, Object> derived = new java.util.HashMap<>();
            derived.put(MuseumFields.PRIORITY_SCORE, null);
            FakeStage stage = new FakeStage(StageName.PRIORITY_CALCULATION)
                    .processing(r -> StageOutput.derived(derived));

            RunResult result = orchestrator().stage(stage).build().run(List.of("us-co"), RunOptions.defaults());

            assertEquals(9, stored("us-co", "a").get(MuseumFields.PRIORITY_SCORE));
            assertTrue(result.changes().isEmpty());
            assertEquals(1, store.getSaveCount());
        }
    }

    @Nested
    @DisplayName("Governance")
    class Governance {

        @Test
        @DisplayName("Budget ceiling aborts before the call that would cross it")
        void budgetAbort() {
            seed("us-co", museum("a"), museum("b"), museum("c"));
            FakeStage paid = new FakeStage(StageName.LLM_JUDGED_SCORING)
                    .costing(1.0)
                    .processing(PipelineOrchestratorTest::phoneCandidate);
            FakeStage priority = new FakeStage(StageName.PRIORITY_CALCULATION);

            RunResult result = orchestrator().stage(paid).stage(priority).build().run(List.of("us-co"),
                    RunOptions.builder().totalBudget(2.0).reserveRatio(0.0).build());

            assertEquals(RunStatus.ABORTED_BUDGET, result.status());
            assertNotNull(result.abortReason());
            assertEquals(List.of("a", "b"), paid.processed);
            assertEquals(2.0, result.budgetSpent(), 1e-9);
            assertTrue(priority.processed.isEmpty());
            assertEquals("303-555-b", stored("us-co", "b").get(MuseumFields.PHONE));
            assertNull(stored("us-co", "c").get(MuseumFields.PHONE));
            assertFalse(result.indexRebuilt());
        }

        @Test
        @DisplayName("Reserve ratio keeps part of the budget unspent")
        void reserveRatio() {
            seed("us-co", museum("a"), museum("b"));
            FakeStage paid = new FakeStage(StageName.LLM_JUDGED_SCORING).costing(1.0);

            RunResult result = orchestrator().stage(paid).build().run(List.of("us-co"),
                    RunOptions.builder().totalBudget(2.0).reserveRatio(0.25).build());

            assertEquals(RunStatus.ABORTED_BUDGET, result.status());
            assertEquals(List.of("a"), paid.processed);
        }

        @Test
        @DisplayName("Free stages run with a zero budget")
        void freeStagesIgnoreBudget() {
            seed("us-co", museum("a"));
            FakeStage free = new FakeStage(StageName.BACKBONE_NORMALIZATION);

            RunResult result = orchestrator().stage(free).build().run(List.of("us-co"),
                    RunOptions.builder().totalBudget(0.0).build());

            assertEquals(RunStatus.COMPLETED, result.status());
            assertEquals(List.of("a"), free.processed);
        }

        @Test
        @DisplayName("Failure rate above the threshold aborts the run")
        void failureRateAbort() {
            seed("us-co", museum("a"), museum("b"));
            seed("us-ny", museum("c"));
            FakeStage failing = new FakeStage(StageName.ENCYCLOPEDIA_LOOKUP)
                    .processing(r -> {
                        throw new StageException("wikipedia unavailable");
                    });

            RunResult result = orchestrator().stage(failing).build()
                    .run(List.of("us-co", "us-ny"), RunOptions.defaults());

            assertEquals(RunStatus.ABORTED_FAILURE_RATE, result.status());
            assertEquals(1, result.recordsProcessed());
            assertEquals(1, result.recordsFailed());
            assertEquals(1, result.partitions().size());
            ReviewItem item = reviewQueue.getPending().get(0);
            assertEquals(ReviewKind.STAGE_FAILURE, item.getKind());
            assertEquals("a", item.getRecordId());
            assertEquals("wikipedia unavailable", item.getReason());
        }

        @Test
        @DisplayName("Failures at the threshold are queued but do not abort")
        void failureRateAtThreshold() {
            seed("us-co", museum("a"), museum("b"), museum("c"), museum("d"));
            FakeStage flaky = new FakeStage(StageName.ENCYCLOPEDIA_LOOKUP)
                    .processing(r -> {
                        if (r.getRecordId().equals("b")) {
                            throw new IllegalStateException("timeout");
                        }
                        return StageOutput.empty();
                    });

            RunResult result = orchestrator().stage(flaky).build().run(List.of("us-co"),
                    RunOptions.builder().failureRateThreshold(0.5).build());

            assertEquals(RunStatus.COMPLETED, result.status());
            assertEquals(4, result.recordsProcessed());
            assertEquals(1, result.recordsFailed());
            assertEquals(0.25, result.failureRate(), 1e-9);
            assertEquals(1, result.reviewItemsQueued());
        }

        @Test
        @DisplayName("Drift above the threshold marks the run without rolling back")
        void driftAbort(@TempDir Path dir) throws IOException {
            seed("us-co", museum("a"));
            Path gold = dir.resolve("gold.json");
            Files.writeString(gold, "{\"museums\": [{\"museum_id\": \"a\", \"expected\": "
                    + "{\"city\": \"Boulder\", \"primary_domain\": \"Art\"}}]}");
            FakeStage stage = new FakeStage(StageName.BACKBONE_NORMALIZATION)
                    .processing(PipelineOrchestratorTest::phoneCandidate);

            RunResult result = orchestrator().stage(stage).build().run(List.of("us-co"),
                    RunOptions.builder().driftCheckEnabled(true).goldSetPath(gold).build());

            assertEquals(RunStatus.ABORTED_DRIFT, result.status());
            assertEquals(0.5, result.driftReport().driftRate(), 1e-9);
            assertEquals("303-555-a", stored("us-co", "a").get(MuseumFields.PHONE));
            assertTrue(result.indexRebuilt());
        }

        @Test
        @DisplayName("Drift within the threshold completes")
        void driftWithinThreshold(@TempDir Path dir) throws IOException {
            seed("us-co", museum("a"));
            Path gold = dir.resolve("gold.json");
            Files.writeString(gold, "[{\"museum_id\": \"a\", \"city\": \"Denver\"}, "
                    + "{\"museum_id\": \"missing\", \"city\": \"Nowhere\"}]");

            RunResult result = orchestrator().stage(new FakeStage(StageName.BACKBONE_NORMALIZATION)).build()
                    .run(List.of("us-co"), RunOptions.builder().driftCheckEnabled(true).goldSetPath(gold).build());

            assertEquals(RunStatus.COMPLETED, result.status());
            assertEquals(0.0, result.driftReport().driftRate());
            assertEquals(List.of("missing"), result.driftReport().recordsSkipped());
        }

        @Test
        @DisplayName("A missing gold set is reported, not fatal")
        void missingGoldSet(@TempDir Path dir) {
            seed("us-co", museum("a"));

            RunResult result = orchestrator().stage(new FakeStage(StageName.BACKBONE_NORMALIZATION)).build()
                    .run(List.of("us-co"), RunOptions.builder()
                            .driftCheckEnabled(true)
                            .goldSetPath(dir.resolve("absent.json"))
                            .build());

            assertEquals(RunStatus.COMPLETED, result.status());
            assertNull(result.driftReport());
            assertNotNull(result.driftError());
        }
    }

    @Nested
    @DisplayName("Record failures")
    class RecordFailures {

        @Test
        @DisplayName("A failing cost estimate is a record failure and the run still finishes")
        void estimateFails(@TempDir Path root) {
            seed("us-co", museum("a"), museum("b"));
            FakeStage stage = new FakeStage(StageName.ENCYCLOPEDIA_LOOKUP)
                    .estimating(r -> {
                        if (r.getRecordId().equals("b")) {
                            throw new IllegalStateException("adapter estimate failed");
                        }
                        return CostEstimate.ofDollars(0.01);
                    })
                    .processing(PipelineOrchestratorTest::phoneCandidate);

            RunResult result = orchestrator().stage(stage).build().run(List.of("us-co"),
                    RunOptions.builder().failureRateThreshold(0.5).artifactRoot(root).build());

            assertEquals(RunStatus.COMPLETED, result.status());
            assertEquals(2, result.recordsProcessed());
            assertEquals(1, result.recordsFailed());
            assertEquals(List.of("a"), stage.processed);
            assertEquals(0.01, result.budgetSpent(), 1e-9);
            assertEquals("303-555-a", stored("us-co", "a").get(MuseumFields.PHONE));

            ReviewItem item = reviewQueue.getPending().get(0);
            assertEquals(ReviewKind.STAGE_FAILURE, item.getKind());
            assertEquals("b", item.getRecordId());
            assertEquals("adapter estimate failed", item.getReason());
            assertTrue(Files.exists(root.resolve("run-test").resolve(RunArtifactWriter.SUMMARY)));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RUN_FINISHED).size());
        }

        @Test
        @DisplayName("A failing apply is a record failure; the call is still charged")
        void applyFails() {
            seed("us-co", museum("a"), museum("b"));
            RecordUpdateApplier applier = spy(new RecordUpdateApplier(store));
            doThrow(new IllegalStateException("apply failed"))
                    .when(applier).apply(any(), eq("b"), anyList(), any());
            FakeStage stage = new FakeStage(StageName.ENCYCLOPEDIA_LOOKUP)
                    .costing(0.01)
                    .processing(PipelineOrchestratorTest::phoneCandidate);

            RunResult result = orchestrator().applier(applier).stage(stage).build().run(List.of("us-co"),
                    RunOptions.builder().failureRateThreshold(0.5).build());

            assertEquals(RunStatus.COMPLETED, result.status());
            assertEquals(List.of("a", "b"), stage.processed);
            assertEquals(1, result.recordsFailed());
            assertEquals(0.02, result.budgetSpent(), 1e-9);
            assertEquals("303-555-a", stored("us-co", "a").get(MuseumFields.PHONE));
            assertNull(stored("us-co", "b").get(MuseumFields.PHONE));
            assertEquals("apply failed", reviewQueue.getPending().get(0).getReason());
        }

        @Test
        @DisplayName("Artifacts and the closing audit entry are written when the run body throws")
        void artifactsOnUnexpectedError(@TempDir Path root) {
            seed("us-co", museum("a"));
            PartitionLock brokenLock = mock(PartitionLock.class);
            doThrow(new IllegalStateException("lock service down")).when(brokenLock).tryLock("us-co");

            IllegalStateException thrown = assertThrows(IllegalStateException.class,
                    () -> orchestrator().lock(brokenLock).stage(new FakeStage(StageName.BACKBONE_NORMALIZATION))
                            .build().run(List.of("us-co"), RunOptions.builder().artifactRoot(root).build()));

            assertEquals("lock service down", thrown.getMessage());
            assertTrue(Files.exists(root.resolve("run-test").resolve(RunArtifactWriter.SUMMARY)));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RUN_FINISHED).size());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("A stage whose prerequisite is unmet does not run")
        void prerequisiteUnmet() {
            seed("us-co", museum("a"), museum("b"));
            FakeStage backbone = new FakeStage(StageName.BACKBONE_NORMALIZATION)
                    .hasOutputWhen(r -> r.has(MuseumFields.CITY_TIER));
            FakeStage priority = new FakeStage(StageName.PRIORITY_CALCULATION);

            RunResult result = orchestrator().stage(backbone).stage(priority).build()
                    .run(List.of("us-co"), RunOptions.defaults());

            PartitionOutcome outcome = result.partitions().get(0);
            assertFalse(outcome.isValid());
            assertTrue(outcome.validationError().contains("backbone_normalization"));
            assertEquals(List.of(StageName.BACKBONE_NORMALIZATION), outcome.stagesRun());
            assertTrue(priority.processed.isEmpty());
            assertFalse(result.indexRebuilt());
            assertEquals(RunStatus.COMPLETED, result.status());
        }

        @Test
        @DisplayName("Prerequisite ratio is inclusive")
        void prerequisiteRatio() {
            seed("us-co", MuseumRecord.builder(museum("a")).field(MuseumFields.CITY_TIER, 1).build(), museum("b"));
            FakeStage backbone = new FakeStage(StageName.BACKBONE_NORMALIZATION)
                    .hasOutputWhen(r -> r.has(MuseumFields.CITY_TIER));
            FakeStage priority = new FakeStage(StageName.PRIORITY_CALCULATION);

            RunResult result = orchestrator().stage(backbone).stage(priority).build()
                    .run(List.of("us-co"), RunOptions.builder().prerequisiteRatio(0.5).build());

            assertTrue(result.partitions().get(0).isValid());
            assertEquals(2, priority.processed.size());
        }

        @Test
        @DisplayName("A start stage is still checked against the stage before it")
        void startStageChecked() {
            seed("us-co", museum("a"));
            FakeStage backbone = new FakeStage(StageName.BACKBONE_NORMALIZATION).hasOutputWhen(r -> false);
            FakeStage priority = new FakeStage(StageName.PRIORITY_CALCULATION);

            RunResult result = orchestrator().stage(backbone).stage(priority).build().run(List.of("us-co"),
                    RunOptions.builder().startStage(StageName.PRIORITY_CALCULATION).build());

            assertTrue(backbone.processed.isEmpty());
            assertTrue(priority.processed.isEmpty());
            assertFalse(result.partitions().get(0).isValid());
        }

        @Test
        @DisplayName("Skipping validation runs the stage anyway")
        void skipValidation() {
            seed("us-co", museum("a"));
            FakeStage backbone = new FakeStage(StageName.BACKBONE_NORMALIZATION).hasOutputWhen(r -> false);
            FakeStage priority = new FakeStage(StageName.PRIORITY_CALCULATION);

            orchestrator().stage(backbone).stage(priority).build().run(List.of("us-co"),
                    RunOptions.builder().skipValidation(true).build());

            assertEquals(List.of("a"), priority.processed);
        }

        @Test
        @DisplayName("Targeted stages are not prerequisites")
        void targetedNotPrerequisite() {
            seed("us-co", museum("a"));
            FakeStage backbone = new FakeStage(StageName.BACKBONE_NORMALIZATION);
            FakeStage judge = new FakeStage(StageName.LLM_JUDGED_SCORING).targeted().hasOutputWhen(r -> false);
            FakeStage priority = new FakeStage(StageName.PRIORITY_CALCULATION);

            RunResult result = orchestrator().stage(backbone).stage(judge).stage(priority).build()
                    .run(List.of("us-co"), RunOptions.builder().topN(0).build());

            assertTrue(result.partitions().get(0).isValid());
            assertTrue(judge.processed.isEmpty());
            assertEquals(List.of("a"), priority.processed);
        }

        @Test
        @DisplayName("Empty and missing partitions fail validation while others still run")
        void emptyAndMissing() {
            seed("empty");
            seed("us-co", museum("a"));
            FakeStage stage = new FakeStage(StageName.BACKBONE_NORMALIZATION);

            RunResult result = orchestrator().stage(stage).build()
                    .run(List.of("empty", "absent", "us-co"), RunOptions.defaults());

            assertEquals(3, result.partitions().size());
            assertEquals("partition is empty", result.partitions().get(0).validationError());
            assertFalse(result.partitions().get(1).isValid());
            assertTrue(result.partitions().get(2).isValid());
            assertEquals(List.of("a"), stage.processed);
            assertEquals(2, result.failedPartitions().size());
            assertFalse(result.indexRebuilt());
        }

        @Test
        @DisplayName("A partition whose lock cannot be taken is skipped")
        void lockFailure() {
            seed("us-ca", museum("a"));
            seed("us-co", museum("b"));
            PartitionLock lock = mock(PartitionLock.class);
            when(lock.tryLock("us-ca")).thenThrow(new LockAcquisitionException("us-ca", "held by another run"));
            when(lock.tryLock("us-co")).thenReturn(true);
            FakeStage stage = new FakeStage(StageName.BACKBONE_NORMALIZATION);

            RunResult result = orchestrator().lock(lock).stage(stage).build()
                    .run(List.of("us-ca", "us-co"), RunOptions.defaults());

            assertTrue(result.partitions().get(0).validationError().contains("held by another run"));
            assertEquals(List.of("b"), stage.processed);
        }
    }

    @Nested
    @DisplayName("Targeting and review")
    class TargetingAndReview {

        @Test
        @DisplayName("Targeted stages only see the top-N records")
        void topN() {
            seed("us-co", scoredArt("weak", 1), scoredArt("strong", 5));
            seed("us-ny", scoredArt("middling", 3));
            FakeStage judge = new FakeStage(StageName.LLM_JUDGED_SCORING).targeted();

            orchestrator().stage(judge).build().run(List.of("us-co", "us-ny"),
                    RunOptions.builder().topN(2).build());

            assertEquals(List.of("strong", "middling"), judge.processed);
        }

        @Test
        @DisplayName("Low-confidence candidates and stage recommendations are queued for review")
        void reviewQueued() {
            seed("us-co", museum("a"));
            Recommendation flagged = new Recommendation(null, MuseumFields.MUSEUM_NAME, null, "Denver Art Museum",
                    "possible rename", 3, "press release", "web", TrustLevel.MODEL_EXTRACTED, NOW);
            FakeStage judge = new FakeStage(StageName.LLM_JUDGED_SCORING)
                    .processing(r -> new StageOutput(
                            List.of(FieldCandidate.of(MuseumFields.REPUTATION, 0, "llm", TrustLevel.MODEL_GUESS, 5)),
                            Map.of(), List.of(flagged)));

            RunResult result = orchestrator().stage(judge).build().run(List.of("us-co"), RunOptions.defaults());

            assertEquals(2, result.reviewItemsQueued());
            List<ReviewItem> pending = reviewQueue.getPending();
            assertEquals(ReviewKind.FIELD_REJECTION, pending.get(0).getKind());
            assertEquals(MuseumFields.REPUTATION, pending.get(0).getFieldName());
            assertEquals(ReviewKind.RECOMMENDATION, pending.get(1).getKind());
            assertEquals("a", pending.get(1).getRecordId());
            assertNull(stored("us-co", "a").get(MuseumFields.REPUTATION));
            assertEquals("low_confidence", result.changes().get(0).rejectedFields().get(0).reason());
        }
    }

    @Nested
    @DisplayName("Dry run and artifacts")
    class DryRunAndArtifacts {

        @Test
        @DisplayName("Dry run reports changes, chains stages in memory and writes nothing")
        void dryRun() {
            seed("us-co", museum("a"));
            int savesBefore = store.getSaveCount();
            FakeStage backbone = new FakeStage(StageName.BACKBONE_NORMALIZATION)
                    .processing(r -> StageOutput.derived(Map.of(MuseumFields.NEARBY_MUSEUM_COUNT, 7)))
                    .hasOutputWhen(r -> r.get(MuseumFields.NEARBY_MUSEUM_COUNT) != null);
            FakeStage priority = new FakeStage(StageName.PRIORITY_CALCULATION)
                    .processing(r -> StageOutput.derived(Map.of(MuseumFields.PRIORITY_SCORE,
                            r.get(MuseumFields.NEARBY_MUSEUM_COUNT))));

            RunResult result = orchestrator().stage(backbone).stage(priority).build()
                    .run(List.of("us-co"), RunOptions.builder().dryRun(true).build());

            assertTrue(result.dryRun());
            assertEquals(savesBefore, store.getSaveCount());
            assertEquals(2, result.changes().size());
            assertEquals(List.of(MuseumFields.PRIORITY_SCORE), result.changes().get(1).derivedFields());
            assertNull(stored("us-co", "a").get(MuseumFields.NEARBY_MUSEUM_COUNT));
            assertFalse(result.indexRebuilt());
            assertTrue(store.getIndex().isEmpty());
        }

        @Test
        @DisplayName("Artifacts are written under the run id")
        void artifacts(@TempDir Path root) throws IOException {
            seed("us-co", museum("a"));
            FakeStage stage = new FakeStage(StageName.BACKBONE_NORMALIZATION)
                    .processing(PipelineOrchestratorTest::phoneCandidate);

            RunResult result = orchestrator().stage(stage).build().run(List.of("us-co"),
                    RunOptions.builder().artifactRoot(root).build());

            Path runDir = root.resolve("run-test");
            assertEquals(runDir.toString(), result.artifactDirectory());
            assertTrue(Files.exists(runDir.resolve(RunArtifactWriter.CHANGES)));
            assertTrue(Files.exists(runDir.resolve(RunArtifactWriter.REVIEW_QUEUE)));
            assertTrue(Files.exists(runDir.resolve(RunArtifactWriter.METRICS)));
            assertTrue(Files.exists(runDir.resolve(RunArtifactWriter.SUMMARY)));
            assertFalse(Files.exists(runDir.resolve(RunArtifactWriter.DRIFT_REPORT)));
            assertTrue(result.artifactErrors().isEmpty());

            JsonNode summary = new ObjectMapper().readTree(runDir.resolve(RunArtifactWriter.SUMMARY).toFile());
            assertEquals("completed", summary.get("status").asText());
            assertEquals(2, summary.get("audit_entries").asInt());
            assertEquals(1, summary.get("audited_field_decisions").asInt());
            assertEquals("us-co", auditService.getEntriesByAction(AuditAction.FIELD_APPLIED).get(0).partitionId());
        }

        @Test
        @DisplayName("Metrics report the cache lookups of this run only")
        void cacheMetrics(@TempDir Path root) throws IOException {
            seed("us-co", museum("a"), museum("b"));
            ResponseCache cache = new CaffeineResponseCache(CacheConfig.defaults());
            cache.get("looked-up-before-the-run");
            CachingSourceAdapter wikipedia = new CachingSourceAdapter(new SourceAdapter() {
                @Override
                public String name() {
                    return "wikipedia";
                }

                @Override
                public SourceResponse fetch(SourceRequest request) {
                    return SourceResponse.empty();
                }
            }, cache);
            FakeStage stage = new FakeStage(StageName.ENCYCLOPEDIA_LOOKUP)
                    .processing(r -> {
                        wikipedia.fetch(SourceRequest.of(r.getRecordId(), Map.of("city", "Denver")));
                        return StageOutput.empty();
                    });

            orchestrator().responseCache(cache).stage(stage).build().run(List.of("us-co"),
                    RunOptions.builder().artifactRoot(root).build());

            JsonNode metrics = new ObjectMapper().readTree(
                    root.resolve("run-test").resolve(RunArtifactWriter.METRICS).toFile());
            assertEquals(2, metrics.get("cache").get("lookups").asInt());
            assertEquals(1, metrics.get("cache").get("hits").asInt());
            assertEquals(0.5, metrics.get("cache").get("hit_rate").asDouble(), 1e-9);
        }

        @Test
        @DisplayName("Artifacts from an earlier run with the same id are never overwritten")
        void artifactsCreateOnce(@TempDir Path root) throws IOException {
            seed("us-co", museum("a"));
            Files.createDirectories(root.resolve("run-test"));
            Files.writeString(root.resolve("run-test").resolve(RunArtifactWriter.SUMMARY), "{}");

            RunResult result = orchestrator().stage(new FakeStage(StageName.BACKBONE_NORMALIZATION)).build()
                    .run(List.of("us-co"), RunOptions.builder().artifactRoot(root).build());

            assertEquals(1, result.artifactErrors().size());
            assertEquals("{}", Files.readString(root.resolve("run-test").resolve(RunArtifactWriter.SUMMARY)));
        }

        @Test
        @DisplayName("Stage subset limits what runs")
        void stageSubset() {
            seed("us-co", museum("a"));
            FakeStage backbone = new FakeStage(StageName.BACKBONE_NORMALIZATION);
            FakeStage priority = new FakeStage(StageName.PRIORITY_CALCULATION);

            RunResult result = orchestrator().stage(backbone).stage(priority).build().run(List.of("us-co"),
                    RunOptions.builder().stages(EnumSet.of(StageName.BACKBONE_NORMALIZATION)).build());

            assertEquals(List.of("a"), backbone.processed);
            assertTrue(priority.processed.isEmpty());
            assertFalse(result.indexRebuilt());
        }
    }
}
