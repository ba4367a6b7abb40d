package com.museum.curation.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code curation.field.applied} - Counter (tag: field)</li>
 *   <li>{@code curation.field.rejected} - Counter (tag: reason)</li>
 *   <li>{@code curation.stage.duration} - Timer (tags: stage, outcome)</li>
 *   <li>{@code curation.stage.failure} - Counter (tag: stage)</li>
 *   <li>{@code curation.budget.spent} - Counter, dollars</li>
 *   <li>{@code curation.cache.hit} / {@code curation.cache.miss} - Counter</li>
 *   <li>{@code curation.drift.rate} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter budgetSpentCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final DistributionSummary driftRateSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.budgetSpentCounter = Counter.builder("curation.budget.spent")
                .description("Dollars spent on paid source calls")
                .baseUnit("dollars")
                .register(registry);
        this.cacheHitCounter = Counter.builder("curation.cache.hit")
                .description("Number of source response cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("curation.cache.miss")
                .description("Number of source response cache misses")
                .register(registry);
        this.driftRateSummary = DistributionSummary.builder("curation.drift.rate")
                .description("Gold-set drift rate per run")
                .register(registry);
    }

    @Override
    public void incrementFieldApplied(String fieldName) {
        String key = "applied:" + fieldName;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("curation.field.applied")
                        .description("Number of field values applied to records")
                        .tag("field", fieldName)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementFieldRejected(String reason) {
        String key = "rejected:" + reason;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("curation.field.rejected")
                        .description("Number of field candidates rejected")
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordStageDuration(String stage, boolean success, Duration duration) {
        String outcome = success ? "success" : "failure";
        String key = stage + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("curation.stage.duration")
                        .description("Duration of a stage call for one record")
                        .tag("stage", stage)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementStageFailure(String stage) {
        String key = "failure:" + stage;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("curation.stage.failure")
                        .description("Number of failed stage calls")
                        .tag("stage", stage)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordBudgetSpent(double dollars) {
        budgetSpentCounter.increment(dollars);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordDriftRate(double driftRate) {
        driftRateSummary.record(driftRate);
    }
}
