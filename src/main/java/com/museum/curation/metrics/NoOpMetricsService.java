package com.museum.curation.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementFieldApplied(String fieldName) {
    }

    @Override
    public void incrementFieldRejected(String reason) {
    }

    @Override
    public void recordStageDuration(String stage, boolean success, Duration duration) {
    }

    @Override
    public void incrementStageFailure(String stage) {
    }

    @Override
    public void recordBudgetSpent(double dollars) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordDriftRate(double driftRate) {
    }
}
