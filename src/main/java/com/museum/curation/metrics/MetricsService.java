package com.museum.curation.metrics;

import java.time.Duration;

/**
 * Interface for recording curation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a meter registry.
 */
public interface MetricsService {

    void incrementFieldApplied(String fieldName);

    void incrementFieldRejected(String reason);

    void recordStageDuration(String stage, boolean success, Duration duration);

    void incrementStageFailure(String stage);

    void recordBudgetSpent(double dollars);

    void recordCacheHit();

    void recordCacheMiss();

    void recordDriftRate(double driftRate);
}
