package com.museum.curation.adapter;

import com.museum.curation.cache.ResponseCache;
import com.museum.curation.metrics.MetricsService;
import com.museum.curation.metrics.NoOpMetricsService;
import com.museum.curation.pipeline.CostEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decorates an adapter with a content-addressed response cache. A cached request
 * is free: {@link #estimateCost} reports zero so the budget is not charged twice.
 * Failures are not cached.
 *
 * <p>The cache is consulted once per request. {@link #estimateCost} remembers what
 * it found and the following {@link #fetch} of the same request uses that answer, so
 * an entry expiring between the two calls cannot turn a free estimate into an
 * uncharged paid call, and hit/miss statistics count each request once.</p>
 */
public class CachingSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(CachingSourceAdapter.class);

    private final SourceAdapter delegate;
    private final ResponseCache cache;
    private final MetricsService metricsService;
    private final Map<String, Optional<SourceResponse>> estimated = new ConcurrentHashMap<>();

    public CachingSourceAdapter(SourceAdapter delegate, ResponseCache cache) {
        this(delegate, cache, new NoOpMetricsService());
    }

    public CachingSourceAdapter(SourceAdapter delegate, ResponseCache cache, MetricsService metricsService) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public SourceResponse fetch(SourceRequest request) {
        String key = cache.keyFor(delegate.name(), request);
        Optional<SourceResponse> cached = estimated.remove(key);
        if (cached == null) {
            cached = cache.get(key);
        }
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            log.debug("source.cache_hit adapter={} recordId={}", delegate.name(), request.recordId());
            return cached.get();
        }
        metricsService.recordCacheMiss();
        SourceResponse response = delegate.fetch(request);
        cache.put(key, response);
        return response;
    }

    @Override
    public CostEstimate estimateCost(SourceRequest request) {
        String key = cache.keyFor(delegate.name(), request);
        Optional<SourceResponse> cached = cache.get(key);
        estimated.put(key, cached);
        if (cached.isPresent()) {
            return CostEstimate.free();
        }
        return delegate.estimateCost(request);
    }
}
