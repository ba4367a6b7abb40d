package com.museum.curation.cache;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters of a response cache. Counters are cumulative over the cache's life;
 * {@link #since(CacheStats)} gives the share of one run.
 *
 * @param hits            requests answered from the cache
 * @param misses          requests that went to the source
 * @param evictions       responses dropped by size or age
 * @param cachedResponses responses currently held
 */
public record CacheStats(long hits, long misses, long evictions, long cachedResponses) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }

    public long lookups() {
        return hits + misses;
    }

    public double hitRate() {
        return lookups() == 0 ? 0.0 : (double) hits / lookups();
    }

    /**
     * Counters accumulated after {@code baseline} was taken. The cached response
     * count is the current one.
     */
    public CacheStats since(CacheStats baseline) {
        return new CacheStats(hits - baseline.hits, misses - baseline.misses,
                evictions - baseline.evictions, cachedResponses);
    }

    /**
     * Artifact form, as written to {@code metrics.json}.
     */
    public Map<String, Object> toArtifact() {
        Map<String, Object> artifact = new LinkedHashMap<>();
        artifact.put("lookups", lookups());
        artifact.put("hits", hits);
        artifact.put("misses", misses);
        artifact.put("hit_rate", hitRate());
        artifact.put("evictions", evictions);
        artifact.put("cached_responses", cachedResponses);
        return artifact;
    }
}
