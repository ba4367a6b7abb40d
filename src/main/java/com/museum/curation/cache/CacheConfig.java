package com.museum.curation.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Sizing of the source response cache. Responses are content-addressed, so the
 * bound is on distinct requests, not on records.
 *
 * @param maxResponses distinct requests kept before the least useful are evicted
 * @param ttl          age after which a response is fetched again
 * @param enabled      false builds a cache that stores nothing
 */
public record CacheConfig(long maxResponses, Duration ttl, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxResponses <= 0) {
            throw new IllegalArgumentException("maxResponses must be positive: " + maxResponses);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    /**
     * 10,000 responses kept for a week: encyclopedia and knowledge-base answers change slowly.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofDays(7), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }

    /**
     * Reads {@code curation.cache.max-responses}, {@code curation.cache.ttl-hours} and
     * {@code curation.cache.enabled}. Missing keys keep their defaults.
     */
    public static CacheConfig fromProperties(Properties properties) {
        CacheConfig defaults = defaults();
        String max = properties.getProperty("curation.cache.max-responses");
        String ttlHours = properties.getProperty("curation.cache.ttl-hours");
        String enabled = properties.getProperty("curation.cache.enabled");
        return new CacheConfig(
                max != null ? Long.parseLong(max.trim()) : defaults.maxResponses(),
                ttlHours != null ? Duration.ofHours(Long.parseLong(ttlHours.trim())) : defaults.ttl(),
                enabled != null ? Boolean.parseBoolean(enabled.trim()) : defaults.enabled());
    }
}
