package com.museum.curation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.museum.curation.adapter.SourceResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed response cache with write-time expiry.
 */
public class CaffeineResponseCache implements ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResponseCache.class);

    private final Cache<String, SourceResponse> cache;

    public CaffeineResponseCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    /**
     * @param ticker time source, replaceable in tests to exercise expiry
     */
    public CaffeineResponseCache(CacheConfig config, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxResponses())
                .expireAfterWrite(config.ttl())
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("cache.initialized maxResponses={} ttl={}", config.maxResponses(), config.ttl());
    }

    /**
     * Builds the cache described by the config: Caffeine when enabled, otherwise a no-op cache.
     */
    public static ResponseCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineResponseCache(config) : new NoOpResponseCache();
    }

    @Override
    public Optional<SourceResponse> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(String key, SourceResponse response) {
        cache.put(key, response);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("response cache cleared");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
