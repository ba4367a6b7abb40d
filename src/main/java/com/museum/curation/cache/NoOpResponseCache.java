package com.museum.curation.cache;

import com.museum.curation.adapter.SourceResponse;

import java.util.Optional;

/**
 * Cache that stores nothing; every lookup misses.
 */
public class NoOpResponseCache implements ResponseCache {

    @Override
    public Optional<SourceResponse> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, SourceResponse response) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
