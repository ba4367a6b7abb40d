package com.museum.curation.cache;

import com.museum.curation.adapter.SourceRequest;
import com.museum.curation.adapter.SourceResponse;

import java.util.Optional;

/**
 * Content-addressed cache of source responses, shared by all adapters of a run.
 * Entries expire by TTL only; there is no eager invalidation on writes.
 */
public interface ResponseCache {

    Optional<SourceResponse> get(String key);

    void put(String key, SourceResponse response);

    void invalidateAll();

    CacheStats getStats();

    /**
     * SHA-256 of the adapter name and the key-sorted JSON of the request parameters.
     * The record id is not part of the key.
     */
    default String keyFor(String adapterName, SourceRequest request) {
        return CacheKeys.keyFor(adapterName, request);
    }
}
