package com.museum.curation.adapter;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Parameters of one adapter call. Two requests with equal parameters are the same
 * request for caching purposes, whichever record asked.
 *
 * @param recordId   record the call is made for
 * @param parameters request parameters, key-sorted and read-only; the cache key is derived from these
 */
public record SourceRequest(String recordId, Map<String, Object> parameters) {

    public SourceRequest {
        Objects.requireNonNull(recordId, "recordId is required");
        parameters = Collections.unmodifiableSortedMap(
                parameters != null ? new TreeMap<>(parameters) : new TreeMap<>());
    }

    public static SourceRequest of(String recordId, Map<String, Object> parameters) {
        return new SourceRequest(recordId, parameters);
    }

    public Object parameter(String name) {
        return parameters.get(name);
    }
}
