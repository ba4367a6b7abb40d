package com.museum.curation.drift;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Manually curated expected values: record id to field to expected value.
 */
public class GoldSet {

    private final Map<String, Map<String, Object>> expected;

    public GoldSet(Map<String, Map<String, Object>> expected) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        if (expected != null) {
            expected.forEach((id, fields) -> copy.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        }
        this.expected = Collections.unmodifiableMap(copy);
    }

    public Set<String> recordIds() {
        return expected.keySet();
    }

    public Map<String, Object> expectedFor(String recordId) {
        return expected.getOrDefault(recordId, Map.of());
    }

    public Map<String, Map<String, Object>> asMap() {
        return expected;
    }

    public int size() {
        return expected.size();
    }
}
