package com.museum.curation.drift;

/**
 * One gold-set field whose live value differs from the expected value.
 */
public record DriftDiff(String recordId, String field, Object expected, Object actual) {
}
