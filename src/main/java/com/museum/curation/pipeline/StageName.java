package com.museum.curation.pipeline;

import java.util.Locale;

/**
 * Canonical stage order of a curation run. {@link #INDEX_REBUILD} runs once per run
 * after every partition; the others run per partition.
 */
public enum StageName {
    IDENTITY_RESOLUTION,
    BACKBONE_NORMALIZATION,
    ENCYCLOPEDIA_LOOKUP,
    LLM_JUDGED_SCORING,
    PRIORITY_CALCULATION,
    INDEX_REBUILD;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isPerPartition() {
        return this != INDEX_REBUILD;
    }

    public static StageName parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
