package com.museum.curation.pipeline;

import java.util.Locale;

/**
 * Terminal state of a run.
 */
public enum RunStatus {
    COMPLETED,
    ABORTED_BUDGET,
    ABORTED_FAILURE_RATE,
    ABORTED_DRIFT;

    public boolean isAborted() {
        return this != COMPLETED;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
