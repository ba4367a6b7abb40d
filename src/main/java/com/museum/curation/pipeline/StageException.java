package com.museum.curation.pipeline;

/**
 * A stage call failed for one record. Non-fatal to the run: the record is counted
 * as failed and queued for review.
 */
public class StageException extends RuntimeException {

    public StageException(String message) {
        super(message);
    }

    public StageException(String message, Throwable cause) {
        super(message, cause);
    }
}
