package com.museum.curation.audit;

/**
 * Thrown when a run artifact cannot be written, including a second write of the same artifact.
 */
public class ArtifactWriteException extends RuntimeException {

    public ArtifactWriteException(String message) {
        super(message);
    }

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
