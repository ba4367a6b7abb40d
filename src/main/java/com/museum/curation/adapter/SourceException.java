package com.museum.curation.adapter;

/**
 * Thrown by a source adapter when a call fails (network, quota, malformed reply).
 */
public class SourceException extends RuntimeException {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
