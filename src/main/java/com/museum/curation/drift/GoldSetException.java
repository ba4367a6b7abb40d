package com.museum.curation.drift;

/**
 * Thrown when the gold set is missing or malformed.
 */
public class GoldSetException extends RuntimeException {

    public GoldSetException(String message) {
        super(message);
    }

    public GoldSetException(String message, Throwable cause) {
        super(message, cause);
    }
}
