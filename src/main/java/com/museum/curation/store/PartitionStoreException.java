package com.museum.curation.store;

/**
 * Thrown when a partition or its provenance sidecar cannot be read or written.
 */
public class PartitionStoreException extends RuntimeException {

    public PartitionStoreException(String message) {
        super(message);
    }

    public PartitionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
