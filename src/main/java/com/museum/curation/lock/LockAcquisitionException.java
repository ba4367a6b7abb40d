package com.museum.curation.lock;

/**
 * A partition could not be locked in time. The orchestrator skips the partition
 * for the current stage and reports the message as its validation error.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String partitionId;

    public LockAcquisitionException(String partitionId, String reason) {
        super(message(partitionId, reason));
        this.partitionId = partitionId;
    }

    public LockAcquisitionException(String partitionId, String reason, Throwable cause) {
        super(message(partitionId, reason), cause);
        this.partitionId = partitionId;
    }

    public String getPartitionId() {
        return partitionId;
    }

    private static String message(String partitionId, String reason) {
        return "Cannot lock partition '" + partitionId + "': " + reason;
    }
}
