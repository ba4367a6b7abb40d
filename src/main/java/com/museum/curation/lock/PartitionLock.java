package com.museum.curation.lock;

/**
 * Single-writer lock guarding a partition's load-modify-rewrite cycle.
 */
public interface PartitionLock {

    /**
     * Acquires the lock for a partition, waiting up to the configured timeout.
     *
     * @param partitionId the partition to lock
     * @return true once the lock is held
     * @throws LockAcquisitionException if the lock cannot be acquired
     */
    boolean tryLock(String partitionId);

    /**
     * Releases the lock for a partition. Releasing a lock that is not held is a no-op.
     *
     * @param partitionId the partition to unlock
     */
    void unlock(String partitionId);
}
