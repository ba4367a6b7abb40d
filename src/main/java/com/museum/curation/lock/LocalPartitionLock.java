package com.museum.curation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process partition lock. Serializes writers inside one JVM only.
 *
 * <p>The lock is reentrant per partition: a thread that already holds a partition
 * (the orchestrator during a stage) may lock it again, for instance through
 * {@code RecordUpdateApplier.applyAndPersist}, and the partition is released on the
 * matching outermost {@link #unlock}. Other threads wait up to
 * {@link LockConfig#acquireTimeout()}.</p>
 */
public class LocalPartitionLock implements PartitionLock {
    private static final Logger log = LoggerFactory.getLogger(LocalPartitionLock.class);

    private final Map<String, ReentrantLock> partitions = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalPartitionLock() {
        this(LockConfig.defaults());
    }

    public LocalPartitionLock(LockConfig config) {
        this.config = config != null ? config : LockConfig.defaults();
    }

    @Override
    public boolean tryLock(String partitionId) {
        ReentrantLock partitionLock = partitions.computeIfAbsent(partitionId, id -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = partitionLock.tryLock(config.acquireTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(partitionId, "interrupted while waiting", e);
        }
        if (!acquired) {
            throw new LockAcquisitionException(partitionId,
                    "held by another writer for more than " + config.acquireTimeout().toMillis() + "ms");
        }
        int holds = partitionLock.getHoldCount();
        if (holds > 1) {
            log.debug("lock.reentered partition={} holds={}", partitionId, holds);
        } else {
            log.debug("lock.acquired partition={}", partitionId);
        }
        return true;
    }

    @Override
    public void unlock(String partitionId) {
        ReentrantLock partitionLock = partitions.get(partitionId);
        if (partitionLock == null || !partitionLock.isHeldByCurrentThread()) {
            return;
        }
        partitionLock.unlock();
        if (!partitionLock.isHeldByCurrentThread()) {
            log.debug("lock.released partition={}", partitionId);
        }
    }

    /**
     * Number of nested holds the current thread has on a partition; 0 when it does not hold it.
     */
    public int getHoldCount(String partitionId) {
        ReentrantLock partitionLock = partitions.get(partitionId);
        return partitionLock != null ? partitionLock.getHoldCount() : 0;
    }
}
