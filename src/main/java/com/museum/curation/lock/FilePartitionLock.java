package com.museum.curation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cross-process advisory lock backed by a {@code <partitionId>.lock} file next to
 * the partition data. A busy file is polled every {@link LockConfig#retryDelay()}
 * until {@link LockConfig#acquireTimeout()} has passed.
 *
 * <p>Like {@link LocalPartitionLock} it is reentrant for the thread that holds the
 * partition; another thread of the same process waits as if the file were held by
 * another process.</p>
 */
public class FilePartitionLock implements PartitionLock {
    private static final Logger log = LoggerFactory.getLogger(FilePartitionLock.class);

    private final Path lockDirectory;
    private final LockConfig config;
    private final Map<String, Hold> held = new ConcurrentHashMap<>();

    public FilePartitionLock(Path lockDirectory) {
        this(lockDirectory, LockConfig.defaults());
    }

    public FilePartitionLock(Path lockDirectory, LockConfig config) {
        this.lockDirectory = lockDirectory;
        this.config = config != null ? config : LockConfig.defaults();
    }

    @Override
    public boolean tryLock(String partitionId) {
        Hold current = held.get(partitionId);
        if (current != null && current.owner == Thread.currentThread()) {
            current.count++;
            log.debug("lock.reentered partition={} holds={}", partitionId, current.count);
            return true;
        }
        Path lockFile = lockFile(partitionId);
        int attempts = config.fileAttempts();
        FileChannel channel = null;
        try {
            Files.createDirectories(lockDirectory);
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            for (int attempt = 1; attempt <= attempts; attempt++) {
                FileLock lock = attemptLock(channel);
                if (lock != null) {
                    held.put(partitionId, new Hold(lock));
                    log.debug("lock.acquired partition={} file={} attempt={}", partitionId, lockFile, attempt);
                    return true;
                }
                if (attempt < attempts) {
                    Thread.sleep(config.retryDelay().toMillis());
                }
            }
        } catch (IOException e) {
            closeQuietly(channel);
            throw new LockAcquisitionException(partitionId, "cannot open lock file " + lockFile, e);
        } catch (InterruptedException e) {
            closeQuietly(channel);
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(partitionId, "interrupted while waiting", e);
        }
        closeQuietly(channel);
        throw new LockAcquisitionException(partitionId, "lock file " + lockFile + " still held after "
                + config.acquireTimeout().toMillis() + "ms");
    }

    @Override
    public void unlock(String partitionId) {
        Hold hold = held.get(partitionId);
        if (hold == null || hold.owner != Thread.currentThread()) {
            return;
        }
        if (--hold.count > 0) {
            return;
        }
        held.remove(partitionId);
        try {
            hold.lock.release();
            hold.lock.channel().close();
            log.debug("lock.released partition={}", partitionId);
        } catch (IOException e) {
            log.warn("lock.release_failed partition={} error={}", partitionId, e.getMessage());
        }
    }

    Path lockFile(String partitionId) {
        return lockDirectory.resolve(partitionId + ".lock");
    }

    private FileLock attemptLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            return null;
        }
    }

    /**
     * A held lock file and the nested holds of its owning thread.
     */
    private static final class Hold {
        final FileLock lock;
        final Thread owner = Thread.currentThread();
        int count = 1;

        Hold(FileLock lock) {
            this.lock = lock;
        }
    }

    private void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("lock.channel_close_failed error={}", e.getMessage());
        }
    }
}
