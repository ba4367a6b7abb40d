package com.museum.curation.lock;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * How long a writer waits for a partition before the stage skips it.
 *
 * <p>{@link LocalPartitionLock} waits up to {@code acquireTimeout} on the in-process lock.
 * {@link FilePartitionLock} polls the lock file every {@code retryDelay} until the same
 * timeout has passed.</p>
 *
 * @param acquireTimeout total wait for one partition
 * @param retryDelay     pause between two attempts on a busy lock file
 */
public record LockConfig(Duration acquireTimeout, Duration retryDelay) {

    public LockConfig {
        Objects.requireNonNull(acquireTimeout, "acquireTimeout is required");
        Objects.requireNonNull(retryDelay, "retryDelay is required");
        if (acquireTimeout.isNegative() || acquireTimeout.isZero()) {
            throw new IllegalArgumentException("acquireTimeout must be positive: " + acquireTimeout);
        }
        if (retryDelay.isNegative() || retryDelay.isZero()) {
            throw new IllegalArgumentException("retryDelay must be positive: " + retryDelay);
        }
        if (retryDelay.compareTo(acquireTimeout) > 0) {
            throw new IllegalArgumentException("retryDelay " + retryDelay + " exceeds acquireTimeout " + acquireTimeout);
        }
    }

    /**
     * Five seconds per partition, polled every 100ms.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofSeconds(5), Duration.ofMillis(100));
    }

    /**
     * Reads {@code curation.lock.timeout-ms} and {@code curation.lock.retry-delay-ms}.
     * Missing keys keep their defaults.
     */
    public static LockConfig fromProperties(Properties properties) {
        LockConfig defaults = defaults();
        String timeout = properties.getProperty("curation.lock.timeout-ms");
        String delay = properties.getProperty("curation.lock.retry-delay-ms");
        return new LockConfig(
                timeout != null ? Duration.ofMillis(Long.parseLong(timeout.trim())) : defaults.acquireTimeout(),
                delay != null ? Duration.ofMillis(Long.parseLong(delay.trim())) : defaults.retryDelay());
    }

    /**
     * Lock-file attempts that fit in the timeout, the immediate first attempt included.
     */
    public int fileAttempts() {
        return (int) (acquireTimeout.toMillis() / retryDelay.toMillis()) + 1;
    }
}
