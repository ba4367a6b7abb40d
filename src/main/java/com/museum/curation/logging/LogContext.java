package com.museum.curation.logging;

import org.slf4j.MDC;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forPartition(runId, "us-ca")) {
 *     log.info("partition.started records={}", size);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String PARTITION_ID = "partitionId";
    public static final String STAGE = "stage";
    public static final String RECORD_ID = "recordId";

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    private final Map<String, Optional<String>> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        return ctx;
    }

    public static LogContext forPartition(String runId, String partitionId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(PARTITION_ID, partitionId);
        return ctx;
    }

    public static LogContext forStage(String stage) {
        LogContext ctx = new LogContext();
        ctx.put(STAGE, stage);
        return ctx;
    }

    public static LogContext forRecord(String recordId) {
        LogContext ctx = new LogContext();
        ctx.put(RECORD_ID, recordId);
        return ctx;
    }

    /**
     * Generates a run id: UTC timestamp prefix plus a random suffix, so ids sort by start time.
     */
    public static String generateRunId() {
        String stamp = RUN_ID_FORMAT.format(Instant.now());
        return stamp + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        previous.putIfAbsent(key, Optional.ofNullable(MDC.get(key)));
        MDC.put(key, value);
    }

    /**
     * Removes the keys this context added, restoring values set by an enclosing context.
     */
    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value.isPresent()) {
                MDC.put(key, value.get());
            } else {
                MDC.remove(key);
            }
        });
        previous.clear();
    }
}
