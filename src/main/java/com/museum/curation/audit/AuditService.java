package com.museum.curation.audit;

import com.museum.curation.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only trail of field-level decisions and run lifecycle events.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries;

    public AuditService() {
        this.entries = new CopyOnWriteArrayList<>();
    }

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} partition={} recordId={} actor={}",
                entry.action(), entry.partitionId(), entry.recordId(), entry.actorId());
        return entry;
    }

    /**
     * Records an audit entry attributed to the run and partition of the current
     * {@link LogContext}. Null detail values are dropped.
     */
    public AuditEntry record(AuditAction action, String recordId, String actorId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .runId(MDC.get(LogContext.RUN_ID))
                .partitionId(MDC.get(LogContext.PARTITION_ID))
                .action(action)
                .recordId(recordId)
                .actorId(actorId)
                .details(withoutNulls(details))
                .build();
        return record(entry);
    }

    public AuditEntry record(AuditAction action, String recordId, String actorId) {
        return record(action, recordId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForRecord(String recordId) {
        return entries.stream()
                .filter(e -> recordId.equals(e.recordId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesForRun(String runId) {
        return entries.stream()
                .filter(e -> runId.equals(e.runId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> details) {
        if (details == null) {
            return null;
        }
        Map<String, Object> kept = new LinkedHashMap<>();
        details.forEach((key, value) -> {
            if (key != null && value != null) {
                kept.put(key, value);
            }
        });
        return kept;
    }
}
