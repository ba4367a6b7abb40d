package com.museum.curation.store;

import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.core.model.ProvenanceEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory working copy of one partition: its records in stored order plus the
 * provenance of every field, keyed by record id then field name.
 * Loaded once, mutated by the applier, then written back as a whole.
 */
public class PartitionSnapshot {

    private final String partitionId;
    private final Map<String, MuseumRecord> records = new LinkedHashMap<>();
    private final Map<String, Map<String, ProvenanceEntry>> provenance = new LinkedHashMap<>();
    private Instant updatedAt;

    public PartitionSnapshot(String partitionId) {
        this.partitionId = Objects.requireNonNull(partitionId, "partitionId is required");
    }

    public PartitionSnapshot(String partitionId, List<MuseumRecord> records,
                             Map<String, Map<String, ProvenanceEntry>> provenance, Instant updatedAt) {
        this(partitionId);
        if (records != null) {
            records.forEach(this::putRecord);
        }
        if (provenance != null) {
            provenance.forEach((recordId, byField) ->
                    this.provenance.put(recordId, new LinkedHashMap<>(byField)));
        }
        this.updatedAt = updatedAt;
    }

    public String getPartitionId() {
        return partitionId;
    }

    public List<MuseumRecord> getRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    public Optional<MuseumRecord> getRecord(String recordId) {
        return Optional.ofNullable(records.get(recordId));
    }

    public void putRecord(MuseumRecord record) {
        records.put(record.getRecordId(), record);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public ProvenanceEntry getProvenance(String recordId, String fieldName) {
        Map<String, ProvenanceEntry> byField = provenance.get(recordId);
        return byField == null ? null : byField.get(fieldName);
    }

    public void putProvenance(String recordId, String fieldName, ProvenanceEntry entry) {
        provenance.computeIfAbsent(recordId, k -> new LinkedHashMap<>()).put(fieldName, entry);
    }

    /**
     * Read-only view of a record's provenance map (empty when none was stored).
     */
    public Map<String, ProvenanceEntry> getProvenance(String recordId) {
        Map<String, ProvenanceEntry> byField = provenance.get(recordId);
        return byField == null ? Map.of() : Collections.unmodifiableMap(byField);
    }

    public Map<String, Map<String, ProvenanceEntry>> getAllProvenance() {
        Map<String, Map<String, ProvenanceEntry>> view = new LinkedHashMap<>();
        provenance.forEach((id, byField) -> view.put(id, Collections.unmodifiableMap(byField)));
        return Collections.unmodifiableMap(view);
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * Deep copy; records are copied so changes to the copy never leak back.
     */
    public PartitionSnapshot copy() {
        List<MuseumRecord> copies = new ArrayList<>();
        records.values().forEach(r -> copies.add(r.copy()));
        return new PartitionSnapshot(partitionId, copies, provenance, updatedAt);
    }
}
