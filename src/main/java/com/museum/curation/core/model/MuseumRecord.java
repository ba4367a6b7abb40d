package com.museum.curation.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A curated museum: a flat map of field values plus lock and source bookkeeping.
 * Created as a stub on first ingest and mutated by every accepted merge. Records
 * are never deleted.
 */
public class MuseumRecord {
    private final String recordId;
    private final Map<String, Object> fields;
    private final Set<String> manualLockFields;
    private final Set<String> dataSources;
    private Instant updatedAt;

    private MuseumRecord(Builder builder) {
        this.recordId = builder.recordId;
        this.fields = new LinkedHashMap<>(builder.fields);
        this.manualLockFields = new LinkedHashSet<>(builder.manualLockFields);
        this.dataSources = new LinkedHashSet<>(builder.dataSources);
        this.updatedAt = builder.updatedAt;
    }

    public String getRecordId() {
        return recordId;
    }

    public Object get(String fieldName) {
        return fields.get(fieldName);
    }

    public Optional<Integer> getInt(String fieldName) {
        Object value = fields.get(fieldName);
        if (value instanceof Number number) {
            return Optional.of(number.intValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<String> getString(String fieldName) {
        Object value = fields.get(fieldName);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    public boolean has(String fieldName) {
        Object value = fields.get(fieldName);
        return value != null && !(value instanceof String text && text.isBlank());
    }

    public void set(String fieldName, Object value) {
        fields.put(fieldName, value);
    }

    public Optional<PrimaryDomain> getPrimaryDomain() {
        return PrimaryDomain.fromValue(fields.get(MuseumFields.PRIMARY_DOMAIN));
    }

    /**
     * Read-only view of all field values.
     */
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean isLocked(String fieldName) {
        return manualLockFields.contains(fieldName);
    }

    public Set<String> getManualLockFields() {
        return Collections.unmodifiableSet(manualLockFields);
    }

    public void lockField(String fieldName) {
        manualLockFields.add(fieldName);
    }

    public Set<String> getDataSources() {
        return Collections.unmodifiableSet(dataSources);
    }

    /**
     * Appends a source. The set is append-only and keeps first-seen order.
     *
     * @return true if the source was not present yet
     */
    public boolean addDataSource(String source) {
        return source != null && !source.isBlank() && dataSources.add(source);
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void touch(Instant at) {
        this.updatedAt = at;
    }

    /**
     * Deep copy, used for dry runs and snapshot isolation.
     */
    public MuseumRecord copy() {
        return builder(this).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MuseumRecord that = (MuseumRecord) o;
        return Objects.equals(recordId, that.recordId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordId);
    }

    @Override
    public String toString() {
        return "MuseumRecord{" +
                "recordId='" + recordId + '\'' +
                ", name=" + fields.get(MuseumFields.MUSEUM_NAME) +
                ", fields=" + fields.size() +
                ", locks=" + manualLockFields +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(MuseumRecord record) {
        return new Builder()
                .recordId(record.recordId)
                .fields(record.fields)
                .manualLockFields(record.manualLockFields)
                .dataSources(record.dataSources)
                .updatedAt(record.updatedAt);
    }

    public static class Builder {
        private String recordId;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private final Set<String> manualLockFields = new LinkedHashSet<>();
        private final Set<String> dataSources = new LinkedHashSet<>();
        private Instant updatedAt;

        public Builder recordId(String recordId) {
            this.recordId = recordId;
            return this;
        }

        public Builder field(String name, Object value) {
            this.fields.put(name, value);
            return this;
        }

        public Builder fields(Map<String, ?> fields) {
            if (fields != null) {
                this.fields.putAll(fields);
            }
            return this;
        }

        public Builder manualLockFields(Set<String> lockFields) {
            if (lockFields != null) {
                this.manualLockFields.addAll(lockFields);
            }
            return this;
        }

        public Builder lock(String fieldName) {
            this.manualLockFields.add(fieldName);
            return this;
        }

        public Builder dataSources(Set<String> dataSources) {
            if (dataSources != null) {
                this.dataSources.addAll(dataSources);
            }
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public MuseumRecord build() {
            Objects.requireNonNull(recordId, "recordId is required");
            fields.remove(MuseumFields.MUSEUM_ID);
            return new MuseumRecord(this);
        }
    }
}
