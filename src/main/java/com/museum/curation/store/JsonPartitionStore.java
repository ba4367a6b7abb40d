package com.museum.curation.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.core.model.ProvenanceEntry;
import com.museum.curation.core.model.TrustLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * File-backed partition store.
 *
 * <p>Layout under the root directory:</p>
 * <pre>
 * &lt;partitionId&gt;.json  {"partition_id", "updated_at", "museums": [...],
 *                       "provenance": {recordId: {field: {source, trust_level, retrieved_at, confidence}}}}
 * index/all-museums.json
 * </pre>
 *
 * <p>Values and their provenance share one document, written to a temp file in the
 * same directory and moved over the target with {@link StandardCopyOption#ATOMIC_MOVE}.
 * A value is therefore never visible without the provenance it was merged under.</p>
 *
 * <p>Partitions written before provenance was embedded keep it in a
 * {@code <partitionId>.provenance.json} sidecar. The sidecar is read when the document
 * has no provenance of its own and removed by the next save.</p>
 */
public class JsonPartitionStore implements PartitionStore {
    private static final Logger log = LoggerFactory.getLogger(JsonPartitionStore.class);

    static final String PARTITION_SUFFIX = ".json";
    static final String PROVENANCE_SUFFIX = ".provenance.json";
    static final String INDEX_DIR = "index";
    static final String INDEX_FILE = "all-museums.json";

    private static final String KEY_PARTITION_ID = "partition_id";
    private static final String KEY_UPDATED_AT = "updated_at";
    private static final String KEY_MUSEUMS = "museums";
    private static final String KEY_PROVENANCE = "provenance";
    private static final String KEY_MANUAL_LOCKS = "manual_lock_fields";
    private static final String KEY_DATA_SOURCES = "data_sources";
    private static final String KEY_MUSEUM_COUNT = "museum_count";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Path root;
    private final ObjectMapper objectMapper;

    public JsonPartitionStore(Path root) {
        this(root, JsonMappers.create());
    }

    public JsonPartitionStore(Path root, ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public PartitionSnapshot load(String partitionId) {
        Path file = partitionFile(partitionId);
        if (!Files.exists(file)) {
            throw new PartitionStoreException("Partition not found: " + file);
        }
        try {
            Map<String, Object> doc = objectMapper.readValue(file.toFile(), MAP_TYPE);
            List<MuseumRecord> records = new ArrayList<>();
            Object museums = doc.get(KEY_MUSEUMS);
            if (museums instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof Map<?, ?> raw) {
                        records.add(toRecord(raw));
                    }
                }
            }
            Map<String, Map<String, ProvenanceEntry>> provenance = doc.get(KEY_PROVENANCE) instanceof Map<?, ?> embedded
                    ? toProvenanceByRecord(embedded)
                    : loadSidecarProvenance(partitionId);
            log.debug("partition.loaded partition={} records={}", partitionId, records.size());
            return new PartitionSnapshot(partitionId, records, provenance, parseInstant(doc.get(KEY_UPDATED_AT)));
        } catch (IOException e) {
            throw new PartitionStoreException("Failed to read partition " + file, e);
        }
    }

    @Override
    public void save(PartitionSnapshot snapshot) {
        String partitionId = snapshot.getPartitionId();
        Instant updatedAt = snapshot.getUpdatedAt() != null ? snapshot.getUpdatedAt() : Instant.now();

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(KEY_PARTITION_ID, partitionId);
        doc.put(KEY_UPDATED_AT, updatedAt.toString());
        List<Map<String, Object>> museums = new ArrayList<>();
        for (MuseumRecord record : snapshot.getRecords()) {
            museums.add(toMap(record));
        }
        doc.put(KEY_MUSEUMS, museums);

        Map<String, Object> provenance = new LinkedHashMap<>();
        snapshot.getAllProvenance().forEach((recordId, byField) -> {
            Map<String, Object> fields = new LinkedHashMap<>();
            byField.forEach((field, entry) -> fields.put(field, toMap(entry)));
            provenance.put(recordId, fields);
        });
        doc.put(KEY_PROVENANCE, provenance);

        writeAtomically(partitionFile(partitionId), doc);
        removeSidecar(partitionId);
        log.debug("partition.saved partition={} records={}", partitionId, museums.size());
    }

    @Override
    public boolean exists(String partitionId) {
        return Files.exists(partitionFile(partitionId));
    }

    @Override
    public List<String> listPartitions() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(root)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(PARTITION_SUFFIX) && !name.endsWith(PROVENANCE_SUFFIX))
                    .map(name -> name.substring(0, name.length() - PARTITION_SUFFIX.length()))
                    .filter(this::isPartitionDocument)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PartitionStoreException("Failed to list partitions in " + root, e);
        }
    }

    @Override
    public void writeIndex(Collection<MuseumRecord> records) {
        List<MuseumRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(MuseumRecord::getRecordId));
        List<Map<String, Object>> museums = new ArrayList<>();
        sorted.forEach(r -> museums.add(toMap(r)));

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(KEY_UPDATED_AT, Instant.now().toString());
        doc.put(KEY_MUSEUM_COUNT, museums.size());
        doc.put(KEY_MUSEUMS, museums);
        writeAtomically(indexFile(), doc);
        log.info("index.written records={} file={}", museums.size(), indexFile());
    }

    Path partitionFile(String partitionId) {
        return root.resolve(partitionId + PARTITION_SUFFIX);
    }

    Path provenanceFile(String partitionId) {
        return root.resolve(partitionId + PROVENANCE_SUFFIX);
    }

    Path indexFile() {
        return root.resolve(INDEX_DIR).resolve(INDEX_FILE);
    }

    /**
     * A file is a partition when it is a JSON object whose {@code partition_id} matches
     * its name. Gold sets and other JSON files in the root are skipped.
     */
    private boolean isPartitionDocument(String partitionId) {
        try {
            JsonNode node = objectMapper.readTree(partitionFile(partitionId).toFile());
            return node != null && partitionId.equals(node.path(KEY_PARTITION_ID).asText(null));
        } catch (IOException e) {
            log.warn("store.unreadable_file partition={} error={}", partitionId, e.getMessage());
            return false;
        }
    }

    private Map<String, Map<String, ProvenanceEntry>> loadSidecarProvenance(String partitionId) throws IOException {
        Path file = provenanceFile(partitionId);
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        log.debug("partition.legacy_provenance partition={}", partitionId);
        return toProvenanceByRecord(objectMapper.readValue(file.toFile(), MAP_TYPE));
    }

    private void removeSidecar(String partitionId) {
        Path sidecar = provenanceFile(partitionId);
        try {
            if (Files.deleteIfExists(sidecar)) {
                log.info("partition.legacy_provenance_removed partition={}", partitionId);
            }
        } catch (IOException e) {
            // The embedded provenance takes precedence, so a leftover sidecar is never read.
            log.warn("store.sidecar_cleanup_failed file={} error={}", sidecar, e.getMessage());
        }
    }

    private static Map<String, Map<String, ProvenanceEntry>> toProvenanceByRecord(Map<?, ?> doc) {
        Map<String, Map<String, ProvenanceEntry>> result = new LinkedHashMap<>();
        doc.forEach((recordId, byField) -> {
            if (byField instanceof Map<?, ?> fields) {
                Map<String, ProvenanceEntry> entries = new LinkedHashMap<>();
                fields.forEach((field, raw) -> {
                    if (raw instanceof Map<?, ?> entry) {
                        entries.put(String.valueOf(field), toProvenance(entry));
                    }
                });
                result.put(String.valueOf(recordId), entries);
            }
        });
        return result;
    }

    private void writeAtomically(Path target, Object document) {
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("store.atomic_move_unsupported target={}", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteTemp(tmp);
            throw new PartitionStoreException("Failed to write " + target, e);
        }
    }

    private void deleteTemp(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("store.temp_cleanup_failed file={} error={}", tmp, e.getMessage());
        }
    }

    private static Map<String, Object> toMap(MuseumRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(MuseumFields.MUSEUM_ID, record.getRecordId());
        map.putAll(record.getFields());
        map.put(KEY_MANUAL_LOCKS, new ArrayList<>(record.getManualLockFields()));
        map.put(KEY_DATA_SOURCES, new ArrayList<>(record.getDataSources()));
        if (record.getUpdatedAt() != null) {
            map.put(KEY_UPDATED_AT, record.getUpdatedAt().toString());
        }
        return map;
    }

    private static MuseumRecord toRecord(Map<?, ?> raw) {
        Object id = raw.get(MuseumFields.MUSEUM_ID);
        if (id == null) {
            throw new PartitionStoreException("Museum entry without " + MuseumFields.MUSEUM_ID + ": " + raw);
        }
        MuseumRecord.Builder builder = MuseumRecord.builder().recordId(id.toString());
        raw.forEach((key, value) -> {
            String name = String.valueOf(key);
            switch (name) {
                case MuseumFields.MUSEUM_ID -> {
                }
                case KEY_MANUAL_LOCKS -> builder.manualLockFields(toStringSet(value));
                case KEY_DATA_SOURCES -> builder.dataSources(toStringSet(value));
                case KEY_UPDATED_AT -> builder.updatedAt(parseInstant(value));
                default -> builder.field(name, value);
            }
        });
        return builder.build();
    }

    private static Map<String, Object> toMap(ProvenanceEntry entry) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("source", entry.source());
        map.put("trust_level", entry.trustLevel().name());
        map.put("retrieved_at", entry.retrievedAt());
        map.put("confidence", entry.confidence());
        return map;
    }

    private static ProvenanceEntry toProvenance(Map<?, ?> raw) {
        Object source = raw.get("source");
        Object confidence = raw.get("confidence");
        Object retrievedAt = raw.get("retrieved_at");
        return new ProvenanceEntry(
                source != null ? source.toString() : null,
                TrustLevel.parse(raw.get("trust_level")),
                retrievedAt != null ? retrievedAt.toString() : null,
                confidence instanceof Number n ? Integer.valueOf(n.intValue()) : null);
    }

    private static LinkedHashSet<String> toStringSet(Object value) {
        LinkedHashSet<String> result = new LinkedHashSet<>();
        if (value instanceof Collection<?> items) {
            items.forEach(item -> {
                if (item != null) {
                    result.add(item.toString());
                }
            });
        }
        return result;
    }

    private static Instant parseInstant(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            log.debug("store.unparseable_timestamp value={}", value);
            return null;
        }
    }
}
