package com.museum.curation.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.museum.curation.core.model.FieldCandidate;
import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.core.model.ProvenanceEntry;
import com.museum.curation.core.model.TrustLevel;
import com.museum.curation.update.ApplyOptions;
import com.museum.curation.update.ApplyResult;
import com.museum.curation.update.RecordUpdateApplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonPartitionStore")
class JsonPartitionStoreTest {

    @TempDir
    Path root;

    private JsonPartitionStore store;

    @BeforeEach
    void setUp() {
        store = new JsonPartitionStore(root);
    }

    private static PartitionSnapshot coloradoSnapshot() {
        PartitionSnapshot snapshot = new PartitionSnapshot("us-co");
        snapshot.putRecord(MuseumRecord.builder()
                .recordId("dam")
                .field(MuseumFields.MUSEUM_NAME, "Denver Art Museum")
                .field(MuseumFields.CITY, "Denver")
                .field(MuseumFields.IMPRESSIONIST_STRENGTH, 4)
                .field(MuseumFields.NOTES, null)
                .lock(MuseumFields.CITY)
                .dataSources(Set.of("imls"))
                .updatedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .build());
        snapshot.putProvenance("dam", MuseumFields.CITY,
                new ProvenanceEntry("imls", TrustLevel.OFFICIAL_STRUCTURED_DATA, "2024-01-01T00:00:00Z", 5));
        snapshot.setUpdatedAt(Instant.parse("2024-03-01T10:00:00Z"));
        return snapshot;
    }

    @Nested
    @DisplayName("Partitions")
    class Partitions {

        @Test
        @DisplayName("Saved partitions load back with fields, locks, sources and provenance")
        void saveAndLoad() {
            store.save(coloradoSnapshot());

            PartitionSnapshot loaded = store.load("us-co");
            MuseumRecord record = loaded.getRecord("dam").orElseThrow();

            assertEquals("Denver Art Museum", record.get(MuseumFields.MUSEUM_NAME));
            assertEquals(4, record.get(MuseumFields.IMPRESSIONIST_STRENGTH));
            assertTrue(record.getFields().containsKey(MuseumFields.NOTES));
            assertTrue(record.isLocked(MuseumFields.CITY));
            assertTrue(record.getDataSources().contains("imls"));
            assertEquals(Instant.parse("2024-03-01T10:00:00Z"), record.getUpdatedAt());
            assertEquals(Instant.parse("2024-03-01T10:00:00Z"), loaded.getUpdatedAt());

            ProvenanceEntry provenance = loaded.getProvenance("dam", MuseumFields.CITY);
            assertEquals("imls", provenance.source());
            assertEquals(TrustLevel.OFFICIAL_STRUCTURED_DATA, provenance.trustLevel());
            assertEquals(5, provenance.confidence());
        }

        @Test
        @DisplayName("Provenance is stored inside the partition document")
        void embeddedProvenance() throws IOException {
            store.save(coloradoSnapshot());

            JsonNode doc = new ObjectMapper().readTree(store.partitionFile("us-co").toFile());
            assertEquals("OFFICIAL_STRUCTURED_DATA",
                    doc.get("provenance").get("dam").get(MuseumFields.CITY).get("trust_level").asText());
            assertFalse(Files.exists(store.provenanceFile("us-co")));
            assertEquals(List.of("us-co"), store.listPartitions());
            assertTrue(store.exists("us-co"));
            assertFalse(store.exists("us-ny"));
        }

        @Test
        @DisplayName("Saving replaces the partition and leaves no temp files")
        void atomicReplace() throws IOException {
            store.save(coloradoSnapshot());
            PartitionSnapshot changed = store.load("us-co");
            changed.getRecord("dam").orElseThrow().set(MuseumFields.PHONE, "720-865-5000");
            store.save(changed);

            assertEquals("720-865-5000", store.load("us-co").getRecord("dam").orElseThrow()
                    .get(MuseumFields.PHONE));
            try (Stream<Path> files = Files.list(root)) {
                assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
            }
        }

        @Test
        @DisplayName("Legacy sidecar entries with rank trust and bad timestamps still load")
        void legacyProvenance() throws IOException {
            Files.writeString(root.resolve("us-wy.json"),
                    "{\"partition_id\": \"us-wy\", \"museums\": [{\"museum_id\": \"wy-1\", \"city\": \"Cody\"}]}");
            Files.writeString(root.resolve("us-wy.provenance.json"),
                    "{\"wy-1\": {\"city\": {\"source\": \"csv\", \"trust_level\": 4, \"retrieved_at\": \"yesterday\"}}}");

            PartitionSnapshot loaded = store.load("us-wy");
            ProvenanceEntry provenance = loaded.getProvenance("wy-1", MuseumFields.CITY);

            assertEquals(TrustLevel.KNOWLEDGE_BASE, provenance.trustLevel());
            assertTrue(provenance.retrievedAtInstant().isEmpty());
            assertNull(provenance.confidence());
            assertNull(loaded.getUpdatedAt());
        }

        @Test
        @DisplayName("Saving a legacy partition embeds its provenance and removes the sidecar")
        void legacySidecarMigrated() throws IOException {
            Files.writeString(root.resolve("us-wy.json"),
                    "{\"partition_id\": \"us-wy\", \"museums\": [{\"museum_id\": \"wy-1\", \"city\": \"Cody\"}]}");
            Files.writeString(root.resolve("us-wy.provenance.json"),
                    "{\"wy-1\": {\"city\": {\"source\": \"imls\", \"trust_level\": \"OFFICIAL_STRUCTURED_DATA\"}}}");

            store.save(store.load("us-wy"));

            assertFalse(Files.exists(store.provenanceFile("us-wy")));
            assertEquals(TrustLevel.OFFICIAL_STRUCTURED_DATA,
                    store.load("us-wy").getProvenance("wy-1", MuseumFields.CITY).trustLevel());
        }

        @Test
        @DisplayName("Only partition documents are listed")
        void listingSkipsOtherJson() throws IOException {
            store.save(coloradoSnapshot());
            Files.writeString(root.resolve("gold.json"),
                    "{\"museums\": [{\"museum_id\": \"dam\", \"expected\": {\"city\": \"Denver\"}}]}");
            Files.writeString(root.resolve("notes.json"), "[1, 2, 3]");
            Files.writeString(root.resolve("broken.json"), "{not json");
            Files.writeString(root.resolve("renamed.json"), "{\"partition_id\": \"us-co\", \"museums\": []}");

            assertEquals(List.of("us-co"), store.listPartitions());
        }

        @Test
        @DisplayName("A failed write keeps values and provenance together")
        void failedWriteKeepsProvenance() {
            FailingWriteMapper mapper = new FailingWriteMapper();
            JsonPartitionStore flaky = new JsonPartitionStore(root, mapper);
            flaky.save(coloradoSnapshot());
            RecordUpdateApplier applier = new RecordUpdateApplier(flaky);
            List<FieldCandidate> official = List.of(FieldCandidate.of(MuseumFields.PHONE, "720-865-5000",
                    "imls", TrustLevel.OFFICIAL_STRUCTURED_DATA, 5));

            mapper.failing = true;
            assertThrows(PartitionStoreException.class,
                    () -> applier.applyAndPersist("us-co", "dam", official, ApplyOptions.defaults()));
            PartitionSnapshot afterFailure = store.load("us-co");
            assertNull(afterFailure.getRecord("dam").orElseThrow().get(MuseumFields.PHONE));
            assertNull(afterFailure.getProvenance("dam", MuseumFields.PHONE));

            mapper.failing = false;
            applier.applyAndPersist("us-co", "dam", official, ApplyOptions.defaults());
            ApplyResult extracted = applier.applyAndPersist("us-co", "dam", List.of(FieldCandidate.of(
                    MuseumFields.PHONE, "303-555-9999", "llm", TrustLevel.MODEL_EXTRACTED, 5)), ApplyOptions.defaults());

            assertTrue(extracted.appliedFields().isEmpty());
            assertEquals("lower_trust_or_older", extracted.reasonFor(MuseumFields.PHONE));
            PartitionSnapshot reloaded = store.load("us-co");
            assertEquals("720-865-5000", reloaded.getRecord("dam").orElseThrow().get(MuseumFields.PHONE));
            assertEquals(TrustLevel.OFFICIAL_STRUCTURED_DATA,
                    reloaded.getProvenance("dam", MuseumFields.PHONE).trustLevel());
        }

        @Test
        @DisplayName("Missing and malformed partitions fail with a store exception")
        void failures() throws IOException {
            assertThrows(PartitionStoreException.class, () -> store.load("absent"));

            Files.writeString(root.resolve("broken.json"), "{not json");
            assertThrows(PartitionStoreException.class, () -> store.load("broken"));

            Files.writeString(root.resolve("noid.json"), "{\"museums\": [{\"city\": \"Nowhere\"}]}");
            assertThrows(PartitionStoreException.class, () -> store.load("noid"));
        }

        @Test
        @DisplayName("An absent root lists no partitions")
        void absentRoot() {
            assertTrue(new JsonPartitionStore(root.resolve("missing")).listPartitions().isEmpty());
        }
    }

    /**
     * Fails every file write while {@code failing} is set.
     */
    private static final class FailingWriteMapper extends ObjectMapper {
        boolean failing;

        FailingWriteMapper() {
            super(JsonMappers.create());
        }

        @Override
        public void writeValue(File resultFile, Object value) throws IOException {
            if (failing) {
                throw new IOException("No space left on device");
            }
            super.writeValue(resultFile, value);
        }
    }

    @Test
    @DisplayName("Index holds every record sorted by id")
    void index() throws IOException {
        MuseumRecord b = MuseumRecord.builder().recordId("b").field(MuseumFields.CITY, "Boulder").build();
        MuseumRecord a = MuseumRecord.builder().recordId("a").field(MuseumFields.CITY, "Aspen").build();

        store.writeIndex(List.of(b, a));

        JsonNode index = new ObjectMapper().readTree(store.indexFile().toFile());
        assertEquals(2, index.get("museum_count").asInt());
        assertEquals("a", index.get("museums").get(0).get(MuseumFields.MUSEUM_ID).asText());
        assertEquals("Boulder", index.get("museums").get(1).get(MuseumFields.CITY).asText());
        assertTrue(store.listPartitions().isEmpty());
    }
}
