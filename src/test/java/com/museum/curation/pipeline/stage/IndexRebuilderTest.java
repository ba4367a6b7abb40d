package com.museum.curation.pipeline.stage;

import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.store.InMemoryPartitionStore;
import com.museum.curation.store.PartitionSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IndexRebuilder")
class IndexRebuilderTest {

    private static PartitionSnapshot partition(String id, String... recordIds) {
        PartitionSnapshot snapshot = new PartitionSnapshot(id);
        for (String recordId : recordIds) {
            snapshot.putRecord(MuseumRecord.builder().recordId(recordId).field(MuseumFields.STATE_PROVINCE, id).build());
        }
        return snapshot;
    }

    @Test
    @DisplayName("The index covers every stored partition, sorted by record id")
    void rebuildsAll() {
        InMemoryPartitionStore store = new InMemoryPartitionStore();
        store.save(partition("us-ny", "moma", "met"));
        store.save(partition("us-co", "dam"));

        int count = new IndexRebuilder(store).rebuild();

        assertEquals(3, count);
        assertEquals(List.of("dam", "met", "moma"),
                store.getIndex().stream().map(MuseumRecord::getRecordId).toList());
    }

    @Test
    @DisplayName("An empty store writes an empty index")
    void empty() {
        InMemoryPartitionStore store = new InMemoryPartitionStore();

        assertEquals(0, new IndexRebuilder(store).rebuild());
        assertTrue(store.getIndex().isEmpty());
    }
}
