package com.museum.curation.store;

import com.museum.curation.core.model.MuseumFields;
import com.museum.curation.core.model.MuseumRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryPartitionStore")
class InMemoryPartitionStoreTest {

    private final InMemoryPartitionStore store = new InMemoryPartitionStore();

    @Test
    @DisplayName("Loads return copies so callers cannot mutate stored state")
    void copies() {
        PartitionSnapshot snapshot = new PartitionSnapshot("us-co");
        snapshot.putRecord(MuseumRecord.builder().recordId("dam").field(MuseumFields.CITY, "Denver").build());
        store.save(snapshot);

        store.load("us-co").getRecord("dam").orElseThrow().set(MuseumFields.CITY, "Boulder");
        snapshot.getRecord("dam").orElseThrow().set(MuseumFields.CITY, "Aspen");

        assertEquals("Denver", store.load("us-co").getRecord("dam").orElseThrow().get(MuseumFields.CITY));
        assertEquals(1, store.getSaveCount());
    }

    @Test
    @DisplayName("Partitions list in lexical order and unknown ids fail")
    void listing() {
        store.save(new PartitionSnapshot("us-ny"));
        store.save(new PartitionSnapshot("us-ca"));

        assertEquals(List.of("us-ca", "us-ny"), store.listPartitions());
        assertThrows(PartitionStoreException.class, () -> store.load("us-tx"));
    }

    @Test
    @DisplayName("Index is sorted by record id")
    void index() {
        store.writeIndex(List.of(MuseumRecord.builder().recordId("z").build(),
                MuseumRecord.builder().recordId("a").build()));

        assertEquals("a", store.getIndex().get(0).getRecordId());
    }
}
