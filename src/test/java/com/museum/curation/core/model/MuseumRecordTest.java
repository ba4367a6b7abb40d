package com.museum.curation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MuseumRecord")
class MuseumRecordTest {

    private static MuseumRecord denver() {
        return MuseumRecord.builder()
                .recordId("dam")
                .field(MuseumFields.MUSEUM_ID, "ignored")
                .field(MuseumFields.PRIMARY_DOMAIN, "art")
                .field(MuseumFields.IMPRESSIONIST_STRENGTH, "4")
                .field(MuseumFields.NOTES, " ")
                .lock(MuseumFields.CITY)
                .build();
    }

    @Test
    @DisplayName("The id lives outside the field map")
    void idSeparate() {
        MuseumRecord record = denver();

        assertEquals("dam", record.getRecordId());
        assertFalse(record.getFields().containsKey(MuseumFields.MUSEUM_ID));
    }

    @Test
    @DisplayName("Typed accessors read numbers, numeric strings and domains")
    void accessors() {
        MuseumRecord record = denver();

        assertEquals(Optional.of(4), record.getInt(MuseumFields.IMPRESSIONIST_STRENGTH));
        assertEquals(Optional.empty(), record.getInt(MuseumFields.NOTES));
        assertEquals(Optional.of(PrimaryDomain.ART), record.getPrimaryDomain());
        assertFalse(record.has(MuseumFields.NOTES));
        assertFalse(record.has(MuseumFields.PHONE));
        assertEquals(Optional.empty(), PrimaryDomain.fromValue("Botanical"));
    }

    @Test
    @DisplayName("Copies are independent of the original")
    void copy() {
        MuseumRecord original = denver();
        MuseumRecord copy = original.copy();

        copy.set(MuseumFields.CITY, "Denver");
        copy.lockField(MuseumFields.PHONE);
        copy.addDataSource("imls");

        assertNull(original.get(MuseumFields.CITY));
        assertFalse(original.isLocked(MuseumFields.PHONE));
        assertTrue(original.getDataSources().isEmpty());
        assertTrue(copy.isLocked(MuseumFields.CITY));
    }

    @Test
    @DisplayName("Data sources are append-only in first-seen order")
    void dataSources() {
        MuseumRecord record = denver();

        assertTrue(record.addDataSource("imls"));
        assertTrue(record.addDataSource("wikipedia"));
        assertFalse(record.addDataSource("imls"));
        assertFalse(record.addDataSource(" "));

        assertEquals(List.of("imls", "wikipedia"), List.copyOf(record.getDataSources()));
    }
}
