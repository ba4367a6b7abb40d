package com.museum.curation.store;

import com.museum.curation.core.model.MuseumRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store keeping partitions in memory. Loads and saves go through deep copies so
 * callers see the same isolation as with a file store.
 */
public class InMemoryPartitionStore implements PartitionStore {

    private final Map<String, PartitionSnapshot> partitions = new ConcurrentHashMap<>();
    private volatile List<MuseumRecord> index = List.of();
    private int saveCount;

    @Override
    public PartitionSnapshot load(String partitionId) {
        PartitionSnapshot stored = partitions.get(partitionId);
        if (stored == null) {
            throw new PartitionStoreException("Partition not found: " + partitionId);
        }
        return stored.copy();
    }

    @Override
    public synchronized void save(PartitionSnapshot snapshot) {
        partitions.put(snapshot.getPartitionId(), snapshot.copy());
        saveCount++;
    }

    @Override
    public boolean exists(String partitionId) {
        return partitions.containsKey(partitionId);
    }

    @Override
    public List<String> listPartitions() {
        List<String> ids = new ArrayList<>(partitions.keySet());
        ids.sort(Comparator.naturalOrder());
        return ids;
    }

    @Override
    public void writeIndex(Collection<MuseumRecord> records) {
        List<MuseumRecord> copies = new ArrayList<>();
        records.forEach(r -> copies.add(r.copy()));
        copies.sort(Comparator.comparing(MuseumRecord::getRecordId));
        this.index = List.copyOf(copies);
    }

    public List<MuseumRecord> getIndex() {
        return index;
    }

    /**
     * Number of saves since creation, used to verify dry runs write nothing.
     */
    public synchronized int getSaveCount() {
        return saveCount;
    }
}
