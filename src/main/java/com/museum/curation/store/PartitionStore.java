package com.museum.curation.store;

import com.museum.curation.core.model.MuseumRecord;

import java.util.Collection;
import java.util.List;

/**
 * Record and provenance storage, addressed by partition.
 * A {@link #save} replaces the whole partition atomically.
 */
public interface PartitionStore {

    /**
     * Loads a partition with its provenance.
     *
     * @throws PartitionStoreException if the partition does not exist or cannot be read
     */
    PartitionSnapshot load(String partitionId);

    /**
     * Atomically replaces the stored partition and its provenance.
     */
    void save(PartitionSnapshot snapshot);

    boolean exists(String partitionId);

    /**
     * Lists stored partition ids in lexical order.
     */
    List<String> listPartitions();

    /**
     * Writes the consolidated index of all given records.
     */
    void writeIndex(Collection<MuseumRecord> records);
}
