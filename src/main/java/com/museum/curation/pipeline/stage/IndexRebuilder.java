package com.museum.curation.pipeline.stage;

import com.museum.curation.core.model.MuseumRecord;
import com.museum.curation.store.PartitionSnapshot;
import com.museum.curation.store.PartitionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds the consolidated index from every stored partition. Runs once per run,
 * after all partitions have been written.
 */
public class IndexRebuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexRebuilder.class);

    private final PartitionStore store;

    public IndexRebuilder(PartitionStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    /**
     * @return number of records written to the index
     * @throws com.museum.curation.store.PartitionStoreException if a partition cannot be read or the index written
     */
    public int rebuild() {
        List<MuseumRecord> records = new ArrayList<>();
        List<String> partitionIds = store.listPartitions();
        for (String partitionId : partitionIds) {
            PartitionSnapshot snapshot = store.load(partitionId);
            records.addAll(snapshot.getRecords());
        }
        store.writeIndex(records);
        log.info("index.rebuilt partitions={} records={}", partitionIds.size(), records.size());
        return records.size();
    }
}
