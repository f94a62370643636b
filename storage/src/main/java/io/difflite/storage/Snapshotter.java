package io.difflite.storage;

import java.util.Map;
import java.util.NavigableMap;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the committed bucket state as of some commit.
 * On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL commit records with a txId greater than the snapshot's.
 */
interface Snapshotter {

    /**
     * Persist a full copy of the committed state.
     *
     * @param txId    id of the last commit included in {@code buckets}
     * @param buckets bucket path -> entries; must not be mutated while writing
     * @return snapshot identifier (e.g., filename/path).
     */
    String writeSnapshot(long txId, Map<BucketPath, NavigableMap<byte[], byte[]>> buckets);

    /** Load the latest snapshot if present, or null. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id, covered txId and its data */
    record LoadedSnapshot(String id, long txId, Map<BucketPath, NavigableMap<byte[], byte[]>> buckets) {}
}
