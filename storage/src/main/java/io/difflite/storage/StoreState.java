package io.difflite.storage;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Committed in-memory state: bucket path -> sorted entries.
 * <p>
 * Mutated only by {@link #apply(TxRecordCodec.Op)}, which FileTxStore calls during
 * WAL replay and while publishing a commit (under its state write lock).
 * Everything else is read access.
 */
final class StoreState {
    private final Map<BucketPath, NavigableMap<byte[], byte[]>> buckets = new HashMap<>();

    void load(Map<BucketPath, NavigableMap<byte[], byte[]>> snapshot) {
        buckets.clear();
        for (var e : snapshot.entrySet()) {
            NavigableMap<byte[], byte[]> m = new TreeMap<>(Bytes.UNSIGNED);
            m.putAll(e.getValue());
            buckets.put(e.getKey(), m);
        }
    }

    boolean exists(BucketPath path) {
        return buckets.containsKey(path);
    }

    /** @return the live entries of a bucket (do not mutate), or null if the bucket does not exist */
    NavigableMap<byte[], byte[]> entries(BucketPath path) {
        return buckets.get(path);
    }

    Iterable<BucketPath> paths() {
        return buckets.keySet();
    }

    void apply(TxRecordCodec.Op op) {
        switch (op.kind()) {
            case CREATE_BUCKET -> buckets.computeIfAbsent(op.path(), p -> new TreeMap<>(Bytes.UNSIGNED));
            case DROP_BUCKET -> buckets.keySet().removeIf(p -> p.isWithin(op.path()));
            case PUT -> require(op.path()).put(op.key(), op.value());
            case DELETE -> require(op.path()).remove(op.key());
        }
    }

    void applyAll(List<TxRecordCodec.Op> ops) {
        for (TxRecordCodec.Op op : ops) {
            apply(op);
        }
    }

    /** Deep copy for snapshotting. */
    Map<BucketPath, NavigableMap<byte[], byte[]>> copy() {
        Map<BucketPath, NavigableMap<byte[], byte[]>> out = new HashMap<>(buckets.size() * 2);
        for (var e : buckets.entrySet()) {
            out.put(e.getKey(), new TreeMap<>(e.getValue()));
        }
        return out;
    }

    private NavigableMap<byte[], byte[]> require(BucketPath path) {
        NavigableMap<byte[], byte[]> m = buckets.get(path);
        if (m == null) throw new StoreException("commit references unknown bucket " + path);
        return m;
    }
}
