// file: src/main/java/io/difflite/storage/FileTransaction.java
package io.difflite.storage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction over a {@link FileTxStore}.
 * <p>
 * Reads go straight to the committed {@link StoreState}; writes are buffered:
 *  - journal:  every mutation in call order, published as one WAL record on commit,
 *  - overlays: per-bucket view of the uncommitted changes, so the transaction reads its own writes.
 * <p>
 * Overlay semantics per bucket:
 *  - exists:  null = same as committed state, otherwise created/dropped in this transaction,
 *  - cleared: committed entries are hidden (bucket dropped and/or recreated here),
 *  - writes:  key -> new value, or {@link #DELETED} for a delete.
 * <p>
 * Not thread safe: a transaction belongs to the thread that began it.
 */
final class FileTransaction implements Transaction {
    private static final Logger log = Logger.getLogger(FileTransaction.class.getName());

    // Identity sentinel: stored values are always fresh copies, so no caller array is ever this instance.
    private static final byte[] DELETED = new byte[0];

    private final FileTxStore store;
    private final StoreState base;
    private final boolean writable;

    private final List<TxRecordCodec.Op> journal = new ArrayList<>();
    private final Map<BucketPath, Overlay> overlays = new HashMap<>();
    private final List<Runnable> commitHooks = new ArrayList<>();
    private boolean done;

    private static final class Overlay {
        Boolean exists;
        boolean cleared;
        final NavigableMap<byte[], byte[]> writes = new TreeMap<>(Bytes.UNSIGNED);
    }

    FileTransaction(FileTxStore store, StoreState base, boolean writable) {
        this.store = store;
        this.base = base;
        this.writable = writable;
    }

    // ---------------- Transaction ----------------

    @Override public boolean writable() { return writable; }

    @Override
    public Bucket bucket(String name) {
        return openBucket(BucketPath.root(name));
    }

    @Override
    public Bucket createBucketIfNotExists(String name) {
        return createBucket(BucketPath.root(name));
    }

    @Override
    public void deleteBucket(String name) {
        dropBucket(BucketPath.root(name));
    }

    @Override
    public List<String> bucketNames() {
        ensureActive();
        return childNames(null);
    }

    @Override
    public void onCommit(Runnable hook) {
        ensureActive();
        commitHooks.add(Objects.requireNonNull(hook, "hook"));
    }

    @Override
    public void commit() {
        ensureActive();
        try {
            if (writable && !journal.isEmpty()) {
                store.publish(List.copyOf(journal));
            }
        } finally {
            end();
        }

        for (Runnable hook : commitHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                // The commit is already durable; a failing hook must not turn it into an apparent failure.
                log.log(Level.WARNING, "post-commit hook failed", e);
            }
        }
    }

    @Override
    public void rollback() {
        if (done) return;
        end();
    }

    @Override
    public void close() {
        rollback();
    }

    private void end() {
        done = true;
        journal.clear();
        overlays.clear();
        if (writable) store.releaseWriter();
        else store.releaseReader();
    }

    // ---------------- bucket internals ----------------

    private Bucket openBucket(BucketPath p) {
        ensureActive();
        return exists(p) ? new TxBucket(p) : null;
    }

    private Bucket createBucket(BucketPath p) {
        ensureWritable();
        if (!exists(p)) {
            journal.add(TxRecordCodec.Op.createBucket(p));
            Overlay o = overlay(p);
            o.exists = true;
            o.cleared = true;
            o.writes.clear();
        }
        return new TxBucket(p);
    }

    private void dropBucket(BucketPath p) {
        ensureWritable();
        if (!exists(p)) throw new StoreException("bucket not found: " + p);

        journal.add(TxRecordCodec.Op.dropBucket(p));
        for (BucketPath q : knownPaths()) {
            if (q.isWithin(p)) {
                Overlay o = overlay(q);
                o.exists = false;
                o.cleared = true;
                o.writes.clear();
            }
        }
    }

    private boolean exists(BucketPath p) {
        Overlay o = overlays.get(p);
        if (o != null && o.exists != null) return o.exists;
        return base.exists(p);
    }

    private Set<BucketPath> knownPaths() {
        Set<BucketPath> out = new HashSet<>(overlays.keySet());
        for (BucketPath p : base.paths()) out.add(p);
        return out;
    }

    private List<String> childNames(BucketPath parent) {
        List<String> out = new ArrayList<>();
        for (BucketPath p : knownPaths()) {
            if (p.isChildOf(parent) && exists(p)) out.add(p.leaf());
        }
        out.sort(null);
        return out;
    }

    private Overlay overlay(BucketPath p) {
        return overlays.computeIfAbsent(p, k -> new Overlay());
    }

    private byte[] get(BucketPath p, byte[] key) {
        requireBucket(p);
        Bytes.requireKey(key);
        Overlay o = overlays.get(p);
        if (o != null) {
            byte[] v = o.writes.get(key);
            if (v == DELETED) return null;
            if (v != null) return Bytes.copy(v);
            if (o.cleared) return null;
        }
        NavigableMap<byte[], byte[]> m = base.entries(p);
        return m == null ? null : Bytes.copy(m.get(key));
    }

    private void put(BucketPath p, byte[] key, byte[] value) {
        ensureWritable();
        requireBucket(p);
        Bytes.requireKey(key);
        Objects.requireNonNull(value, "value");

        byte[] k = Bytes.copy(key);
        byte[] v = Bytes.copy(value);
        journal.add(TxRecordCodec.Op.put(p, k, v));
        overlay(p).writes.put(k, v);
    }

    private void delete(BucketPath p, byte[] key) {
        ensureWritable();
        if (get(p, key) == null) return;

        byte[] k = Bytes.copy(key);
        journal.add(TxRecordCodec.Op.delete(p, k));
        overlay(p).writes.put(k, DELETED);
    }

    private int count(BucketPath p) {
        requireBucket(p);
        Overlay o = overlays.get(p);
        if (o == null) {
            NavigableMap<byte[], byte[]> m = base.entries(p);
            return m == null ? 0 : m.size();
        }
        int n = 0;
        for (var e = step(p, null, true); e != null; e = step(p, e.getKey(), false)) n++;
        return n;
    }

    /**
     * Smallest visible entry with key {@code >= from} (inclusive) or {@code > from};
     * a null {@code from} means "from the start". Overlay writes shadow committed entries.
     */
    private Map.Entry<byte[], byte[]> step(BucketPath p, byte[] from, boolean inclusive) {
        requireBucket(p);
        Overlay o = overlays.get(p);
        NavigableMap<byte[], byte[]> committed = (o != null && o.cleared) ? null : base.entries(p);
        NavigableMap<byte[], byte[]> writes = o == null ? null : o.writes;

        while (true) {
            var c = seekIn(committed, from, inclusive);
            var w = seekIn(writes, from, inclusive);
            if (c == null && w == null) return null;

            Map.Entry<byte[], byte[]> pick;
            if (w == null) pick = c;
            else if (c == null) pick = w;
            else pick = Bytes.UNSIGNED.compare(w.getKey(), c.getKey()) <= 0 ? w : c;

            if (pick.getValue() != DELETED) return pick;
            from = pick.getKey();
            inclusive = false;
        }
    }

    private static Map.Entry<byte[], byte[]> seekIn(NavigableMap<byte[], byte[]> m, byte[] from, boolean inclusive) {
        if (m == null) return null;
        if (from == null) return m.firstEntry();
        return inclusive ? m.ceilingEntry(from) : m.higherEntry(from);
    }

    private void requireBucket(BucketPath p) {
        ensureActive();
        if (!exists(p)) throw new StoreException("bucket not found: " + p);
    }

    private void ensureActive() {
        if (done) throw new StoreException("transaction already ended");
    }

    private void ensureWritable() {
        ensureActive();
        if (!writable) throw new StoreException("read-only transaction");
    }

    // ---------------- handles ----------------

    private final class TxBucket implements Bucket {
        private final BucketPath path;

        TxBucket(BucketPath path) {
            this.path = path;
        }

        @Override public String name() { return path.leaf(); }

        @Override public byte[] get(byte[] key) { return FileTransaction.this.get(path, key); }

        @Override public void put(byte[] key, byte[] value) { FileTransaction.this.put(path, key, value); }

        @Override public void delete(byte[] key) { FileTransaction.this.delete(path, key); }

        @Override public Cursor cursor() {
            requireBucket(path);
            return new TxCursor(path);
        }

        @Override public int count() { return FileTransaction.this.count(path); }

        @Override public Bucket bucket(String name) {
            requireBucket(path);
            return openBucket(path.child(name));
        }

        @Override public Bucket createBucketIfNotExists(String name) {
            requireBucket(path);
            return createBucket(path.child(name));
        }

        @Override public void deleteBucket(String name) {
            requireBucket(path);
            dropBucket(path.child(name));
        }

        @Override public List<String> bucketNames() {
            requireBucket(path);
            return childNames(path);
        }

        @Override public String toString() { return "Bucket(" + path + ")"; }
    }

    private final class TxCursor implements Cursor {
        private final BucketPath path;
        private byte[] lastKey;
        private boolean exhausted;

        TxCursor(BucketPath path) {
            this.path = path;
        }

        @Override public Entry first() {
            return remember(step(path, null, true));
        }

        @Override public Entry next() {
            if (exhausted) return null;
            if (lastKey == null) return first();
            return remember(step(path, lastKey, false));
        }

        @Override public Entry seek(byte[] key) {
            return remember(step(path, Bytes.requireKey(key), true));
        }

        private Entry remember(Map.Entry<byte[], byte[]> e) {
            if (e == null) {
                exhausted = true;
                return null;
            }
            exhausted = false;
            lastKey = e.getKey();
            return new Entry(Bytes.copy(e.getKey()), Bytes.copy(e.getValue()));
        }
    }
}
