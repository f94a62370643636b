// file: src/main/java/io/difflite/storage/FileTxStore.java
package io.difflite.storage;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable transactional bucket store.
 * <p>
 * Responsibilities:
 *  - Maintain the committed state in memory: bucket path -> sorted entries.
 *  - On commit of a write transaction:
 *      1) Serialize the transaction's journal into one commit record (TxRecordCodec).
 *      2) Append (+fsync) it to the WAL. If this fails nothing is applied.
 *      3) Apply the journal to memory under the state write lock.
 *      4) Rotate WAL segment if needed.
 *      5) Possibly write a full snapshot and drop the WAL segments it covers (SnapshotPolicy).
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL commit records newer than the snapshot, in order.
 * <p>
 * Concurrency:
 *  - Writers are serialized by a fair, non-reentrant permit: begin(true) blocks
 *    until the previous writer commits or rolls back.
 *  - Readers share the read side of a fair read/write lock over the committed state;
 *    publishing a commit takes the write side, so it waits for open readers.
 */
public final class FileTxStore implements TxStore {
    private static final Logger log = Logger.getLogger(FileTxStore.class.getName());

    private final StoreConfig config;
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;

    private final StoreState state = new StoreState();
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock(true);
    private final Semaphore writer = new Semaphore(1, true);

    // Guarded by the writer permit after construction.
    private long lastTxId;
    private volatile boolean closed;

    public FileTxStore(StoreConfig config) {
        this(config,
                new FileWal(config.walDir(), config.walRotateBytes(), config.fsync()),
                new FileSnapshotter(config.snapDir(), config.fsync()));
    }

    FileTxStore(StoreConfig config, Wal wal, Snapshotter snaps) {
        this.config = Objects.requireNonNull(config, "config");
        this.wal = wal;
        this.snaps = snaps;
        this.snapPolicy = new SnapshotPolicy(config.snapshotEveryCommits());
        recover();
    }

    /** Open (or create) a store under {@code dataDir} with default settings. */
    public static FileTxStore open(Path dataDir) {
        return new FileTxStore(StoreConfig.defaults(dataDir));
    }

    public StoreConfig config() {
        return config;
    }

    @Override
    public Transaction begin(boolean writable) {
        ensureOpen();
        if (!writable) {
            stateLock.readLock().lock();
            return new FileTransaction(this, state, false);
        }

        try {
            writer.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("interrupted while waiting for the write transaction", e);
        }
        if (closed) {
            writer.release();
            throw new StoreException("store is closed");
        }
        return new FileTransaction(this, state, true);
    }

    /**
     * Waits for the in-flight writer (if any), then closes the WAL.
     * Open read transactions are not waited for.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        writer.acquireUninterruptibly();
        try {
            wal.close();
            log.info(() -> "closed store " + config.dataDir() + " at txId=" + lastTxId);
        } finally {
            writer.release();
        }
    }

    // ---------------- called by FileTransaction ----------------

    /** Make a write transaction's journal durable and visible. Caller holds the writer permit. */
    void publish(List<TxRecordCodec.Op> journal) {
        long txId = lastTxId + 1;

        // 1) append + fsync. If this throws, the WAL has cut the record back out and memory is
        //    untouched, so the transaction is lost as a whole and txId is free for the next commit.
        wal.append(TxRecordCodec.encode(txId, journal));

        // 2) apply to memory
        stateLock.writeLock().lock();
        try {
            state.applyAll(journal);
        } finally {
            stateLock.writeLock().unlock();
        }
        lastTxId = txId;

        // 3) maybe rotate and maybe snapshot on thresholds
        wal.rotateIfNeeded();
        if (snapPolicy.commitAndCheck()) {
            snapshot();
        }
    }

    void releaseWriter() {
        writer.release();
    }

    void releaseReader() {
        stateLock.readLock().unlock();
    }

    // ---------------- internals ----------------

    /**
     * Readers never mutate the state and the caller holds the writer permit,
     * so the copy needs no lock. The WAL is compacted only after the snapshot is
     * published durably; a failed snapshot leaves every segment in place.
     */
    private void snapshot() {
        try {
            String id = snaps.writeSnapshot(lastTxId, state.copy());
            wal.compact();
            log.info(() -> "wrote snapshot " + id);
        } catch (StoreException e) {
            // The commit that triggered this is already durable in the WAL; recovery just replays more.
            log.log(Level.WARNING, "snapshot at txId=" + lastTxId + " failed", e);
        }
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL commit records in order, skipping those the snapshot already covers.
     */
    private void recover() {
        try {
            Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
            if (loaded != null) {
                state.load(loaded.buckets());
                lastTxId = loaded.txId();
            }

            int replayed = 0;
            try (Wal.WalReader r = wal.openReader()) {
                for (byte[] payload; (payload = r.next()) != null; ) {
                    TxRecordCodec.CommitRecord rec = TxRecordCodec.decode(payload);
                    if (rec.txId() <= lastTxId) continue;
                    state.applyAll(rec.ops());
                    lastTxId = rec.txId();
                    replayed++;
                }
            }

            int n = replayed;
            log.info(() -> "recovered store " + config.dataDir()
                    + " (snapshot=" + (loaded == null ? "none" : loaded.id())
                    + ", replayed=" + n + ", txId=" + lastTxId + ")");
        } catch (RuntimeException e) {
            wal.close();
            throw new StoreException("Recovery failed for " + config.dataDir(), e);
        }
    }

    private void ensureOpen() {
        if (closed) throw new StoreException("store is closed");
    }
}
