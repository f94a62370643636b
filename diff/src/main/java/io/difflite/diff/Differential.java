package io.difflite.diff;

import io.difflite.core.ContentHash;
import io.difflite.core.PayloadCodec;
import io.difflite.core.StructuralHasher;
import io.difflite.storage.Bucket;
import io.difflite.storage.Cursor;
import io.difflite.storage.StoreException;
import io.difflite.storage.Transaction;
import io.difflite.storage.TxStore;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks changes to a set of objects and drives their application to an external system.
 * <p>
 * Responsibilities:
 *  - Stage: record the latest content of an object if it differs from what was last
 *    applied or already staged.
 *  - Apply: hand every staged change to a callback; promote the ones it accepts,
 *    keep the rest pending for retry.
 *  - Optionally reject a second stage of the same ID within one epoch.
 * <p>
 * Layout inside the namespace bucket:
 *  - {@code _m}:    id -> hash of the last applied version
 *  - {@code _ph}:   id -> hash of the pending version
 *  - {@code _pd}:   hash -> [u32 refs][encoded payload]
 *  - {@code _dk}:   id -> marker, for conflict tracking
 *  - {@code _mode}: persisted namespace mode
 *  - {@code _ud}:   user data, untouched by this class
 * <p>
 * Payloads are shared by every pending ID with the same content hash and carry a
 * reference count, so superseding or promoting one ID never drops a payload another
 * ID still points at.
 * <p>
 * Instances are thread safe; all state lives in the store.
 */
public final class Differential {
    private static final Logger log = Logger.getLogger(Differential.class.getName());

    /** Terminates {@link #addStream}; compared by identity. */
    public static final DiffObject END_OF_STREAM = () -> new byte[0];

    static final String HASHES = "_m";
    static final String PENDING_HASHES = "_ph";
    static final String PENDING_DATA = "_pd";
    static final String KEY_CONFLICTS = "_dk";
    static final String MODE = "_mode";
    static final String USER_DATA = "_ud";

    static final List<String> TABLES = List.of(HASHES, PENDING_HASHES, PENDING_DATA, KEY_CONFLICTS, MODE, USER_DATA);

    private static final byte[] MODE_CONFLICTS = "conflicts".getBytes(StandardCharsets.UTF_8);
    private static final byte[] MARKER = {1};
    private static final int REFS_BYTES = 4;

    /** Longest a waiting {@link #addStream} goes without checking its token. */
    static final long STREAM_POLL_MILLIS = 50;

    private final String name;
    private final TxStore store;
    private final StructuralHasher hasher;
    private final PayloadCodec codec;

    Differential(String name, TxStore store, StructuralHasher hasher, PayloadCodec codec) {
        this.name = name;
        this.store = store;
        this.hasher = hasher;
        this.codec = codec;
    }

    public String name() {
        return name;
    }

    /** Content hash as this differential computes it. */
    public ContentHash hashOf(Object value) {
        return hasher.hash(value);
    }

    // ---------------- conflict mode ----------------

    /**
     * Enable conflict tracking and start a new epoch with no IDs seen.
     * While enabled, staging an ID that was already staged in the epoch throws
     * {@link ConflictingKeyException}. Calling it again starts a fresh epoch.
     */
    public void mustNotConflict() {
        store.update(tx -> {
            Bucket ns = namespace(tx);
            resetConflicts(ns);
            ns.createBucketIfNotExists(MODE).put(MODE_CONFLICTS, MARKER);
            return null;
        });
        log.info(() -> "Conflict tracking enabled for differential " + name);
    }

    /** Disable conflict tracking and drop the markers of the current epoch. */
    public void allowConflicts() {
        store.update(tx -> {
            Bucket ns = namespace(tx);
            resetConflicts(ns);
            ns.createBucketIfNotExists(MODE).delete(MODE_CONFLICTS);
            return null;
        });
        log.info(() -> "Conflict tracking disabled for differential " + name);
    }

    public boolean conflictTracking() {
        return store.view(tx -> conflictTracking(namespace(tx)));
    }

    // ---------------- stage ----------------

    /**
     * Stage {@code obj} in its own write transaction.
     *
     * @return true if the object was changed and is now pending
     */
    public boolean add(DiffObject obj) {
        return store.update(tx -> addTx(tx, obj));
    }

    /**
     * Stage {@code obj} inside a caller-owned write transaction. The caller commits.
     *
     * @return true if the object was changed and is now pending
     * @throws ConflictingKeyException if conflict tracking is on and the ID was already staged this epoch
     */
    public boolean addTx(Transaction tx, DiffObject obj) {
        Objects.requireNonNull(obj, "obj");
        byte[] id = obj.id();
        if (id == null || id.length == 0) {
            throw new IllegalArgumentException("DiffObject id must be non-empty");
        }
        Bucket ns = namespace(tx);

        boolean tracking = conflictTracking(ns);
        Bucket conflicts = tracking ? ns.createBucketIfNotExists(KEY_CONFLICTS) : null;
        if (conflicts != null && conflicts.get(id) != null) {
            throw new ConflictingKeyException(name, id);
        }

        ContentHash hash = hasher.hash(obj);

        if (hash.matches(ns.bucket(HASHES).get(id))) {
            return false;
        }
        Bucket pending = ns.bucket(PENDING_HASHES);
        byte[] previous = pending.get(id);
        if (hash.matches(previous)) {
            return false;
        }

        Bucket payloads = ns.bucket(PENDING_DATA);
        if (previous != null) {
            release(payloads, id, previous);
        }
        byte[] key = hash.bytes();
        retain(payloads, key, obj);
        pending.put(id, key);
        if (conflicts != null) {
            conflicts.put(id, MARKER);
        }
        if (log.isLoggable(Level.FINE)) {
            log.fine("Staged " + Ids.display(id) + " as " + hash + " in " + name
                    + (previous == null ? "" : " (superseded " + ContentHash.of(previous) + ")"));
        }
        return true;
    }

    /**
     * Stage every object from {@code objects} in one write transaction.
     * The batch commits only if the iterator is exhausted normally; any failure or
     * cancellation rolls back all of it.
     *
     * @return the number of objects that were changed
     * @throws CancellationException if {@code token} was cancelled before the input ended
     */
    public int addAll(CancellationToken token, Iterator<? extends DiffObject> objects) {
        return store.update(tx -> {
            int updated = 0;
            while (objects.hasNext()) {
                if (token.isCancelled()) throw cancelledStage(token, updated);
                if (addTx(tx, objects.next())) updated++;
            }
            logBatch(updated);
            return updated;
        });
    }

    /**
     * Stage objects taken from {@code stream} until {@link #END_OF_STREAM} arrives, in one
     * write transaction. Same all-or-nothing rules as {@link #addAll}. The write lock is held
     * while waiting for producers, so other writers block until the stream ends.
     * <p>
     * While the queue is empty the token is checked every {@value #STREAM_POLL_MILLIS} ms,
     * so a cancellation is noticed at most that long after it happens. Interrupting the
     * calling thread is noticed immediately and also cancels the batch.
     *
     * @return the number of objects that were changed
     * @throws CancellationException if {@code token} was cancelled or the thread interrupted first
     */
    public int addStream(CancellationToken token, BlockingQueue<? extends DiffObject> stream) {
        return store.update(tx -> {
            int updated = 0;
            while (true) {
                if (token.isCancelled()) throw cancelledStage(token, updated);
                DiffObject obj;
                try {
                    obj = stream.poll(STREAM_POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    CancellationException ce = new CancellationException("interrupted while staging " + name);
                    ce.initCause(e);
                    throw ce;
                }
                if (obj == null) continue;
                if (obj == END_OF_STREAM) break;
                if (addTx(tx, obj)) updated++;
            }
            logBatch(updated);
            return updated;
        });
    }

    private CancellationException cancelledStage(CancellationToken token, int updated) {
        log.info(() -> "Staging batch for " + name + " cancelled; discarding " + updated + " change(s)");
        return token.toException();
    }

    private void logBatch(int updated) {
        log.fine(() -> "Staged batch of " + updated + " change(s) in " + name);
    }

    // ---------------- apply ----------------

    /**
     * Apply every pending change. Equivalent to {@code eachN(token, f, 0)}.
     */
    public ApplyResult each(CancellationToken token, ApplyFunc f) {
        return eachN(token, f, 0);
    }

    public ApplyResult each(ApplyFunc f) {
        return eachN(CancellationToken.none(), f, 0);
    }

    /**
     * Offer pending changes to {@code f} in ascending ID order, stopping once {@code n}
     * of them have been promoted ({@code n <= 0} means no limit) or the token is cancelled.
     * <p>
     * Accepted changes move to the committed table; rejected ones stay pending and are
     * reported in the result. Everything happens in one write transaction, committed once
     * at the end, so a failed commit loses every promotion of this pass.
     *
     * @throws InconsistentStateException if a pending change has no payload
     * @throws StoreException             if the transaction cannot be committed
     */
    public ApplyResult eachN(CancellationToken token, ApplyFunc f, int n) {
        Objects.requireNonNull(f, "f");
        ApplyResult result = store.update(tx -> {
            Bucket ns = namespace(tx);
            Bucket committed = ns.bucket(HASHES);
            Bucket pending = ns.bucket(PENDING_HASHES);
            Bucket payloads = ns.bucket(PENDING_DATA);

            List<ItemFailure> failures = new ArrayList<>();
            int promoted = 0;
            boolean cancelled = false;

            Cursor cur = pending.cursor();
            for (Cursor.Entry e = cur.first(); e != null; e = cur.next()) {
                if (token.isCancelled()) {
                    cancelled = true;
                    break;
                }
                byte[] id = e.key();
                byte[] hash = e.value();
                byte[] entry = payloads.get(hash);
                if (entry == null) {
                    InconsistentStateException ex = new InconsistentStateException(name, id, hash);
                    log.log(Level.SEVERE, ex.getMessage(), ex);
                    throw ex;
                }
                try {
                    f.apply(id, codec.decoder(payloadOf(entry)));
                } catch (Exception ex) {
                    failures.add(new ItemFailure(id, ex));
                    log.log(Level.WARNING, "Apply failed for " + Ids.display(id) + " in " + name
                            + "; change stays pending", ex);
                    continue;
                }
                committed.put(id, hash);
                pending.delete(id);
                release(payloads, id, hash);
                promoted++;
                if (n > 0 && promoted >= n) break;
            }
            return new ApplyResult(promoted, failures, cancelled);
        });
        log.info(() -> "Applied " + result.promoted() + " change(s) in " + name
                + ", " + result.failures().size() + " failed"
                + (result.cancelled() ? ", cancelled" : ""));
        return result;
    }

    // ---------------- queries ----------------

    /**
     * Whether {@code candidate} differs from the last applied version of {@code id}.
     * Pending changes are not considered.
     */
    public boolean changed(byte[] id, Object candidate) {
        ContentHash hash = hasher.hash(candidate);
        return store.view(tx -> !hash.matches(namespace(tx).bucket(HASHES).get(id)));
    }

    /** Number of IDs with an applied version. */
    public int countTracking() {
        return store.view(tx -> namespace(tx).bucket(HASHES).count());
    }

    /** Number of changes waiting to be applied. */
    public int countChanges() {
        return store.view(tx -> namespace(tx).bucket(PENDING_HASHES).count());
    }

    /** IDs of the changes waiting to be applied, in apply order. */
    public List<byte[]> pendingIds() {
        return store.view(tx -> {
            List<byte[]> ids = new ArrayList<>();
            Cursor cur = namespace(tx).bucket(PENDING_HASHES).cursor();
            for (Cursor.Entry e = cur.first(); e != null; e = cur.next()) {
                ids.add(e.key());
            }
            return ids;
        });
    }

    // ---------------- user data ----------------

    public <T> T viewUserData(Function<Bucket, T> fn) {
        return store.view(tx -> fn.apply(namespace(tx).bucket(USER_DATA)));
    }

    /** Run {@code fn} against the user data bucket; changes commit if it returns normally. */
    public <T> T updateUserData(Function<Bucket, T> fn) {
        return store.update(tx -> fn.apply(namespace(tx).bucket(USER_DATA)));
    }

    // ---------------- internals ----------------

    private Bucket namespace(Transaction tx) {
        Bucket ns = tx.bucket(name);
        if (ns == null) {
            throw new StoreException("Differential " + name + " does not exist");
        }
        return ns;
    }

    private static void resetConflicts(Bucket ns) {
        if (ns.bucket(KEY_CONFLICTS) != null) {
            ns.deleteBucket(KEY_CONFLICTS);
        }
        ns.createBucketIfNotExists(KEY_CONFLICTS);
    }

    private static boolean conflictTracking(Bucket ns) {
        Bucket mode = ns.bucket(MODE);
        return mode != null && mode.get(MODE_CONFLICTS) != null;
    }

    /** Store the payload for {@code hash}, or add a reference if another ID already holds it. */
    private void retain(Bucket payloads, byte[] hash, DiffObject obj) {
        byte[] entry = payloads.get(hash);
        if (entry != null) {
            payloads.put(hash, withRefs(entry, refsOf(entry) + 1));
            return;
        }
        byte[] data = codec.encode(obj);
        ByteBuffer bb = ByteBuffer.allocate(REFS_BYTES + data.length);
        bb.putInt(1).put(data);
        payloads.put(hash, bb.array());
    }

    /** Drop one reference to the payload for {@code hash}; the payload goes with the last one. */
    private void release(Bucket payloads, byte[] id, byte[] hash) {
        byte[] entry = payloads.get(hash);
        if (entry == null) {
            throw new InconsistentStateException(name, id, hash);
        }
        int refs = refsOf(entry);
        if (refs <= 1) {
            payloads.delete(hash);
        } else {
            payloads.put(hash, withRefs(entry, refs - 1));
        }
    }

    private static int refsOf(byte[] entry) {
        return ByteBuffer.wrap(entry, 0, REFS_BYTES).getInt();
    }

    private static byte[] withRefs(byte[] entry, int refs) {
        byte[] out = entry.clone();
        ByteBuffer.wrap(out).putInt(refs);
        return out;
    }

    private static byte[] payloadOf(byte[] entry) {
        return Arrays.copyOfRange(entry, REFS_BYTES, entry.length);
    }
}
