package io.difflite.diff;

import io.difflite.core.CborPayloadCodec;
import io.difflite.core.JacksonStructuralHasher;
import io.difflite.core.PayloadCodec;
import io.difflite.core.StructuralHasher;
import io.difflite.storage.Bucket;
import io.difflite.storage.FileTxStore;
import io.difflite.storage.StoreConfig;
import io.difflite.storage.StoreException;
import io.difflite.storage.TxStore;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point: a store holding any number of named differentials.
 * <p>
 * Each differential lives in its own top-level bucket; opening one creates its tables.
 * All differentials share the store's single writer.
 */
public final class DiffDb implements AutoCloseable {
    private static final Logger log = Logger.getLogger(DiffDb.class.getName());

    private final TxStore store;
    private final StructuralHasher hasher;
    private final PayloadCodec codec;

    public DiffDb(TxStore store) {
        this(store, new JacksonStructuralHasher(), new CborPayloadCodec());
    }

    public DiffDb(TxStore store, StructuralHasher hasher, PayloadCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public static DiffDb open(StoreConfig config) {
        return new DiffDb(new FileTxStore(config));
    }

    public static DiffDb open(Path dataDir) {
        return open(StoreConfig.defaults(dataDir));
    }

    /** Create the differential {@code name} if needed and return a handle to it. */
    public Differential open(String name) {
        requireName(name);
        store.update(tx -> {
            Bucket ns = tx.createBucketIfNotExists(name);
            for (String table : Differential.TABLES) {
                ns.createBucketIfNotExists(table);
            }
            return null;
        });
        log.fine(() -> "Opened differential " + name);
        return new Differential(name, store, hasher, codec);
    }

    /**
     * Drop the differential {@code name} with everything it tracks.
     *
     * @throws StoreException if it does not exist
     */
    public void delete(String name) {
        requireName(name);
        store.update(tx -> {
            tx.deleteBucket(name);
            return null;
        });
        log.info(() -> "Deleted differential " + name);
    }

    /** Names of all differentials, in byte order. */
    public List<String> names() {
        return store.view(tx -> tx.bucketNames());
    }

    /** The underlying store, for callers that stage inside their own transactions. */
    public TxStore store() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("differential name must be non-empty");
        }
    }
}
