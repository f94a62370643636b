package io.difflite.storage;

import java.util.List;

/**
 * A read-only or read-write view over the store.
 * <p>
 * Lifecycle:
 *  - Obtained from {@link TxStore#begin(boolean)}; must end with {@link #commit()}
 *    or {@link #rollback()}. {@link #close()} rolls back if neither happened, so
 *    try-with-resources gives "commit explicitly or discard".
 *  - Write transactions are exclusive: at most one is open per store.
 *  - Read transactions see the state committed when they started and block
 *    commits of writers until they end. A thread holding a read transaction must
 *    not begin a write transaction.
 */
public interface Transaction extends AutoCloseable {

    boolean writable();

    /** @return the top-level bucket, or null if it does not exist. */
    Bucket bucket(String name);

    Bucket createBucketIfNotExists(String name);

    /**
     * Delete a top-level bucket and everything nested in it.
     *
     * @throws StoreException if the bucket does not exist
     */
    void deleteBucket(String name);

    /** Names of the top-level buckets, sorted. */
    List<String> bucketNames();

    /**
     * Register a hook to run after this transaction commits durably.
     * Hooks never run on rollback or on a failed commit.
     */
    void onCommit(Runnable hook);

    /**
     * Make all changes durable and visible. For read transactions this simply ends them.
     *
     * @throws StoreException if the transaction already ended or the commit record could not be written;
     *                        in the latter case nothing of the transaction is applied.
     */
    void commit();

    /** Discard all changes. No-op if the transaction already ended. */
    void rollback();

    @Override
    void close();
}
