package io.difflite.storage;

import java.util.List;

/**
 * Ordered byte-keyed table inside a transaction.
 * <p>
 * Semantics:
 *  - Keys are non-empty byte arrays ordered as unsigned bytes; values may be empty but not null.
 *  - Values are copied on put and on get; callers never share arrays with the store.
 *  - Mutations require a writable transaction; they become visible to other
 *    transactions only after commit.
 *  - A bucket handle is only valid while its transaction is open and the bucket
 *    has not been deleted.
 */
public interface Bucket {

    String name();

    /** @return a copy of the value, or null if the key is absent. */
    byte[] get(byte[] key);

    void put(byte[] key, byte[] value);

    /** Deleting an absent key is a no-op. */
    void delete(byte[] key);

    Cursor cursor();

    /** Number of key/value entries, nested buckets excluded. */
    int count();

    /** @return the nested bucket, or null if it does not exist. */
    Bucket bucket(String name);

    Bucket createBucketIfNotExists(String name);

    /**
     * Delete a nested bucket and everything below it.
     *
     * @throws StoreException if the bucket does not exist
     */
    void deleteBucket(String name);

    /** Names of the direct nested buckets, sorted. */
    List<String> bucketNames();
}
