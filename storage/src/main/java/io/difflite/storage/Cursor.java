package io.difflite.storage;

/**
 * Forward cursor over one bucket, in unsigned lexicographic key order.
 * <p>
 * The cursor is positional: each step looks up the next key after the one it
 * last returned, so the bucket may be modified while iterating (deleting the
 * current entry is fine). Only valid while its transaction is open.
 */
public interface Cursor {

    /** @return the first entry, or null if the bucket is empty. */
    Entry first();

    /** @return the entry after the last one returned, or null at the end. */
    Entry next();

    /** @return the first entry whose key is {@code >= key}, or null if none. */
    Entry seek(byte[] key);

    /** Key/value pair returned by a cursor step. Arrays are copies owned by the caller. */
    record Entry(byte[] key, byte[] value) {}
}
