package io.difflite.storage;

/**
 * Write-Ahead Log abstraction for durability and recovery.
 * <p>
 * Contract:
 *  - append() is atomic at "record" granularity: a partial write is treated
 *    as absent during recovery (reader stops at first corrupt/truncated record).
 *  - append() forces the record to disk before returning when fsync is enabled,
 *    so that if the process crashes after append() returns, recovery will see the record.
 */
public interface Wal extends AutoCloseable {

    /**
     * Append a single serialized record.
     *
     * @param serializedRecord header+payload bytes, from TxRecordCodec.encode(...)
     */
    void append(byte[] serializedRecord);

    /**
     * Rotate log segment if configured thresholds are hit.
     * Called by the store after each commit.
     */
    void rotateIfNeeded();

    /**
     * Start a fresh segment and delete every older one.
     * Only safe once a snapshot covers all records in the older segments.
     */
    void compact();

    /**
     * Open a sequential reader over the WAL.
     * Reader walks segments oldest first and stops at:
     *  - first corrupt header,
     *  - first truncated payload, or
     *  - end of the last segment.
     */
    WalReader openReader();

    @Override
    void close();

    /**
     * Reader abstraction used during recovery.
     */
    interface WalReader extends AutoCloseable {

        /**
         * @return next valid payload (NOT including header), or null when:
         *   - at EOF, or
         *   - corruption/truncation is detected.
         */
        byte[] next();

        @Override
        void close();
    }
}
