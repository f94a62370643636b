package io.difflite.storage;

/**
 * Storage-level failure: I/O while logging or snapshotting, a failed commit,
 * access to a missing bucket, or use of a closed store or finished transaction.
 * Always fatal for the whole call; the active transaction does not commit.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
