// file: src/main/java/io/difflite/storage/SnapshotPolicy.java
package io.difflite.storage;

/**
 * Snapshot policy that triggers a full snapshot after every N commits.
 * <p>
 * Simple but effective:
 *  - Bounds worst-case recovery time by limiting WAL replay length.
 *  - Does not consider file size or time.
 * <p>
 * Only touched by the single writer, so no synchronization is needed.
 */
final class SnapshotPolicy {
    private final int everyCommits;
    private int sinceLast;

    SnapshotPolicy(int everyCommits) {
        if (everyCommits <= 0) throw new IllegalArgumentException("everyCommits must be > 0");
        this.everyCommits = everyCommits;
    }

    /** Call after each durable commit. Returns true when a snapshot is due, resetting the counter. */
    boolean commitAndCheck() {
        if (++sinceLast >= everyCommits) {
            sinceLast = 0;
            return true;
        }
        return false;
    }
}
