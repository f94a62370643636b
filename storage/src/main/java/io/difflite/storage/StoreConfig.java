// file: storage/src/main/java/io/difflite/storage/StoreConfig.java
package io.difflite.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for a {@link FileTxStore}.
 *
 * Fields:
 *  - dataDir:              root directory; WAL segments go to dataDir/wal, snapshots to dataDir/snap
 *  - walRotateBytes:       start a new WAL segment once the current one reaches this size
 *  - snapshotEveryCommits: write a full snapshot (and drop covered WAL segments) after this many commits
 *  - fsync:                force every commit record to disk before commit() returns, and every
 *                          snapshot before the WAL segments it covers are deleted
 */
public record StoreConfig(
        Path dataDir,
        long walRotateBytes,
        int snapshotEveryCommits,
        boolean fsync
) {

    public static final long DEFAULT_WAL_ROTATE_BYTES = 64L * 1024 * 1024; // ~64MB
    public static final int DEFAULT_SNAPSHOT_EVERY_COMMITS = 10_000;

    public StoreConfig {
        Objects.requireNonNull(dataDir, "dataDir");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("walRotateBytes must be > 0");
        if (snapshotEveryCommits <= 0) throw new IllegalArgumentException("snapshotEveryCommits must be > 0");
    }

    /** Defaults suitable for production use under {@code dataDir}. */
    public static StoreConfig defaults(Path dataDir) {
        return new StoreConfig(dataDir, DEFAULT_WAL_ROTATE_BYTES, DEFAULT_SNAPSHOT_EVERY_COMMITS, true);
    }

    public Path walDir() { return dataDir.resolve("wal"); }

    public Path snapDir() { return dataDir.resolve("snap"); }

    public StoreConfig withSnapshotEveryCommits(int everyCommits) {
        return new StoreConfig(dataDir, walRotateBytes, everyCommits, fsync);
    }

    public StoreConfig withWalRotateBytes(long rotateBytes) {
        return new StoreConfig(dataDir, rotateBytes, snapshotEveryCommits, fsync);
    }

    /**
     * Load from a JSON file. Missing fields fall back to {@link #defaults(Path)};
     * a relative dataDir is resolved against the file's directory.
     *
     * Example:
     * <pre>
     * {
     *   "dataDir": "./data",
     *   "walRotateBytes": 67108864,
     *   "snapshotEveryCommits": 10000,
     *   "fsync": true
     * }
     * </pre>
     */
    public static StoreConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            JsonStoreConfig cfg = mapper.readValue(path.toFile(), JsonStoreConfig.class);
            if (cfg.dataDir == null || cfg.dataDir.isBlank()) {
                throw new IllegalArgumentException("dataDir is required in " + path);
            }

            Path base = path.toAbsolutePath().getParent();
            Path dir = base == null ? Path.of(cfg.dataDir) : base.resolve(cfg.dataDir);

            return new StoreConfig(
                    dir.normalize(),
                    cfg.walRotateBytes == null ? DEFAULT_WAL_ROTATE_BYTES : cfg.walRotateBytes,
                    cfg.snapshotEveryCommits == null ? DEFAULT_SNAPSHOT_EVERY_COMMITS : cfg.snapshotEveryCommits,
                    cfg.fsync == null || cfg.fsync
            );
        } catch (IOException e) {
            throw new StoreException("Failed to load StoreConfig from " + path, e);
        }
    }
}
