package io.difflite.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotDurabilityTest {

    @TempDir Path dataDir;

    private static byte[] b(String s) { return s.getBytes(StandardCharsets.UTF_8); }

    private static List<String> names(Path dir, String suffix) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).filter(n -> n.endsWith(suffix)).sorted().toList();
        }
    }

    /** Records every sync and, optionally, fails the sync of the temporary snapshot file. */
    static final class RecordingSnapshotter extends FileSnapshotter {
        final Path dir;
        final List<String> synced = new ArrayList<>();
        final List<List<String>> publishedAtSync = new ArrayList<>();
        boolean failFileSync;

        RecordingSnapshotter(Path dir) {
            super(dir, true);
            this.dir = dir;
        }

        @Override
        void sync(FileChannel ch, Path path) throws IOException {
            synced.add(path.equals(dir) ? "<dir>" : path.getFileName().toString());
            publishedAtSync.add(names(dir, ".bin"));
            if (failFileSync && !path.equals(dir)) throw new IOException("fsync failed");
            super.sync(ch, path);
        }
    }

    private static FileTxStore open(StoreConfig cfg, RecordingSnapshotter snaps) {
        return new FileTxStore(cfg, new FileWal(cfg.walDir(), cfg.walRotateBytes(), cfg.fsync()), snaps);
    }

    @Test
    void snapshot_file_is_forced_before_publish_and_directory_after() throws Exception {
        var cfg = StoreConfig.defaults(dataDir).withSnapshotEveryCommits(2);
        var snaps = new RecordingSnapshotter(cfg.snapDir());

        try (var store = open(cfg, snaps)) {
            store.update(tx -> tx.createBucketIfNotExists("ns"));
            store.update(tx -> { tx.bucket("ns").put(b("k"), b("v")); return null; });
        }

        String published = String.format("snapshot-%020d.bin", 2);
        assertEquals(List.of(published + ".tmp", "<dir>"), snaps.synced);
        assertEquals(List.of(), snaps.publishedAtSync.get(0), "not visible before its bytes are on disk");
        assertEquals(List.of(published), snaps.publishedAtSync.get(1));
        assertEquals(List.of(published), names(cfg.snapDir(), ".bin"));
    }

    @Test
    void failed_snapshot_sync_keeps_the_wal() throws Exception {
        var cfg = StoreConfig.defaults(dataDir).withSnapshotEveryCommits(2);
        var snaps = new RecordingSnapshotter(cfg.snapDir());
        snaps.failFileSync = true;

        try (var store = open(cfg, snaps)) {
            store.update(tx -> tx.createBucketIfNotExists("ns"));
            // triggers the snapshot; the commit itself still succeeds
            store.update(tx -> { tx.bucket("ns").put(b("k"), b("v")); return null; });
            store.update(tx -> { tx.bucket("ns").put(b("k2"), b("v2")); return null; });
        }

        assertEquals(List.of(), names(cfg.snapDir(), ".bin"));
        assertEquals(List.of(), names(cfg.snapDir(), ".tmp"));
        assertEquals(List.of("00000001.log"), names(cfg.walDir(), ".log"), "not compacted");

        try (var store = FileTxStore.open(dataDir)) {
            store.view(tx -> {
                assertArrayEquals(b("v"), tx.bucket("ns").get(b("k")));
                assertArrayEquals(b("v2"), tx.bucket("ns").get(b("k2")));
                return null;
            });
        }
    }
}
