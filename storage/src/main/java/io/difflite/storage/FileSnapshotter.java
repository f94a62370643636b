// file: src/main/java/io/difflite/storage/FileSnapshotter.java
package io.difflite.storage;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int64 txId            last commit included
 *   int32 bucketCount
 *   repeated 'bucketCount' times:
 *     - pathLen: int32, then per name int32 len + UTF-8 bytes
 *     - entries: int32
 *         repeated 'entries' times:
 *           - key:   int32 len + bytes
 *           - value: int32 len + bytes
 * <p>
 * Atomicity:
 *   - We write to "snapshot-<txId>.bin.tmp" first and, with fsync on, force it to disk,
 *   - then move to "snapshot-<txId>.bin" using ATOMIC_MOVE and force the directory,
 *   - then delete older snapshots.
 * writeSnapshot() returning means the snapshot survives a power loss (fsync on),
 * which is what lets the store drop the WAL segments it covers.
 * txId is zero padded so name order is commit order.
 */
class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());

    private final Path dir;
    private final boolean fsync;

    FileSnapshotter(Path dir, boolean fsync) {
        this.dir = dir;
        this.fsync = fsync;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new StoreException("cannot create snapshot dir " + dir, e); }
    }

    @Override
    public String writeSnapshot(long txId, Map<BucketPath, NavigableMap<byte[], byte[]>> buckets) {
        String name = String.format("snapshot-%020d.bin", txId);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (FileChannel fc = FileChannel.open(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            var out = new DataOutputStream(new BufferedOutputStream(Channels.newOutputStream(fc)));
            out.writeLong(txId);
            out.writeInt(buckets.size());

            for (Map.Entry<BucketPath, NavigableMap<byte[], byte[]>> b : buckets.entrySet()) {
                List<String> names = b.getKey().names();
                out.writeInt(names.size());
                for (String n : names) {
                    writeBytes(out, n.getBytes(StandardCharsets.UTF_8));
                }

                out.writeInt(b.getValue().size());
                for (Map.Entry<byte[], byte[]> e : b.getValue().entrySet()) {
                    writeBytes(out, e.getKey());
                    writeBytes(out, e.getValue());
                }
            }
            out.flush();
            if (fsync) sync(fc, tmp);
        } catch (IOException ex) {
            deleteQuietly(tmp);
            throw new StoreException("snapshot write failed", ex);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
            if (fsync) {
                try (FileChannel d = FileChannel.open(dir, StandardOpenOption.READ)) {
                    sync(d, dir);
                }
            }
        } catch (IOException e) { throw new StoreException("snapshot publish failed", e); }

        deleteOlderThan(dst);
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        Path snap = latest();
        if (snap == null) return null;

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            long txId = in.readLong();
            int bucketCount = in.readInt();
            Map<BucketPath, NavigableMap<byte[], byte[]>> buckets = new HashMap<>(bucketCount * 2);

            for (int i = 0; i < bucketCount; i++) {
                int depth = in.readInt();
                List<String> names = new ArrayList<>(depth);
                for (int d = 0; d < depth; d++) {
                    names.add(new String(readBytes(in), StandardCharsets.UTF_8));
                }

                int entries = in.readInt();
                NavigableMap<byte[], byte[]> m = new TreeMap<>(Bytes.UNSIGNED);
                for (int j = 0; j < entries; j++) {
                    byte[] k = readBytes(in);
                    m.put(k, readBytes(in));
                }
                buckets.put(new BucketPath(names), m);
            }
            return new LoadedSnapshot(snap.getFileName().toString(), txId, buckets);
        } catch (IOException e) { throw new StoreException("snapshot load failed: " + snap, e); }
    }

    private Path latest() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().startsWith("snapshot-"))
                    .filter(p -> p.getFileName().toString().endsWith(".bin"))
                    .sorted()
                    .reduce((a, b) -> b)
                    .orElse(null);
        } catch (IOException e) { throw new StoreException("cannot list snapshot dir " + dir, e); }
    }

    private void deleteOlderThan(Path keep) {
        try (Stream<Path> files = Files.list(dir)) {
            for (Path p : files.filter(p -> p.getFileName().toString().startsWith("snapshot-")).toList()) {
                if (p.getFileName().toString().compareTo(keep.getFileName().toString()) < 0) {
                    Files.deleteIfExists(p);
                }
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "could not prune old snapshots in " + dir, e);
        }
    }

    /** Force {@code ch}, open on {@code path}, to disk. */
    void sync(FileChannel ch, Path path) throws IOException {
        ch.force(true);
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.log(Level.WARNING, "could not delete " + p, e);
        }
    }

    private static void writeBytes(DataOutputStream out, byte[] v) throws IOException {
        out.writeInt(v.length);
        out.write(v);
    }

    private static byte[] readBytes(DataInputStream in) throws IOException {
        int len = in.readInt();
        return in.readNBytes(len);
    }
}
