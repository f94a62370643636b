// file: src/main/java/io/difflite/storage/FileWal.java
package io.difflite.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;


/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - truncates a torn tail left by a crash mid-append,
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata (when fsync is on),
 *      - tracks bytes written this segment,
 *      - on any I/O failure truncates the segment back to where the record started,
 *        so a failed append leaves nothing for recovery to replay and nothing for
 *        later records to be appended behind.
 *      - if that rollback fails too, the WAL is poisoned: every further append is
 *        rejected until the store is reopened (recovery then drops the torn tail).
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - Reader:
 *      - walks all segments in name order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private final boolean fsync;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;
    private StoreException failure;

    public FileWal(Path dir, long rotateBytes, boolean fsync) {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        this.fsync = fsync;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new StoreException("cannot create WAL dir " + dir, e); }
        openNewestOrCreate();
    }

    @Override
    public void append(byte[] serializedRecord) {
        if (failure != null) {
            throw new StoreException("WAL unusable after a failed rollback; reopen the store", failure);
        }
        long start;
        try {
            start = ch.position();
        } catch (IOException e) {
            throw new StoreException("WAL append failed", e);
        }
        try {
            writeFully(ByteBuffer.wrap(serializedRecord));
            if (fsync) sync(); // metadata too, so a freshly rotated file is durable
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            StoreException ex = new StoreException("WAL append failed", e);
            rollbackTo(start, ex);
            throw ex;
        }
    }

    /** Cut the segment back to {@code start}; poison the WAL if that is impossible. */
    private void rollbackTo(long start, StoreException cause) {
        try {
            ch.truncate(start);
            ch.position(start);
            if (fsync) sync();
        } catch (IOException e) {
            cause.addSuppressed(e);
            failure = cause;
            log.log(Level.SEVERE, "could not roll back failed WAL append in " + current.getFileName()
                    + "; rejecting further appends", e);
        }
    }

    /** Write the whole buffer at the current position. */
    void writeFully(ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) {
            ch.write(buf);
        }
    }

    void sync() throws IOException {
        ch.force(true);
    }

    @Override
    public void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        openNext();
    }

    @Override
    public void compact() {
        Path keep = openNext();
        for (Path seg : segments()) {
            if (seg.equals(keep)) continue;
            try {
                Files.deleteIfExists(seg);
            } catch (IOException e) {
                // Leftover segments only cost replay time: their records are older than the snapshot.
                log.log(Level.WARNING, "could not delete WAL segment " + seg, e);
            }
        }
    }

    @Override
    public WalReader openReader() { return new Reader(segments()); }

    @Override
    public void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new StoreException("WAL close failed", e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, drop any torn tail and
     *    position at the end of the last valid record.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        try {
            List<Path> segs = segments();
            current = segs.isEmpty() ? dir.resolve("00000001.log") : segs.get(segs.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);

            long valid = 0;
            for (byte[] rec; (rec = readRecord(ch, valid)) != null; ) {
                valid += TxRecordCodec.HEADER_BYTES + rec.length;
            }
            if (valid < ch.size()) {
                log.warning(() -> "truncating torn WAL tail in " + current.getFileName());
                ch.truncate(valid);
                if (fsync) ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) { throw new StoreException("cannot open WAL in " + dir, e); }
    }

    private Path openNext() {
        try {
            ch.close();
            String next = String.format("%08d.log", Integer.parseInt(
                    current.getFileName().toString().replace(".log", "")) + 1);
            current = dir.resolve(next);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
            return current;
        } catch (IOException e) { throw new StoreException("WAL rotation failed", e); }
    }

    private List<Path> segments() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList();
        } catch (IOException e) { throw new StoreException("cannot list WAL dir " + dir, e); }
    }

    /**
     * Read one record at {@code pos}.
     *
     * @return the payload, or null at EOF or on a truncated/corrupt record
     */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(TxRecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read == -1 || read == 0) return null; // EOF or empty
        if (read < TxRecordCodec.HEADER_BYTES) return null; // truncated header at tail, stop
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != TxRecordCodec.MAGIC || ver != TxRecordCodec.VERSION || len < 0) return null;
        if (pos + TxRecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload, stop
        ByteBuffer payload = ByteBuffer.allocate(len);
        long at = pos + TxRecordCodec.HEADER_BYTES;
        while (payload.hasRemaining()) {
            int r = ch.read(payload, at + payload.position());
            if (r <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (TxRecordCodec.crc32(bytes) != crc) return null; // bad tail, stop
        return bytes;
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     * Stops for good at the first invalid record, even if later segments exist.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIdx = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped = false;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (++segIdx >= segments.size()) { stopped = true; return null; }
                        ch = FileChannel.open(segments.get(segIdx), READ);
                        pos = 0;
                    }
                    byte[] rec = readRecord(ch, pos);
                    if (rec != null) {
                        pos += TxRecordCodec.HEADER_BYTES + rec.length;
                        return rec;
                    }
                    boolean cleanEnd = pos == ch.size();
                    ch.close();
                    ch = null;
                    if (!cleanEnd) { stopped = true; return null; }
                }
            } catch (IOException e) {
                throw new StoreException("WAL read failed", e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new StoreException("WAL reader close failed", e);
            }
        }
    }
}
