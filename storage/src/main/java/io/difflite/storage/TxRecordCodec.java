// file: src/main/java/io/difflite/storage/TxRecordCodec.java
package io.difflite.storage;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary framing for commit records: one WAL record per committed write transaction.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD1FF   (helps detect garbage)
 *     - version (1B)  = 1        (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - txId:    int64 commit sequence number
 *     - opCount: int32
 *         repeated opCount times:
 *           - kind:  byte (1=create bucket, 2=drop bucket, 3=put, 4=delete)
 *           - path:  int32 name count, then per name int32 len + UTF-8 bytes
 *           - key:   int32 len + bytes (len == -1 => null)
 *           - value: int32 len + bytes (len == -1 => null)
 * <p>
 * A commit is atomic because the whole transaction is one CRC-checked record:
 * a torn record fails validation and recovery ignores it entirely.
 */
final class TxRecordCodec {
    static final short MAGIC = (short) 0xD1FF;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 2 + 1 + 4 + 4;

    enum Kind {
        CREATE_BUCKET((byte) 1),
        DROP_BUCKET((byte) 2),
        PUT((byte) 3),
        DELETE((byte) 4);

        final byte code;

        Kind(byte code) { this.code = code; }

        static Kind of(byte code) {
            for (Kind k : values()) {
                if (k.code == code) return k;
            }
            throw new IllegalArgumentException("unknown op kind " + code);
        }
    }

    /** One journaled mutation. key/value are null for bucket operations. */
    record Op(Kind kind, BucketPath path, byte[] key, byte[] value) {
        static Op createBucket(BucketPath p) { return new Op(Kind.CREATE_BUCKET, p, null, null); }
        static Op dropBucket(BucketPath p) { return new Op(Kind.DROP_BUCKET, p, null, null); }
        static Op put(BucketPath p, byte[] k, byte[] v) { return new Op(Kind.PUT, p, k, v); }
        static Op delete(BucketPath p, byte[] k) { return new Op(Kind.DELETE, p, k, null); }
    }

    /** Immutable view of a decoded commit record. */
    record CommitRecord(long txId, List<Op> ops) {}

    private TxRecordCodec() {
    }

    /** Encode a commit into header+payload bytes ready for append. */
    static byte[] encode(long txId, List<Op> ops) {
        byte[] payload = encodePayload(txId, ops);
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        header.flip();

        byte[] out = new byte[header.remaining() + payload.length];
        header.get(out, 0, header.limit());
        System.arraycopy(payload, 0, out, header.limit(), payload.length);
        return out;
    }

    /** Decode a full payload (not including header). */
    static CommitRecord decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        long txId = b.getLong();
        int count = b.getInt();
        List<Op> ops = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Kind kind = Kind.of(b.get());
            BucketPath path = readPath(b);
            byte[] key = readBytes(b);
            byte[] value = readBytes(b);
            ops.add(new Op(kind, path, key, value));
        }
        return new CommitRecord(txId, ops);
    }

    // ----------------- helpers -----------------

    private static byte[] encodePayload(long txId, List<Op> ops) {
        int size = 8 + 4; // txId + opCount
        for (Op op : ops) {
            size += 1;
            size += 4;
            for (String n : op.path().names()) {
                size += 4 + utf8(n).length;
            }
            size += 4 + (op.key() == null ? 0 : op.key().length);
            size += 4 + (op.value() == null ? 0 : op.value().length);
        }

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        b.putLong(txId);
        b.putInt(ops.size());
        for (Op op : ops) {
            b.put(op.kind().code);
            b.putInt(op.path().depth());
            for (String n : op.path().names()) {
                writeBytes(b, utf8(n));
            }
            writeBytes(b, op.key());
            writeBytes(b, op.value());
        }
        return b.array();
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static BucketPath readPath(ByteBuffer b) {
        int n = b.getInt();
        List<String> names = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            byte[] s = readBytes(b);
            if (s == null) throw new NullPointerException("bucket name bytes are null");
            names.add(new String(s, StandardCharsets.UTF_8));
        }
        return new BucketPath(names);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) { b.putInt(-1); return; }
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }
}
