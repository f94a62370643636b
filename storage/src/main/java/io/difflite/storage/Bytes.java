package io.difflite.storage;

import java.util.Arrays;
import java.util.Comparator;

/** Byte-key helpers shared by buckets, cursors and the snapshot format. */
public final class Bytes {

    /** Unsigned lexicographic order: the iteration order of every bucket. */
    public static final Comparator<byte[]> UNSIGNED = Arrays::compareUnsigned;

    private Bytes() {
        // utility
    }

    public static byte[] copy(byte[] b) {
        return b == null ? null : Arrays.copyOf(b, b.length);
    }

    static byte[] requireKey(byte[] key) {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("key must be non-empty");
        }
        return key;
    }
}
