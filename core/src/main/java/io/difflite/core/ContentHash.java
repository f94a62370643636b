// file: src/main/java/io/difflite/core/ContentHash.java
package io.difflite.core;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Immutable fixed-width digest of an object's structural content.
 * <p>
 * Properties:
 *  - Always {@link #LENGTH} bytes.
 *  - Equal content produces equal hashes; unequal content produces different
 *    hashes with high (but not guaranteed) probability. Not collision resistant.
 * <p>
 * Invariants:
 *  - Defensive copies of the digest bytes are taken on input and output.
 */
public final class ContentHash {

    /** Digest width in bytes. */
    public static final int LENGTH = 8;

    private final byte[] bytes;

    private ContentHash(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wrap raw digest bytes, for example a hash read back from storage.
     *
     * @throws IllegalArgumentException if {@code bytes} is not exactly {@link #LENGTH} long
     */
    public static ContentHash of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("content hash must be " + LENGTH + " bytes");
        }
        return new ContentHash(Arrays.copyOf(bytes, LENGTH));
    }

    /** Returns null when {@code bytes} is null, otherwise the same as {@link #of(byte[])}. */
    public static ContentHash ofNullable(byte[] bytes) {
        return bytes == null ? null : of(bytes);
    }

    public byte[] bytes() { return Arrays.copyOf(bytes, LENGTH); }

    /** True if {@code other} holds the same digest bytes. Null-safe. */
    public boolean matches(byte[] other) {
        return other != null && Arrays.equals(bytes, other);
    }

    public String toHex() { return HexFormat.of().formatHex(bytes); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentHash h)) return false;
        return Arrays.equals(bytes, h.bytes);
    }

    @Override public int hashCode() { return Arrays.hashCode(bytes); }

    @Override public String toString() { return toHex(); }
}
