package io.difflite.core;

/**
 * Deterministic digest of an arbitrary value's structural content.
 * <p>
 * Contract:
 *  - Same logical content yields the same {@link ContentHash}, across calls
 *    and across processes (change detection compares against hashes persisted
 *    by earlier runs).
 *  - Values that cannot be walked (cycles, unsupported types) fail with
 *    {@link HashingException}.
 */
public interface StructuralHasher {

    ContentHash hash(Object value);
}
