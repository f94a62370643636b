package io.difflite.diff;

/**
 * An object whose changes a {@link Differential} tracks.
 * <p>
 * The ID uniquely identifies the object across changes (for example the primary
 * key of a database row) and must be stable for its lifetime. Everything Jackson
 * serializes from the object is its content: it is hashed for change detection and
 * encoded as the staged payload.
 */
public interface DiffObject {

    /** Non-empty, caller-assigned identifier. */
    byte[] id();
}
