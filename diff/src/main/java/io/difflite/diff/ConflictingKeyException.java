package io.difflite.diff;

/**
 * Conflict tracking is enabled and an object with this ID was already staged in the current epoch.
 * Nothing was modified by the rejected stage.
 */
public class ConflictingKeyException extends RuntimeException {

    private final byte[] id;

    public ConflictingKeyException(String namespace, byte[] id) {
        super("difflite: multiple objects with the same ID were added in the same change version"
                + " (differential=" + namespace + ", id=" + Ids.display(id) + ")");
        this.id = id.clone();
    }

    public byte[] id() {
        return id.clone();
    }
}
