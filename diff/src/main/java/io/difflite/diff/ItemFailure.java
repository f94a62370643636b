package io.difflite.diff;

import java.util.Arrays;
import java.util.Objects;

/**
 * One change the apply callback rejected. The ID is still pending and will be offered again.
 * Two failures are equal when their IDs have the same bytes and they carry the same cause instance.
 *
 * @param id    ID of the pending change
 * @param cause exception thrown by the callback
 */
public record ItemFailure(byte[] id, Exception cause) {

    public ItemFailure {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(cause, "cause");
    }

    /** ID rendered for humans: text when printable, hex otherwise. */
    public String displayId() {
        return Ids.display(id);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ItemFailure other)) return false;
        return Arrays.equals(id, other.id) && cause == other.cause;
    }

    @Override public int hashCode() {
        return 31 * Arrays.hashCode(id) + System.identityHashCode(cause);
    }

    @Override public String toString() {
        return displayId() + ": " + cause;
    }
}
