package io.difflite.diff;

import java.util.HexFormat;

/**
 * A pending change points at a payload that does not exist.
 * <p>
 * This means the differential's tables are corrupted, not that an ordinary
 * operation failed: it is never folded into an {@link ApplyResult}, and the
 * apply pass that hit it is rolled back.
 */
public class InconsistentStateException extends IllegalStateException {

    public InconsistentStateException(String namespace, byte[] id, byte[] hash) {
        super("missing payload for pending change (differential=" + namespace
                + ", id=" + Ids.display(id) + ", hash=" + HexFormat.of().formatHex(hash) + ")");
    }
}
