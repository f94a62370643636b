package io.difflite.diff;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/** Human-readable rendering of opaque IDs for logs and messages. */
final class Ids {

    private Ids() {
        // utility
    }

    /** Printable ASCII IDs render as text, anything else as 0x-prefixed hex. */
    static String display(byte[] id) {
        if (id == null) return "null";
        for (byte b : id) {
            if (b < 0x20 || b > 0x7E) {
                return "0x" + HexFormat.of().formatHex(id);
            }
        }
        return new String(id, StandardCharsets.US_ASCII);
    }
}
