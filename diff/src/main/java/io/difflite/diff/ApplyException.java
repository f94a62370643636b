package io.difflite.diff;

import java.util.stream.Collectors;

/**
 * Aggregated apply failure: every rejected ID plus the cancellation, if any.
 * Each callback exception is attached as a suppressed exception.
 */
public class ApplyException extends RuntimeException {

    private final ApplyResult result;

    public ApplyException(ApplyResult result) {
        super(describe(result));
        this.result = result;
        for (ItemFailure f : result.failures()) {
            addSuppressed(f.cause());
        }
    }

    public ApplyResult result() {
        return result;
    }

    private static String describe(ApplyResult r) {
        StringBuilder sb = new StringBuilder();
        if (!r.failures().isEmpty()) {
            sb.append(r.failures().size()).append(" change(s) failed to apply: ")
              .append(r.failures().stream().map(ItemFailure::toString).collect(Collectors.joining("; ")));
        }
        if (r.cancelled()) {
            if (sb.length() > 0) sb.append("; ");
            sb.append("apply cancelled after ").append(r.promoted()).append(" promotion(s)");
        }
        return sb.toString();
    }
}
