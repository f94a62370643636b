package io.difflite.diff;

import java.util.List;

/**
 * Outcome of one apply pass.
 *
 * @param promoted  changes applied and moved to the committed table
 * @param failures  changes the callback rejected, in key order; they remain pending
 * @param cancelled true if the pass stopped early because its token was cancelled;
 *                  changes not reached remain pending
 */
public record ApplyResult(int promoted, List<ItemFailure> failures, boolean cancelled) {

    public ApplyResult {
        failures = List.copyOf(failures);
    }

    /** No callback failures and not cancelled. */
    public boolean isSuccess() {
        return failures.isEmpty() && !cancelled;
    }

    /** IDs to retry. */
    public List<byte[]> failedIds() {
        return failures.stream().map(ItemFailure::id).toList();
    }

    /** @throws ApplyException carrying this result, unless {@link #isSuccess()} */
    public ApplyResult throwIfFailed() {
        if (!isSuccess()) throw new ApplyException(this);
        return this;
    }
}
