package io.difflite.diff;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared between a caller and a running stage or apply loop.
 * <p>
 * Loops check the token between items only; an item already being processed
 * always completes. A stream stage waiting for input checks it every
 * 50 ms. Cancelling is one-way and idempotent.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicReference<String> reason = new AtomicReference<>();

    /** A token that is never cancelled. Calling {@link #cancel()} on it is an error. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        cancel("cancelled");
    }

    /** Cancel with {@code reason}; only the first reason is kept. */
    public void cancel(String reason) {
        if (this == NONE) throw new UnsupportedOperationException("the shared none() token cannot be cancelled");
        this.reason.compareAndSet(null, reason == null ? "cancelled" : reason);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    CancellationException toException() {
        String r = reason.get();
        return new CancellationException(r == null ? "cancelled" : r);
    }
}
