package io.difflite.diff;

import io.difflite.core.Decoder;

/**
 * Called once per pending change during {@link Differential#eachN}.
 * Returning normally marks the change as applied; throwing leaves it pending for a later retry.
 */
@FunctionalInterface
public interface ApplyFunc {

    void apply(byte[] id, Decoder data) throws Exception;
}
