package io.difflite.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Typed view over an encoded payload.
 * <p>
 * Decoding is deferred until the caller asks for a concrete shape, so a callback
 * can bind the same payload to its own view type (unknown properties are ignored).
 * All methods fail with {@link CodecException} if the bytes cannot be bound.
 */
public interface Decoder {

    <T> T decode(Class<T> type);

    <T> T decode(TypeReference<T> type);

    /** Untyped tree view of the payload. */
    JsonNode tree();

    /** Copy of the raw encoded bytes. */
    byte[] bytes();
}
