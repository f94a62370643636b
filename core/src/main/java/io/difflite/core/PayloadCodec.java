package io.difflite.core;

/**
 * Binary codec for staged payloads.
 * <p>
 * encode(): object -> bytes stored alongside its pending hash.
 * decoder(): bytes -> lazily decodable view handed to apply callbacks.
 */
public interface PayloadCodec {

    byte[] encode(Object value);

    Decoder decoder(byte[] data);
}
