package io.difflite.core;

/** Encoding a value to payload bytes, or decoding it back, failed. */
public class CodecException extends RuntimeException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
