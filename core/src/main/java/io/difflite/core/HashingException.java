package io.difflite.core;

/**
 * Raised when a value contains structure the hasher cannot digest,
 * for example a reference cycle or a type with no serializable properties.
 */
public class HashingException extends RuntimeException {

    public HashingException(String message) {
        super(message);
    }

    public HashingException(String message, Throwable cause) {
        super(message, cause);
    }
}
