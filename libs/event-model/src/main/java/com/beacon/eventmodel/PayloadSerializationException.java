package com.beacon.eventmodel;

/**
 * Raised when a caller-supplied payload cannot be converted into a {@link CanonicalValue}:
 * a non-serializable typed value, a malformed untyped map, or a value that is not an object where
 * an object is required.
 */
public class PayloadSerializationException extends RuntimeException {

    public PayloadSerializationException(String message) {
        super(message);
    }

    public PayloadSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
