package com.flyknight.protocol;

/**
 * Thrown when bytes cannot be turned into a {@link Message} (or back).
 *
 * Per-message failure: the offending frame is dropped, the connection it
 * arrived on stays up.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
