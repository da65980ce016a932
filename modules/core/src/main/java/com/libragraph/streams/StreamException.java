package com.libragraph.streams;

/**
 * Base class for failures of active stream operations.
 */
public class StreamException extends RuntimeException {

    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamException(String message) {
        super(message);
    }
}
