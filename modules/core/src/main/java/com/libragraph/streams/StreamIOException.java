package com.libragraph.streams;

/**
 * The underlying handle could not perform a read, write, seek or position query,
 * or the stream lacks the capability for it.
 */
public class StreamIOException extends StreamException {

    public StreamIOException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamIOException(String message) {
        super(message);
    }
}
