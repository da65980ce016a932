package com.libragraph.streams;

/**
 * Thrown by active I/O on a stream that was closed or detached.
 */
public class StreamDetachedException extends StreamException {

    public StreamDetachedException() {
        super("Stream is detached");
    }
}
