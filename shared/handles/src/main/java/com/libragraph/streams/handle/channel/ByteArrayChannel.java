package com.libragraph.streams.handle.channel;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;

/**
 * SeekableByteChannel over a growable heap byte array.
 *
 * Positioning past the end is allowed; a later write zero-fills the gap.
 */
public class ByteArrayChannel implements SeekableByteChannel {
    private byte[] data;
    private long position;
    private long size;  // Logical size (may be less than data.length)
    private boolean open = true;

    /**
     * Creates empty channel with initial capacity.
     */
    public ByteArrayChannel(int initialCapacity) {
        this.data = new byte[initialCapacity];
    }

    /**
     * Creates channel holding a copy of {@code content}, positioned at the start.
     */
    public ByteArrayChannel(byte[] content) {
        this.data = Arrays.copyOf(content, content.length);
        this.size = content.length;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        ensureOpen();
        if (position >= size) {
            return -1;  // EOF
        }

        int remaining = (int) (size - position);
        int toRead = Math.min(remaining, dst.remaining());
        dst.put(data, (int) position, toRead);
        position += toRead;
        return toRead;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        ensureOpen();
        int toWrite = src.remaining();
        long endPosition = position + toWrite;
        if (endPosition > Integer.MAX_VALUE) {
            throw new IOException("Byte array channel cannot exceed " + Integer.MAX_VALUE + " bytes");
        }

        if (endPosition > data.length) {
            grow(endPosition);
        }
        if (position > size) {
            // Gap left by seeking past the end; may hold stale bytes after truncate
            Arrays.fill(data, (int) size, (int) position, (byte) 0);
        }

        src.get(data, (int) position, toWrite);
        position = endPosition;

        if (position > size) {
            size = position;
        }
        return toWrite;
    }

    @Override
    public long position() throws IOException {
        ensureOpen();
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        ensureOpen();
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        this.position = newPosition;
        return this;
    }

    @Override
    public long size() throws IOException {
        ensureOpen();
        return size;
    }

    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        ensureOpen();
        if (newSize < 0) {
            throw new IllegalArgumentException("Negative size: " + newSize);
        }
        if (newSize < size) {
            size = newSize;
        }
        if (position > newSize) {
            position = newSize;
        }
        return this;
    }

    /**
     * Copy of the logical content.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(data, (int) size);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }

    /**
     * Grows the internal array to accommodate the requested size.
     * Doubles capacity each time to amortize growth cost.
     */
    private void grow(long minCapacity) {
        long newCapacity = Math.max(data.length * 2L, minCapacity);
        if (newCapacity > Integer.MAX_VALUE) {
            newCapacity = Integer.MAX_VALUE;
        }
        data = Arrays.copyOf(data, (int) newCapacity);
    }

    private void ensureOpen() throws ClosedChannelException {
        if (!open) {
            throw new ClosedChannelException();
        }
    }
}
