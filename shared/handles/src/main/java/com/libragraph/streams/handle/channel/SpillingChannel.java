package com.libragraph.streams.handle.channel;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Channel that keeps data in RAM until it would grow past {@code maxMemory} bytes,
 * then moves everything to a {@link TempFileChannel} and continues there.
 *
 * <p>Content and cursor are carried over on the switch; callers never see it.
 */
public class SpillingChannel implements SeekableByteChannel {

    private final long maxMemory;
    private SeekableByteChannel delegate;
    private boolean spilled;

    public SpillingChannel(long maxMemory) {
        if (maxMemory < 0) {
            throw new IllegalArgumentException("maxMemory must be >= 0, got: " + maxMemory);
        }
        this.maxMemory = maxMemory;
        this.delegate = new ByteArrayChannel((int) Math.min(maxMemory, 4096));
    }

    /** Whether the data now lives in a temp file. */
    public boolean isSpilled() {
        return spilled;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return delegate.read(dst);
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        if (!spilled && delegate.position() + src.remaining() > maxMemory) {
            spill();
        }
        return delegate.write(src);
    }

    @Override
    public long position() throws IOException {
        return delegate.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        delegate.position(newPosition);
        return this;
    }

    @Override
    public long size() throws IOException {
        return delegate.size();
    }

    @Override
    public SeekableByteChannel truncate(long size) throws IOException {
        delegate.truncate(size);
        return this;
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }

    private void spill() throws IOException {
        ByteArrayChannel ram = (ByteArrayChannel) delegate;
        long cursor = ram.position();

        TempFileChannel file = new TempFileChannel();
        try {
            ByteBuffer content = ByteBuffer.wrap(ram.toByteArray());
            while (content.hasRemaining()) {
                file.write(content);
            }
            file.position(cursor);
        } catch (IOException e) {
            file.close();
            throw e;
        }

        ram.close();
        delegate = file;
        spilled = true;
    }
}
