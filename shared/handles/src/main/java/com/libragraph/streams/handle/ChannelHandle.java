package com.libragraph.streams.handle;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.NonReadableChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Seekable handle over any {@link SeekableByteChannel}: memory and temp buffers,
 * files, or a caller-supplied channel.
 */
public class ChannelHandle extends Handle {

    private final SeekableByteChannel channel;

    public ChannelHandle(SeekableByteChannel channel, OpenMode mode, String uri,
                         String wrapperType, String streamType) {
        super(mode, uri, wrapperType, streamType);
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
    }

    /** The wrapped channel. */
    public SeekableByteChannel channel() {
        return channel;
    }

    @Override
    public boolean isSeekable() {
        return true;
    }

    @Override
    public boolean isOpen() {
        return super.isOpen() && channel.isOpen();
    }

    @Override
    protected int doRead(byte[] dst, int off, int len) throws IOException {
        try {
            return channel.read(ByteBuffer.wrap(dst, off, len));
        } catch (NonReadableChannelException e) {
            throw new IOException("Channel is not readable: " + uri(), e);
        }
    }

    @Override
    protected void doWrite(byte[] src, int off, int len) throws IOException {
        try {
            if (mode().isAppend()) {
                channel.position(channel.size());
            }
            ByteBuffer buf = ByteBuffer.wrap(src, off, len);
            while (buf.hasRemaining()) {
                channel.write(buf);
            }
        } catch (NonWritableChannelException e) {
            throw new IOException("Channel is not writable: " + uri(), e);
        }
    }

    @Override
    protected void doSeek(long position) throws IOException {
        channel.position(position);
    }

    @Override
    protected long doTell() throws IOException {
        return channel.position();
    }

    @Override
    protected OptionalLong doStat() throws IOException {
        return OptionalLong.of(channel.size());
    }

    @Override
    protected void doClose() throws IOException {
        channel.close();
    }
}
