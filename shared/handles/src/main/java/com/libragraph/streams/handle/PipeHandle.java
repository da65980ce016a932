package com.libragraph.streams.handle;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.OptionalLong;

/**
 * Sequential handle over an {@link InputStream} (read side) or an {@link OutputStream}
 * (write side). Never seekable; {@link #tell()} counts bytes consumed or produced and
 * the size is unknown.
 */
public class PipeHandle extends Handle {

    public static final String INPUT_URI = "pipe://input";
    public static final String OUTPUT_URI = "pipe://output";

    private final InputStream in;
    private final OutputStream out;
    private long position;

    protected PipeHandle(InputStream in, OutputStream out, OpenMode mode, String uri,
                         String wrapperType, String streamType) {
        super(mode, uri, wrapperType, streamType);
        this.in = in;
        this.out = out;
    }

    /**
     * Read-only pipe (mode {@code r}).
     */
    public static PipeHandle input(InputStream in, String uri) {
        if (in == null) {
            throw new IllegalArgumentException("input stream cannot be null");
        }
        return new PipeHandle(in, null, OpenMode.of("r"), uri, "pipe", "INPUT");
    }

    /**
     * Write-only pipe (mode {@code w}).
     */
    public static PipeHandle output(OutputStream out, String uri) {
        if (out == null) {
            throw new IllegalArgumentException("output stream cannot be null");
        }
        return new PipeHandle(null, out, OpenMode.of("w"), uri, "pipe", "OUTPUT");
    }

    @Override
    public boolean isSeekable() {
        return false;
    }

    /**
     * Source of bytes; subclasses may create it lazily.
     */
    protected InputStream input() throws IOException {
        if (in == null) {
            throw new IOException("Pipe has no read side: " + uri());
        }
        return in;
    }

    /**
     * Sink for bytes.
     */
    protected OutputStream output() throws IOException {
        if (out == null) {
            throw new IOException("Pipe has no write side: " + uri());
        }
        return out;
    }

    /** Whether every write is flushed through to the sink. */
    protected boolean flushOnWrite() {
        return true;
    }

    @Override
    protected int doRead(byte[] dst, int off, int len) throws IOException {
        int n = input().read(dst, off, len);
        if (n > 0) {
            position += n;
        }
        return n;
    }

    @Override
    protected void doWrite(byte[] src, int off, int len) throws IOException {
        OutputStream sink = output();
        sink.write(src, off, len);
        if (flushOnWrite()) {
            sink.flush();
        }
        position += len;
    }

    @Override
    protected void doSeek(long position) throws IOException {
        throw new IOException("Pipe is not seekable: " + uri());
    }

    @Override
    protected long doTell() {
        return position;
    }

    @Override
    protected OptionalLong doStat() {
        return OptionalLong.empty();
    }

    @Override
    protected void doClose() throws IOException {
        try {
            if (out != null) {
                out.close();
            }
        } finally {
            if (in != null) {
                in.close();
            }
        }
    }
}
