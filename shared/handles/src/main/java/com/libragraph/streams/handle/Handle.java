package com.libragraph.streams.handle;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * An open resource: a memory buffer, a temp buffer, a file, a pipe or a compressed stream.
 *
 * Subclasses provide the raw primitives (doRead, doWrite, doSeek, ...); this class
 * enforces the open mode, tracks the end-of-resource flag and assembles metadata.
 *
 * Design principles:
 * - Mode checks happen here, once, for every backend
 * - Reads block until the requested length is available or the resource ends
 * - A read that hits the end sets eof; a seek clears it
 *
 * Not thread-safe: cursor and eof flag are plain mutable state.
 */
public abstract class Handle implements Closeable {

    private static final int CHUNK_SIZE = 8192;

    private final OpenMode mode;
    private final String uri;
    private final String wrapperType;
    private final String streamType;
    private boolean eof;
    private boolean closed;

    /**
     * @param uri locator of the resource (may be null)
     */
    protected Handle(OpenMode mode, String uri, String wrapperType, String streamType) {
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
        this.uri = uri;
        this.wrapperType = wrapperType;
        this.streamType = streamType;
    }

    public final OpenMode mode() {
        return mode;
    }

    /**
     * Locator of the resource: an absolute path for files, a {@code scheme://} name otherwise.
     * May be null.
     */
    public final String uri() {
        return uri;
    }

    public abstract boolean isSeekable();

    public boolean isOpen() {
        return !closed;
    }

    /**
     * Reads up to {@code length} bytes, blocking until that many are available or the
     * resource ends. Fewer bytes than requested means the end was reached.
     *
     * @throws IOException if the handle is closed, not readable, or the backend fails
     */
    public final byte[] read(int length) throws IOException {
        ensureOpen();
        if (!mode.isReadable()) {
            throw new IOException("Handle not opened for reading (mode '" + mode + "')");
        }
        if (length < 0) {
            throw new IllegalArgumentException("Negative length: " + length);
        }
        if (length == 0) {
            return new byte[0];
        }

        byte[] chunk = new byte[Math.min(length, CHUNK_SIZE)];
        ByteArrayOutputStream out = new ByteArrayOutputStream(chunk.length);
        int remaining = length;
        while (remaining > 0) {
            int n = doRead(chunk, 0, Math.min(remaining, chunk.length));
            if (n < 0) {
                eof = true;
                break;
            }
            if (n == 0) {
                break;
            }
            out.write(chunk, 0, n);
            remaining -= n;
        }
        return out.toByteArray();
    }

    /**
     * Reads everything from the cursor to the end of the resource.
     */
    public final byte[] readAll() throws IOException {
        ensureOpen();
        if (!mode.isReadable()) {
            throw new IOException("Handle not opened for reading (mode '" + mode + "')");
        }

        byte[] chunk = new byte[CHUNK_SIZE];
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int n;
        while ((n = doRead(chunk, 0, chunk.length)) > 0) {
            out.write(chunk, 0, n);
        }
        eof = true;
        return out.toByteArray();
    }

    /**
     * Writes all of {@code src}.
     *
     * @return number of bytes written
     */
    public final int write(byte[] src) throws IOException {
        Objects.requireNonNull(src, "src cannot be null");
        ensureOpen();
        if (!mode.isWritable()) {
            throw new IOException("Handle not opened for writing (mode '" + mode + "')");
        }
        if (src.length == 0) {
            return 0;
        }
        doWrite(src, 0, src.length);
        return src.length;
    }

    /**
     * Moves the cursor. Clears the eof flag.
     *
     * @throws IOException if the handle is not seekable or the target lies before the start
     */
    public final void seek(long offset, Whence whence) throws IOException {
        Objects.requireNonNull(whence, "whence cannot be null");
        ensureOpen();
        if (!isSeekable()) {
            throw new IOException("Handle is not seekable: " + uri);
        }

        long base = switch (whence) {
            case SET -> 0;
            case CURRENT -> doTell();
            case END -> doStat().orElseThrow(() -> new IOException("Size unknown, cannot seek from end"));
        };
        long target = base + offset;
        if (target < 0) {
            throw new IOException("Negative position: " + target);
        }
        doSeek(target);
        eof = false;
    }

    public final long tell() throws IOException {
        ensureOpen();
        return doTell();
    }

    /**
     * Whether the last read reached the end of the resource.
     */
    public final boolean eof() {
        return eof;
    }

    /**
     * Current size of the resource, or empty when the backend cannot tell (pipes,
     * compressed streams).
     */
    public final OptionalLong stat() throws IOException {
        ensureOpen();
        return doStat();
    }

    /**
     * Descriptive metadata. Empty once closed.
     */
    public Map<String, Object> metadata() {
        if (closed) {
            return Map.of();
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("timed_out", false);
        meta.put("blocked", true);
        meta.put("eof", eof);
        meta.put("wrapper_type", wrapperType);
        meta.put("stream_type", streamType);
        meta.put("mode", mode.mode());
        meta.put("unread_bytes", 0);
        meta.put("seekable", isSeekable());
        if (uri != null) {
            meta.put("uri", uri);
        }
        return Collections.unmodifiableMap(meta);
    }

    /**
     * Opens an InputStream reading from the current cursor.
     * Closing it closes this handle.
     */
    public InputStream inputStream() {
        return new InputStream() {
            @Override
            public int read() throws IOException {
                byte[] one = Handle.this.read(1);
                return one.length == 0 ? -1 : one[0] & 0xFF;
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                Objects.checkFromIndexSize(off, len, b.length);
                if (len == 0) {
                    return 0;
                }
                ensureOpen();
                int n = doRead(b, off, len);
                if (n < 0) {
                    eof = true;
                }
                return n;
            }

            @Override
            public void close() throws IOException {
                Handle.this.close();
            }
        };
    }

    /**
     * Opens an OutputStream writing at the current cursor.
     * Closing it closes this handle.
     */
    public OutputStream outputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                Handle.this.write(new byte[]{(byte) b});
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                Objects.checkFromIndexSize(off, len, b.length);
                if (len == 0) {
                    return;
                }
                ensureOpen();
                if (!mode.isWritable()) {
                    throw new IOException("Handle not opened for writing (mode '" + mode + "')");
                }
                doWrite(b, off, len);
            }

            @Override
            public void close() throws IOException {
                Handle.this.close();
            }
        };
    }

    @Override
    public final void close() throws IOException {
        if (!closed) {
            closed = true;
            doClose();
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + uri + ", mode=" + mode + (closed ? ", closed" : "") + "]";
    }

    /**
     * Reads at most {@code len} bytes into {@code dst}.
     *
     * @return bytes read, or -1 at end of resource
     */
    protected abstract int doRead(byte[] dst, int off, int len) throws IOException;

    /**
     * Writes exactly {@code len} bytes from {@code src}.
     */
    protected abstract void doWrite(byte[] src, int off, int len) throws IOException;

    /**
     * Moves the cursor to an absolute, non-negative position.
     */
    protected abstract void doSeek(long position) throws IOException;

    protected abstract long doTell() throws IOException;

    protected abstract OptionalLong doStat() throws IOException;

    protected abstract void doClose() throws IOException;

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Handle is closed: " + uri);
        }
    }
}
