package com.libragraph.streams;

import com.libragraph.streams.handle.Handle;
import com.libragraph.streams.handle.Handles;
import com.libragraph.streams.handle.Whence;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.lang.ref.Cleaner;
import java.lang.ref.Reference;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Capability-aware wrapper owning exactly one {@link Handle}.
 *
 * <p>Readability and writability are snapshots of the handle's open mode, and
 * seekability of the handle's own report, all taken once at construction.
 * The size is cached after the first query and advanced by writes through this
 * stream; path-backed resources are re-stat'ed on every query since the file may
 * change underneath the handle.
 *
 * <p>Once closed or detached the stream is inert: capability flags are false,
 * {@link #getSize()} and {@link #getMetadata()} report nothing, and every active
 * I/O call throws {@link StreamDetachedException}. A stream that becomes unreachable
 * while still owning its handle closes it.
 *
 * <p>Not thread-safe.
 */
public class Stream implements AutoCloseable {

    private static final Logger log = Logger.getLogger(Stream.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final Owner owner;
    private final Cleaner.Cleanable cleanable;
    private final Map<String, Object> customMetadata;
    private Long size;
    private String uri;
    private boolean seekable;
    private boolean readable;
    private boolean writable;

    public Stream(Handle handle) {
        this(handle, StreamOptions.defaults());
    }

    /**
     * @throws IllegalArgumentException if {@code handle} is null or already closed
     */
    public Stream(Handle handle, StreamOptions options) {
        if (handle == null || !handle.isOpen()) {
            throw new IllegalArgumentException("Stream must wrap an open handle, got: " + handle);
        }
        Objects.requireNonNull(options, "options cannot be null");

        this.owner = new Owner(handle);
        this.customMetadata = options.metadata();
        this.size = options.size();
        this.seekable = handle.isSeekable();
        this.readable = handle.mode().isReadable();
        this.writable = handle.mode().isWritable();
        this.uri = handle.uri();
        this.cleanable = CLEANER.register(this, owner);
    }

    public boolean isReadable() {
        return readable;
    }

    public boolean isWritable() {
        return writable;
    }

    public boolean isSeekable() {
        return seekable;
    }

    /**
     * Reads up to {@code length} bytes. Fewer bytes means the end was reached.
     *
     * @throws IllegalArgumentException if {@code length} is negative
     * @throws StreamDetachedException  if the stream was closed or detached
     * @throws StreamIOException        if the stream is not readable or the read fails
     */
    public byte[] read(int length) {
        Handle handle = requireHandle();
        if (!readable) {
            throw new StreamIOException("Cannot read from non-readable stream");
        }
        if (length < 0) {
            throw new IllegalArgumentException("Length parameter cannot be negative");
        }
        if (length == 0) {
            return new byte[0];
        }

        try {
            return handle.read(length);
        } catch (IOException e) {
            throw new StreamIOException("Unable to read from stream", e);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Writes all of {@code bytes} at the cursor. A known size grows by the count written.
     *
     * @return number of bytes written
     */
    public int write(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Handle handle = requireHandle();
        if (!writable) {
            throw new StreamIOException("Cannot write to a non-writable stream");
        }

        int written;
        try {
            written = handle.write(bytes);
        } catch (IOException e) {
            throw new StreamIOException("Unable to write to stream", e);
        } finally {
            Reference.reachabilityFence(this);
        }
        // Additive model: overwrites before the end still grow the cached size
        if (size != null) {
            size += written;
        }
        return written;
    }

    /**
     * Writes {@code text} encoded with the configured charset.
     */
    public int write(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return write(text.getBytes(StreamConfig.current().textCharset()));
    }

    public void seek(long offset) {
        seek(offset, Whence.SET);
    }

    public void seek(long offset, Whence whence) {
        Handle handle = requireHandle();
        if (!seekable) {
            throw new StreamIOException("Stream is not seekable");
        }
        try {
            handle.seek(offset, whence);
        } catch (IOException e) {
            throw new StreamIOException("Unable to seek to stream position " + offset + " with whence " + whence, e);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    public void rewind() {
        seek(0);
    }

    public long tell() {
        Handle handle = requireHandle();
        try {
            return handle.tell();
        } catch (IOException e) {
            throw new StreamIOException("Unable to determine stream position", e);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Whether the last read reached the end. Reading exactly the remaining bytes does
     * not count; one more read attempt does.
     */
    public boolean eof() {
        try {
            return requireHandle().eof();
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Size in bytes, or empty when unknown. Never throws.
     */
    public OptionalLong getSize() {
        Handle handle = owner.handle;
        if (handle == null) {
            return OptionalLong.empty();
        }
        boolean pathBacked = Handles.isLocalPath(uri);
        if (size != null && !pathBacked) {
            return OptionalLong.of(size);
        }

        try {
            OptionalLong stat = pathBacked
                    ? OptionalLong.of(Files.size(Handles.toPath(uri)))
                    : handle.stat();
            if (stat.isPresent()) {
                size = stat.getAsLong();
            }
            return stat;
        } catch (IOException | InvalidPathException e) {
            log.debugf(e, "Unable to stat %s", uri);
            return OptionalLong.empty();
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * All metadata of the handle, with custom entries from {@link StreamOptions}
     * taking precedence. Empty once closed or detached.
     */
    public Map<String, Object> getMetadata() {
        Handle handle = owner.handle;
        if (handle == null) {
            return Map.of();
        }
        try {
            Map<String, Object> meta = new LinkedHashMap<>(handle.metadata());
            meta.putAll(customMetadata);
            return meta;
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * One metadata entry, or empty if the key is unknown or the stream is inert.
     */
    public Optional<Object> getMetadata(String key) {
        Handle handle = owner.handle;
        if (handle == null) {
            return Optional.empty();
        }
        if (customMetadata.containsKey(key)) {
            return Optional.of(customMetadata.get(key));
        }
        try {
            return Optional.ofNullable(handle.metadata().get(key));
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Reads from the cursor to the end.
     *
     * @throws StreamDetachedException if the stream was closed or detached
     * @throws StreamIOException       if the stream is not readable or the read fails
     */
    public byte[] getContents() {
        Handle handle = requireHandle();
        if (!readable) {
            throw new StreamIOException("Cannot read from non-readable stream");
        }
        try {
            return handle.readAll();
        } catch (IOException e) {
            throw new StreamIOException("Unable to read stream contents", e);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Closes the handle if still owned. Idempotent; a failing handle close is logged.
     */
    @Override
    public void close() {
        owner.explicit = true;
        cleanable.clean();
        reset();
    }

    /**
     * Hands the handle to the caller without closing it. This stream becomes inert.
     *
     * @return the handle, or empty if already closed or detached
     */
    public Optional<Handle> detach() {
        Handle handle = owner.handle;
        if (handle == null) {
            return Optional.empty();
        }
        owner.handle = null;
        cleanable.clean();
        reset();
        return Optional.of(handle);
    }

    /**
     * Full contents as text, read from the start when seekable and from the cursor
     * otherwise.
     *
     * <p>Never throws: on any failure the error is logged and "" is returned.
     */
    @Override
    public String toString() {
        try {
            if (isSeekable()) {
                seek(0);
            }
            return new String(getContents(), StreamConfig.current().textCharset());
        } catch (RuntimeException e) {
            log.errorf(e, "%s::toString exception: %s", Stream.class.getName(), e.getMessage());
            return "";
        }
    }

    private Handle requireHandle() {
        Handle handle = owner.handle;
        if (handle == null) {
            throw new StreamDetachedException();
        }
        return handle;
    }

    private void reset() {
        size = null;
        uri = null;
        readable = false;
        writable = false;
        seekable = false;
    }

    /**
     * Holds the handle apart from the Stream so the cleaner can release it once the
     * Stream is unreachable.
     */
    private static final class Owner implements Runnable {
        private Handle handle;
        private boolean explicit;

        Owner(Handle handle) {
            this.handle = handle;
        }

        @Override
        public void run() {
            Handle owned = handle;
            if (owned == null) {
                return;
            }
            handle = null;
            if (!explicit) {
                log.debugf("Releasing unclosed stream %s", owned);
            }
            try {
                owned.close();
            } catch (IOException e) {
                log.warnf(e, "Failed to close %s", owned);
            }
        }
    }
}
