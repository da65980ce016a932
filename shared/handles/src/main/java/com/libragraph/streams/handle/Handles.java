package com.libragraph.streams.handle;

import com.libragraph.streams.handle.CompressedHandle.Compression;
import com.libragraph.streams.handle.channel.ByteArrayChannel;
import com.libragraph.streams.handle.channel.SpillingChannel;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Factory for opening handles, in the spirit of fopen.
 *
 * <ul>
 *   <li>{@code stream://memory}: heap buffer ({@link ByteArrayChannel})</li>
 *   <li>{@code stream://temp}: heap buffer spilling to a temp file past 2 MB ({@link SpillingChannel});
 *       {@code stream://temp/maxmemory:<bytes>} sets the threshold</li>
 *   <li>{@code file:///abs/path} or a plain path: {@link FileHandle}</li>
 * </ul>
 */
public final class Handles {

    public static final String MEMORY_URI = "stream://memory";
    public static final String TEMP_URI = "stream://temp";

    /** Default RAM threshold for temp handles. */
    public static final long DEFAULT_MAX_MEMORY = 2L * 1024 * 1024; // 2 MB

    private static final String MAX_MEMORY_PREFIX = TEMP_URI + "/maxmemory:";

    private Handles() {
    }

    public static ChannelHandle memory(String mode) {
        return new ChannelHandle(new ByteArrayChannel(1024), OpenMode.of(mode), MEMORY_URI, "stream", "MEMORY");
    }

    /**
     * Memory handle pre-filled with {@code content}, cursor at the start.
     */
    public static ChannelHandle memory(byte[] content, String mode) {
        Objects.requireNonNull(content, "content cannot be null");
        return new ChannelHandle(new ByteArrayChannel(content), OpenMode.of(mode), MEMORY_URI, "stream", "MEMORY");
    }

    public static ChannelHandle temp(String mode) {
        return temp(mode, DEFAULT_MAX_MEMORY);
    }

    public static ChannelHandle temp(String mode, long maxMemory) {
        return new ChannelHandle(new SpillingChannel(maxMemory), OpenMode.of(mode), TEMP_URI, "stream", "TEMP");
    }

    public static FileHandle file(Path path, String mode) throws IOException {
        return FileHandle.open(path, OpenMode.of(mode));
    }

    /**
     * Wraps a caller-supplied channel. The handle owns the channel from now on.
     */
    public static ChannelHandle channel(SeekableByteChannel channel, String mode, String uri) {
        return new ChannelHandle(channel, OpenMode.of(mode), uri, "channel", "CHANNEL");
    }

    public static PipeHandle input(InputStream in) {
        return PipeHandle.input(in, PipeHandle.INPUT_URI);
    }

    public static PipeHandle output(OutputStream out) {
        return PipeHandle.output(out, PipeHandle.OUTPUT_URI);
    }

    public static CompressedHandle gzip(Path path, String mode) throws IOException {
        return CompressedHandle.open(path, OpenMode.of(mode), Compression.GZIP);
    }

    public static CompressedHandle gzip(Handle inner, String mode) throws IOException {
        return CompressedHandle.wrap(inner, OpenMode.of(mode), Compression.GZIP);
    }

    public static CompressedHandle bzip2(Path path, String mode) throws IOException {
        return CompressedHandle.open(path, OpenMode.of(mode), Compression.BZIP2);
    }

    public static CompressedHandle bzip2(Handle inner, String mode) throws IOException {
        return CompressedHandle.wrap(inner, OpenMode.of(mode), Compression.BZIP2);
    }

    /**
     * Opens a handle from a locator string.
     *
     * @throws IllegalArgumentException for an unknown scheme or malformed locator
     * @throws IOException if a file cannot be opened in the given mode
     */
    public static Handle open(String locator, String mode) throws IOException {
        Objects.requireNonNull(locator, "locator cannot be null");
        if (locator.equals(MEMORY_URI)) {
            return memory(mode);
        }
        if (locator.equals(TEMP_URI)) {
            return temp(mode);
        }
        if (locator.startsWith(MAX_MEMORY_PREFIX)) {
            String value = locator.substring(MAX_MEMORY_PREFIX.length());
            try {
                return temp(mode, Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid maxmemory in locator: " + locator, e);
            }
        }
        if (locator.startsWith("file://")) {
            return file(Path.of(URI.create(locator)), mode);
        }
        if (locator.contains("://")) {
            throw new IllegalArgumentException("Unsupported locator: " + locator);
        }
        return file(Path.of(locator), mode);
    }

    /**
     * Whether {@code uri} names a file in the local filesystem (a plain path or a
     * {@code file://} URI) rather than a memory buffer, pipe or wrapper.
     */
    public static boolean isLocalPath(String uri) {
        if (uri == null || uri.isEmpty()) {
            return false;
        }
        return uri.startsWith("file://") || !uri.contains("://");
    }

    /**
     * Resolves a local-path uri to a {@link Path}.
     *
     * @throws IllegalArgumentException if {@code uri} is not a local path
     */
    public static Path toPath(String uri) {
        if (!isLocalPath(uri)) {
            throw new IllegalArgumentException("Not a local path: " + uri);
        }
        return uri.startsWith("file://") ? Path.of(URI.create(uri)) : Path.of(uri);
    }
}
