package com.libragraph.streams;

import com.libragraph.streams.handle.Handle;
import com.libragraph.streams.handle.Handles;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.Blake3;
import org.apache.commons.codec.digest.DigestUtils;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * Helpers for creating streams and moving bytes between them.
 */
public final class Streams {

    private static final Logger log = Logger.getLogger(Streams.class);

    /** Algorithm name accepted by {@link #hash} next to any JCA digest. */
    public static final String BLAKE3 = "blake3";

    private static final int BLAKE3_LENGTH = 32;

    private Streams() {
    }

    /**
     * Creates a stream for a supported resource:
     * <ul>
     *   <li>{@link Stream}: returned as-is</li>
     *   <li>{@link Handle}: wrapped</li>
     *   <li>{@code byte[]} / {@link String}: temp stream holding the content, cursor at 0</li>
     *   <li>{@code null}: empty temp stream</li>
     *   <li>{@link InputStream} / {@link OutputStream}: read / write pipe</li>
     *   <li>{@link SeekableByteChannel}: seekable {@code r+} stream over the channel</li>
     * </ul>
     *
     * @throws IllegalArgumentException for any other type
     */
    public static Stream streamFor(Object resource) {
        if (resource == null) {
            return temp();
        }
        if (resource instanceof Stream stream) {
            return stream;
        }
        if (resource instanceof Handle handle) {
            return new Stream(handle);
        }
        if (resource instanceof byte[] bytes) {
            return temp(bytes);
        }
        if (resource instanceof String text) {
            return temp(text.getBytes(StreamConfig.current().textCharset()));
        }
        if (resource instanceof InputStream in) {
            return new Stream(Handles.input(in));
        }
        if (resource instanceof OutputStream out) {
            return new Stream(Handles.output(out));
        }
        if (resource instanceof SeekableByteChannel channel) {
            return new Stream(Handles.channel(channel, "r+", null));
        }
        throw new IllegalArgumentException("Invalid resource type: " + resource.getClass().getName());
    }

    /**
     * Empty read/write temp stream honoring {@link StreamConfig#tempMaxMemory()}.
     */
    public static Stream temp() {
        return new Stream(Handles.temp("r+", StreamConfig.current().tempMaxMemory()));
    }

    /**
     * Temp stream holding {@code content}, cursor at the start.
     */
    public static Stream temp(byte[] content) {
        Objects.requireNonNull(content, "content cannot be null");
        Stream stream = temp();
        stream.write(content);
        stream.rewind();
        return stream;
    }

    /**
     * Opens a file stream.
     *
     * @throws StreamIOException if the file cannot be opened in {@code mode}
     */
    public static Stream tryOpen(Path path, String mode) {
        try {
            return new Stream(Handles.file(path, mode));
        } catch (IOException e) {
            throw new StreamIOException(String.format("Unable to open \"%s\" using mode \"%s\"", path, mode), e);
        }
    }

    /**
     * Reads up to {@code maxLength} bytes from the cursor, or everything when
     * {@code maxLength} is -1.
     */
    public static byte[] copyToBytes(Stream stream, long maxLength) {
        int chunkSize = StreamConfig.current().copyChunkSize();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        long copied = 0;
        while (!stream.eof() && (maxLength == -1 || copied < maxLength)) {
            int want = maxLength == -1 ? chunkSize : (int) Math.min(chunkSize, maxLength - copied);
            byte[] chunk = stream.read(want);
            if (chunk.length == 0) {
                break;
            }
            buffer.writeBytes(chunk);
            copied += chunk.length;
        }
        return buffer.toByteArray();
    }

    /**
     * Copies up to {@code maxLength} bytes (-1 for all) from {@code source} to
     * {@code dest}, each at its own cursor.
     *
     * @return number of bytes copied
     */
    public static long copyToStream(Stream source, Stream dest, long maxLength) {
        int chunkSize = StreamConfig.current().copyChunkSize();
        long copied = 0;
        while (!source.eof() && (maxLength == -1 || copied < maxLength)) {
            int want = maxLength == -1 ? chunkSize : (int) Math.min(chunkSize, maxLength - copied);
            byte[] chunk = source.read(want);
            if (chunk.length == 0) {
                break;
            }
            dest.write(chunk);
            copied += chunk.length;
        }
        log.debugf("Copied %d bytes", copied);
        return copied;
    }

    /**
     * Reads one line including its trailing {@code \n}, stopping early after
     * {@code maxLength - 1} bytes (-1 for no limit) or at the end of the stream.
     */
    public static String readLine(Stream stream, int maxLength) {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int count = 0;
        while (!stream.eof()) {
            byte[] one = stream.read(1);
            if (one.length == 0) {
                break;
            }
            line.write(one[0]);
            if (one[0] == '\n' || ++count == maxLength - 1) {
                break;
            }
        }
        return line.toString(StreamConfig.current().textCharset());
    }

    /**
     * Lowercase hex digest of the entire stream. The cursor is restored afterwards.
     * A sequential stream cannot rewind, so it is hashed from its cursor to the end.
     *
     * @param algorithm {@value #BLAKE3} or any {@link MessageDigest} algorithm name
     * @throws IllegalArgumentException if the algorithm is unknown
     */
    public static String hash(Stream stream, String algorithm) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        int chunkSize = StreamConfig.current().copyChunkSize();
        boolean seekable = stream.isSeekable();
        long position = stream.tell();
        if (seekable && position > 0) {
            stream.rewind();
        }

        String hex;
        if (BLAKE3.equalsIgnoreCase(algorithm)) {
            Blake3 hasher = Blake3.initHash();
            for (byte[] chunk = stream.read(chunkSize); chunk.length > 0; chunk = stream.read(chunkSize)) {
                hasher.update(chunk);
            }
            hex = Hex.encodeHexString(hasher.doFinalize(BLAKE3_LENGTH));
        } else {
            MessageDigest digest = DigestUtils.getDigest(algorithm);
            for (byte[] chunk = stream.read(chunkSize); chunk.length > 0; chunk = stream.read(chunkSize)) {
                digest.update(chunk);
            }
            hex = Hex.encodeHexString(digest.digest());
        }

        if (seekable) {
            stream.seek(position);
        }
        return hex;
    }
}
