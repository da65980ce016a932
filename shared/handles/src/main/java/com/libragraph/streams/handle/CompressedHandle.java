package com.libragraph.streams.handle;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Sequential handle that decompresses on read or compresses on write.
 * Uses Apache Commons Compress for GZIP and BZIP2 support.
 *
 * <p>A compressed handle is either readable or writable, never both, and is never
 * seekable. A trailing digit in the mode sets the level: deflate level for GZIP
 * ({@code wb2}), block size for BZIP2. Closing finishes the compressed frame and
 * closes the underlying resource.
 *
 * <p>The decompressor is created on the first read, so opening an empty source for
 * reading succeeds.
 */
public class CompressedHandle extends PipeHandle {

    public enum Compression {
        GZIP("gzip", "compress.zlib", "ZLIB"),
        BZIP2("bzip2", "compress.bzip2", "BZIP2");

        private final String scheme;
        private final String wrapperType;
        private final String streamType;

        Compression(String scheme, String wrapperType, String streamType) {
            this.scheme = scheme;
            this.wrapperType = wrapperType;
            this.streamType = streamType;
        }

        public String scheme() {
            return scheme;
        }
    }

    private final Compression compression;
    private final InputStream source;
    private InputStream decompressor;

    private CompressedHandle(InputStream source, OutputStream compressor, OpenMode mode,
                             String uri, Compression compression) {
        super(null, compressor, mode, uri, compression.wrapperType, compression.streamType);
        this.compression = compression;
        this.source = source == null ? null : new BufferedInputStream(source);
    }

    /**
     * Opens a compressed file.
     */
    public static CompressedHandle open(Path path, OpenMode mode, Compression compression) throws IOException {
        checkDirection(mode);
        Path absolute = path.toAbsolutePath();
        String uri = compression.scheme + "://" + absolute;
        if (mode.isReadable()) {
            return new CompressedHandle(Files.newInputStream(absolute), null, mode, uri, compression);
        }

        OpenOption[] options = mode.isAppend()
                ? new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.APPEND}
                : new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                                   StandardOpenOption.WRITE};
        OutputStream raw = Files.newOutputStream(absolute, options);
        return new CompressedHandle(null, compressor(raw, mode, compression), mode, uri, compression);
    }

    /**
     * Layers compression over another handle, which this handle then owns.
     */
    public static CompressedHandle wrap(Handle inner, OpenMode mode, Compression compression) throws IOException {
        checkDirection(mode);
        String uri = compression.scheme + "://" + inner.uri();
        if (mode.isReadable()) {
            return new CompressedHandle(inner.inputStream(), null, mode, uri, compression);
        }
        return new CompressedHandle(null, compressor(inner.outputStream(), mode, compression),
                mode, uri, compression);
    }

    public Compression compression() {
        return compression;
    }

    @Override
    protected InputStream input() throws IOException {
        if (source == null) {
            return super.input();
        }
        if (decompressor == null) {
            decompressor = switch (compression) {
                case GZIP -> new GzipCompressorInputStream(source, true);
                case BZIP2 -> new BZip2CompressorInputStream(source, true);
            };
        }
        return decompressor;
    }

    @Override
    protected int doRead(byte[] dst, int off, int len) throws IOException {
        if (decompressor == null && source != null && isEmptySource()) {
            return -1;
        }
        return super.doRead(dst, off, len);
    }

    @Override
    protected boolean flushOnWrite() {
        return false;
    }

    @Override
    protected void doClose() throws IOException {
        if (source != null) {
            if (decompressor != null) {
                decompressor.close();
            } else {
                source.close();
            }
            return;
        }
        super.doClose();
    }

    private boolean isEmptySource() throws IOException {
        source.mark(1);
        int first = source.read();
        source.reset();
        return first < 0;
    }

    private static OutputStream compressor(OutputStream raw, OpenMode mode, Compression compression)
            throws IOException {
        try {
            return switch (compression) {
                case GZIP -> {
                    GzipParameters parameters = new GzipParameters();
                    mode.compressionLevel().ifPresent(parameters::setCompressionLevel);
                    yield new GzipCompressorOutputStream(raw, parameters);
                }
                case BZIP2 -> {
                    int blockSize = mode.compressionLevel().orElse(BZip2CompressorOutputStream.MAX_BLOCKSIZE);
                    yield new BZip2CompressorOutputStream(raw, Math.max(BZip2CompressorOutputStream.MIN_BLOCKSIZE, blockSize));
                }
            };
        } catch (IOException | RuntimeException e) {
            raw.close();
            throw e;
        }
    }

    private static void checkDirection(OpenMode mode) {
        if (mode.isReadable() == mode.isWritable()) {
            throw new IllegalArgumentException(
                    "Compressed handles are either read or write, got mode '" + mode + "'");
        }
    }
}
