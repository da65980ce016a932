package com.libragraph.streams.handle;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Handle on a file in the local filesystem. Its uri is the absolute path.
 */
public class FileHandle extends ChannelHandle {

    private final Path path;

    private FileHandle(FileChannel channel, Path path, OpenMode mode) {
        super(channel, mode, path.toString(), "plainfile", "STDIO");
        this.path = path;
    }

    /**
     * Opens {@code path} with the file semantics of {@code mode}:
     * {@code r} requires an existing file, {@code w} truncates, {@code x} fails if the
     * file exists, {@code a} and {@code c} create without truncating.
     */
    public static FileHandle open(Path path, OpenMode mode) throws IOException {
        Path absolute = path.toAbsolutePath();
        FileChannel channel = FileChannel.open(absolute, mode.fileOptions());
        return new FileHandle(channel, absolute, mode);
    }

    public Path path() {
        return path;
    }
}
