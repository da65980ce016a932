package com.libragraph.streams.handle;

import java.nio.file.OpenOption;
import java.nio.file.StandardOpenOption;
import java.util.EnumSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * An fopen-style mode string such as {@code r}, {@code w+b}, {@code ab+} or {@code wb2}.
 *
 * <p>Readability and writability depend only on the base character, a {@code +}
 * anywhere in the string and the {@code rw} form, so binary/text suffixes
 * ({@code b}, {@code t}) never change the outcome wherever they appear. A trailing
 * digit is the compression level used by compressed handles.
 *
 * <p>Classification:
 * <ul>
 *   <li>{@code r}: readable only</li>
 *   <li>{@code w}, {@code a}, {@code x}, {@code c}: writable only</li>
 *   <li>{@code rw}, or any mode containing {@code +}: readable and writable</li>
 * </ul>
 */
public record OpenMode(String mode) {

    private static final String BASE_CHARS = "rwaxc";
    private static final String WRITE_BASE_CHARS = "waxc";

    public OpenMode {
        Objects.requireNonNull(mode, "mode cannot be null");
        if (mode.isEmpty() || BASE_CHARS.indexOf(mode.charAt(0)) < 0) {
            throw new IllegalArgumentException("Invalid open mode: '" + mode + "'");
        }
    }

    public static OpenMode of(String mode) {
        return new OpenMode(mode);
    }

    public boolean isReadable() {
        return mode.charAt(0) == 'r' || isUpdate();
    }

    public boolean isWritable() {
        return WRITE_BASE_CHARS.indexOf(mode.charAt(0)) >= 0 || isUpdate() || mode.startsWith("rw");
    }

    /** {@code +} opens for both reading and writing. */
    private boolean isUpdate() {
        return mode.indexOf('+') >= 0;
    }

    /** Writes always land at the end of the resource. */
    public boolean isAppend() {
        return mode.charAt(0) == 'a';
    }

    /**
     * Compression level encoded as a trailing digit ({@code rb9}, {@code wb2}).
     */
    public OptionalInt compressionLevel() {
        char last = mode.charAt(mode.length() - 1);
        if (Character.isDigit(last)) {
            return OptionalInt.of(last - '0');
        }
        return OptionalInt.empty();
    }

    /**
     * Options for opening a file channel in this mode.
     * Append is not mapped to {@link StandardOpenOption#APPEND} since it cannot be
     * combined with READ; append handles reposition before every write instead.
     */
    public Set<OpenOption> fileOptions() {
        Set<StandardOpenOption> options = EnumSet.noneOf(StandardOpenOption.class);
        switch (mode.charAt(0)) {
            case 'w' -> {
                options.add(StandardOpenOption.CREATE);
                options.add(StandardOpenOption.TRUNCATE_EXISTING);
            }
            case 'a', 'c' -> options.add(StandardOpenOption.CREATE);
            case 'x' -> options.add(StandardOpenOption.CREATE_NEW);
            default -> {
                // 'r' opens an existing file as-is
            }
        }
        if (isReadable()) {
            options.add(StandardOpenOption.READ);
        }
        if (isWritable()) {
            options.add(StandardOpenOption.WRITE);
        }
        return Set.copyOf(options);
    }

    @Override
    public String toString() {
        return mode;
    }
}
