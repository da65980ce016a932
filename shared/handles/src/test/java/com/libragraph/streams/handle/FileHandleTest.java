package com.libragraph.streams.handle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileHandleTest {

    private Path dir;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("file-handle-");
    }

    @AfterEach
    void tearDown() throws Exception {
        try (var files = Files.list(dir)) {
            for (Path file : files.toList()) {
                Files.deleteIfExists(file);
            }
        }
        Files.deleteIfExists(dir);
    }

    @Test
    void shouldUseAbsolutePathAsUri() throws Exception {
        Path file = dir.resolve("a.txt");
        try (FileHandle handle = Handles.file(file, "w")) {
            assertThat(handle.uri()).isEqualTo(file.toAbsolutePath().toString());
            assertThat(handle.path()).isEqualTo(file.toAbsolutePath());
            assertThat(handle.isSeekable()).isTrue();
            assertThat(handle.metadata()).containsEntry("wrapper_type", "plainfile");
        }
    }

    @Test
    void shouldTruncateInWriteMode() throws Exception {
        Path file = dir.resolve("a.txt");
        Files.writeString(file, "previous content");

        try (FileHandle handle = Handles.file(file, "w")) {
            handle.write("new".getBytes());
        }

        assertThat(Files.readString(file)).isEqualTo("new");
    }

    @Test
    void shouldRequireExistingFileInReadMode() {
        assertThatThrownBy(() -> Handles.file(dir.resolve("missing.txt"), "r"))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void shouldFailExclusiveModeOnExistingFile() throws Exception {
        Path file = dir.resolve("a.txt");
        Files.writeString(file, "x");

        assertThatThrownBy(() -> Handles.file(file, "x"))
                .isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    void shouldKeepExistingContentInCreateMode() throws Exception {
        Path file = dir.resolve("a.txt");
        Files.writeString(file, "keep");

        try (FileHandle handle = Handles.file(file, "c+")) {
            assertThat(handle.readAll()).isEqualTo("keep".getBytes());
        }
    }

    @Test
    void shouldAppendToEnd() throws Exception {
        Path file = dir.resolve("log.txt");
        Files.writeString(file, "one\n");

        try (FileHandle handle = Handles.file(file, "a")) {
            handle.write("two\n".getBytes());
        }

        assertThat(Files.readString(file)).isEqualTo("one\ntwo\n");
    }

    @Test
    void shouldSeeExternalChangesInStat() throws Exception {
        Path file = dir.resolve("a.txt");
        Files.writeString(file, "abc");

        try (FileHandle handle = Handles.file(file, "r")) {
            assertThat(handle.stat()).hasValue(3);
            Files.writeString(file, "abcdefgh");
            assertThat(handle.stat()).hasValue(8);
        }
    }
}
