package com.libragraph.streams;

import com.libragraph.streams.handle.Handle;
import com.libragraph.streams.handle.Handles;
import com.libragraph.streams.handle.OpenMode;
import com.libragraph.streams.handle.Whence;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static org.assertj.core.api.Assertions.*;

class StreamTest {

    private static final List<String> READABLE_MODES = List.of(
            "r", "w+", "r+", "x+", "c+", "rb", "w+b", "r+b", "x+b", "c+b",
            "rt", "w+t", "r+t", "x+t", "c+t", "a+", "rb+",
            "rt+", "wt+", "xt+", "ct+", "at+");

    private static final List<String> WRITABLE_MODES = List.of(
            "w", "w+", "rw", "r+", "x+", "c+", "wb", "w+b", "r+b", "rb+",
            "x+b", "c+b", "w+t", "r+t", "x+t", "c+t", "a", "a+",
            "rt+", "wt+", "xt+", "ct+", "at+");

    // --- Construction ---

    @Test
    void shouldRejectNullHandle() {
        assertThatIllegalArgumentException().isThrownBy(() -> new Stream(null));
    }

    @Test
    void shouldRejectClosedHandle() throws Exception {
        Handle handle = Handles.temp("r+");
        handle.close();

        assertThatIllegalArgumentException()
                .isThrownBy(() -> new Stream(handle))
                .withMessageContaining("open handle");
    }

    @Test
    void shouldInitializeProperties() throws Exception {
        for (String mode : List.of("r+", "rb+")) {
            Handle handle = Handles.temp(mode);
            handle.write("data".getBytes());

            try (Stream stream = new Stream(handle)) {
                assertThat(stream.isReadable()).isTrue();
                assertThat(stream.isWritable()).isTrue();
                assertThat(stream.isSeekable()).isTrue();
                assertThat(stream.getMetadata("uri")).contains(Handles.TEMP_URI);
                assertThat(stream.getMetadata()).containsEntry("mode", mode);
                assertThat(stream.getSize()).hasValue(4);
                assertThat(stream.eof()).isFalse();
            }
        }
    }

    // --- Capabilities ---

    @Test
    void shouldBeReadableInReadableModes() {
        for (String mode : READABLE_MODES) {
            try (Stream stream = new Stream(Handles.temp(mode))) {
                assertThat(stream.isReadable()).as("mode %s", mode).isTrue();
            }
        }
    }

    @Test
    void shouldBeWritableInWritableModes() {
        for (String mode : WRITABLE_MODES) {
            try (Stream stream = new Stream(Handles.temp(mode))) {
                assertThat(stream.isWritable()).as("mode %s", mode).isTrue();
            }
        }
    }

    @Test
    void shouldRejectReadOnWriteOnlyStream() {
        try (Stream stream = new Stream(Handles.output(new ByteArrayOutputStream()))) {
            assertThat(stream.isReadable()).isFalse();
            assertThatThrownBy(() -> stream.read(1))
                    .isInstanceOf(StreamIOException.class)
                    .hasMessage("Cannot read from non-readable stream");
            assertThatThrownBy(stream::getContents)
                    .isInstanceOf(StreamIOException.class)
                    .hasMessage("Cannot read from non-readable stream");
        }
    }

    @Test
    void shouldRejectWriteOnReadOnlyStream() {
        try (Stream stream = new Stream(Handles.input(new ByteArrayInputStream(new byte[0])))) {
            assertThat(stream.isWritable()).isFalse();
            assertThatThrownBy(() -> stream.write("x"))
                    .isInstanceOf(StreamIOException.class)
                    .hasMessage("Cannot write to a non-writable stream");
        }
    }

    @Test
    void shouldClassifyGzipModes() throws Exception {
        try (Stream reader = new Stream(Handles.gzip(Handles.temp("r+"), "rb9"))) {
            assertThat(reader.isReadable()).isTrue();
            assertThat(reader.isWritable()).isFalse();
            assertThat(reader.isSeekable()).isFalse();
        }
        try (Stream writer = new Stream(Handles.gzip(Handles.temp("r+"), "wb2"))) {
            assertThat(writer.isReadable()).isFalse();
            assertThat(writer.isWritable()).isTrue();
            assertThat(writer.isSeekable()).isFalse();
        }
    }

    // --- Read / write / position ---

    @Test
    void shouldHandleFreshBufferScenario() {
        try (Stream stream = new Stream(Handles.memory("w+"))) {
            assertThat(stream.write("data")).isEqualTo(4);
            assertThat(stream.getSize()).hasValue(4);
            assertThat(stream.tell()).isEqualTo(4);

            assertThat(stream.eof()).isFalse();
            assertThat(stream.read(1)).isEmpty();
            assertThat(stream.eof()).isTrue();

            stream.seek(0);
            assertThat(stream.eof()).isFalse();
            assertThat(stream.getContents()).isEqualTo("data".getBytes());
        }
    }

    @Test
    void shouldGetContents() throws Exception {
        Handle handle = Handles.temp("w+");
        handle.write("data".getBytes());

        try (Stream stream = new Stream(handle)) {
            assertThat(stream.getContents()).isEmpty();
            stream.seek(0);
            assertThat(stream.getContents()).isEqualTo("data".getBytes());
            assertThat(stream.getContents()).isEmpty();
        }
    }

    @Test
    void shouldCheckEof() throws Exception {
        Handle handle = Handles.temp("w+");
        handle.write("data".getBytes());

        try (Stream stream = new Stream(handle)) {
            assertThat(stream.tell()).as("cursor already at the end").isEqualTo(4);
            assertThat(stream.eof()).as("still not eof").isFalse();
            assertThat(stream.read(1)).as("one more read reaches eof").isEmpty();
            assertThat(stream.eof()).isTrue();
        }
    }

    @Test
    void shouldKeepEofOnZeroLengthRead() {
        try (Stream stream = new Stream(Handles.temp("r"))) {
            assertThat(stream.read(0)).isEmpty();
            assertThat(stream.eof()).isFalse();
        }
    }

    @Test
    void shouldRejectNegativeReadLength() {
        try (Stream stream = new Stream(Handles.temp("r"))) {
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> stream.read(-1))
                    .withMessage("Length parameter cannot be negative");
        }
    }

    @Test
    void shouldReadBackWrittenBytes() {
        byte[] bytes = {0, 1, 2, (byte) 0xFF, 'a', '\n'};
        try (Stream stream = new Stream(Handles.temp("w+"))) {
            stream.write(bytes);
            stream.rewind();

            assertThat(stream.getContents()).isEqualTo(bytes);
            assertThat(stream.getContents()).isEmpty();
        }
    }

    @Test
    void shouldProvideStreamPosition() throws Exception {
        Handle handle = Handles.temp("w+");
        try (Stream stream = new Stream(handle)) {
            assertThat(stream.tell()).isZero();
            stream.write("foo");
            assertThat(stream.tell()).isEqualTo(3);
            stream.seek(1);
            assertThat(stream.tell()).isEqualTo(1);
            assertThat(stream.tell()).isEqualTo(handle.tell());

            stream.seek(-1, Whence.END);
            assertThat(stream.read(1)).isEqualTo("o".getBytes());
        }
    }

    @Test
    void shouldFailSeekOnSequentialStream() {
        try (Stream stream = new Stream(Handles.input(new ByteArrayInputStream("abc".getBytes())))) {
            assertThat(stream.isSeekable()).isFalse();
            assertThatThrownBy(() -> stream.seek(0))
                    .isInstanceOf(StreamIOException.class)
                    .hasMessage("Stream is not seekable");
        }
    }

    @Test
    void shouldFailSeekBeforeStart() {
        try (Stream stream = new Stream(Handles.temp("r+"))) {
            assertThatThrownBy(() -> stream.seek(-5))
                    .isInstanceOf(StreamIOException.class)
                    .hasMessageContaining("Unable to seek to stream position -5")
                    .hasCauseInstanceOf(IOException.class);
        }
    }

    @Test
    void shouldReportReadFailure() {
        try (Stream stream = new Stream(new FailingHandle())) {
            assertThatThrownBy(() -> stream.read(1))
                    .isInstanceOf(StreamIOException.class)
                    .hasMessage("Unable to read from stream")
                    .hasRootCauseMessage("device unplugged");
        }
    }

    @Test
    void shouldReportBulkReadFailure() {
        try (Stream stream = new Stream(new FailingHandle())) {
            assertThatThrownBy(stream::getContents)
                    .isInstanceOf(StreamIOException.class)
                    .hasMessage("Unable to read stream contents");
        }
    }

    @Test
    void shouldReportWriteFailure() {
        try (Stream stream = new Stream(new FailingHandle())) {
            assertThatThrownBy(() -> stream.write("x"))
                    .isInstanceOf(StreamIOException.class)
                    .hasMessage("Unable to write to stream");
        }
    }

    @Test
    void shouldReportPositionFailure() {
        try (Stream stream = new Stream(new FailingHandle())) {
            assertThatThrownBy(stream::tell)
                    .isInstanceOf(StreamIOException.class)
                    .hasMessage("Unable to determine stream position");
        }
    }

    // --- Size ---

    @Test
    void shouldGetSizeOfFile() throws Exception {
        Path tmp = Files.createTempFile("test-", ".txt");
        Files.writeString(tmp, "some file content");
        try (Stream stream = new Stream(Handles.file(tmp, "r"))) {
            assertThat(stream.getSize()).hasValue(Files.size(tmp));
            // Second query
            assertThat(stream.getSize()).hasValue(Files.size(tmp));
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Test
    void shouldFollowExternalChangesForPathBackedSize() throws Exception {
        Path tmp = Files.createTempFile("test-", ".txt");
        Files.writeString(tmp, "abc");
        try (Stream stream = new Stream(Handles.file(tmp, "r"))) {
            assertThat(stream.getSize()).hasValue(3);

            Files.writeString(tmp, "abcdefgh");
            assertThat(stream.getSize()).hasValue(8);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Test
    void shouldServeBufferSizeFromCache() throws Exception {
        Handle handle = Handles.temp("w+");
        handle.write("foo".getBytes());
        try (Stream stream = new Stream(handle)) {
            assertThat(stream.getSize()).hasValue(3);

            // Bypasses the stream, so the cache does not see it
            handle.write("bar".getBytes());
            assertThat(stream.getSize()).hasValue(3);
        }
    }

    @Test
    void shouldKeepSizeConsistent() throws Exception {
        Handle handle = Handles.temp("w+");
        assertThat(handle.write("foo".getBytes())).isEqualTo(3);
        try (Stream stream = new Stream(handle)) {
            assertThat(stream.getSize()).hasValue(3);
            assertThat(stream.write("test")).isEqualTo(4);
            assertThat(stream.getSize()).hasValue(7);
            assertThat(stream.getSize()).hasValue(7);
        }
    }

    @Test
    void shouldAddOverwriteToCachedSize() {
        try (Stream stream = new Stream(Handles.temp("w+"))) {
            stream.write("abcdef");
            assertThat(stream.getSize()).hasValue(6);

            stream.seek(0);
            stream.write("xy");
            assertThat(stream.getSize()).hasValue(8);
        }
    }

    @Test
    void shouldReportUnknownSizeAsEmpty() {
        try (Stream stream = new Stream(Handles.input(new ByteArrayInputStream("abc".getBytes())))) {
            assertThat(stream.getSize()).isEmpty();
        }
    }

    // --- Options ---

    @Test
    void shouldPreseedSizeAndOverrideMetadata() {
        StreamOptions options = StreamOptions.defaults()
                .withSize(42)
                .withMetadata(Map.<String, Object>of("uri", "custom://resource", "owner", "tests"));

        try (Stream stream = new Stream(Handles.temp("r+"), options)) {
            assertThat(stream.getSize()).hasValue(42);
            assertThat(stream.getMetadata("uri")).contains("custom://resource");
            assertThat(stream.getMetadata("owner")).contains("tests");
            assertThat(stream.getMetadata("mode")).contains("r+");
            assertThat(stream.getMetadata("missing")).isEmpty();
            assertThat(stream.getMetadata()).containsEntry("uri", "custom://resource");
        }
    }

    @Test
    void shouldRejectNegativeOptionSize() {
        assertThatIllegalArgumentException().isThrownBy(() -> StreamOptions.defaults().withSize(-1));
    }

    // --- String conversion ---

    @Test
    void shouldConvertToString() throws Exception {
        Handle handle = Handles.temp("w+");
        handle.write("data".getBytes());
        try (Stream stream = new Stream(handle)) {
            assertThat(stream.toString()).isEqualTo("data");
            assertThat(stream.toString()).isEqualTo("data");
        }
    }

    @Test
    void shouldConvertSequentialStreamFromCursor() {
        try (Stream stream = new Stream(Handles.input(new ByteArrayInputStream("abc".getBytes())))) {
            stream.read(1);
            assertThat(stream.toString()).isEqualTo("bc");
        }
    }

    @Test
    void shouldLogToStringFailureAndReturnEmpty() {
        try (LogCapture logs = LogCapture.of(Stream.class);
             Stream stream = new Stream(new FailingHandle())) {
            assertThat(stream.toString()).isEmpty();

            List<LogRecord> errors = logs.recordsAtLeast(Level.SEVERE);
            assertThat(errors).hasSize(1);
            assertThat(errors.get(0).getThrown()).isInstanceOf(StreamIOException.class);
        }
    }

    // --- Lifecycle ---

    @Test
    void shouldReleaseHandleOnClose() {
        Handle handle = Handles.temp("r");
        Stream stream = new Stream(handle);
        stream.close();

        assertThat(handle.isOpen()).isFalse();
        assertInert(stream);

        // Idempotent
        stream.close();
    }

    @Test
    void shouldDetachHandleOnceWithoutClosingIt() throws Exception {
        Handle handle = Handles.temp("r");
        Stream stream = new Stream(handle);

        assertThat(stream.detach()).containsSame(handle);
        assertThat(handle.isOpen()).as("handle is not closed").isTrue();
        assertThat(stream.detach()).isEmpty();

        assertInert(stream);

        stream.close();
        assertThat(handle.isOpen()).as("close after detach leaves the handle alone").isTrue();
        handle.close();
    }

    @Test
    void shouldReleaseHandleWhenUnreachable() throws Exception {
        Handle handle = Handles.temp("r+");
        wrapAndForget(handle);

        for (int i = 0; i < 100 && handle.isOpen(); i++) {
            System.gc();
            Thread.sleep(20);
        }
        assertThat(handle.isOpen()).isFalse();
    }

    @Test
    void shouldKeepHandleOpenDuringCallOnTemporaryStream() throws Exception {
        byte[] content = new byte[256 * 1024];
        Arrays.fill(content, (byte) 'x');

        Thread collector = new Thread(() -> {
            while (!Thread.currentThread().isInterrupted()) {
                System.gc();
            }
        });
        collector.setDaemon(true);
        collector.start();
        try {
            for (int i = 0; i < 200; i++) {
                assertThat(new Stream(Handles.memory(content, "r")).getContents())
                        .as("iteration %d", i)
                        .hasSize(content.length);
            }
        } finally {
            collector.interrupt();
            collector.join();
        }
    }

    @Test
    void shouldSurviveFailingHandleClose() {
        FailingHandle handle = new FailingHandle();
        handle.failOnClose = true;
        Stream stream = new Stream(handle);

        try (LogCapture logs = LogCapture.of(Stream.class)) {
            assertThatCode(stream::close).doesNotThrowAnyException();
            assertThat(logs.recordsAtLeast(Level.WARNING)).hasSize(1);
        }
        assertInert(stream);
    }

    private static void wrapAndForget(Handle handle) {
        new Stream(handle);
    }

    private static void assertInert(Stream stream) {
        assertThat(stream.isReadable()).isFalse();
        assertThat(stream.isWritable()).isFalse();
        assertThat(stream.isSeekable()).isFalse();
        assertThat(stream.getSize()).isEqualTo(OptionalLong.empty());
        assertThat(stream.getMetadata()).isEmpty();
        assertThat(stream.getMetadata("foo")).isEmpty();

        List<ThrowingCallable> activeCalls = List.of(
                () -> stream.read(10),
                () -> stream.write("bar"),
                () -> stream.seek(10),
                stream::tell,
                stream::eof,
                stream::getContents);
        for (ThrowingCallable call : activeCalls) {
            assertThatThrownBy(call)
                    .isInstanceOf(StreamDetachedException.class)
                    .hasMessageContaining("Stream is detached");
        }

        try (LogCapture logs = LogCapture.of(Stream.class)) {
            assertThat(stream.toString()).isEmpty();

            List<LogRecord> errors = logs.recordsAtLeast(Level.SEVERE);
            assertThat(errors).hasSize(1);
            assertThat(errors.get(0).getMessage())
                    .startsWith("com.libragraph.streams.Stream::toString exception");
        }
    }

    /**
     * Seekable read/write handle whose primitives all fail.
     */
    static final class FailingHandle extends Handle {
        boolean failOnClose;

        FailingHandle() {
            super(OpenMode.of("r+"), "test://failing", "test", "FAILING");
        }

        @Override
        public boolean isSeekable() {
            return true;
        }

        @Override
        protected int doRead(byte[] dst, int off, int len) throws IOException {
            throw new IOException("device unplugged");
        }

        @Override
        protected void doWrite(byte[] src, int off, int len) throws IOException {
            throw new IOException("device unplugged");
        }

        @Override
        protected void doSeek(long position) {
            // accepted
        }

        @Override
        protected long doTell() throws IOException {
            throw new IOException("device unplugged");
        }

        @Override
        protected OptionalLong doStat() throws IOException {
            throw new IOException("device unplugged");
        }

        @Override
        protected void doClose() throws IOException {
            if (failOnClose) {
                throw new IOException("device unplugged");
            }
        }
    }
}
