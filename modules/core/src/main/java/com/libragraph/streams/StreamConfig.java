package com.libragraph.streams;

import com.libragraph.streams.handle.Handles;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jboss.logging.Logger;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Tunables for streams created by this library, read through MicroProfile Config
 * (system properties, environment, {@code META-INF/microprofile-config.properties}).
 *
 * @param tempMaxMemory bytes a temp stream keeps in RAM before spilling to disk
 * @param copyChunkSize read size used when copying and hashing
 * @param textCharset   charset used to turn stream bytes into text
 */
public record StreamConfig(long tempMaxMemory, int copyChunkSize, Charset textCharset) {

    private static final Logger log = Logger.getLogger(StreamConfig.class);

    public static final String TEMP_MAX_MEMORY = "streams.temp.max-memory";
    public static final String COPY_CHUNK_SIZE = "streams.copy.chunk-size";
    public static final String TEXT_CHARSET = "streams.text.charset";

    private static final int DEFAULT_CHUNK_SIZE = 8192;

    public StreamConfig {
        if (tempMaxMemory < 0) {
            throw new IllegalArgumentException(TEMP_MAX_MEMORY + " must be >= 0, got: " + tempMaxMemory);
        }
        if (copyChunkSize <= 0) {
            throw new IllegalArgumentException(COPY_CHUNK_SIZE + " must be > 0, got: " + copyChunkSize);
        }
        Objects.requireNonNull(textCharset, "textCharset cannot be null");
    }

    public static StreamConfig defaults() {
        return new StreamConfig(Handles.DEFAULT_MAX_MEMORY, DEFAULT_CHUNK_SIZE, StandardCharsets.UTF_8);
    }

    /**
     * Reads the configuration from {@code config}, falling back to defaults for
     * missing keys.
     */
    public static StreamConfig from(Config config) {
        long tempMaxMemory = config.getOptionalValue(TEMP_MAX_MEMORY, Long.class)
                .orElse(Handles.DEFAULT_MAX_MEMORY);
        int copyChunkSize = config.getOptionalValue(COPY_CHUNK_SIZE, Integer.class)
                .orElse(DEFAULT_CHUNK_SIZE);
        Charset textCharset = config.getOptionalValue(TEXT_CHARSET, String.class)
                .map(Charset::forName)
                .orElse(StandardCharsets.UTF_8);
        return new StreamConfig(tempMaxMemory, copyChunkSize, textCharset);
    }

    /**
     * Configuration of the current application, loaded once. Never fails: an invalid
     * value (unknown charset, negative size, unparsable number) is logged and the
     * defaults are used instead.
     */
    public static StreamConfig current() {
        return Holder.INSTANCE;
    }

    static StreamConfig load(Supplier<Config> source) {
        try {
            return from(source.get());
        } catch (RuntimeException e) {
            log.warnf(e, "Invalid streams configuration, using defaults: %s", e.getMessage());
            return defaults();
        }
    }

    private static final class Holder {
        private static final StreamConfig INSTANCE = load(ConfigProvider::getConfig);
    }
}
