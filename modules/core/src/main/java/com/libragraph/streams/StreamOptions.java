package com.libragraph.streams;

import java.util.Map;

/**
 * Construction options for a {@link Stream}.
 *
 * @param size     known size of the resource, pre-seeding the size cache (may be null)
 * @param metadata entries reported by {@link Stream#getMetadata()} in place of the
 *                 handle's own entries with the same key
 */
public record StreamOptions(Long size, Map<String, Object> metadata) {

    public StreamOptions {
        if (size != null && size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got: " + size);
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static StreamOptions defaults() {
        return new StreamOptions(null, Map.of());
    }

    public StreamOptions withSize(long size) {
        return new StreamOptions(size, metadata);
    }

    public StreamOptions withMetadata(Map<String, Object> metadata) {
        return new StreamOptions(size, metadata);
    }
}
