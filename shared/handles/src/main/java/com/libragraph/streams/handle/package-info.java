/**
 * Open resource handles for the stream layer.
 *
 * <p>{@link com.libragraph.streams.handle.Handle} is the contract, with channel-backed
 * (memory, temp, file), pipe and compressed implementations, opened through
 * {@link com.libragraph.streams.handle.Handles}. The
 * {@link com.libragraph.streams.handle.channel channel} subpackage holds the
 * RAM and temp-file channels behind memory and temp handles.
 * Depends only on Apache Commons Compress.
 */
package com.libragraph.streams.handle;
