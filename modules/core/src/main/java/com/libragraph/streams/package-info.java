/**
 * Seekable byte-stream wrapper over an open {@link com.libragraph.streams.handle.Handle}.
 *
 * <p>{@link com.libragraph.streams.Stream} mediates all I/O against its handle and manages
 * the handle's lifetime (close, detach, release on teardown).
 * {@link com.libragraph.streams.Streams} creates streams from common resources and
 * copies or hashes their content. Failures of active I/O surface as
 * {@link com.libragraph.streams.StreamException} subclasses; introspection never throws.
 */
package com.libragraph.streams;
