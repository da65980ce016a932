package com.libragraph.streams.handle;

/**
 * Reference point for a seek offset.
 */
public enum Whence {
    /** Absolute offset from the start. */
    SET,
    /** Relative to the current cursor. */
    CURRENT,
    /** Relative to the end of the resource. */
    END
}
