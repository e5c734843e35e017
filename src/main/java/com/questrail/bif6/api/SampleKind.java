package com.questrail.bif6.api;

/**
 * Numeric kind of the intensity samples stored in an interval image.
 *
 * <p>The kind is fixed once per file by the format version and is never
 * re-derived per record. BIF6 stores every sample as an unsigned 32-bit count.</p>
 */
public enum SampleKind
{
    /** Unsigned 32-bit integer count, little-endian on the wire. */
    UNSIGNED_INT32(4);

    private final int byteWidth;

    SampleKind(int byteWidth) {
        this.byteWidth = byteWidth;
    }

    /**
     * Returns the number of bytes a single sample occupies on the wire.
     */
    public int byteWidth() {
        return byteWidth;
    }
}
