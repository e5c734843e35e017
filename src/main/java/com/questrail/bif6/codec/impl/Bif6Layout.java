package com.questrail.bif6.codec.impl;

import com.questrail.bif6.api.Bif6Header;

/**
 * Bif6Layout
 * -----------------------------------------------------------------------------
 * Fixed sizes and constants of the BIF6 wire layout.
 *
 * <p>See {@code com.questrail.bif6.codec} package documentation for the
 * field table.</p>
 */
public final class Bif6Layout
{
    /** Header signature: two NUL bytes followed by ASCII {@code BIF6}. */
    static final byte[] MAGIC = { 0x00, 0x00, 'B', 'I', 'F', '6' };

    /** Size of the header block in bytes. */
    public static final int HEADER_SIZE = MAGIC.length + 3 * Short.BYTES;

    /** Size of the per-record metadata (id + three m/z floats) in bytes. */
    public static final int RECORD_METADATA_SIZE = Integer.BYTES + 3 * Float.BYTES;

    /** Largest width or height the header can express (unsigned 16-bit). */
    public static final int MAX_ENCODABLE_DIMENSION = 0xFFFF;

    /**
     * Largest record payload that can be held in a single Java array.
     * Some VMs reserve header words in arrays, hence the small margin.
     */
    static final long MAX_PAYLOAD_SIZE = Integer.MAX_VALUE - 8;

    private Bif6Layout() {}

    /**
     * Returns the size in bytes of the sample payload of every record in a
     * file with the given header.
     */
    public static long payloadSize(Bif6Header header)
    {
        return header.pixelCount() * header.sampleKind().byteWidth();
    }

    /**
     * Returns the full size in bytes of one record (metadata + payload).
     */
    public static long recordSize(Bif6Header header)
    {
        return RECORD_METADATA_SIZE + payloadSize(header);
    }
}
