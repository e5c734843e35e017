package com.questrail.bif6.codec;

import java.util.Objects;

/**
 * Indicates that BIF6 input violates the structure of the format.
 *
 * Every instance is fatal for the rest of the stream: the format carries no
 * resynchronization marker, so no later record boundary can be trusted.
 * Intervals produced before the failure remain valid.
 *
 * <p>The exception records where the defect was detected:</p>
 * <ul>
 *   <li>{@link #byteOffset()}: absolute offset from the start of the input</li>
 *   <li>{@link #recordIndex()}: zero-based record index, or
 *       {@link #HEADER_RECORD_INDEX} for the header block</li>
 * </ul>
 */
public final class Bif6FormatException extends RuntimeException
{
    /** Record index reported for defects in the header block. */
    public static final long HEADER_RECORD_INDEX = -1;

    /**
     * Classification of structural defects.
     */
    public enum Kind
    {
        /** The header does not start with the BIF6 signature. */
        INVALID_MAGIC,

        /** Fewer bytes are available than a field or payload requires. */
        TRUNCATED,

        /** Declared width or height is zero or above the accepted bound. */
        INVALID_DIMENSIONS,

        /** Decoded m/z boundaries violate {@code lower <= middle <= upper}. */
        INVALID_RANGE
    }

    private final Kind kind;
    private final long byteOffset;
    private final long recordIndex;

    public Bif6FormatException(Kind kind, String message, long byteOffset, long recordIndex)
    {
        super(describe(kind, message, byteOffset, recordIndex));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.byteOffset = byteOffset;
        this.recordIndex = recordIndex;
    }

    public Kind kind()
    {
        return kind;
    }

    public long byteOffset()
    {
        return byteOffset;
    }

    public long recordIndex()
    {
        return recordIndex;
    }

    private static String describe(Kind kind, String message, long byteOffset, long recordIndex)
    {
        String where = (recordIndex == HEADER_RECORD_INDEX)
                ? "header"
                : "record " + recordIndex;
        return kind + ": " + message + " (" + where + ", byte offset " + byteOffset + ")";
    }
}
