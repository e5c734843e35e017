package com.questrail.bif6.codec.impl;

import com.questrail.bif6.api.Bif6Header;
import com.questrail.bif6.api.SampleKind;
import com.questrail.bif6.codec.Bif6FormatException;
import com.questrail.bif6.codec.Bif6FormatException.Kind;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.Arrays;

/**
 * Bif6HeaderCodec
 * -----------------------------------------------------------------------------
 * Decodes and validates the fixed BIF6 header block.
 *
 * <p>Validation happens in this order:</p>
 * <ol>
 *   <li>length: the block must be exactly {@link Bif6Layout#HEADER_SIZE} bytes</li>
 *   <li>signature: the first six bytes must be {@code 00 00 'B' 'I' 'F' '6'}</li>
 *   <li>dimensions: width and height must be non-zero, at most
 *       {@code maxDimension}, and small enough that one record's payload fits
 *       in memory</li>
 * </ol>
 *
 * <p>The sample kind is implied by the signature: BIF6 always carries
 * unsigned 32-bit samples.</p>
 */
public final class Bif6HeaderCodec
{
    private Bif6HeaderCodec() {}

    /**
     * Decode a header block.
     *
     * @param block        bytes read from the start of the input; may be shorter
     *                     than a full header if the input ended early
     * @param maxDimension largest accepted width or height
     * @return the decoded header
     * @throws Bif6FormatException if the block is truncated, carries the wrong
     *         signature, or declares unusable dimensions
     */
    public static Bif6Header decode(byte[] block, int maxDimension)
    {
        if (block == null || block.length < Bif6Layout.HEADER_SIZE) {
            int available = (block == null) ? 0 : block.length;
            throw new Bif6FormatException(Kind.TRUNCATED,
                    "header requires " + Bif6Layout.HEADER_SIZE + " bytes, only " + available + " available",
                    available, Bif6FormatException.HEADER_RECORD_INDEX);
        }

        final ByteBuf buf = Unpooled.wrappedBuffer(block, 0, Bif6Layout.HEADER_SIZE);
        try {
            final byte[] magic = new byte[Bif6Layout.MAGIC.length];
            buf.readBytes(magic);
            if (!Arrays.equals(magic, Bif6Layout.MAGIC)) {
                throw new Bif6FormatException(Kind.INVALID_MAGIC,
                        "expected signature " + ByteBufUtil.hexDump(Bif6Layout.MAGIC)
                                + ", found " + ByteBufUtil.hexDump(magic),
                        0, Bif6FormatException.HEADER_RECORD_INDEX);
            }

            final int intervals = buf.readUnsignedShortLE();
            final int widthOffset = buf.readerIndex();
            final int width = buf.readUnsignedShortLE();
            final int height = buf.readUnsignedShortLE();

            checkDimension("width", width, maxDimension, widthOffset);
            checkDimension("height", height, maxDimension, widthOffset + Short.BYTES);

            final Bif6Header header = new Bif6Header(intervals, width, height, SampleKind.UNSIGNED_INT32);
            if (Bif6Layout.payloadSize(header) > Bif6Layout.MAX_PAYLOAD_SIZE) {
                throw new Bif6FormatException(Kind.INVALID_DIMENSIONS,
                        "image of " + width + "x" + height + " samples exceeds the largest decodable record",
                        widthOffset, Bif6FormatException.HEADER_RECORD_INDEX);
            }
            return header;
        }
        finally {
            buf.release();
        }
    }

    private static void checkDimension(String name, int value, int maxDimension, int offset)
    {
        if (value == 0 || value > maxDimension) {
            throw new Bif6FormatException(Kind.INVALID_DIMENSIONS,
                    name + " " + value + " outside accepted range 1.." + maxDimension,
                    offset, Bif6FormatException.HEADER_RECORD_INDEX);
        }
    }
}
