package com.questrail.bif6.codec.impl;

import com.questrail.bif6.api.Bif6Header;
import com.questrail.bif6.api.IntervalImage;
import com.questrail.bif6.api.SampleKind;
import com.questrail.bif6.codec.Bif6FormatException;
import com.questrail.bif6.codec.Bif6FormatException.Kind;
import com.questrail.bif6.codec.RecordPosition;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultBif6RecordDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultBif6RecordDecoder}.
 *
 * <p>Record bytes are spelled out by hand to pin the little-endian layout:</p>
 * <ul>
 *   <li>uint32 id</li>
 *   <li>three float32 m/z boundaries, in wire order</li>
 *   <li>uint32 samples, row-major</li>
 * </ul>
 */
final class DefaultBif6RecordDecoderTest
{
    private final DefaultBif6RecordDecoder decoder = new DefaultBif6RecordDecoder();

    private static final Bif6Header TWO_BY_ONE = new Bif6Header(1, 2, 1, SampleKind.UNSIGNED_INT32);

    private static final RecordPosition FIRST = new RecordPosition(0, 12);

    // 1.0f = 0x3F800000, 2.0f = 0x40000000, 3.0f = 0x40400000
    private static byte[] metadata(int id, int lowerBits, int middleBits, int upperBits)
    {
        return new byte[] {
                (byte) id, (byte) (id >>> 8), (byte) (id >>> 16), (byte) (id >>> 24),
                (byte) lowerBits, (byte) (lowerBits >>> 8), (byte) (lowerBits >>> 16), (byte) (lowerBits >>> 24),
                (byte) middleBits, (byte) (middleBits >>> 8), (byte) (middleBits >>> 16), (byte) (middleBits >>> 24),
                (byte) upperBits, (byte) (upperBits >>> 8), (byte) (upperBits >>> 16), (byte) (upperBits >>> 24)
        };
    }

    private static byte[] metadata(int id, float lower, float middle, float upper)
    {
        return metadata(id, Float.floatToRawIntBits(lower), Float.floatToRawIntBits(middle),
                Float.floatToRawIntBits(upper));
    }

    private IntervalImage decode(Bif6Header header, byte[] metadata, byte[] payload, RecordPosition position)
            throws IOException
    {
        return decoder.decode(header, metadata, new ByteArrayInputStream(payload), position);
    }

    @Test
    void decodesFieldsInWireOrder() throws IOException
    {
        byte[] metadata = {
                0x2A, 0x00, 0x00, 0x00,                     // id 42
                0x00, 0x00, (byte) 0x80, 0x3F,              // 1.0f
                0x00, 0x00, 0x00, 0x40,                     // 2.0f
                0x00, 0x00, 0x40, 0x40                      // 3.0f
        };
        byte[] payload = {
                0x01, 0x00, 0x00, 0x00,                     // x=0
                0x00, 0x01, 0x00, 0x00                      // x=1 -> 256
        };

        IntervalImage image = decode(TWO_BY_ONE, metadata, payload, FIRST);

        assertEquals(42, image.id());
        assertEquals(1.0f, image.mzLower());
        assertEquals(2.0f, image.mzMiddle());
        assertEquals(3.0f, image.mzUpper());
        assertEquals(2, image.width());
        assertEquals(1, image.height());
        assertEquals(1, image.intensity(0, 0));
        assertEquals(256, image.intensity(1, 0));
    }

    @Test
    void idAndSamplesAreUnsigned() throws IOException
    {
        byte[] metadata = metadata(0xFFFF_FFFF, 1.0f, 2.0f, 3.0f);
        byte[] payload = { (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0, 0, 0, (byte) 0x80 };

        IntervalImage image = decode(TWO_BY_ONE, metadata, payload, FIRST);

        assertEquals(0xFFFF_FFFFL, image.id());
        assertEquals(0xFFFF_FFFFL, image.intensity(0, 0));
        assertEquals(0x8000_0000L, image.intensity(1, 0));
    }

    @Test
    void samplesFillRowsOfWidth() throws IOException
    {
        Bif6Header header = new Bif6Header(1, 2, 3, SampleKind.UNSIGNED_INT32);
        byte[] payload = new byte[24];
        for (int i = 0; i < 6; i++) {
            payload[i * 4] = (byte) (i + 1);
        }

        IntervalImage image = decode(header, metadata(1, 1.0f, 2.0f, 3.0f), payload, FIRST);

        assertEquals(1, image.intensity(0, 0));
        assertEquals(2, image.intensity(1, 0));
        assertEquals(3, image.intensity(0, 1));
        assertEquals(6, image.intensity(1, 2));
        assertArrayEquals(new long[] { 1, 2, 3, 4, 5, 6 }, image.samples());
    }

    @Test
    void acceptsEqualBounds() throws IOException
    {
        IntervalImage image = decode(TWO_BY_ONE, metadata(3, 7.5f, 7.5f, 7.5f), new byte[8], FIRST);
        assertEquals(7.5f, image.mzLower());
        assertEquals(7.5f, image.mzUpper());
    }

    @Test
    void rejectsLowerAboveMiddle()
    {
        Bif6FormatException e = assertThrows(Bif6FormatException.class,
                () -> decode(TWO_BY_ONE, metadata(3, 2.5f, 2.0f, 3.0f), new byte[8],
                        new RecordPosition(4, 1000)));

        assertEquals(Kind.INVALID_RANGE, e.kind());
        assertEquals(4, e.recordIndex());
        assertEquals(1004, e.byteOffset());
    }

    @Test
    void rejectsMiddleAboveUpper()
    {
        assertEquals(Kind.INVALID_RANGE, assertThrows(Bif6FormatException.class,
                () -> decode(TWO_BY_ONE, metadata(3, 1.0f, 3.5f, 3.0f), new byte[8], FIRST)).kind());
    }

    @Test
    void rejectsNaNBound()
    {
        assertEquals(Kind.INVALID_RANGE, assertThrows(Bif6FormatException.class,
                () -> decode(TWO_BY_ONE, metadata(3, 1.0f, Float.NaN, 3.0f), new byte[8], FIRST)).kind());
    }

    @Test
    void rejectsMetadataOfWrongSize()
    {
        assertThrows(IllegalArgumentException.class,
                () -> decode(TWO_BY_ONE, new byte[15], new byte[8], FIRST));
        assertThrows(IllegalArgumentException.class,
                () -> decode(TWO_BY_ONE, new byte[17], new byte[8], FIRST));
    }

    @Test
    void shortPayloadIsTruncatedAtLastByteAvailable()
    {
        Bif6FormatException e = assertThrows(Bif6FormatException.class,
                () -> decode(TWO_BY_ONE, metadata(1, 1.0f, 2.0f, 3.0f), new byte[7], new RecordPosition(2, 100)));

        assertEquals(Kind.TRUNCATED, e.kind());
        assertEquals(2, e.recordIndex());
        assertEquals(100 + 16 + 7, e.byteOffset());
    }

    @Test
    void boundsAreCheckedBeforeAnySampleIsRead()
    {
        Bif6FormatException e = assertThrows(Bif6FormatException.class,
                () -> decode(TWO_BY_ONE, metadata(3, 4.0f, 2.0f, 3.0f), new byte[0], FIRST));

        assertEquals(Kind.INVALID_RANGE, e.kind());
    }

    @Test
    void hugeDeclaredGridOverTinyPayloadFailsAsTruncated()
    {
        Bif6Header huge = new Bif6Header(1, 8192, 8192, SampleKind.UNSIGNED_INT32);

        Bif6FormatException e = assertThrows(Bif6FormatException.class,
                () -> decode(huge, metadata(0, 1.0f, 2.0f, 3.0f), new byte[20], FIRST));

        assertEquals(Kind.TRUNCATED, e.kind());
        assertEquals(0, e.recordIndex());
        assertEquals(12 + 16 + 20, e.byteOffset());
    }

    @Test
    void decodesGridSpanningSeveralChunks() throws IOException
    {
        // 20000 samples = 80000 bytes, more than one read buffer
        Bif6Header header = new Bif6Header(1, 200, 100, SampleKind.UNSIGNED_INT32);
        int count = 200 * 100;
        byte[] payload = new byte[count * 4];
        for (int i = 0; i < count; i++) {
            payload[i * 4] = (byte) i;
            payload[i * 4 + 1] = (byte) (i >>> 8);
            payload[i * 4 + 2] = (byte) (i >>> 16);
        }

        IntervalImage image = decode(header, metadata(5, 1.0f, 2.0f, 3.0f), payload, FIRST);

        assertTrue(payload.length > DefaultBif6RecordDecoder.CHUNK_SIZE);
        assertEquals(count, image.sampleCount());
        assertEquals(0, image.intensity(0, 0));
        assertEquals(16383, image.intensity(183, 81));
        assertEquals(16384, image.intensity(184, 81));
        assertEquals(count - 1, image.intensity(199, 99));
    }

    @Test
    void consumesExactlyOnePayload() throws IOException
    {
        byte[] bytes = { 1, 0, 0, 0, 2, 0, 0, 0, 0x7F };
        InputStream in = new ByteArrayInputStream(bytes);

        IntervalImage image = decoder.decode(TWO_BY_ONE, metadata(1, 1.0f, 2.0f, 3.0f), in, FIRST);

        assertArrayEquals(new long[] { 1, 2 }, image.samples());
        assertEquals(0x7F, in.read());
    }
}
