package com.questrail.bif6.codec.impl;

import com.questrail.bif6.api.Bif6Header;
import com.questrail.bif6.api.IntervalImage;
import com.questrail.bif6.codec.Bif6FormatException;
import com.questrail.bif6.codec.Bif6FormatException.Kind;
import com.questrail.bif6.codec.Bif6RecordDecoder;
import com.questrail.bif6.codec.RecordPosition;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * DefaultBif6RecordDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link Bif6RecordDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>id (uint32)</li>
 *   <li>m/z lower, middle, upper (float32 each), never reordered</li>
 *   <li>ordering check on the m/z boundaries</li>
 *   <li>{@code width * height} samples (uint32 each), row-major, read through
 *       a fixed {@link #CHUNK_SIZE}-byte buffer</li>
 * </ol>
 *
 * <p>Width, height and sample kind come from the header: BIF6 declares the
 * grid once for the whole file.</p>
 *
 * <p>The sample array starts at one chunk's worth and doubles as samples
 * arrive, capped at the declared grid size. A payload that ends early costs
 * memory in proportion to the bytes present.</p>
 *
 * <p>Stateless and safe to share.</p>
 */
public final class DefaultBif6RecordDecoder implements Bif6RecordDecoder
{
    /** Offset of the first m/z float, relative to the record start. */
    private static final int MZ_OFFSET = Integer.BYTES;

    /** Bytes pulled from the payload stream per read. Multiple of every sample width. */
    static final int CHUNK_SIZE = 64 * 1024;

    @Override
    public IntervalImage decode(Bif6Header header, byte[] metadata, InputStream payload, RecordPosition position)
            throws IOException
    {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(position, "position");

        if (metadata.length != Bif6Layout.RECORD_METADATA_SIZE) {
            throw new IllegalArgumentException("metadata must be " + Bif6Layout.RECORD_METADATA_SIZE
                    + " bytes, got " + metadata.length);
        }

        final long id;
        final float lower;
        final float middle;
        final float upper;

        final ByteBuf meta = Unpooled.wrappedBuffer(metadata);
        try {
            id = meta.readUnsignedIntLE();
            lower = meta.readFloatLE();
            middle = meta.readFloatLE();
            upper = meta.readFloatLE();
        }
        finally {
            meta.release();
        }

        // NaN fails both comparisons and is rejected along with out-of-order bounds.
        if (!(lower <= middle && middle <= upper)) {
            throw new Bif6FormatException(Kind.INVALID_RANGE,
                    "m/z bounds out of order: lower=" + lower + ", middle=" + middle + ", upper=" + upper
                            + " (interval id " + id + ")",
                    position.byteOffset() + MZ_OFFSET, position.recordIndex());
        }

        final int[] samples = readSamples(header, payload, position);
        return IntervalImage.wrap(id, lower, middle, upper, header.width(), header.height(), samples);
    }

    private static int[] readSamples(Bif6Header header, InputStream payload, RecordPosition position)
            throws IOException
    {
        final int total = (int) header.pixelCount();
        final int sampleBytes = header.sampleKind().byteWidth();
        final long payloadSize = Bif6Layout.payloadSize(header);

        int[] samples = new int[Math.min(total, CHUNK_SIZE / sampleBytes)];
        int decoded = 0;
        long remaining = payloadSize;

        final ByteBuf chunk = Unpooled.buffer(CHUNK_SIZE, CHUNK_SIZE);
        try {
            while (remaining > 0) {
                final int requested = (int) Math.min(chunk.writableBytes(), remaining);
                final int read = chunk.writeBytes(payload, requested);
                if (read < 0) {
                    final long available = payloadSize - remaining;
                    throw new Bif6FormatException(Kind.TRUNCATED,
                            "pixel payload requires " + payloadSize + " bytes, only " + available + " available",
                            position.byteOffset() + Bif6Layout.RECORD_METADATA_SIZE + available,
                            position.recordIndex());
                }
                remaining -= read;

                while (chunk.readableBytes() >= sampleBytes) {
                    if (decoded == samples.length) {
                        samples = Arrays.copyOf(samples, (int) Math.min(total, 2L * samples.length));
                    }
                    samples[decoded++] = chunk.readIntLE();
                }
                chunk.discardReadBytes();
            }
        }
        finally {
            chunk.release();
        }
        return samples;
    }
}
