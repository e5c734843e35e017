package com.questrail.bif6.codec;

import com.questrail.bif6.api.Bif6Header;
import com.questrail.bif6.api.IntervalImage;

import java.io.IOException;
import java.io.InputStream;

/**
 * Bif6RecordDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for a single BIF6 interval record.
 *
 * <p>This interface is the boundary between the raw bytes of one record and a
 * structured {@link IntervalImage}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Extracting the id and the three m/z boundaries, in wire order</li>
 *   <li>Rejecting boundaries that violate {@code lower <= middle <= upper}
 *       before any sample is read</li>
 *   <li>Pulling exactly {@code width * height} samples, row-major, from the
 *       payload stream in bounded chunks</li>
 *   <li>Reporting a payload that ends early as {@code TRUNCATED}</li>
 * </ul>
 *
 * <p>Memory grows with the samples actually read, not with the grid the header
 * declares.</p>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Reading record metadata or detecting end-of-stream</li>
 *   <li>Knowing anything about surrounding records</li>
 *   <li>Physical plausibility of intensity values</li>
 * </ul>
 */
public interface Bif6RecordDecoder
{
    /**
     * Decode one record.
     *
     * @param header   decoded header of the file; supplies grid shape and sample kind
     * @param metadata exactly {@code RECORD_METADATA_SIZE} bytes of record metadata
     * @param payload  stream positioned at the first sample; exactly
     *                 {@code width * height * sampleKind.byteWidth()} bytes are consumed
     * @param position where the record starts, for error reporting
     * @return the decoded interval image
     * @throws Bif6FormatException with kind {@code INVALID_RANGE} if the m/z
     *         boundaries are out of order, or {@code TRUNCATED} if the payload
     *         ends early
     * @throws IOException if reading the payload fails
     * @throws IllegalArgumentException if the metadata does not have the
     *         fixed metadata size
     */
    IntervalImage decode(Bif6Header header, byte[] metadata, InputStream payload, RecordPosition position)
            throws IOException;
}
