/**
 * BIF6 Codec: Wire-Level Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for BIF6 interval
 * files. The codec layer implements the byte layout of the format:</p>
 *
 * <ul>
 *   <li>Header signature and header fields</li>
 *   <li>Record metadata (id and m/z boundaries)</li>
 *   <li>Pixel payload extraction into an {@code IntervalImage}</li>
 * </ul>
 *
 * <h2>Wire Layout</h2>
 * <p>All multi-byte fields are little-endian.</p>
 *
 * <pre>
 *   header  (12 bytes)
 *     0  6  magic            00 00 'B' 'I' 'F' '6'
 *     6  2  uint16           declared interval count
 *     8  2  uint16           width  (x pixels)
 *    10  2  uint16           height (y pixels)
 *
 *   record  (16 + 4 * width * height bytes), repeated until end-of-input
 *     0  4  uint32           id
 *     4  4  float32          m/z lower
 *     8  4  float32          m/z middle
 *    12  4  float32          m/z upper
 *    16  ..  uint32[h][w]    samples, row-major
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   InputStream
 *        → Bif6StreamDecoder     (cursor, truncation, end-of-stream)
 *            → Bif6RecordDecoder (wire rules applied here)
 *                → IntervalImage
 *                    → IntervalImageIterator
 * </pre>
 *
 * <p>Any failure at this layer is a {@link com.questrail.bif6.codec.Bif6FormatException}
 * and ends the stream.</p>
 */
package com.questrail.bif6.codec;
