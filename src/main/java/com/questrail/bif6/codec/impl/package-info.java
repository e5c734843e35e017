/**
 * BIF6 Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>Concrete BIF6 codec classes that turn raw header and record bytes into
 * API values.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   header bytes
 *        → Bif6HeaderCodec.decode
 *        → Bif6Header
 *
 *   record bytes (metadata + payload)
 *        → DefaultBif6RecordDecoder.decode
 *        → IntervalImage
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * Netty {@code ByteBuf} is used here to read little-endian fields. Netty types
 * MUST NOT escape this package; buffers are released before returning.
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>layout-faithful</li>
 *   <li>I/O-agnostic</li>
 *   <li>free of per-file state</li>
 * </ul>
 */
package com.questrail.bif6.codec.impl;
