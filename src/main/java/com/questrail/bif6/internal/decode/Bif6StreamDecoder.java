package com.questrail.bif6.internal.decode;

import com.questrail.bif6.api.Bif6Header;
import com.questrail.bif6.api.IntervalImage;
import com.questrail.bif6.codec.Bif6FormatException;
import com.questrail.bif6.codec.Bif6FormatException.Kind;
import com.questrail.bif6.codec.Bif6RecordDecoder;
import com.questrail.bif6.codec.RecordPosition;
import com.questrail.bif6.codec.impl.Bif6HeaderCodec;
import com.questrail.bif6.codec.impl.Bif6Layout;
import com.questrail.bif6.codec.impl.DefaultBif6RecordDecoder;
import com.questrail.bif6.config.Bif6DecoderConfig;
import com.questrail.bif6.observability.Bif6ErrorEvent;
import com.questrail.bif6.observability.Bif6IntervalDecodedEvent;
import com.questrail.bif6.observability.Bif6ObservabilitySink;
import com.questrail.bif6.observability.Bif6StreamCompletedEvent;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Bif6StreamDecoder
 * ============================================================================
 * Owns the byte cursor over one BIF6 input and drives the record loop.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #open(Path, Bif6DecoderConfig)} or
 *       {@link #open(InputStream, String, Bif6DecoderConfig)} acquires the input</li>
 *   <li>{@link #readHeader()} is called exactly once</li>
 *   <li>{@link #nextRecord()} is called until it returns {@link Optional#empty()}
 *       or throws</li>
 *   <li>{@link #close()} releases the input</li>
 * </ol>
 *
 * <h2>Termination</h2>
 * <ul>
 *   <li>Zero bytes remaining at a record boundary is end-of-stream.</li>
 *   <li>A record that starts but cannot be completed is
 *       {@link Kind#TRUNCATED}; partial records are never returned.</li>
 *   <li>After any failure, {@link Error}s included, the decoder is unusable;
 *       the format has no point at which decoding could resume.</li>
 * </ul>
 *
 * <h2>Memory</h2>
 * The cursor only moves forward. Record payloads are pulled in bounded chunks,
 * so memory tracks the samples present rather than the grid the header
 * declares.
 *
 * <h2>Thread Safety</h2>
 * Not thread-safe. One instance per input per thread.
 */
public final class Bif6StreamDecoder implements Closeable
{
    private enum State { OPEN, READY, FINISHED, FAILED, CLOSED }

    private final InputStream in;
    private final String source;
    private final Bif6DecoderConfig config;
    private final Bif6RecordDecoder recordDecoder;
    private final Bif6ObservabilitySink sink;

    private State state = State.OPEN;
    private Bif6Header header;
    private long offset;
    private long recordsDecoded;

    Bif6StreamDecoder(InputStream in, String source, Bif6DecoderConfig config, Bif6RecordDecoder recordDecoder)
    {
        this.in = Objects.requireNonNull(in, "in");
        this.source = Objects.requireNonNull(source, "source");
        this.config = Objects.requireNonNull(config, "config");
        this.recordDecoder = Objects.requireNonNull(recordDecoder, "recordDecoder");
        this.sink = config.observabilitySink();
    }

    /**
     * Opens a BIF6 file for decoding.
     *
     * @throws IOException if the file cannot be opened
     */
    public static Bif6StreamDecoder open(Path path, Bif6DecoderConfig config) throws IOException
    {
        Objects.requireNonNull(path, "path");
        InputStream in = new BufferedInputStream(Files.newInputStream(path));
        return new Bif6StreamDecoder(in, path.toString(), config, new DefaultBif6RecordDecoder());
    }

    /**
     * Wraps an already-open stream. The decoder takes ownership and closes it.
     *
     * @param source human-readable name used in diagnostics
     */
    public static Bif6StreamDecoder open(InputStream in, String source, Bif6DecoderConfig config)
    {
        return new Bif6StreamDecoder(in, source, config, new DefaultBif6RecordDecoder());
    }

    /**
     * Reads and validates the header block. Must be called exactly once,
     * before the first {@link #nextRecord()}.
     *
     * @throws Bif6FormatException if the header is truncated, carries the wrong
     *         signature, or declares unusable dimensions
     * @throws IOException if the read fails
     * @throws IllegalStateException if the header was already read or the decoder is closed
     */
    public Bif6Header readHeader() throws IOException
    {
        if (state != State.OPEN) {
            throw new IllegalStateException("Header already read or decoder closed (state " + state + ")");
        }

        try {
            final byte[] block = in.readNBytes(Bif6Layout.HEADER_SIZE);
            offset += block.length;
            header = Bif6HeaderCodec.decode(block, config.maxDimension());
            state = State.READY;
            return header;
        }
        catch (Throwable t) {
            fail(t);
            throw t;
        }
    }

    /**
     * Decodes the next record.
     *
     * @return the next interval image, or {@link Optional#empty()} at end-of-stream
     * @throws Bif6FormatException if the record is truncated or structurally invalid
     * @throws IOException if a read fails
     * @throws IllegalStateException if the header has not been read, a previous
     *         call failed, or the decoder is closed
     */
    public Optional<IntervalImage> nextRecord() throws IOException
    {
        switch (state) {
            case READY:
                break;
            case FINISHED:
                return Optional.empty();
            default:
                throw new IllegalStateException("Decoder not readable (state " + state + ")");
        }

        final RecordPosition position = new RecordPosition(recordsDecoded, offset);
        try {
            final byte[] metadata = new byte[Bif6Layout.RECORD_METADATA_SIZE];
            final int metaRead = in.readNBytes(metadata, 0, metadata.length);
            if (metaRead == 0) {
                finish();
                return Optional.empty();
            }
            offset += metaRead;
            if (metaRead < metadata.length) {
                throw truncated("record metadata", metadata.length, metaRead);
            }

            final IntervalImage image;
            try {
                image = recordDecoder.decode(header, metadata, in, position);
            }
            catch (Bif6FormatException e) {
                if (e.kind() == Kind.TRUNCATED) {
                    offset = e.byteOffset();
                }
                throw e;
            }
            offset = position.byteOffset() + Bif6Layout.recordSize(header);
            recordsDecoded++;

            sink.onIntervalDecoded(new Bif6IntervalDecodedEvent(
                    config.wallClock().now(),
                    source,
                    position.recordIndex(),
                    image.id(),
                    position.byteOffset()));

            return Optional.of(image);
        }
        catch (Throwable t) {
            fail(t);
            throw t;
        }
    }

    /**
     * Returns the decoded header, if {@link #readHeader()} has succeeded.
     */
    public Optional<Bif6Header> header()
    {
        return Optional.ofNullable(header);
    }

    /**
     * Returns the number of bytes consumed from the input so far.
     */
    public long bytesConsumed()
    {
        return offset;
    }

    /**
     * Returns the number of records successfully decoded so far.
     */
    public long recordsDecoded()
    {
        return recordsDecoded;
    }

    /**
     * Returns the diagnostic name of the input.
     */
    public String source()
    {
        return source;
    }

    /**
     * Releases the input. Idempotent.
     */
    @Override
    public void close() throws IOException
    {
        if (state == State.CLOSED) {
            return;
        }
        state = State.CLOSED;
        in.close();
    }

    private Bif6FormatException truncated(String what, int required, int available)
    {
        return new Bif6FormatException(Kind.TRUNCATED,
                what + " requires " + required + " bytes, only " + available + " available",
                offset, recordsDecoded);
    }

    private void finish()
    {
        state = State.FINISHED;
        sink.onStreamCompleted(new Bif6StreamCompletedEvent(
                config.wallClock().now(),
                source,
                recordsDecoded,
                header.declaredIntervalCount(),
                offset));
    }

    private void fail(Throwable t)
    {
        state = State.FAILED;
        sink.onError(new Bif6ErrorEvent(config.wallClock().now(), source, t.getMessage(), t));
    }
}
