package com.questrail.bif6;

import com.questrail.bif6.api.Bif6Header;
import com.questrail.bif6.api.IntervalImage;
import com.questrail.bif6.internal.decode.Bif6StreamDecoder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * IntervalImageIterator
 * =============================================================================
 * Lazy, forward-only view of the intervals in one BIF6 input.
 *
 * <p>Nothing is read until {@link #hasNext()} or {@link #next()} is called, and
 * each call decodes at most one record. Iterating a second time requires opening
 * the input again.</p>
 *
 * <h2>Error contract</h2>
 * <ul>
 *   <li>The first failure is thrown from the call that triggered decoding:
 *       {@link com.questrail.bif6.codec.Bif6FormatException} for structural
 *       defects, {@link UncheckedIOException} for read failures.</li>
 *   <li>The input is closed before the failure propagates, {@link Error}s
 *       included.</li>
 *   <li>After a failure {@link #hasNext()} returns {@code false}; no further
 *       intervals are produced even if bytes remain.</li>
 *   <li>Intervals returned before the failure remain valid.</li>
 * </ul>
 *
 * <h2>Resource contract</h2>
 * The input is released when iteration reaches end-of-stream, when a failure
 * occurs, and when {@link #close()} is called. Use try-with-resources when the
 * iteration may be abandoned early:
 *
 * <pre>
 * try (IntervalImageIterator it = Bif6Files.open(path)) {
 *     while (it.hasNext()) {
 *         IntervalImage image = it.next();
 *         ...
 *     }
 * }
 * </pre>
 *
 * <p>Not thread-safe.</p>
 */
public final class IntervalImageIterator implements Iterator<IntervalImage>, AutoCloseable
{
    private final Bif6StreamDecoder decoder;
    private final Bif6Header header;

    private IntervalImage pending;
    private boolean done;

    IntervalImageIterator(Bif6StreamDecoder decoder)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.header = decoder.header()
                .orElseThrow(() -> new IllegalStateException("Header must be read before iterating"));
    }

    /**
     * Returns the header of the input being iterated.
     */
    public Bif6Header header()
    {
        return header;
    }

    @Override
    public boolean hasNext()
    {
        if (pending != null) {
            return true;
        }
        if (done) {
            return false;
        }

        final Optional<IntervalImage> next;
        try {
            next = decoder.nextRecord();
        }
        catch (IOException e) {
            throw terminate(new UncheckedIOException(e));
        }
        catch (RuntimeException e) {
            throw terminate(e);
        }
        catch (Error e) {
            throw terminate(e);
        }

        if (next.isEmpty()) {
            close();
            return false;
        }
        pending = next.get();
        return true;
    }

    @Override
    public IntervalImage next()
    {
        if (!hasNext()) {
            throw new NoSuchElementException("No more intervals in " + decoder.source());
        }
        final IntervalImage image = pending;
        pending = null;
        return image;
    }

    /**
     * Returns the number of records decoded so far.
     */
    public long recordsDecoded()
    {
        return decoder.recordsDecoded();
    }

    /**
     * Stops iteration and releases the input. Idempotent.
     *
     * @throws UncheckedIOException if closing the input fails
     */
    @Override
    public void close()
    {
        done = true;
        pending = null;
        try {
            decoder.close();
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to close " + decoder.source(), e);
        }
    }

    private <T extends Throwable> T terminate(T failure)
    {
        try {
            close();
        }
        catch (UncheckedIOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
        return failure;
    }
}
