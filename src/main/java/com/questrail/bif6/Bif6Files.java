package com.questrail.bif6;

import com.questrail.bif6.api.IntervalImage;
import com.questrail.bif6.config.Bif6DecoderConfig;
import com.questrail.bif6.internal.decode.Bif6StreamDecoder;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Bif6Files
 * =============================================================================
 * Entry points for reading BIF6 interval files.
 *
 * <p>Every method reads and validates the header before returning, so a file
 * with a bad signature, a short header, or unusable dimensions is rejected
 * here, before any interval is requested. On such a failure the input is
 * already closed when the exception reaches the caller.</p>
 */
public final class Bif6Files
{
    private Bif6Files() {}

    /**
     * Opens a BIF6 file with {@link Bif6DecoderConfig#defaults()}.
     *
     * @throws IOException if the file cannot be opened or read
     * @throws com.questrail.bif6.codec.Bif6FormatException if the header is invalid
     */
    public static IntervalImageIterator open(Path path) throws IOException
    {
        return open(path, Bif6DecoderConfig.defaults());
    }

    /**
     * Opens a BIF6 file.
     *
     * @throws IOException if the file cannot be opened or read
     * @throws com.questrail.bif6.codec.Bif6FormatException if the header is invalid
     */
    public static IntervalImageIterator open(Path path, Bif6DecoderConfig config) throws IOException
    {
        return start(Bif6StreamDecoder.open(path, config));
    }

    /**
     * Decodes BIF6 data from a stream. The returned iterator owns the stream
     * and closes it.
     *
     * @param source human-readable name used in diagnostics
     * @throws IOException if the header cannot be read
     * @throws com.questrail.bif6.codec.Bif6FormatException if the header is invalid
     */
    public static IntervalImageIterator open(InputStream in, String source, Bif6DecoderConfig config)
            throws IOException
    {
        return start(Bif6StreamDecoder.open(in, source, config));
    }

    /**
     * Opens a BIF6 file as a sequential {@link Stream}. Close the stream to
     * release the file when it is not consumed to the end.
     *
     * <pre>
     * try (Stream&lt;IntervalImage&gt; images = Bif6Files.stream(path)) {
     *     images.filter(i -&gt; !i.isTicImage()).forEach(...);
     * }
     * </pre>
     *
     * @throws IOException if the file cannot be opened or read
     * @throws com.questrail.bif6.codec.Bif6FormatException if the header is invalid
     */
    public static Stream<IntervalImage> stream(Path path) throws IOException
    {
        return stream(path, Bif6DecoderConfig.defaults());
    }

    /**
     * Opens a BIF6 file as a sequential {@link Stream} with the given configuration.
     *
     * @throws IOException if the file cannot be opened or read
     * @throws com.questrail.bif6.codec.Bif6FormatException if the header is invalid
     */
    public static Stream<IntervalImage> stream(Path path, Bif6DecoderConfig config) throws IOException
    {
        final IntervalImageIterator iterator = open(path, config);
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator,
                                Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
                        false)
                .onClose(iterator::close);
    }

    private static IntervalImageIterator start(Bif6StreamDecoder decoder) throws IOException
    {
        try {
            decoder.readHeader();
        }
        catch (IOException | RuntimeException e) {
            try {
                decoder.close();
            }
            catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        return new IntervalImageIterator(decoder);
    }
}
