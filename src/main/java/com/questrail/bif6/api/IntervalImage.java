package com.questrail.bif6.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * IntervalImage
 * -----------------------------------------------------------------------------
 * Immutable, decoded representation of one BIF6 interval: an m/z band and the
 * intensity map recorded for it over the sample surface.
 *
 * <h2>Grid layout</h2>
 * The grid is row-major: {@code height} rows of {@code width} samples. The
 * sample at column {@code x} and row {@code y} lives at index
 * {@code y * width + x}.
 *
 * <h2>Why {@code int[]} is used for samples</h2>
 * BIF6 samples are unsigned 32-bit counts. They are held as their raw 32-bit
 * words to keep large images compact; accessors widen them to {@code long}
 * so callers never see a negative intensity.
 *
 * Immutability is enforced via defensive copying, except for
 * {@link #wrap}, which adopts an array the caller hands over.
 */
public final class IntervalImage
{
    private final long id;
    private final float mzLower;
    private final float mzMiddle;
    private final float mzUpper;
    private final int width;
    private final int height;

    /**
     * Raw sample words, row-major. Never exposed without copying.
     */
    private final int[] samples;

    public IntervalImage(long id,
                         float mzLower,
                         float mzMiddle,
                         float mzUpper,
                         int width,
                         int height,
                         int[] samples) {

        this(id, mzLower, mzMiddle, mzUpper, width, height,
                Objects.requireNonNull(samples, "samples").clone(), true);
    }

    /**
     * Creates an image that takes ownership of {@code samples} without copying.
     *
     * <p>Used by decoders that allocate a fresh sample array per record. The
     * caller must not retain, modify, or share the array afterwards.</p>
     */
    public static IntervalImage wrap(long id,
                                     float mzLower,
                                     float mzMiddle,
                                     float mzUpper,
                                     int width,
                                     int height,
                                     int[] samples) {

        return new IntervalImage(id, mzLower, mzMiddle, mzUpper, width, height, samples, true);
    }

    private IntervalImage(long id,
                          float mzLower,
                          float mzMiddle,
                          float mzUpper,
                          int width,
                          int height,
                          int[] samples,
                          boolean adopt) {
        // samples are stored as given; the public constructor copies before delegating

        if (id < 0 || id > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("id must be an unsigned 32-bit value: " + id);
        }
        if (!(mzLower <= mzMiddle && mzMiddle <= mzUpper)) {
            throw new IllegalArgumentException(
                    "m/z bounds must satisfy lower <= middle <= upper: "
                            + mzLower + ", " + mzMiddle + ", " + mzUpper);
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width and height must be positive");
        }
        Objects.requireNonNull(samples, "samples");
        if (samples.length != (long) width * height) {
            throw new IllegalArgumentException(
                    "expected " + ((long) width * height) + " samples, got " + samples.length);
        }

        this.id = id;
        this.mzLower = mzLower;
        this.mzMiddle = mzMiddle;
        this.mzUpper = mzUpper;
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    /**
     * Returns the identifier assigned to this interval by the file.
     */
    public long id() {
        return id;
    }

    public float mzLower() {
        return mzLower;
    }

    public float mzMiddle() {
        return mzMiddle;
    }

    public float mzUpper() {
        return mzUpper;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public SampleKind sampleKind() {
        return SampleKind.UNSIGNED_INT32;
    }

    /**
     * Returns the number of samples in the grid ({@code width * height}).
     */
    public int sampleCount() {
        return samples.length;
    }

    /**
     * Returns the intensity at column {@code x}, row {@code y}.
     *
     * @throws IndexOutOfBoundsException if the coordinate lies outside the grid
     */
    public long intensity(int x, int y) {
        Objects.checkIndex(x, width);
        Objects.checkIndex(y, height);
        return Integer.toUnsignedLong(samples[y * width + x]);
    }

    /**
     * Returns a row-major copy of all intensities, widened to {@code long}.
     */
    public long[] samples() {
        long[] out = new long[samples.length];
        for (int i = 0; i < samples.length; i++) {
            out[i] = Integer.toUnsignedLong(samples[i]);
        }
        return out;
    }

    /**
     * Returns a row-major copy of the raw 32-bit sample words.
     *
     * Values above {@link Integer#MAX_VALUE} appear negative; use
     * {@link Integer#toUnsignedLong(int)} to interpret them.
     */
    public int[] rawSamples() {
        return samples.clone();
    }

    /**
     * Indicates whether this interval is the total-ion-count image.
     *
     * <p>By instrument convention the TIC image carries id {@code 0} and is the
     * first interval in a BIF6 file.</p>
     */
    public boolean isTicImage() {
        return id == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IntervalImage)) {
            return false;
        }
        IntervalImage other = (IntervalImage) o;
        return id == other.id
                && Float.compare(mzLower, other.mzLower) == 0
                && Float.compare(mzMiddle, other.mzMiddle) == 0
                && Float.compare(mzUpper, other.mzUpper) == 0
                && width == other.width
                && height == other.height
                && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, mzLower, mzMiddle, mzUpper, width, height);
        return 31 * result + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "IntervalImage[" +
                "id=" + id +
                ", mz=[" + mzLower + ", " + mzMiddle + ", " + mzUpper + ']' +
                ", size=" + width + 'x' + height +
                ']';
    }
}
