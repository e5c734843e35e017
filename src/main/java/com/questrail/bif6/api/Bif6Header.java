package com.questrail.bif6.api;

import java.util.Objects;

/**
 * Values decoded from the fixed BIF6 header block.
 *
 * <p>{@code declaredIntervalCount} is what the instrument wrote into the header.
 * It is informational only: the record sequence is terminated by end-of-input,
 * and a file may contain a different number of records.</p>
 *
 * @param declaredIntervalCount interval count declared by the header
 * @param width                 number of samples per image row (x pixels)
 * @param height                number of image rows (y pixels)
 * @param sampleKind            numeric kind of every sample in the file
 */
public record Bif6Header(
    int declaredIntervalCount,
    int width,
    int height,
    SampleKind sampleKind
) {
    public Bif6Header {
        if (declaredIntervalCount < 0) {
            throw new IllegalArgumentException("declaredIntervalCount must be >= 0");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("width and height must be positive");
        }
        Objects.requireNonNull(sampleKind, "sampleKind");
    }

    /**
     * Returns the number of samples in every interval image of the file.
     */
    public long pixelCount() {
        return (long) width * height;
    }
}
