package com.questrail.bif6.config;

import com.questrail.bif6.codec.impl.Bif6Layout;
import com.questrail.bif6.internal.time.SystemWallClock;
import com.questrail.bif6.internal.time.WallClock;
import com.questrail.bif6.observability.Bif6ObservabilitySink;
import com.questrail.bif6.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Configuration for a BIF6 decode session.
 *
 * <p>{@code maxDimension} bounds the width and height accepted from a header.
 * It keeps a corrupt header from triggering an unbounded allocation.</p>
 */
public record Bif6DecoderConfig(
    int maxDimension,
    Bif6ObservabilitySink observabilitySink,
    WallClock wallClock
) {
    /** Default upper bound for width and height. */
    public static final int DEFAULT_MAX_DIMENSION = 8192;

    public Bif6DecoderConfig {
        if (maxDimension < 1 || maxDimension > Bif6Layout.MAX_ENCODABLE_DIMENSION) {
            throw new IllegalArgumentException(
                "maxDimension must be 1-" + Bif6Layout.MAX_ENCODABLE_DIMENSION + ": " + maxDimension);
        }
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Returns a configuration with default limits and no observability.
     */
    public static Bif6DecoderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxDimension = DEFAULT_MAX_DIMENSION;
        private Bif6ObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withMaxDimension(int maxDimension) {
            this.maxDimension = maxDimension;
            return this;
        }

        public Builder withObservabilitySink(Bif6ObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Bif6DecoderConfig build() {
            return new Bif6DecoderConfig(maxDimension, observabilitySink, wallClock);
        }
    }
}
