package com.questrail.spatial.protocol.ewkb.config;

import com.questrail.spatial.protocol.ewkb.codec.RawBytesCodec;
import com.questrail.spatial.protocol.ewkb.codec.impl.ByteaRawBytesCodec;
import com.questrail.spatial.protocol.ewkb.internal.time.SystemWallClock;
import com.questrail.spatial.protocol.ewkb.internal.time.WallClock;
import com.questrail.spatial.protocol.ewkb.observability.EwkbObservabilitySink;
import com.questrail.spatial.protocol.ewkb.observability.NullObservabilitySink;
import com.questrail.spatial.protocol.ewkb.transport.netty.ByteBufEwkbReadBuffer;

import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the EWKB geometry type handler.
 *
 * @param rawBytesCodec codec for undecoded access; empty disables raw reads and writes
 * @param bufferSize    capacity of the bounded buffers used for stream transfers
 */
public record EwkbCodecConfig(
    EwkbObservabilitySink observabilitySink,
    WallClock wallClock,
    Optional<RawBytesCodec> rawBytesCodec,
    int bufferSize
) {
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    public EwkbCodecConfig {
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(rawBytesCodec, "rawBytesCodec");
        if (bufferSize < ByteBufEwkbReadBuffer.MIN_BUFFER_SIZE) {
            throw new IllegalArgumentException(
                "bufferSize must be at least " + ByteBufEwkbReadBuffer.MIN_BUFFER_SIZE);
        }
    }

    public static EwkbCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EwkbObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private RawBytesCodec rawBytesCodec = new ByteaRawBytesCodec();
        private int bufferSize = DEFAULT_BUFFER_SIZE;

        public Builder withObservabilitySink(EwkbObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withRawBytesCodec(RawBytesCodec rawBytesCodec) {
            this.rawBytesCodec = Objects.requireNonNull(rawBytesCodec, "rawBytesCodec");
            return this;
        }

        public Builder withoutRawBytesCodec() {
            this.rawBytesCodec = null;
            return this;
        }

        public Builder withBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public EwkbCodecConfig build() {
            return new EwkbCodecConfig(observabilitySink, wallClock, Optional.ofNullable(rawBytesCodec), bufferSize);
        }
    }
}
