package com.questrail.spatial.protocol.ewkb.transport.netty;

import com.questrail.spatial.protocol.ewkb.EwkbGeometryTypeHandler;
import com.questrail.spatial.protocol.ewkb.model.Geometry;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageCodec;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

import java.util.List;
import java.util.Objects;

/**
 * EwkbGeometryFieldCodec
 * =============================================================================
 * Netty pipeline codec carrying geometry values as length-prefixed fields.
 *
 * <pre>
 *   Field := Length(int32, big-endian) EWKB(Length bytes)
 * </pre>
 *
 * <p>This is the framing a database wire protocol applies to a column value:
 * the length is announced before the first EWKB byte, so outbound it comes
 * from {@link EwkbGeometryTypeHandler#validateAndGetLength(Geometry)}.
 * Inbound, a field is decoded only once all of its bytes have arrived.</p>
 *
 * <p>Netty types stay inside this package; everything above sees
 * {@link Geometry} values only.</p>
 */
public final class EwkbGeometryFieldCodec extends ByteToMessageCodec<Geometry>
{
    /** Size of the length prefix. */
    static final int LENGTH_FIELD_SIZE = 4;

    /** Default cap on a single field, matching PostgreSQL's 1 GiB field limit. */
    public static final int DEFAULT_MAX_FIELD_LENGTH = 1 << 30;

    private final EwkbGeometryTypeHandler handler;
    private final int maxFieldLength;

    public EwkbGeometryFieldCodec(EwkbGeometryTypeHandler handler)
    {
        this(handler, DEFAULT_MAX_FIELD_LENGTH);
    }

    public EwkbGeometryFieldCodec(EwkbGeometryTypeHandler handler, int maxFieldLength)
    {
        this.handler = Objects.requireNonNull(handler, "handler");
        if (maxFieldLength <= 0) {
            throw new IllegalArgumentException("maxFieldLength must be positive (was " + maxFieldLength + ")");
        }
        this.maxFieldLength = maxFieldLength;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Geometry geometry, ByteBuf out) throws Exception
    {
        final int length = handler.validateAndGetLength(geometry);
        if (length > maxFieldLength) {
            throw new TooLongFrameException(
                    "Geometry field of " + length + " bytes exceeds " + maxFieldLength);
        }

        out.writeInt(length);
        handler.write(geometry, ByteBufEwkbWriteBuffer.wrap(out));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception
    {
        if (in.readableBytes() < LENGTH_FIELD_SIZE) {
            return;
        }

        final int length = in.getInt(in.readerIndex());
        if (length < 0) {
            throw new CorruptedFrameException("Negative geometry field length: " + length);
        }
        if (length > maxFieldLength) {
            throw new TooLongFrameException(
                    "Geometry field of " + length + " bytes exceeds " + maxFieldLength);
        }
        if (in.readableBytes() < LENGTH_FIELD_SIZE + length) {
            return;
        }

        in.skipBytes(LENGTH_FIELD_SIZE);
        final ByteBuf field = in.readSlice(length);
        final Geometry geometry = handler.read(ByteBufEwkbReadBuffer.wrap(field), length);

        if (field.isReadable()) {
            throw new CorruptedFrameException(
                    field.readableBytes() + " unread bytes after geometry field of " + length);
        }
        out.add(geometry);
    }
}
